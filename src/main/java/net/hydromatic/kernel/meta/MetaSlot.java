/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kernel.meta;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import net.hydromatic.kernel.expr.Context;
import net.hydromatic.kernel.expr.Term;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry in a {@link MetavarEnv}: the context in which a metavariable was
 * created, its type (once somebody has asked for it) and its value (once it
 * has been assigned).
 *
 * <p>Slots are immutable; the environment replaces a slot when it sets the
 * type or the value. Each of those is set at most once.
 */
public final class MetaSlot {
  public final Context context;
  public final @Nullable Term type;
  public final @Nullable Term value;

  private MetaSlot(Context context, @Nullable Term type,
      @Nullable Term value) {
    this.context = requireNonNull(context);
    this.type = type;
    this.value = value;
  }

  /** Creates a slot with neither type nor value. */
  static MetaSlot of(Context context) {
    return new MetaSlot(context, null, null);
  }

  /** Returns a copy of this slot with a type. */
  MetaSlot withType(Term type) {
    checkState(this.type == null, "type already set");
    return new MetaSlot(context, requireNonNull(type), value);
  }

  /** Returns a copy of this slot with a value. */
  MetaSlot withValue(Term value) {
    checkState(this.value == null, "value already set");
    return new MetaSlot(context, type, requireNonNull(value));
  }

  public boolean isAssigned() {
    return value != null;
  }

  @Override
  public String toString() {
    return "{context: " + context + ", type: " + type + ", value: " + value
        + "}";
  }
}

// End MetaSlot.java
