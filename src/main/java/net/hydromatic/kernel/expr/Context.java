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
package net.hydromatic.kernel.expr;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Local context: the binders that are in scope at some point in a term,
 * innermost first.
 *
 * <p>Entry {@code i} describes the variable that de Bruijn index {@code i}
 * refers to. Contexts are immutable; {@link #extend} shares the existing
 * entries.
 *
 * <p>The metavariable core does not interpret a context; it records the
 * context in which a metavariable was created and passes it on to the
 * unification collector.
 */
public final class Context {
  /** The empty context. */
  public static final Context EMPTY = new Context(null, "", null, 0);

  private final @Nullable Context parent;
  private final String name;
  private final @Nullable Term domain;
  private final int size;

  private Context(@Nullable Context parent, String name,
      @Nullable Term domain, int size) {
    this.parent = parent;
    this.name = name;
    this.domain = domain;
    this.size = size;
  }

  /** Returns a context with one more binder, which becomes index 0. */
  public Context extend(String name, Term domain) {
    return new Context(this, requireNonNull(name), requireNonNull(domain),
        size + 1);
  }

  /** Returns the number of entries. */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /** Returns the name of the variable with a given de Bruijn index. */
  public String name(int index) {
    return entry(index).name;
  }

  /** Returns the domain (type) of the variable with a given de Bruijn
   * index. */
  public Term domain(int index) {
    return requireNonNull(entry(index).domain);
  }

  private Context entry(int index) {
    checkArgument(index >= 0 && index < size,
        "index %s out of range for context of size %s", index, size);
    Context c = this;
    for (int i = 0; i < index; i++) {
      c = requireNonNull(c.parent);
    }
    return c;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder("[");
    for (Context c = this; c.parent != null; c = c.parent) {
      if (c != this) {
        buf.append(", ");
      }
      buf.append(c.name).append(" : ").append(c.domain);
    }
    return buf.append(']').toString();
  }
}

// End Context.java
