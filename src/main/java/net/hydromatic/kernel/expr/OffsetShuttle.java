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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Shuttle that knows how many binders it has entered.
 *
 * <p>A variable {@code #i} seen by a shuttle whose {@link #offset} is
 * {@code k} is bound inside the term being rewritten if {@code i < k}, and is
 * free variable {@code i - k} of that term otherwise.
 */
public abstract class OffsetShuttle extends TermShuttle {
  /** Number of binders between the root of the rewrite and this point. */
  protected final int offset;

  private @Nullable OffsetShuttle inner;

  /** Creates an OffsetShuttle. */
  protected OffsetShuttle(int offset) {
    checkArgument(offset >= 0);
    this.offset = offset;
  }

  /** Creates a shuttle the same as this but with a given offset. */
  protected abstract OffsetShuttle bind(int offset);

  /** Returns the shuttle for the body of a binder. */
  private OffsetShuttle inner() {
    if (inner == null) {
      inner = bind(offset + 1);
    }
    return inner;
  }

  @Override
  public Term visit(Binder binder) {
    return binder.copy(binder.domain.accept(this),
        binder.body.accept(inner()));
  }
}

// End OffsetShuttle.java
