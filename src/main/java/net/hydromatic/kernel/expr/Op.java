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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link Term}. */
public enum Op {
  /** Bound variable, identified by its de Bruijn index. */
  VAR,
  /** Named constant. */
  CONST,
  /** Application of a function to one or more arguments. */
  APPLY,
  LAMBDA("fun"),
  PI("pi"),
  /** Reference to a metavariable in a {@code MetavarEnv}. */
  METAVAR;

  /** Keyword used when describing a binder; null for other operators. */
  public final @Nullable String keyword;

  Op() {
    this(null);
  }

  Op(@Nullable String keyword) {
    this.keyword = keyword;
  }

  /** Returns whether this operator introduces a bound variable. */
  public boolean isBinder() {
    return keyword != null;
  }
}

// End Op.java
