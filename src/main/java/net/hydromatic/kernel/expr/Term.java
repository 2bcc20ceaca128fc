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

import static java.util.Objects.requireNonNull;

/**
 * Term of the kernel calculus.
 *
 * <p>Terms are immutable, and sub-terms are shared freely between terms. Two
 * terms are equal if they are structurally equal; the hash code is computed
 * once, when the term is created.
 *
 * <p>Bound variables are de Bruijn indices ({@link Var}); a term may also
 * contain references to metavariables ({@link MetaVar}), placeholders whose
 * values are held in a {@code MetavarEnv}.
 */
public abstract class Term {
  public final Op op;
  private final int hash;

  Term(Op op, int hash) {
    this.op = requireNonNull(op);
    this.hash = hash;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  /**
   * Returns a description of this term, for debugging.
   *
   * <p>Variables print as {@code #i}, metavariables as {@code ?i} followed by
   * their pending operations, binders as {@code fun x : T, body}.
   */
  @Override
  public final String toString() {
    return describe(new StringBuilder()).toString();
  }

  /** Writes a description of this term to a string builder. */
  abstract StringBuilder describe(StringBuilder buf);

  /** Accepts a visitor. */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /**
   * Accepts a shuttle, calling the {@link TermShuttle#visit} method
   * appropriate to the type of this term, and returning the result.
   */
  public abstract Term accept(TermShuttle shuttle);

  /** Returns whether this term is a reference to a metavariable. */
  public final boolean isMetavar() {
    return op == Op.METAVAR;
  }

  /** Returns whether this term is a bound variable. */
  public final boolean isVar() {
    return op == Op.VAR;
  }
}

// End Term.java
