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

import net.hydromatic.kernel.expr.PendingOp.Subst;

/** Visitor over {@link Term} objects.
 *
 * <p>The default methods visit every sub-term, including the terms inside
 * the pending substitutions of a metavariable, and return null.
 *
 * @param <R> return type from {@code visit} methods
 *
 * @see Term#accept(TermVisitor)
 */
public class TermVisitor<R> {
  /** Visits a {@link Var}. */
  public R visit(Var var) {
    return null;
  }

  /** Visits a {@link Const}. */
  public R visit(Const constant) {
    return null;
  }

  /** Visits an {@link Apply}. */
  public R visit(Apply apply) {
    R r = apply.fn.accept(this);
    for (Term arg : apply.args) {
      r = arg.accept(this);
    }
    return r;
  }

  /** Visits a {@link Binder}. */
  public R visit(Binder binder) {
    binder.domain.accept(this);
    return binder.body.accept(this);
  }

  /** Visits a {@link MetaVar}. */
  public R visit(MetaVar metaVar) {
    R r = null;
    for (PendingOp op : metaVar.chain) {
      if (op instanceof Subst) {
        r = ((Subst) op).term.accept(this);
      }
    }
    return r;
  }
}

// End TermVisitor.java
