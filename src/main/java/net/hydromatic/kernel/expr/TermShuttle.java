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

import com.google.common.collect.ImmutableList;
import net.hydromatic.kernel.expr.PendingOp.Subst;

/**
 * Visitor over {@link Term} objects that returns terms.
 *
 * <p>Each default method rewrites the sub-terms of a term and returns the
 * original term if none of them changed.
 */
public class TermShuttle extends TermVisitor<Term> {
  @Override
  public Term visit(Var var) {
    return var;
  }

  @Override
  public Term visit(Const constant) {
    return constant;
  }

  @Override
  public Term visit(Apply apply) {
    final Term fn = apply.fn.accept(this);
    final ImmutableList.Builder<Term> args = ImmutableList.builder();
    for (Term arg : apply.args) {
      args.add(arg.accept(this));
    }
    return apply.copy(fn, args.build());
  }

  @Override
  public Term visit(Binder binder) {
    return binder.copy(binder.domain.accept(this), binder.body.accept(this));
  }

  /** Visits a {@link MetaVar}, rewriting the terms of its pending
   * substitutions. */
  @Override
  public Term visit(MetaVar metaVar) {
    final ImmutableList.Builder<PendingOp> chain = ImmutableList.builder();
    for (PendingOp op : metaVar.chain) {
      if (op instanceof Subst) {
        final Subst subst = (Subst) op;
        final Term term = subst.term.accept(this);
        chain.add(term == subst.term ? subst : PendingOp.subst(op.start, term));
      } else {
        chain.add(op);
      }
    }
    return metaVar.copy(chain.build());
  }
}

// End TermShuttle.java
