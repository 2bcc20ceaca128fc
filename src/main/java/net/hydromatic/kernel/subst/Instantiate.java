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
package net.hydromatic.kernel.subst;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.kernel.expr.TermBuilder.term;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.kernel.expr.Binder;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.OffsetShuttle;
import net.hydromatic.kernel.expr.PendingOp;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.expr.Var;

/**
 * Substitution and shifting of free variables in terms.
 *
 * <p>Each operation rewrites the explicit structure of a term. When it
 * reaches a metavariable it does not look for the metavariable's value;
 * instead it records the equivalent operation on the metavariable's chain,
 * using {@link PendingOps}. The cost of an operation is therefore
 * proportional to the size of the term, not to the size of the values that
 * its metavariables will eventually receive.
 */
public class Instantiate {
  private Instantiate() {}

  /** Replaces free variable 0 of {@code e} with {@code value}, and lowers
   * the other free variables by one. */
  public static Term instantiate(Term e, Term value) {
    return instantiate(e, 1, ImmutableList.of(value));
  }

  /**
   * Replaces free variables {@code 0 .. values.size() - 1} of {@code e}.
   *
   * @see #instantiate(Term, int, List)
   */
  public static Term instantiate(Term e, List<? extends Term> values) {
    return instantiate(e, values.size(), values);
  }

  /**
   * Replaces free variables {@code 0 .. n - 1} of {@code e} and lowers the
   * other free variables by {@code n}.
   *
   * <p>Free variable {@code i} is replaced by {@code values.get(i)}, so the
   * replacement for the innermost variable comes first. The replacements are
   * expressed in the context outside the eliminated variables; when one is
   * placed under binders, its free variables are lifted accordingly.
   *
   * @throws ArityMismatchException if there are fewer than {@code n} values
   */
  public static Term instantiate(Term e, int n, List<? extends Term> values) {
    checkArgument(n >= 0, "negative count %s", n);
    if (values.size() < n) {
      throw new ArityMismatchException(n, values.size());
    }
    if (n == 0) {
      return e;
    }
    return e.accept(
        new InstantiateShuttle(ImmutableList.copyOf(values.subList(0, n)), 0));
  }

  /** Instantiates the body of a binder with a value for its variable. */
  public static Term instantiateBody(Binder binder, Term value) {
    return instantiate(binder.body, value);
  }

  /** Increases every free variable of {@code e} by {@code n}. */
  public static Term liftFreeVars(Term e, int n) {
    return liftFreeVars(e, 0, n);
  }

  /** Increases every free variable {@code i >= start} of {@code e} by
   * {@code n}. */
  public static Term liftFreeVars(Term e, int start, int n) {
    checkArgument(start >= 0 && n >= 0, "bad lift %s %s", start, n);
    if (n == 0) {
      return e;
    }
    return e.accept(new LiftShuttle(start, n, 0));
  }

  /**
   * Decreases every free variable {@code i >= start} of {@code e} by
   * {@code n}.
   *
   * @throws MalformedChainException if a free variable in
   *   {@code [start - n, start)} occurs in {@code e}
   */
  public static Term lowerFreeVars(Term e, int start, int n) {
    checkArgument(n >= 0 && start >= n, "bad lower %s %s", start, n);
    if (n == 0) {
      return e;
    }
    return e.accept(new LowerShuttle(e, start, n, 0));
  }

  /** Replaces free variable {@code index} of {@code e} with {@code value};
   * the other free variables are unchanged. */
  public static Term substFreeVar(Term e, int index, Term value) {
    checkArgument(index >= 0, "negative index %s", index);
    return e.accept(new SubstShuttle(index, value, 0));
  }

  /** Applies a pending operation to a term. */
  public static Term apply(PendingOp op, Term e) {
    switch (op.kind) {
    case LIFT:
      return liftFreeVars(e, op.start, ((PendingOp.Lift) op).n);
    case LOWER:
      return lowerFreeVars(e, op.start, ((PendingOp.Lower) op).n);
    case SUBST:
      return substFreeVar(e, op.start, ((PendingOp.Subst) op).term);
    default:
      throw new AssertionError("unexpected " + op.kind);
    }
  }

  /** Applies a chain of pending operations to a term, in order. */
  public static Term apply(List<PendingOp> chain, Term e) {
    for (PendingOp op : chain) {
      e = apply(op, e);
    }
    return e;
  }

  /** Shuttle that implements {@link #liftFreeVars(Term, int, int)}. */
  private static class LiftShuttle extends OffsetShuttle {
    private final int start;
    private final int n;

    LiftShuttle(int start, int n, int offset) {
      super(offset);
      this.start = start;
      this.n = n;
    }

    @Override
    protected OffsetShuttle bind(int offset) {
      return new LiftShuttle(start, n, offset);
    }

    @Override
    public Term visit(Var var) {
      return var.index >= start + offset ? term.var(var.index + n) : var;
    }

    @Override
    public Term visit(MetaVar metaVar) {
      return PendingOps.addLift(metaVar, start + offset, n);
    }
  }

  /** Shuttle that implements {@link #lowerFreeVars(Term, int, int)}. */
  private static class LowerShuttle extends OffsetShuttle {
    private final Term root;
    private final int start;
    private final int n;

    LowerShuttle(Term root, int start, int n, int offset) {
      super(offset);
      this.root = root;
      this.start = start;
      this.n = n;
    }

    @Override
    protected OffsetShuttle bind(int offset) {
      return new LowerShuttle(root, start, n, offset);
    }

    @Override
    public Term visit(Var var) {
      final int i = var.index - offset;
      if (i >= start) {
        return term.var(var.index - n);
      }
      if (i >= start - n) {
        throw new MalformedChainException(PendingOp.lower(start, n), i, root);
      }
      return var;
    }

    @Override
    public Term visit(MetaVar metaVar) {
      return PendingOps.addLower(metaVar, start + offset, n);
    }
  }

  /** Shuttle that implements {@link #substFreeVar(Term, int, Term)}. */
  private static class SubstShuttle extends OffsetShuttle {
    private final int index;
    private final Term value;

    SubstShuttle(int index, Term value, int offset) {
      super(offset);
      this.index = index;
      this.value = value;
    }

    @Override
    protected OffsetShuttle bind(int offset) {
      return new SubstShuttle(index, value, offset);
    }

    @Override
    public Term visit(Var var) {
      return var.index == index + offset
          ? liftFreeVars(value, offset)
          : var;
    }

    @Override
    public Term visit(MetaVar metaVar) {
      return PendingOps.addSubst(metaVar, index + offset,
          liftFreeVars(value, offset));
    }
  }

  /** Shuttle that implements {@link #instantiate(Term, int, List)}. */
  private static class InstantiateShuttle extends OffsetShuttle {
    private final ImmutableList<Term> values;

    InstantiateShuttle(ImmutableList<Term> values, int offset) {
      super(offset);
      this.values = values;
    }

    @Override
    protected OffsetShuttle bind(int offset) {
      return new InstantiateShuttle(values, offset);
    }

    @Override
    public Term visit(Var var) {
      final int i = var.index - offset;
      if (i < 0) {
        return var;
      }
      if (i < values.size()) {
        return liftFreeVars(values.get(i), offset);
      }
      return term.var(var.index - values.size());
    }

    /**
     * Records the instantiation on a metavariable. Each eliminated variable
     * {@code offset + i} is substituted by its value, expressed in the context
     * that still contains the eliminated variables; then the variables above
     * them are lowered onto the emptied range.
     */
    @Override
    public Term visit(MetaVar metaVar) {
      final int n = values.size();
      MetaVar m = metaVar;
      for (int i = 0; i < n; i++) {
        m = PendingOps.addSubst(m, offset + i,
            liftFreeVars(values.get(i), offset + n));
      }
      return PendingOps.addLower(m, offset + n, n);
    }
  }
}

// End Instantiate.java
