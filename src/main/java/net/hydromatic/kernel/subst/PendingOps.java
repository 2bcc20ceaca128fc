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

import static net.hydromatic.kernel.util.Static.append;
import static net.hydromatic.kernel.util.Static.skipLast;

import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.PendingOp;
import net.hydromatic.kernel.expr.Term;

/**
 * Adds operations to the chain of a metavariable reference.
 *
 * <p>The methods never look at the metavariable's value; they only look at
 * the last operation of the chain, and simplify when the new operation and
 * that last operation combine:
 *
 * <ul>
 *   <li>a lift followed by a lift that starts inside or at the end of its
 *       range becomes one lift;
 *   <li>a lift followed by a lower of at most the same amount whose cutoff
 *       lies in the lifted range, or at its end, cancels, leaving the
 *       difference as a lift;
 *   <li>a substitution for a variable that a preceding lift removed has no
 *       effect, and is dropped;
 *   <li>a substitution moves in front of a preceding lower, adjusting its
 *       index and its term; and in front of a preceding lift if its term does
 *       not refer to the lifted range.
 * </ul>
 *
 * <p>Each rewrite replaces a chain with one that has the same effect on every
 * value for which the original chain is valid. So two chains that are built
 * in different but equivalent orders end up equal, and applying either one
 * to the eventual value of the metavariable gives the same term.
 */
public class PendingOps {
  private PendingOps() {}

  /** Appends an operation, using the same simplifications as the specific
   * methods. */
  public static MetaVar add(MetaVar m, PendingOp op) {
    switch (op.kind) {
    case LIFT:
      return addLift(m, op.start, ((PendingOp.Lift) op).n);
    case LOWER:
      return addLower(m, op.start, ((PendingOp.Lower) op).n);
    case SUBST:
      return addSubst(m, op.start, ((PendingOp.Subst) op).term);
    default:
      throw new AssertionError("unexpected " + op.kind);
    }
  }

  /** Records that free variables {@code i >= s} of the value of {@code m}
   * are to be increased by {@code n}. */
  public static MetaVar addLift(MetaVar m, int s, int n) {
    if (n == 0) {
      return m;
    }
    final PendingOp last = m.lastOp();
    if (last instanceof PendingOp.Lift) {
      final PendingOp.Lift lift = (PendingOp.Lift) last;
      if (lift.start <= s && s <= lift.end()) {
        return m.copy(
            append(skipLast(m.chain), PendingOp.lift(lift.start, lift.n + n)));
      }
    }
    return m.copy(append(m.chain, PendingOp.lift(s, n)));
  }

  /**
   * Records that free variables {@code i >= s} of the value of {@code m} are
   * to be decreased by {@code n}; the variables in {@code [s - n, s)} must not
   * occur.
   */
  public static MetaVar addLower(MetaVar m, int s, int n) {
    if (n == 0) {
      return m;
    }
    final PendingOp last = m.lastOp();
    if (last instanceof PendingOp.Lift) {
      final PendingOp.Lift lift = (PendingOp.Lift) last;
      if (lift.start <= s && s <= lift.end() && n <= lift.n) {
        // Indices below the lift are below s; the others stay at or above s.
        final MetaVar m0 = m.copy(skipLast(m.chain));
        return addLift(m0, lift.start, lift.n - n);
      }
    }
    return m.copy(append(m.chain, PendingOp.lower(s, n)));
  }

  /** Records that free variable {@code s} of the value of {@code m} is to be
   * replaced by {@code t}. */
  public static MetaVar addSubst(MetaVar m, int s, Term t) {
    final PendingOp last = m.lastOp();
    if (last instanceof PendingOp.Lower) {
      final PendingOp.Lower lower = (PendingOp.Lower) last;
      final MetaVar m0 = m.copy(skipLast(m.chain));
      final int s0 = s < lower.low() ? s : s + lower.n;
      final Term t0 = Instantiate.liftFreeVars(t, lower.low(), lower.n);
      return addLower(addSubst(m0, s0, t0), lower.start, lower.n);
    }
    if (last instanceof PendingOp.Lift) {
      final PendingOp.Lift lift = (PendingOp.Lift) last;
      if (lift.start <= s && s < lift.end()) {
        // Variable s cannot occur after the lift.
        return m;
      }
      if (!FreeVars.hasFreeVarIn(t, lift.start, lift.end())) {
        final MetaVar m0 = m.copy(skipLast(m.chain));
        final int s0 = s < lift.start ? s : s - lift.n;
        final Term t0 = Instantiate.lowerFreeVars(t, lift.end(), lift.n);
        return addLift(addSubst(m0, s0, t0), lift.start, lift.n);
      }
    }
    return m.copy(append(m.chain, PendingOp.subst(s, t)));
  }
}

// End PendingOps.java
