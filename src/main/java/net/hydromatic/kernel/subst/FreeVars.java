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

import java.util.concurrent.atomic.AtomicBoolean;
import net.hydromatic.kernel.expr.Apply;
import net.hydromatic.kernel.expr.Binder;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.expr.TermVisitor;
import net.hydromatic.kernel.expr.Var;

/** Queries about the free variables and metavariables of a term. */
public class FreeVars {
  private FreeVars() {}

  /**
   * Returns whether {@code term} may contain a free variable whose index is
   * in the range {@code [low, high)}.
   *
   * <p>The answer is exact for terms without metavariables. A metavariable
   * may be assigned a value with any free variables, so a term that contains
   * one is assumed to contain every free variable.
   */
  public static boolean hasFreeVarIn(Term term, int low, int high) {
    checkArgument(0 <= low && low <= high, "bad range [%s, %s)", low, high);
    return low < high && hasFreeVarIn(term, low, high, 0);
  }

  /** Returns whether {@code term} may contain any free variable. */
  public static boolean hasFreeVars(Term term) {
    return hasFreeVarIn(term, 0, Integer.MAX_VALUE);
  }

  private static boolean hasFreeVarIn(Term term, int low, int high,
      int offset) {
    switch (term.op) {
    case VAR:
      final int index = ((Var) term).index;
      return index >= offset
          && index - offset >= low
          && index - offset < high;
    case CONST:
      return false;
    case APPLY:
      final Apply apply = (Apply) term;
      if (hasFreeVarIn(apply.fn, low, high, offset)) {
        return true;
      }
      for (Term arg : apply.args) {
        if (hasFreeVarIn(arg, low, high, offset)) {
          return true;
        }
      }
      return false;
    case LAMBDA:
    case PI:
      final Binder binder = (Binder) term;
      return hasFreeVarIn(binder.domain, low, high, offset)
          || hasFreeVarIn(binder.body, low, high, offset + 1);
    case METAVAR:
      return true;
    default:
      throw new AssertionError("unexpected " + term.op);
    }
  }

  /** Returns whether {@code term} contains a reference to any
   * metavariable. */
  public static boolean hasMetavar(Term term) {
    return find(term, -1);
  }

  /**
   * Returns whether {@code term} contains a reference to metavariable
   * {@code id}, including inside the pending substitutions of other
   * metavariables.
   */
  public static boolean containsMetavar(Term term, int id) {
    checkArgument(id >= 0);
    return find(term, id);
  }

  /** Looks for metavariable {@code id}, or any metavariable if {@code id} is
   * negative. */
  private static boolean find(Term term, int id) {
    final AtomicBoolean found = new AtomicBoolean();
    term.accept(
        new TermVisitor<Void>() {
          @Override
          public Void visit(MetaVar metaVar) {
            if (id < 0 || metaVar.id == id) {
              found.set(true);
              return null;
            }
            return super.visit(metaVar);
          }
        });
    return found.get();
  }
}

// End FreeVars.java
