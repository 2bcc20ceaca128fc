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

import static net.hydromatic.kernel.expr.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

/** Tests for {@link Term} and {@link TermBuilder}. */
class TermTest {
  private final Const f = term.constant("f");
  private final Const g = term.constant("g");
  private final Const a = term.constant("a");
  private final Const x = term.constant("x");
  private final Const n = term.constant("N");

  @Test void testDescribe() {
    assertThat(term.apply(f, term.var(0), a), hasToString("f(#0, a)"));
    assertThat(term.lambda("x", n, term.apply(f, term.var(0))),
        hasToString("fun x : N, f(#0)"));
    assertThat(term.pi("x", n, n), hasToString("pi x : N, N"));
    assertThat(term.metavar(3), hasToString("?3"));
    final MetaVar m =
        term.metavar(1,
            ImmutableList.of(PendingOp.lift(1, 2),
                PendingOp.subst(0, term.apply(g, a)),
                PendingOp.lower(1, 1)));
    assertThat(m, hasToString("?1[lift:1:2, subst:0 g(a), lower:1:1]"));
  }

  @Test void testStructuralEquality() {
    final Term t1 = term.apply(f, term.var(0), term.apply(g, a));
    final Term t2 = term.apply(f, term.var(0), term.apply(g, a));
    assertThat(t1, is(t2));
    assertThat(t1.hashCode(), is(t2.hashCode()));
    assertThat(t1, not(term.apply(f, term.var(1), term.apply(g, a))));
    assertThat(term.lambda("x", n, term.var(0)),
        not(term.pi("x", n, term.var(0))));
    assertThat(term.lambda("x", n, term.var(0)),
        not(term.lambda("y", n, term.var(0))));
  }

  /** Two references to the same metavariable are equal only if their chains
   * are equal element by element. */
  @Test void testMetavarEquality() {
    final MetaVar m0 = term.metavar(0);
    assertThat(m0, is(term.metavar(0)));
    assertThat(m0, not(term.metavar(1)));
    final MetaVar lift = m0.copy(ImmutableList.of(PendingOp.lift(1, 1)));
    assertThat(lift, is(term.metavar(0, ImmutableList.of(PendingOp.lift(1, 1)))));
    assertThat(lift, not(m0));
    assertThat(lift,
        not(term.metavar(0, ImmutableList.of(PendingOp.lower(1, 1)))));
    assertThat(lift,
        not(term.metavar(0, ImmutableList.of(PendingOp.lift(1, 2)))));
    final MetaVar subst0 =
        term.metavar(0, ImmutableList.of(PendingOp.subst(1, term.apply(f, a))));
    final MetaVar subst1 =
        term.metavar(0, ImmutableList.of(PendingOp.subst(1, term.apply(g, a))));
    assertThat(subst0, not(subst1));
  }

  @Test void testCopyPreservesIdentity() {
    final MetaVar m = term.metavar(2);
    assertThat(m.copy(ImmutableList.of()), sameInstance(m));
    assertThat(m.lastOp(), nullValue());
    final Apply apply = term.apply(f, a, m);
    assertThat(apply.copy(f, ImmutableList.of(a, m)), sameInstance(apply));
    assertThat(apply.copy(g, ImmutableList.of(a, m)),
        hasToString("g(a, ?2)"));
  }

  /** Abstracting a constant replaces it by the bound variable, and leaves the
   * other free variables alone. */
  @Test void testFun() {
    final Binder fun =
        term.fun(x, n,
            term.apply(f, term.var(3), x,
                term.fun(term.constant("y"), n,
                    term.apply(f, x, term.constant("y")))));
    assertThat(fun,
        is(
            term.lambda("x", n,
                term.apply(f, term.var(3), term.var(0),
                    term.lambda("y", n,
                        term.apply(f, term.var(1), term.var(0)))))));
    assertThat(term.forall(x, n, x), is(term.pi("x", n, term.var(0))));
  }

  @Test void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> term.var(-1));
    assertThrows(IllegalArgumentException.class,
        () -> term.apply(f, ImmutableList.of()));
    assertThrows(IllegalArgumentException.class, () -> term.metavar(-2));
    assertThrows(IllegalArgumentException.class,
        () -> PendingOp.lift(-1, 1));
    assertThrows(IllegalArgumentException.class,
        () -> PendingOp.lower(0, -1));
    // A lower cannot move an index below zero.
    assertThrows(IllegalArgumentException.class,
        () -> PendingOp.lower(1, 2));
  }

  @Test void testContext() {
    final Context c0 = Context.EMPTY;
    final Context c2 = c0.extend("x", n).extend("y", term.apply(f, term.var(0)));
    assertThat(c0.isEmpty(), is(true));
    assertThat(c2.size(), is(2));
    assertThat(c2.name(0), is("y"));
    assertThat(c2.name(1), is("x"));
    assertThat(c2.domain(1), is(n));
    assertThat(c2, hasToString("[y : f(#0), x : N]"));
    assertThrows(IllegalArgumentException.class, () -> c2.name(2));
  }
}

// End TermTest.java
