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
package net.hydromatic.kernel.meta;

import static net.hydromatic.kernel.expr.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kernel.expr.Apply;
import net.hydromatic.kernel.expr.Const;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.subst.Instantiate;
import net.hydromatic.kernel.subst.MalformedChainException;
import net.hydromatic.kernel.subst.PendingOps;
import org.junit.jupiter.api.Test;

/** Tests for {@link MetavarResolver}: instantiation of free variables and
 * of metavariables, in either order. */
class MetavarResolverTest {
  private final Const f = term.constant("f");
  private final Const g = term.constant("g");
  private final Const h = term.constant("h");
  private final Const a = term.constant("a");
  private final Const n = term.constant("N");
  private final Const x = term.constant("x");
  private final Const y = term.constant("y");

  private final MetavarEnv env = new MetavarEnv();

  private Term f(Term... args) {
    return term.apply(f, args);
  }

  private Term g(Term... args) {
    return term.apply(g, args);
  }

  private Term h(Term... args) {
    return term.apply(h, args);
  }

  private static Term v(int i) {
    return term.var(i);
  }

  @Test void testNoMetavars() {
    final Term t = f(a, v(0));
    assertThat(env.instantiateMetavars(t), sameInstance(t));
  }

  @Test void testUnassignedKept() {
    final MetaVar m = env.mkMetavar();
    final Term t = f(m, a);
    assertThat(env.instantiateMetavars(t), sameInstance(t));
  }

  @Test void testInstantiateThenAssign() {
    final MetaVar m1 = env.mkMetavar();
    final Term t = Instantiate.instantiate(f(m1, v(0)), a);
    env.assign(m1, g(v(0)));
    assertThat(env.instantiateMetavars(t), hasToString("f(g(a), a)"));
  }

  /** Free variables of the value above the instantiated one are lowered. */
  @Test void testInstantiateLowersOuterVariables() {
    final MetaVar m1 = env.mkMetavar();
    final Term t = Instantiate.instantiate(f(m1, v(0), v(2)), a);
    assertThat(t, hasToString("f(?0[subst:0 a, lower:1:1], a, #1)"));
    env.assign(m1, g(v(0), v(1)));
    assertThat(env.instantiateMetavars(t), hasToString("f(g(a, #0), a, #1)"));
  }

  @Test void testLiftThenInstantiate() {
    final MetaVar m1 = env.mkMetavar();
    final Term t =
        Instantiate.instantiate(
            Instantiate.liftFreeVars(f(m1, v(1), v(2)), 1, 2), a);
    env.assign(m1, g(v(0), v(1)));
    assertThat(env.instantiateMetavars(t), hasToString("f(g(a, #2), #2, #3)"));
  }

  /** A substitution and a lower that are pending on a reference are applied
   * to the value when the reference is resolved; a reference inside the
   * substituted term keeps the lower until its own value arrives. */
  @Test void testPendingLower() {
    final MetaVar m1 = env.mkMetavar();
    final MetaVar m2 = env.mkMetavar();
    final MetaVar m11 =
        PendingOps.addLower(PendingOps.addSubst(m1, 0, f(a, m2)), 1, 1);
    assertThat(m11, hasToString("?0[subst:0 f(a, ?1), lower:1:1]"));
    env.assign(m1, f(v(0)));
    assertThat(env.instantiateMetavars(m11),
        is(f(f(a, PendingOps.addLower(m2, 1, 1)))));
    env.assign(m2, g(a, v(1)));
    assertThat(env.instantiateMetavars(h(m11)), is(h(f(f(a, g(a, v(0)))))));
  }

  /** Instantiating a term with a metavariable that the term contains puts a
   * reference to the metavariable inside its own pending substitution. That
   * is not a cycle. */
  @Test void testMetavarInOwnSubstitution() {
    final MetaVar m = env.mkMetavar();
    final Term t = Instantiate.instantiate(f(m), m);
    assertThat(t, hasToString("f(?0[subst:0 ?0[lift:0:1], lower:1:1])"));
    env.assign(m, g(v(0)));
    assertThat(env.instantiateMetavars(t), is(f(g(g(v(0))))));
  }

  /** Instantiating and then resolving gives the same result as resolving
   * and then instantiating. */
  @Test void testCommute() {
    final MetaVar m1 = env.mkMetavar();
    final Term t = f(m1, v(0));
    env.assign(m1, h(v(0), v(2)));
    final Term r1 = env.instantiateMetavars(Instantiate.instantiate(t, g(a)));
    final Term r2 = Instantiate.instantiate(env.instantiateMetavars(t), g(a));
    assertThat(r1, hasToString("f(h(g(a), #1), g(a))"));
    assertThat(r1, is(r2));
  }

  @Test void testInstantiateMany() {
    final MetaVar m1 = env.mkMetavar();
    final Term t =
        Instantiate.instantiate(f(m1, v(2)),
            ImmutableList.of(g(v(0)), h(a)));
    env.assign(m1, h(v(1)));
    assertThat(env.instantiateMetavars(t), hasToString("f(h(h(a)), #0)"));
  }

  /** A value that contains metavariables is placed under several binders;
   * each copy is lifted by the depth at which it lands. */
  @Test void testValueUnderBinders() {
    final MetaVar m1 = env.mkMetavar();
    final MetaVar m2 = env.mkMetavar();
    final Term t =
        f(v(0),
            term.fun(x, n,
                f(v(1), x, term.fun(y, n, f(v(2), x, y)))));
    final Term t2 = Instantiate.instantiate(t, g(m1, m2));
    env.assign(m2, v(2));
    env.assign(m1, h(v(3)));
    final String expected = "f(g(h(#3), #2), "
        + "fun x : N, f(g(h(#4), #3), #0, "
        + "fun y : N, f(g(h(#5), #4), #1, #0)))";
    assertThat(env.instantiateMetavars(t2), hasToString(expected));
    // Resolving the value first gives the same result.
    assertThat(
        Instantiate.instantiate(t,
            MetavarResolver.instantiateMetavars(g(m1, m2), env)),
        hasToString(expected));
  }

  /** Two instantiations, the second of which places a value inside the
   * pending substitution of the first. */
  @Test void testNestedInstantiation() {
    final MetaVar m1 = env.mkMetavar();
    final MetaVar m2 = env.mkMetavar();
    final Term t =
        f(v(0),
            term.fun(x, n,
                f(v(1), v(2), x, term.fun(y, n, f(v(2), x, y)))));
    final Term t2 =
        Instantiate.instantiate(Instantiate.instantiate(t, g(m1)), h(m2));
    env.assign(m1, f(v(0)));
    env.assign(m2, v(2));
    assertThat(env.instantiateMetavars(t2),
        hasToString("f(g(f(h(#2))), "
            + "fun x : N, f(g(f(h(#3))), h(#3), #0, "
            + "fun y : N, f(g(f(h(#4))), #1, #0)))"));
  }

  /** The value of one metavariable refers to another, which is resolved
   * too. */
  @Test void testTransitive() {
    final MetaVar m0 = env.mkMetavar();
    final MetaVar m1 = env.mkMetavar();
    final MetaVar m2 = env.mkMetavar();
    env.assign(m0, f(m1, PendingOps.addLift(m2, 0, 1)));
    env.assign(m1, g(m2));
    env.assign(m2, v(0));
    assertThat(env.instantiateMetavars(h(m0)), hasToString("h(f(g(#0), #1))"));
  }

  @Test void testMalformedChain() {
    final MetaVar m = env.mkMetavar();
    final Term t = Instantiate.lowerFreeVars(f(m), 1, 1);
    assertThat(t, hasToString("f(?0[lower:1:1])"));
    env.assign(m, g(v(0)));
    final MalformedChainException e =
        assertThrows(MalformedChainException.class,
            () -> env.instantiateMetavars(t));
    assertThat(e.index, is(0));
  }

  @Test void testCycle() {
    final MetaVar m0 = env.mkMetavar();
    final MetaVar m1 = env.mkMetavar();
    env.assign(m0, f(m1));
    env.assign(m1, g(m0));
    final CyclicAssignmentException e =
        assertThrows(CyclicAssignmentException.class,
            () -> env.instantiateMetavars(h(m0)));
    assertThat(e.id, is(0));
    assertThat(e.getMessage(), containsString("[0, 1]"));
  }

  @Test void testSelfCycle() {
    final MetavarEnv env2 =
        new MetavarEnv(ImmutableMap.of(Prop.CHECK_ASSIGNMENT_CYCLES, false));
    final MetaVar m = env2.mkMetavar();
    env2.assign(m, f(m));
    assertThrows(CyclicAssignmentException.class,
        () -> env2.instantiateMetavars(m));
  }

  /** The same metavariable may occur several times without being a cycle. */
  @Test void testSharedIsNotCycle() {
    final MetaVar m0 = env.mkMetavar();
    final MetaVar m1 = env.mkMetavar();
    env.assign(m0, f(m1, m1));
    env.assign(m1, a);
    assertThat(env.instantiateMetavars(g(m0, m1)), hasToString("g(f(a, a), a)"));
  }

  @Test void testMaxDepth() {
    final MetavarEnv env2 =
        new MetavarEnv(ImmutableMap.of(Prop.MAX_RESOLUTION_DEPTH, 2));
    final MetaVar m0 = env2.mkMetavar();
    final MetaVar m1 = env2.mkMetavar();
    final MetaVar m2 = env2.mkMetavar();
    env2.assign(m0, f(m1));
    env2.assign(m1, f(m2));
    env2.assign(m2, a);
    assertThat(env2.instantiateMetavars(m1), hasToString("f(a)"));
    final CyclicAssignmentException e =
        assertThrows(CyclicAssignmentException.class,
            () -> env2.instantiateMetavars(m0));
    assertThat(e.id, is(2));
  }

  /** A long acyclic chain of assignments resolves; a chain longer than the
   * default depth limit fails with a cycle error, not by exhausting the
   * stack. */
  @Test void testLongChain() {
    assertThat(resolveChain(900), is(900));
    final CyclicAssignmentException e =
        assertThrows(CyclicAssignmentException.class,
            () -> resolveChain(9_000));
    assertThat(e.id, is(1_000));
    assertThat(e.getMessage(), containsString("more than 1000"));
  }

  /** Assigns {@code ?i := f(?i+1)} for {@code i < length} and
   * {@code ?length := a}, resolves {@code ?0}, and returns how many times
   * {@code f} is applied in the result. */
  private int resolveChain(int length) {
    final MetavarEnv env2 = new MetavarEnv();
    final List<MetaVar> metaVars = new ArrayList<>();
    for (int i = 0; i <= length; i++) {
      metaVars.add(env2.mkMetavar());
    }
    for (int i = 0; i < length; i++) {
      env2.assign(metaVars.get(i), f(metaVars.get(i + 1)));
    }
    env2.assign(metaVars.get(length), a);
    Term t = env2.instantiateMetavars(metaVars.get(0));
    int depth = 0;
    while (t instanceof Apply) {
      t = ((Apply) t).args.get(0);
      ++depth;
    }
    assertThat(t, is(a));
    return depth;
  }
}

// End MetavarResolverTest.java
