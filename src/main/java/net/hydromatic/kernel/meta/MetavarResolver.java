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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashSet;
import java.util.Set;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.expr.TermShuttle;
import net.hydromatic.kernel.subst.Instantiate;

/**
 * Replaces assigned metavariables in a term with their values.
 *
 * <p>For a reference {@code ?i[ops]} whose metavariable has value {@code v},
 * the resolver resolves {@code v}, because it may itself contain
 * metavariables, resolves the terms of the substitutions in {@code ops}, and
 * applies the resolved {@code ops} to the resolved {@code v}, in order. A
 * reference to an unassigned metavariable is kept, but the terms in its
 * pending substitutions are resolved.
 *
 * <p>Results are not cached between calls; the result depends only on the
 * term and on the state of the environment.
 *
 * <p>The assignments in an environment are supposed to be acyclic. The
 * resolver keeps the ids whose values it is expanding, and throws
 * {@link CyclicAssignmentException} if it meets one of them again inside
 * such a value, or if it has expanded more than
 * {@link Prop#MAX_RESOLUTION_DEPTH} values inside each other. The terms in
 * the chain of {@code ?i} are not part of the value of {@code ?i}, so they
 * may refer to {@code ?i}; this happens when a term that contains {@code ?i}
 * is instantiated with {@code ?i}.
 */
public class MetavarResolver extends TermShuttle {
  private final MetavarEnv env;
  private final int maxDepth;
  /** Ids of the metavariables being expanded, outermost first. */
  private final Set<Integer> active = new LinkedHashSet<>();

  private MetavarResolver(MetavarEnv env) {
    this.env = requireNonNull(env);
    this.maxDepth = Prop.MAX_RESOLUTION_DEPTH.intValue(env.props());
  }

  /** Replaces every assigned metavariable in {@code t} with its value in
   * {@code env}. */
  public static Term instantiateMetavars(Term t, MetavarEnv env) {
    return t.accept(new MetavarResolver(env));
  }

  @Override
  public Term visit(MetaVar metaVar) {
    final Term value = env.getSubst(metaVar.id);
    if (value == null) {
      return super.visit(metaVar);
    }
    final Term resolvedValue = expand(metaVar.id, value);
    final MetaVar resolved = (MetaVar) super.visit(metaVar);
    final Term result = Instantiate.apply(resolved.chain, resolvedValue);
    env.tracer().onResolve(metaVar, value, result);
    return result;
  }

  /** Resolves the value of metavariable {@code id}. */
  private Term expand(int id, Term value) {
    if (!active.add(id)) {
      throw new CyclicAssignmentException(id, "expansion path " + active);
    }
    try {
      if (active.size() > maxDepth) {
        throw new CyclicAssignmentException(id,
            "more than " + maxDepth + " nested expansions");
      }
      return value.accept(this);
    } finally {
      active.remove(id);
    }
  }
}

// End MetavarResolver.java
