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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds terms. */
public enum TermBuilder {
  /** The singleton instance of the term builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Small variables are shared. */
  private static final ImmutableList<Var> VARS = smallVars(32);

  private static ImmutableList<Var> smallVars(int n) {
    final ImmutableList.Builder<Var> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(new Var(i));
    }
    return b.build();
  }

  /** Creates a bound variable with a given de Bruijn index. */
  public Var var(int index) {
    return index >= 0 && index < VARS.size() ? VARS.get(index)
        : new Var(index);
  }

  /** Creates a constant. */
  public Const constant(String name) {
    return new Const(name);
  }

  /** Creates an application. */
  public Apply apply(Term fn, Term... args) {
    return new Apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates an application. */
  public Apply apply(Term fn, List<? extends Term> args) {
    return new Apply(fn, ImmutableList.copyOf(args));
  }

  /** Creates a lambda abstraction whose body is already in de Bruijn
   * form. */
  public Binder lambda(String name, Term domain, Term body) {
    return new Binder(Op.LAMBDA, name, domain, body);
  }

  /** Creates a dependent function type whose body is already in de Bruijn
   * form. */
  public Binder pi(String name, Term domain, Term body) {
    return new Binder(Op.PI, name, domain, body);
  }

  /**
   * Creates a lambda abstraction over constant {@code x}: every occurrence of
   * {@code x} in {@code body} becomes the bound variable.
   *
   * <p>For example, {@code fun(x, N, f(x, #0))} is {@code fun x : N, f(#0,
   * #0)}. The free variables of {@code body} are not shifted.
   */
  public Binder fun(Const x, Term domain, Term body) {
    return lambda(x.name, domain, abstractConst(body, x));
  }

  /** Creates a dependent function type over constant {@code x}, in the same
   * way that {@link #fun} creates a lambda. */
  public Binder forall(Const x, Term domain, Term body) {
    return pi(x.name, domain, abstractConst(body, x));
  }

  /** Creates a reference to a metavariable with no pending operations. */
  public MetaVar metavar(int id) {
    return new MetaVar(id, ImmutableList.of());
  }

  /** Creates a reference to a metavariable with pending operations. */
  public MetaVar metavar(int id, List<PendingOp> chain) {
    return new MetaVar(id, ImmutableList.copyOf(chain));
  }

  /**
   * Replaces each occurrence of constant {@code x} in {@code term} with the
   * variable bound by a binder placed around {@code term}.
   *
   * <p>Metavariables are left as they are; their values, when assigned, do not
   * see {@code x}.
   */
  public Term abstractConst(Term term, Const x) {
    requireNonNull(x);
    return term.accept(new AbstractShuttle(x, 0));
  }

  /** Shuttle that replaces a constant with a bound variable. */
  private static class AbstractShuttle extends OffsetShuttle {
    private final Const x;

    AbstractShuttle(Const x, int offset) {
      super(offset);
      this.x = x;
    }

    @Override
    protected OffsetShuttle bind(int offset) {
      return new AbstractShuttle(x, offset);
    }

    @Override
    public Term visit(Const constant) {
      return constant.equals(x) ? term.var(offset) : constant;
    }

    @Override
    public Term visit(MetaVar metaVar) {
      return metaVar;
    }
  }
}

// End TermBuilder.java
