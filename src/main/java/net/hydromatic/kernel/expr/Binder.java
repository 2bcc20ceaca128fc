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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Lambda abstraction or dependent function type.
 *
 * <p>The de Bruijn indices in {@link #body} are relative to this binder:
 * index 0 in the body is the variable that this binder introduces. The name
 * is used for printing; it is also compared by {@link #equals}.
 */
public class Binder extends Term {
  public final String name;
  public final Term domain;
  public final Term body;

  Binder(Op op, String name, Term domain, Term body) {
    super(op, Objects.hash(op.ordinal(), name, domain, body));
    checkArgument(op.isBinder(), "not a binder: %s", op);
    this.name = requireNonNull(name);
    this.domain = requireNonNull(domain);
    this.body = requireNonNull(body);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Binder
            && op == ((Binder) obj).op
            && hashCode() == obj.hashCode()
            && name.equals(((Binder) obj).name)
            && domain.equals(((Binder) obj).domain)
            && body.equals(((Binder) obj).body);
  }

  @Override
  StringBuilder describe(StringBuilder buf) {
    buf.append(op.keyword).append(' ').append(name).append(" : ");
    domain.describe(buf).append(", ");
    return body.describe(buf);
  }

  @Override
  public <R> R accept(TermVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  /**
   * Returns a copy of this binder with the given domain and body, or this
   * binder if they are the same objects.
   */
  public Binder copy(Term domain, Term body) {
    return domain == this.domain && body == this.body
        ? this
        : new Binder(op, name, domain, body);
  }
}

// End Binder.java
