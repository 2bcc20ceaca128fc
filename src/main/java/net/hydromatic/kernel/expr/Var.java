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

/** Bound variable, identified by its de Bruijn index.
 *
 * <p>Index 0 refers to the innermost enclosing binder. */
public class Var extends Term {
  public final int index;

  Var(int index) {
    super(Op.VAR, index * 31 + 7);
    checkArgument(index >= 0, "negative index %s", index);
    this.index = index;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Var && index == ((Var) obj).index;
  }

  @Override
  StringBuilder describe(StringBuilder buf) {
    return buf.append('#').append(index);
  }

  @Override
  public <R> R accept(TermVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }
}

// End Var.java
