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

/** Named constant. */
public class Const extends Term {
  public final String name;

  Const(String name) {
    super(Op.CONST, requireNonNull(name).hashCode());
    this.name = name;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Const && name.equals(((Const) obj).name);
  }

  @Override
  StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
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

// End Const.java
