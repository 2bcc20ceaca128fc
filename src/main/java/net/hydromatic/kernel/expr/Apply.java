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
import static net.hydromatic.kernel.util.Static.sameElements;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Application of a function to a non-empty list of arguments. */
public class Apply extends Term {
  public final Term fn;
  public final ImmutableList<Term> args;

  Apply(Term fn, ImmutableList<Term> args) {
    super(Op.APPLY, requireNonNull(fn).hashCode() * 37 + args.hashCode());
    checkArgument(!args.isEmpty(), "application must have arguments");
    this.fn = fn;
    this.args = args;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Apply
            && hashCode() == obj.hashCode()
            && fn.equals(((Apply) obj).fn)
            && args.equals(((Apply) obj).args);
  }

  @Override
  StringBuilder describe(StringBuilder buf) {
    fn.describe(buf).append('(');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      args.get(i).describe(buf);
    }
    return buf.append(')');
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
   * Returns a copy of this application with the given function and arguments,
   * or this application if they are the same objects.
   */
  public Apply copy(Term fn, List<Term> args) {
    return fn == this.fn && sameElements(args, this.args)
        ? this
        : new Apply(fn, ImmutableList.copyOf(args));
  }
}

// End Apply.java
