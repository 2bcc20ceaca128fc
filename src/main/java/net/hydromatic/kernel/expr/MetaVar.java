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
import static net.hydromatic.kernel.util.Static.sameElements;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to a metavariable, with the chain of operations that are to be
 * applied to its value once it is assigned.
 *
 * <p>The chain lives with the reference, not with the metavariable: the same
 * metavariable may occur in many places, each with its own chain. Operations
 * are applied in the order that they occur in {@link #chain}.
 */
public class MetaVar extends Term {
  public final int id;
  public final ImmutableList<PendingOp> chain;

  MetaVar(int id, ImmutableList<PendingOp> chain) {
    super(Op.METAVAR, id * 41 + chain.hashCode());
    checkArgument(id >= 0, "negative metavariable id %s", id);
    this.id = id;
    this.chain = chain;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof MetaVar
            && id == ((MetaVar) obj).id
            && chain.equals(((MetaVar) obj).chain);
  }

  @Override
  StringBuilder describe(StringBuilder buf) {
    buf.append('?').append(id);
    if (!chain.isEmpty()) {
      buf.append('[');
      for (int i = 0; i < chain.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        chain.get(i).describe(buf);
      }
      buf.append(']');
    }
    return buf;
  }

  @Override
  public <R> R accept(TermVisitor<R> visitor) {
    return visitor.visit(this);
  }

  @Override
  public Term accept(TermShuttle shuttle) {
    return shuttle.visit(this);
  }

  /** Returns whether this reference has no pending operations. */
  public boolean isPlain() {
    return chain.isEmpty();
  }

  /** Returns the most recently added operation, or null if there is none. */
  public @Nullable PendingOp lastOp() {
    return chain.isEmpty() ? null : chain.get(chain.size() - 1);
  }

  /** Returns a reference to the same metavariable with the given chain. */
  public MetaVar copy(List<PendingOp> chain) {
    return sameElements(chain, this.chain)
        ? this
        : new MetaVar(id, ImmutableList.copyOf(chain));
  }
}

// End MetaVar.java
