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
 * Operation that is recorded on a {@link MetaVar} and applied to its value
 * once the metavariable is assigned.
 *
 * <p>Every operation has a cutoff, {@link #start}; indices below the cutoff
 * are never affected.
 */
public abstract class PendingOp {
  /** Kind of pending operation. */
  public enum Kind {
    LIFT,
    LOWER,
    SUBST
  }

  public final Kind kind;
  public final int start;

  PendingOp(Kind kind, int start) {
    checkArgument(start >= 0, "negative cutoff %s", start);
    this.kind = requireNonNull(kind);
    this.start = start;
  }

  /** Creates a {@link Lift}. */
  public static Lift lift(int start, int n) {
    return new Lift(start, n);
  }

  /** Creates a {@link Lower}. */
  public static Lower lower(int start, int n) {
    return new Lower(start, n);
  }

  /** Creates a {@link Subst}. */
  public static Subst subst(int start, Term term) {
    return new Subst(start, term);
  }

  @Override
  public String toString() {
    return describe(new StringBuilder()).toString();
  }

  abstract StringBuilder describe(StringBuilder buf);

  /** Base class for {@link Lift} and {@link Lower}, which shift indices. */
  public abstract static class Shift extends PendingOp {
    /** Amount by which indices are shifted. */
    public final int n;

    Shift(Kind kind, int start, int n) {
      super(kind, start);
      checkArgument(n >= 0, "negative shift %s", n);
      this.n = n;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind.ordinal(), start, n);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Shift
              && kind == ((Shift) obj).kind
              && start == ((Shift) obj).start
              && n == ((Shift) obj).n;
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      return buf.append(kind == Kind.LIFT ? "lift" : "lower")
          .append(':').append(start)
          .append(':').append(n);
    }
  }

  /**
   * Increases every free index {@code i >= start} by {@code n}. After a lift,
   * no free index lies in {@code [start, start + n)}.
   */
  public static final class Lift extends Shift {
    Lift(int start, int n) {
      super(Kind.LIFT, start, n);
    }

    /** Returns the end of the range {@code [start, end)} that this lift
     * leaves free of variables. */
    public int end() {
      return start + n;
    }
  }

  /**
   * Decreases every free index {@code i >= start} by {@code n}; indices below
   * {@code start} are unchanged.
   *
   * <p>Valid only if no free index lies in {@code [start - n, start)}, the
   * range onto which the lowered indices move. So {@code Lower(s + n, n)}
   * undoes {@code Lift(s, n)}.
   */
  public static final class Lower extends Shift {
    Lower(int start, int n) {
      super(Kind.LOWER, start, n);
      checkArgument(start >= n, "lower %s beyond cutoff %s", n, start);
    }

    /** Returns the start of the range {@code [low, start)} that must be free
     * of variables. */
    public int low() {
      return start - n;
    }
  }

  /**
   * Replaces free index {@code start} by {@link #term}. Other indices are
   * unchanged.
   */
  public static final class Subst extends PendingOp {
    public final Term term;

    Subst(int start, Term term) {
      super(Kind.SUBST, start);
      this.term = requireNonNull(term);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind.ordinal(), start, term);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Subst
              && start == ((Subst) obj).start
              && term.equals(((Subst) obj).term);
    }

    @Override
    StringBuilder describe(StringBuilder buf) {
      buf.append("subst:").append(start).append(' ');
      return term.describe(buf);
    }
  }
}

// End PendingOp.java
