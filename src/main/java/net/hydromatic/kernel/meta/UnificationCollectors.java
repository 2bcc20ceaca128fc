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

import java.io.PrintWriter;
import net.hydromatic.kernel.expr.Context;
import net.hydromatic.kernel.expr.Term;

/** Implementations of {@link UnificationCollector}. */
public class UnificationCollectors {
  private UnificationCollectors() {}

  /** Returns a collector that ignores every constraint. */
  public static UnificationCollector noop() {
    return NoopCollector.INSTANCE;
  }

  /** Returns a collector that writes each constraint to a writer, then
   * passes it to another collector. */
  public static UnificationCollector printer(PrintWriter w,
      UnificationCollector next) {
    return new PrintCollector(w, next);
  }

  /** Returns a collector that writes each constraint to a writer. */
  public static UnificationCollector printer(PrintWriter w) {
    return printer(w, noop());
  }

  /** Collector that does nothing. */
  private enum NoopCollector implements UnificationCollector {
    INSTANCE;

    @Override
    public void addEq(Context context, Term lhs, Term rhs) {}

    @Override
    public void addTypeOfEq(Context context, Term term, Term type) {}
  }

  /** Collector that writes to a {@link PrintWriter}. */
  private static class PrintCollector implements UnificationCollector {
    private final PrintWriter w;
    private final UnificationCollector next;

    PrintCollector(PrintWriter w, UnificationCollector next) {
      this.w = requireNonNull(w);
      this.next = requireNonNull(next);
    }

    @Override
    public void addEq(Context context, Term lhs, Term rhs) {
      w.println(context + " |- " + lhs + " == " + rhs);
      w.flush();
      next.addEq(context, lhs, rhs);
    }

    @Override
    public void addTypeOfEq(Context context, Term term, Term type) {
      w.println(context + " |- typeof(" + term + ") == " + type);
      w.flush();
      next.addTypeOfEq(context, term, type);
    }
  }
}

// End UnificationCollectors.java
