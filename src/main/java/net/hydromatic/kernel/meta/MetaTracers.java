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

import java.io.OutputStream;
import java.io.PrintWriter;
import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;

/** Implementations of {@link MetaTracer}. */
public class MetaTracers {
  private MetaTracers() {}

  /** Returns a tracer that does nothing. */
  public static MetaTracer nullTracer() {
    return NullTracer.INSTANCE;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static MetaTracer printTracer(PrintWriter w) {
    return new PrintTracer(w);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static MetaTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /** Implementation of {@link MetaTracer} that does nothing. */
  private enum NullTracer implements MetaTracer {
    INSTANCE;

    public void onCreate(MetaVar metaVar) {}

    public void onTypeCreated(MetaVar metaVar, Term type) {}

    public void onAssign(int id, Term value) {}

    public void onResolve(MetaVar metaVar, Term value, Term result) {}
  }

  /**
   * Implementation of {@link MetaTracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements MetaTracer {
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void println(String s) {
      w.println(s);
      w.flush();
    }

    public void onCreate(MetaVar metaVar) {
      println("create " + metaVar);
    }

    public void onTypeCreated(MetaVar metaVar, Term type) {
      println("type " + metaVar + " : " + type);
    }

    public void onAssign(int id, Term value) {
      println("assign ?" + id + " := " + value);
    }

    public void onResolve(MetaVar metaVar, Term value, Term result) {
      println("resolve " + metaVar + " := " + value + " ~> " + result);
    }
  }
}

// End MetaTracers.java
