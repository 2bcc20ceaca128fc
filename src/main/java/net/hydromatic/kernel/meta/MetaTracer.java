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

import net.hydromatic.kernel.expr.MetaVar;
import net.hydromatic.kernel.expr.Term;

/** Called on various events in a {@link MetavarEnv}.
 *
 * @see MetaTracers */
public interface MetaTracer {
  /** Called when a metavariable is created. */
  void onCreate(MetaVar metaVar);

  /** Called when the type of a metavariable is created. */
  void onTypeCreated(MetaVar metaVar, Term type);

  /** Called when a metavariable is assigned a value. */
  void onAssign(int id, Term value);

  /**
   * Called when {@link MetavarResolver} replaces a reference to an assigned
   * metavariable. {@code value} is the assigned value, {@code result} the
   * value after the reference's chain has been applied.
   */
  void onResolve(MetaVar metaVar, Term value, Term result);
}

// End MetaTracer.java
