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

import net.hydromatic.kernel.expr.Context;
import net.hydromatic.kernel.expr.Term;

/**
 * Receives equality constraints that the metavariable environment cannot
 * solve itself.
 *
 * <p>The environment never interprets the constraints. It emits
 * {@link #addTypeOfEq} when {@link MetavarEnv#getType} creates the type of a
 * metavariable; the elaborator that owns the collector emits the rest.
 *
 * @see UnificationCollectors
 */
public interface UnificationCollector {
  /** Records that {@code lhs} and {@code rhs} must be equal in
   * {@code context}. */
  void addEq(Context context, Term lhs, Term rhs);

  /** Records that the type of {@code term} must be {@code type} in
   * {@code context}. */
  void addTypeOfEq(Context context, Term term, Term type);
}

// End UnificationCollector.java
