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
package net.hydromatic.kernel.subst;

import net.hydromatic.kernel.expr.PendingOp;
import net.hydromatic.kernel.expr.Term;
import net.hydromatic.kernel.util.KernelException;

/**
 * Thrown when a {@link PendingOp.Lower} meets a free variable in the range
 * that it requires to be empty.
 *
 * <p>This happens when a metavariable's value is applied to a chain that was
 * built on a false assumption about which variables the value could contain.
 */
public class MalformedChainException extends KernelException {
  public final PendingOp.Shift op;
  public final int index;

  public MalformedChainException(PendingOp.Shift op, int index, Term term) {
    super("cannot apply " + op + ": free variable #" + index
        + " occurs in " + term);
    this.op = op;
    this.index = index;
  }
}

// End MalformedChainException.java
