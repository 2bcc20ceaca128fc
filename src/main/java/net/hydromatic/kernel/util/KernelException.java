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
package net.hydromatic.kernel.util;

/**
 * Error raised by the metavariable core.
 *
 * <p>Every such error is a defect in the caller (an elaborator that built an
 * invalid term, chain or assignment); none is recoverable, and the core never
 * catches one.
 */
public abstract class KernelException extends RuntimeException {
  protected KernelException(String message) {
    super(message);
  }
}

// End KernelException.java
