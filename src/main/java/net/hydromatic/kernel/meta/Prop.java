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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import java.util.Map;

/**
 * Property of a {@link MetavarEnv}.
 *
 * @see MetavarEnv#MetavarEnv(Map)
 */
public enum Prop {
  /**
   * Integer property "maxResolutionDepth" is the number of nested
   * metavariable expansions that {@link MetavarResolver} allows before it
   * decides that the assignments form a cycle. Default is 1,000.
   *
   * <p>Each expansion uses several stack frames, so a much larger value lets
   * a long chain of assignments exhaust the stack before the limit is
   * reached.
   */
  MAX_RESOLUTION_DEPTH("maxResolutionDepth", Integer.class, 1_000),

  /**
   * Boolean property "checkAssignmentCycles" controls whether
   * {@link MetavarEnv#assign} rejects a value that refers to the metavariable
   * being assigned. Default is true.
   *
   * <p>Cycles through several metavariables are detected later, by
   * {@link MetavarResolver}.
   */
  CHECK_ASSIGNMENT_CYCLES("checkAssignmentCycles", Boolean.class, true);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }
}

// End Prop.java
