/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.eddy.common.types;

/**
 * Type of a column. Fixed when a batch is created; every value of a
 * column array has the same type. {@link #INVALID} marks a column whose
 * type could not be determined. An operator that tries to produce an
 * <tt>INVALID</tt> column fails.
 */
public enum ColumnType {
  BOOL("boolean"),
  INT("int"),
  UINT("uint"),
  FLOAT("float"),
  STRING("string"),
  TIME("time"),
  DURATION("duration"),
  INVALID("invalid");

  private final String displayName;

  ColumnType(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Lower-case name used in user messages.
   */
  public String displayName() { return displayName; }

  public boolean isNumeric() {
    return this == INT || this == UINT || this == FLOAT;
  }

  /**
   * Resolves a type from its display name (<tt>int</tt>) or its constant
   * name (<tt>INT</tt>).
   *
   * @throws IllegalArgumentException if the name matches no type
   */
  public static ColumnType fromName(String name) {
    for (ColumnType type : values()) {
      if (type.displayName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown column type: " + name);
  }

  @Override
  public String toString() { return displayName; }
}
