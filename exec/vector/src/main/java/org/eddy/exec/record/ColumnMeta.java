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
package org.eddy.exec.record;

import java.util.Objects;

import org.eddy.common.types.ColumnType;

import com.google.common.base.Preconditions;

/**
 * Label and type of one column. Immutable.
 */
public final class ColumnMeta {

  private final String label;
  private final ColumnType type;

  public ColumnMeta(String label, ColumnType type) {
    this.label = Preconditions.checkNotNull(label, "label cannot be null");
    this.type = Preconditions.checkNotNull(type, "type cannot be null");
  }

  public static ColumnMeta of(String label, ColumnType type) {
    return new ColumnMeta(label, type);
  }

  public String getLabel() { return label; }

  public ColumnType getType() { return type; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ColumnMeta)) {
      return false;
    }
    ColumnMeta other = (ColumnMeta) o;
    return label.equals(other.label) && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(label, type);
  }

  @Override
  public String toString() {
    return label + ":" + type;
  }
}
