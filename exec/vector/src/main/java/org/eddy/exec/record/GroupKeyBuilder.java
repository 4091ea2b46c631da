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

import java.util.ArrayList;
import java.util.List;

import org.eddy.common.types.ColumnType;

/**
 * Builds a {@link GroupKey}, either from scratch or by extending an
 * existing key. Adding a label that is already present replaces its
 * entry in place.
 */
public class GroupKeyBuilder {

  private final List<ColumnMeta> cols = new ArrayList<>();
  private final List<Object> values = new ArrayList<>();

  public GroupKeyBuilder() { }

  public GroupKeyBuilder(GroupKey key) {
    if (key != null) {
      cols.addAll(key.cols());
      values.addAll(key.values());
    }
  }

  public GroupKeyBuilder addKeyValue(String label, ColumnType type, Object value) {
    return addKeyValue(new ColumnMeta(label, type), value);
  }

  public GroupKeyBuilder addKeyValue(ColumnMeta col, Object value) {
    for (int i = 0; i < cols.size(); i++) {
      if (cols.get(i).getLabel().equals(col.getLabel())) {
        cols.set(i, col);
        values.set(i, value);
        return this;
      }
    }
    cols.add(col);
    values.add(value);
    return this;
  }

  public int size() { return cols.size(); }

  public GroupKey build() {
    if (cols.isEmpty()) {
      return GroupKey.EMPTY;
    }
    return new GroupKey(cols, values);
  }
}
