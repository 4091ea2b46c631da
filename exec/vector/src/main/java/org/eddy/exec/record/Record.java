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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.vector.TypeHelper;

/**
 * An ordered set of typed properties: the row or object representation
 * passed to predicates and returned by row functions. Property order is
 * insertion order. A property may hold a typed null.
 */
public class Record {

  private final Map<String, ColumnMeta> types = new LinkedHashMap<>();
  private final Map<String, Object> values = new LinkedHashMap<>();

  public Record set(String label, ColumnType type, Object value) {
    types.put(label, new ColumnMeta(label, type));
    values.put(label, TypeHelper.checkValue(type, value));
    return this;
  }

  public Record setNull(String label, ColumnType type) {
    return set(label, type, null);
  }

  public boolean has(String label) { return types.containsKey(label); }

  public Object get(String label) { return values.get(label); }

  public ColumnType type(String label) {
    ColumnMeta col = types.get(label);
    return col == null ? null : col.getType();
  }

  public int size() { return types.size(); }

  /**
   * Properties in insertion order.
   */
  public List<ColumnMeta> cols() {
    return new ArrayList<>(types.values());
  }

  /**
   * Values of row <tt>row</tt> of a view, one property per column.
   */
  public static Record fromRow(TableView view, int row) {
    Record record = new Record();
    for (int j = 0; j < view.nCols(); j++) {
      ColumnMeta col = view.col(j);
      record.set(col.getLabel(), col.getType(), view.values(j).getObject(row));
    }
    return record;
  }

  /**
   * The key's entries as properties.
   */
  public static Record fromKey(GroupKey key) {
    Record record = new Record();
    for (int k = 0; k < key.nCols(); k++) {
      record.set(key.col(k).getLabel(), key.col(k).getType(), key.value(k));
    }
    return record;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
