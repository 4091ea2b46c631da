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
package org.eddy.exec.work.foreman;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Rows of one named result, copied out of the buffers that reached it and
 * grouped by key in arrival order. Views with the same key are appended to
 * one table and must share its schema.
 */
public class ResultTable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ResultTable.class);

  private static class KeyedRows {
    final List<ColumnMeta> cols;
    final List<List<Object>> rows = new ArrayList<>();
    int flushes;

    KeyedRows(List<ColumnMeta> cols) {
      this.cols = cols;
    }
  }

  private final String name;
  private final Map<GroupKey, KeyedRows> tables = new LinkedHashMap<>();

  public ResultTable(String name) {
    this.name = name;
  }

  public String getName() { return name; }

  synchronized void append(TableView view) {
    KeyedRows table = tables.get(view.key());
    if (table == null) {
      table = new KeyedRows(new ArrayList<>(view.cols()));
      tables.put(view.key(), table);
    } else if (! table.cols.equals(view.cols())) {
      throw UserException.failedPreconditionError()
          .message("schema collision detected")
          .addContext("Result", name)
          .addContext("Group key", view.key().toString())
          .addContext("Expected", table.cols.toString())
          .addContext("Found", view.cols().toString())
          .build(logger);
    }
    for (int i = 0; i < view.len(); i++) {
      List<Object> row = new ArrayList<>(view.nCols());
      for (int j = 0; j < view.nCols(); j++) {
        row.add(view.values(j).getObject(i));
      }
      table.rows.add(Collections.unmodifiableList(row));
    }
  }

  synchronized void flushKey(GroupKey key) {
    KeyedRows table = tables.get(key);
    if (table != null) {
      table.flushes++;
    }
  }

  /**
   * Keys of the tables in the order their first view arrived.
   */
  public synchronized List<GroupKey> keys() {
    return new ArrayList<>(tables.keySet());
  }

  public synchronized int tableCount() {
    return tables.size();
  }

  public synchronized long rowCount() {
    long count = 0;
    for (KeyedRows table : tables.values()) {
      count += table.rows.size();
    }
    return count;
  }

  public synchronized boolean hasKey(GroupKey key) {
    return tables.containsKey(key);
  }

  public synchronized List<ColumnMeta> getColumns(GroupKey key) {
    return Collections.unmodifiableList(get(key).cols);
  }

  public synchronized List<List<Object>> getRows(GroupKey key) {
    return Collections.unmodifiableList(new ArrayList<>(get(key).rows));
  }

  /**
   * Values of one column of the table with the given key.
   */
  public synchronized List<Object> column(GroupKey key, String label) {
    KeyedRows table = get(key);
    int index = -1;
    for (int j = 0; j < table.cols.size(); j++) {
      if (table.cols.get(j).getLabel().equals(label)) {
        index = j;
        break;
      }
    }
    if (index == -1) {
      throw new IllegalArgumentException("No column " + label + " in result " + name);
    }
    List<Object> values = new ArrayList<>(table.rows.size());
    for (List<Object> row : table.rows) {
      values.add(row.get(index));
    }
    return values;
  }

  /**
   * Number of flushes received for the key, normally one.
   */
  public synchronized int getFlushCount(GroupKey key) {
    return get(key).flushes;
  }

  private KeyedRows get(GroupKey key) {
    KeyedRows table = tables.get(key);
    if (table == null) {
      throw new IllegalArgumentException("No table with key " + key + " in result " + name);
    }
    return table;
  }

  @Override
  public synchronized String toString() {
    return "ResultTable[" + name + ", tables=" + tables.size() + "]";
  }
}
