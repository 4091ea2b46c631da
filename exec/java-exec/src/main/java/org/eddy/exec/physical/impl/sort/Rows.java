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
package org.eddy.exec.physical.impl.sort;

import java.util.List;

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;

/**
 * Conversions between views and materialized rows, for the operators
 * that reorder rows.
 */
final class Rows {

  private Rows() { }

  static void addRows(TableView view, List<Object[]> rows) {
    for (int i = 0; i < view.len(); i++) {
      Object[] row = new Object[view.nCols()];
      for (int j = 0; j < row.length; j++) {
        row[j] = view.values(j).getObject(i);
      }
      rows.add(row);
    }
  }

  static TableBuffer build(GroupKey key, List<ColumnMeta> schema, List<Object[]> rows,
      BufferAllocator allocator) {
    ArrayTableBuilder builder = new ArrayTableBuilder(key, allocator);
    builder.addCols(schema);
    for (Object[] row : rows) {
      for (int j = 0; j < row.length; j++) {
        builder.appendValue(j, row[j]);
      }
      builder.finishRow();
    }
    return builder.build();
  }
}
