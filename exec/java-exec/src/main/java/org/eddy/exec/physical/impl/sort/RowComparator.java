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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.vector.TypeHelper;

/**
 * Orders materialized rows by a list of columns. Nulls sort first in
 * ascending order; descending order reverses the whole comparison.
 * Columns missing from the schema are ignored.
 */
public class RowComparator implements Comparator<Object[]> {

  private final int[] indexes;
  private final ColumnType[] types;
  private final boolean desc;

  public RowComparator(List<ColumnMeta> schema, List<String> columns, boolean desc) {
    List<Integer> found = new ArrayList<>();
    for (String label : columns) {
      int j = TableBuffer.colIndex(schema, label);
      if (j != -1) {
        found.add(j);
      }
    }
    indexes = new int[found.size()];
    types = new ColumnType[found.size()];
    for (int c = 0; c < indexes.length; c++) {
      indexes[c] = found.get(c);
      types[c] = schema.get(indexes[c]).getType();
    }
    this.desc = desc;
  }

  @Override
  public int compare(Object[] a, Object[] b) {
    for (int c = 0; c < indexes.length; c++) {
      int result = TypeHelper.compare(types[c], a[indexes[c]], b[indexes[c]]);
      if (result != 0) {
        return desc ? -result : result;
      }
    }
    return 0;
  }
}
