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

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.vector.ArrayBuilder;
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;

/**
 * Builds one {@link TableBuffer} for a group key, column by column.
 * Columns may be added after rows were appended; the new column is
 * back-filled with nulls. Rows are written a value at a time followed by
 * {@link #finishRow()}, which fills any column left short with a null.
 */
public class ArrayTableBuilder {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ArrayTableBuilder.class);

  private final GroupKey key;
  private final BufferAllocator allocator;
  private final List<ColumnMeta> cols = new ArrayList<>();
  private final List<ArrayBuilder> builders = new ArrayList<>();
  private int rowCount;
  private boolean built;

  public ArrayTableBuilder(GroupKey key, BufferAllocator allocator) {
    this.key = key;
    this.allocator = allocator;
  }

  public GroupKey key() { return key; }

  public List<ColumnMeta> cols() { return cols; }

  public int nCols() { return cols.size(); }

  public int nRows() { return rowCount; }

  public int colIndex(String label) {
    return TableBuffer.colIndex(cols, label);
  }

  /**
   * Adds a column, or returns the existing column with the same label.
   *
   * @return the column index
   * @throws UserException if a column with the label exists with another
   * type
   */
  public int addCol(ColumnMeta col) {
    int j = colIndex(col.getLabel());
    if (j != -1) {
      if (cols.get(j).getType() != col.getType()) {
        throw UserException.failedPreconditionError()
            .message("schema collision detected: column \"%s\" is both %s and %s",
                col.getLabel(), cols.get(j).getType(), col.getType())
            .addContext("Group key", key.toString())
            .build(logger);
      }
      return j;
    }
    if (col.getType() == ColumnType.INVALID) {
      throw UserException.internalError()
          .message("column \"%s\" has an invalid type", col.getLabel())
          .build(logger);
    }
    ArrayBuilder builder = TypeHelper.newBuilder(col.getType(), allocator);
    builder.appendNulls(rowCount);
    cols.add(col);
    builders.add(builder);
    return cols.size() - 1;
  }

  public int addCol(String label, ColumnType type) {
    return addCol(new ColumnMeta(label, type));
  }

  /**
   * Adds each column of a schema, in order.
   */
  public void addCols(List<ColumnMeta> schema) {
    for (ColumnMeta col : schema) {
      addCol(col);
    }
  }

  public void appendValue(int j, Object value) {
    builders.get(j).appendObject(value);
  }

  public void appendNull(int j) {
    builders.get(j).appendNull();
  }

  public void appendFrom(int j, ValueArray source, int index) {
    builders.get(j).appendFrom(source, index);
  }

  /**
   * Ends the current row: pads columns that received no value.
   */
  public void finishRow() {
    rowCount++;
    for (ArrayBuilder builder : builders) {
      if (builder.size() < rowCount) {
        builder.appendNull();
      }
      if (builder.size() != rowCount) {
        throw new IllegalStateException("more than one value appended to a column in a row");
      }
    }
  }

  /**
   * Appends every row of a view, matching columns by label. Columns of
   * the view not yet in this builder are added.
   */
  public void appendView(TableView view) {
    int[] map = new int[view.nCols()];
    for (int c = 0; c < view.nCols(); c++) {
      map[c] = addCol(view.col(c));
    }
    for (int i = 0; i < view.len(); i++) {
      for (int c = 0; c < view.nCols(); c++) {
        appendFrom(map[c], view.values(c), i);
      }
      finishRow();
    }
  }

  /**
   * Writes the key's value into each key column of the current row.
   */
  public void appendKeyValues() {
    for (int k = 0; k < key.nCols(); k++) {
      int j = colIndex(key.col(k).getLabel());
      if (j != -1) {
        appendValue(j, key.value(k));
      }
    }
  }

  public TableBuffer build() {
    if (built) {
      throw new IllegalStateException("table builder already used");
    }
    built = true;
    List<ValueArray> arrays = new ArrayList<>(builders.size());
    try {
      for (ArrayBuilder builder : builders) {
        arrays.add(builder.build());
      }
    } catch (RuntimeException e) {
      for (ValueArray arr : arrays) {
        arr.release();
      }
      throw e;
    }
    return new TableBuffer(key, cols, arrays);
  }
}
