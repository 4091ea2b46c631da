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
import java.util.Collections;
import java.util.List;

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;

import com.google.common.base.Preconditions;

import io.netty.util.AbstractReferenceCounted;

/**
 * A record batch: a group key plus one array per column, all of the same
 * length. The buffer owns one reference to each of its arrays and
 * releases them when its own count reaches zero. Immutable once created.
 * <p>
 * Key columns that appear in the schema hold the key's value in every
 * row; {@link #validate()} checks this along with the array lengths and
 * types.
 */
public class TableBuffer extends AbstractReferenceCounted {

  private final GroupKey key;
  private final List<ColumnMeta> cols;
  private final List<ValueArray> values;
  private final int length;

  /**
   * Creates a buffer that takes ownership of the given arrays.
   */
  public TableBuffer(GroupKey key, List<ColumnMeta> cols, List<ValueArray> values) {
    Preconditions.checkArgument(cols.size() == values.size(),
        "buffer has %s columns but %s arrays", cols.size(), values.size());
    this.key = Preconditions.checkNotNull(key);
    this.cols = Collections.unmodifiableList(new ArrayList<>(cols));
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
    this.length = values.isEmpty() ? 0 : values.get(0).size();
  }

  /**
   * Creates a buffer with the given schema and no rows.
   */
  public static TableBuffer empty(GroupKey key, List<ColumnMeta> cols, BufferAllocator allocator) {
    List<ValueArray> arrays = new ArrayList<>(cols.size());
    for (ColumnMeta col : cols) {
      arrays.add(TypeHelper.newBuilder(col.getType(), allocator).build());
    }
    return new TableBuffer(key, cols, arrays);
  }

  public GroupKey key() { return key; }

  public List<ColumnMeta> cols() { return cols; }

  public int nCols() { return cols.size(); }

  public ColumnMeta col(int j) { return cols.get(j); }

  public int len() { return length; }

  public boolean isEmpty() { return length == 0; }

  /**
   * The array for column <tt>j</tt>, borrowed from this buffer. Call
   * {@link ValueArray#retain()} to keep it beyond the buffer's lifetime.
   */
  public ValueArray values(int j) { return values.get(j); }

  /**
   * Position of the column with the given label, or -1.
   */
  public int colIndex(String label) {
    return colIndex(cols, label);
  }

  public static int colIndex(List<ColumnMeta> cols, String label) {
    for (int j = 0; j < cols.size(); j++) {
      if (cols.get(j).getLabel().equals(label)) {
        return j;
      }
    }
    return -1;
  }

  public TableView asView() {
    return new TableView(this);
  }

  /**
   * Checks the buffer invariants: unique labels, array types matching the
   * schema, equal lengths and constant key columns.
   *
   * @throws IllegalStateException if an invariant does not hold
   */
  public void validate() {
    for (int j = 0; j < cols.size(); j++) {
      ColumnMeta col = cols.get(j);
      ValueArray arr = values.get(j);
      if (colIndex(col.getLabel()) != j) {
        throw new IllegalStateException("duplicate column label " + col.getLabel());
      }
      if (arr.getType() != col.getType()) {
        throw new IllegalStateException(String.format(
            "column %s has an array of type %s", col, arr.getType()));
      }
      if (arr.size() != length) {
        throw new IllegalStateException(String.format(
            "column %s has length %d, expected %d", col.getLabel(), arr.size(), length));
      }
      int k = key.index(col.getLabel());
      if (k == -1) {
        continue;
      }
      if (key.col(k).getType() != col.getType()) {
        throw new IllegalStateException(String.format(
            "key column %s does not match schema column %s", key.col(k), col));
      }
      for (int i = 0; i < length; i++) {
        if (! TypeHelper.valueEquals(col.getType(), key.value(k), arr.getObject(i))) {
          throw new IllegalStateException(String.format(
              "row %d of key column %s is %s, key value is %s", i, col.getLabel(), arr.getObject(i), key.value(k)));
        }
      }
    }
  }

  @Override
  public TableBuffer retain() {
    super.retain();
    return this;
  }

  @Override
  public TableBuffer touch(Object hint) {
    return this;
  }

  @Override
  protected void deallocate() {
    for (ValueArray arr : values) {
      arr.release();
    }
  }

  @Override
  public String toString() {
    return "TableBuffer[key=" + key + ", cols=" + cols + ", len=" + length + "]";
  }
}
