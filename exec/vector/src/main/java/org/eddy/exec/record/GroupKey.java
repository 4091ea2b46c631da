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
import java.util.Comparator;
import java.util.List;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.vector.TypeHelper;

import com.google.common.base.Preconditions;

/**
 * Identifies the partition that all rows of a table share: an ordered
 * list of (column, value) entries. Values may be null.
 * <p>
 * Entry order is kept for display only. Equality, hashing and ordering
 * work on the form sorted by label, so <tt>{a=1,b=2}</tt> equals
 * <tt>{b=2,a=1}</tt>. Equality is type-sensitive: the same label with a
 * different type is a different key.
 * <p>
 * Ordering ({@link #compareTo(GroupKey)}) compares the sorted forms column
 * by column: labels first, then types, then values, with null before any
 * value. If all compared columns tie, the key with fewer columns is the
 * lesser.
 * <p>
 * Keys are immutable and may be shared freely across threads.
 */
public final class GroupKey implements Comparable<GroupKey> {

  public static final GroupKey EMPTY = new GroupKey(Collections.<ColumnMeta>emptyList(), Collections.emptyList());

  private final List<ColumnMeta> cols;
  private final List<Object> values;

  // Entry indexes ordered by label.

  private final int[] sorted;
  private int hash;

  public GroupKey(List<ColumnMeta> cols, List<?> values) {
    Preconditions.checkArgument(cols.size() == values.size(),
        "key has %s columns but %s values", cols.size(), values.size());
    List<Object> checked = new ArrayList<>(values.size());
    for (int i = 0; i < cols.size(); i++) {
      checked.add(TypeHelper.checkValue(cols.get(i).getType(), values.get(i)));
    }
    this.cols = Collections.unmodifiableList(new ArrayList<>(cols));
    this.values = Collections.unmodifiableList(checked);
    this.sorted = sortIndexes(this.cols);
  }

  private static int[] sortIndexes(List<ColumnMeta> cols) {
    List<Integer> indexes = new ArrayList<>(cols.size());
    for (int i = 0; i < cols.size(); i++) {
      indexes.add(i);
    }
    indexes.sort(Comparator.comparing(i -> cols.get(i).getLabel()));
    int[] result = new int[indexes.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = indexes.get(i);
    }
    return result;
  }

  public int nCols() { return cols.size(); }

  public ColumnMeta col(int i) { return cols.get(i); }

  public Object value(int i) { return values.get(i); }

  public boolean isNull(int i) { return values.get(i) == null; }

  public List<ColumnMeta> cols() { return cols; }

  public List<Object> values() { return values; }

  public boolean hasCol(String label) {
    return index(label) != -1;
  }

  /**
   * Position of the column with the given label, or -1.
   */
  public int index(String label) {
    for (int i = 0; i < cols.size(); i++) {
      if (cols.get(i).getLabel().equals(label)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * The value for a label, or null if the label is absent or its value is
   * null. Use {@link #hasCol(String)} to tell the two apart.
   */
  public Object labelValue(String label) {
    int i = index(label);
    return i == -1 ? null : values.get(i);
  }

  public boolean isSorted() {
    for (int i = 0; i < sorted.length; i++) {
      if (sorted[i] != i) {
        return false;
      }
    }
    return true;
  }

  /**
   * This key with entries ordered by label. Returns this key if it is
   * already sorted.
   */
  public GroupKey sorted() {
    if (isSorted()) {
      return this;
    }
    List<ColumnMeta> sortedCols = new ArrayList<>(sorted.length);
    List<Object> sortedValues = new ArrayList<>(sorted.length);
    for (int i : sorted) {
      sortedCols.add(cols.get(i));
      sortedValues.add(values.get(i));
    }
    return new GroupKey(sortedCols, sortedValues);
  }

  public boolean less(GroupKey other) {
    return compareTo(other) < 0;
  }

  @Override
  public int compareTo(GroupKey other) {
    int n = Math.min(nCols(), other.nCols());
    for (int i = 0; i < n; i++) {
      int a = sorted[i];
      int b = other.sorted[i];
      ColumnMeta aCol = cols.get(a);
      ColumnMeta bCol = other.cols.get(b);
      int cmp = aCol.getLabel().compareTo(bCol.getLabel());
      if (cmp != 0) {
        return cmp;
      }
      if (aCol.getType() != bCol.getType()) {
        return aCol.getType().compareTo(bCol.getType());
      }
      cmp = TypeHelper.compare(aCol.getType(), values.get(a), other.values.get(b));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(nCols(), other.nCols());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GroupKey)) {
      return false;
    }
    GroupKey other = (GroupKey) o;
    if (nCols() != other.nCols()) {
      return false;
    }
    for (int i = 0; i < sorted.length; i++) {
      int a = sorted[i];
      int b = other.sorted[i];
      if (! cols.get(a).equals(other.cols.get(b))) {
        return false;
      }
      if (! TypeHelper.valueEquals(cols.get(a).getType(), values.get(a), other.values.get(b))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0 && sorted.length > 0) {
      h = 1;
      for (int i : sorted) {
        ColumnType type = cols.get(i).getType();
        h = 31 * h + cols.get(i).hashCode();
        h = 31 * h + TypeHelper.valueHash(type, values.get(i));
      }
      hash = h;
    }
    return h;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder("{");
    for (int i = 0; i < cols.size(); i++) {
      if (i > 0) {
        buf.append(",");
      }
      buf.append(cols.get(i).getLabel())
         .append("=")
         .append(values.get(i));
    }
    return buf.append("}").toString();
  }
}
