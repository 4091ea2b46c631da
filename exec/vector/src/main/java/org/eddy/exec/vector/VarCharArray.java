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
package org.eddy.exec.vector;

import java.util.Arrays;
import java.util.BitSet;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;

/**
 * Strings: the {@link ColumnType#STRING} type.
 */
public class VarCharArray extends BaseValueArray {

  private final String[] data;

  VarCharArray(BufferAllocator allocator, long bufferSize, BitSet nulls, String[] data, int length) {
    super(allocator, bufferSize, nulls, length);
    this.data = data;
  }

  private VarCharArray(VarCharArray parent, int offset, int length) {
    super(parent, offset, length);
    this.data = parent.data;
  }

  @Override
  public ColumnType getType() { return ColumnType.STRING; }

  public String getString(int index) {
    checkIndex(index);
    return data[offset + index];
  }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : getString(index);
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new VarCharArray(this, sliceOffset, sliceLength);
  }

  public static class Builder extends ArrayBuilder {

    private String[] values = new String[0];
    private long charCount;

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.STRING; }

    public void append(String value) {
      if (value == null) {
        appendNull();
        return;
      }
      ensureCapacity(count + 1);
      values[count++] = value;
      charCount += value.length();
    }

    @Override
    protected void appendValue(Object value) {
      append((String) value);
    }

    @Override
    protected void ensureCapacity(int n) {
      if (n > values.length) {
        values = Arrays.copyOf(values, grow(values.length, n));
      }
    }

    // Offsets plus UTF-16 data.

    @Override
    protected long dataSize() {
      return 4L * (count + 1) + 2 * charCount;
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new VarCharArray(allocator, bufferSize, nulls, values, count);
    }
  }
}
