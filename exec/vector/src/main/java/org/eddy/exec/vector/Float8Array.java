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
 * 64-bit floating point values: the {@link ColumnType#FLOAT} type.
 */
public class Float8Array extends BaseValueArray {

  private final double[] data;

  Float8Array(BufferAllocator allocator, long bufferSize, BitSet nulls, double[] data, int length) {
    super(allocator, bufferSize, nulls, length);
    this.data = data;
  }

  private Float8Array(Float8Array parent, int offset, int length) {
    super(parent, offset, length);
    this.data = parent.data;
  }

  @Override
  public ColumnType getType() { return ColumnType.FLOAT; }

  public double getDouble(int index) {
    checkIndex(index);
    return data[offset + index];
  }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : Double.valueOf(getDouble(index));
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new Float8Array(this, sliceOffset, sliceLength);
  }

  public static class Builder extends ArrayBuilder {

    private double[] values = new double[0];

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.FLOAT; }

    public void append(double value) {
      ensureCapacity(count + 1);
      values[count++] = value;
    }

    @Override
    protected void appendValue(Object value) {
      append((Double) value);
    }

    @Override
    protected void ensureCapacity(int n) {
      if (n > values.length) {
        values = Arrays.copyOf(values, grow(values.length, n));
      }
    }

    @Override
    protected long dataSize() {
      return 8L * count;
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new Float8Array(allocator, bufferSize, nulls, values, count);
    }
  }
}
