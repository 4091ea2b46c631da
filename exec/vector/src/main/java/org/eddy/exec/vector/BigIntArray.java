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

import java.util.BitSet;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;

/**
 * Signed 64-bit integers: the {@link ColumnType#INT} type.
 */
public class BigIntArray extends LongBackedArray {

  BigIntArray(BufferAllocator allocator, long bufferSize, BitSet nulls, long[] data, int length) {
    super(allocator, bufferSize, nulls, data, length);
  }

  private BigIntArray(BigIntArray parent, int offset, int length) {
    super(parent, offset, length);
  }

  @Override
  public ColumnType getType() { return ColumnType.INT; }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : Long.valueOf(getLong(index));
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new BigIntArray(this, sliceOffset, sliceLength);
  }

  public static class Builder extends LongBuilder {

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.INT; }

    @Override
    protected void appendValue(Object value) {
      append((Long) value);
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new BigIntArray(allocator, bufferSize, nulls, values, count);
    }
  }
}
