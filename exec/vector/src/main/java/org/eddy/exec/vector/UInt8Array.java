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

import com.google.common.primitives.UnsignedLong;

/**
 * Unsigned 64-bit integers: the {@link ColumnType#UINT} type. Values
 * are stored as their bit pattern and surface as Guava
 * {@link UnsignedLong}.
 */
public class UInt8Array extends LongBackedArray {

  UInt8Array(BufferAllocator allocator, long bufferSize, BitSet nulls, long[] data, int length) {
    super(allocator, bufferSize, nulls, data, length);
  }

  private UInt8Array(UInt8Array parent, int offset, int length) {
    super(parent, offset, length);
  }

  @Override
  public ColumnType getType() { return ColumnType.UINT; }

  public UnsignedLong getUnsigned(int index) {
    return UnsignedLong.fromLongBits(getLong(index));
  }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : getUnsigned(index);
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new UInt8Array(this, sliceOffset, sliceLength);
  }

  public static class Builder extends LongBuilder {

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.UINT; }

    @Override
    protected void appendValue(Object value) {
      append(((UnsignedLong) value).longValue());
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new UInt8Array(allocator, bufferSize, nulls, values, count);
    }
  }
}
