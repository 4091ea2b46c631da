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
 * Booleans packed one per bit: the {@link ColumnType#BOOL} type.
 */
public class BitArray extends BaseValueArray {

  private final BitSet bits;

  BitArray(BufferAllocator allocator, long bufferSize, BitSet nulls, BitSet bits, int length) {
    super(allocator, bufferSize, nulls, length);
    this.bits = bits;
  }

  private BitArray(BitArray parent, int offset, int length) {
    super(parent, offset, length);
    this.bits = parent.bits;
  }

  @Override
  public ColumnType getType() { return ColumnType.BOOL; }

  public boolean getBoolean(int index) {
    checkIndex(index);
    return bits.get(offset + index);
  }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : Boolean.valueOf(getBoolean(index));
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new BitArray(this, sliceOffset, sliceLength);
  }

  public static class Builder extends ArrayBuilder {

    private final BitSet values = new BitSet();

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.BOOL; }

    public void append(boolean value) {
      values.set(count++, value);
    }

    @Override
    protected void appendValue(Object value) {
      append((Boolean) value);
    }

    @Override
    protected void ensureCapacity(int n) { }

    @Override
    protected long dataSize() {
      return bitmapSize(count);
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new BitArray(allocator, bufferSize, nulls, values, count);
    }
  }
}
