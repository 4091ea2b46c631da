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

import java.time.Duration;
import java.util.BitSet;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;

/**
 * Lengths of time in nanoseconds: the {@link ColumnType#DURATION} type.
 */
public class IntervalArray extends LongBackedArray {

  IntervalArray(BufferAllocator allocator, long bufferSize, BitSet nulls, long[] data, int length) {
    super(allocator, bufferSize, nulls, data, length);
  }

  private IntervalArray(IntervalArray parent, int offset, int length) {
    super(parent, offset, length);
  }

  @Override
  public ColumnType getType() { return ColumnType.DURATION; }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : Duration.ofNanos(getLong(index));
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new IntervalArray(this, sliceOffset, sliceLength);
  }

  public static class Builder extends LongBuilder {

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.DURATION; }

    @Override
    protected void appendValue(Object value) {
      append(((Duration) value).toNanos());
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new IntervalArray(allocator, bufferSize, nulls, values, count);
    }
  }
}
