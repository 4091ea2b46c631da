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

import java.time.Instant;
import java.util.BitSet;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;

/**
 * Points in time as nanoseconds since the Unix epoch: the
 * {@link ColumnType#TIME} type.
 */
public class TimeStampArray extends LongBackedArray {

  TimeStampArray(BufferAllocator allocator, long bufferSize, BitSet nulls, long[] data, int length) {
    super(allocator, bufferSize, nulls, data, length);
  }

  private TimeStampArray(TimeStampArray parent, int offset, int length) {
    super(parent, offset, length);
  }

  @Override
  public ColumnType getType() { return ColumnType.TIME; }

  @Override
  public Object getObject(int index) {
    return isNull(index) ? null : TypeHelper.toInstant(getLong(index));
  }

  @Override
  protected BaseValueArray newSlice(int sliceOffset, int sliceLength) {
    return new TimeStampArray(this, sliceOffset, sliceLength);
  }

  public static class Builder extends LongBuilder {

    public Builder(BufferAllocator allocator) {
      super(allocator);
    }

    @Override
    public ColumnType getType() { return ColumnType.TIME; }

    @Override
    protected void appendValue(Object value) {
      append(TypeHelper.toNanos((Instant) value));
    }

    @Override
    protected ValueArray newArray(long bufferSize) {
      return new TimeStampArray(allocator, bufferSize, nulls, values, count);
    }
  }
}
