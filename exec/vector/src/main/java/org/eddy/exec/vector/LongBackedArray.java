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

import org.eddy.exec.memory.BufferAllocator;

/**
 * Base for the 64-bit fixed width types that store their values as
 * <tt>long</tt>: signed and unsigned integers, times and durations.
 */
public abstract class LongBackedArray extends BaseValueArray {

  protected final long[] data;

  protected LongBackedArray(BufferAllocator allocator, long bufferSize, BitSet nulls, long[] data, int length) {
    super(allocator, bufferSize, nulls, length);
    this.data = data;
  }

  protected LongBackedArray(LongBackedArray parent, int offset, int length) {
    super(parent, offset, length);
    this.data = parent.data;
  }

  /**
   * Raw 64-bit value. Undefined for a null entry.
   */
  public long getLong(int index) {
    checkIndex(index);
    return data[offset + index];
  }

  public abstract static class LongBuilder extends ArrayBuilder {

    protected long[] values = new long[0];

    protected LongBuilder(BufferAllocator allocator) {
      super(allocator);
    }

    public void append(long value) {
      ensureCapacity(count + 1);
      values[count++] = value;
    }

    @Override
    public void appendFrom(ValueArray source, int index) {
      if (source.isNull(index)) {
        appendNull();
      } else {
        append(((LongBackedArray) source).getLong(index));
      }
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
  }
}
