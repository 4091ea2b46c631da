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
 * Accumulates values for one array. A builder can be used once:
 * {@link #build()} hands the storage to the new array.
 */
public abstract class ArrayBuilder {

  protected static final int INITIAL_CAPACITY = 16;

  protected final BufferAllocator allocator;
  protected BitSet nulls = new BitSet();
  protected int count;
  private boolean built;

  protected ArrayBuilder(BufferAllocator allocator) {
    this.allocator = allocator;
  }

  public abstract ColumnType getType();

  public int size() { return count; }

  public void appendNull() {
    ensureCapacity(count + 1);
    nulls.set(count);
    count++;
  }

  public void appendNulls(int n) {
    for (int i = 0; i < n; i++) {
      appendNull();
    }
  }

  /**
   * Appends a Java value of this builder's type, or a null.
   *
   * @throws IllegalArgumentException if the value is of the wrong class
   */
  public void appendObject(Object value) {
    if (value == null) {
      appendNull();
    } else {
      appendValue(TypeHelper.checkValue(getType(), value));
    }
  }

  /**
   * Copies one value, possibly null, from an array of the same type.
   */
  public void appendFrom(ValueArray source, int index) {
    if (source.isNull(index)) {
      appendNull();
    } else {
      appendValue(source.getObject(index));
    }
  }

  protected abstract void appendValue(Object value);

  protected abstract void ensureCapacity(int n);

  /**
   * Estimated memory held by the values appended so far.
   */
  protected abstract long dataSize();

  /**
   * Reserves memory for the values and creates the array.
   */
  public ValueArray build() {
    if (built) {
      throw new IllegalStateException("array builder already used");
    }
    built = true;
    long size = dataSize() + BaseValueArray.bitmapSize(count);
    allocator.reserve(size);
    return newArray(size);
  }

  protected abstract ValueArray newArray(long bufferSize);

  protected static int grow(int current, int needed) {
    int capacity = Math.max(current, INITIAL_CAPACITY);
    while (capacity < needed) {
      capacity *= 2;
    }
    return capacity;
  }
}
