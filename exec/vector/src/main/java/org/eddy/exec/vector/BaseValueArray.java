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

import org.eddy.exec.memory.BufferAllocator;

import com.google.common.base.Preconditions;

import io.netty.util.AbstractReferenceCounted;

/**
 * Common state of all arrays: the window <tt>[offset, offset + length)</tt>
 * over the type-specific storage, the null bitmap and the memory
 * accounting. A slice shares storage and the null bitmap with its parent
 * and keeps the parent alive; only the array that owns the storage
 * returns memory to the allocator.
 */
public abstract class BaseValueArray extends AbstractReferenceCounted implements ValueArray {

  protected final BitSet nulls;
  protected final int offset;
  protected final int length;
  private final BufferAllocator allocator;
  private final long bufferSize;
  private final BaseValueArray parent;
  private int nullCount = -1;

  /**
   * Creates an array that owns its storage. The caller has already
   * reserved <tt>bufferSize</tt> bytes from the allocator.
   */
  protected BaseValueArray(BufferAllocator allocator, long bufferSize, BitSet nulls, int length) {
    this.allocator = Preconditions.checkNotNull(allocator, "allocator cannot be null");
    this.bufferSize = bufferSize;
    this.nulls = nulls;
    this.offset = 0;
    this.length = length;
    this.parent = null;
  }

  /**
   * Creates a slice of a parent array.
   */
  protected BaseValueArray(BaseValueArray parent, int offset, int length) {
    this.allocator = null;
    this.bufferSize = 0;
    this.nulls = parent.nulls;
    this.offset = offset;
    this.length = length;
    this.parent = parent;
  }

  @Override
  public int size() { return length; }

  @Override
  public boolean isNull(int index) {
    checkIndex(index);
    return nulls.get(offset + index);
  }

  @Override
  public int getNullCount() {
    if (nullCount == -1) {
      nullCount = nulls.get(offset, offset + length).cardinality();
    }
    return nullCount;
  }

  @Override
  public long getBufferSize() { return bufferSize; }

  protected void checkIndex(int index) {
    if (index < 0 || index >= length) {
      throw new IndexOutOfBoundsException(
          String.format("index %d out of bounds for array of length %d", index, length));
    }
  }

  @Override
  public ValueArray slice(int start, int end) {
    Preconditions.checkPositionIndexes(start, end, length);
    retain();
    return newSlice(offset + start, end - start);
  }

  /**
   * Creates an array of the same class over this array's storage.
   */
  protected abstract BaseValueArray newSlice(int sliceOffset, int sliceLength);

  protected BaseValueArray parent() { return parent; }

  @Override
  protected void deallocate() {
    if (parent != null) {
      parent.release();
    } else {
      allocator.release(bufferSize);
    }
  }

  @Override
  public ValueArray retain() {
    super.retain();
    return this;
  }

  @Override
  public ValueArray touch(Object hint) {
    return this;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(getClass().getSimpleName())
       .append("[");
    int n = Math.min(length, 10);
    for (int i = 0; i < n; i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(getObject(i));
    }
    if (n < length) {
      buf.append(", ...");
    }
    return buf.append("]").toString();
  }

  static long bitmapSize(int n) {
    return (n + 7) / 8;
  }
}
