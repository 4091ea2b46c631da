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
package org.eddy.exec.memory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Preconditions;

public abstract class BaseAllocator implements BufferAllocator {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(BaseAllocator.class);

  private final String name;
  private final BaseAllocator parent;
  private final Set<BaseAllocator> children = ConcurrentHashMap.newKeySet();
  private final AtomicLong allocated = new AtomicLong();
  private final AtomicLong peak = new AtomicLong();
  private volatile long limit;
  private volatile boolean closed;

  protected BaseAllocator(BaseAllocator parent, String name, long limit) {
    Preconditions.checkArgument(limit >= 0, "limit must be non-negative");
    this.parent = parent;
    this.name = name;
    this.limit = limit;
  }

  @Override
  public String getName() { return name; }

  @Override
  public BufferAllocator getParentAllocator() { return parent; }

  @Override
  public BufferAllocator newChildAllocator(String childName, long maxAllocation) {
    assertOpen();
    ChildAllocator child = new ChildAllocator(this, childName, Math.min(maxAllocation, limit));
    children.add(child);
    logger.trace("Allocator[{}] created child {}", name, childName);
    return child;
  }

  @Override
  public void reserve(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative reservation: %s", bytes);
    assertOpen();
    if (bytes == 0) {
      return;
    }
    if (parent != null) {
      parent.reserve(bytes);
    }
    long total = allocated.addAndGet(bytes);
    if (total > limit) {
      allocated.addAndGet(-bytes);
      if (parent != null) {
        parent.release(bytes);
      }
      throw new OutOfMemoryException(String.format(
          "Unable to reserve %d bytes in allocator %s: %d of %d bytes in use",
          bytes, name, total - bytes, limit));
    }
    peak.accumulateAndGet(total, Math::max);
  }

  @Override
  public void release(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative release: %s", bytes);
    if (bytes == 0) {
      return;
    }
    long total = allocated.addAndGet(-bytes);
    if (total < 0) {
      throw new IllegalStateException(String.format(
          "Allocator %s released %d bytes more than it reserved", name, -total));
    }
    if (parent != null) {
      parent.release(bytes);
    }
  }

  @Override
  public long getAllocatedMemory() { return allocated.get(); }

  @Override
  public long getPeakMemoryAllocation() { return peak.get(); }

  @Override
  public long getLimit() { return limit; }

  @Override
  public void setLimit(long limit) { this.limit = limit; }

  @Override
  public long getHeadroom() {
    long local = limit - allocated.get();
    if (parent == null) {
      return local;
    }
    return Math.min(local, parent.getHeadroom());
  }

  public boolean isClosed() { return closed; }

  private void assertOpen() {
    if (closed) {
      throw new IllegalStateException("Attempt to use closed allocator " + name);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    if (! children.isEmpty()) {
      throw new IllegalStateException(String.format(
          "Allocator[%s] closed with outstanding child allocators.\n%s", name, toVerboseString()));
    }
    long leaked = allocated.get();
    if (leaked != 0) {
      throw new IllegalStateException(String.format(
          "Memory was leaked by query. Memory leaked: (%d)\n%s", leaked, toVerboseString()));
    }
    closed = true;
    if (parent != null) {
      parent.children.remove(this);
    }
    logger.trace("Allocator[{}] closed, peak {} bytes", name, peak.get());
  }

  @Override
  public String toVerboseString() {
    StringBuilder buf = new StringBuilder();
    print(buf, 0);
    return buf.toString();
  }

  private void print(StringBuilder buf, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append("  ");
    }
    buf.append("Allocator(")
       .append(name)
       .append(") ")
       .append(allocated.get())
       .append("/")
       .append(peak.get())
       .append("/")
       .append(limit)
       .append(" (res/peak/limit)\n");
    for (BaseAllocator child : children) {
      child.print(buf, indent + 1);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[name=" + name + ", allocated=" + allocated.get() + "]";
  }
}
