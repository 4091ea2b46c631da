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

/**
 * Accounts for the memory held by column arrays. Allocators form a tree:
 * one root per query and one child per dataset. A reservation made on a
 * child is also charged to each of its ancestors, so a limit anywhere on
 * the path bounds it.
 * <p>
 * Arrays reserve their size when built and release it when their
 * reference count drops to zero. An allocator that still holds memory
 * when closed reports a leak.
 */
public interface BufferAllocator extends AutoCloseable {

  String getName();

  /**
   * Creates a child allocator whose reservations are charged to this one.
   *
   * @param name name used in leak reports
   * @param maxAllocation limit for the child, further bounded by this
   * allocator's own limit
   * @return the new child
   */
  BufferAllocator newChildAllocator(String name, long maxAllocation);

  /**
   * Reserves memory.
   *
   * @param bytes number of bytes to reserve
   * @throws OutOfMemoryException if the reservation would exceed the
   * limit of this allocator or of any ancestor
   */
  void reserve(long bytes);

  /**
   * Returns memory obtained from {@link #reserve(long)}.
   */
  void release(long bytes);

  long getAllocatedMemory();

  long getPeakMemoryAllocation();

  long getLimit();

  void setLimit(long limit);

  /**
   * Bytes that can still be reserved before hitting a limit on this
   * allocator or an ancestor.
   */
  long getHeadroom();

  BufferAllocator getParentAllocator();

  String toVerboseString();

  /**
   * Closes the allocator.
   *
   * @throws IllegalStateException if child allocators are still open or
   * memory is still reserved
   */
  @Override
  void close();
}
