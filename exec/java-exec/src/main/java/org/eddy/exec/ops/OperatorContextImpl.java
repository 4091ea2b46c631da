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
package org.eddy.exec.ops;

import java.util.List;

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.impl.protocol.DatasetId;

import com.google.common.collect.ImmutableList;

public class OperatorContextImpl implements OperatorContext, AutoCloseable {

  private final QueryContext queryContext;
  private final DatasetId id;
  private final String kind;
  private final List<DatasetId> parents;
  private final BufferAllocator allocator;
  private boolean closed;

  OperatorContextImpl(QueryContext queryContext, DatasetId id, String kind,
      List<DatasetId> parents, BufferAllocator allocator) {
    this.queryContext = queryContext;
    this.id = id;
    this.kind = kind;
    this.parents = ImmutableList.copyOf(parents);
    this.allocator = allocator;
  }

  @Override
  public DatasetId getId() { return id; }

  @Override
  public String getOperatorKind() { return kind; }

  @Override
  public BufferAllocator getAllocator() { return allocator; }

  @Override
  public List<DatasetId> getParents() { return parents; }

  @Override
  public QueryContext getQueryContext() { return queryContext; }

  @Override
  public void checkContinue() {
    queryContext.checkContinue();
  }

  /**
   * Closes the operator's allocator, which fails if buffers allocated by
   * this operator were never released.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    allocator.close();
  }

  @Override
  public String toString() {
    return "OperatorContext[" + kind + " " + id + "]";
  }
}
