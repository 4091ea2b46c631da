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

/**
 * Services the execution framework provides to one operator instance:
 * memory, the identity of the operator's dataset and of its parents,
 * and access to the query-wide state such as cancellation and options.
 */
public interface OperatorContext {

  DatasetId getId();

  /**
   * Procedure kind of the plan node this operator runs.
   */
  String getOperatorKind();

  /**
   * Allocator to use for every buffer the operator creates. Buffers
   * outlive the operator's own handler; the consumer releases them.
   */
  BufferAllocator getAllocator();

  /**
   * Datasets this operator consumes from, in plan order.
   */
  List<DatasetId> getParents();

  QueryContext getQueryContext();

  /**
   * Throws a canceled <tt>UserException</tt> once the query was
   * cancelled. Operators call this at least once per row loop.
   */
  void checkContinue();

  void close();
}
