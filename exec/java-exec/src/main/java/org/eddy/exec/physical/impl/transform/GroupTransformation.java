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
package org.eddy.exec.physical.impl.transform;

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Operator whose output views may carry a different group key than its
 * input. Flushes of input keys do not reach the downstream: the operator
 * flushes its own output keys when it knows they are complete.
 */
public interface GroupTransformation {

  void process(TableView view, Dataset dataset, BufferAllocator allocator);

  /**
   * Called when an input key is flushed. The default does nothing.
   */
  default void flushKey(GroupKey key, Dataset dataset, BufferAllocator allocator) { }

  /**
   * Called once when every parent finished without error, before the
   * dataset is closed.
   */
  default void finish(Dataset dataset, BufferAllocator allocator) { }

  /**
   * Called when the operator fails or a parent reports an error. Releases
   * anything the operator still holds.
   */
  default void discard() { }
}
