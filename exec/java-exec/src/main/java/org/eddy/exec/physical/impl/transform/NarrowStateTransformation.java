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
import org.eddy.exec.record.TableView;

/**
 * Narrow operator with a state slot per group key.
 *
 * @param <S> state type
 */
public interface NarrowStateTransformation<S> {

  /**
   * Processes one view.
   *
   * @param state the state stored for the view's key, or null on the
   * first view of the key
   * @return the state to keep. Returning a different object than
   * <tt>state</tt> replaces the stored state; returning null removes it.
   * State is not cleared when the key is flushed.
   */
  S process(TableView view, S state, Dataset dataset, BufferAllocator allocator);
}
