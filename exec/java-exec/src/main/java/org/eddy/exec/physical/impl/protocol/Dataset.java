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
package org.eddy.exec.physical.impl.protocol;

import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Output port of one operator. The operator emits its results through
 * the dataset, which forwards them as messages to every downstream
 * transport. The dataset also keeps the operator's per-key state.
 *
 * <h4>Ownership</h4>
 * {@link #process(TableView)} takes over one reference to the view's
 * buffer. An operator that forwards a view it was given must retain it
 * first; an operator that built a new buffer passes its reference on.
 *
 * <h4>Errors</h4>
 * If a downstream transport fails, the failure is thrown out of
 * <tt>process()</tt> or <tt>flushKey()</tt>. The dataset still owes its
 * downstream a finish message: the caller must {@link #abort} it.
 *
 * <h4>Finish</h4>
 * Exactly one of {@link #close()} or {@link #abort(UserException)} takes
 * effect; later calls are ignored.
 */
public interface Dataset {

  DatasetId getId();

  /**
   * Allocator for buffers created by the owning operator.
   */
  BufferAllocator getAllocator();

  /**
   * Adds a downstream transport. All transports are added before the
   * first message is emitted.
   */
  void addTransformation(Transport transport);

  void process(TableView view);

  void flushKey(GroupKey key);

  void updateWatermarkForKey(GroupKey key, String columnName, long watermark);

  /**
   * Ends the stream successfully.
   */
  void close();

  /**
   * Ends the stream with an error.
   */
  void abort(UserException error);

  boolean isFinished();

  // Per-key state of the owning operator.

  <S> S lookup(GroupKey key);

  <S> S lookupOrCreate(GroupKey key, Supplier<S> factory);

  void set(GroupKey key, Object state);

  <S> S delete(GroupKey key);

  <S> void range(BiConsumer<GroupKey, S> fn);

  void clearState();
}
