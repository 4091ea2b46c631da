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
import org.eddy.exec.record.Table;

/**
 * Operator written against whole tables. The framework collects every
 * view of a key and hands the complete table over once the key is
 * flushed. The operator emits its result, including the flush of its
 * output key, on the dataset.
 */
public interface LegacyTransformation {

  /**
   * Processes one table. The operator must read the table with
   * {@link Table#forEach} or release it with {@link Table#done()}.
   */
  void process(Table table, Dataset dataset, BufferAllocator allocator);
}
