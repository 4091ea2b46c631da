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

import org.eddy.common.config.EddyConfig;

public class RootAllocatorFactory {

  public static final String TOP_LEVEL_MAX_ALLOC = EddyConfig.append(EddyConfig.MEMORY_PARENT, "top.max");

  private RootAllocatorFactory() { }

  /**
   * Creates a root allocator whose limit comes from
   * <tt>eddy.memory.top.max</tt>.
   */
  public static BufferAllocator newRoot(EddyConfig config) {
    return new RootAllocator(config.getBytes(TOP_LEVEL_MAX_ALLOC));
  }
}
