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
package org.eddy.exec.physical.impl.common;

import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.eddy.exec.record.GroupKey;

/**
 * Map from group key to per-key state. Values are never null: a null
 * return means the key has no entry.
 * <p>
 * Not thread safe. A lookup belongs to one operator, and the operator's
 * transport serializes the calls into it.
 */
public interface GroupLookup<V> {

  V lookup(GroupKey key);

  V lookupOrCreate(GroupKey key, Supplier<? extends V> factory);

  /**
   * Inserts or replaces the value for the key.
   */
  void set(GroupKey key, V value);

  /**
   * Removes the key.
   *
   * @return the prior value, or null if the key had none
   */
  V delete(GroupKey key);

  /**
   * Visits every entry. The order is fixed by the implementation and is
   * the same for every call within one run. The function may modify the
   * lookup; changes do not affect the current iteration.
   */
  void range(BiConsumer<GroupKey, V> fn);

  void clear();

  int size();
}
