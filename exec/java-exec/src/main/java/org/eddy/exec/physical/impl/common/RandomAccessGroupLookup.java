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

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.eddy.exec.record.GroupKey;

import com.google.common.base.Preconditions;

/**
 * Hash-based lookup. Iteration follows the order in which keys were
 * first inserted.
 */
public class RandomAccessGroupLookup<V> implements GroupLookup<V> {

  private final Map<GroupKey, V> entries;

  public RandomAccessGroupLookup() {
    this(new LinkedHashMap<GroupKey, V>());
  }

  protected RandomAccessGroupLookup(Map<GroupKey, V> entries) {
    this.entries = entries;
  }

  @Override
  public V lookup(GroupKey key) {
    return entries.get(key);
  }

  @Override
  public V lookupOrCreate(GroupKey key, Supplier<? extends V> factory) {
    V value = entries.get(key);
    if (value == null) {
      value = Preconditions.checkNotNull(factory.get(), "factory returned null for key %s", key);
      entries.put(key, value);
    }
    return value;
  }

  @Override
  public void set(GroupKey key, V value) {
    entries.put(key, Preconditions.checkNotNull(value));
  }

  @Override
  public V delete(GroupKey key) {
    return entries.remove(key);
  }

  @Override
  public void range(BiConsumer<GroupKey, V> fn) {
    // Copies, since a sorted map may reuse its entry objects on removal.
    List<Map.Entry<GroupKey, V>> snapshot = new ArrayList<>(entries.size());
    for (Map.Entry<GroupKey, V> entry : entries.entrySet()) {
      snapshot.add(new AbstractMap.SimpleImmutableEntry<>(entry));
    }
    for (Map.Entry<GroupKey, V> entry : snapshot) {
      fn.accept(entry.getKey(), entry.getValue());
    }
  }

  @Override
  public void clear() {
    entries.clear();
  }

  @Override
  public int size() {
    return entries.size();
  }
}
