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
import java.util.function.Consumer;
import java.util.function.Function;

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.BufferedTableBuilder;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.Table;
import org.eddy.exec.record.TableBuffer;

/**
 * Table builders indexed by group key. A builder is created on first use
 * for a key and is removed from the cache when it is finalized into its
 * table. The finalized table carries the key the builder was created
 * with.
 *
 * @param <B> builder type
 * @param <T> type of the finalized table
 */
public class BuilderCache<B, T> {

  /**
   * Result of {@link BuilderCache#getOrCreate(GroupKey)}.
   */
  public static class Entry<B> {
    private final B builder;
    private final boolean created;

    Entry(B builder, boolean created) {
      this.builder = builder;
      this.created = created;
    }

    public B builder() { return builder; }

    /**
     * True if the builder was created by this call.
     */
    public boolean created() { return created; }
  }

  private final GroupLookup<B> builders;
  private final Function<GroupKey, B> factory;
  private final Function<B, T> finisher;
  private final Consumer<B> discarder;

  public BuilderCache(GroupLookup<B> builders, Function<GroupKey, B> factory,
      Function<B, T> finisher, Consumer<B> discarder) {
    this.builders = builders;
    this.factory = factory;
    this.finisher = finisher;
    this.discarder = discarder;
  }

  /**
   * Cache of builders that keep the views appended to them and emit them
   * as one logical {@link Table}.
   */
  public static BuilderCache<BufferedTableBuilder, Table> buffered() {
    return new BuilderCache<>(new RandomAccessGroupLookup<BufferedTableBuilder>(),
        BufferedTableBuilder::new, BufferedTableBuilder::table, BufferedTableBuilder::release);
  }

  /**
   * Cache of column builders that each emit one buffer, iterated in
   * insertion order.
   */
  public static BuilderCache<ArrayTableBuilder, TableBuffer> arrays(BufferAllocator allocator) {
    return arrays(new RandomAccessGroupLookup<ArrayTableBuilder>(), allocator);
  }

  public static BuilderCache<ArrayTableBuilder, TableBuffer> arrays(GroupLookup<ArrayTableBuilder> lookup,
      final BufferAllocator allocator) {
    return new BuilderCache<>(lookup,
        key -> new ArrayTableBuilder(key, allocator),
        ArrayTableBuilder::build,
        builder -> { });
  }

  public Entry<B> getOrCreate(GroupKey key) {
    B builder = builders.lookup(key);
    if (builder != null) {
      return new Entry<>(builder, false);
    }
    builder = factory.apply(key);
    builders.set(key, builder);
    return new Entry<>(builder, true);
  }

  public B get(GroupKey key) {
    return builders.lookup(key);
  }

  /**
   * Finalizes the builder for the key and removes it from the cache.
   *
   * @return the table, or null if the cache has no builder for the key
   */
  public T table(GroupKey key) {
    B builder = builders.delete(key);
    return builder == null ? null : finisher.apply(builder);
  }

  /**
   * Finalizes every builder, in the order of the underlying lookup, and
   * passes each table to the consumer. The cache is empty afterwards. If
   * the consumer fails, the builders not yet finalized are discarded.
   */
  public void forEach(final BiConsumer<GroupKey, T> fn) {
    try {
      builders.range((key, builder) -> {
        builders.delete(key);
        fn.accept(key, finisher.apply(builder));
      });
    } finally {
      clear();
    }
  }

  /**
   * Discards every builder without finalizing it.
   */
  public void clear() {
    builders.range((key, builder) -> discarder.accept(builder));
    builders.clear();
  }

  public int size() {
    return builders.size();
  }
}
