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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.impl.common.GroupLookup;
import org.eddy.exec.physical.impl.common.RandomAccessGroupLookup;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

import com.google.common.base.Preconditions;

/**
 * Dataset that delivers its messages synchronously, on the caller's
 * thread, to each downstream transport.
 * <p>
 * A dataset shared by several instances of a parallel source expects one
 * {@link #close()} per instance and finishes its downstream on the last
 * one. An abort from any instance finishes the downstream at once; views
 * the other instances emit afterwards are released and dropped.
 */
public class TransportDataset implements Dataset {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TransportDataset.class);

  private final DatasetId id;
  private final BufferAllocator allocator;
  private final List<Transport> downstream = new ArrayList<>();
  private final GroupLookup<Object> cache = new RandomAccessGroupLookup<>();
  private final AtomicInteger pendingCloses;
  private final AtomicBoolean finished = new AtomicBoolean();

  public TransportDataset(DatasetId id, BufferAllocator allocator) {
    this(id, allocator, 1);
  }

  public TransportDataset(DatasetId id, BufferAllocator allocator, int writers) {
    Preconditions.checkArgument(writers > 0);
    this.id = id;
    this.allocator = allocator;
    this.pendingCloses = new AtomicInteger(writers);
  }

  @Override
  public DatasetId getId() { return id; }

  @Override
  public BufferAllocator getAllocator() { return allocator; }

  @Override
  public void addTransformation(Transport transport) {
    downstream.add(transport);
  }

  public List<Transport> getDownstream() { return downstream; }

  @Override
  public void process(TableView view) {
    if (finished.get()) {
      // Another writer of a shared dataset aborted it.
      logger.debug("Dropping view sent to finished dataset {}", id);
      view.release();
      return;
    }
    sendMessage(new ProcessViewMessage(id, view));
  }

  @Override
  public void flushKey(GroupKey key) {
    sendMessage(new FlushKeyMessage(id, key));
  }

  @Override
  public void updateWatermarkForKey(GroupKey key, String columnName, long watermark) {
    sendMessage(new WatermarkKeyMessage(id, columnName, watermark, key));
  }

  @Override
  public void close() {
    if (pendingCloses.decrementAndGet() > 0) {
      return;
    }
    finish(null);
  }

  @Override
  public void abort(UserException error) {
    Preconditions.checkNotNull(error);
    finish(error);
  }

  private void finish(UserException error) {
    if (!finished.compareAndSet(false, true)) {
      logger.trace("Dataset {} already finished", id);
      return;
    }
    logger.debug("Dataset {} finished{}", id, error == null ? "" : " with error");
    cache.clear();
    sendMessage(new FinishMessage(id, error));
  }

  @Override
  public boolean isFinished() {
    return finished.get();
  }

  /**
   * Sends the message to every downstream transport. A single receiver
   * gets the original; several receivers each get a copy and the
   * original is acknowledged here. Every receiver gets the message even
   * if an earlier one fails, so that each sees its finish; the first
   * failure is rethrown afterwards.
   */
  private void sendMessage(Message message) {
    if (downstream.isEmpty()) {
      message.ack();
      return;
    }
    if (downstream.size() == 1) {
      downstream.get(0).processMessage(message);
      return;
    }
    RuntimeException failure = null;
    try {
      for (Transport transport : downstream) {
        try {
          transport.processMessage(message.dup());
        } catch (RuntimeException e) {
          if (failure == null) {
            failure = e;
          } else if (failure != e) {
            failure.addSuppressed(e);
          }
        }
      }
    } finally {
      message.ack();
    }
    if (failure != null) {
      throw failure;
    }
  }

  @SuppressWarnings("unchecked")
  @Override
  public <S> S lookup(GroupKey key) {
    return (S) cache.lookup(key);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <S> S lookupOrCreate(GroupKey key, Supplier<S> factory) {
    return (S) cache.lookupOrCreate(key, factory);
  }

  @Override
  public void set(GroupKey key, Object state) {
    cache.set(key, state);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <S> S delete(GroupKey key) {
    return (S) cache.delete(key);
  }

  @SuppressWarnings("unchecked")
  @Override
  public <S> void range(final BiConsumer<GroupKey, S> fn) {
    cache.range((key, value) -> fn.accept(key, (S) value));
  }

  @Override
  public void clearState() {
    cache.clear();
  }

  @Override
  public String toString() {
    return "TransportDataset[" + id + ", downstream=" + downstream.size() + "]";
  }
}
