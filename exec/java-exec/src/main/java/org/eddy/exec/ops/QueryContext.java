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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.eddy.common.AutoCloseables;
import org.eddy.common.config.EddyConfig;
import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ExecConstants;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.memory.RootAllocatorFactory;
import org.eddy.exec.physical.impl.protocol.DatasetId;

/**
 * Query-wide state shared by every operator of one execution: the root
 * allocator, configuration, per-query options and the cancellation
 * flag. Closing the context closes every operator context it created
 * and then the root allocator, so leaked buffers are detected at the end
 * of each query.
 */
public class QueryContext implements AutoCloseable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(QueryContext.class);

  private final String queryId;
  private final EddyConfig config;
  private final Map<String, Object> options;
  private final BufferAllocator allocator;
  private final List<OperatorContextImpl> operatorContexts = new ArrayList<>();
  private final AtomicReference<String> cancelReason = new AtomicReference<>();
  private boolean closed;

  public QueryContext(EddyConfig config) {
    this(config, Collections.<String, Object>emptyMap());
  }

  public QueryContext(EddyConfig config, Map<String, Object> options) {
    this.queryId = UUID.randomUUID().toString();
    this.config = config;
    this.options = Collections.unmodifiableMap(new HashMap<>(options));
    this.allocator = RootAllocatorFactory.newRoot(config);
  }

  public String getQueryId() { return queryId; }

  public EddyConfig getConfig() { return config; }

  public Map<String, Object> getOptions() { return options; }

  public BufferAllocator getAllocator() { return allocator; }

  /**
   * Returns an integer query option, falling back to the given
   * configuration key when the query does not set it.
   */
  public int getIntOption(String name, String configKey) {
    Object value = options.get(name);
    if (value == null) {
      return config.getInt(configKey);
    }
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    return Integer.parseInt(value.toString());
  }

  public int getConcurrencyIncrease() {
    return getIntOption(ExecConstants.CONCURRENCY_INCREASE_OPTION, ExecConstants.CONCURRENCY_INCREASE);
  }

  public synchronized OperatorContextImpl newOperatorContext(DatasetId id, String kind, List<DatasetId> parents) {
    BufferAllocator child = allocator.newChildAllocator(
        kind + ":" + id, config.getBytes(ExecConstants.OPERATOR_MAX_MEMORY));
    OperatorContextImpl context = new OperatorContextImpl(this, id, kind, parents, child);
    operatorContexts.add(context);
    return context;
  }

  /**
   * Marks the query as cancelled. Only the first reason is kept.
   *
   * @return true if this call cancelled the query
   */
  public boolean cancel(String reason) {
    if (cancelReason.compareAndSet(null, reason)) {
      logger.debug("Query {} cancelled: {}", queryId, reason);
      return true;
    }
    return false;
  }

  public boolean isCancelled() {
    return cancelReason.get() != null;
  }

  public void checkContinue() {
    String reason = cancelReason.get();
    if (reason != null) {
      throw UserException.canceledError()
          .message(reason)
          .addContext("Query", queryId)
          .build(logger);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    List<AutoCloseable> closeables = new ArrayList<AutoCloseable>(operatorContexts);
    closeables.add(allocator);
    operatorContexts.clear();
    AutoCloseables.close(closeables);
  }
}
