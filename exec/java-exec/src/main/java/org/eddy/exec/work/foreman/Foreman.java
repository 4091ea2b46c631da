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
package org.eddy.exec.work.foreman;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ExecConstants;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.ops.QueryContext;
import org.eddy.exec.physical.PhysicalPlan;
import org.eddy.exec.physical.base.PlanNode;
import org.eddy.exec.physical.config.YieldSpec;
import org.eddy.exec.physical.impl.OperatorCreatorRegistry;
import org.eddy.exec.physical.impl.Source;
import org.eddy.exec.physical.impl.protocol.DatasetId;
import org.eddy.exec.physical.impl.protocol.TransportDataset;
import org.eddy.exec.physical.impl.transform.AbstractTransport;
import org.eddy.exec.work.foreman.rm.ConcurrencyPlanner;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs one physical plan to completion.
 * <p>
 * The Foreman builds one dataset and one operator per plan node, in
 * topological order, and connects each operator to the datasets of its
 * inputs. Every yield and every root that is not a yield gets a result
 * collector. Sources then run on a worker pool sized by the
 * {@link ConcurrencyPlanner}; messages flow downstream synchronously on
 * the source's thread.
 * <p>
 * The first error wins. An error cancels the query so that unrelated
 * branches stop early; errors that arrive afterwards are logged and
 * dropped. Results collected before the error are kept.
 * <p>
 * A Foreman runs once. It owns the query context and closes it when the
 * query ends.
 */
public class Foreman implements ResultTransport.Listener, SourceRunner.ErrorHandler {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(Foreman.class);

  public static final String RESULT_KIND = "result";

  private final QueryContext queryContext;
  private final PhysicalPlan plan;
  private final OperatorCreatorRegistry registry;
  private final Map<String, ResultTable> results = new LinkedHashMap<>();
  private final List<ResultTransport> resultTransports = new ArrayList<>();
  private final List<SourceRunner> runners = new ArrayList<>();
  private CountDownLatch pendingResults;
  private UserException error;
  private int quota;
  private boolean started;

  public Foreman(QueryContext queryContext, PhysicalPlan plan, OperatorCreatorRegistry registry) {
    this.queryContext = queryContext;
    this.plan = plan;
    this.registry = registry;
  }

  public String getQueryId() { return queryContext.getQueryId(); }

  /**
   * Runs the query and waits for it to end.
   */
  public QueryResult run() {
    synchronized (this) {
      if (started) {
        throw UserException.internalError()
            .message("query %s already ran", getQueryId())
            .build(logger);
      }
      started = true;
    }
    logger.debug("Query {} starting with {} plan nodes", getQueryId(), plan.getNodes().size());
    try {
      setup();
      execute();
    } catch (RuntimeException e) {
      recordError(UserException.wrap(e, logger));
    } finally {
      closeQuery();
    }
    logger.debug("Query {} done{}", getQueryId(), error == null ? "" : ": " + error.getOriginalMessage());
    return new QueryResult(results, getError(), quota);
  }

  /**
   * Cancels a running query. Operators notice at their next row loop.
   */
  public void cancel() {
    queryContext.cancel("query cancelled by user");
  }

  public synchronized UserException getError() { return error; }

  private void setup() {
    quota = ConcurrencyPlanner.quota(plan, queryContext.getConcurrencyIncrease());
    Map<String, TransportDataset> datasets = new HashMap<>();
    for (PlanNode node : plan.topologicalOrder()) {
      List<DatasetId> parents = new ArrayList<>();
      for (String input : node.getInputs()) {
        parents.add(DatasetId.of(input));
      }
      DatasetId id = DatasetId.of(node.getId());
      OperatorContext context = queryContext.newOperatorContext(id, node.getKind(), parents);
      if (node.getInputs().isEmpty()) {
        int instances = node.getParallelFactor();
        TransportDataset dataset = new TransportDataset(id, context.getAllocator(), instances);
        for (int i = 0; i < instances; i++) {
          Source source = registry.createSource(node.getSpec(), i, instances, context, dataset);
          runners.add(new SourceRunner(node.getId() + "-" + i, source, this));
        }
        datasets.put(node.getId(), dataset);
      } else {
        TransportDataset dataset = new TransportDataset(id, context.getAllocator());
        AbstractTransport transport = registry.createTransport(node.getSpec(), context, dataset);
        for (String input : new HashSet<>(node.getInputs())) {
          datasets.get(input).addTransformation(transport);
        }
        datasets.put(node.getId(), dataset);
      }
    }
    attachResults(datasets);
    pendingResults = new CountDownLatch(resultTransports.size());
    logger.debug("Query {}: {} sources, {} results, concurrency quota {}",
        getQueryId(), runners.size(), resultTransports.size(), quota);
  }

  private void attachResults(Map<String, TransportDataset> datasets) {
    Set<String> yieldNames = new HashSet<>();
    for (PlanNode node : plan.getNodes()) {
      if (! YieldSpec.KIND.equals(node.getKind())) {
        continue;
      }
      String name = ((YieldSpec) node.getSpec()).getName();
      if (! yieldNames.add(name)) {
        throw UserException.invalidError()
            .message("duplicate yield name \"%s\"", name)
            .build(logger);
      }
      attachResult(node, name, datasets);
    }
    for (PlanNode node : plan.roots()) {
      if (YieldSpec.KIND.equals(node.getKind())) {
        continue;
      }
      if (yieldNames.contains(ExecConstants.DEFAULT_RESULT_NAME)) {
        throw UserException.invalidError()
            .message("duplicate yield name \"%s\"", ExecConstants.DEFAULT_RESULT_NAME)
            .addContext("Plan root", node.getId())
            .build(logger);
      }
      attachResult(node, ExecConstants.DEFAULT_RESULT_NAME, datasets);
    }
  }

  private void attachResult(PlanNode node, String name, Map<String, TransportDataset> datasets) {
    ResultTable table = results.get(name);
    if (table == null) {
      table = new ResultTable(name);
      results.put(name, table);
    }
    DatasetId id = DatasetId.of(RESULT_KIND + ":" + name + ":" + node.getId());
    OperatorContext context = queryContext.newOperatorContext(id, RESULT_KIND,
        ImmutableList.of(DatasetId.of(node.getId())));
    ResultTransport transport = new ResultTransport(table, this, context,
        new TransportDataset(id, context.getAllocator()));
    datasets.get(node.getId()).addTransformation(transport);
    resultTransports.add(transport);
  }

  private void execute() {
    int poolSize = Math.min(quota, queryContext.getConfig().getInt(ExecConstants.CONCURRENCY_MAX));
    poolSize = Math.max(1, poolSize);
    ListeningExecutorService pool = MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(poolSize, new ThreadFactoryBuilder()
            .setNameFormat("eddy-" + getQueryId() + "-%d")
            .setDaemon(true)
            .build()));
    try {
      List<ListenableFuture<?>> futures = new ArrayList<>();
      for (SourceRunner runner : runners) {
        futures.add(pool.submit(runner));
      }
      awaitResults();
      Futures.successfulAsList(futures).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      queryContext.cancel("interrupted");
      recordError(UserException.canceledError()
          .message("query interrupted")
          .addContext("Query", getQueryId())
          .build(logger));
    } catch (ExecutionException e) {
      recordError(UserException.wrap(e.getCause(), logger));
    } finally {
      pool.shutdown();
    }
  }

  private void awaitResults() throws InterruptedException {
    long timeout = queryContext.getConfig().getMillis(ExecConstants.QUERY_TIMEOUT);
    if (timeout > 0 && ! pendingResults.await(timeout, TimeUnit.MILLISECONDS)) {
      logger.warn("Query {} timed out after {} ms", getQueryId(), timeout);
      recordError(UserException.canceledError()
          .message("query timed out after %d ms", timeout)
          .addContext("Query", getQueryId())
          .build(logger));
      queryContext.cancel("query timed out");
    }
    pendingResults.await();
  }

  @Override
  public void resultFinished(ResultTransport transport, UserException error) {
    if (error != null) {
      recordError(error);
    }
    logger.debug("Query {}: {} finished", getQueryId(), transport.getTable().getName());
    pendingResults.countDown();
  }

  @Override
  public void sourceFailed(UserException error) {
    recordError(error);
  }

  /**
   * Keeps the first error, preferring any error over a cancellation,
   * and cancels the query.
   */
  private void recordError(UserException newError) {
    synchronized (this) {
      if (error == null
          || (error.getErrorType() == ErrorType.CANCELED && newError.getErrorType() != ErrorType.CANCELED)) {
        error = newError;
      } else if (error != newError) {
        if (newError.getErrorType() == ErrorType.CANCELED
            || newError.getOriginalMessage().equals(error.getOriginalMessage())) {
          logger.debug("Query {}: dropping error after the first: {}", getQueryId(), newError.getOriginalMessage());
        } else {
          logger.warn("Query {}: dropping error after the first: {}", getQueryId(), newError.getOriginalMessage());
        }
      }
    }
    queryContext.cancel(newError.getOriginalMessage());
  }

  private void closeQuery() {
    try {
      queryContext.close();
    } catch (RuntimeException e) {
      recordError(UserException.internalError(e)
          .message("failed to release query resources")
          .addContext("Query", getQueryId())
          .build(logger));
    }
  }
}
