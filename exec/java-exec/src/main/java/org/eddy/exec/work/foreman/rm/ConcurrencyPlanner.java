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
package org.eddy.exec.work.foreman.rm;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eddy.exec.physical.PhysicalPlan;
import org.eddy.exec.physical.base.PlanNode;
import org.eddy.exec.physical.base.PlanVisitor;
import org.eddy.exec.physical.config.YieldSpec;

/**
 * Computes the number of workers a query may use.
 * <p>
 * Each result branch of the plan gets one worker. A branch is the
 * subgraph below a plan root, or below a yield that sits in the middle of
 * a pipeline. Within a branch:
 * <ul>
 * <li>a source counts one worker,</li>
 * <li>a union counts the sum of its inputs, since every input runs at
 * the same time,</li>
 * <li>any other node counts the largest of its inputs,</li>
 * <li>a node with a parallel-run factor F counts F - 1 more.</li>
 * </ul>
 * Yields chained one after another on the same pipeline open a single
 * branch. The plan may carry its own quota, which replaces the computed
 * one. The query's increase is added last; the quota is never below one.
 */
public class ConcurrencyPlanner extends PlanVisitor<Integer, Void> {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ConcurrencyPlanner.class);

  private final PhysicalPlan plan;
  private final Map<String, Integer> memo = new HashMap<>();

  private ConcurrencyPlanner(PhysicalPlan plan) {
    this.plan = plan;
  }

  public static int quota(PhysicalPlan plan, int increase) {
    int base = plan.getResources().getConcurrencyQuota();
    if (base > 0) {
      logger.debug("Using concurrency quota {} from the plan", base);
    } else {
      base = new ConcurrencyPlanner(plan).compute();
    }
    int quota = Math.max(1, base + increase);
    logger.debug("Concurrency quota {} (base {}, increase {})", quota, base, increase);
    return quota;
  }

  private int compute() {
    int total = 0;
    for (PlanNode root : plan.roots()) {
      int branch = root.accept(this, null);
      logger.trace("Result branch at {} needs {}", root.getId(), branch);
      total += branch;
    }
    for (PlanNode node : plan.getNodes()) {
      if (isYield(node) && opensBranch(node)) {
        logger.trace("Yield {} opens a result branch", node.getId());
        total += 1;
      }
    }
    return total;
  }

  /**
   * A chain of yields opens a branch of its own when the pipeline goes on
   * after the last yield of the chain. Only the first yield of a chain is
   * considered.
   */
  private boolean opensBranch(PlanNode yield) {
    List<PlanNode> inputs = plan.getInputs(yield);
    if (inputs.size() == 1 && isYield(inputs.get(0))) {
      return false;
    }
    PlanNode last = yield;
    List<PlanNode> next = plan.getSuccessors(last);
    while (next.size() == 1 && isYield(next.get(0))) {
      last = next.get(0);
      next = plan.getSuccessors(last);
    }
    return ! next.isEmpty();
  }

  private static boolean isYield(PlanNode node) {
    return YieldSpec.KIND.equals(node.getKind());
  }

  private int extra(PlanNode node) {
    return node.getParallelFactor() - 1;
  }

  private int memoize(PlanNode node, int value) {
    memo.put(node.getId(), value);
    return value;
  }

  @Override
  public Integer visitSource(PlanNode node, Void arg) {
    return memoize(node, 1 + extra(node));
  }

  @Override
  public Integer visitUnion(PlanNode node, Void arg) {
    Integer known = memo.get(node.getId());
    if (known != null) {
      return known;
    }
    int sum = 0;
    for (PlanNode input : plan.getInputs(node)) {
      sum += input.accept(this, null);
    }
    return memoize(node, sum + extra(node));
  }

  @Override
  public Integer visitOperator(PlanNode node, Void arg) {
    Integer known = memo.get(node.getId());
    if (known != null) {
      return known;
    }
    int max = 0;
    for (PlanNode input : plan.getInputs(node)) {
      max = Math.max(max, input.accept(this, null));
    }
    return memoize(node, Math.max(max, 1) + extra(node));
  }
}
