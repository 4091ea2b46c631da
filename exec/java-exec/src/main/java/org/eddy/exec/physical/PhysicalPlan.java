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
package org.eddy.exec.physical;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.physical.base.PlanNode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;

/**
 * A directed acyclic graph of plan nodes, plus the resources the planner
 * assigned to the query. Nodes refer to their inputs by id. Roots are the
 * nodes no other node reads from; sources are the nodes without inputs.
 */
@JsonPropertyOrder({"resources", "nodes"})
public class PhysicalPlan {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(PhysicalPlan.class);

  /**
   * Resource settings chosen when the plan was built. A zero value means
   * "not set": the engine computes its own.
   */
  public static class Resources {

    private final int concurrencyQuota;
    private final long memoryBytesQuota;

    @JsonCreator
    public Resources(@JsonProperty("concurrencyQuota") int concurrencyQuota,
                     @JsonProperty("memoryBytesQuota") long memoryBytesQuota) {
      this.concurrencyQuota = concurrencyQuota;
      this.memoryBytesQuota = memoryBytesQuota;
    }

    public static Resources none() {
      return new Resources(0, 0);
    }

    @JsonProperty("concurrencyQuota")
    public int getConcurrencyQuota() { return concurrencyQuota; }

    @JsonProperty("memoryBytesQuota")
    public long getMemoryBytesQuota() { return memoryBytesQuota; }
  }

  private final Resources resources;
  private final List<PlanNode> nodes;
  private final Map<String, PlanNode> nodeMap = new LinkedHashMap<>();
  private final ListMultimap<String, PlanNode> successors = ArrayListMultimap.create();

  @JsonCreator
  public PhysicalPlan(@JsonProperty("resources") Resources resources,
                      @JsonProperty("nodes") List<PlanNode> nodes) {
    this.resources = resources == null ? Resources.none() : resources;
    this.nodes = nodes == null ? Collections.<PlanNode>emptyList() : ImmutableList.copyOf(nodes);
    for (PlanNode node : this.nodes) {
      if (nodeMap.put(node.getId(), node) != null) {
        throw UserException.internalError()
            .message("duplicate plan node id %s", node.getId())
            .build(logger);
      }
    }
    for (PlanNode node : this.nodes) {
      for (String input : node.getInputs()) {
        if (! nodeMap.containsKey(input)) {
          throw UserException.internalError()
              .message("plan node %s refers to unknown input %s", node.getId(), input)
              .build(logger);
        }
        successors.put(input, node);
      }
    }
  }

  public PhysicalPlan(List<PlanNode> nodes) {
    this(Resources.none(), nodes);
  }

  @JsonProperty("resources")
  public Resources getResources() { return resources; }

  @JsonProperty("nodes")
  public List<PlanNode> getNodes() { return nodes; }

  public PlanNode getNode(String id) {
    PlanNode node = nodeMap.get(id);
    if (node == null) {
      throw UserException.internalError()
          .message("unknown plan node %s", id)
          .build(logger);
    }
    return node;
  }

  public List<PlanNode> getInputs(PlanNode node) {
    List<PlanNode> inputs = new ArrayList<>();
    for (String id : node.getInputs()) {
      inputs.add(getNode(id));
    }
    return inputs;
  }

  public List<PlanNode> getSuccessors(PlanNode node) {
    return Collections.unmodifiableList(successors.get(node.getId()));
  }

  /**
   * Nodes that no other node reads from, in plan order.
   */
  @JsonIgnore
  public List<PlanNode> roots() {
    List<PlanNode> roots = new ArrayList<>();
    for (PlanNode node : nodes) {
      if (! successors.containsKey(node.getId())) {
        roots.add(node);
      }
    }
    return roots;
  }

  /**
   * Nodes without inputs, in plan order.
   */
  @JsonIgnore
  public List<PlanNode> sources() {
    List<PlanNode> sources = new ArrayList<>();
    for (PlanNode node : nodes) {
      if (node.getInputs().isEmpty()) {
        sources.add(node);
      }
    }
    return sources;
  }

  /**
   * Orders the nodes so that each node follows all of its inputs. Ties
   * keep plan order.
   *
   * @throws UserException if the plan contains a cycle
   */
  @JsonIgnore
  public List<PlanNode> topologicalOrder() {
    Map<String, Integer> pending = new HashMap<>();
    Deque<PlanNode> ready = new ArrayDeque<>();
    for (PlanNode node : nodes) {
      int count = node.getInputs().size();
      pending.put(node.getId(), count);
      if (count == 0) {
        ready.add(node);
      }
    }
    List<PlanNode> order = new ArrayList<>(nodes.size());
    while (! ready.isEmpty()) {
      PlanNode node = ready.poll();
      order.add(node);
      for (PlanNode succ : successors.get(node.getId())) {
        int count = pending.get(succ.getId()) - 1;
        pending.put(succ.getId(), count);
        if (count == 0) {
          ready.add(succ);
        }
      }
    }
    if (order.size() != nodes.size()) {
      throw UserException.internalError()
          .message("plan contains a cycle")
          .addContext("Ordered nodes", order.size())
          .addContext("Plan nodes", nodes.size())
          .build(logger);
    }
    return order;
  }
}
