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
package org.eddy.exec.physical.base;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One node of a physical plan: an id unique within the plan, the spec of
 * the operator to run, and the ids of the nodes it reads from.
 */
@JsonPropertyOrder({"@id", "spec", "inputs"})
public class PlanNode {

  private final String id;
  private final ProcedureSpec spec;
  private final List<String> inputs;

  @JsonCreator
  public PlanNode(@JsonProperty("@id") String id,
                  @JsonProperty("spec") ProcedureSpec spec,
                  @JsonProperty("inputs") List<String> inputs) {
    this.id = Preconditions.checkNotNull(id, "plan node without an id");
    this.spec = Preconditions.checkNotNull(spec, "plan node %s without a spec", id);
    this.inputs = inputs == null ? Collections.<String>emptyList() : ImmutableList.copyOf(inputs);
  }

  public PlanNode(String id, ProcedureSpec spec, String... inputs) {
    this(id, spec, ImmutableList.copyOf(inputs));
  }

  @JsonProperty("@id")
  public String getId() { return id; }

  @JsonProperty("spec")
  public ProcedureSpec getSpec() { return spec; }

  @JsonProperty("inputs")
  public List<String> getInputs() { return inputs; }

  @JsonIgnore
  public String getKind() { return spec.getKind(); }

  /**
   * Number of parallel instances, 1 if the node has no parallel-run
   * attribute.
   */
  @JsonIgnore
  public int getParallelFactor() {
    ParallelRunAttribute attr = spec.getParallelRun();
    return attr == null ? 1 : attr.getFactor();
  }

  public <R, A> R accept(PlanVisitor<R, A> visitor, A arg) {
    return spec.accept(visitor, this, arg);
  }

  @Override
  public String toString() {
    return "PlanNode[" + id + ": " + spec.getKind() + " " + inputs + "]";
  }
}
