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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Configuration of one plan node. The <tt>kind</tt> names the operator
 * that runs the node; it is also the JSON type discriminator. Concrete
 * specs are registered with the plan reader under their kind.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
public interface ProcedureSpec {

  @JsonIgnore
  String getKind();

  /**
   * Parallel-run attribute, or null if the node runs as one instance.
   */
  ParallelRunAttribute getParallelRun();

  /**
   * Calls the visitor method that matches the category of this spec.
   */
  <R, A> R accept(PlanVisitor<R, A> visitor, PlanNode node, A arg);
}
