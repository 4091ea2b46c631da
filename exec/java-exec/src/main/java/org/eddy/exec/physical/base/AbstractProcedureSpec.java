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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public abstract class AbstractProcedureSpec implements ProcedureSpec {

  private ParallelRunAttribute parallelRun;

  @Override
  @JsonProperty("parallelRun")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public ParallelRunAttribute getParallelRun() { return parallelRun; }

  @JsonProperty("parallelRun")
  public void setParallelRun(ParallelRunAttribute parallelRun) {
    this.parallelRun = parallelRun;
  }

  @Override
  public <R, A> R accept(PlanVisitor<R, A> visitor, PlanNode node, A arg) {
    return visitor.visitOperator(node, arg);
  }

  @Override
  public String toString() {
    return getKind();
  }
}
