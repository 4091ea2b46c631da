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
package org.eddy.exec.physical.config;

import org.eddy.exec.physical.base.AbstractProcedureSpec;
import org.eddy.exec.physical.base.PlanNode;
import org.eddy.exec.physical.base.PlanVisitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Merges the tables of all inputs into one stream.
 */
@JsonTypeName(UnionSpec.KIND)
public class UnionSpec extends AbstractProcedureSpec {

  public static final String KIND = "union";

  @JsonCreator
  public UnionSpec() { }

  @Override
  public String getKind() { return KIND; }

  @Override
  public <R, A> R accept(PlanVisitor<R, A> visitor, PlanNode node, A arg) {
    return visitor.visitUnion(node, arg);
  }
}
