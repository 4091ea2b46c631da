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

/**
 * Visitor over plan nodes, dispatched on the category of the node's
 * spec. Every method defaults to {@link #visitOperator}.
 *
 * @param <R> return value from the visitor
 * @param <A> argument passed to the visitor
 */
public class PlanVisitor<R, A> {

  public R visitSource(PlanNode node, A arg) {
    return visitOperator(node, arg);
  }

  public R visitUnion(PlanNode node, A arg) {
    return visitOperator(node, arg);
  }

  public R visitYield(PlanNode node, A arg) {
    return visitOperator(node, arg);
  }

  public R visitOperator(PlanNode node, A arg) { return null; }
}
