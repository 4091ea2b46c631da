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

import java.util.List;

import org.eddy.exec.physical.base.AbstractProcedureSpec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

/**
 * Base for aggregates that reduce each target column of a table to one
 * value.
 */
public abstract class AggregateSpec extends AbstractProcedureSpec {

  public static final String DEFAULT_VALUE_COLUMN = "_value";

  private final List<String> columns;

  protected AggregateSpec(List<String> columns) {
    this.columns = columns == null || columns.isEmpty()
        ? ImmutableList.of(DEFAULT_VALUE_COLUMN)
        : ImmutableList.copyOf(columns);
  }

  @JsonProperty("columns")
  public List<String> getColumns() { return columns; }
}
