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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;

/**
 * Keeps the first <tt>n</tt> rows of each table in sort order.
 */
@JsonTypeName(SortLimitSpec.KIND)
public class SortLimitSpec extends AbstractProcedureSpec {

  public static final String KIND = "sortLimit";

  private final int n;
  private final List<String> columns;
  private final boolean desc;

  @JsonCreator
  public SortLimitSpec(@JsonProperty("n") int n,
                       @JsonProperty("columns") List<String> columns,
                       @JsonProperty("desc") Boolean desc) {
    this.n = n;
    this.columns = columns == null || columns.isEmpty()
        ? ImmutableList.of(AggregateSpec.DEFAULT_VALUE_COLUMN)
        : ImmutableList.copyOf(columns);
    this.desc = desc == null ? defaultDesc() : desc;
  }

  protected boolean defaultDesc() { return false; }

  @Override
  public String getKind() { return KIND; }

  @JsonProperty("n")
  public int getN() { return n; }

  @JsonProperty("columns")
  public List<String> getColumns() { return columns; }

  @JsonProperty("desc")
  public boolean isDesc() { return desc; }
}
