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

@JsonTypeName(SortSpec.KIND)
public class SortSpec extends AbstractProcedureSpec {

  public static final String KIND = "sort";

  private final List<String> columns;
  private final boolean desc;

  @JsonCreator
  public SortSpec(@JsonProperty("columns") List<String> columns,
                  @JsonProperty("desc") boolean desc) {
    this.columns = columns == null || columns.isEmpty()
        ? ImmutableList.of(AggregateSpec.DEFAULT_VALUE_COLUMN)
        : ImmutableList.copyOf(columns);
    this.desc = desc;
  }

  @Override
  public String getKind() { return KIND; }

  @JsonProperty("columns")
  public List<String> getColumns() { return columns; }

  @JsonProperty("desc")
  public boolean isDesc() { return desc; }
}
