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

import java.util.Collections;
import java.util.List;

import org.eddy.exec.physical.base.AbstractProcedureSpec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.collect.ImmutableList;

/**
 * Regroups rows. In <tt>by</tt> mode the new key is made of the listed
 * columns; in <tt>except</tt> mode of every column but the listed ones.
 */
@JsonTypeName(GroupSpec.KIND)
public class GroupSpec extends AbstractProcedureSpec {

  public static final String KIND = "group";
  public static final String MODE_BY = "by";
  public static final String MODE_EXCEPT = "except";

  private final String mode;
  private final List<String> columns;

  @JsonCreator
  public GroupSpec(@JsonProperty("mode") String mode,
                   @JsonProperty("columns") List<String> columns) {
    this.mode = mode == null ? MODE_BY : mode;
    this.columns = columns == null ? Collections.<String>emptyList() : ImmutableList.copyOf(columns);
  }

  public static GroupSpec by(String... columns) {
    return new GroupSpec(MODE_BY, ImmutableList.copyOf(columns));
  }

  public static GroupSpec except(String... columns) {
    return new GroupSpec(MODE_EXCEPT, ImmutableList.copyOf(columns));
  }

  @Override
  public String getKind() { return KIND; }

  @JsonProperty("mode")
  public String getMode() { return mode; }

  @JsonProperty("columns")
  public List<String> getColumns() { return columns; }
}
