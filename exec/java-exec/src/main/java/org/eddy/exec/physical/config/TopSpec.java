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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * The <tt>n</tt> largest rows of each table: a sort-limit that sorts in
 * descending order unless told otherwise.
 */
@JsonTypeName(TopSpec.KIND)
public class TopSpec extends SortLimitSpec {

  public static final String KIND = "top";

  @JsonCreator
  public TopSpec(@JsonProperty("n") int n,
                 @JsonProperty("columns") List<String> columns,
                 @JsonProperty("desc") Boolean desc) {
    super(n, columns, desc);
  }

  @Override
  protected boolean defaultDesc() { return true; }

  @Override
  public String getKind() { return KIND; }
}
