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

import org.eddy.exec.expr.RowFunction;
import org.eddy.exec.physical.base.AbstractProcedureSpec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;

/**
 * Map applies a row function to every row. The function is code, so a
 * map node can be built in code but not read from JSON.
 */
@JsonTypeName(MapSpec.KIND)
public class MapSpec extends AbstractProcedureSpec {

  public static final String KIND = "map";

  private final RowFunction fn;
  private final boolean mergeKey;

  public MapSpec(RowFunction fn, boolean mergeKey) {
    this.fn = Preconditions.checkNotNull(fn);
    this.mergeKey = mergeKey;
  }

  @Override
  public String getKind() { return KIND; }

  @JsonIgnore
  public RowFunction getFn() { return fn; }

  public boolean isMergeKey() { return mergeKey; }
}
