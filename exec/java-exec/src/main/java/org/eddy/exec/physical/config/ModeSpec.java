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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Most frequent value of one column. The result is written to
 * <tt>_value</tt>.
 */
@JsonTypeName(ModeSpec.KIND)
public class ModeSpec extends AbstractProcedureSpec {

  public static final String KIND = "mode";

  private final String column;

  @JsonCreator
  public ModeSpec(@JsonProperty("column") String column) {
    this.column = column == null ? AggregateSpec.DEFAULT_VALUE_COLUMN : column;
  }

  @Override
  public String getKind() { return KIND; }

  @JsonProperty("column")
  public String getColumn() { return column; }
}
