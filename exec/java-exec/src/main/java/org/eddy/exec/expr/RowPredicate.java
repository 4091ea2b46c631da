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
package org.eddy.exec.expr;

import java.util.List;
import java.util.Set;

import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.Record;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Boolean function of one row, used by filter.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ComparisonPredicate.class, name = "compare")
})
public interface RowPredicate {

  /**
   * Labels of the columns the predicate reads.
   */
  Set<String> referencedColumns();

  /**
   * Checks the predicate against the schema of the rows it is about to
   * see. Called once per view, before any call to {@link #eval}.
   */
  void prepare(List<ColumnMeta> schema);

  boolean eval(Record row);
}
