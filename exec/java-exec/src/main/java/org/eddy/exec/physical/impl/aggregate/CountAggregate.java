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
package org.eddy.exec.physical.impl.aggregate;

import java.util.List;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.vector.ValueArray;

/**
 * Number of non-null values. Accepts columns of any type.
 */
public class CountAggregate extends ColumnAggregate {

  public CountAggregate(List<String> columns) {
    super(columns);
  }

  @Override
  protected Accumulator newAccumulator(ColumnMeta col) {
    return new Accumulator() {
      private long count;

      @Override
      public void add(ValueArray values) {
        count += values.size() - values.getNullCount();
      }

      @Override
      public ColumnType resultType() { return ColumnType.INT; }

      @Override
      public Object result() { return count; }
    };
  }
}
