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
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;

/**
 * Arithmetic mean of numeric columns, as a float.
 */
public class MeanAggregate extends ColumnAggregate {

  public MeanAggregate(List<String> columns) {
    super(columns);
  }

  @Override
  protected Accumulator newAccumulator(final ColumnMeta col) {
    if (! col.getType().isNumeric()) {
      throw unsupportedType("mean", col);
    }
    return new Accumulator() {
      private long count;
      private double sum;

      @Override
      public void add(ValueArray values) {
        for (int i = 0; i < values.size(); i++) {
          if (! values.isNull(i)) {
            sum += TypeHelper.toDouble(col.getType(), values.getObject(i));
            count++;
          }
        }
      }

      @Override
      public ColumnType resultType() { return ColumnType.FLOAT; }

      @Override
      public Object result() {
        return count == 0 ? null : (Object) (sum / count);
      }
    };
  }
}
