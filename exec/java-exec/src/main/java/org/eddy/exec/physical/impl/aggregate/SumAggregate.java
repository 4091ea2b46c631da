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

import com.google.common.primitives.UnsignedLong;

/**
 * Sum of the non-null values of numeric columns, of the input type.
 * Integer sums wrap on overflow.
 */
public class SumAggregate extends ColumnAggregate {

  public SumAggregate(List<String> columns) {
    super(columns);
  }

  @Override
  protected Accumulator newAccumulator(final ColumnMeta col) {
    switch (col.getType()) {
    case INT:
    case UINT:
      return new LongSum(col.getType());
    case FLOAT:
      return new FloatSum();
    default:
      throw unsupportedType("sum", col);
    }
  }

  private static class LongSum implements Accumulator {
    private final ColumnType type;
    private long sum;
    private boolean seen;

    LongSum(ColumnType type) {
      this.type = type;
    }

    @Override
    public void add(ValueArray values) {
      for (int i = 0; i < values.size(); i++) {
        if (values.isNull(i)) {
          continue;
        }
        Object value = values.getObject(i);
        sum += type == ColumnType.UINT ? ((UnsignedLong) value).longValue() : (Long) value;
        seen = true;
      }
    }

    @Override
    public ColumnType resultType() { return type; }

    @Override
    public Object result() {
      if (! seen) {
        return null;
      }
      return type == ColumnType.UINT ? UnsignedLong.fromLongBits(sum) : (Object) sum;
    }
  }

  private static class FloatSum implements Accumulator {
    private double sum;
    private boolean seen;

    @Override
    public void add(ValueArray values) {
      for (int i = 0; i < values.size(); i++) {
        if (! values.isNull(i)) {
          sum += (Double) values.getObject(i);
          seen = true;
        }
      }
    }

    @Override
    public ColumnType resultType() { return ColumnType.FLOAT; }

    @Override
    public Object result() { return seen ? sum : null; }
  }
}
