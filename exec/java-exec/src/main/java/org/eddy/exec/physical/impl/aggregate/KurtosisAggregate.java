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
 * Excess kurtosis of numeric columns, from population moments updated
 * one value at a time.
 */
public class KurtosisAggregate extends ColumnAggregate {

  public KurtosisAggregate(List<String> columns) {
    super(columns);
  }

  @Override
  protected Accumulator newAccumulator(ColumnMeta col) {
    if (! col.getType().isNumeric()) {
      throw unsupportedType("kurtosis", col);
    }
    return new Moments(col.getType());
  }

  private static class Moments implements Accumulator {
    private final ColumnType type;
    private long n;
    private double mean;
    private double m2;
    private double m3;
    private double m4;

    Moments(ColumnType type) {
      this.type = type;
    }

    @Override
    public void add(ValueArray values) {
      for (int i = 0; i < values.size(); i++) {
        if (! values.isNull(i)) {
          update(TypeHelper.toDouble(type, values.getObject(i)));
        }
      }
    }

    private void update(double x) {
      long n1 = n;
      n++;
      double delta = x - mean;
      double deltaN = delta / n;
      double deltaN2 = deltaN * deltaN;
      double term1 = delta * deltaN * n1;
      mean += deltaN;
      m4 += term1 * deltaN2 * (n * n - 3 * n + 3) + 6 * deltaN2 * m2 - 4 * deltaN * m3;
      m3 += term1 * deltaN * (n - 2) - 3 * deltaN * m2;
      m2 += term1;
    }

    @Override
    public ColumnType resultType() { return ColumnType.FLOAT; }

    @Override
    public Object result() {
      if (n < 2 || m2 == 0) {
        return null;
      }
      return n * m4 / (m2 * m2) - 3.0;
    }
  }
}
