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

import java.util.ArrayList;
import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.AggregateTransformation;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;
import org.eddy.exec.vector.ValueArray;

import com.google.common.collect.ImmutableList;

/**
 * Base for aggregates that reduce each target column to a single value.
 * The state of a key holds one accumulator per target column. The output
 * of a key is one row: the key columns followed by one column per
 * target, named like the target.
 */
public abstract class ColumnAggregate implements AggregateTransformation<ColumnAggregate.State> {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ColumnAggregate.class);

  /**
   * Running result for one column.
   */
  protected interface Accumulator {

    /**
     * Folds every value of the array, skipping nulls.
     */
    void add(ValueArray values);

    ColumnType resultType();

    /**
     * The result, or null if the column had no value to aggregate.
     */
    Object result();
  }

  public static class State {
    private final List<ColumnMeta> inputCols = new ArrayList<>();
    private final List<Accumulator> accumulators = new ArrayList<>();
  }

  private final List<String> columns;

  protected ColumnAggregate(List<String> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  public List<String> getColumns() { return columns; }

  /**
   * Creates the accumulator for an input column.
   *
   * @throws UserException if the aggregate does not support the type
   */
  protected abstract Accumulator newAccumulator(ColumnMeta col);

  protected UserException unsupportedType(String aggregate, ColumnMeta col) {
    return UserException.failedPreconditionError()
        .message("unsupported input type for %s aggregate: %s", aggregate, col.getType())
        .addContext("Column", col.getLabel())
        .build(logger);
  }

  @Override
  public State aggregate(TableView view, State state, BufferAllocator allocator) {
    boolean first = state == null;
    if (first) {
      state = new State();
    }
    int[] indexes = new int[columns.size()];
    for (int c = 0; c < columns.size(); c++) {
      String label = columns.get(c);
      int j = view.colIndex(label);
      if (j == -1) {
        throw UserException.failedPreconditionError()
            .message("column \"%s\" does not exist", label)
            .addContext("Group key", view.key().toString())
            .build(logger);
      }
      ColumnMeta col = view.col(j);
      if (first) {
        if (view.key().hasCol(label)) {
          throw UserException.failedPreconditionError()
              .message("cannot aggregate column \"%s\", which is part of the group key", label)
              .addContext("Group key", view.key().toString())
              .build(logger);
        }
        state.inputCols.add(col);
        state.accumulators.add(newAccumulator(col));
      } else if (state.inputCols.get(c).getType() != col.getType()) {
        throw UserException.failedPreconditionError()
            .message("schema collision detected: column \"%s\" is both %s and %s",
                label, state.inputCols.get(c).getType(), col.getType())
            .addContext("Group key", view.key().toString())
            .build(logger);
      }
      indexes[c] = j;
    }
    for (int c = 0; c < columns.size(); c++) {
      state.accumulators.get(c).add(view.values(indexes[c]));
    }
    return state;
  }

  @Override
  public void compute(GroupKey key, State state, Dataset dataset, BufferAllocator allocator) {
    ArrayTableBuilder builder = new ArrayTableBuilder(key, allocator);
    builder.addCols(key.cols());
    int[] indexes = new int[columns.size()];
    for (int c = 0; c < columns.size(); c++) {
      indexes[c] = builder.addCol(columns.get(c), state.accumulators.get(c).resultType());
    }
    builder.appendKeyValues();
    for (int c = 0; c < columns.size(); c++) {
      builder.appendValue(indexes[c], state.accumulators.get(c).result());
    }
    builder.finishRow();
    dataset.process(builder.build().asView());
    dataset.flushKey(key);
  }
}
