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
package org.eddy.exec.physical.impl.mode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.config.AggregateSpec;
import org.eddy.exec.physical.config.ModeSpec;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.AggregateTransformation;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;
import org.eddy.exec.vector.ValueArray;

/**
 * Most frequent value of a column, written to <tt>_value</tt>. Ties
 * produce one row per tied value, in the order the values first
 * appeared. There is no mode, and the output is a single null, when all
 * distinct values occur equally often or when nulls outnumber every
 * value. If nulls tie with the most frequent values, a null row comes
 * first.
 * <p>
 * A column that is part of the group key has its key value as mode. A
 * table without the column produces a null string.
 */
public class ModeAggregate implements AggregateTransformation<ModeAggregate.State> {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ModeAggregate.class);

  public static class State {
    private ColumnMeta col;
    private boolean keyed;
    private long nullCount;
    private final Map<Object, long[]> counts = new LinkedHashMap<>();
  }

  private final String column;

  public ModeAggregate(ModeSpec spec) {
    this.column = spec.getColumn();
  }

  @Override
  public State aggregate(TableView view, State state, BufferAllocator allocator) {
    if (state == null) {
      state = new State();
    }
    int j = view.colIndex(column);
    if (j == -1) {
      return state;
    }
    ColumnMeta col = view.col(j);
    if (state.col == null) {
      state.col = col;
      state.keyed = view.key().hasCol(column);
    } else if (state.col.getType() != col.getType()) {
      throw UserException.failedPreconditionError()
          .message("schema collision detected: column \"%s\" is both %s and %s",
              column, state.col.getType(), col.getType())
          .addContext("Group key", view.key().toString())
          .build(logger);
    }
    if (state.keyed) {
      return state;
    }
    ValueArray values = view.values(j);
    for (int i = 0; i < values.size(); i++) {
      if (values.isNull(i)) {
        state.nullCount++;
        continue;
      }
      Object value = values.getObject(i);
      long[] count = state.counts.get(value);
      if (count == null) {
        count = new long[1];
        state.counts.put(value, count);
      }
      count[0]++;
    }
    return state;
  }

  @Override
  public void compute(GroupKey key, State state, Dataset dataset, BufferAllocator allocator) {
    ArrayTableBuilder builder = new ArrayTableBuilder(key, allocator);
    builder.addCols(key.cols());
    List<Object> modes;
    int j;
    if (state.col == null) {
      j = builder.addCol(AggregateSpec.DEFAULT_VALUE_COLUMN, ColumnType.STRING);
      modes = Collections.singletonList(null);
    } else {
      j = builder.addCol(AggregateSpec.DEFAULT_VALUE_COLUMN, state.col.getType());
      modes = state.keyed
          ? Collections.singletonList(key.labelValue(column))
          : modes(state);
    }
    for (Object value : modes) {
      builder.appendKeyValues();
      builder.appendValue(j, value);
      builder.finishRow();
    }
    dataset.process(builder.build().asView());
    dataset.flushKey(key);
  }

  static List<Object> modes(State state) {
    long max = 0;
    List<Object> tied = new ArrayList<>();
    for (Map.Entry<Object, long[]> entry : state.counts.entrySet()) {
      long count = entry.getValue()[0];
      if (count > max) {
        max = count;
        tied.clear();
        tied.add(entry.getKey());
      } else if (count == max) {
        tied.add(entry.getKey());
      }
    }
    if (tied.size() == state.counts.size() || state.nullCount > max) {
      return Collections.singletonList(null);
    }
    if (state.nullCount == max) {
      List<Object> result = new ArrayList<>(tied.size() + 1);
      result.add(null);
      result.addAll(tied);
      return result;
    }
    return tied;
  }
}
