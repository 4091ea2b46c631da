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
package org.eddy.exec.physical.impl.sort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.physical.config.SortLimitSpec;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.AggregateTransformation;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Keeps the first <tt>n</tt> rows of each table in sort order. The state
 * holds at most <tt>n</tt> rows: each view is merged in and the tail cut
 * off. Among equal rows the earliest arrivals are kept.
 */
public class SortLimitAggregate implements AggregateTransformation<SortLimitAggregate.State> {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SortLimitAggregate.class);

  public static class State {
    private final List<ColumnMeta> schema;
    private final RowComparator comparator;
    private final List<Object[]> rows = new ArrayList<>();

    State(List<ColumnMeta> schema, RowComparator comparator) {
      this.schema = schema;
      this.comparator = comparator;
    }
  }

  private final int n;
  private final List<String> columns;
  private final boolean desc;

  public SortLimitAggregate(SortLimitSpec spec) {
    if (spec.getN() <= 0) {
      throw UserException.invalidError()
          .message("cardinality must be positive")
          .addContext("N", spec.getN())
          .build(logger);
    }
    this.n = spec.getN();
    this.columns = spec.getColumns();
    this.desc = spec.isDesc();
  }

  @Override
  public State aggregate(TableView view, State state, BufferAllocator allocator) {
    if (state == null) {
      state = new State(view.cols(), new RowComparator(view.cols(), columns, desc));
    } else if (! state.schema.equals(view.cols())) {
      throw UserException.failedPreconditionError()
          .message("schema collision detected")
          .addContext("Group key", view.key().toString())
          .addContext("Expected", state.schema.toString())
          .addContext("Found", view.cols().toString())
          .build(logger);
    }
    Rows.addRows(view, state.rows);
    Collections.sort(state.rows, state.comparator);
    while (state.rows.size() > n) {
      state.rows.remove(state.rows.size() - 1);
    }
    return state;
  }

  @Override
  public void compute(GroupKey key, State state, Dataset dataset, BufferAllocator allocator) {
    dataset.process(Rows.build(key, state.schema, state.rows, allocator).asView());
    dataset.flushKey(key);
  }
}
