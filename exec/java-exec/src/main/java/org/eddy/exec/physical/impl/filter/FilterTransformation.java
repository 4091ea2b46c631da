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
package org.eddy.exec.physical.impl.filter;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.expr.RowPredicate;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.NarrowTransformation;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.Record;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;
import org.eddy.exec.vector.ArrayBuilder;
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;

/**
 * Keeps the rows of each view that satisfy a predicate.
 * <p>
 * When every column the predicate reads is part of the group key, the
 * predicate is evaluated once against the key and the view is passed on
 * or dropped as a whole. Otherwise the predicate is evaluated per row
 * and the surviving rows are copied into a new buffer. Key columns are
 * constant, so they are sliced rather than copied.
 */
public class FilterTransformation implements NarrowTransformation {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FilterTransformation.class);

  private final OperatorContext context;
  private final RowPredicate predicate;
  private final boolean keepEmpty;

  public FilterTransformation(FilterSpec spec, OperatorContext context) {
    this.context = context;
    this.predicate = spec.getPredicate();
    this.keepEmpty = spec.isKeepEmpty();
  }

  @Override
  public void process(TableView view, Dataset dataset, BufferAllocator allocator) {
    if (view.isEmpty()) {
      if (keepEmpty) {
        dataset.process(view.retain());
      }
      return;
    }
    prepare(view);
    if (decidedByKey(view)) {
      if (eval(Record.fromKey(view.key()))) {
        dataset.process(view.retain());
      } else if (keepEmpty) {
        emitEmpty(view, dataset, allocator);
      }
      return;
    }

    BitSet selected = new BitSet(view.len());
    for (int i = 0; i < view.len(); i++) {
      context.checkContinue();
      if (eval(Record.fromRow(view, i))) {
        selected.set(i);
      }
    }
    int n = selected.cardinality();
    if (n == 0) {
      if (keepEmpty) {
        emitEmpty(view, dataset, allocator);
      }
    } else if (n == view.len()) {
      dataset.process(view.retain());
    } else {
      dataset.process(filter(view, selected, allocator).asView());
    }
  }

  private void prepare(TableView view) {
    try {
      predicate.prepare(view.cols());
    } catch (RuntimeException e) {
      throw UserException.inheritError(e)
          .message("failed to prepare filter function")
          .build(logger);
    }
  }

  private boolean eval(Record record) {
    try {
      return predicate.eval(record);
    } catch (RuntimeException e) {
      throw UserException.inheritError(e)
          .message("failed to evaluate filter function")
          .build(logger);
    }
  }

  /**
   * True if none of the columns the predicate reads vary within the view.
   */
  private boolean decidedByKey(TableView view) {
    GroupKey key = view.key();
    for (String label : predicate.referencedColumns()) {
      if (view.colIndex(label) != -1 && ! key.hasCol(label)) {
        return false;
      }
    }
    return true;
  }

  private void emitEmpty(TableView view, Dataset dataset, BufferAllocator allocator) {
    dataset.process(TableBuffer.empty(view.key(), view.cols(), allocator).asView());
  }

  private TableBuffer filter(TableView view, BitSet selected, BufferAllocator allocator) {
    int n = selected.cardinality();
    GroupKey key = view.key();
    List<ValueArray> arrays = new ArrayList<>(view.nCols());
    try {
      for (int j = 0; j < view.nCols(); j++) {
        ColumnMeta col = view.col(j);
        ValueArray source = view.values(j);
        if (key.hasCol(col.getLabel())) {
          arrays.add(source.slice(0, n));
          continue;
        }
        ArrayBuilder builder = TypeHelper.newBuilder(col.getType(), allocator);
        for (int i = selected.nextSetBit(0); i >= 0; i = selected.nextSetBit(i + 1)) {
          builder.appendFrom(source, i);
        }
        arrays.add(builder.build());
      }
    } catch (RuntimeException e) {
      for (ValueArray arr : arrays) {
        arr.release();
      }
      throw e;
    }
    return new TableBuffer(key, view.cols(), arrays);
  }
}
