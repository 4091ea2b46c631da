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
package org.eddy.exec.physical.impl.map;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.expr.RowFunction;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.MapSpec;
import org.eddy.exec.physical.impl.common.BuilderCache;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.GroupTransformation;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.GroupKeyBuilder;
import org.eddy.exec.record.Record;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;

/**
 * Replaces each row by the record a function returns for it.
 * <p>
 * The output key of a row is made of the input key columns that appear
 * in the returned record, with the record's values. With
 * <tt>mergeKey</tt> set, input key columns the function did not return
 * are carried over first, so the output keeps the input key; a value the
 * function returns for a key column wins over the input value.
 * <p>
 * Rows are collected per output key while one view is processed, and the
 * resulting tables are emitted when the view is done. Map does not flush:
 * the output key of a table is not known to be complete.
 */
public class MapTransformation implements GroupTransformation {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MapTransformation.class);

  private final OperatorContext context;
  private final RowFunction fn;
  private final boolean mergeKey;

  public MapTransformation(MapSpec spec, OperatorContext context) {
    this.context = context;
    this.fn = spec.getFn();
    this.mergeKey = spec.isMergeKey();
  }

  @Override
  public void process(TableView view, Dataset dataset, BufferAllocator allocator) {
    BuilderCache<ArrayTableBuilder, TableBuffer> builders = BuilderCache.arrays(allocator);
    try {
      try {
        fn.prepare(view.cols());
      } catch (RuntimeException e) {
        throw UserException.invalidError(e)
            .message("failed to prepare map function")
            .build(logger);
      }
      for (int i = 0; i < view.len(); i++) {
        context.checkContinue();
        Record out = outputRecord(view.key(), eval(Record.fromRow(view, i)));
        GroupKey outKey = outputKey(view.key(), out);
        BuilderCache.Entry<ArrayTableBuilder> entry = builders.getOrCreate(outKey);
        appendRow(entry.builder(), out);
      }
      builders.forEach((key, buffer) -> dataset.process(buffer.asView()));
    } finally {
      builders.clear();
    }
  }

  private Record eval(Record row) {
    try {
      return fn.eval(row);
    } catch (RuntimeException e) {
      throw UserException.invalidError(e)
          .message("failed to evaluate map function")
          .build(logger);
    }
  }

  private Record outputRecord(GroupKey inputKey, Record body) {
    if (! mergeKey) {
      return body;
    }
    Record out = new Record();
    for (int k = 0; k < inputKey.nCols(); k++) {
      ColumnMeta col = inputKey.col(k);
      if (! body.has(col.getLabel())) {
        out.set(col.getLabel(), col.getType(), inputKey.value(k));
      }
    }
    for (ColumnMeta col : body.cols()) {
      out.set(col.getLabel(), col.getType(), body.get(col.getLabel()));
    }
    return out;
  }

  private GroupKey outputKey(GroupKey inputKey, Record out) {
    GroupKeyBuilder builder = new GroupKeyBuilder();
    for (int k = 0; k < inputKey.nCols(); k++) {
      String label = inputKey.col(k).getLabel();
      if (out.has(label)) {
        builder.addKeyValue(label, out.type(label), out.get(label));
      }
    }
    return builder.build();
  }

  private void appendRow(ArrayTableBuilder builder, Record out) {
    for (ColumnMeta col : out.cols()) {
      int j = builder.colIndex(col.getLabel());
      if (j == -1) {
        j = builder.addCol(col);
      } else if (builder.cols().get(j).getType() != col.getType()) {
        throw UserException.failedPreconditionError()
            .message("column %s:%s is not of type %s",
                col.getLabel(), builder.cols().get(j).getType(), col.getType())
            .addContext("Group key", builder.key().toString())
            .build(logger);
      }
      builder.appendValue(j, out.get(col.getLabel()));
    }
    builder.finishRow();
  }
}
