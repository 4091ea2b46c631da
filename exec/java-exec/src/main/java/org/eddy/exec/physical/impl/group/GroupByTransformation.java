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
package org.eddy.exec.physical.impl.group;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.GroupSpec;
import org.eddy.exec.physical.impl.common.BuilderCache;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.GroupTransformation;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.GroupKeyBuilder;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;
import org.eddy.exec.vector.ValueArray;

/**
 * Regroups rows under a new key.
 * <p>
 * If the new key only uses columns of the input key, every row of a view
 * lands in the same output table, so the view is re-emitted under the
 * projected key, sharing the input arrays. Otherwise each row is routed
 * by its own values into a per-key builder and the builders are emitted
 * when the view is done.
 */
public class GroupByTransformation implements GroupTransformation {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(GroupByTransformation.class);

  private final OperatorContext context;
  private final boolean except;
  private final Set<String> columns;

  // Column types seen so far for each output key.

  private final Map<GroupKey, Map<String, ColumnMeta>> schemas = new HashMap<>();

  public GroupByTransformation(GroupSpec spec, OperatorContext context) {
    this.context = context;
    if (GroupSpec.MODE_BY.equals(spec.getMode())) {
      except = false;
    } else if (GroupSpec.MODE_EXCEPT.equals(spec.getMode())) {
      except = true;
    } else {
      throw UserException.invalidError()
          .message("invalid group mode: must be \"by\" or \"except\"")
          .addContext("Mode", spec.getMode())
          .build(logger);
    }
    this.columns = new HashSet<>(spec.getColumns());
  }

  @Override
  public void process(TableView view, Dataset dataset, BufferAllocator allocator) {
    List<Integer> keyCols = outputKeyColumns(view);
    if (allKeyed(view, keyCols)) {
      TableBuffer buffer = rekey(view, keyCols);
      try {
        checkSchema(buffer.key(), buffer.cols());
      } catch (RuntimeException e) {
        buffer.release();
        throw e;
      }
      dataset.process(buffer.asView());
      return;
    }

    BuilderCache<ArrayTableBuilder, TableBuffer> builders = BuilderCache.arrays(allocator);
    List<ArrayTableBuilder> created = new ArrayList<>();
    try {
      for (int i = 0; i < view.len(); i++) {
        context.checkContinue();
        GroupKeyBuilder keyBuilder = new GroupKeyBuilder();
        for (int j : keyCols) {
          keyBuilder.addKeyValue(view.col(j), view.values(j).getObject(i));
        }
        BuilderCache.Entry<ArrayTableBuilder> entry = builders.getOrCreate(keyBuilder.build());
        ArrayTableBuilder builder = entry.builder();
        if (entry.created()) {
          builder.addCols(view.cols());
          created.add(builder);
        }
        for (int j = 0; j < view.nCols(); j++) {
          builder.appendFrom(builder.addCol(view.col(j)), view.values(j), i);
        }
        builder.finishRow();
      }
      for (ArrayTableBuilder builder : created) {
        checkSchema(builder.key(), builder.cols());
      }
      builders.forEach((key, buffer) -> dataset.process(buffer.asView()));
    } finally {
      builders.clear();
    }
  }

  /**
   * Indexes, in column order, of the view columns that form the new key.
   */
  private List<Integer> outputKeyColumns(TableView view) {
    List<Integer> keyCols = new ArrayList<>();
    for (int j = 0; j < view.nCols(); j++) {
      if (columns.contains(view.col(j).getLabel()) != except) {
        keyCols.add(j);
      }
    }
    return keyCols;
  }

  private boolean allKeyed(TableView view, List<Integer> keyCols) {
    GroupKey key = view.key();
    for (int j : keyCols) {
      int k = key.index(view.col(j).getLabel());
      if (k == -1 || key.col(k).getType() != view.col(j).getType()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Fails if a column of the table was seen with another type in an
   * earlier table of the same output key.
   */
  private void checkSchema(GroupKey key, List<ColumnMeta> cols) {
    Map<String, ColumnMeta> seen = schemas.get(key);
    if (seen == null) {
      seen = new HashMap<>();
      schemas.put(key, seen);
    }
    for (ColumnMeta col : cols) {
      ColumnMeta prior = seen.get(col.getLabel());
      if (prior == null) {
        seen.put(col.getLabel(), col);
      } else if (prior.getType() != col.getType()) {
        throw UserException.failedPreconditionError()
            .message("schema collision detected: column \"%s\" is both %s and %s",
                col.getLabel(), prior.getType(), col.getType())
            .addContext("Group key", key.toString())
            .build(logger);
      }
    }
  }

  @Override
  public void finish(Dataset dataset, BufferAllocator allocator) {
    schemas.clear();
  }

  @Override
  public void discard() {
    schemas.clear();
  }

  private TableBuffer rekey(TableView view, List<Integer> keyCols) {
    GroupKey key = view.key();
    GroupKeyBuilder keyBuilder = new GroupKeyBuilder();
    for (int j : keyCols) {
      keyBuilder.addKeyValue(view.col(j), key.labelValue(view.col(j).getLabel()));
    }
    List<ValueArray> arrays = new ArrayList<>(view.nCols());
    for (int j = 0; j < view.nCols(); j++) {
      arrays.add(view.values(j).retain());
    }
    return new TableBuffer(keyBuilder.build(), view.cols(), arrays);
  }
}
