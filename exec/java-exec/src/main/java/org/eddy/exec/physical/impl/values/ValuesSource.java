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
package org.eddy.exec.physical.impl.values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.expr.ValueLiterals;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.ValuesSpec;
import org.eddy.exec.physical.config.ValuesSpec.ColumnDef;
import org.eddy.exec.physical.config.ValuesSpec.TableData;
import org.eddy.exec.physical.impl.Source;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.GroupKeyBuilder;
import org.eddy.exec.record.TableBuffer;

/**
 * Emits the literal tables of a values spec, one table per call to
 * {@link #next()}. A key is flushed after its last table. Parallel
 * instances split the work by key: instance <tt>i</tt> of <tt>F</tt>
 * emits the tables of the i-th, (i+F)-th, ... distinct key, so that each
 * key is flushed by exactly one instance.
 */
public class ValuesSource implements Source {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ValuesSource.class);

  private final OperatorContext context;
  private final Dataset dataset;
  private final List<TableData> tables = new ArrayList<>();
  private final List<GroupKey> keys = new ArrayList<>();
  private int next;
  private UserException error;

  public ValuesSource(ValuesSpec spec, int instance, int instances,
      OperatorContext context, Dataset dataset) {
    this.context = context;
    this.dataset = dataset;
    Map<GroupKey, Integer> keyIndexes = new LinkedHashMap<>();
    for (TableData table : spec.getTables()) {
      GroupKey key = keyOf(table);
      Integer index = keyIndexes.get(key);
      if (index == null) {
        index = keyIndexes.size();
        keyIndexes.put(key, index);
      }
      if (index % instances == instance) {
        tables.add(table);
        keys.add(key);
      }
    }
    logger.debug("{} instance {} of {}: {} tables", context.getId(), instance, instances, tables.size());
  }

  @Override
  public Dataset getDataset() { return dataset; }

  @Override
  public boolean next() {
    if (error != null || next >= tables.size()) {
      return false;
    }
    try {
      context.checkContinue();
      int i = next++;
      GroupKey key = keys.get(i);
      dataset.process(build(tables.get(i), key).asView());
      if (! keys.subList(next, keys.size()).contains(key)) {
        dataset.flushKey(key);
      }
    } catch (RuntimeException e) {
      error = UserException.executionError(e)
          .addContext("Source", context.getId().toString())
          .build(logger);
      return false;
    }
    return next < tables.size();
  }

  @Override
  public UserException err() { return error; }

  private TableBuffer build(TableData table, GroupKey key) {
    ArrayTableBuilder builder = new ArrayTableBuilder(key, context.getAllocator());
    for (ColumnDef col : table.getColumns()) {
      builder.addCol(col.getLabel(), col.getType());
    }
    for (List<Object> row : table.getRows()) {
      if (row.size() != table.getColumns().size()) {
        throw UserException.invalidError()
            .message("row has %d values, expected %d", row.size(), table.getColumns().size())
            .build(logger);
      }
      for (int j = 0; j < row.size(); j++) {
        builder.appendValue(j, convert(table.getColumns().get(j), row.get(j)));
      }
      builder.finishRow();
    }
    TableBuffer buffer = builder.build();
    try {
      buffer.validate();
    } catch (IllegalStateException e) {
      buffer.release();
      throw UserException.invalidError(e)
          .message("values table does not match its key: %s", e.getMessage())
          .build(logger);
    }
    return buffer;
  }

  /**
   * Group key of a table: the key columns' values in the first row, or
   * the explicit key values of a table without rows.
   */
  private static GroupKey keyOf(TableData table) {
    GroupKeyBuilder builder = new GroupKeyBuilder();
    List<String> keyColumns = table.getKeyColumns();
    for (int k = 0; k < keyColumns.size(); k++) {
      String label = keyColumns.get(k);
      int j = indexOf(table, label);
      if (j == -1) {
        throw UserException.invalidError()
            .message("key column \"%s\" is not a column of the table", label)
            .build(logger);
      }
      ColumnDef col = table.getColumns().get(j);
      Object value;
      if (! table.getRows().isEmpty()) {
        value = table.getRows().get(0).get(j);
      } else if (table.getKeyValues() != null && k < table.getKeyValues().size()) {
        value = table.getKeyValues().get(k);
      } else {
        throw UserException.invalidError()
            .message("no value for key column \"%s\" of a table without rows", label)
            .build(logger);
      }
      builder.addKeyValue(col.getLabel(), col.getType(), convert(col, value));
    }
    return builder.build();
  }

  private static int indexOf(TableData table, String label) {
    for (int j = 0; j < table.getColumns().size(); j++) {
      if (table.getColumns().get(j).getLabel().equals(label)) {
        return j;
      }
    }
    return -1;
  }

  private static Object convert(ColumnDef col, Object literal) {
    try {
      return ValueLiterals.convert(col.getType(), literal);
    } catch (RuntimeException e) {
      throw UserException.invalidError(e)
          .message("invalid value %s for column \"%s\" of type %s", literal, col.getLabel(), col.getType())
          .build(logger);
    }
  }
}
