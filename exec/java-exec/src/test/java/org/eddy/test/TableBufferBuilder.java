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
package org.eddy.test;

import java.util.Arrays;
import java.util.List;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.record.ArrayTableBuilder;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.GroupKeyBuilder;
import org.eddy.exec.record.TableBuffer;

/**
 * Builds a literal table for a test. Values are given per row in schema
 * order; <tt>Integer</tt> values are accepted for int columns.
 * <pre><code>
 * TableBuffer buffer = fixture.tableBuilder(key, schema)
 *     .addRow("A", 42)
 *     .addRow("A", null)
 *     .build();
 * </code></pre>
 */
public class TableBufferBuilder {

  private final ArrayTableBuilder builder;

  public TableBufferBuilder(GroupKey key, List<ColumnMeta> schema, BufferAllocator allocator) {
    builder = new ArrayTableBuilder(key, allocator);
    builder.addCols(schema);
  }

  public TableBufferBuilder addRow(Object... values) {
    if (values.length != builder.nCols()) {
      throw new IllegalArgumentException("Row has " + values.length + " values, schema has " + builder.nCols());
    }
    for (int j = 0; j < values.length; j++) {
      builder.appendValue(j, values[j]);
    }
    builder.finishRow();
    return this;
  }

  /**
   * Adds a row of a single-column table.
   */
  public TableBufferBuilder addSingleCol(Object value) {
    return addRow(new Object[] { value });
  }

  public TableBuffer build() {
    return builder.build();
  }

  public static List<ColumnMeta> schema(Object... labelsAndTypes) {
    ColumnMeta[] cols = new ColumnMeta[labelsAndTypes.length / 2];
    for (int i = 0; i < cols.length; i++) {
      cols[i] = ColumnMeta.of((String) labelsAndTypes[2 * i], (ColumnType) labelsAndTypes[2 * i + 1]);
    }
    return Arrays.asList(cols);
  }

  /**
   * Builds a key from label, type, value triples.
   */
  public static GroupKey key(Object... triples) {
    GroupKeyBuilder builder = new GroupKeyBuilder();
    for (int i = 0; i + 2 < triples.length; i += 3) {
      builder.addKeyValue((String) triples[i], (ColumnType) triples[i + 1], triples[i + 2]);
    }
    return builder.build();
  }
}
