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

import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.config.SortSpec;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.LegacyTransformation;
import org.eddy.exec.record.Table;

/**
 * Sorts each complete table. The sort is stable, so rows that compare
 * equal keep their arrival order.
 */
public class SortTransformation implements LegacyTransformation {

  private final OperatorContext context;
  private final List<String> columns;
  private final boolean desc;

  public SortTransformation(SortSpec spec, OperatorContext context) {
    this.context = context;
    this.columns = spec.getColumns();
    this.desc = spec.isDesc();
  }

  @Override
  public void process(Table table, Dataset dataset, BufferAllocator allocator) {
    final List<Object[]> rows = new ArrayList<>();
    table.forEach(view -> {
      context.checkContinue();
      Rows.addRows(view, rows);
    });
    Collections.sort(rows, new RowComparator(table.cols(), columns, desc));
    dataset.process(Rows.build(table.key(), table.cols(), rows, allocator).asView());
    dataset.flushKey(table.key());
  }
}
