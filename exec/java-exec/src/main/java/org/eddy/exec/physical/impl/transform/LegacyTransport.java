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
package org.eddy.exec.physical.impl.transform;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.impl.common.BuilderCache;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.record.BufferedTableBuilder;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.Table;
import org.eddy.exec.record.TableView;

/**
 * Adapts a whole-table operator to the message protocol. Views are
 * retained into a buffered builder per key; the flush of a key hands the
 * complete table to the operator. Keys still open when the input ends
 * are processed then, in the order they first appeared.
 */
public class LegacyTransport extends AbstractTransport {

  private final LegacyTransformation transformation;
  private final BuilderCache<BufferedTableBuilder, Table> cache = BuilderCache.buffered();

  public LegacyTransport(LegacyTransformation transformation, OperatorContext context, Dataset dataset) {
    super(context, dataset);
    this.transformation = transformation;
  }

  @Override
  protected void processView(TableView view) {
    cache.getOrCreate(view.key()).builder().append(view);
  }

  @Override
  protected void flushKey(GroupKey key) {
    Table table = cache.table(key);
    if (table != null) {
      process(table);
    }
  }

  @Override
  protected void watermarkKey(GroupKey key, String columnName, long watermark) { }

  @Override
  protected void onFinish() {
    cache.forEach((key, table) -> process(table));
  }

  private void process(Table table) {
    try {
      transformation.process(table, dataset, allocator());
    } finally {
      table.done();
    }
  }

  @Override
  protected void onAbort(UserException error) {
    cache.clear();
  }
}
