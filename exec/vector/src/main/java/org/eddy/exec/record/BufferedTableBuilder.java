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
package org.eddy.exec.record;

import java.util.ArrayList;
import java.util.List;

import org.eddy.common.exceptions.UserException;

/**
 * Collects the buffers of one group key so they can be handed out as a
 * single {@link Table}. Appended views are retained; the schema of the
 * first view fixes the schema of the table.
 */
public class BufferedTableBuilder {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(BufferedTableBuilder.class);

  private final GroupKey key;
  private List<ColumnMeta> cols;
  private List<TableBuffer> buffers = new ArrayList<>();

  public BufferedTableBuilder(GroupKey key) {
    this.key = key;
  }

  public GroupKey key() { return key; }

  public void append(TableView view) {
    if (cols == null) {
      cols = view.cols();
    } else if (! cols.equals(view.cols())) {
      throw UserException.failedPreconditionError()
          .message("schema collision detected")
          .addContext("Group key", key.toString())
          .addContext("Expected", cols.toString())
          .addContext("Found", view.cols().toString())
          .build(logger);
    }
    buffers.add(view.retain().buffer());
  }

  public int bufferCount() { return buffers.size(); }

  /**
   * Transfers the buffers to a new table. The builder is empty afterwards.
   */
  public Table table() {
    Table table = new BufferedTable(key, cols == null ? new ArrayList<>() : cols, buffers);
    buffers = new ArrayList<>();
    return table;
  }

  /**
   * Drops the collected buffers.
   */
  public void release() {
    for (TableBuffer buffer : buffers) {
      buffer.release();
    }
    buffers.clear();
  }
}
