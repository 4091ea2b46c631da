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

import java.util.List;
import java.util.function.Consumer;

/**
 * Table backed by a list of buffers that were appended to a
 * {@link BufferedTableBuilder}. The table owns one reference to each.
 */
public class BufferedTable implements Table {

  private final GroupKey key;
  private final List<ColumnMeta> cols;
  private final List<TableBuffer> buffers;
  private boolean consumed;

  BufferedTable(GroupKey key, List<ColumnMeta> cols, List<TableBuffer> buffers) {
    this.key = key;
    this.cols = cols;
    this.buffers = buffers;
  }

  @Override
  public GroupKey key() { return key; }

  @Override
  public List<ColumnMeta> cols() { return cols; }

  @Override
  public boolean isEmpty() {
    for (TableBuffer buffer : buffers) {
      if (! buffer.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public void forEach(Consumer<TableView> reader) {
    if (consumed) {
      throw new IllegalStateException("table " + key + " has already been read");
    }
    consumed = true;
    int i = 0;
    try {
      for (; i < buffers.size(); i++) {
        TableBuffer buffer = buffers.get(i);
        try {
          reader.accept(buffer.asView());
        } finally {
          buffer.release();
        }
      }
    } finally {

      // On failure, drop the buffers not yet read.

      for (i++; i < buffers.size(); i++) {
        buffers.get(i).release();
      }
      buffers.clear();
    }
  }

  @Override
  public void done() {
    if (consumed) {
      return;
    }
    consumed = true;
    for (TableBuffer buffer : buffers) {
      buffer.release();
    }
    buffers.clear();
  }
}
