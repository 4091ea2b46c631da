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

import org.eddy.exec.vector.ValueArray;

/**
 * Borrowed handle to a {@link TableBuffer} passed to a transformation for
 * the duration of one call. The handler must not keep the view after it
 * returns unless it calls {@link #retain()}, and must then balance that
 * with {@link #release()}.
 */
public final class TableView {

  private final TableBuffer buffer;

  TableView(TableBuffer buffer) {
    this.buffer = buffer;
  }

  public GroupKey key() { return buffer.key(); }

  public List<ColumnMeta> cols() { return buffer.cols(); }

  public int nCols() { return buffer.nCols(); }

  public ColumnMeta col(int j) { return buffer.col(j); }

  public int len() { return buffer.len(); }

  public boolean isEmpty() { return buffer.isEmpty(); }

  public ValueArray values(int j) { return buffer.values(j); }

  public int colIndex(String label) { return buffer.colIndex(label); }

  public TableBuffer buffer() { return buffer; }

  public TableView retain() {
    buffer.retain();
    return this;
  }

  public boolean release() {
    return buffer.release();
  }

  public int refCnt() { return buffer.refCnt(); }

  @Override
  public String toString() {
    return "TableView[key=" + key() + ", cols=" + cols() + ", len=" + len() + "]";
  }
}
