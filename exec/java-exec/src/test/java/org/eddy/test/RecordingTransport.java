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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.physical.impl.protocol.DatasetId;
import org.eddy.exec.physical.impl.protocol.FinishMessage;
import org.eddy.exec.physical.impl.protocol.FlushKeyMessage;
import org.eddy.exec.physical.impl.protocol.Message;
import org.eddy.exec.physical.impl.protocol.MessageType;
import org.eddy.exec.physical.impl.protocol.ProcessViewMessage;
import org.eddy.exec.physical.impl.protocol.Transport;
import org.eddy.exec.physical.impl.protocol.WatermarkKeyMessage;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Stands in for a downstream operator: records every message it receives
 * and acknowledges it, as a real transport does. Rows of each view are
 * copied so the buffer can be released. Optionally the views themselves
 * are retained for tests that check buffer identity; such tests must call
 * {@link #releaseViews()}.
 */
public class RecordingTransport implements Transport {

  public static class Entry {
    public final MessageType type;
    public final DatasetId source;
    public final GroupKey key;
    public final List<ColumnMeta> cols;
    public final List<List<Object>> rows;
    public final UserException error;

    Entry(MessageType type, DatasetId source, GroupKey key, List<ColumnMeta> cols,
        List<List<Object>> rows, UserException error) {
      this.type = type;
      this.source = source;
      this.key = key;
      this.cols = cols;
      this.rows = rows;
      this.error = error;
    }

    public int len() { return rows.size(); }

    /**
     * Values of one column, in row order.
     */
    public List<Object> column(String label) {
      int j = -1;
      for (int c = 0; c < cols.size(); c++) {
        if (cols.get(c).getLabel().equals(label)) {
          j = c;
        }
      }
      if (j == -1) {
        throw new IllegalArgumentException("No column " + label + " in " + cols);
      }
      List<Object> values = new ArrayList<>();
      for (List<Object> row : rows) {
        values.add(row.get(j));
      }
      return values;
    }

    @Override
    public String toString() {
      switch (type) {
      case PROCESS_VIEW:
        return "view " + key + " " + rows;
      case FLUSH_KEY:
        return "flush " + key;
      case FINISH:
        return "finish" + (error == null ? "" : " " + error.getOriginalMessage());
      default:
        return type.name().toLowerCase() + " " + key;
      }
    }
  }

  private final boolean retainViews;
  private final List<Entry> entries = new ArrayList<>();
  private final List<TableView> retained = new ArrayList<>();

  public RecordingTransport() {
    this(false);
  }

  public RecordingTransport(boolean retainViews) {
    this.retainViews = retainViews;
  }

  @Override
  public synchronized void processMessage(Message message) {
    try {
      entries.add(record(message));
    } finally {
      message.ack();
    }
  }

  private Entry record(Message message) {
    switch (message.getType()) {
    case PROCESS_VIEW: {
      TableView view = ((ProcessViewMessage) message).view();
      if (retainViews) {
        retained.add(view.retain());
      }
      return new Entry(MessageType.PROCESS_VIEW, message.getSourceId(), view.key(),
          new ArrayList<>(view.cols()), copyRows(view), null);
    }
    case FLUSH_KEY:
      return new Entry(MessageType.FLUSH_KEY, message.getSourceId(),
          ((FlushKeyMessage) message).key(), null, null, null);
    case WATERMARK_KEY:
      return new Entry(MessageType.WATERMARK_KEY, message.getSourceId(),
          ((WatermarkKeyMessage) message).key(), null, null, null);
    case FINISH:
      return new Entry(MessageType.FINISH, message.getSourceId(), null, null, null,
          ((FinishMessage) message).error());
    default:
      throw new IllegalStateException("Unexpected message type: " + message.getType());
    }
  }

  private static List<List<Object>> copyRows(TableView view) {
    List<List<Object>> rows = new ArrayList<>(view.len());
    for (int i = 0; i < view.len(); i++) {
      List<Object> row = new ArrayList<>(view.nCols());
      for (int j = 0; j < view.nCols(); j++) {
        row.add(view.values(j).getObject(i));
      }
      rows.add(Collections.unmodifiableList(row));
    }
    return rows;
  }

  public synchronized List<Entry> entries() {
    return new ArrayList<>(entries);
  }

  public synchronized List<Entry> entries(MessageType type) {
    List<Entry> matches = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.type == type) {
        matches.add(entry);
      }
    }
    return matches;
  }

  public List<Entry> views() {
    return entries(MessageType.PROCESS_VIEW);
  }

  /**
   * Keys of the flush messages, in order.
   */
  public List<GroupKey> flushes() {
    List<GroupKey> keys = new ArrayList<>();
    for (Entry entry : entries(MessageType.FLUSH_KEY)) {
      keys.add(entry.key);
    }
    return keys;
  }

  public int finishCount() {
    return entries(MessageType.FINISH).size();
  }

  public boolean isFinished() {
    return finishCount() > 0;
  }

  /**
   * Error carried by the first finish message, or null.
   */
  public UserException error() {
    List<Entry> finishes = entries(MessageType.FINISH);
    return finishes.isEmpty() ? null : finishes.get(0).error;
  }

  /**
   * The views kept when recording with <tt>retainViews</tt>.
   */
  public synchronized List<TableView> retainedViews() {
    return new ArrayList<>(retained);
  }

  public synchronized void releaseViews() {
    for (TableView view : retained) {
      view.release();
    }
    retained.clear();
  }

  /**
   * Compact description of what was received, one entry per message.
   */
  public synchronized List<String> describe() {
    List<String> lines = new ArrayList<>();
    for (Entry entry : entries) {
      lines.add(entry.toString());
    }
    return lines;
  }
}
