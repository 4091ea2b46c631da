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
package org.eddy.exec.physical.impl.protocol;

import org.eddy.exec.record.GroupKey;

/**
 * Announces that the sending dataset will emit no rows for the key whose
 * time column holds a value below the watermark.
 */
public class WatermarkKeyMessage extends Message {

  private final String columnName;
  private final long watermark;
  private final GroupKey key;

  public WatermarkKeyMessage(DatasetId sourceId, String columnName, long watermark, GroupKey key) {
    super(sourceId);
    this.columnName = columnName;
    this.watermark = watermark;
    this.key = key;
  }

  @Override
  public MessageType getType() { return MessageType.WATERMARK_KEY; }

  public String columnName() { return columnName; }

  /**
   * Watermark as nanoseconds since the epoch.
   */
  public long watermark() { return watermark; }

  public GroupKey key() { return key; }

  @Override
  public Message dup() { return this; }

  @Override
  public void ack() { }

  @Override
  public String toString() {
    return "WatermarkKey[" + getSourceId() + ", " + columnName + "=" + watermark + ", " + key + "]";
  }
}
