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

import java.util.concurrent.atomic.AtomicBoolean;

import org.eddy.exec.record.TableView;

/**
 * Carries one table view. The message owns one reference to the view's
 * buffer; acknowledging the message releases that reference.
 */
public class ProcessViewMessage extends Message {

  private final TableView view;
  private final AtomicBoolean acked = new AtomicBoolean();

  public ProcessViewMessage(DatasetId sourceId, TableView view) {
    super(sourceId);
    this.view = view;
  }

  @Override
  public MessageType getType() { return MessageType.PROCESS_VIEW; }

  public TableView view() { return view; }

  @Override
  public Message dup() {
    view.retain();
    return new ProcessViewMessage(getSourceId(), view);
  }

  @Override
  public void ack() {
    if (!acked.compareAndSet(false, true)) {
      throw new IllegalStateException("message acknowledged twice: " + this);
    }
    view.release();
  }

  @Override
  public String toString() {
    return "ProcessView[" + getSourceId() + ", " + view + "]";
  }
}
