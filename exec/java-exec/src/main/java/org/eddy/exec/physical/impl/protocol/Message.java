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

/**
 * A unit of communication between a dataset and a downstream
 * transformation. The receiver owns the message it is given and must
 * call {@link #ack()} exactly once when done with it. A dataset that
 * sends one message to several receivers gives each its own copy made
 * with {@link #dup()}.
 */
public abstract class Message {

  private final DatasetId sourceId;

  protected Message(DatasetId sourceId) {
    this.sourceId = sourceId;
  }

  public abstract MessageType getType();

  /**
   * The dataset that emitted the message.
   */
  public DatasetId getSourceId() { return sourceId; }

  /**
   * Returns an equivalent message with its own acknowledgement state,
   * retaining any reference this message holds.
   */
  public abstract Message dup();

  /**
   * Releases the references held by this message.
   */
  public abstract void ack();
}
