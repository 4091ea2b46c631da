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

import org.eddy.common.exceptions.UserException;

/**
 * Ends the stream from one dataset, successfully when the error is null.
 */
public class FinishMessage extends Message {

  private final UserException error;

  public FinishMessage(DatasetId sourceId, UserException error) {
    super(sourceId);
    this.error = error;
  }

  @Override
  public MessageType getType() { return MessageType.FINISH; }

  public UserException error() { return error; }

  @Override
  public Message dup() { return this; }

  @Override
  public void ack() { }

  @Override
  public String toString() {
    return "Finish[" + getSourceId() + (error == null ? "" : ", " + error.getOriginalMessage()) + "]";
  }
}
