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
package org.eddy.exec.physical.impl;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.physical.impl.protocol.Dataset;

/**
 * Operator at the start of a pipeline. The driver calls {@link #next()}
 * until it returns false, then checks {@link #err()}. Each call emits at
 * least one message into the source's dataset. A source never blocks
 * waiting for its downstream: messages are delivered synchronously.
 * <p>
 * The driver, not the source, closes or aborts the dataset once the
 * source is done.
 */
public interface Source {

  Dataset getDataset();

  /**
   * Emits the next batch of messages.
   *
   * @return false once the source has nothing more to emit, or failed
   */
  boolean next();

  /**
   * The error that ended the source, or null.
   */
  UserException err();
}
