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
 * Receiving side of the message protocol. A transport takes ownership of
 * each message passed to it and acknowledges it.
 * <p>
 * Messages from one dataset arrive in the order that dataset emitted
 * them. Messages from different datasets may interleave in any order, so
 * implementations that have several parents must be thread safe.
 * <p>
 * An implementation that fails throws an unchecked
 * {@link org.eddy.common.exceptions.UserException}, after it has made
 * sure that its own downstream receives the error in a finish message.
 */
public interface Transport {
  void processMessage(Message message);
}
