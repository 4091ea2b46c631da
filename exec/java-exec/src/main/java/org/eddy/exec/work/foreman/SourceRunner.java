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
package org.eddy.exec.work.foreman;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.physical.impl.Source;

/**
 * Drives one source instance on a worker thread: calls {@link Source#next()}
 * until the source is done, then ends its dataset.
 */
class SourceRunner implements Runnable {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SourceRunner.class);

  interface ErrorHandler {
    void sourceFailed(UserException error);
  }

  private final String name;
  private final Source source;
  private final ErrorHandler errorHandler;

  SourceRunner(String name, Source source, ErrorHandler errorHandler) {
    this.name = name;
    this.source = source;
    this.errorHandler = errorHandler;
  }

  @Override
  public void run() {
    final Thread currentThread = Thread.currentThread();
    final String originalThreadName = currentThread.getName();
    currentThread.setName(name);
    try {
      logger.debug("Source {} started", name);
      UserException error;
      try {
        while (source.next()) {
          // Each call emits into the source's dataset.
        }
        error = source.err();
        if (error == null) {
          // Downstream operators finish on this thread and may fail here.
          source.getDataset().close();
          logger.debug("Source {} done", name);
        }
      } catch (RuntimeException e) {
        error = UserException.executionError(e)
            .addContext("Source", name)
            .build(logger);
      }
      if (error != null) {
        errorHandler.sourceFailed(error);
        source.getDataset().abort(error);
      }
    } finally {
      currentThread.setName(originalThreadName);
    }
  }
}
