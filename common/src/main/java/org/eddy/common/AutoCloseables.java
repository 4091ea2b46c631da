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
package org.eddy.common;

import java.util.Arrays;
import java.util.Collection;

/**
 * Utilities for closing a group of resources where each close must be
 * attempted even if an earlier one fails.
 */
public final class AutoCloseables {

  private AutoCloseables() { }

  public static void close(AutoCloseable... closeables) {
    close(Arrays.asList(closeables));
  }

  /**
   * Closes every non-null resource. The first failure is rethrown after
   * all closes were attempted; later failures are attached as suppressed
   * exceptions.
   */
  public static void close(Collection<? extends AutoCloseable> closeables) {
    RuntimeException first = null;
    for (AutoCloseable c : closeables) {
      if (c == null) {
        continue;
      }
      try {
        c.close();
      } catch (Exception e) {
        if (first == null) {
          first = e instanceof RuntimeException ? (RuntimeException) e : new RuntimeException(e);
        } else {
          first.addSuppressed(e);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }
}
