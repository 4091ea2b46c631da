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
package org.eddy.exec;

import org.eddy.common.config.EddyConfig;

/**
 * Names of the configuration keys and query options read by the
 * execution engine. Defaults live in <tt>eddy-module.conf</tt>.
 */
public final class ExecConstants {

  private ExecConstants() { }

  public static final String CONCURRENCY_PARENT = EddyConfig.append(EddyConfig.EXEC_PARENT, "concurrency");

  /**
   * Workers added to the computed concurrency quota when the query does
   * not set its own increase.
   */
  public static final String CONCURRENCY_INCREASE = EddyConfig.append(CONCURRENCY_PARENT, "increase");

  /**
   * Upper bound on the size of the worker pool of one query.
   */
  public static final String CONCURRENCY_MAX = EddyConfig.append(CONCURRENCY_PARENT, "max");

  /**
   * How long the driver waits for a query to finish. Zero waits forever.
   */
  public static final String QUERY_TIMEOUT = EddyConfig.append(EddyConfig.EXEC_PARENT, "query.timeout");

  /**
   * Limit of the child allocator given to each dataset.
   */
  public static final String OPERATOR_MAX_MEMORY = EddyConfig.append(EddyConfig.MEMORY_PARENT, "operator.max");

  // Per-query options

  public static final String CONCURRENCY_INCREASE_OPTION = "queryConcurrencyIncrease";

  /**
   * Name of the result produced by a plan root that is not a yield.
   */
  public static final String DEFAULT_RESULT_NAME = "_result";
}
