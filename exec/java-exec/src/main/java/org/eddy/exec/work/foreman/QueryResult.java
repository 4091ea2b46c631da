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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eddy.common.exceptions.UserException;

/**
 * Outcome of one query: the named results and the error that ended the
 * query, if any. Results received before an error are kept.
 */
public class QueryResult {

  private final Map<String, ResultTable> results;
  private final UserException error;
  private final int concurrencyQuota;

  public QueryResult(Map<String, ResultTable> results, UserException error, int concurrencyQuota) {
    this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    this.error = error;
    this.concurrencyQuota = concurrencyQuota;
  }

  public Map<String, ResultTable> getResults() { return results; }

  /**
   * The result with the given name, or null if the plan has no such
   * result.
   */
  public ResultTable getResult(String name) {
    return results.get(name);
  }

  public UserException getError() { return error; }

  public boolean isSuccess() { return error == null; }

  public int getConcurrencyQuota() { return concurrencyQuota; }

  @Override
  public String toString() {
    return "QueryResult[results=" + results.keySet()
        + (error == null ? "" : ", error=" + error.getOriginalMessage()) + "]";
  }
}
