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
package org.eddy.common.exceptions;

/**
 * Classification of an error by how the engine handles it, as opposed
 * to by where it was raised. The code travels with the error to the
 * client so that user interfaces can classify it.
 */
public enum ErrorType {

  /**
   * A bug or an impossible state: invalid procedure spec type, missing
   * registered kind and so on. Fatal for the query.
   */
  INTERNAL("internal error"),

  /**
   * The data does not satisfy what the operator needs: missing required
   * column, schema collision, unsupported aggregate input type.
   */
  FAILED_PRECONDITION("failed precondition"),

  /**
   * Bad user-supplied configuration, detected when the operator is
   * constructed and before execution starts.
   */
  INVALID("invalid"),

  /**
   * Wraps an error raised by user code, such as a compiled predicate.
   * The code of the wrapped error, if any, is passed through.
   */
  INHERIT("inherit"),

  /**
   * The query was cancelled or timed out.
   */
  CANCELED("canceled");

  private final String description;

  ErrorType(String description) {
    this.description = description;
  }

  public String description() { return description; }
}
