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

import com.google.common.base.Preconditions;

/**
 * Identifies a dataset within one execution. Operators refer to their
 * parents and successors through these handles rather than holding
 * references to the other operators.
 */
public final class DatasetId {

  private final String name;

  private DatasetId(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  public static DatasetId of(String name) {
    return new DatasetId(name);
  }

  public String getName() { return name; }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof DatasetId && name.equals(((DatasetId) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
