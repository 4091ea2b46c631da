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
package org.eddy.exec.physical.base;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * Declares that a node may run as <tt>factor</tt> parallel instances.
 */
public class ParallelRunAttribute {

  private final int factor;

  @JsonCreator
  public ParallelRunAttribute(@JsonProperty("factor") int factor) {
    Preconditions.checkArgument(factor > 0, "parallel factor must be positive: %s", factor);
    this.factor = factor;
  }

  @JsonProperty("factor")
  public int getFactor() { return factor; }

  @Override
  public String toString() {
    return "ParallelRun[factor=" + factor + "]";
  }
}
