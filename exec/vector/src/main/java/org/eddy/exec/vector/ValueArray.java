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
package org.eddy.exec.vector;

import org.eddy.common.types.ColumnType;

import io.netty.util.ReferenceCounted;

/**
 * An immutable, reference-counted column of values of a single
 * {@link ColumnType}. Arrays are created by an {@link ArrayBuilder} and
 * hold memory reserved from the builder's allocator until the last
 * reference is released.
 * <p>
 * Values are exposed through the typed accessors of the concrete classes
 * and, generically, through {@link #getObject(int)} which returns the
 * Java value for the type (see {@link TypeHelper}).
 */
public interface ValueArray extends ReferenceCounted {

  ColumnType getType();

  /**
   * Number of values, including nulls.
   */
  int size();

  int getNullCount();

  boolean isNull(int index);

  /**
   * The value at the index as a Java object, or null.
   */
  Object getObject(int index);

  /**
   * Returns a view of the values in <tt>[start, end)</tt>. The slice
   * shares storage with this array and holds a reference to it until the
   * slice itself is released.
   */
  ValueArray slice(int start, int end);

  /**
   * Bytes reserved for this array; zero for a slice.
   */
  long getBufferSize();

  @Override
  ValueArray retain();
}
