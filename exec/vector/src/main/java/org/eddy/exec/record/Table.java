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
package org.eddy.exec.record;

import java.util.List;
import java.util.function.Consumer;

/**
 * A complete table: every buffer for one group key, read in a single
 * pass. Used where an operator needs the whole table at once, such as the
 * pull-style operators behind the legacy adapter.
 * <p>
 * A table can be read once. {@link #forEach(Consumer)} hands out each
 * buffer as a view and releases it after the callback returns; a reader
 * that wants to keep a view retains it. A table that will not be read
 * must be discarded with {@link #done()}.
 */
public interface Table {

  GroupKey key();

  List<ColumnMeta> cols();

  /**
   * True if the table has no rows.
   */
  boolean isEmpty();

  void forEach(Consumer<TableView> reader);

  void done();
}
