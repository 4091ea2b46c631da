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
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.transform.AbstractTransport;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Collects what one plan root emits into a {@link ResultTable} and tells
 * the {@link Foreman} when the root finished.
 */
class ResultTransport extends AbstractTransport {

  interface Listener {
    void resultFinished(ResultTransport transport, UserException error);
  }

  private final ResultTable table;
  private final Listener listener;
  private boolean reported;

  ResultTransport(ResultTable table, Listener listener, OperatorContext context, Dataset dataset) {
    super(context, dataset);
    this.table = table;
    this.listener = listener;
  }

  public ResultTable getTable() { return table; }

  @Override
  protected void processView(TableView view) {
    table.append(view);
  }

  @Override
  protected void flushKey(GroupKey key) {
    table.flushKey(key);
    super.flushKey(key);
  }

  @Override
  protected void onFinish() {
    report(null);
  }

  @Override
  protected void onAbort(UserException error) {
    report(error);
  }

  private void report(UserException error) {
    if (reported) {
      return;
    }
    reported = true;
    listener.resultFinished(this, error);
  }

  @Override
  protected String describe() {
    return "result " + table.getName() + " of " + context.getParents();
  }
}
