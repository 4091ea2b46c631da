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
package org.eddy.exec.physical.impl.transform;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Transport for aggregates. State lives in the dataset's lookup from the
 * first view of a key until the key is flushed, at which point it is
 * removed and handed to <tt>compute()</tt>. Keys never flushed are
 * computed when all parents finish, in the order they first appeared.
 * Input flushes are not forwarded: <tt>compute()</tt> flushes the output.
 */
public class AggregateTransport<S> extends AbstractTransport {

  private final AggregateTransformation<S> transformation;

  public AggregateTransport(AggregateTransformation<S> transformation,
      OperatorContext context, Dataset dataset) {
    super(context, dataset);
    this.transformation = transformation;
  }

  @Override
  protected void processView(TableView view) {
    GroupKey key = view.key();
    S state = dataset.lookup(key);
    S newState = transformation.aggregate(view, state, allocator());
    if (newState != state) {
      dataset.set(key, newState);
    }
  }

  @Override
  protected void flushKey(GroupKey key) {
    S state = dataset.delete(key);
    if (state != null) {
      transformation.compute(key, state, dataset, allocator());
    }
  }

  @Override
  protected void watermarkKey(GroupKey key, String columnName, long watermark) { }

  @Override
  protected void onFinish() {
    dataset.<S>range((key, state) -> {
      dataset.delete(key);
      transformation.compute(key, state, dataset, allocator());
    });
  }

  @Override
  protected void onAbort(UserException error) {
    dataset.clearState();
  }
}
