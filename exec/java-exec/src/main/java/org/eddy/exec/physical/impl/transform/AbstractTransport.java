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

import java.util.HashSet;
import java.util.Set;

import org.eddy.common.exceptions.UserException;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.physical.impl.protocol.Dataset;
import org.eddy.exec.physical.impl.protocol.DatasetId;
import org.eddy.exec.physical.impl.protocol.FinishMessage;
import org.eddy.exec.physical.impl.protocol.FlushKeyMessage;
import org.eddy.exec.physical.impl.protocol.Message;
import org.eddy.exec.physical.impl.protocol.ProcessViewMessage;
import org.eddy.exec.physical.impl.protocol.Transport;
import org.eddy.exec.physical.impl.protocol.WatermarkKeyMessage;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableView;

/**
 * Receiving side shared by all transformation shapes. Dispatches each
 * message to the shape-specific handler and enforces the protocol rules
 * so that operator code never sees a message.
 *
 * <h4>Lifecycle</h4>
 * <ul>
 * <li>Views, flushes and watermarks are handled as they arrive. The
 * transport acknowledges every message once the handler returns, so a
 * view belongs to the handler only for the duration of the call.</li>
 * <li>A successful finish is acted on once every parent finished.
 * {@link #onFinish()} runs, then the dataset is closed.</li>
 * <li>A finish with an error from any parent ends the operator at once:
 * {@link #onAbort(UserException)} discards the operator's state and the
 * error is passed to the dataset.</li>
 * <li>Messages that arrive after the operator finished are acknowledged
 * and ignored.</li>
 * </ul>
 *
 * <h4>Error Handling</h4>
 * A handler fails by throwing. Exceptions other than a
 * <tt>UserException</tt> are wrapped in one. The transport aborts its
 * dataset with the error, so the downstream receives it as a finish
 * message, and rethrows it so that the upstream caller, and finally the
 * driver, also sees it.
 * <p>
 * Messages from different parents may arrive on different threads; the
 * transport handles one message at a time.
 */
public abstract class AbstractTransport implements Transport {
  static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AbstractTransport.class);

  public static final String OPERATOR_CONTEXT = "Operator";

  protected final OperatorContext context;
  protected final Dataset dataset;
  private final Set<DatasetId> parents;
  private final Set<DatasetId> finishedParents = new HashSet<>();
  private boolean finished;

  protected AbstractTransport(OperatorContext context, Dataset dataset) {
    this.context = context;
    this.dataset = dataset;
    this.parents = new HashSet<>(context.getParents());
  }

  public Dataset getDataset() { return dataset; }

  protected BufferAllocator allocator() {
    return context.getAllocator();
  }

  public synchronized boolean isFinished() { return finished; }

  @Override
  public synchronized void processMessage(Message message) {
    try {
      if (finished) {
        logger.trace("{} ignoring {} after finish", describe(), message);
        return;
      }
      dispatch(message);
    } catch (RuntimeException e) {
      UserException error = wrap(e);
      finished = true;
      abortDataset(error);
      throw error;
    } finally {
      message.ack();
    }
  }

  private void dispatch(Message message) {
    logger.trace("{} received {}", describe(), message);
    switch (message.getType()) {
    case PROCESS_VIEW:
      context.checkContinue();
      processView(((ProcessViewMessage) message).view());
      break;
    case FLUSH_KEY:
      flushKey(((FlushKeyMessage) message).key());
      break;
    case WATERMARK_KEY:
      WatermarkKeyMessage watermark = (WatermarkKeyMessage) message;
      watermarkKey(watermark.key(), watermark.columnName(), watermark.watermark());
      break;
    case FINISH:
      parentFinished(message.getSourceId(), ((FinishMessage) message).error());
      break;
    default:
      throw new IllegalStateException("Unexpected message type: " + message.getType());
    }
  }

  private void parentFinished(DatasetId parent, UserException error) {
    if (error != null) {
      finish(error);
      return;
    }
    finishedParents.add(parent);
    if (! finishedParents.containsAll(parents)) {
      logger.debug("{}: parent {} finished, {} of {} done",
          describe(), parent, finishedParents.size(), parents.size());
      return;
    }
    finish(null);
  }

  private void finish(UserException error) {
    finished = true;
    if (error == null) {
      onFinish();
      dataset.close();
    } else {
      onAbort(error);
      dataset.abort(error);
    }
  }

  private UserException wrap(RuntimeException e) {
    if (e instanceof UserException) {
      UserException ue = (UserException) e;
      for (String line : ue.getContext()) {
        if (line.startsWith(OPERATOR_CONTEXT + " ")) {
          return ue;
        }
      }
    }
    return UserException.executionError(e)
        .addContext(OPERATOR_CONTEXT, describe())
        .build(logger);
  }

  private void abortDataset(UserException error) {
    try {
      onAbort(error);
    } catch (RuntimeException e) {
      logger.warn("{}: failed to discard operator state", describe(), e);
    }
    dataset.abort(error);
  }

  protected String describe() {
    return context.getOperatorKind() + " " + context.getId();
  }

  protected abstract void processView(TableView view);

  protected void flushKey(GroupKey key) {
    dataset.flushKey(key);
  }

  protected void watermarkKey(GroupKey key, String columnName, long watermark) {
    dataset.updateWatermarkForKey(key, columnName, watermark);
  }

  /**
   * Called once all parents finished successfully, before the dataset is
   * closed. An exception thrown here aborts the dataset instead.
   */
  protected void onFinish() { }

  /**
   * Called when the operator ends with an error. Must not throw.
   */
  protected void onAbort(UserException error) { }
}
