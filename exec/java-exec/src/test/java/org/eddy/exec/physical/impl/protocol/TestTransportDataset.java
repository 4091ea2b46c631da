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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.eddy.categories.OperatorTest;
import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.ops.OperatorContext;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableBuffer;
import org.eddy.test.RecordingTransport;
import org.eddy.test.SubOperatorTest;
import org.eddy.test.TableBufferBuilder;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Message fan-out, reference counting and end-of-stream handling of the
 * dataset that connects an operator to its consumers.
 */
@Category(OperatorTest.class)
public class TestTransportDataset extends SubOperatorTest {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TestTransportDataset.class);

  private static final GroupKey KEY = TableBufferBuilder.key("host", ColumnType.STRING, "A");
  private static final List<ColumnMeta> SCHEMA = TableBufferBuilder.schema(
      "host", ColumnType.STRING,
      "_value", ColumnType.INT);

  private TableBuffer buffer() {
    return fixture.tableBuilder(KEY, SCHEMA)
        .addRow("A", 1)
        .addRow("A", 2)
        .build();
  }

  private TransportDataset dataset(int writers) {
    OperatorContext context = fixture.newOperatorContext("test");
    return new TransportDataset(context.getId(), context.getAllocator(), writers);
  }

  @Test
  public void testSingleDownstream() {
    TransportDataset dataset = dataset(1);
    RecordingTransport out = new RecordingTransport();
    dataset.addTransformation(out);

    dataset.process(buffer().asView());
    dataset.flushKey(KEY);
    dataset.updateWatermarkForKey(KEY, "_time", 10);
    dataset.close();

    assertEquals(4, out.entries().size());
    assertEquals(MessageType.PROCESS_VIEW, out.entries().get(0).type);
    assertEquals(dataset.getId(), out.entries().get(0).source);
    assertEquals(2, out.views().get(0).len());
    assertEquals(KEY, out.flushes().get(0));
    assertEquals(MessageType.WATERMARK_KEY, out.entries().get(2).type);
    assertEquals(1, out.finishCount());
    assertNull(out.error());
    assertTrue(dataset.isFinished());
  }

  /**
   * Each consumer gets its own reference to a shared buffer; the buffer
   * is freed once every consumer acknowledged its copy.
   */
  @Test
  public void testFanOut() {
    TransportDataset dataset = dataset(1);
    RecordingTransport out1 = new RecordingTransport(true);
    RecordingTransport out2 = new RecordingTransport(true);
    dataset.addTransformation(out1);
    dataset.addTransformation(out2);

    TableBuffer buffer = buffer();
    dataset.process(buffer.asView());
    assertEquals(2, buffer.refCnt());
    assertSame(out1.retainedViews().get(0).buffer(), out2.retainedViews().get(0).buffer());

    out1.releaseViews();
    assertEquals(1, buffer.refCnt());
    out2.releaseViews();
    assertEquals(0, buffer.refCnt());
    assertEquals(0, fixture.allocator().getAllocatedMemory());

    dataset.close();
    assertEquals(1, out1.finishCount());
    assertEquals(1, out2.finishCount());
  }

  @Test
  public void testNoDownstream() {
    TransportDataset dataset = dataset(1);
    dataset.process(buffer().asView());
    dataset.close();
    assertEquals(0, fixture.allocator().getAllocatedMemory());
  }

  /**
   * A dataset shared by several writers finishes once, after the last
   * writer closed it.
   */
  @Test
  public void testMultipleWriters() {
    TransportDataset dataset = dataset(3);
    RecordingTransport out = new RecordingTransport();
    dataset.addTransformation(out);

    dataset.close();
    dataset.close();
    assertFalse(dataset.isFinished());
    assertEquals(0, out.finishCount());
    dataset.close();
    assertTrue(dataset.isFinished());
    assertEquals(1, out.finishCount());
  }

  @Test
  public void testAbort() {
    TransportDataset dataset = dataset(2);
    RecordingTransport out = new RecordingTransport();
    dataset.addTransformation(out);

    UserException error = UserException.failedPreconditionError()
        .message("boom")
        .build(logger);
    dataset.abort(error);
    dataset.abort(error);
    dataset.close();

    assertEquals(1, out.finishCount());
    assertSame(error, out.error());

    // A writer that did not see the abort yet: its view is dropped.
    TableBuffer buffer = buffer();
    dataset.process(buffer.asView());
    assertEquals(0, buffer.refCnt());
    assertTrue(out.views().isEmpty());
  }

  /**
   * A failing consumer does not keep the others from seeing the message;
   * its failure is rethrown afterwards and the buffer is still released.
   */
  @Test
  public void testFailingDownstream() {
    TransportDataset dataset = dataset(1);
    Transport failing = mock(Transport.class);
    doThrow(new IllegalStateException("consumer failed")).when(failing).processMessage(any(Message.class));
    RecordingTransport out = new RecordingTransport();
    dataset.addTransformation(failing);
    dataset.addTransformation(out);

    TableBuffer buffer = buffer();
    try {
      dataset.process(buffer.asView());
      fail();
    } catch (IllegalStateException e) {
      assertEquals("consumer failed", e.getMessage());
    }
    verify(failing).processMessage(any(Message.class));
    assertEquals(1, out.views().size());

    // The mock never acknowledged its copy.
    assertEquals(1, buffer.refCnt());
    buffer.release();
  }

  @Test
  public void testGroupState() {
    TransportDataset dataset = dataset(1);
    GroupKey other = TableBufferBuilder.key("host", ColumnType.STRING, "B");
    assertNull(dataset.lookup(KEY));
    dataset.set(KEY, "a");
    assertEquals("b", dataset.<String>lookupOrCreate(other, () -> "b"));
    assertEquals("b", dataset.<String>lookupOrCreate(other, () -> "c"));
    assertEquals("a", dataset.lookup(KEY));

    StringBuilder seen = new StringBuilder();
    dataset.<String>range((key, value) -> seen.append(value));
    assertEquals("ab", seen.toString());

    assertEquals("a", dataset.delete(KEY));
    assertNull(dataset.lookup(KEY));
    dataset.clearState();
    assertNull(dataset.lookup(other));
  }

  @Test
  public void testMessageAck() {
    TableBuffer buffer = buffer();
    ProcessViewMessage message = new ProcessViewMessage(DatasetId.of("x"), buffer.asView());
    Message copy = message.dup();
    assertEquals(2, buffer.refCnt());
    copy.ack();
    message.ack();
    assertEquals(0, buffer.refCnt());
    try {
      message.ack();
      fail();
    } catch (IllegalStateException e) {
      // Expected
    }
  }
}
