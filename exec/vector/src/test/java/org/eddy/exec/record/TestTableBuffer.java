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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.memory.RootAllocator;
import org.eddy.exec.vector.TypeHelper;
import org.eddy.exec.vector.ValueArray;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class TestTableBuffer {

  private static final GroupKey KEY = new GroupKeyBuilder()
      .addKeyValue("host", ColumnType.STRING, "A")
      .build();
  private static final List<ColumnMeta> SCHEMA = Arrays.asList(
      ColumnMeta.of("host", ColumnType.STRING),
      ColumnMeta.of("_value", ColumnType.FLOAT));

  private BufferAllocator allocator;

  @Before
  public void setup() {
    allocator = new RootAllocator(1024 * 1024);
  }

  @After
  public void teardown() {
    allocator.close();
  }

  private TableBuffer build(double... values) {
    ArrayTableBuilder builder = new ArrayTableBuilder(KEY, allocator);
    builder.addCols(SCHEMA);
    for (double v : values) {
      builder.appendKeyValues();
      builder.appendValue(1, v);
      builder.finishRow();
    }
    return builder.build();
  }

  @Test
  public void testBuildAndRelease() {
    TableBuffer buffer = build(1, 2, 3);
    buffer.validate();
    assertEquals(3, buffer.len());
    assertEquals(1, buffer.colIndex("_value"));
    assertEquals(-1, buffer.colIndex("nope"));
    assertEquals("A", buffer.values(0).getObject(2));

    TableView view = buffer.asView();
    view.retain();
    assertEquals(2, buffer.refCnt());
    view.release();
    assertTrue(buffer.release());
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test
  public void testEmpty() {
    TableBuffer buffer = TableBuffer.empty(KEY, SCHEMA, allocator);
    buffer.validate();
    assertEquals(0, buffer.len());
    assertTrue(buffer.isEmpty());
    assertEquals(SCHEMA, buffer.cols());
    buffer.release();
  }

  @Test
  public void testValidateKeyColumn() {
    ValueArray host = TypeHelper.repeat(ColumnType.STRING, "B", 1, allocator);
    ValueArray value = TypeHelper.repeat(ColumnType.FLOAT, 1.0, 1, allocator);
    TableBuffer buffer = new TableBuffer(KEY, SCHEMA, Arrays.asList(host, value));
    try {
      buffer.validate();
      fail();
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("key column host"));
    } finally {
      buffer.release();
    }
  }

  @Test
  public void testValidateLengths() {
    ValueArray host = TypeHelper.repeat(ColumnType.STRING, "A", 2, allocator);
    ValueArray value = TypeHelper.repeat(ColumnType.FLOAT, 1.0, 1, allocator);
    TableBuffer buffer = new TableBuffer(KEY, SCHEMA, Arrays.asList(host, value));
    try {
      buffer.validate();
      fail();
    } catch (IllegalStateException e) {
      // Expected
    } finally {
      buffer.release();
    }
  }

  /**
   * A column added after rows were written is back-filled with nulls, and
   * a row that skips a column gets a null.
   */
  @Test
  public void testLateColumn() {
    ArrayTableBuilder builder = new ArrayTableBuilder(GroupKey.EMPTY, allocator);
    int a = builder.addCol("a", ColumnType.INT);
    builder.appendValue(a, 1L);
    builder.finishRow();
    int b = builder.addCol("b", ColumnType.STRING);
    builder.appendValue(b, "x");
    builder.finishRow();
    TableBuffer buffer = builder.build();
    assertEquals(2, buffer.len());
    assertNull(buffer.values(b).getObject(0));
    assertNull(buffer.values(a).getObject(1));
    assertEquals("x", buffer.values(b).getObject(1));
    buffer.release();
  }

  @Test
  public void testSchemaCollision() {
    ArrayTableBuilder builder = new ArrayTableBuilder(GroupKey.EMPTY, allocator);
    builder.addCol("a", ColumnType.INT);
    try {
      builder.addCol("a", ColumnType.FLOAT);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.FAILED_PRECONDITION, e.getErrorType());
      assertTrue(e.getOriginalMessage().startsWith("schema collision detected"));
    }
    builder.build().release();
  }

  @Test
  public void testBufferedTable() {
    BufferedTableBuilder builder = new BufferedTableBuilder(KEY);
    TableBuffer b1 = build(1, 2);
    TableBuffer b2 = build(3);
    builder.append(b1.asView());
    builder.append(b2.asView());
    b1.release();
    b2.release();
    assertEquals(2, builder.bufferCount());

    Table table = builder.table();
    assertEquals(0, builder.bufferCount());
    int[] rows = new int[1];
    table.forEach(view -> rows[0] += view.len());
    assertEquals(3, rows[0]);
    try {
      table.forEach(view -> { });
      fail();
    } catch (IllegalStateException e) {
      // Expected: one-shot
    }
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test
  public void testBufferedTableDone() {
    BufferedTableBuilder builder = new BufferedTableBuilder(KEY);
    TableBuffer b1 = build(1);
    builder.append(b1.asView());
    b1.release();
    builder.table().done();
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test
  public void testBufferedSchemaCollision() {
    BufferedTableBuilder builder = new BufferedTableBuilder(KEY);
    TableBuffer b1 = build(1);
    TableBuffer b2 = TableBuffer.empty(KEY, Arrays.asList(ColumnMeta.of("host", ColumnType.STRING)), allocator);
    builder.append(b1.asView());
    try {
      builder.append(b2.asView());
      fail();
    } catch (UserException e) {
      assertEquals("schema collision detected", e.getOriginalMessage());
    } finally {
      b1.release();
      b2.release();
      builder.release();
    }
  }

  @Test
  public void testRecordFromRow() {
    TableBuffer buffer = build(5.5);
    Record r = Record.fromRow(buffer.asView(), 0);
    assertEquals(Arrays.asList("host", "_value"),
        Arrays.asList(r.cols().get(0).getLabel(), r.cols().get(1).getLabel()));
    assertEquals(5.5, r.get("_value"));
    assertEquals(ColumnType.FLOAT, r.type("_value"));
    buffer.release();
  }
}
