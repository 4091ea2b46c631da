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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.time.Instant;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;
import org.eddy.exec.memory.RootAllocator;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.primitives.UnsignedLong;

public class TestValueArrays {

  private BufferAllocator allocator;

  @Before
  public void setup() {
    allocator = new RootAllocator(1024 * 1024);
  }

  @After
  public void teardown() {

    // Fails if any test leaked an array.

    allocator.close();
  }

  @Test
  public void testBigInt() {
    BigIntArray.Builder builder = new BigIntArray.Builder(allocator);
    for (int i = 0; i < 100; i++) {
      builder.append(i);
    }
    builder.appendNull();
    ValueArray arr = builder.build();
    assertEquals(ColumnType.INT, arr.getType());
    assertEquals(101, arr.size());
    assertEquals(1, arr.getNullCount());
    assertEquals(42L, arr.getObject(42));
    assertEquals(42L, ((BigIntArray) arr).getLong(42));
    assertTrue(arr.isNull(100));
    assertNull(arr.getObject(100));
    assertTrue(allocator.getAllocatedMemory() > 0);
    assertTrue(arr.release());
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test
  public void testTypedValues() {
    Instant t = Instant.parse("2018-05-22T19:53:26.000000123Z");
    Object[][] cases = {
        { ColumnType.BOOL, true },
        { ColumnType.UINT, UnsignedLong.valueOf("18446744073709551615") },
        { ColumnType.FLOAT, 1.5D },
        { ColumnType.STRING, "cpu" },
        { ColumnType.TIME, t },
        { ColumnType.DURATION, Duration.ofSeconds(90) },
    };
    for (Object[] c : cases) {
      ColumnType type = (ColumnType) c[0];
      ArrayBuilder builder = TypeHelper.newBuilder(type, allocator);
      builder.appendNull();
      builder.appendObject(c[1]);
      ValueArray arr = builder.build();
      assertEquals(type, arr.getType());
      assertTrue(arr.isNull(0));
      assertEquals(c[1], arr.getObject(1));
      arr.release();
    }
  }

  @Test
  public void testIntegerWidening() {
    ArrayBuilder builder = TypeHelper.newBuilder(ColumnType.INT, allocator);
    builder.appendObject(7);
    ValueArray arr = builder.build();
    assertEquals(7L, arr.getObject(0));
    arr.release();
  }

  @Test
  public void testWrongClass() {
    ArrayBuilder builder = TypeHelper.newBuilder(ColumnType.STRING, allocator);
    try {
      builder.appendObject(10L);
      fail();
    } catch (IllegalArgumentException e) {
      // Expected
    }
    builder.build().release();
  }

  @Test(expected = UserException.class)
  public void testInvalidType() {
    TypeHelper.newBuilder(ColumnType.INVALID, allocator);
  }

  /**
   * A slice shares storage and keeps its parent alive after the parent's
   * own reference is released.
   */
  @Test
  public void testSlice() {
    VarCharArray.Builder builder = new VarCharArray.Builder(allocator);
    builder.append("a");
    builder.append(null);
    builder.append("c");
    builder.append("d");
    ValueArray arr = builder.build();
    ValueArray slice = arr.slice(1, 3);
    assertEquals(2, slice.size());
    assertTrue(slice.isNull(0));
    assertEquals(1, slice.getNullCount());
    assertEquals("c", slice.getObject(1));
    assertEquals(2, arr.refCnt());

    assertFalse(arr.release());
    assertTrue(allocator.getAllocatedMemory() > 0);
    assertEquals("c", ((VarCharArray) slice).getString(1));
    assertTrue(slice.release());
    assertEquals(0, arr.refCnt());
    assertEquals(0, allocator.getAllocatedMemory());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testSliceBounds() {
    ValueArray arr = TypeHelper.repeat(ColumnType.INT, 1L, 3, allocator);
    try {
      arr.slice(2, 4);
    } finally {
      arr.release();
    }
  }

  @Test
  public void testRepeat() {
    ValueArray arr = TypeHelper.repeat(ColumnType.STRING, "cpu", 5, allocator);
    assertEquals(5, arr.size());
    for (int i = 0; i < 5; i++) {
      assertEquals("cpu", arr.getObject(i));
    }
    arr.release();
  }

  @Test
  public void testCompare() {
    assertTrue(TypeHelper.compare(ColumnType.INT, null, 1L) < 0);
    assertTrue(TypeHelper.compare(ColumnType.BOOL, false, true) < 0);
    assertTrue(TypeHelper.compare(ColumnType.UINT,
        UnsignedLong.valueOf(1), UnsignedLong.fromLongBits(-1L)) < 0);
    assertEquals(0, TypeHelper.compare(ColumnType.STRING, null, null));
  }

  @Test
  public void testTimeConversion() {
    Instant before = Instant.parse("1969-12-31T23:59:59.999999999Z");
    assertEquals(-1L, TypeHelper.toNanos(before));
    assertEquals(before, TypeHelper.toInstant(-1L));
  }
}
