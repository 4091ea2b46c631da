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
package org.eddy.exec.physical.impl.sort;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eddy.categories.OperatorTest;
import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.physical.config.SortLimitSpec;
import org.eddy.exec.physical.config.SortSpec;
import org.eddy.exec.physical.config.TopSpec;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableBuffer;
import org.eddy.test.RecordingTransport.Entry;
import org.eddy.test.SubOperatorTest;
import org.eddy.test.TableBufferBuilder;
import org.eddy.test.TransportHarness;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Sort, sortLimit and top.
 */
@Category(OperatorTest.class)
public class TestSortOperators extends SubOperatorTest {

  private static final GroupKey KEY = TableBufferBuilder.key("host", ColumnType.STRING, "A");
  private static final List<ColumnMeta> SCHEMA = TableBufferBuilder.schema(
      "host", ColumnType.STRING,
      "id", ColumnType.STRING,
      "_value", ColumnType.INT);

  /**
   * Rows as (id, value) pairs.
   */
  private TableBuffer table(Object... pairs) {
    TableBufferBuilder builder = fixture.tableBuilder(KEY, SCHEMA);
    for (int i = 0; i < pairs.length; i += 2) {
      builder.addRow("A", pairs[i], pairs[i + 1]);
    }
    return builder.build();
  }

  private Entry run(TransportHarness harness, TableBuffer... tables) {
    for (TableBuffer table : tables) {
      harness.send(table);
    }
    harness.flush(KEY).finish();
    assertEquals(Arrays.asList(KEY), harness.output().flushes());
    List<Entry> views = harness.output().views();
    assertEquals(1, views.size());
    assertEquals(SCHEMA, views.get(0).cols);
    return views.get(0);
  }

  private static List<String> values(String... columns) {
    return Arrays.asList(columns);
  }

  @Test
  public void testSortAscending() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(values("_value"), false));
    Entry view = run(harness, table("a", 3, "b", 1), table("c", 2, "d", null));
    assertEquals(Arrays.asList(null, 1L, 2L, (Object) 3L), view.column("_value"));
  }

  @Test
  public void testSortDescending() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(null, true));
    Entry view = run(harness, table("a", 3, "b", 1), table("c", 2, "d", null));
    assertEquals(Arrays.asList(3L, 2L, 1L, (Object) null), view.column("_value"));
  }

  @Test
  public void testSortIsStable() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(values("_value"), false));
    Entry view = run(harness, table("a", 2, "b", 1, "c", 2), table("d", 1));
    assertEquals(Arrays.asList((Object) "b", "d", "a", "c"), view.column("id"));
  }

  @Test
  public void testSortOnSeveralColumns() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(values("_value", "id"), false));
    Entry view = run(harness, table("b", 1, "a", 2, "a", 1));
    assertEquals(Arrays.asList((Object) "a", "b", "a"), view.column("id"));
  }

  /**
   * Columns missing from the table are ignored.
   */
  @Test
  public void testSortOnMissingColumn() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(values("other"), false));
    Entry view = run(harness, table("b", 1, "a", 2));
    assertEquals(Arrays.asList((Object) "b", "a"), view.column("id"));
  }

  @Test
  public void testSortSchemaCollision() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortSpec(null, false));
    harness.send(table("a", 1));
    TableBuffer other = fixture.tableBuilder(KEY, TableBufferBuilder.schema(
        "host", ColumnType.STRING,
        "_value", ColumnType.FLOAT))
        .addRow("A", 1.0)
        .build();
    try {
      harness.send(other);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.FAILED_PRECONDITION, e.getErrorType());
      assertEquals("schema collision detected", e.getOriginalMessage());
    }
  }

  @Test
  public void testSortLimit() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortLimitSpec(2, null, null));
    Entry view = run(harness, table("a", 5, "b", 1, "c", 4), table("d", 2, "e", 3));
    assertEquals(Arrays.asList((Object) 1L, 2L), view.column("_value"));
  }

  @Test
  public void testTop() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new TopSpec(2, null, null));
    Entry view = run(harness, table("a", 5, "b", 1, "c", 4), table("d", 2, "e", 3));
    assertEquals(Arrays.asList((Object) 5L, 4L), view.column("_value"));
  }

  @Test
  public void testTopAscending() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new TopSpec(1, values("_value"), false));
    Entry view = run(harness, table("a", 5, "b", 1));
    assertEquals(Arrays.asList((Object) 1L), view.column("_value"));
  }

  /**
   * Among equal rows the first ones to arrive are kept.
   */
  @Test
  public void testSortLimitTies() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortLimitSpec(2, values("_value"), false));
    Entry view = run(harness, table("a", 1, "b", 1), table("c", 1, "d", 0));
    assertEquals(Arrays.asList((Object) "d", "a"), view.column("id"));
  }

  @Test
  public void testSortLimitLargerThanInput() {
    TransportHarness harness = TransportHarness.forSpec(fixture, new SortLimitSpec(10, null, null));
    Entry view = run(harness, table("a", 2, "b", 1));
    assertEquals(Arrays.asList((Object) 1L, 2L), view.column("_value"));
  }

  @Test
  public void testNonPositiveLimit() {
    for (int n : new int[] {0, -1}) {
      try {
        TransportHarness.forSpec(fixture, new SortLimitSpec(n, Collections.<String>emptyList(), null));
        fail();
      } catch (UserException e) {
        assertEquals(ErrorType.INVALID, e.getErrorType());
        assertEquals("cardinality must be positive", e.getOriginalMessage());
      }
    }
  }
}
