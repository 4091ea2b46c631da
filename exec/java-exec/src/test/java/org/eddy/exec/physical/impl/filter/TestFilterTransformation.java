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
package org.eddy.exec.physical.impl.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.eddy.categories.OperatorTest;
import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.expr.ComparisonPredicate;
import org.eddy.exec.expr.Functions;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.impl.transform.AbstractTransport;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;
import org.eddy.test.RecordingTransport.Entry;
import org.eddy.test.SubOperatorTest;
import org.eddy.test.TableBufferBuilder;
import org.eddy.test.TransportHarness;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(OperatorTest.class)
public class TestFilterTransformation extends SubOperatorTest {

  private static final GroupKey KEY = TableBufferBuilder.key(
      "_measurement", ColumnType.STRING, "cpu",
      "host", ColumnType.STRING, "A");
  private static final List<ColumnMeta> SCHEMA = TableBufferBuilder.schema(
      "_measurement", ColumnType.STRING,
      "host", ColumnType.STRING,
      "_value", ColumnType.INT);

  private TableBuffer table(Integer... values) {
    TableBufferBuilder builder = fixture.tableBuilder(KEY, SCHEMA);
    for (Integer value : values) {
      builder.addRow("cpu", "A", value);
    }
    return builder.build();
  }

  private static FilterSpec greaterThan(long value, boolean keepEmpty) {
    return new FilterSpec(new ComparisonPredicate("_value", ComparisonPredicate.Op.GT, value), keepEmpty);
  }

  @Test
  public void testPartialSelection() {
    TransportHarness harness = TransportHarness.forSpec(fixture, greaterThan(10, false));
    harness.sendAndFlush(table(5, 20, null, 30)).finish();

    List<Entry> views = harness.output().views();
    assertEquals(1, views.size());
    assertEquals(KEY, views.get(0).key);
    assertEquals(SCHEMA, views.get(0).cols);
    assertEquals(Arrays.asList((Object) 20L, 30L), views.get(0).column("_value"));
    assertEquals(Arrays.asList((Object) "A", "A"), views.get(0).column("host"));
    assertEquals(Arrays.asList(KEY), harness.output().flushes());
    assertEquals(1, harness.output().finishCount());
  }

  /**
   * With keepEmpty, a table with no matching row still produces one empty
   * table with the input key and schema, followed by the flush.
   */
  @Test
  public void testKeepEmpty() {
    TransportHarness harness = TransportHarness.forSpec(fixture, greaterThan(100, true));
    harness.sendAndFlush(table(1, 50, 100)).finish();

    assertEquals(Arrays.asList(
        "view " + KEY + " []",
        "flush " + KEY,
        "finish"), harness.output().describe());
    Entry view = harness.output().views().get(0);
    assertEquals(SCHEMA, view.cols);
    assertEquals(0, view.len());
  }

  @Test
  public void testDropEmpty() {
    TransportHarness harness = TransportHarness.forSpec(fixture, greaterThan(100, false));
    harness.sendAndFlush(table(1, 50, 100))
        .sendAndFlush(table())
        .finish();
    assertTrue(harness.output().views().isEmpty());
    assertEquals(2, harness.output().flushes().size());
  }

  @Test
  public void testKeepEmptyForEmptyInput() {
    TransportHarness harness = TransportHarness.forSpec(fixture, greaterThan(100, true));
    harness.send(table()).finish();
    List<Entry> views = harness.output().views();
    assertEquals(1, views.size());
    assertEquals(0, views.get(0).len());
  }

  /**
   * A predicate that keeps every row passes the input view on unchanged,
   * without a copy.
   */
  @Test
  public void testAllRowsSelected() {
    TransportHarness harness = TransportHarness.forSpec(fixture,
        new FilterSpec(Functions.predicate(row -> true, "_value"), false), true);
    TableBuffer input = table(1, 2, 3);
    input.retain();
    harness.send(input).finish();

    List<TableView> retained = harness.output().retainedViews();
    assertEquals(1, retained.size());
    assertSame(input, retained.get(0).buffer());
    harness.output().releaseViews();
    input.release();
  }

  /**
   * A predicate on key columns only is evaluated once per view.
   */
  @Test
  public void testDecidedByKey() {
    final int[] calls = new int[1];
    FilterSpec spec = new FilterSpec(Functions.predicate(row -> {
      calls[0]++;
      return "A".equals(row.get("host"));
    }, "host"), false);
    TransportHarness harness = TransportHarness.forSpec(fixture, spec);
    harness.send(table(1, 2, 3, 4)).finish();

    assertEquals(1, calls[0]);
    assertEquals(4, harness.output().views().get(0).len());
  }

  @Test
  public void testPredicateFailure() {
    FilterSpec spec = new FilterSpec(Functions.predicate(row -> {
      throw new IllegalArgumentException("bad row");
    }, "_value"), false);
    TransportHarness harness = TransportHarness.forSpec(fixture, spec);
    try {
      harness.send(table(1));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.INHERIT, e.getErrorType());
      assertEquals("failed to evaluate filter function", e.getOriginalMessage());
      assertTrue(e.getContext().contains(AbstractTransport.OPERATOR_CONTEXT + " filter " + harness.context().getId()));
    }
    assertSame(ErrorType.INHERIT, harness.output().error().getErrorType());
  }

  /**
   * A row without the compared column does not match.
   */
  @Test
  public void testMissingColumn() {
    TransportHarness harness = TransportHarness.forSpec(fixture,
        new FilterSpec(new ComparisonPredicate("missing", ComparisonPredicate.Op.EQ, 1L), false));
    harness.sendAndFlush(table(1, 2)).finish();
    assertTrue(harness.output().views().isEmpty());
    assertNull(harness.output().error());
  }
}
