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
package org.eddy.exec.physical.impl.group;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.eddy.categories.OperatorTest;
import org.eddy.common.exceptions.ErrorType;
import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.physical.config.GroupSpec;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.record.TableView;
import org.eddy.test.RecordingTransport.Entry;
import org.eddy.test.SubOperatorTest;
import org.eddy.test.TableBufferBuilder;
import org.eddy.test.TableComparison;
import org.eddy.test.TransportHarness;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(OperatorTest.class)
public class TestGroupByTransformation extends SubOperatorTest {

  private static final List<ColumnMeta> SCHEMA = TableBufferBuilder.schema(
      "t1", ColumnType.STRING,
      "t2", ColumnType.STRING,
      "_value", ColumnType.INT);

  private TableBuffer pairTable(String t1, String t2, int... values) {
    TableBufferBuilder builder = fixture.tableBuilder(TableBufferBuilder.key(
        "t1", ColumnType.STRING, t1,
        "t2", ColumnType.STRING, t2), SCHEMA);
    for (int value : values) {
      builder.addRow(t1, t2, value);
    }
    return builder.build();
  }

  private static List<Object> valuesFor(List<Entry> views, GroupKey key) {
    List<Object> values = new ArrayList<>();
    for (Entry view : views) {
      if (view.key.equals(key)) {
        values.addAll(view.column("_value"));
      }
    }
    return values;
  }

  /**
   * Regrouping on a subset of the input key: every table lands under the
   * projected key and rows of a key keep their arrival order.
   */
  @Test
  public void testRegroupOnKeySubset() {
    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.by("t1"));
    harness.sendAndFlush(pairTable("a", "x", 1, 2))
        .sendAndFlush(pairTable("a", "y", 3))
        .sendAndFlush(pairTable("b", "x", 4, 5))
        .sendAndFlush(pairTable("a", "z", 6))
        .finish();

    List<Entry> views = harness.output().views();
    assertEquals(4, views.size());
    GroupKey a = TableBufferBuilder.key("t1", ColumnType.STRING, "a");
    GroupKey b = TableBufferBuilder.key("t1", ColumnType.STRING, "b");
    assertEquals(Arrays.asList((Object) 1L, 2L, 3L, 6L), valuesFor(views, a));
    assertEquals(Arrays.asList((Object) 4L, 5L), valuesFor(views, b));
    for (Entry view : views) {
      assertEquals(SCHEMA, view.cols);
    }
    assertEquals(1, harness.output().finishCount());
  }

  /**
   * When the new key only uses input key columns, the output shares the
   * input's arrays.
   */
  @Test
  public void testFastPathSharesArrays() {
    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.by("t1"), true);
    TableBuffer input = pairTable("a", "x", 1, 2, 3);
    input.retain();
    harness.send(input).finish();

    TableView output = harness.output().retainedViews().get(0);
    assertEquals(TableBufferBuilder.key("t1", ColumnType.STRING, "a"), output.key());
    for (int j = 0; j < input.nCols(); j++) {
      assertSame(input.values(j), output.values(j));
    }
    harness.output().releaseViews();
    input.release();
  }

  /**
   * Rows are routed by the values of a column outside the input key.
   */
  @Test
  public void testRegroupByValue() {
    GroupKey key = TableBufferBuilder.key("_measurement", ColumnType.STRING, "cpu");
    List<ColumnMeta> schema = TableBufferBuilder.schema(
        "_measurement", ColumnType.STRING,
        "host", ColumnType.STRING,
        "_value", ColumnType.FLOAT);
    TableBuffer input = fixture.tableBuilder(key, schema)
        .addRow("cpu", "A", 1.0)
        .addRow("cpu", "B", 2.0)
        .addRow("cpu", "A", 3.0)
        .addRow("cpu", null, 4.0)
        .build();

    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.by("host"));
    harness.send(input).finish();

    List<Entry> views = harness.output().views();
    assertEquals(3, views.size());
    TableComparison.verifyAndClear(fixture.tableBuilder(
        TableBufferBuilder.key("host", ColumnType.STRING, "A"), schema)
        .addRow("cpu", "A", 1.0)
        .addRow("cpu", "A", 3.0)
        .build(), views.get(0));
    TableComparison.verifyAndClear(fixture.tableBuilder(
        TableBufferBuilder.key("host", ColumnType.STRING, "B"), schema)
        .addRow("cpu", "B", 2.0)
        .build(), views.get(1));
    TableComparison.verifyAndClear(fixture.tableBuilder(
        TableBufferBuilder.key("host", ColumnType.STRING, null), schema)
        .addRow("cpu", null, 4.0)
        .build(), views.get(2));
  }

  /**
   * Rows whose float key value is NaN share one output table.
   */
  @Test
  public void testRegroupByNaN() {
    GroupKey key = TableBufferBuilder.key("_measurement", ColumnType.STRING, "cpu");
    List<ColumnMeta> schema = TableBufferBuilder.schema(
        "_measurement", ColumnType.STRING,
        "v", ColumnType.FLOAT,
        "_value", ColumnType.INT);
    TableBuffer input = fixture.tableBuilder(key, schema)
        .addRow("cpu", Double.NaN, 1)
        .addRow("cpu", 1.0, 2)
        .addRow("cpu", Double.NaN, 3)
        .build();

    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.by("v"));
    harness.send(input).finish();

    List<Entry> views = harness.output().views();
    assertEquals(2, views.size());
    GroupKey nan = TableBufferBuilder.key("v", ColumnType.FLOAT, Double.NaN);
    assertEquals(Arrays.asList((Object) 1L, 3L), valuesFor(views, nan));
    assertEquals(Arrays.asList((Object) 2L),
        valuesFor(views, TableBufferBuilder.key("v", ColumnType.FLOAT, 1.0)));
  }

  @Test
  public void testExcept() {
    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.except("_value"));
    harness.send(pairTable("a", "x", 1)).finish();
    Entry view = harness.output().views().get(0);
    assertEquals(TableBufferBuilder.key(
        "t1", ColumnType.STRING, "a",
        "t2", ColumnType.STRING, "x"), view.key);
  }

  /**
   * Grouping by nothing, then by the original key columns, gives back the
   * input table.
   */
  @Test
  public void testUngroupRegroup() {
    TransportHarness ungroup = TransportHarness.forSpec(fixture, GroupSpec.by());
    TransportHarness regroup = new TransportHarness(fixture, GroupSpec.KIND,
        ungroup.context().getId().getName());
    regroup.attach(TransportHarness.registry().createTransport(
        GroupSpec.by("t1", "t2"), regroup.context(), regroup.dataset()));
    ungroup.dataset().addTransformation(regroup.transport());

    ungroup.send(pairTable("a", "x", 1, 2, 3)).finish();

    assertEquals(GroupKey.EMPTY, ungroup.output().views().get(0).key);
    List<Entry> views = regroup.output().views();
    assertEquals(1, views.size());
    TableComparison.verifyAndClear(pairTable("a", "x", 1, 2, 3), views.get(0));
    assertEquals(1, regroup.output().finishCount());
  }

  @Test
  public void testSchemaCollision() {
    List<ColumnMeta> strings = TableBufferBuilder.schema(
        "t1", ColumnType.STRING,
        "t2", ColumnType.STRING,
        "_value", ColumnType.STRING);
    TableBuffer other = fixture.tableBuilder(TableBufferBuilder.key(
        "t1", ColumnType.STRING, "a",
        "t2", ColumnType.STRING, "y"), strings)
        .addRow("a", "y", "text")
        .build();

    TransportHarness harness = TransportHarness.forSpec(fixture, GroupSpec.by("t1"));
    harness.send(pairTable("a", "x", 1));
    try {
      harness.send(other);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.FAILED_PRECONDITION, e.getErrorType());
      assertEquals("schema collision detected: column \"_value\" is both int and string",
          e.getOriginalMessage());
    }
    assertEquals(ErrorType.FAILED_PRECONDITION, harness.output().error().getErrorType());
  }

  @Test
  public void testInvalidMode() {
    try {
      TransportHarness.forSpec(fixture, new GroupSpec("around", Arrays.asList("t1")));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.INVALID, e.getErrorType());
    }
  }
}
