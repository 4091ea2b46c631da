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
package org.eddy.exec.physical.impl;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import org.eddy.categories.OperatorTest;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.expr.Functions;
import org.eddy.exec.physical.base.ProcedureSpec;
import org.eddy.exec.physical.config.CountSpec;
import org.eddy.exec.physical.config.FilterSpec;
import org.eddy.exec.physical.config.GroupSpec;
import org.eddy.exec.physical.config.KurtosisSpec;
import org.eddy.exec.physical.config.MapSpec;
import org.eddy.exec.physical.config.MeanSpec;
import org.eddy.exec.physical.config.ModeSpec;
import org.eddy.exec.physical.config.SortLimitSpec;
import org.eddy.exec.physical.config.SortSpec;
import org.eddy.exec.physical.config.SumSpec;
import org.eddy.exec.physical.config.TopSpec;
import org.eddy.exec.physical.config.UnionSpec;
import org.eddy.exec.physical.config.WindowSpec;
import org.eddy.exec.physical.config.YieldSpec;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.GroupKey;
import org.eddy.test.SubOperatorTest;
import org.eddy.test.TableBufferBuilder;
import org.eddy.test.TransportHarness;
import org.junit.Test;
import org.junit.experimental.categories.Category;

/**
 * Every operator accepts a table without rows.
 */
@Category(OperatorTest.class)
public class TestEmptyTables extends SubOperatorTest {

  private static final GroupKey KEY = TableBufferBuilder.key("host", ColumnType.STRING, "A");
  private static final List<ColumnMeta> SCHEMA = TableBufferBuilder.schema(
      "host", ColumnType.STRING,
      "_time", ColumnType.TIME,
      "_value", ColumnType.FLOAT);

  private static List<ProcedureSpec> specs() {
    Instant start = Instant.parse("2024-01-01T00:00:00Z");
    return Arrays.<ProcedureSpec>asList(
        new FilterSpec(Functions.predicate(row -> true), true),
        new MapSpec(Functions.function(row -> row), true),
        GroupSpec.by("host"),
        GroupSpec.except("host"),
        new CountSpec(),
        new SumSpec(),
        new MeanSpec(),
        new KurtosisSpec(),
        new ModeSpec("_value"),
        new WindowSpec(Duration.ofMinutes(1)),
        new WindowSpec(Duration.ofMinutes(1), null, null, null, true, null, null, null,
            new WindowSpec.Bounds(start, start.plusSeconds(120))),
        new SortSpec(null, false),
        new SortLimitSpec(1, null, null),
        new TopSpec(1, null, null),
        new UnionSpec(),
        new YieldSpec("out"));
  }

  @Test
  public void testEmptyTable() {
    for (ProcedureSpec spec : specs()) {
      TransportHarness harness = TransportHarness.forSpec(fixture, spec);
      harness.sendAndFlush(fixture.tableBuilder(KEY, SCHEMA).build()).finish();
      assertNull(spec.getKind(), harness.output().error());
      assertEquals(spec.getKind(), 1, harness.output().finishCount());
    }
    assertEquals(0, fixture.allocator().getAllocatedMemory());
  }
}
