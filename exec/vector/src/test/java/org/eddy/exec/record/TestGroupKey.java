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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eddy.common.types.ColumnType;
import org.junit.Test;

public class TestGroupKey {

  private static GroupKey key(Object... labelValues) {
    GroupKeyBuilder builder = new GroupKeyBuilder();
    for (int i = 0; i < labelValues.length; i += 2) {
      Object value = labelValues[i + 1];
      ColumnType type = value instanceof Long ? ColumnType.INT
          : value instanceof Boolean ? ColumnType.BOOL : ColumnType.STRING;
      builder.addKeyValue((String) labelValues[i], type, value);
    }
    return builder.build();
  }

  @Test
  public void testAccessors() {
    GroupKey k = key("_measurement", "cpu", "host", "A");
    assertEquals(2, k.nCols());
    assertEquals(ColumnMeta.of("host", ColumnType.STRING), k.col(1));
    assertEquals("A", k.value(1));
    assertTrue(k.hasCol("host"));
    assertFalse(k.hasCol("region"));
    assertEquals(-1, k.index("region"));
    assertEquals("cpu", k.labelValue("_measurement"));
    assertNull(k.labelValue("region"));
    assertEquals("{_measurement=cpu,host=A}", k.toString());
  }

  @Test
  public void testEqualityIgnoresOrder() {
    GroupKey a = key("t1", "a", "t2", "x");
    GroupKey b = key("t2", "x", "t1", "a");
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(0, a.compareTo(b));
  }

  @Test
  public void testEqualityIsTypeSensitive() {
    GroupKey a = new GroupKeyBuilder().addKeyValue("v", ColumnType.INT, 1L).build();
    GroupKey b = new GroupKeyBuilder().addKeyValue("v", ColumnType.STRING, "1").build();
    assertNotEquals(a, b);
  }

  @Test
  public void testNulls() {
    GroupKey a = new GroupKeyBuilder().addKeyValue("host", ColumnType.STRING, null).build();
    GroupKey b = new GroupKeyBuilder().addKeyValue("host", ColumnType.STRING, null).build();
    GroupKey c = key("host", "A");
    assertEquals(a, b);
    assertNotEquals(a, c);
    assertTrue(a.less(c));
    assertFalse(c.less(a));
  }

  @Test
  public void testSorted() {
    GroupKey sorted = key("a", "1", "b", "2");
    assertSame(sorted, sorted.sorted());
    GroupKey unsorted = key("b", "2", "a", "1");
    GroupKey s = unsorted.sorted();
    assertEquals("a", s.col(0).getLabel());
    assertSame(s, s.sorted());
    assertEquals(unsorted, s);
  }

  @Test
  public void testOrdering() {
    List<GroupKey> keys = new ArrayList<>(Arrays.asList(
        key("a", "2"),
        key("b", "1"),
        key("a", "1", "b", "1"),
        key("a", "1"),
        key("a", true),
        key("a", false),
        GroupKey.EMPTY));
    Collections.sort(keys);
    assertEquals(Arrays.asList(
        GroupKey.EMPTY,
        key("a", false),
        key("a", true),
        key("a", "1"),
        key("a", "1", "b", "1"),
        key("a", "2"),
        key("b", "1")), keys);
  }

  /**
   * When the compared columns tie, the shorter key is the lesser.
   */
  @Test
  public void testPrefixIsLess() {
    GroupKey shorter = key("a", "1");
    GroupKey longer = key("a", "1", "b", "0");
    assertTrue(shorter.less(longer));
    assertFalse(longer.less(shorter));
  }

  /**
   * Float keys agree between equality, hashing and ordering: NaN matches
   * itself and the two zeros are distinct.
   */
  @Test
  public void testFloatValues() {
    GroupKey nan1 = new GroupKeyBuilder().addKeyValue("v", ColumnType.FLOAT, Double.NaN).build();
    GroupKey nan2 = new GroupKeyBuilder().addKeyValue("v", ColumnType.FLOAT, 0.0 / 0.0).build();
    assertEquals(nan1, nan2);
    assertEquals(nan1.hashCode(), nan2.hashCode());
    assertEquals(0, nan1.compareTo(nan2));

    GroupKey zero = new GroupKeyBuilder().addKeyValue("v", ColumnType.FLOAT, 0.0).build();
    GroupKey negativeZero = new GroupKeyBuilder().addKeyValue("v", ColumnType.FLOAT, -0.0).build();
    assertNotEquals(zero, negativeZero);
    assertTrue(negativeZero.less(zero));
    assertTrue(zero.less(nan1));
  }

  @Test
  public void testTimeValues() {
    Instant t = Instant.parse("2018-01-01T00:00:00Z");
    GroupKey a = new GroupKeyBuilder().addKeyValue("_start", ColumnType.TIME, t).build();
    GroupKey b = new GroupKeyBuilder().addKeyValue("_start", ColumnType.TIME, Instant.ofEpochSecond(t.getEpochSecond())).build();
    assertEquals(a, b);
    GroupKey c = new GroupKeyBuilder().addKeyValue("_start", ColumnType.TIME, t.plusSeconds(60)).build();
    assertTrue(a.less(c));
  }

  @Test
  public void testBuilderFromExisting() {
    GroupKey base = key("_measurement", "cpu");
    GroupKey k = new GroupKeyBuilder(base)
        .addKeyValue("_field", ColumnType.STRING, "usage_user")
        .build();
    assertEquals(Arrays.asList(ColumnMeta.of("_measurement", ColumnType.STRING),
        ColumnMeta.of("_field", ColumnType.STRING)), k.cols());
    assertEquals(Arrays.asList("cpu", "usage_user"), k.values());

    // Replacing a label keeps its position.

    k = new GroupKeyBuilder(k).addKeyValue("_measurement", ColumnType.STRING, "mem").build();
    assertEquals(Arrays.asList("mem", "usage_user"), k.values());
  }

  @Test
  public void testBuilderFromNull() {
    GroupKey k = new GroupKeyBuilder(null)
        .addKeyValue("_measurement", ColumnType.STRING, "cpu")
        .build();
    assertEquals(1, k.nCols());
    assertSame(GroupKey.EMPTY, new GroupKeyBuilder().build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testValueTypeChecked() {
    new GroupKey(Arrays.asList(ColumnMeta.of("a", ColumnType.INT)), Arrays.asList("x"));
  }
}
