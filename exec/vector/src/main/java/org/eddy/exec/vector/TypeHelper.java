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

import java.time.Duration;
import java.time.Instant;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.memory.BufferAllocator;

import com.google.common.primitives.UnsignedLong;

/**
 * Type-driven helpers for column values. Each column type has one Java
 * representation:
 * <table>
 * <tr><th>Type</th><th>Java class</th></tr>
 * <tr><td>BOOL</td><td>{@link Boolean}</td></tr>
 * <tr><td>INT</td><td>{@link Long}</td></tr>
 * <tr><td>UINT</td><td>{@link UnsignedLong}</td></tr>
 * <tr><td>FLOAT</td><td>{@link Double}</td></tr>
 * <tr><td>STRING</td><td>{@link String}</td></tr>
 * <tr><td>TIME</td><td>{@link Instant}, nanosecond precision</td></tr>
 * <tr><td>DURATION</td><td>{@link Duration}</td></tr>
 * </table>
 */
public final class TypeHelper {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(TypeHelper.class);

  private static final long NANOS_PER_SECOND = 1_000_000_000L;

  private TypeHelper() { }

  public static ArrayBuilder newBuilder(ColumnType type, BufferAllocator allocator) {
    switch (type) {
    case BOOL:
      return new BitArray.Builder(allocator);
    case INT:
      return new BigIntArray.Builder(allocator);
    case UINT:
      return new UInt8Array.Builder(allocator);
    case FLOAT:
      return new Float8Array.Builder(allocator);
    case STRING:
      return new VarCharArray.Builder(allocator);
    case TIME:
      return new TimeStampArray.Builder(allocator);
    case DURATION:
      return new IntervalArray.Builder(allocator);
    default:
      throw UserException.internalError()
          .message("cannot create an array of type %s", type)
          .build(logger);
    }
  }

  /**
   * Creates an array of <tt>n</tt> copies of one value. Used to
   * materialize group key columns.
   */
  public static ValueArray repeat(ColumnType type, Object value, int n, BufferAllocator allocator) {
    ArrayBuilder builder = newBuilder(type, allocator);
    for (int i = 0; i < n; i++) {
      builder.appendObject(value);
    }
    return builder.build();
  }

  /**
   * Verifies that a value has the Java class of the given type, widening
   * the common boxed types (<tt>Integer</tt> to <tt>Long</tt>,
   * <tt>Float</tt> to <tt>Double</tt>) along the way.
   *
   * @return the value in its canonical class
   * @throws IllegalArgumentException if the value does not fit the type
   */
  public static Object checkValue(ColumnType type, Object value) {
    if (value == null) {
      return null;
    }
    switch (type) {
    case BOOL:
      if (value instanceof Boolean) {
        return value;
      }
      break;
    case INT:
      if (value instanceof Long) {
        return value;
      }
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        return ((Number) value).longValue();
      }
      break;
    case UINT:
      if (value instanceof UnsignedLong) {
        return value;
      }
      if ((value instanceof Long || value instanceof Integer) && ((Number) value).longValue() >= 0) {
        return UnsignedLong.valueOf(((Number) value).longValue());
      }
      break;
    case FLOAT:
      if (value instanceof Double) {
        return value;
      }
      if (value instanceof Float) {
        return ((Float) value).doubleValue();
      }
      break;
    case STRING:
      if (value instanceof String) {
        return value;
      }
      break;
    case TIME:
      if (value instanceof Instant) {
        return value;
      }
      break;
    case DURATION:
      if (value instanceof Duration) {
        return value;
      }
      break;
    default:
      break;
    }
    throw new IllegalArgumentException(String.format(
        "value %s of class %s is not of type %s", value, value.getClass().getSimpleName(), type));
  }

  public static Instant toInstant(long nanos) {
    return Instant.ofEpochSecond(Math.floorDiv(nanos, NANOS_PER_SECOND), Math.floorMod(nanos, NANOS_PER_SECOND));
  }

  public static long toNanos(Instant instant) {
    return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
  }

  /**
   * Value equality for two values of the same type; two nulls are equal.
   * Agrees with {@link #compare}: floats follow <tt>Double.compare</tt>, so
   * NaN equals NaN and -0.0 differs from 0.0.
   */
  public static boolean valueEquals(ColumnType type, Object a, Object b) {
    if (a == null || b == null) {
      return a == b;
    }
    if (type == ColumnType.FLOAT) {
      return Double.compare((Double) a, (Double) b) == 0;
    }
    return a.equals(b);
  }

  public static int valueHash(ColumnType type, Object value) {
    if (value == null) {
      return 0;
    }
    if (type == ColumnType.FLOAT) {
      return Double.hashCode((Double) value);
    }
    return value.hashCode();
  }

  /**
   * Orders two values of the same type. Nulls sort before all other
   * values, <tt>false</tt> before <tt>true</tt>, unsigned integers by
   * their unsigned value.
   */
  @SuppressWarnings("unchecked")
  public static int compare(ColumnType type, Object a, Object b) {
    if (a == null || b == null) {
      return a == null ? (b == null ? 0 : -1) : 1;
    }
    if (type == ColumnType.FLOAT) {
      return Double.compare((Double) a, (Double) b);
    }
    return ((Comparable<Object>) a).compareTo(b);
  }

  /**
   * Converts a numeric value to a double, for aggregates that compute in
   * floating point.
   */
  public static double toDouble(ColumnType type, Object value) {
    switch (type) {
    case INT:
      return (Long) value;
    case UINT:
      return ((UnsignedLong) value).doubleValue();
    case FLOAT:
      return (Double) value;
    default:
      throw new IllegalArgumentException("not a numeric type: " + type);
    }
  }
}
