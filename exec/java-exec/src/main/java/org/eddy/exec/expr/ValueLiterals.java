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
package org.eddy.exec.expr;

import java.time.Duration;
import java.time.Instant;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.vector.TypeHelper;

import com.google.common.primitives.UnsignedLong;

/**
 * Converts literal values, as they come out of a JSON plan, to the Java
 * class of a column type. Times are written as ISO-8601 instants or as
 * nanoseconds since the epoch, durations as ISO-8601 durations or as
 * nanoseconds.
 */
public final class ValueLiterals {

  private ValueLiterals() { }

  public static Object convert(ColumnType type, Object literal) {
    if (literal == null) {
      return null;
    }
    switch (type) {
    case INT:
      if (literal instanceof Number && isIntegral(literal)) {
        return ((Number) literal).longValue();
      }
      break;
    case UINT:
      if (literal instanceof UnsignedLong) {
        return literal;
      }
      if (literal instanceof String) {
        return UnsignedLong.valueOf((String) literal);
      }
      if (literal instanceof Number && isIntegral(literal)) {
        return UnsignedLong.valueOf(literal.toString());
      }
      break;
    case FLOAT:
      if (literal instanceof Number) {
        return ((Number) literal).doubleValue();
      }
      break;
    case TIME:
      if (literal instanceof String) {
        return Instant.parse((String) literal);
      }
      if (literal instanceof Number && isIntegral(literal)) {
        return TypeHelper.toInstant(((Number) literal).longValue());
      }
      break;
    case DURATION:
      if (literal instanceof String) {
        return Duration.parse((String) literal);
      }
      if (literal instanceof Number && isIntegral(literal)) {
        return Duration.ofNanos(((Number) literal).longValue());
      }
      break;
    default:
      break;
    }
    return TypeHelper.checkValue(type, literal);
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long || value instanceof Integer || value instanceof Short
        || value instanceof Byte || value instanceof java.math.BigInteger;
  }
}
