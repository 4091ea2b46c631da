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

import java.util.List;
import java.util.Set;

import org.eddy.common.exceptions.UserException;
import org.eddy.common.types.ColumnType;
import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.Record;
import org.eddy.exec.record.TableBuffer;
import org.eddy.exec.vector.TypeHelper;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Compares one column with a literal: <tt>r.column op value</tt>. A row
 * that lacks the column, or holds null in it, does not match.
 * Numbers of different types compare by value.
 */
public class ComparisonPredicate implements RowPredicate {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(ComparisonPredicate.class);

  public enum Op {
    EQ, NE, LT, LE, GT, GE;

    @JsonValue
    public String getName() {
      return name().toLowerCase();
    }

    @JsonCreator
    public static Op fromName(String name) {
      return valueOf(name.toUpperCase());
    }

    boolean test(int cmp) {
      switch (this) {
      case EQ: return cmp == 0;
      case NE: return cmp != 0;
      case LT: return cmp < 0;
      case LE: return cmp <= 0;
      case GT: return cmp > 0;
      case GE: return cmp >= 0;
      default: throw new IllegalStateException();
      }
    }
  }

  private final String column;
  private final Op op;
  private final Object value;

  // Set by prepare(): the literal converted to the column's type.

  private ColumnType preparedType;
  private Object preparedValue;

  @JsonCreator
  public ComparisonPredicate(@JsonProperty("column") String column,
                             @JsonProperty("op") Op op,
                             @JsonProperty("value") Object value) {
    this.column = Preconditions.checkNotNull(column);
    this.op = Preconditions.checkNotNull(op);
    this.value = value;
  }

  @JsonProperty("column")
  public String getColumn() { return column; }

  @JsonProperty("op")
  public Op getOp() { return op; }

  @JsonProperty("value")
  public Object getValue() { return value; }

  @Override
  public Set<String> referencedColumns() {
    return ImmutableSet.of(column);
  }

  @Override
  public void prepare(List<ColumnMeta> schema) {
    int j = TableBuffer.colIndex(schema, column);
    if (j == -1) {
      preparedType = null;
      preparedValue = null;
      return;
    }
    ColumnType type = schema.get(j).getType();
    if (type == preparedType) {
      return;
    }
    preparedType = type;
    preparedValue = literalFor(type);
  }

  private Object literalFor(ColumnType type) {
    if (type.isNumeric() && value instanceof Number) {
      return value;
    }
    try {
      return ValueLiterals.convert(type, value);
    } catch (RuntimeException e) {
      throw UserException.invalidError(e)
          .message("cannot compare column \"%s\" of type %s with %s", column, type, value)
          .build(logger);
    }
  }

  @Override
  public boolean eval(Record row) {
    if (! row.has(column)) {
      return false;
    }
    Object actual = row.get(column);
    ColumnType type = row.type(column);
    if (type != preparedType) {
      preparedType = type;
      preparedValue = literalFor(type);
    }
    if (actual == null || preparedValue == null) {
      return false;
    }
    return op.test(compare(type, actual, preparedValue));
  }

  private static int compare(ColumnType type, Object actual, Object literal) {
    if (! type.isNumeric()) {
      return TypeHelper.compare(type, actual, literal);
    }
    if (type == ColumnType.UINT && isIntegral(literal) && ((Number) literal).longValue() < 0) {
      return 1;
    }
    if (type != ColumnType.FLOAT && isIntegral(literal)) {
      Object exact = ValueLiterals.convert(type, literal);
      return TypeHelper.compare(type, actual, exact);
    }
    return Double.compare(TypeHelper.toDouble(type, actual), ((Number) literal).doubleValue());
  }

  private static boolean isIntegral(Object value) {
    return value instanceof Long || value instanceof Integer;
  }

  @Override
  public String toString() {
    return "r." + column + " " + op.getName() + " " + value;
  }
}
