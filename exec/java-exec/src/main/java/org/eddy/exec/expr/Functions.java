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
import java.util.function.Function;
import java.util.function.Predicate;

import org.eddy.exec.record.ColumnMeta;
import org.eddy.exec.record.Record;

import com.google.common.collect.ImmutableSet;

/**
 * Adapters that turn Java lambdas into row predicates and row functions,
 * for plans built in code. The caller names the columns the lambda reads
 * so that filter can tell whether the group key alone decides the
 * result.
 */
public final class Functions {

  private Functions() { }

  public static RowPredicate predicate(Predicate<Record> fn, String... columns) {
    return new LambdaPredicate(fn, ImmutableSet.copyOf(columns));
  }

  public static RowFunction function(Function<Record, Record> fn, String... columns) {
    return new LambdaFunction(fn, ImmutableSet.copyOf(columns));
  }

  private static class LambdaPredicate implements RowPredicate {
    private final Predicate<Record> fn;
    private final Set<String> columns;

    LambdaPredicate(Predicate<Record> fn, Set<String> columns) {
      this.fn = fn;
      this.columns = columns;
    }

    @Override
    public Set<String> referencedColumns() { return columns; }

    @Override
    public void prepare(List<ColumnMeta> schema) { }

    @Override
    public boolean eval(Record row) {
      return fn.test(row);
    }
  }

  private static class LambdaFunction implements RowFunction {
    private final Function<Record, Record> fn;
    private final Set<String> columns;

    LambdaFunction(Function<Record, Record> fn, Set<String> columns) {
      this.fn = fn;
      this.columns = columns;
    }

    @Override
    public Set<String> referencedColumns() { return columns; }

    @Override
    public void prepare(List<ColumnMeta> schema) { }

    @Override
    public Record eval(Record row) {
      Record result = fn.apply(row);
      if (result == null) {
        throw new IllegalStateException("row function returned no record");
      }
      return result;
    }
  }
}
