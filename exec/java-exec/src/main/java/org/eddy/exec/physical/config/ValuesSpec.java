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
package org.eddy.exec.physical.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.eddy.common.types.ColumnType;
import org.eddy.exec.physical.base.AbstractSourceSpec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Source that emits literal tables. Each table names its key columns;
 * the key values come from the first row, or from <tt>keyValues</tt>
 * when the table has no rows.
 */
@JsonTypeName(ValuesSpec.KIND)
public class ValuesSpec extends AbstractSourceSpec {

  public static final String KIND = "values";

  public static class ColumnDef {
    private final String label;
    private final ColumnType type;

    @JsonCreator
    public ColumnDef(@JsonProperty("label") String label, @JsonProperty("type") String type) {
      this(label, ColumnType.fromName(type));
    }

    public ColumnDef(String label, ColumnType type) {
      this.label = Preconditions.checkNotNull(label);
      this.type = Preconditions.checkNotNull(type);
    }

    @JsonProperty("label")
    public String getLabel() { return label; }

    public ColumnType getType() { return type; }

    @JsonProperty("type")
    public String getTypeName() { return type.displayName(); }
  }

  public static class TableData {
    private final List<String> keyColumns;
    private final List<ColumnDef> columns;
    private final List<List<Object>> rows;
    private final List<Object> keyValues;

    @JsonCreator
    public TableData(@JsonProperty("keyColumns") List<String> keyColumns,
                     @JsonProperty("columns") List<ColumnDef> columns,
                     @JsonProperty("rows") List<List<Object>> rows,
                     @JsonProperty("keyValues") List<Object> keyValues) {
      this.keyColumns = keyColumns == null ? Collections.<String>emptyList() : ImmutableList.copyOf(keyColumns);
      this.columns = ImmutableList.copyOf(Preconditions.checkNotNull(columns, "table without columns"));
      this.rows = rows == null ? Collections.<List<Object>>emptyList() : copyRows(rows);
      this.keyValues = keyValues == null ? null : Collections.unmodifiableList(new ArrayList<>(keyValues));
    }

    private static List<List<Object>> copyRows(List<List<Object>> rows) {
      List<List<Object>> copy = new ArrayList<>(rows.size());
      for (List<Object> row : rows) {
        // Rows may hold nulls, which rules out ImmutableList.
        copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
      }
      return Collections.unmodifiableList(copy);
    }

    @JsonProperty("keyColumns")
    public List<String> getKeyColumns() { return keyColumns; }

    @JsonProperty("columns")
    public List<ColumnDef> getColumns() { return columns; }

    @JsonProperty("rows")
    public List<List<Object>> getRows() { return rows; }

    @JsonProperty("keyValues")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public List<Object> getKeyValues() { return keyValues; }
  }

  /**
   * Fluent construction of a table in code.
   */
  public static class TableBuilder {
    private final List<String> keyColumns = new ArrayList<>();
    private final List<ColumnDef> columns = new ArrayList<>();
    private final List<List<Object>> rows = new ArrayList<>();
    private List<Object> keyValues;

    public TableBuilder key(String... labels) {
      keyColumns.addAll(Arrays.asList(labels));
      return this;
    }

    public TableBuilder column(String label, ColumnType type) {
      columns.add(new ColumnDef(label, type));
      return this;
    }

    public TableBuilder row(Object... values) {
      rows.add(Arrays.asList(values));
      return this;
    }

    public TableBuilder keyValues(Object... values) {
      keyValues = Arrays.asList(values);
      return this;
    }

    public TableData build() {
      return new TableData(keyColumns, columns, rows, keyValues);
    }
  }

  private final List<TableData> tables;

  @JsonCreator
  public ValuesSpec(@JsonProperty("tables") List<TableData> tables) {
    this.tables = tables == null ? Collections.<TableData>emptyList() : ImmutableList.copyOf(tables);
  }

  public ValuesSpec(TableData... tables) {
    this(Arrays.asList(tables));
  }

  public static TableBuilder table() {
    return new TableBuilder();
  }

  @Override
  public String getKind() { return KIND; }

  @JsonProperty("tables")
  public List<TableData> getTables() { return tables; }
}
