/*-
 * -\-\-
 * Spotify Sluice Warehouse Client
 * --
 * Copyright (C) 2016 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.sluice.warehouse;

import com.google.common.collect.ImmutableList;
import com.spotify.sluice.model.ResultTable;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The warehouse columns of an uploaded result: the metadata columns followed by one column per
 * result column, in result column order.
 */
public final class TableSchema {

  public static final WarehouseColumn EXECUTION_ID =
      WarehouseColumn.of("EXECUTION_ID", ColumnType.VARCHAR);
  public static final WarehouseColumn UPLOADED_AT =
      WarehouseColumn.of("UPLOADED_AT", ColumnType.TIMESTAMP_NTZ);
  public static final WarehouseColumn PRINCIPAL_ID =
      WarehouseColumn.of("PRINCIPAL_ID", ColumnType.VARCHAR);

  private static final List<WarehouseColumn> METADATA_COLUMNS =
      ImmutableList.of(EXECUTION_ID, UPLOADED_AT, PRINCIPAL_ID);

  private final ImmutableList<String> sourceColumns;
  private final ImmutableList<WarehouseColumn> dataColumns;

  private TableSchema(List<String> sourceColumns, List<WarehouseColumn> dataColumns) {
    this.sourceColumns = ImmutableList.copyOf(sourceColumns);
    this.dataColumns = ImmutableList.copyOf(dataColumns);
  }

  public static TableSchema infer(ResultTable table) {
    final Set<String> taken = new HashSet<>();
    METADATA_COLUMNS.forEach(column -> taken.add(column.name()));

    final ImmutableList.Builder<WarehouseColumn> columns = ImmutableList.builder();
    for (int i = 0; i < table.columns().size(); i++) {
      final String base = Identifiers.columnName(table.columns().get(i));
      String name = base;
      for (int n = 2; !taken.add(name); n++) {
        name = base + "_" + n;
      }
      columns.add(WarehouseColumn.of(name, ColumnType.infer(table.columnValues(i))));
    }
    return new TableSchema(table.columns(), columns.build());
  }

  public List<WarehouseColumn> columns() {
    return ImmutableList.<WarehouseColumn>builder()
        .addAll(METADATA_COLUMNS)
        .addAll(dataColumns)
        .build();
  }

  public List<WarehouseColumn> dataColumns() {
    return dataColumns;
  }

  /**
   * The warehouse column holding the given result column.
   *
   * @throws IllegalArgumentException if the result has no such column
   */
  public WarehouseColumn column(String sourceColumn) {
    final int index = sourceColumns.indexOf(sourceColumn);
    if (index < 0) {
      throw new IllegalArgumentException("No result column named " + sourceColumn);
    }
    return dataColumns.get(index);
  }
}
