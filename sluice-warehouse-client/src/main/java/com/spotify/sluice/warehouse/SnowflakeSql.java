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

import static com.spotify.sluice.warehouse.Identifiers.quote;
import static java.util.stream.Collectors.joining;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Statement text for the Snowflake dialect. All identifiers are expected to be sanitized.
 */
final class SnowflakeSql {

  static final String CURRENT_VERSION = "SELECT CURRENT_VERSION()";

  private SnowflakeSql() {
    throw new UnsupportedOperationException();
  }

  static String createTable(String table, List<WarehouseColumn> columns, List<String> primaryKey) {
    final String columnDefinitions = columns.stream()
        .map(column -> quote(column.name()) + " " + column.type().sqlType())
        .collect(joining(", "));
    final String key = primaryKey.isEmpty()
        ? ""
        : ", PRIMARY KEY (" + primaryKey.stream().map(Identifiers::quote).collect(joining(", ")) + ")";
    return "CREATE TABLE IF NOT EXISTS " + quote(table) + " (" + columnDefinitions + key + ")";
  }

  static String createTemporaryTable(String temporaryTable, String table) {
    return "CREATE TEMPORARY TABLE " + quote(temporaryTable) + " LIKE " + quote(table);
  }

  static String dropTable(String table) {
    return "DROP TABLE IF EXISTS " + quote(table);
  }

  static String insert(String table, List<WarehouseColumn> columns) {
    return "INSERT INTO " + quote(table)
           + " (" + columns.stream().map(column -> quote(column.name())).collect(joining(", ")) + ")"
           + " VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
  }

  static String deleteExecution(String table) {
    return "DELETE FROM " + quote(table) + " WHERE " + quote(TableSchema.EXECUTION_ID.name()) + " = ?";
  }

  /**
   * Update rows of {@code table} matching a row of {@code source} on every key column, and insert
   * the rest. Key columns compare null-safe.
   */
  static String merge(String table, String source, List<WarehouseColumn> columns,
                      List<String> keyColumns) {
    final String on = keyColumns.stream()
        .map(key -> "EQUAL_NULL(t." + quote(key) + ", s." + quote(key) + ")")
        .collect(joining(" AND "));
    final Set<String> keys = Set.copyOf(keyColumns);
    final List<String> updated = columns.stream()
        .map(WarehouseColumn::name)
        .filter(name -> !keys.contains(name))
        .collect(Collectors.toList());

    final StringBuilder sql = new StringBuilder()
        .append("MERGE INTO ").append(quote(table)).append(" t")
        .append(" USING ").append(quote(source)).append(" s")
        .append(" ON ").append(on);
    if (!updated.isEmpty()) {
      sql.append(" WHEN MATCHED THEN UPDATE SET ")
          .append(updated.stream().map(name -> "t." + quote(name) + " = s." + quote(name))
              .collect(joining(", ")));
    }
    sql.append(" WHEN NOT MATCHED THEN INSERT (")
        .append(columns.stream().map(column -> quote(column.name())).collect(joining(", ")))
        .append(") VALUES (")
        .append(columns.stream().map(column -> "s." + quote(column.name())).collect(joining(", ")))
        .append(")");
    return sql.toString();
  }
}
