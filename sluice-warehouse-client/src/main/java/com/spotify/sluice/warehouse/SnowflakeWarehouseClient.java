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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.spotify.sluice.model.ResultTable;
import com.spotify.sluice.model.WarehouseConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WarehouseClient} for Snowflake over JDBC. Every call opens its own connection.
 *
 * <p>Rows are staged in a temporary table and moved into the target with a single MERGE inside
 * one transaction. Snowflake commits implicitly on DDL, so both tables are created before the
 * transaction starts.
 */
public class SnowflakeWarehouseClient implements WarehouseClient {

  private static final Logger LOG = LoggerFactory.getLogger(SnowflakeWarehouseClient.class);

  static final int BATCH_SIZE = 1000;

  @FunctionalInterface
  interface ConnectionSupplier {

    Connection get() throws SQLException;
  }

  private final String description;
  private final ConnectionSupplier connections;

  @VisibleForTesting
  SnowflakeWarehouseClient(String description, ConnectionSupplier connections) {
    this.description = Objects.requireNonNull(description);
    this.connections = Objects.requireNonNull(connections);
  }

  public static SnowflakeWarehouseClient create(WarehouseConfig config, String password) {
    final String url = jdbcUrl(config.account());
    final Properties properties = connectionProperties(config, password);
    return new SnowflakeWarehouseClient(
        config.account() + "/" + config.database() + "." + config.schema(),
        () -> DriverManager.getConnection(url, properties));
  }

  static String jdbcUrl(String account) {
    return String.format("jdbc:snowflake://%s.snowflakecomputing.com/", account.trim());
  }

  static Properties connectionProperties(WarehouseConfig config, String password) {
    final Properties properties = new Properties();
    properties.put("user", config.user().trim());
    properties.put("password", password);
    properties.put("warehouse", config.warehouse());
    properties.put("db", config.database());
    properties.put("schema", config.schema());
    config.role().ifPresent(role -> properties.put("role", role));
    return properties;
  }

  @Override
  public String testConnection() throws WarehouseException {
    try (Connection connection = connections.get();
         Statement statement = connection.createStatement();
         ResultSet resultSet = statement.executeQuery(SnowflakeSql.CURRENT_VERSION)) {
      final String version = resultSet.next() ? resultSet.getString(1) : "unknown";
      LOG.info("Connected to Snowflake {} (version {})", description, version);
      return version;
    } catch (SQLException e) {
      throw new WarehouseException("Failed to connect to " + description + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void ensureTable(String table, List<WarehouseColumn> columns, List<String> primaryKey)
      throws WarehouseException {
    try (Connection connection = connections.get()) {
      execute(connection, SnowflakeSql.createTable(table, columns, primaryKey));
    } catch (SQLException e) {
      throw new WarehouseException("Failed to create table " + table + ": " + e.getMessage(), e);
    }
  }

  @Override
  public long upsert(UpsertRequest request) throws WarehouseException {
    final TableSchema schema = TableSchema.infer(request.rows());
    final List<WarehouseColumn> columns = schema.columns();
    final List<String> keyColumns = keyColumns(schema, request);
    final List<List<String>> rows = request.appendOnly()
        ? request.rows().rows()
        : distinctByKey(request.rows(), request.keyColumns());

    final String staging = "SLUICE_STAGE_" + UUID.randomUUID().toString()
        .replace("-", "").toUpperCase(Locale.ROOT);

    try (Connection connection = connections.get()) {
      execute(connection, SnowflakeSql.createTable(request.table(), columns,
          request.appendOnly() ? ImmutableList.of() : keyColumns));
      if (!request.appendOnly()) {
        execute(connection, SnowflakeSql.createTemporaryTable(staging, request.table()));
      }

      connection.setAutoCommit(false);
      try {
        if (request.appendOnly()) {
          try (PreparedStatement delete =
                   connection.prepareStatement(SnowflakeSql.deleteExecution(request.table()))) {
            delete.setString(1, request.executionId());
            delete.executeUpdate();
          }
          insert(connection, request.table(), schema, rows, request);
        } else {
          insert(connection, staging, schema, rows, request);
          execute(connection, SnowflakeSql.merge(request.table(), staging, columns, keyColumns));
        }
        connection.commit();
      } catch (SQLException | RuntimeException e) {
        connection.rollback();
        throw e;
      } finally {
        connection.setAutoCommit(true);
      }

      if (!request.appendOnly()) {
        execute(connection, SnowflakeSql.dropTable(staging));
      }
    } catch (SQLException e) {
      throw new WarehouseException(
          "Failed to upsert into " + request.table() + ": " + e.getMessage(), e);
    }

    LOG.info("Wrote {} rows of execution {} to {}.{}", rows.size(), request.executionId(),
        description, request.table());
    return rows.size();
  }

  /**
   * The primary key: the execution id followed by the warehouse columns of the key columns.
   */
  static List<String> keyColumns(TableSchema schema, UpsertRequest request) {
    final ImmutableList.Builder<String> key = ImmutableList.builder();
    key.add(TableSchema.EXECUTION_ID.name());
    for (String column : request.keyColumns()) {
      key.add(schema.column(column).name());
    }
    return key.build();
  }

  /**
   * Keep the last row of each key, so that the MERGE source never has two rows for one target
   * row.
   */
  static List<List<String>> distinctByKey(ResultTable table, List<String> keyColumns) {
    final int[] indexes = keyColumns.stream().mapToInt(table::columnIndex).toArray();
    final Map<List<String>, List<String>> rows = new LinkedHashMap<>();
    for (List<String> row : table.rows()) {
      final List<String> key = new ArrayList<>(indexes.length);
      for (int index : indexes) {
        key.add(row.get(index));
      }
      rows.remove(key);
      rows.put(key, row);
    }
    return new ArrayList<>(rows.values());
  }

  private static void insert(Connection connection, String table, TableSchema schema,
                             List<List<String>> rows, UpsertRequest request) throws SQLException {
    final List<WarehouseColumn> dataColumns = schema.dataColumns();
    final Timestamp uploadedAt = Timestamp.valueOf(
        request.uploadedAt().atOffset(ZoneOffset.UTC).toLocalDateTime());
    try (PreparedStatement statement =
             connection.prepareStatement(SnowflakeSql.insert(table, schema.columns()))) {
      int batched = 0;
      for (List<String> row : rows) {
        statement.setString(1, request.executionId());
        statement.setTimestamp(2, uploadedAt);
        statement.setString(3, request.principalId());
        for (int i = 0; i < dataColumns.size(); i++) {
          dataColumns.get(i).type().bind(statement, i + 4, row.get(i));
        }
        statement.addBatch();
        if (++batched % BATCH_SIZE == 0) {
          statement.executeBatch();
        }
      }
      if (batched % BATCH_SIZE != 0) {
        statement.executeBatch();
      }
    }
  }

  private static void execute(Connection connection, String sql) throws SQLException {
    LOG.debug("Executing: {}", sql);
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    }
  }
}
