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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.spotify.sluice.model.ResultTable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class SnowflakeWarehouseClientTest {

  private static final Instant NOW = Instant.parse("2024-03-04T10:15:30Z");

  private static final ResultTable RESULTS = ResultTable.create(
      ImmutableList.of("week", "campaign", "impressions"),
      ImmutableList.of(
          ImmutableList.of("2024-01-01", "a", "10"),
          ImmutableList.of("2024-01-01", "b", "20"),
          ImmutableList.of("2024-01-01", "a", "30")));

  @Mock Connection connection;
  @Mock Statement statement;
  @Mock PreparedStatement preparedStatement;
  @Mock ResultSet resultSet;

  private SnowflakeWarehouseClient client;

  @Before
  public void setUp() {
    client = new SnowflakeWarehouseClient("acct/DB.PUBLIC", () -> connection);
  }

  @Test
  public void shouldReportVersionOnConnectionTest() throws Exception {
    when(connection.createStatement()).thenReturn(statement);
    when(statement.executeQuery(SnowflakeSql.CURRENT_VERSION)).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true);
    when(resultSet.getString(1)).thenReturn("8.1.0");

    assertThat(client.testConnection(), is("8.1.0"));
    verify(connection).close();
  }

  @Test
  public void shouldWrapConnectionFailure() {
    client = new SnowflakeWarehouseClient("acct/DB.PUBLIC", () -> {
      throw new SQLException("Incorrect username or password was specified.");
    });

    final WarehouseException e = assertThrows(WarehouseException.class, client::testConnection);
    assertThat(e.getMessage(), startsWith("Failed to connect to acct/DB.PUBLIC"));
  }

  @Test
  public void shouldMergeThroughStagingTableInOneTransaction() throws Exception {
    when(connection.createStatement()).thenReturn(statement);
    when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);

    final long written = client.upsert(UpsertRequest.create("RESULTS", RESULTS,
        ImmutableList.of("week", "campaign"), "exec-1", "user-1", NOW));

    assertThat(written, is(2L));
    final InOrder inOrder = inOrder(connection, statement, preparedStatement);
    inOrder.verify(statement).execute(argThat(sql -> sql.startsWith(
        "CREATE TABLE IF NOT EXISTS \"RESULTS\"")
        && sql.endsWith("PRIMARY KEY (\"EXECUTION_ID\", \"WEEK\", \"CAMPAIGN\"))")));
    inOrder.verify(statement).execute(argThat(sql -> sql.startsWith(
        "CREATE TEMPORARY TABLE \"SLUICE_STAGE_")));
    inOrder.verify(connection).setAutoCommit(false);
    inOrder.verify(preparedStatement).executeBatch();
    inOrder.verify(statement).execute(argThat(sql -> sql.startsWith("MERGE INTO \"RESULTS\"")));
    inOrder.verify(connection).commit();
    inOrder.verify(connection).setAutoCommit(true);
    inOrder.verify(statement).execute(argThat(sql -> sql.startsWith(
        "DROP TABLE IF EXISTS \"SLUICE_STAGE_")));
    verify(preparedStatement, times(2)).addBatch();
    verify(preparedStatement, times(2)).setString(1, "exec-1");
    verify(preparedStatement, times(2)).setString(3, "user-1");
  }

  @Test
  public void shouldReplaceExecutionRowsInAppendMode() throws Exception {
    when(connection.createStatement()).thenReturn(statement);
    when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);

    final long written = client.upsert(UpsertRequest.create("RESULTS", RESULTS,
        ImmutableList.of(), "exec-1", "user-1", NOW));

    assertThat(written, is(3L));
    final InOrder inOrder = inOrder(connection, preparedStatement);
    inOrder.verify(connection).setAutoCommit(false);
    inOrder.verify(connection).prepareStatement(SnowflakeSql.deleteExecution("RESULTS"));
    inOrder.verify(preparedStatement).executeUpdate();
    inOrder.verify(preparedStatement).executeBatch();
    inOrder.verify(connection).commit();
    verify(preparedStatement, times(3)).addBatch();
    verify(statement, never()).execute(argThat(sql -> sql.contains("PRIMARY KEY")));
    verify(statement, never()).execute(argThat(sql -> sql.startsWith("MERGE")));
  }

  @Test
  public void shouldRollbackWhenMergeFails() throws Exception {
    when(connection.createStatement()).thenReturn(statement);
    when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
    when(statement.execute(argThat(sql -> sql != null && sql.startsWith("MERGE"))))
        .thenThrow(new SQLException("Duplicate row detected"));

    final WarehouseException e = assertThrows(WarehouseException.class, () ->
        client.upsert(UpsertRequest.create("RESULTS", RESULTS,
            ImmutableList.of("week", "campaign"), "exec-1", "user-1", NOW)));

    assertThat(e.getMessage(), startsWith("Failed to upsert into RESULTS"));
    final InOrder inOrder = inOrder(connection);
    inOrder.verify(connection).rollback();
    inOrder.verify(connection).setAutoCommit(true);
    verify(connection, never()).commit();
    verify(connection).close();
  }

  @Test
  public void shouldKeepLastRowPerKey() {
    final List<List<String>> rows =
        SnowflakeWarehouseClient.distinctByKey(RESULTS, ImmutableList.of("week", "campaign"));

    assertThat(rows, contains(
        ImmutableList.of("2024-01-01", "b", "20"),
        ImmutableList.of("2024-01-01", "a", "30")));
  }

  @Test
  public void shouldPrefixKeyWithExecutionId() {
    final TableSchema schema = TableSchema.infer(RESULTS);
    final UpsertRequest request = UpsertRequest.create("RESULTS", RESULTS,
        ImmutableList.of("campaign"), "exec-1", "user-1", NOW);

    assertThat(SnowflakeWarehouseClient.keyColumns(schema, request),
        contains("EXECUTION_ID", "CAMPAIGN"));
  }

  @Test
  public void shouldBuildJdbcUrlForAccount() {
    assertThat(SnowflakeWarehouseClient.jdbcUrl(" xy12345.eu-west-1 "),
        is("jdbc:snowflake://xy12345.eu-west-1.snowflakecomputing.com/"));
  }
}
