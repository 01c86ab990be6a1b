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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;

public class SnowflakeSqlTest {

  private static final List<WarehouseColumn> COLUMNS = ImmutableList.of(
      TableSchema.EXECUTION_ID,
      WarehouseColumn.of("WEEK_START", ColumnType.DATE),
      WarehouseColumn.of("IMPRESSIONS", ColumnType.NUMBER));

  @Test
  public void shouldCreateTableWithPrimaryKey() {
    assertThat(SnowflakeSql.createTable("RESULTS", COLUMNS, ImmutableList.of("EXECUTION_ID", "WEEK_START")),
        is("CREATE TABLE IF NOT EXISTS \"RESULTS\" (\"EXECUTION_ID\" VARCHAR, \"WEEK_START\" DATE, "
           + "\"IMPRESSIONS\" NUMBER(38,0), PRIMARY KEY (\"EXECUTION_ID\", \"WEEK_START\"))"));
  }

  @Test
  public void shouldCreateTableWithoutPrimaryKey() {
    assertThat(SnowflakeSql.createTable("RESULTS", COLUMNS, ImmutableList.of()),
        not(containsString("PRIMARY KEY")));
  }

  @Test
  public void shouldInsertWithPlaceholders() {
    assertThat(SnowflakeSql.insert("RESULTS", COLUMNS),
        is("INSERT INTO \"RESULTS\" (\"EXECUTION_ID\", \"WEEK_START\", \"IMPRESSIONS\") VALUES (?, ?, ?)"));
  }

  @Test
  public void shouldMergeOnKeyAndUpdateOtherColumns() {
    assertThat(SnowflakeSql.merge("RESULTS", "STAGE", COLUMNS, ImmutableList.of("EXECUTION_ID", "WEEK_START")),
        is("MERGE INTO \"RESULTS\" t USING \"STAGE\" s"
           + " ON EQUAL_NULL(t.\"EXECUTION_ID\", s.\"EXECUTION_ID\")"
           + " AND EQUAL_NULL(t.\"WEEK_START\", s.\"WEEK_START\")"
           + " WHEN MATCHED THEN UPDATE SET t.\"IMPRESSIONS\" = s.\"IMPRESSIONS\""
           + " WHEN NOT MATCHED THEN INSERT (\"EXECUTION_ID\", \"WEEK_START\", \"IMPRESSIONS\")"
           + " VALUES (s.\"EXECUTION_ID\", s.\"WEEK_START\", s.\"IMPRESSIONS\")"));
  }

  @Test
  public void shouldOmitUpdateWhenEveryColumnIsKey() {
    final List<WarehouseColumn> columns = ImmutableList.of(TableSchema.EXECUTION_ID);

    assertThat(SnowflakeSql.merge("RESULTS", "STAGE", columns, ImmutableList.of("EXECUTION_ID")),
        not(containsString("WHEN MATCHED")));
  }

  @Test
  public void shouldDeleteRowsOfExecution() {
    assertThat(SnowflakeSql.deleteExecution("RESULTS"),
        is("DELETE FROM \"RESULTS\" WHERE \"EXECUTION_ID\" = ?"));
  }
}
