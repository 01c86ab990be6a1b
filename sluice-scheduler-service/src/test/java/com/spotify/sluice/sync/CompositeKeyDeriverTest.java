/*-
 * -\-\-
 * Spotify Sluice Scheduler Service
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

package com.spotify.sluice.sync;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

import com.spotify.sluice.model.ResultTable;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class CompositeKeyDeriverTest {

  @Test
  public void shouldPreferTimeWindowColumns() {
    var table = table(List.of("report_date", "Time Window Start", "time_window_end", "region",
            "clicks"),
        List.of("2024-01-01", "2024-01-01T00:00:00", "2024-01-07T23:59:59", "EU", "5"));

    assertThat(CompositeKeyDeriver.derive(table),
        contains("Time Window Start", "time_window_end", "report_date", "region"));
  }

  @Test
  public void shouldUseWeekColumns() {
    var table = table(List.of("day", "week_start_date", "week_end", "campaign", "spend"),
        List.of("2024-01-03", "2024-01-01", "2024-01-07", "spring", "12.5"));

    assertThat(CompositeKeyDeriver.derive(table),
        contains("week_start_date", "week_end", "day", "campaign"));
  }

  @Test
  public void shouldUseLeftMostDateColumn() {
    var table = table(List.of("region", "created_at", "day", "orders"),
        List.of("EU", "2024-01-01T10:15:00", "2024-01-01", "3"));

    assertThat(CompositeKeyDeriver.derive(table), contains("created_at", "region", "day"));
  }

  @Test
  public void shouldKeepNullableDimensions() {
    var table = table(List.of("week_start", "country", "revenue"),
        Arrays.asList("2024-01-01", null, "10"),
        List.of("2024-01-01", "SE", "20"));

    assertThat(CompositeKeyDeriver.derive(table), contains("week_start", "country"));
  }

  @Test
  public void shouldAppendWithoutTimeColumn() {
    var table = table(List.of("region", "orders"), List.of("EU", "3"));

    assertThat(CompositeKeyDeriver.derive(table), is(empty()));
  }

  @Test
  public void shouldAppendEmptyResult() {
    assertThat(CompositeKeyDeriver.derive(ResultTable.empty()), is(empty()));
  }

  @Test
  public void shouldAddExecutionWindowColumns() {
    var table = table(List.of("week_start", "region", "revenue"),
        List.of("2024-02-19", "EU", "100"));

    var widened = CompositeKeyDeriver.withExecutionWindow(table,
        Map.of("startDate", "2024-02-19T00:00:00", "endDate", "2024-02-25T23:59:59"));

    assertThat(widened.columns(), contains("week_start", "region", "revenue",
        "time_window_start", "time_window_end"));
    assertThat(widened.rows().get(0), contains("2024-02-19", "EU", "100",
        "2024-02-19T00:00:00", "2024-02-25T23:59:59"));
    assertThat(CompositeKeyDeriver.derive(widened),
        contains("time_window_start", "time_window_end", "week_start", "region"));
  }

  @Test
  public void shouldKeepTableWithoutExecutionWindow() {
    var table = table(List.of("week_start", "revenue"), List.of("2024-02-19", "100"));

    assertThat(CompositeKeyDeriver.withExecutionWindow(table, Map.of("region", "EU")),
        is(table));
  }

  @Test
  public void shouldKeepExistingWindowColumns() {
    var table = table(List.of("time_window_start", "time_window_end", "revenue"),
        List.of("2024-02-19", "2024-02-25", "100"));

    assertThat(CompositeKeyDeriver.withExecutionWindow(table,
        Map.of("startDate", "2024-01-01T00:00:00", "endDate", "2024-01-07T23:59:59")),
        is(table));
  }

  @SafeVarargs
  private static ResultTable table(List<String> columns, List<String>... rows) {
    return ResultTable.create(columns, List.of(rows));
  }
}
