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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.spotify.sluice.model.ResultTable;
import com.spotify.sluice.util.ParameterUtil;
import com.spotify.sluice.warehouse.ColumnType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the result columns that identify a row across re-uploads of the same time window.
 *
 * <p>The time part of the key is, in order of preference: explicit time window columns, week
 * columns, or the left-most date or timestamp column. Results of an execution that ran for a
 * window get that window as explicit time window columns, see {@link #withExecutionWindow}. All remaining non-numeric columns are
 * dimensions and complete the key, so that rows of the same period stay distinct. A result
 * without any time column has no key and is appended instead.
 */
public final class CompositeKeyDeriver {

  static final String TIME_WINDOW_START_COLUMN = "time_window_start";
  static final String TIME_WINDOW_END_COLUMN = "time_window_end";

  private static final Set<String> WINDOW_START = ImmutableSet.of("timewindowstart");
  private static final Set<String> WINDOW_END = ImmutableSet.of("timewindowend");
  private static final Set<String> WEEK_START = ImmutableSet.of("weekstart", "weekstartdate");
  private static final Set<String> WEEK_END = ImmutableSet.of("weekend", "weekenddate");

  private static final Set<ColumnType> TIME_TYPES =
      ImmutableSet.of(ColumnType.DATE, ColumnType.TIMESTAMP_NTZ);
  private static final Set<ColumnType> MEASURE_TYPES =
      ImmutableSet.of(ColumnType.NUMBER, ColumnType.FLOAT);

  private CompositeKeyDeriver() {
    throw new UnsupportedOperationException();
  }

  /**
   * @return the key columns by their result names, or an empty list for append mode
   */
  public static ImmutableList<String> derive(ResultTable table) {
    final Optional<List<String>> timeKey = windowColumns(table)
        .or(() -> weekColumns(table))
        .or(() -> firstTimeColumn(table));
    if (timeKey.isEmpty()) {
      return ImmutableList.of();
    }

    final List<String> key = new ArrayList<>(timeKey.get());
    for (int i = 0; i < table.columns().size(); i++) {
      final String column = table.columns().get(i);
      if (!key.contains(column) && !MEASURE_TYPES.contains(type(table, i))) {
        key.add(column);
      }
    }
    return ImmutableList.copyOf(key);
  }

  /**
   * Add {@code time_window_start} and {@code time_window_end} columns holding the execution's
   * {@code startDate} and {@code endDate} parameters to every row. Tables that already carry time
   * window columns, and executions without a window, are returned unchanged.
   */
  public static ResultTable withExecutionWindow(ResultTable table, Map<String, String> parameters) {
    final String start = parameters.get(ParameterUtil.START_DATE);
    final String end = parameters.get(ParameterUtil.END_DATE);
    if (start == null || end == null || table.columns().isEmpty()
        || windowColumns(table).isPresent()) {
      return table;
    }

    final List<String> columns = new ArrayList<>(table.columns());
    columns.add(TIME_WINDOW_START_COLUMN);
    columns.add(TIME_WINDOW_END_COLUMN);
    final List<List<String>> rows = new ArrayList<>(table.rowCount());
    for (List<String> row : table.rows()) {
      final List<String> widened = new ArrayList<>(row);
      widened.add(start);
      widened.add(end);
      rows.add(widened);
    }
    return ResultTable.create(columns, rows);
  }

  private static Optional<List<String>> windowColumns(ResultTable table) {
    final Optional<String> start = find(table, WINDOW_START);
    final Optional<String> end = find(table, WINDOW_END);
    if (start.isPresent() && end.isPresent()) {
      return Optional.of(List.of(start.get(), end.get()));
    }
    return Optional.empty();
  }

  private static Optional<List<String>> weekColumns(ResultTable table) {
    final Optional<String> start = find(table, WEEK_START);
    if (start.isEmpty()) {
      return Optional.empty();
    }
    final Optional<String> end = find(table, WEEK_END);
    return Optional.of(end.isPresent() ? List.of(start.get(), end.get()) : List.of(start.get()));
  }

  private static Optional<List<String>> firstTimeColumn(ResultTable table) {
    for (int i = 0; i < table.columns().size(); i++) {
      if (TIME_TYPES.contains(type(table, i))) {
        return Optional.of(List.of(table.columns().get(i)));
      }
    }
    return Optional.empty();
  }

  private static Optional<String> find(ResultTable table, Set<String> names) {
    return table.columns().stream()
        .filter(column -> names.contains(normalize(column)))
        .findFirst();
  }

  private static ColumnType type(ResultTable table, int index) {
    return ColumnType.infer(table.columnValues(index));
  }

  static String normalize(String column) {
    return column.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
  }
}
