/*-
 * -\-\-
 * Spotify Sluice Common
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

package com.spotify.sluice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tabular query results as fetched from the gateway. Cells are raw strings; an empty cell is
 * {@code null}.
 */
@AutoValue
public abstract class ResultTable {

  @JsonProperty
  public abstract ImmutableList<String> columns();

  @JsonProperty
  public abstract List<List<String>> rows();

  @JsonIgnore
  public int rowCount() {
    return rows().size();
  }

  public int columnIndex(String column) {
    return columns().indexOf(column);
  }

  /**
   * All values of one column, in row order.
   */
  public List<String> columnValues(int index) {
    final List<String> values = new ArrayList<>(rows().size());
    for (List<String> row : rows()) {
      values.add(row.get(index));
    }
    return values;
  }

  @JsonCreator
  public static ResultTable create(
      @JsonProperty("columns") List<String> columns,
      @JsonProperty("rows") List<List<String>> rows) {
    final ImmutableList<String> header = ImmutableList.copyOf(columns);
    final List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      Preconditions.checkArgument(row.size() == header.size(),
          "row has %s cells, expected %s", row.size(), header.size());
      copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    return new AutoValue_ResultTable(header, Collections.unmodifiableList(copy));
  }

  public static ResultTable empty() {
    return create(ImmutableList.of(), ImmutableList.of());
  }
}
