/*-
 * -\-\-
 * Spotify Sluice Gateway Client
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

package com.spotify.sluice.gateway;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.spotify.sluice.model.ResultTable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the gateway's CSV result files: a header row followed by data rows. Empty cells are
 * read as {@code null}.
 */
final class ResultCsvParser {

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  private ResultCsvParser() {
    throw new UnsupportedOperationException();
  }

  static ResultTable parse(String csv) {
    final List<String> header;
    final List<List<String>> rows = new ArrayList<>();
    try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
        .readValues(csv)) {
      if (!it.hasNextValue()) {
        return ResultTable.empty();
      }
      header = Arrays.asList(it.nextValue());
      while (it.hasNextValue()) {
        final String[] cells = it.nextValue();
        if (cells.length != header.size()) {
          throw new DataException("Malformed result row " + (rows.size() + 1) + ": "
                                  + cells.length + " cells, expected " + header.size());
        }
        final List<String> row = new ArrayList<>(cells.length);
        for (String cell : cells) {
          row.add(cell == null || cell.isEmpty() ? null : cell);
        }
        rows.add(row);
      }
    } catch (IOException e) {
      throw new DataException("Malformed result data: " + e.getMessage(), e);
    }
    return ResultTable.create(header, rows);
  }
}
