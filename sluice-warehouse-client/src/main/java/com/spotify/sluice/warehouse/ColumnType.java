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

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Warehouse column types, inferred from the string cells of a result table.
 */
public enum ColumnType {
  VARCHAR("VARCHAR", Types.VARCHAR),
  NUMBER("NUMBER(38,0)", Types.NUMERIC),
  FLOAT("FLOAT", Types.DOUBLE),
  BOOLEAN("BOOLEAN", Types.BOOLEAN),
  DATE("DATE", Types.DATE),
  TIMESTAMP_NTZ("TIMESTAMP_NTZ", Types.TIMESTAMP);

  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,38}");
  private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
  private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
  private static final Pattern ISO_TIMESTAMP =
      Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d{1,9})?)?(Z|[+-]\\d{2}:\\d{2})?");

  private final String sqlType;
  private final int jdbcType;

  ColumnType(String sqlType, int jdbcType) {
    this.sqlType = sqlType;
    this.jdbcType = jdbcType;
  }

  public String sqlType() {
    return sqlType;
  }

  /**
   * The narrowest type every non-null value fits, so that every cell binds. A column without
   * values is {@link #VARCHAR}.
   */
  public static ColumnType infer(List<String> values) {
    boolean seen = false;
    boolean bool = true;
    boolean integer = true;
    boolean decimal = true;
    boolean date = true;
    boolean timestamp = true;
    for (String value : values) {
      if (value == null) {
        continue;
      }
      if (seen && !(bool || integer || decimal || date || timestamp)) {
        break;
      }
      seen = true;
      final String v = value.trim();
      bool &= v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false");
      integer &= INTEGER.matcher(v).matches();
      decimal &= DECIMAL.matcher(v).matches();
      date &= ISO_DATE.matcher(v).matches() && parsesAsDate(v);
      timestamp &= ISO_TIMESTAMP.matcher(v).matches();
    }
    if (!seen) {
      return VARCHAR;
    }
    if (bool) {
      return BOOLEAN;
    }
    if (integer) {
      return NUMBER;
    }
    if (decimal) {
      return FLOAT;
    }
    if (date) {
      return DATE;
    }
    if (timestamp) {
      return TIMESTAMP_NTZ;
    }
    return VARCHAR;
  }

  private static boolean parsesAsDate(String value) {
    try {
      LocalDate.parse(value);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  /**
   * Bind a string cell as a parameter of this type.
   */
  void bind(PreparedStatement statement, int index, String value) throws SQLException {
    if (value == null) {
      statement.setNull(index, jdbcType);
      return;
    }
    final String v = value.trim();
    try {
      switch (this) {
        case NUMBER:
          statement.setBigDecimal(index, new BigDecimal(v));
          break;
        case FLOAT:
          statement.setDouble(index, Double.parseDouble(v));
          break;
        case BOOLEAN:
          statement.setBoolean(index, Boolean.parseBoolean(v.toLowerCase(Locale.ROOT)));
          break;
        case DATE:
          statement.setDate(index, Date.valueOf(LocalDate.parse(v)));
          break;
        case TIMESTAMP_NTZ:
          statement.setTimestamp(index, Timestamp.valueOf(parseTimestamp(v)));
          break;
        default:
          statement.setString(index, value);
      }
    } catch (IllegalArgumentException | DateTimeException e) {
      throw new SQLException("Cannot convert '" + value + "' to " + sqlType, e);
    }
  }

  /**
   * Timestamps with an offset are normalized to UTC wall-clock time.
   */
  static LocalDateTime parseTimestamp(String value) {
    final String iso = value.replace(' ', 'T');
    if (iso.endsWith("Z") || iso.matches(".*[+-]\\d{2}:\\d{2}$")) {
      return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }
    return LocalDateTime.parse(iso);
  }
}
