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

import java.util.Locale;

/**
 * Turns arbitrary names into safe, upper-case warehouse identifiers.
 */
public final class Identifiers {

  static final int MAX_LENGTH = 255;

  private Identifiers() {
    throw new UnsupportedOperationException();
  }

  /**
   * Upper-cases the name, replaces every character outside {@code [A-Z0-9_]} with {@code _},
   * collapses runs of underscores, prefixes {@code T_} if it starts with a digit and truncates
   * to 255 characters.
   */
  public static String tableName(String name) {
    return sanitize(name, "T_");
  }

  public static String columnName(String name) {
    return sanitize(name, "C_");
  }

  private static String sanitize(String name, String digitPrefix) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Identifier must not be empty");
    }
    String identifier = name.trim().toUpperCase(Locale.ROOT)
        .replaceAll("[^A-Z0-9_]", "_")
        .replaceAll("_{2,}", "_");
    if (Character.isDigit(identifier.charAt(0))) {
      identifier = digitPrefix + identifier;
    }
    return identifier.length() > MAX_LENGTH ? identifier.substring(0, MAX_LENGTH) : identifier;
  }

  static String quote(String identifier) {
    return '"' + identifier + '"';
  }
}
