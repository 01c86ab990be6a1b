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

package com.spotify.sluice.util;

import static com.cronutils.model.definition.CronDefinitionBuilder.instanceDefinitionFor;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Static utility functions for evaluating five-field cron expressions in a time zone.
 */
public final class TimeUtil {

  private static final CronDefinition CRON_DEFINITION = instanceDefinitionFor(CronType.UNIX);

  private static final Map<String, String> WELL_KNOWN = ImmutableMap.<String, String>builder()
      .put("@hourly", "0 * * * *")
      .put("@daily", "0 0 * * *")
      .put("@weekly", "0 0 * * MON")
      .put("@monthly", "0 0 1 * *")
      .put("@yearly", "0 0 1 1 *")
      .put("hourly", "0 * * * *")
      .put("daily", "0 0 * * *")
      .put("weekly", "0 0 * * MON")
      .put("monthly", "0 0 1 * *")
      .put("yearly", "0 0 1 1 *")
      .build();

  private TimeUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Gets the next fire instant of a cron expression evaluated in a time zone.
   *
   * <p>The returned instant is strictly after {@code instant}, e.g. {@code 0 9 * * *} in
   * America/New_York relative to 09:00 local today is 09:00 local tomorrow.
   *
   * @param instant    The instant to calculate the next fire time relative to
   * @param expression A five-field cron expression or a well-known alias such as {@code @daily}
   * @param zone       The zone the expression is evaluated in
   * @return the next fire time, as an instant
   */
  public static Instant nextInstant(Instant instant, String expression, ZoneId zone) {
    final ExecutionTime executionTime = ExecutionTime.forCron(cron(expression));
    final ZonedDateTime zonedDateTime = instant.atZone(zone);

    return executionTime.nextExecution(zonedDateTime)
        .orElseThrow(IllegalArgumentException::new) // with unix cron, this should not happen
        .toInstant();
  }

  /**
   * Parses and validates a cron expression.
   *
   * @throws IllegalArgumentException if the expression is not a valid five-field cron expression
   */
  public static Cron cron(String expression) {
    return new CronParser(CRON_DEFINITION).parse(normalize(expression)).validate();
  }

  /**
   * Expands well-known aliases such as {@code @weekly} into their five-field form.
   */
  public static String normalize(String expression) {
    return WELL_KNOWN.getOrDefault(expression.trim().toLowerCase(Locale.ROOT), expression.trim());
  }

  public static boolean isValidCron(String expression) {
    try {
      cron(expression);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  public static LocalDate dateInZone(Instant instant, ZoneId zone) {
    return instant.atZone(zone).toLocalDate();
  }
}
