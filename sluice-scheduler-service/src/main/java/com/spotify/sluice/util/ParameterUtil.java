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

package com.spotify.sluice.util;

import com.google.common.collect.ImmutableMap;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.ScheduledJob;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the parameters an execution is submitted with.
 */
public final class ParameterUtil {

  public static final String START_DATE = "startDate";
  public static final String END_DATE = "endDate";
  public static final String SCHEDULE_ID = "_schedule_id";
  public static final String SCHEDULED_EXECUTION = "_scheduled_execution";

  private static final DateTimeFormatter START_OF_DAY =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'00:00:00");
  private static final DateTimeFormatter END_OF_DAY =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'23:59:59");

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

  private ParameterUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Parameters of a scheduled run: the query's defaults with a date window ending {@code dataLag}
   * days before {@code today} and looking back the query's lookback days.
   */
  public static Map<String, String> scheduledParameters(ScheduledJob job, LocalDate today,
                                                        int dataLagDays) {
    final QueryDefinition query = job.query();
    final LocalDate end = today.minusDays(dataLagDays);
    final LocalDate start = end.minusDays(
        query.lookbackDays().orElseGet(() -> defaultLookbackDays(job.cronExpression())));

    final Map<String, String> parameters = new LinkedHashMap<>(query.defaultParameters());
    parameters.put(START_DATE, START_OF_DAY.format(start));
    parameters.put(END_DATE, END_OF_DAY.format(end));
    parameters.put(SCHEDULE_ID, job.id());
    parameters.put(SCHEDULED_EXECUTION, "true");
    return ImmutableMap.copyOf(parameters);
  }

  /**
   * Lookback of a schedule without explicit lookback days: a month for monthly schedules, a week
   * for weekly schedules, a day otherwise.
   */
  public static int defaultLookbackDays(String cronExpression) {
    final String[] fields = TimeUtil.normalize(cronExpression).split("\\s+");
    if (fields.length != 5) {
      return 1;
    }
    if (!fields[2].equals("*")) {
      return 30;
    }
    if (!fields[4].equals("*")) {
      return 7;
    }
    return 1;
  }

  /**
   * Parameters of a backfill segment covering {@code [start, end]}. Placeholders such as
   * {@code {{start_date}}} or {@code {{week_end}}} in the defaults are replaced by the window;
   * {@code startDate} and {@code endDate} are added unless the defaults define them.
   */
  public static Map<String, String> windowParameters(Map<String, String> defaults, LocalDate start,
                                                     LocalDate end) {
    final Map<String, String> window = windowSubstitutions(start, end);
    final Map<String, String> parameters = new LinkedHashMap<>();
    defaults.forEach((key, value) -> parameters.put(key, render(value, window)));
    parameters.putIfAbsent(START_DATE, window.get("start_date"));
    parameters.putIfAbsent(END_DATE, window.get("end_date"));
    return ImmutableMap.copyOf(parameters);
  }

  public static Map<String, String> windowSubstitutions(LocalDate start, LocalDate end) {
    final String from = START_OF_DAY.format(start);
    final String to = END_OF_DAY.format(end);
    return ImmutableMap.<String, String>builder()
        .put("start_date", from)
        .put("end_date", to)
        .put("week_start", from)
        .put("week_end", to)
        .put("date_from", from)
        .put("date_to", to)
        .put("from_date", from)
        .put("to_date", to)
        .build();
  }

  /**
   * Replace every {@code {{name}}} with its substitution. Unknown placeholders are left as is.
   */
  public static String render(String template, Map<String, String> substitutions) {
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuffer rendered = new StringBuffer();
    while (matcher.find()) {
      final String replacement = substitutions.getOrDefault(matcher.group(1), matcher.group());
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }
}
