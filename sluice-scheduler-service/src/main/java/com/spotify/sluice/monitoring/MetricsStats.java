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

package com.spotify.sluice.monitoring;

import static com.codahale.metrics.MetricRegistry.name;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.SyncStatus;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public final class MetricsStats implements Stats {

  private static final String BASE = "sluice";

  static final String ACTIVE_EXECUTIONS = name(BASE, "active-executions-count");
  static final String TICK_DURATION = name(BASE, "tick-duration");
  static final String SUBMISSION_RATE = name(BASE, "submission-rate");
  static final String SUBMISSION_ERROR_RATE = name(BASE, "submission-error-rate");
  static final String TERMINAL_EXECUTION_RATE = name(BASE, "terminal-execution-rate");
  static final String CREDENTIAL_REFRESH_RATE = name(BASE, "credential-refresh-rate");
  static final String SYNC_RATE = name(BASE, "warehouse-sync-rate");

  private final MetricRegistry registry;

  private final ConcurrentMap<String, Histogram> tickDurationHistograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Meter> meters = new ConcurrentHashMap<>();

  public MetricsStats(MetricRegistry registry) {
    this.registry = Objects.requireNonNull(registry);
  }

  @Override
  public void registerActiveExecutionsMetric(Gauge<Long> activeExecutions) {
    registry.register(ACTIVE_EXECUTIONS, activeExecutions);
  }

  @Override
  public void recordTickDuration(String type, long durationMillis) {
    tickDurationHistograms
        .computeIfAbsent(type, t -> registry.histogram(name(TICK_DURATION, t)))
        .update(durationMillis);
  }

  @Override
  public void recordSubmission(ExecutionOrigin.Kind origin) {
    meter(SUBMISSION_RATE, origin.name()).mark();
  }

  @Override
  public void recordSubmissionFailure(ExecutionOrigin.Kind origin) {
    meter(SUBMISSION_ERROR_RATE, origin.name()).mark();
  }

  @Override
  public void recordTerminalExecution(ExecutionStatus status) {
    meter(TERMINAL_EXECUTION_RATE, status.name()).mark();
  }

  @Override
  public void recordCredentialRefresh(String outcome) {
    meter(CREDENTIAL_REFRESH_RATE, outcome).mark();
  }

  @Override
  public void recordSync(SyncStatus status) {
    meter(SYNC_RATE, status.name()).mark();
  }

  private Meter meter(String base, String tag) {
    final String metricName = name(base, tag.toLowerCase(Locale.ROOT));
    return meters.computeIfAbsent(metricName, registry::meter);
  }
}
