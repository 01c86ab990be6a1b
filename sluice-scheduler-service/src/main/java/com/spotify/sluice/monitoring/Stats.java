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

import com.codahale.metrics.Gauge;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.SyncStatus;

/**
 * Interface for collecting statistics from throughout the Sluice scheduler
 */
public interface Stats {

  Stats NOOP = new NoopStats();

  void registerActiveExecutionsMetric(Gauge<Long> activeExecutions);

  void recordTickDuration(String type, long durationMillis);

  void recordSubmission(ExecutionOrigin.Kind origin);

  void recordSubmissionFailure(ExecutionOrigin.Kind origin);

  void recordTerminalExecution(ExecutionStatus status);

  void recordCredentialRefresh(String outcome);

  void recordSync(SyncStatus status);
}
