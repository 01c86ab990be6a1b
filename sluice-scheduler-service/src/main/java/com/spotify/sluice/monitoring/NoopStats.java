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

final class NoopStats implements Stats {

  @Override
  public void registerActiveExecutionsMetric(Gauge<Long> activeExecutions) {
    // nop
  }

  @Override
  public void recordTickDuration(String type, long durationMillis) {
    // nop
  }

  @Override
  public void recordSubmission(ExecutionOrigin.Kind origin) {
    // nop
  }

  @Override
  public void recordSubmissionFailure(ExecutionOrigin.Kind origin) {
    // nop
  }

  @Override
  public void recordTerminalExecution(ExecutionStatus status) {
    // nop
  }

  @Override
  public void recordCredentialRefresh(String outcome) {
    // nop
  }

  @Override
  public void recordSync(SyncStatus status) {
    // nop
  }
}
