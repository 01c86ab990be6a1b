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

package com.spotify.sluice.storage;

import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.WarehouseConfig;
import com.spotify.sluice.model.WarehouseSyncState;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The interface to the persistence layer. The store is the only mutable state the periodic
 * components share.
 */
public interface Storage extends Closeable {

  Optional<Credential> credential(String principalId) throws IOException;

  /**
   * Credentials that expire before the given instant, across all principals.
   */
  List<Credential> credentialsExpiringBefore(Instant instant) throws IOException;

  void store(Credential credential) throws IOException;

  Optional<WarehouseConfig> warehouseConfig(String principalId) throws IOException;

  void store(WarehouseConfig warehouseConfig) throws IOException;

  Optional<ScheduledJob> scheduledJob(String id) throws IOException;

  List<ScheduledJob> scheduledJobs() throws IOException;

  /**
   * Active scheduled jobs whose next fire time is at or before {@code now}.
   */
  List<ScheduledJob> dueScheduledJobs(Instant now) throws IOException;

  void store(ScheduledJob scheduledJob) throws IOException;

  Optional<Execution> execution(String id) throws IOException;

  /**
   * Executions that have not reached a terminal status.
   */
  List<Execution> activeExecutions() throws IOException;

  /**
   * Executions created by a scheduled job at or after {@code createdSince}.
   */
  List<Execution> executionsForScheduledJob(String scheduledJobId, Instant createdSince)
      throws IOException;

  void store(Execution execution) throws IOException;

  Optional<BackfillRun> backfillRun(String id) throws IOException;

  List<BackfillRun> backfillRuns(BackfillStatus status) throws IOException;

  /**
   * All segments of a backfill run, in sequence order.
   */
  List<BackfillSegment> segments(String runId) throws IOException;

  Optional<WarehouseSyncState> syncState(String executionId) throws IOException;

  List<WarehouseSyncState> syncStates(SyncStatus status) throws IOException;

  /**
   * Run a function in a transaction, committing on success and retrying the whole function if
   * the commit conflicts with a concurrent transaction.
   */
  <T, E extends Exception> T runInTransactionWithRetries(TransactionFunction<T, E> f)
      throws IOException, E;
}
