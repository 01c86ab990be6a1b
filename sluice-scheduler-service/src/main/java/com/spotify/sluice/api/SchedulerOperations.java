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

package com.spotify.sluice.api;

import static java.util.stream.Collectors.toList;

import com.google.common.base.Preconditions;
import com.spotify.sluice.BackfillProcessor;
import com.spotify.sluice.BackfillRuns;
import com.spotify.sluice.ExecutionOutcomeHandler;
import com.spotify.sluice.ExecutionSubmitter;
import com.spotify.sluice.crypto.SecretCipher;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SegmentStatus;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.WarehouseConfig;
import com.spotify.sluice.model.WarehouseSyncDirective;
import com.spotify.sluice.model.WarehouseSyncState;
import com.spotify.sluice.state.ExecutionTransitions;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.sync.WarehouseSyncPipeline;
import com.spotify.sluice.util.ConflictException;
import com.spotify.sluice.util.ResourceNotFoundException;
import com.spotify.sluice.util.Time;
import com.spotify.sluice.util.TimeUtil;
import com.spotify.sluice.warehouse.WarehouseClientFactory;
import com.spotify.sluice.warehouse.WarehouseException;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator facing mutations and reads. Every mutation respects the state machines of the
 * entities it touches: operations on missing entities throw {@link ResourceNotFoundException},
 * mutations not allowed in the entity's current state throw {@link ConflictException}.
 */
public class SchedulerOperations {

  private static final Logger LOG = LoggerFactory.getLogger(SchedulerOperations.class);

  private final Storage storage;
  private final ExecutionSubmitter submitter;
  private final ExecutionOutcomeHandler outcomes;
  private final BackfillProcessor backfills;
  private final WarehouseSyncPipeline syncPipeline;
  private final SecretCipher cipher;
  private final WarehouseClientFactory warehouseClientFactory;
  private final Time time;

  public SchedulerOperations(Storage storage, ExecutionSubmitter submitter,
                             ExecutionOutcomeHandler outcomes, BackfillProcessor backfills,
                             WarehouseSyncPipeline syncPipeline, SecretCipher cipher,
                             WarehouseClientFactory warehouseClientFactory, Time time) {
    this.storage = Objects.requireNonNull(storage);
    this.submitter = Objects.requireNonNull(submitter);
    this.outcomes = Objects.requireNonNull(outcomes);
    this.backfills = Objects.requireNonNull(backfills);
    this.syncPipeline = Objects.requireNonNull(syncPipeline);
    this.cipher = Objects.requireNonNull(cipher);
    this.warehouseClientFactory = Objects.requireNonNull(warehouseClientFactory);
    this.time = Objects.requireNonNull(time);
  }

  // schedules

  /**
   * Store a new active schedule, first firing at the next cron match from now.
   *
   * @throws IllegalArgumentException if the cron expression or timezone is invalid
   */
  public ScheduledJob createSchedule(String principalId, QueryDefinition query,
                                     String cronExpression, String timezone,
                                     Optional<WarehouseSyncDirective> syncDirective)
      throws IOException {
    Preconditions.checkArgument(TimeUtil.isValidCron(cronExpression),
        "invalid cron expression: %s", cronExpression);
    final ZoneId zone;
    try {
      zone = ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("invalid timezone: " + timezone, e);
    }

    final Instant now = time.get();
    final ScheduledJob job = ScheduledJob.newBuilder()
        .id(UUID.randomUUID().toString())
        .principalId(principalId)
        .query(query)
        .cronExpression(cronExpression)
        .timezone(timezone)
        .nextFire(TimeUtil.nextInstant(now, cronExpression, zone))
        .syncDirective(syncDirective)
        .created(now)
        .build();
    storage.store(job);
    LOG.info("Created schedule {} of {} ({} {}), first fire at {}", job.id(), query.queryId(),
        cronExpression, timezone, job.nextFire());
    return job;
  }

  public ScheduledJob pauseSchedule(String jobId) throws IOException {
    return storage.runInTransactionWithRetries(tx -> {
      final ScheduledJob job = tx.scheduledJob(jobId).orElseThrow(() -> scheduleNotFound(jobId));
      if (!job.active()) {
        throw new ConflictException("Schedule " + jobId + " is already paused");
      }
      final ScheduledJob paused = job.toBuilder().active(false).build();
      tx.store(paused);
      return paused;
    });
  }

  /**
   * Resume a paused schedule. Fires missed while paused are not caught up.
   */
  public ScheduledJob resumeSchedule(String jobId) throws IOException {
    final Instant now = time.get();
    return storage.runInTransactionWithRetries(tx -> {
      final ScheduledJob job = tx.scheduledJob(jobId).orElseThrow(() -> scheduleNotFound(jobId));
      if (job.active()) {
        throw new ConflictException("Schedule " + jobId + " is not paused");
      }
      final ScheduledJob resumed = job.toBuilder()
          .active(true)
          .nextFire(TimeUtil.nextInstant(now, job.cronExpression(), job.zone()))
          .build();
      tx.store(resumed);
      return resumed;
    });
  }

  public ScheduledJob schedule(String jobId) throws IOException {
    return storage.scheduledJob(jobId).orElseThrow(() -> scheduleNotFound(jobId));
  }

  public List<Execution> executionsForSchedule(String jobId) throws IOException {
    schedule(jobId);
    return storage.executionsForScheduledJob(jobId, Instant.EPOCH);
  }

  // executions

  /**
   * Create and submit a one-off execution.
   */
  public Execution runAdHoc(String principalId, QueryDefinition query,
                            Map<String, String> parameters,
                            Optional<WarehouseSyncDirective> syncDirective) throws IOException {
    final Execution execution = Execution.newBuilder()
        .id(UUID.randomUUID().toString())
        .origin(ExecutionOrigin.adHoc())
        .principalId(principalId)
        .query(query)
        .parameters(parameters)
        .syncDirective(syncDirective)
        .created(time.get())
        .build();
    storage.store(execution);
    return submitter.submit(execution);
  }

  /**
   * Cancel an execution. A pending execution is cancelled at once; a running one is marked and
   * cancelled on the query gateway by the next poll.
   */
  public Execution cancelExecution(String executionId) throws IOException {
    final Instant now = time.get();
    final Execution execution = storage.runInTransactionWithRetries(tx -> {
      final Execution current = tx.execution(executionId).orElseThrow(() ->
          executionNotFound(executionId));
      if (current.status() == ExecutionStatus.PENDING) {
        final Execution cancelled = ExecutionTransitions.cancelled(current, now);
        tx.store(cancelled);
        outcomes.apply(tx, cancelled, now);
        return cancelled;
      }
      if (current.status() == ExecutionStatus.RUNNING && current.cancellationRequested()) {
        return current;
      }
      final Execution requested = ExecutionTransitions.cancellationRequested(current);
      tx.store(requested);
      return requested;
    });
    LOG.info("Cancellation of execution {} requested, now {}", executionId, execution.status());
    return execution;
  }

  public Execution execution(String executionId) throws IOException {
    return storage.execution(executionId).orElseThrow(() -> executionNotFound(executionId));
  }

  // backfills

  public BackfillRun createBackfill(BackfillRequest request) throws IOException {
    return backfills.createBackfill(request);
  }

  public BackfillRun pauseBackfill(String runId) throws IOException {
    return setBackfillStatus(runId, BackfillStatus.ACTIVE, BackfillStatus.PAUSED);
  }

  public BackfillRun resumeBackfill(String runId) throws IOException {
    return setBackfillStatus(runId, BackfillStatus.PAUSED, BackfillStatus.ACTIVE);
  }

  private BackfillRun setBackfillStatus(String runId, BackfillStatus from, BackfillStatus to)
      throws IOException {
    final Instant now = time.get();
    return storage.runInTransactionWithRetries(tx -> {
      final BackfillRun run = tx.backfillRun(runId).orElseThrow(() -> backfillNotFound(runId));
      if (run.status() != from) {
        throw new ConflictException("Backfill " + runId + " is " + run.status() + ", not " + from);
      }
      final BackfillRun updated = run.toBuilder().status(to).build();
      tx.store(updated);
      return BackfillRuns.refresh(tx, updated, List.of(), now);
    });
  }

  /**
   * Give every failed segment of a run a fresh set of attempts. A failed run becomes active again.
   */
  public BackfillRun retryFailedSegments(String runId) throws IOException {
    final Instant now = time.get();
    return storage.runInTransactionWithRetries(tx -> {
      final BackfillRun run = tx.backfillRun(runId).orElseThrow(() -> backfillNotFound(runId));
      final List<BackfillSegment> failed = tx.segments(runId).stream()
          .filter(segment -> segment.status() == SegmentStatus.FAILED)
          .collect(toList());
      if (failed.isEmpty()) {
        throw new ConflictException("Backfill " + runId + " has no failed segments");
      }

      final List<BackfillSegment> reset = new ArrayList<>(failed.size());
      for (BackfillSegment segment : failed) {
        final BackfillSegment pending = segment.toBuilder()
            .status(SegmentStatus.PENDING)
            .attempts(0)
            .executionId(Optional.empty())
            .lastError(Optional.empty())
            .updated(now)
            .build();
        tx.store(pending);
        reset.add(pending);
      }

      final BackfillRun reopened = run.status() == BackfillStatus.FAILED
          ? run.toBuilder().status(BackfillStatus.ACTIVE).finished(Optional.empty()).build()
          : run;
      if (!reopened.equals(run)) {
        tx.store(reopened);
      }
      LOG.info("Retrying {} failed segments of backfill {}", reset.size(), runId);
      return BackfillRuns.refresh(tx, reopened, reset, now);
    });
  }

  public BackfillRun backfill(String runId) throws IOException {
    return storage.backfillRun(runId).orElseThrow(() -> backfillNotFound(runId));
  }

  public List<BackfillSegment> segments(String runId) throws IOException {
    backfill(runId);
    return storage.segments(runId);
  }

  // warehouse sync

  /**
   * Reset a failed or abandoned sync to a fresh set of attempts and run it at once.
   */
  public WarehouseSyncState retrySync(String executionId) throws IOException {
    final Instant now = time.get();
    storage.runInTransactionWithRetries(tx -> {
      final WarehouseSyncState state = tx.syncState(executionId).orElseThrow(() ->
          syncNotFound(executionId));
      final boolean uploading = state.status() == SyncStatus.UPLOADING
          && !syncPipeline.isUploadAbandoned(state, now);
      if (uploading || state.status() == SyncStatus.UPLOADED
          || state.status() == SyncStatus.SKIPPED) {
        throw new ConflictException("Warehouse sync of " + executionId + " is "
                                    + state.status());
      }
      tx.store(state.toBuilder()
          .status(SyncStatus.PENDING)
          .attempts(0)
          .lastError(Optional.empty())
          .nextAttemptAt(Optional.empty())
          .updated(now)
          .build());
      return null;
    });
    return syncPipeline.sync(executionId);
  }

  public WarehouseSyncState syncState(String executionId) throws IOException {
    return storage.syncState(executionId).orElseThrow(() -> syncNotFound(executionId));
  }

  /**
   * Connect to the principal's warehouse.
   *
   * @return the warehouse version
   */
  public String testWarehouseConnection(String principalId)
      throws IOException, WarehouseException {
    final WarehouseConfig config = storage.warehouseConfig(principalId).orElseThrow(() ->
        new ResourceNotFoundException("No warehouse configuration for " + principalId));
    return warehouseClientFactory.create(config, cipher.decrypt(config.encryptedPassword()))
        .testConnection();
  }

  private static ResourceNotFoundException scheduleNotFound(String jobId) {
    return new ResourceNotFoundException("Schedule " + jobId + " does not exist");
  }

  private static ResourceNotFoundException executionNotFound(String executionId) {
    return new ResourceNotFoundException("Execution " + executionId + " does not exist");
  }

  private static ResourceNotFoundException backfillNotFound(String runId) {
    return new ResourceNotFoundException("Backfill " + runId + " does not exist");
  }

  private static ResourceNotFoundException syncNotFound(String executionId) {
    return new ResourceNotFoundException("No warehouse sync for execution " + executionId);
  }
}
