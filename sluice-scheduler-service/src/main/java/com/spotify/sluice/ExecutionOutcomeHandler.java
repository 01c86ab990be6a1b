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

package com.spotify.sluice;

import com.google.common.base.Preconditions;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SegmentStatus;
import com.spotify.sluice.model.WarehouseSyncDirective;
import com.spotify.sluice.model.WarehouseSyncState;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.StorageTransaction;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the consequences of an execution reaching a terminal status to whatever created it,
 * within the transaction that stored the terminal status.
 *
 * <ul>
 *   <li>a scheduled job counts the run as successful or failed</li>
 *   <li>a backfill segment succeeds, goes back to pending for another attempt or fails, and its
 *   run's progress is recomputed</li>
 *   <li>a successful execution with warehouse sync enabled gets a pending sync state</li>
 * </ul>
 */
public class ExecutionOutcomeHandler {

  private static final Logger LOG = LoggerFactory.getLogger(ExecutionOutcomeHandler.class);

  private final Stats stats;

  public ExecutionOutcomeHandler(Stats stats) {
    this.stats = Objects.requireNonNull(stats);
  }

  public void apply(StorageTransaction tx, Execution execution, Instant now) throws IOException {
    Preconditions.checkArgument(execution.status().isTerminal(),
        "execution %s is not terminal: %s", execution.id(), execution.status());

    stats.recordTerminalExecution(execution.status());

    switch (execution.origin().kind()) {
      case SCHEDULED:
        countScheduledRun(tx, execution);
        break;
      case BACKFILL:
        completeSegment(tx, execution, now);
        break;
      case AD_HOC:
        break;
      default:
        throw new AssertionError("Unknown origin: " + execution.origin().kind());
    }

    if (execution.status() == ExecutionStatus.SUCCESS && execution.syncEnabled()) {
      enqueueSync(tx, execution, now);
    }
  }

  private void countScheduledRun(StorageTransaction tx, Execution execution) throws IOException {
    final String jobId = execution.origin().referenceId().orElseThrow();
    final Optional<ScheduledJob> job = tx.scheduledJob(jobId);
    if (job.isEmpty()) {
      LOG.warn("Scheduled job {} of execution {} no longer exists", jobId, execution.id());
      return;
    }
    final ScheduledJob.Builder builder = job.get().toBuilder();
    if (execution.status() == ExecutionStatus.SUCCESS) {
      builder.successfulRuns(job.get().successfulRuns() + 1);
    } else {
      builder.failedRuns(job.get().failedRuns() + 1);
    }
    tx.store(builder.build());
  }

  private void completeSegment(StorageTransaction tx, Execution execution, Instant now)
      throws IOException {
    final String runId = execution.origin().parentId().orElseThrow();
    final String segmentId = execution.origin().referenceId().orElseThrow();

    final Optional<BackfillRun> run = tx.backfillRun(runId);
    final Optional<BackfillSegment> segment = tx.segment(runId, segmentId);
    if (run.isEmpty() || segment.isEmpty()) {
      LOG.warn("Backfill segment {}/{} of execution {} no longer exists",
          runId, segmentId, execution.id());
      return;
    }
    if (!segment.get().executionId().equals(Optional.of(execution.id()))) {
      LOG.info("Segment {} moved on from execution {}, ignoring its outcome",
          segmentId, execution.id());
      return;
    }

    final BackfillSegment updated = segmentOutcome(segment.get(), execution,
        run.get().maxAttempts(), now);
    tx.store(updated);
    final BackfillRun refreshed = BackfillRuns.refresh(tx, run.get(), List.of(updated), now);

    LOG.info("Segment {} of backfill {} is {} ({}/{} done)", segment.get().sequence(), runId,
        updated.status(), refreshed.progress().completed(), refreshed.progress().total());
  }

  static BackfillSegment segmentOutcome(BackfillSegment segment, Execution execution,
                                        int maxAttempts, Instant now) {
    if (execution.status() == ExecutionStatus.SUCCESS) {
      return segment.toBuilder()
          .status(SegmentStatus.SUCCESS)
          .lastError(Optional.empty())
          .updated(now)
          .build();
    }
    final int attempts = segment.attempts() + 1;
    return segment.toBuilder()
        .status(attempts < maxAttempts ? SegmentStatus.PENDING : SegmentStatus.FAILED)
        .attempts(attempts)
        .lastError(execution.error().orElse("Execution " + execution.status()))
        .updated(now)
        .build();
  }

  private void enqueueSync(StorageTransaction tx, Execution execution, Instant now)
      throws IOException {
    if (tx.syncState(execution.id()).isPresent()) {
      return;
    }
    final WarehouseSyncDirective directive = execution.syncDirective().orElseThrow();
    tx.store(WarehouseSyncState.newBuilder()
        .executionId(execution.id())
        .principalId(execution.principalId())
        .targetTable(directive.targetTable().orElse(execution.query().queryId()))
        .upsertKeyPolicy(directive.upsertKeyPolicy())
        .created(now)
        .updated(now)
        .build());
    LOG.debug("Queued warehouse sync of execution {}", execution.id());
  }
}
