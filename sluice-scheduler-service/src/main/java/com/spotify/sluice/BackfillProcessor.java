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

import static com.google.common.base.CaseFormat.LOWER_UNDERSCORE;
import static com.google.common.base.CaseFormat.UPPER_CAMEL;
import static com.spotify.sluice.util.GuardedRunnable.guard;
import static java.util.stream.Collectors.toList;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.futures.CompletableFutures;
import com.spotify.sluice.api.BackfillRequest;
import com.spotify.sluice.model.BackfillProgress;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.SegmentStatus;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.ParameterUtil;
import com.spotify.sluice.util.Time;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives backfill runs: each tick submits the next pending segments of the oldest active runs.
 * Segment outcomes are applied by {@link ExecutionOutcomeHandler} once their executions finish.
 */
public class BackfillProcessor {

  private static final Logger LOG = LoggerFactory.getLogger(BackfillProcessor.class);

  private static final String TICK_TYPE = UPPER_CAMEL.to(LOWER_UNDERSCORE,
      BackfillProcessor.class.getSimpleName());

  static final int DEFAULT_RUNS_PER_TICK = 5;
  static final int DEFAULT_SEGMENTS_PER_RUN = 10;

  private final Storage storage;
  private final ExecutionSubmitter submitter;
  private final Stats stats;
  private final Time time;
  private final Executor executor;
  private final int runsPerTick;
  private final int segmentsPerRun;
  private final int maxSegments;

  public BackfillProcessor(Storage storage, ExecutionSubmitter submitter, Stats stats, Time time,
                           Executor executor, int runsPerTick, int segmentsPerRun,
                           int maxSegments) {
    this.storage = Objects.requireNonNull(storage);
    this.submitter = Objects.requireNonNull(submitter);
    this.stats = Objects.requireNonNull(stats);
    this.time = Objects.requireNonNull(time);
    this.executor = Objects.requireNonNull(executor);
    this.runsPerTick = runsPerTick;
    this.segmentsPerRun = segmentsPerRun;
    this.maxSegments = maxSegments;
  }

  /**
   * Store a new active run together with all of its pending segments.
   *
   * @throws IllegalArgumentException if the date range cannot be segmented
   */
  public BackfillRun createBackfill(BackfillRequest request) throws IOException {
    final Instant now = time.get();
    final String runId = UUID.randomUUID().toString();
    final BackfillRun.Builder builder = BackfillRun.newBuilder()
        .id(runId)
        .principalId(request.principalId())
        .query(request.query())
        .startDate(request.startDate())
        .endDate(request.endDate())
        .syncDirective(request.syncDirective())
        .created(now);
    request.segmentDays().ifPresent(builder::segmentDays);
    request.maxAttempts().ifPresent(builder::maxAttempts);
    final BackfillRun template = builder.build();

    final List<BackfillSegment> segments = BackfillPlanner.plan(runId, template.startDate(),
        template.endDate(), template.segmentDays(), maxSegments, now);
    final BackfillRun run = template.toBuilder()
        .progress(BackfillProgress.of(segments))
        .build();

    storage.runInTransactionWithRetries(tx -> {
      tx.store(run);
      for (BackfillSegment segment : segments) {
        tx.store(segment);
      }
      return null;
    });

    LOG.info("Created backfill {} of {} for {} to {} in {} segments", runId,
        request.query().queryId(), run.startDate(), run.endDate(), segments.size());
    return run;
  }

  public void tick() {
    final Instant t0 = time.get();

    final List<BackfillRun> runs;
    try {
      runs = storage.backfillRuns(BackfillStatus.ACTIVE).stream()
          .sorted(Comparator.comparing(BackfillRun::created))
          .limit(runsPerTick)
          .collect(toList());
    } catch (IOException e) {
      LOG.warn("Failed to read active backfills, skipping this tick", e);
      return;
    }

    runs.forEach(run -> guard(() -> process(run)).run());

    stats.recordTickDuration(TICK_TYPE, t0.until(time.get(), ChronoUnit.MILLIS));
  }

  @VisibleForTesting
  void process(BackfillRun run) {
    final List<BackfillSegment> pending;
    try {
      pending = storage.segments(run.id()).stream()
          .filter(segment -> segment.status() == SegmentStatus.PENDING)
          .sorted(BackfillSegment.SEQUENCE_ORDER)
          .limit(segmentsPerRun)
          .collect(toList());
      if (pending.isEmpty()) {
        completeIfDone(run.id());
        return;
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    final List<CompletableFuture<Void>> submissions = pending.stream()
        .map(segment -> CompletableFuture.runAsync(guard(() -> submitSegment(run, segment)),
            executor))
        .collect(toList());
    CompletableFutures.allAsList(submissions).join();
  }

  private void submitSegment(BackfillRun run, BackfillSegment segment) {
    try {
      final Optional<Execution> claimed = claim(run, segment);
      if (claimed.isPresent()) {
        submitter.submit(claimed.get());
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Create the execution of a pending segment and mark the segment running, provided the run is
   * still active and nobody else claimed the segment.
   */
  private Optional<Execution> claim(BackfillRun run, BackfillSegment segment) throws IOException {
    final Instant now = time.get();
    return storage.runInTransactionWithRetries(tx -> {
      final Optional<BackfillRun> currentRun = tx.backfillRun(run.id());
      final Optional<BackfillSegment> current = tx.segment(run.id(), segment.id());
      if (currentRun.isEmpty() || currentRun.get().status() != BackfillStatus.ACTIVE
          || current.isEmpty() || current.get().status() != SegmentStatus.PENDING) {
        return Optional.<Execution>empty();
      }

      final Execution execution = segmentExecution(currentRun.get(), current.get(), now);
      final BackfillSegment running = current.get().toBuilder()
          .status(SegmentStatus.RUNNING)
          .executionId(execution.id())
          .updated(now)
          .build();
      tx.store(execution);
      tx.store(running);
      BackfillRuns.refresh(tx, currentRun.get(), List.of(running), now);

      LOG.info("Submitting segment {} ({} to {}) of backfill {}, attempt {}",
          segment.sequence(), segment.startDate(), segment.endDate(), run.id(),
          segment.attempts() + 1);
      return Optional.of(execution);
    });
  }

  private void completeIfDone(String runId) throws IOException {
    final Instant now = time.get();
    final BackfillRun run = storage.runInTransactionWithRetries(tx -> {
      final Optional<BackfillRun> current = tx.backfillRun(runId);
      if (current.isEmpty() || current.get().status() != BackfillStatus.ACTIVE) {
        return null;
      }
      return BackfillRuns.refresh(tx, current.get(), List.of(), now);
    });
    if (run != null && run.status() != BackfillStatus.ACTIVE) {
      LOG.info("Backfill {} is {}", runId, run.status());
    }
  }

  static Execution segmentExecution(BackfillRun run, BackfillSegment segment, Instant now) {
    final QueryDefinition query = run.query();
    final String sql = ParameterUtil.render(query.sql(),
        ParameterUtil.windowSubstitutions(segment.startDate(), segment.endDate()));
    return Execution.newBuilder()
        .id(UUID.randomUUID().toString())
        .origin(ExecutionOrigin.backfill(run.id(), segment.id()))
        .principalId(run.principalId())
        .query(query.toBuilder().sql(sql).build())
        .parameters(ParameterUtil.windowParameters(query.defaultParameters(),
            segment.startDate(), segment.endDate()))
        .syncDirective(run.syncDirective())
        .created(now)
        .build();
  }
}
