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
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.ParameterUtil;
import com.spotify.sluice.util.Time;
import com.spotify.sluice.util.TimeUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires due scheduled jobs. Each fire claims the job, creates a pending execution with the job's
 * date window and submits it. A job that already ran within the dedup window is not fired again,
 * but its next fire time still advances.
 */
public class ScheduleDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(ScheduleDispatcher.class);

  private static final String TICK_TYPE = UPPER_CAMEL.to(LOWER_UNDERSCORE,
      ScheduleDispatcher.class.getSimpleName());

  static final Duration DEFAULT_DEDUP_WINDOW = Duration.ofMinutes(5);
  static final int DEFAULT_DATA_LAG_DAYS = 14;

  private final Storage storage;
  private final ExecutionSubmitter submitter;
  private final Stats stats;
  private final Time time;
  private final Executor executor;
  private final Duration dedupWindow;
  private final int dataLagDays;

  public ScheduleDispatcher(Storage storage, ExecutionSubmitter submitter, Stats stats, Time time,
                            Executor executor, Duration dedupWindow, int dataLagDays) {
    this.storage = Objects.requireNonNull(storage);
    this.submitter = Objects.requireNonNull(submitter);
    this.stats = Objects.requireNonNull(stats);
    this.time = Objects.requireNonNull(time);
    this.executor = Objects.requireNonNull(executor);
    this.dedupWindow = Objects.requireNonNull(dedupWindow);
    this.dataLagDays = dataLagDays;
  }

  public void tick() {
    final Instant t0 = time.get();

    final List<ScheduledJob> dueJobs;
    try {
      dueJobs = storage.dueScheduledJobs(t0);
    } catch (IOException e) {
      LOG.warn("Failed to read due scheduled jobs, skipping this tick", e);
      return;
    }

    final List<CompletableFuture<Void>> fires = dueJobs.stream()
        .map(job -> CompletableFuture.runAsync(guard(() -> fire(job, t0)), executor))
        .collect(toList());
    CompletableFutures.allAsList(fires).join();

    final long durationMillis = t0.until(time.get(), ChronoUnit.MILLIS);
    stats.recordTickDuration(TICK_TYPE, durationMillis);
  }

  private void fire(ScheduledJob job, Instant now) {
    try {
      final Optional<Execution> claimed = claim(job, now);
      if (claimed.isPresent()) {
        submitter.submit(claimed.get());
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Advance the job past this fire and, unless it ran recently, create its execution. Nothing is
   * written if another actor changed the job since it was read.
   */
  @VisibleForTesting
  Optional<Execution> claim(ScheduledJob job, Instant now) throws IOException {
    final Instant since = now.minus(dedupWindow);
    final boolean recentlyRun = job.lastRun().map(since::isBefore).orElse(false)
        || !storage.executionsForScheduledJob(job.id(), since).isEmpty();

    final Instant nextFire = TimeUtil.nextInstant(
        job.nextFire().isAfter(now) ? job.nextFire() : now, job.cronExpression(), job.zone());

    return storage.runInTransactionWithRetries(tx -> {
      final Optional<ScheduledJob> current = tx.scheduledJob(job.id());
      if (current.isEmpty() || !current.get().active()
          || !current.get().nextFire().equals(job.nextFire())
          || !current.get().lastRun().equals(job.lastRun())) {
        LOG.debug("Scheduled job {} changed since it was read, not firing", job.id());
        return Optional.<Execution>empty();
      }

      if (recentlyRun) {
        LOG.info("Scheduled job {} ran within the last {}, skipping until {}",
            job.id(), dedupWindow, nextFire);
        tx.store(current.get().toBuilder().nextFire(nextFire).build());
        return Optional.<Execution>empty();
      }

      final Execution execution = Execution.newBuilder()
          .id(UUID.randomUUID().toString())
          .origin(ExecutionOrigin.scheduled(job.id()))
          .principalId(job.principalId())
          .query(job.query())
          .parameters(ParameterUtil.scheduledParameters(job,
              TimeUtil.dateInZone(now, job.zone()), dataLagDays))
          .syncDirective(job.syncDirective())
          .created(now)
          .build();

      tx.store(current.get().toBuilder()
          .lastRun(now)
          .totalRuns(current.get().totalRuns() + 1)
          .nextFire(nextFire)
          .build());
      tx.store(execution);

      LOG.info("Firing scheduled job {} as execution {}, next fire at {}",
          job.id(), execution.id(), nextFire);
      return Optional.of(execution);
    });
  }
}
