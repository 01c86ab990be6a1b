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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.verify;

import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SegmentStatus;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.UpsertKeyPolicy;
import com.spotify.sluice.model.WarehouseSyncDirective;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.InMemStorage;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class ExecutionOutcomeHandlerTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private final InMemStorage storage = new InMemStorage();

  @Mock private Stats stats;

  private ExecutionOutcomeHandler handler() {
    return new ExecutionOutcomeHandler(stats);
  }

  @Test
  public void shouldCountSuccessfulScheduledRun() throws IOException {
    storage.store(job());

    apply(execution(ExecutionOrigin.scheduled("job-1"), ExecutionStatus.SUCCESS));

    var job = storage.scheduledJob("job-1").orElseThrow();
    assertThat(job.successfulRuns(), is(1L));
    assertThat(job.failedRuns(), is(0L));
    verify(stats).recordTerminalExecution(ExecutionStatus.SUCCESS);
  }

  @Test
  public void shouldCountTimedOutScheduledRunAsFailure() throws IOException {
    storage.store(job());

    apply(execution(ExecutionOrigin.scheduled("job-1"), ExecutionStatus.TIMED_OUT));

    assertThat(storage.scheduledJob("job-1").orElseThrow().failedRuns(), is(1L));
  }

  @Test
  public void shouldReturnFailedSegmentToPendingWhileAttemptsRemain() throws IOException {
    storeRun(segment(0, "exec-1"));

    apply(execution("exec-1", ExecutionOrigin.backfill("run-1", "run-1-0"),
        ExecutionStatus.FAILED));

    var segment = storage.segments("run-1").get(0);
    assertThat(segment.status(), is(SegmentStatus.PENDING));
    assertThat(segment.attempts(), is(1));
    assertThat(segment.lastError(), is(Optional.of("boom")));
    assertThat(storage.backfillRun("run-1").orElseThrow().progress().pending(), is(1));
  }

  @Test
  public void shouldFailSegmentAndRunWhenAttemptsAreExhausted() throws IOException {
    storeRun(segment(0, "exec-1").toBuilder().attempts(2).build());

    apply(execution("exec-1", ExecutionOrigin.backfill("run-1", "run-1-0"),
        ExecutionStatus.FAILED));

    assertThat(storage.segments("run-1").get(0).status(), is(SegmentStatus.FAILED));
    assertThat(storage.segments("run-1").get(0).attempts(), is(3));
    assertThat(storage.backfillRun("run-1").orElseThrow().status(), is(BackfillStatus.FAILED));
  }

  @Test
  public void shouldCompleteRunWhenLastSegmentSucceeds() throws IOException {
    storeRun(segment(0, "exec-1"));

    apply(execution("exec-1", ExecutionOrigin.backfill("run-1", "run-1-0"),
        ExecutionStatus.SUCCESS));

    assertThat(storage.segments("run-1").get(0).status(), is(SegmentStatus.SUCCESS));
    var run = storage.backfillRun("run-1").orElseThrow();
    assertThat(run.status(), is(BackfillStatus.COMPLETED));
    assertThat(run.progress().completed(), is(1));
  }

  @Test
  public void shouldIgnoreOutcomeOfSupersededExecution() throws IOException {
    storeRun(segment(0, "exec-2"));

    apply(execution("exec-1", ExecutionOrigin.backfill("run-1", "run-1-0"),
        ExecutionStatus.FAILED));

    var segment = storage.segments("run-1").get(0);
    assertThat(segment.status(), is(SegmentStatus.RUNNING));
    assertThat(segment.attempts(), is(0));
  }

  @Test
  public void shouldQueueSyncOfSuccessfulExecution() throws IOException {
    var execution = execution(ExecutionOrigin.adHoc(), ExecutionStatus.SUCCESS).toBuilder()
        .syncDirective(WarehouseSyncDirective.create(true, Optional.empty(),
            UpsertKeyPolicy.APPEND))
        .build();

    apply(execution);

    var state = storage.syncState(execution.id()).orElseThrow();
    assertThat(state.status(), is(SyncStatus.PENDING));
    assertThat(state.attempts(), is(0));
    assertThat(state.targetTable(), is(TestData.QUERY.queryId()));
    assertThat(state.upsertKeyPolicy(), is(UpsertKeyPolicy.APPEND));
  }

  @Test
  public void shouldNotQueueSyncOfFailedExecution() throws IOException {
    var execution = execution(ExecutionOrigin.adHoc(), ExecutionStatus.FAILED).toBuilder()
        .syncDirective(WarehouseSyncDirective.enabledFor("SALES"))
        .build();

    apply(execution);

    assertThat(storage.syncState(execution.id()), is(Optional.empty()));
  }

  @Test
  public void shouldRejectNonTerminalExecution() {
    assertThrows(IllegalArgumentException.class, () ->
        apply(execution(ExecutionOrigin.adHoc(), ExecutionStatus.RUNNING)));
  }

  private void apply(Execution execution) throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      handler().apply(tx, execution, NOW);
      return null;
    });
  }

  private void storeRun(BackfillSegment segment) throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      tx.store(BackfillRun.newBuilder()
          .id("run-1")
          .principalId(TestData.PRINCIPAL)
          .query(TestData.QUERY)
          .startDate(segment.startDate())
          .endDate(segment.endDate())
          .created(NOW)
          .build());
      tx.store(segment);
      return null;
    });
  }

  private static BackfillSegment segment(int sequence, String executionId) {
    return BackfillSegment.newBuilder()
        .id("run-1-" + sequence)
        .runId("run-1")
        .sequence(sequence)
        .startDate(LocalDate.parse("2024-01-01"))
        .endDate(LocalDate.parse("2024-01-07"))
        .status(SegmentStatus.RUNNING)
        .executionId(executionId)
        .updated(NOW)
        .build();
  }

  private static ScheduledJob job() {
    return ScheduledJob.newBuilder()
        .id("job-1")
        .principalId(TestData.PRINCIPAL)
        .query(TestData.QUERY)
        .cronExpression("0 9 * * *")
        .timezone("UTC")
        .nextFire(NOW)
        .created(NOW)
        .build();
  }

  private static Execution execution(ExecutionOrigin origin, ExecutionStatus status) {
    return execution("exec-1", origin, status);
  }

  private static Execution execution(String id, ExecutionOrigin origin, ExecutionStatus status) {
    return Execution.newBuilder()
        .id(id)
        .origin(origin)
        .principalId(TestData.PRINCIPAL)
        .query(TestData.QUERY)
        .status(status)
        .error(status == ExecutionStatus.SUCCESS ? Optional.empty() : Optional.of("boom"))
        .created(NOW)
        .build();
  }
}
