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

import static java.time.Instant.parse;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.ScheduledJob;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.Test;

public class InMemStorageTest {

  private static final Instant NOW = parse("2024-01-16T14:00:00Z");
  private static final QueryDefinition QUERY = QueryDefinition.newBuilder()
      .queryId("query-1")
      .instanceId("instance-1")
      .sql("SELECT 1")
      .build();

  private final InMemStorage storage = new InMemStorage();

  @Test
  public void shouldCommitTransactionWrites() throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      tx.store(execution("exec-1", ExecutionStatus.PENDING));
      assertThat(tx.execution("exec-1").isPresent(), is(true));
      assertThat(storage.execution("exec-1"), is(Optional.empty()));
      return null;
    });

    assertThat(storage.execution("exec-1").isPresent(), is(true));
  }

  @Test
  public void shouldDiscardWritesOfFailedTransaction() throws IOException {
    assertThrows(IllegalStateException.class, () ->
        storage.runInTransactionWithRetries(tx -> {
          tx.store(execution("exec-1", ExecutionStatus.PENDING));
          throw new IllegalStateException("boom");
        }));

    assertThat(storage.execution("exec-1"), is(Optional.empty()));
  }

  @Test
  public void shouldListOnlyNonTerminalExecutionsAsActive() throws IOException {
    storage.store(execution("pending", ExecutionStatus.PENDING));
    storage.store(execution("running", ExecutionStatus.RUNNING));
    storage.store(execution("done", ExecutionStatus.SUCCESS));
    storage.store(execution("timed-out", ExecutionStatus.TIMED_OUT));

    assertThat(storage.activeExecutions().size(), is(2));
  }

  @Test
  public void shouldReturnDueActiveJobsOnly() throws IOException {
    storage.store(job("due", true, NOW.minusSeconds(1)));
    storage.store(job("exactly-now", true, NOW));
    storage.store(job("paused", false, NOW.minusSeconds(1)));
    storage.store(job("future", true, NOW.plusSeconds(1)));

    assertThat(storage.dueScheduledJobs(NOW).stream().map(ScheduledJob::id).sorted()
        .collect(java.util.stream.Collectors.toList()), contains("due", "exactly-now"));
  }

  @Test
  public void shouldReturnSegmentsInSequenceOrder() throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      tx.store(segment("run-1", 2));
      tx.store(segment("run-1", 0));
      tx.store(segment("run-2", 0));
      tx.store(segment("run-1", 1));
      assertThat(tx.segments("run-1").size(), is(3));
      return null;
    });

    assertThat(storage.segments("run-1").stream().map(BackfillSegment::sequence)
        .collect(java.util.stream.Collectors.toList()), contains(0, 1, 2));
  }

  @Test
  public void shouldFindExecutionsForScheduledJobSince() throws IOException {
    storage.store(execution("old", ExecutionStatus.SUCCESS).toBuilder()
        .origin(ExecutionOrigin.scheduled("job-1"))
        .created(NOW.minusSeconds(600))
        .build());
    storage.store(execution("recent", ExecutionStatus.RUNNING).toBuilder()
        .origin(ExecutionOrigin.scheduled("job-1"))
        .build());
    storage.store(execution("other-job", ExecutionStatus.RUNNING).toBuilder()
        .origin(ExecutionOrigin.scheduled("job-2"))
        .build());

    assertThat(storage.executionsForScheduledJob("job-1", NOW.minusSeconds(300)).size(), is(1));
  }

  private static Execution execution(String id, ExecutionStatus status) {
    return Execution.newBuilder()
        .id(id)
        .origin(ExecutionOrigin.adHoc())
        .principalId("principal-1")
        .query(QUERY)
        .status(status)
        .created(NOW)
        .build();
  }

  private static ScheduledJob job(String id, boolean active, Instant nextFire) {
    return ScheduledJob.newBuilder()
        .id(id)
        .principalId("principal-1")
        .query(QUERY)
        .cronExpression("0 9 * * *")
        .timezone("UTC")
        .active(active)
        .nextFire(nextFire)
        .created(NOW)
        .build();
  }

  private static BackfillSegment segment(String runId, int sequence) {
    final LocalDate start = LocalDate.of(2024, 1, 1).plusWeeks(sequence);
    return BackfillSegment.newBuilder()
        .id(runId + "-" + sequence)
        .runId(runId)
        .sequence(sequence)
        .startDate(start)
        .endDate(start.plusDays(6))
        .updated(NOW)
        .build();
  }
}
