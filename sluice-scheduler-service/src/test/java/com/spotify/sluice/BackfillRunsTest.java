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

import com.spotify.sluice.model.BackfillProgress;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.SegmentStatus;
import com.spotify.sluice.storage.InMemStorage;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.Test;

public class BackfillRunsTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

  private static final BackfillRun RUN = BackfillRun.newBuilder()
      .id("run-1")
      .principalId(TestData.PRINCIPAL)
      .query(TestData.QUERY)
      .startDate(LocalDate.parse("2024-01-01"))
      .endDate(LocalDate.parse("2024-01-14"))
      .created(NOW.minusSeconds(3600))
      .build();

  private final InMemStorage storage = new InMemStorage();

  @Test
  public void shouldCompleteWhenAllSegmentsSucceeded() {
    var run = BackfillRuns.withProgress(RUN, BackfillProgress.create(3, 0, 0, 3, 0), NOW);

    assertThat(run.status(), is(BackfillStatus.COMPLETED));
    assertThat(run.finished(), is(Optional.of(NOW)));
  }

  @Test
  public void shouldFailWhenNothingIsLeftToRun() {
    var run = BackfillRuns.withProgress(RUN, BackfillProgress.create(3, 0, 0, 2, 1), NOW);

    assertThat(run.status(), is(BackfillStatus.FAILED));
    assertThat(run.finished(), is(Optional.of(NOW)));
  }

  @Test
  public void shouldStayActiveWhileSegmentsArePendingOrRunning() {
    assertThat(BackfillRuns.withProgress(RUN, BackfillProgress.create(3, 1, 0, 1, 1), NOW)
        .status(), is(BackfillStatus.ACTIVE));
    assertThat(BackfillRuns.withProgress(RUN, BackfillProgress.create(3, 0, 1, 1, 1), NOW)
        .status(), is(BackfillStatus.ACTIVE));
  }

  @Test
  public void shouldOnlyUpdateProgressOfPausedRun() {
    var paused = RUN.toBuilder().status(BackfillStatus.PAUSED).build();

    var run = BackfillRuns.withProgress(paused, BackfillProgress.create(2, 0, 0, 2, 0), NOW);

    assertThat(run.status(), is(BackfillStatus.PAUSED));
    assertThat(run.progress().completed(), is(2));
    assertThat(run.finished(), is(Optional.empty()));
  }

  @Test
  public void shouldPreferSegmentsUpdatedInTheTransaction() throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      tx.store(RUN);
      tx.store(segment(0, SegmentStatus.SUCCESS));
      tx.store(segment(1, SegmentStatus.RUNNING));
      return null;
    });

    var refreshed = storage.runInTransactionWithRetries(tx ->
        BackfillRuns.refresh(tx, RUN, List.of(segment(1, SegmentStatus.SUCCESS)), NOW));

    assertThat(refreshed.status(), is(BackfillStatus.COMPLETED));
    assertThat(refreshed.progress(), is(BackfillProgress.create(2, 0, 0, 2, 0)));
    assertThat(storage.backfillRun(RUN.id()), is(Optional.of(refreshed)));
  }

  private static BackfillSegment segment(int sequence, SegmentStatus status) {
    return BackfillSegment.newBuilder()
        .id(RUN.id() + "-" + sequence)
        .runId(RUN.id())
        .sequence(sequence)
        .startDate(RUN.startDate().plusDays(7L * sequence))
        .endDate(RUN.startDate().plusDays(7L * sequence + 6))
        .status(status)
        .updated(NOW)
        .build();
  }
}
