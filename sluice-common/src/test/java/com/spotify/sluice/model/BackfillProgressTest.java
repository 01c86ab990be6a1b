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

package com.spotify.sluice.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.Test;

public class BackfillProgressTest {

  @Test
  public void shouldCountSegmentsByStatus() {
    final BackfillProgress progress = BackfillProgress.of(ImmutableList.of(
        segment(0, SegmentStatus.SUCCESS),
        segment(1, SegmentStatus.SUCCESS),
        segment(2, SegmentStatus.FAILED),
        segment(3, SegmentStatus.RUNNING),
        segment(4, SegmentStatus.PENDING)));

    assertThat(progress, is(BackfillProgress.create(5, 1, 1, 2, 1)));
    assertThat(progress.percentComplete(), is(40));
  }

  @Test
  public void shouldHandleNoSegments() {
    assertThat(BackfillProgress.of(ImmutableList.of()).percentComplete(), is(0));
  }

  private static BackfillSegment segment(int sequence, SegmentStatus status) {
    final LocalDate start = LocalDate.of(2024, 1, 1).plusWeeks(sequence);
    return BackfillSegment.newBuilder()
        .id("run-1-" + sequence)
        .runId("run-1")
        .sequence(sequence)
        .startDate(start)
        .endDate(start.plusDays(6))
        .status(status)
        .updated(Instant.EPOCH)
        .build();
  }
}
