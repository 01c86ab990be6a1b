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
import com.spotify.sluice.model.BackfillSegment;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a backfill date range into consecutive segments.
 */
final class BackfillPlanner {

  static final int DEFAULT_MAX_SEGMENTS = 52;

  private BackfillPlanner() {
    throw new UnsupportedOperationException();
  }

  /**
   * Segments of {@code segmentDays} days covering {@code [start, end]} without gaps or overlap.
   * The last segment is cut short at {@code end}.
   *
   * @throws IllegalArgumentException if the range is empty, or needs more than
   *                                  {@code maxSegments} segments
   */
  static List<BackfillSegment> plan(String runId, LocalDate start, LocalDate end, int segmentDays,
                                    int maxSegments, Instant now) {
    Preconditions.checkArgument(!start.isAfter(end),
        "start date %s is after end date %s", start, end);
    Preconditions.checkArgument(segmentDays > 0, "segment days must be positive");

    final long days = ChronoUnit.DAYS.between(start, end) + 1;
    final long count = (days + segmentDays - 1) / segmentDays;
    Preconditions.checkArgument(count <= maxSegments,
        "%s to %s needs %s segments of %s days, at most %s are allowed",
        start, end, count, segmentDays, maxSegments);

    final List<BackfillSegment> segments = new ArrayList<>((int) count);
    LocalDate segmentStart = start;
    for (int sequence = 0; sequence < count; sequence++) {
      final LocalDate segmentEnd = segmentStart.plusDays(segmentDays - 1L);
      segments.add(BackfillSegment.newBuilder()
          .id(runId + "-" + sequence)
          .runId(runId)
          .sequence(sequence)
          .startDate(segmentStart)
          .endDate(segmentEnd.isAfter(end) ? end : segmentEnd)
          .updated(now)
          .build());
      segmentStart = segmentEnd.plusDays(1);
    }
    return segments;
  }
}
