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

import com.spotify.sluice.model.BackfillProgress;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.storage.StorageTransaction;
import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the progress and status of a backfill run in line with its segments.
 */
public final class BackfillRuns {

  private BackfillRuns() {
    throw new UnsupportedOperationException();
  }

  /**
   * Recompute the progress of a run and complete it if it is done, storing the result in the
   * transaction.
   *
   * <p>Segments written earlier in the same transaction are not guaranteed to be visible to
   * reads, so they are passed in as {@code updated} and take precedence over the stored ones.
   */
  public static BackfillRun refresh(StorageTransaction tx, BackfillRun run,
                                    Collection<BackfillSegment> updated, Instant now)
      throws IOException {
    final Map<String, BackfillSegment> segments = new LinkedHashMap<>();
    for (BackfillSegment segment : tx.segments(run.id())) {
      segments.put(segment.id(), segment);
    }
    for (BackfillSegment segment : updated) {
      segments.put(segment.id(), segment);
    }

    final BackfillRun refreshed = withProgress(run, BackfillProgress.of(segments.values()), now);
    if (!refreshed.equals(run)) {
      tx.store(refreshed);
    }
    return refreshed;
  }

  /**
   * Only active runs complete: a paused run keeps its status until resumed.
   */
  static BackfillRun withProgress(BackfillRun run, BackfillProgress progress, Instant now) {
    final BackfillRun.Builder builder = run.toBuilder().progress(progress);
    if (run.status() != BackfillStatus.ACTIVE || progress.pending() > 0 || progress.total() == 0) {
      return builder.build();
    }
    if (progress.completed() == progress.total()) {
      return builder.status(BackfillStatus.COMPLETED).finished(now).build();
    }
    if (progress.failed() > 0 && progress.running() == 0) {
      return builder.status(BackfillStatus.FAILED).finished(now).build();
    }
    return builder.build();
  }
}
