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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Collection;

/**
 * Aggregate segment counters of a {@link BackfillRun}, always recomputed from the stored segments.
 */
@AutoValue
public abstract class BackfillProgress {

  @JsonProperty
  public abstract int total();

  @JsonProperty
  public abstract int pending();

  @JsonProperty
  public abstract int running();

  @JsonProperty
  public abstract int completed();

  @JsonProperty
  public abstract int failed();

  @JsonIgnore
  public int percentComplete() {
    return total() == 0 ? 0 : completed() * 100 / total();
  }

  @JsonCreator
  public static BackfillProgress create(
      @JsonProperty("total") int total,
      @JsonProperty("pending") int pending,
      @JsonProperty("running") int running,
      @JsonProperty("completed") int completed,
      @JsonProperty("failed") int failed) {
    return new AutoValue_BackfillProgress(total, pending, running, completed, failed);
  }

  public static BackfillProgress empty() {
    return create(0, 0, 0, 0, 0);
  }

  public static BackfillProgress of(Collection<BackfillSegment> segments) {
    int pending = 0;
    int running = 0;
    int completed = 0;
    int failed = 0;
    for (BackfillSegment segment : segments) {
      switch (segment.status()) {
        case PENDING:
          pending++;
          break;
        case RUNNING:
          running++;
          break;
        case SUCCESS:
          completed++;
          break;
        case FAILED:
          failed++;
          break;
        default:
          throw new AssertionError("Unknown segment status: " + segment.status());
      }
    }
    return create(segments.size(), pending, running, completed, failed);
  }
}
