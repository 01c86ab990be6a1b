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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Objects;
import java.util.Optional;

/**
 * What created an {@link Execution}: a scheduled job, a backfill segment or an ad-hoc request.
 */
@AutoValue
public abstract class ExecutionOrigin {

  public enum Kind {
    SCHEDULED,
    BACKFILL,
    AD_HOC
  }

  @JsonProperty
  public abstract Kind kind();

  /**
   * The scheduled job id or the backfill segment id.
   */
  @JsonProperty
  public abstract Optional<String> referenceId();

  /**
   * The backfill run id of a backfill segment.
   */
  @JsonProperty
  public abstract Optional<String> parentId();

  @JsonCreator
  public static ExecutionOrigin create(
      @JsonProperty("kind") Kind kind,
      @JsonProperty("reference_id") Optional<String> referenceId,
      @JsonProperty("parent_id") Optional<String> parentId) {
    return new AutoValue_ExecutionOrigin(kind, referenceId, parentId);
  }

  public static ExecutionOrigin scheduled(String scheduledJobId) {
    return create(Kind.SCHEDULED, Optional.of(Objects.requireNonNull(scheduledJobId)),
        Optional.empty());
  }

  public static ExecutionOrigin backfill(String runId, String segmentId) {
    return create(Kind.BACKFILL, Optional.of(Objects.requireNonNull(segmentId)),
        Optional.of(Objects.requireNonNull(runId)));
  }

  public static ExecutionOrigin adHoc() {
    return create(Kind.AD_HOC, Optional.empty(), Optional.empty());
  }

  public boolean isScheduled(String scheduledJobId) {
    return kind() == Kind.SCHEDULED && referenceId().equals(Optional.of(scheduledJobId));
  }
}
