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
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A historical date range run as a sequence of fixed-size {@link BackfillSegment}s.
 */
@AutoValue
public abstract class BackfillRun {

  @JsonProperty
  public abstract String id();

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract QueryDefinition query();

  @JsonProperty
  public abstract LocalDate startDate();

  @JsonProperty
  public abstract LocalDate endDate();

  @JsonProperty
  public abstract int segmentDays();

  @JsonProperty
  public abstract BackfillStatus status();

  @JsonProperty
  public abstract BackfillProgress progress();

  /**
   * Number of attempts a segment gets before it is marked failed.
   */
  @JsonProperty
  public abstract int maxAttempts();

  @JsonProperty
  public abstract Optional<WarehouseSyncDirective> syncDirective();

  @JsonProperty
  public abstract Instant created();

  @JsonProperty
  public abstract Optional<Instant> finished();

  public static Builder newBuilder() {
    return new AutoValue_BackfillRun.Builder()
        .status(BackfillStatus.ACTIVE)
        .progress(BackfillProgress.empty())
        .segmentDays(7)
        .maxAttempts(3);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static BackfillRun create(
      @JsonProperty("id") String id,
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("query") QueryDefinition query,
      @JsonProperty("start_date") LocalDate startDate,
      @JsonProperty("end_date") LocalDate endDate,
      @JsonProperty("segment_days") int segmentDays,
      @JsonProperty("status") BackfillStatus status,
      @JsonProperty("progress") BackfillProgress progress,
      @JsonProperty("max_attempts") int maxAttempts,
      @JsonProperty("sync_directive") Optional<WarehouseSyncDirective> syncDirective,
      @JsonProperty("created") Instant created,
      @JsonProperty("finished") Optional<Instant> finished) {
    return newBuilder()
        .id(id)
        .principalId(principalId)
        .query(query)
        .startDate(startDate)
        .endDate(endDate)
        .segmentDays(segmentDays)
        .status(status)
        .progress(progress == null ? BackfillProgress.empty() : progress)
        .maxAttempts(maxAttempts)
        .syncDirective(syncDirective)
        .created(created)
        .finished(finished)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder id(String id);

    public abstract Builder principalId(String principalId);

    public abstract Builder query(QueryDefinition query);

    public abstract Builder startDate(LocalDate startDate);

    public abstract Builder endDate(LocalDate endDate);

    public abstract Builder segmentDays(int segmentDays);

    public abstract Builder status(BackfillStatus status);

    public abstract Builder progress(BackfillProgress progress);

    public abstract Builder maxAttempts(int maxAttempts);

    public abstract Builder syncDirective(WarehouseSyncDirective syncDirective);

    public abstract Builder syncDirective(Optional<WarehouseSyncDirective> syncDirective);

    public abstract Builder created(Instant created);

    public abstract Builder finished(Instant finished);

    public abstract Builder finished(Optional<Instant> finished);

    public abstract BackfillRun build();
  }
}
