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
import java.util.Comparator;
import java.util.Optional;

@AutoValue
public abstract class BackfillSegment {

  public static final Comparator<BackfillSegment> SEQUENCE_ORDER =
      Comparator.comparingInt(BackfillSegment::sequence);

  @JsonProperty
  public abstract String id();

  @JsonProperty
  public abstract String runId();

  @JsonProperty
  public abstract int sequence();

  @JsonProperty
  public abstract LocalDate startDate();

  /**
   * Inclusive.
   */
  @JsonProperty
  public abstract LocalDate endDate();

  @JsonProperty
  public abstract SegmentStatus status();

  @JsonProperty
  public abstract Optional<String> executionId();

  @JsonProperty
  public abstract int attempts();

  @JsonProperty
  public abstract Optional<String> lastError();

  @JsonProperty
  public abstract Instant updated();

  public static Builder newBuilder() {
    return new AutoValue_BackfillSegment.Builder()
        .status(SegmentStatus.PENDING)
        .attempts(0);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static BackfillSegment create(
      @JsonProperty("id") String id,
      @JsonProperty("run_id") String runId,
      @JsonProperty("sequence") int sequence,
      @JsonProperty("start_date") LocalDate startDate,
      @JsonProperty("end_date") LocalDate endDate,
      @JsonProperty("status") SegmentStatus status,
      @JsonProperty("execution_id") Optional<String> executionId,
      @JsonProperty("attempts") int attempts,
      @JsonProperty("last_error") Optional<String> lastError,
      @JsonProperty("updated") Instant updated) {
    return newBuilder()
        .id(id)
        .runId(runId)
        .sequence(sequence)
        .startDate(startDate)
        .endDate(endDate)
        .status(status)
        .executionId(executionId)
        .attempts(attempts)
        .lastError(lastError)
        .updated(updated)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder id(String id);

    public abstract Builder runId(String runId);

    public abstract Builder sequence(int sequence);

    public abstract Builder startDate(LocalDate startDate);

    public abstract Builder endDate(LocalDate endDate);

    public abstract Builder status(SegmentStatus status);

    public abstract Builder executionId(String executionId);

    public abstract Builder executionId(Optional<String> executionId);

    public abstract Builder attempts(int attempts);

    public abstract Builder lastError(String lastError);

    public abstract Builder lastError(Optional<String> lastError);

    public abstract Builder updated(Instant updated);

    public abstract BackfillSegment build();
  }
}
