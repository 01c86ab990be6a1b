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
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One run of a query on the query gateway. Status changes go through
 * {@link com.spotify.sluice.state.ExecutionTransitions} only.
 */
@AutoValue
public abstract class Execution {

  @JsonProperty
  public abstract String id();

  @JsonProperty
  public abstract ExecutionOrigin origin();

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract QueryDefinition query();

  /**
   * Parameters resolved at creation time, sent with the submission.
   */
  @JsonProperty
  public abstract ImmutableMap<String, String> parameters();

  @JsonProperty
  public abstract Optional<WarehouseSyncDirective> syncDirective();

  /**
   * Id assigned by the gateway at submission. Assigned at most once.
   */
  @JsonProperty
  public abstract Optional<String> externalId();

  @JsonProperty
  public abstract ExecutionStatus status();

  @JsonProperty
  public abstract boolean cancellationRequested();

  @JsonProperty
  public abstract Instant created();

  @JsonProperty
  public abstract Optional<Instant> submitted();

  @JsonProperty
  public abstract Optional<Instant> started();

  @JsonProperty
  public abstract Optional<Instant> completed();

  @JsonProperty
  public abstract Optional<ResultMetadata> resultMetadata();

  @JsonProperty
  public abstract Optional<String> error();

  @JsonProperty
  public abstract int retryCount();

  @JsonProperty
  public abstract Optional<Instant> lastPolled();

  @JsonIgnore
  public boolean syncEnabled() {
    return syncDirective().map(WarehouseSyncDirective::enabled).orElse(false);
  }

  public static Builder newBuilder() {
    return new AutoValue_Execution.Builder()
        .parameters(ImmutableMap.of())
        .status(ExecutionStatus.PENDING)
        .cancellationRequested(false)
        .retryCount(0);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static Execution create(
      @JsonProperty("id") String id,
      @JsonProperty("origin") ExecutionOrigin origin,
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("query") QueryDefinition query,
      @JsonProperty("parameters") Map<String, String> parameters,
      @JsonProperty("sync_directive") Optional<WarehouseSyncDirective> syncDirective,
      @JsonProperty("external_id") Optional<String> externalId,
      @JsonProperty("status") ExecutionStatus status,
      @JsonProperty("cancellation_requested") boolean cancellationRequested,
      @JsonProperty("created") Instant created,
      @JsonProperty("submitted") Optional<Instant> submitted,
      @JsonProperty("started") Optional<Instant> started,
      @JsonProperty("completed") Optional<Instant> completed,
      @JsonProperty("result_metadata") Optional<ResultMetadata> resultMetadata,
      @JsonProperty("error") Optional<String> error,
      @JsonProperty("retry_count") int retryCount,
      @JsonProperty("last_polled") Optional<Instant> lastPolled) {
    return newBuilder()
        .id(id)
        .origin(origin)
        .principalId(principalId)
        .query(query)
        .parameters(parameters == null ? ImmutableMap.of() : parameters)
        .syncDirective(syncDirective)
        .externalId(externalId)
        .status(status)
        .cancellationRequested(cancellationRequested)
        .created(created)
        .submitted(submitted)
        .started(started)
        .completed(completed)
        .resultMetadata(resultMetadata)
        .error(error)
        .retryCount(retryCount)
        .lastPolled(lastPolled)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder id(String id);

    public abstract Builder origin(ExecutionOrigin origin);

    public abstract Builder principalId(String principalId);

    public abstract Builder query(QueryDefinition query);

    public abstract Builder parameters(Map<String, String> parameters);

    public abstract Builder syncDirective(WarehouseSyncDirective syncDirective);

    public abstract Builder syncDirective(Optional<WarehouseSyncDirective> syncDirective);

    public abstract Builder externalId(String externalId);

    public abstract Builder externalId(Optional<String> externalId);

    public abstract Builder status(ExecutionStatus status);

    public abstract Builder cancellationRequested(boolean cancellationRequested);

    public abstract Builder created(Instant created);

    public abstract Builder submitted(Instant submitted);

    public abstract Builder submitted(Optional<Instant> submitted);

    public abstract Builder started(Instant started);

    public abstract Builder started(Optional<Instant> started);

    public abstract Builder completed(Instant completed);

    public abstract Builder completed(Optional<Instant> completed);

    public abstract Builder resultMetadata(ResultMetadata resultMetadata);

    public abstract Builder resultMetadata(Optional<ResultMetadata> resultMetadata);

    public abstract Builder error(String error);

    public abstract Builder error(Optional<String> error);

    public abstract Builder retryCount(int retryCount);

    public abstract Builder lastPolled(Instant lastPolled);

    public abstract Builder lastPolled(Optional<Instant> lastPolled);

    public abstract Execution build();
  }
}
