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
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * A recurring job definition driven by a cron expression evaluated in the job's own time zone.
 */
@AutoValue
public abstract class ScheduledJob {

  @JsonProperty
  public abstract String id();

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract QueryDefinition query();

  @JsonProperty
  public abstract String cronExpression();

  /**
   * IANA time zone id, e.g. {@code America/New_York}.
   */
  @JsonProperty
  public abstract String timezone();

  @JsonProperty
  public abstract boolean active();

  @JsonProperty
  public abstract Instant nextFire();

  @JsonProperty
  public abstract Optional<Instant> lastRun();

  @JsonProperty
  public abstract long totalRuns();

  @JsonProperty
  public abstract long successfulRuns();

  @JsonProperty
  public abstract long failedRuns();

  @JsonProperty
  public abstract Optional<WarehouseSyncDirective> syncDirective();

  @JsonProperty
  public abstract Instant created();

  @JsonIgnore
  public ZoneId zone() {
    return ZoneId.of(timezone());
  }

  public static Builder newBuilder() {
    return new AutoValue_ScheduledJob.Builder()
        .active(true)
        .totalRuns(0)
        .successfulRuns(0)
        .failedRuns(0);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static ScheduledJob create(
      @JsonProperty("id") String id,
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("query") QueryDefinition query,
      @JsonProperty("cron_expression") String cronExpression,
      @JsonProperty("timezone") String timezone,
      @JsonProperty("active") boolean active,
      @JsonProperty("next_fire") Instant nextFire,
      @JsonProperty("last_run") Optional<Instant> lastRun,
      @JsonProperty("total_runs") long totalRuns,
      @JsonProperty("successful_runs") long successfulRuns,
      @JsonProperty("failed_runs") long failedRuns,
      @JsonProperty("sync_directive") Optional<WarehouseSyncDirective> syncDirective,
      @JsonProperty("created") Instant created) {
    return newBuilder()
        .id(id)
        .principalId(principalId)
        .query(query)
        .cronExpression(cronExpression)
        .timezone(timezone)
        .active(active)
        .nextFire(nextFire)
        .lastRun(lastRun)
        .totalRuns(totalRuns)
        .successfulRuns(successfulRuns)
        .failedRuns(failedRuns)
        .syncDirective(syncDirective)
        .created(created)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder id(String id);

    public abstract Builder principalId(String principalId);

    public abstract Builder query(QueryDefinition query);

    public abstract Builder cronExpression(String cronExpression);

    public abstract Builder timezone(String timezone);

    public abstract Builder active(boolean active);

    public abstract Builder nextFire(Instant nextFire);

    public abstract Builder lastRun(Instant lastRun);

    public abstract Builder lastRun(Optional<Instant> lastRun);

    public abstract Builder totalRuns(long totalRuns);

    public abstract Builder successfulRuns(long successfulRuns);

    public abstract Builder failedRuns(long failedRuns);

    public abstract Builder syncDirective(WarehouseSyncDirective syncDirective);

    public abstract Builder syncDirective(Optional<WarehouseSyncDirective> syncDirective);

    public abstract Builder created(Instant created);

    public abstract ScheduledJob build();
  }
}
