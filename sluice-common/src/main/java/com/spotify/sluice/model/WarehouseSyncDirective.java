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
import java.util.Optional;

/**
 * Per-job configuration of warehouse replication, attached to scheduled jobs, backfill runs and
 * ad-hoc executions.
 */
@AutoValue
public abstract class WarehouseSyncDirective {

  @JsonProperty
  public abstract boolean enabled();

  /**
   * Destination table. Derived from the query id when absent.
   */
  @JsonProperty
  public abstract Optional<String> targetTable();

  @JsonProperty
  public abstract UpsertKeyPolicy upsertKeyPolicy();

  @JsonCreator
  public static WarehouseSyncDirective create(
      @JsonProperty("enabled") boolean enabled,
      @JsonProperty("target_table") Optional<String> targetTable,
      @JsonProperty("upsert_key_policy") UpsertKeyPolicy upsertKeyPolicy) {
    return new AutoValue_WarehouseSyncDirective(enabled, targetTable,
        upsertKeyPolicy == null ? UpsertKeyPolicy.AUTO : upsertKeyPolicy);
  }

  public static WarehouseSyncDirective enabledFor(String targetTable) {
    return create(true, Optional.of(targetTable), UpsertKeyPolicy.AUTO);
  }

  public static WarehouseSyncDirective disabled() {
    return create(false, Optional.empty(), UpsertKeyPolicy.AUTO);
  }
}
