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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * The query an execution runs: which gateway instance it targets, its SQL text and the
 * parameters it runs with unless overridden.
 */
@AutoValue
public abstract class QueryDefinition {

  @JsonProperty
  public abstract String queryId();

  @JsonProperty
  public abstract String instanceId();

  @JsonProperty
  public abstract String sql();

  @JsonProperty
  public abstract ImmutableMap<String, String> defaultParameters();

  /**
   * Number of days a scheduled run looks back from its end date.
   */
  @JsonProperty
  public abstract Optional<Integer> lookbackDays();

  public static Builder newBuilder() {
    return new AutoValue_QueryDefinition.Builder()
        .defaultParameters(ImmutableMap.of());
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static QueryDefinition create(
      @JsonProperty("query_id") String queryId,
      @JsonProperty("instance_id") String instanceId,
      @JsonProperty("sql") String sql,
      @JsonProperty("default_parameters") Map<String, String> defaultParameters,
      @JsonProperty("lookback_days") Optional<Integer> lookbackDays) {
    return newBuilder()
        .queryId(queryId)
        .instanceId(instanceId)
        .sql(sql)
        .defaultParameters(defaultParameters == null ? ImmutableMap.of() : defaultParameters)
        .lookbackDays(lookbackDays)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder queryId(String queryId);

    public abstract Builder instanceId(String instanceId);

    public abstract Builder sql(String sql);

    public abstract Builder defaultParameters(Map<String, String> defaultParameters);

    public abstract Builder lookbackDays(Integer lookbackDays);

    public abstract Builder lookbackDays(Optional<Integer> lookbackDays);

    public abstract QueryDefinition build();
  }
}
