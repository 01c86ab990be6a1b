/*-
 * -\-\-
 * Spotify Sluice Gateway Client
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

package com.spotify.sluice.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

@AutoValue
abstract class SubmitExecutionRequest {

  @JsonProperty
  abstract String queryId();

  @JsonProperty
  abstract String sql();

  @JsonProperty
  abstract ImmutableMap<String, String> parameters();

  static SubmitExecutionRequest create(String queryId, String sql, Map<String, String> parameters) {
    return new AutoValue_SubmitExecutionRequest(queryId, sql, ImmutableMap.copyOf(parameters));
  }
}
