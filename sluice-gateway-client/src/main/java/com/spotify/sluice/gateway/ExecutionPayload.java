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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * Gateway representation of an execution, returned by submit and status calls.
 */
@AutoValue
abstract class ExecutionPayload {

  @JsonProperty
  abstract String executionId();

  @JsonProperty
  abstract Optional<String> status();

  @JsonProperty
  abstract Optional<String> error();

  @JsonProperty
  abstract Optional<String> resultLocation();

  @JsonCreator
  static ExecutionPayload create(
      @JsonProperty("execution_id") String executionId,
      @JsonProperty("status") Optional<String> status,
      @JsonProperty("error") Optional<String> error,
      @JsonProperty("result_location") Optional<String> resultLocation) {
    return new AutoValue_ExecutionPayload(executionId, status, error, resultLocation);
  }
}
