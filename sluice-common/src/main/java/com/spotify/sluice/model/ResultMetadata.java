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
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

@AutoValue
public abstract class ResultMetadata {

  @JsonProperty
  public abstract long rowCount();

  @JsonProperty
  public abstract long byteSize();

  @JsonProperty
  public abstract Optional<String> location();

  @JsonProperty
  public abstract ImmutableList<String> columns();

  @JsonCreator
  public static ResultMetadata create(
      @JsonProperty("row_count") long rowCount,
      @JsonProperty("byte_size") long byteSize,
      @JsonProperty("location") Optional<String> location,
      @JsonProperty("columns") List<String> columns) {
    return new AutoValue_ResultMetadata(rowCount, byteSize, location,
        columns == null ? ImmutableList.of() : ImmutableList.copyOf(columns));
  }
}
