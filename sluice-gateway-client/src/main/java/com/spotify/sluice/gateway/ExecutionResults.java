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

import com.google.auto.value.AutoValue;
import com.spotify.sluice.model.ResultTable;
import java.util.Optional;

/**
 * Downloaded results of a successful execution.
 */
@AutoValue
public abstract class ExecutionResults {

  public abstract ResultTable table();

  public abstract long byteSize();

  public abstract Optional<String> location();

  public static ExecutionResults create(ResultTable table, long byteSize,
      Optional<String> location) {
    return new AutoValue_ExecutionResults(table, byteSize, location);
  }

  public static ExecutionResults empty() {
    return create(ResultTable.empty(), 0, Optional.empty());
  }
}
