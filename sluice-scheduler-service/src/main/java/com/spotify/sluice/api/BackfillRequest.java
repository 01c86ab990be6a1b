/*-
 * -\-\-
 * Spotify Sluice Scheduler Service
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

package com.spotify.sluice.api;

import com.google.auto.value.AutoValue;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.WarehouseSyncDirective;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A request to run a query over a historical date range, one segment at a time.
 */
@AutoValue
public abstract class BackfillRequest {

  public abstract String principalId();

  public abstract QueryDefinition query();

  public abstract LocalDate startDate();

  /**
   * Inclusive.
   */
  public abstract LocalDate endDate();

  public abstract Optional<Integer> segmentDays();

  public abstract Optional<Integer> maxAttempts();

  public abstract Optional<WarehouseSyncDirective> syncDirective();

  public static Builder newBuilder() {
    return new AutoValue_BackfillRequest.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder principalId(String principalId);

    public abstract Builder query(QueryDefinition query);

    public abstract Builder startDate(LocalDate startDate);

    public abstract Builder endDate(LocalDate endDate);

    public abstract Builder segmentDays(Integer segmentDays);

    public abstract Builder maxAttempts(Integer maxAttempts);

    public abstract Builder syncDirective(WarehouseSyncDirective syncDirective);

    public abstract BackfillRequest build();
  }
}
