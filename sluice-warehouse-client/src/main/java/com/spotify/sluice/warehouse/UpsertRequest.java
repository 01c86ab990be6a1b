/*-
 * -\-\-
 * Spotify Sluice Warehouse Client
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

package com.spotify.sluice.warehouse;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.spotify.sluice.model.ResultTable;
import java.time.Instant;
import java.util.List;

/**
 * Rows of one execution to write to a warehouse table. An empty key means append mode: the
 * execution's previous rows are replaced.
 */
@AutoValue
public abstract class UpsertRequest {

  /** Sanitized target table name. */
  public abstract String table();

  public abstract ResultTable rows();

  /** Result column names identifying a row within the execution. */
  public abstract ImmutableList<String> keyColumns();

  public abstract String executionId();

  public abstract String principalId();

  public abstract Instant uploadedAt();

  public boolean appendOnly() {
    return keyColumns().isEmpty();
  }

  public static UpsertRequest create(String table, ResultTable rows, List<String> keyColumns,
                                     String executionId, String principalId, Instant uploadedAt) {
    return new AutoValue_UpsertRequest(table, rows, ImmutableList.copyOf(keyColumns), executionId,
        principalId, uploadedAt);
  }
}
