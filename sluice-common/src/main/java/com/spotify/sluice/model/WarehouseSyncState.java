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
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Replication state of one successful {@link Execution} into the warehouse.
 */
@AutoValue
public abstract class WarehouseSyncState {

  @JsonProperty
  public abstract String executionId();

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract String targetTable();

  @JsonProperty
  public abstract UpsertKeyPolicy upsertKeyPolicy();

  @JsonProperty
  public abstract SyncStatus status();

  @JsonProperty
  public abstract int attempts();

  @JsonProperty
  public abstract Optional<String> lastError();

  @JsonProperty
  public abstract Optional<Instant> uploadedAt();

  @JsonProperty
  public abstract Optional<Instant> nextAttemptAt();

  /**
   * Columns of the composite idempotency key used for the last upload.
   */
  @JsonProperty
  public abstract ImmutableList<String> keyColumns();

  @JsonProperty
  public abstract long rowsUploaded();

  @JsonProperty
  public abstract Instant created();

  @JsonProperty
  public abstract Instant updated();

  public static Builder newBuilder() {
    return new AutoValue_WarehouseSyncState.Builder()
        .upsertKeyPolicy(UpsertKeyPolicy.AUTO)
        .status(SyncStatus.PENDING)
        .attempts(0)
        .keyColumns(ImmutableList.of())
        .rowsUploaded(0);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static WarehouseSyncState create(
      @JsonProperty("execution_id") String executionId,
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("target_table") String targetTable,
      @JsonProperty("upsert_key_policy") UpsertKeyPolicy upsertKeyPolicy,
      @JsonProperty("status") SyncStatus status,
      @JsonProperty("attempts") int attempts,
      @JsonProperty("last_error") Optional<String> lastError,
      @JsonProperty("uploaded_at") Optional<Instant> uploadedAt,
      @JsonProperty("next_attempt_at") Optional<Instant> nextAttemptAt,
      @JsonProperty("key_columns") List<String> keyColumns,
      @JsonProperty("rows_uploaded") long rowsUploaded,
      @JsonProperty("created") Instant created,
      @JsonProperty("updated") Instant updated) {
    return newBuilder()
        .executionId(executionId)
        .principalId(principalId)
        .targetTable(targetTable)
        .upsertKeyPolicy(upsertKeyPolicy == null ? UpsertKeyPolicy.AUTO : upsertKeyPolicy)
        .status(status)
        .attempts(attempts)
        .lastError(lastError)
        .uploadedAt(uploadedAt)
        .nextAttemptAt(nextAttemptAt)
        .keyColumns(keyColumns == null ? ImmutableList.of() : keyColumns)
        .rowsUploaded(rowsUploaded)
        .created(created)
        .updated(updated)
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder executionId(String executionId);

    public abstract Builder principalId(String principalId);

    public abstract Builder targetTable(String targetTable);

    public abstract Builder upsertKeyPolicy(UpsertKeyPolicy upsertKeyPolicy);

    public abstract Builder status(SyncStatus status);

    public abstract Builder attempts(int attempts);

    public abstract Builder lastError(String lastError);

    public abstract Builder lastError(Optional<String> lastError);

    public abstract Builder uploadedAt(Instant uploadedAt);

    public abstract Builder uploadedAt(Optional<Instant> uploadedAt);

    public abstract Builder nextAttemptAt(Instant nextAttemptAt);

    public abstract Builder nextAttemptAt(Optional<Instant> nextAttemptAt);

    public abstract Builder keyColumns(List<String> keyColumns);

    public abstract Builder rowsUploaded(long rowsUploaded);

    public abstract Builder created(Instant created);

    public abstract Builder updated(Instant updated);

    public abstract WarehouseSyncState build();
  }
}
