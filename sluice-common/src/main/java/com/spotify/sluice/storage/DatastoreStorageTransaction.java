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

package com.spotify.sluice.storage;

import static com.spotify.sluice.storage.DatastoreStorage.backfillRunKey;
import static com.spotify.sluice.storage.DatastoreStorage.backfillRunToEntity;
import static com.spotify.sluice.storage.DatastoreStorage.credentialKey;
import static com.spotify.sluice.storage.DatastoreStorage.credentialToEntity;
import static com.spotify.sluice.storage.DatastoreStorage.executionKey;
import static com.spotify.sluice.storage.DatastoreStorage.executionToEntity;
import static com.spotify.sluice.storage.DatastoreStorage.parseJson;
import static com.spotify.sluice.storage.DatastoreStorage.querySegments;
import static com.spotify.sluice.storage.DatastoreStorage.scheduledJobKey;
import static com.spotify.sluice.storage.DatastoreStorage.scheduledJobToEntity;
import static com.spotify.sluice.storage.DatastoreStorage.segmentKey;
import static com.spotify.sluice.storage.DatastoreStorage.segmentToEntity;
import static com.spotify.sluice.storage.DatastoreStorage.syncStateKey;
import static com.spotify.sluice.storage.DatastoreStorage.syncStateToEntity;

import com.google.cloud.datastore.Entity;
import com.google.cloud.datastore.Key;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.WarehouseSyncState;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class DatastoreStorageTransaction implements StorageTransaction {

  private final CheckedDatastore.CheckedTransaction tx;

  public DatastoreStorageTransaction(CheckedDatastore.CheckedTransaction transaction) {
    this.tx = Objects.requireNonNull(transaction);
  }

  @Override
  public Optional<Credential> credential(String principalId) throws IOException {
    return read(credentialKey(tx::newKeyFactory, principalId), Credential.class);
  }

  @Override
  public void store(Credential credential) throws IOException {
    tx.put(credentialToEntity(tx::newKeyFactory, credential));
  }

  @Override
  public Optional<ScheduledJob> scheduledJob(String id) throws IOException {
    return read(scheduledJobKey(tx::newKeyFactory, id), ScheduledJob.class);
  }

  @Override
  public void store(ScheduledJob scheduledJob) throws IOException {
    tx.put(scheduledJobToEntity(tx::newKeyFactory, scheduledJob));
  }

  @Override
  public Optional<Execution> execution(String id) throws IOException {
    return read(executionKey(tx::newKeyFactory, id), Execution.class);
  }

  @Override
  public void store(Execution execution) throws IOException {
    tx.put(executionToEntity(tx::newKeyFactory, execution));
  }

  @Override
  public Optional<BackfillRun> backfillRun(String id) throws IOException {
    return read(backfillRunKey(tx::newKeyFactory, id), BackfillRun.class);
  }

  @Override
  public void store(BackfillRun backfillRun) throws IOException {
    tx.put(backfillRunToEntity(tx::newKeyFactory, backfillRun));
  }

  @Override
  public Optional<BackfillSegment> segment(String runId, String segmentId) throws IOException {
    return read(segmentKey(tx::newKeyFactory, runId, segmentId), BackfillSegment.class);
  }

  @Override
  public List<BackfillSegment> segments(String runId) throws IOException {
    // ancestor query, allowed inside a transaction
    return querySegments(tx::query, tx::newKeyFactory, runId);
  }

  @Override
  public void store(BackfillSegment segment) throws IOException {
    tx.put(segmentToEntity(tx::newKeyFactory, segment));
  }

  @Override
  public Optional<WarehouseSyncState> syncState(String executionId) throws IOException {
    return read(syncStateKey(tx::newKeyFactory, executionId), WarehouseSyncState.class);
  }

  @Override
  public void store(WarehouseSyncState syncState) throws IOException {
    tx.put(syncStateToEntity(tx::newKeyFactory, syncState));
  }

  @Override
  public void commit() throws TransactionException {
    try {
      tx.commit();
    } catch (DatastoreIOException e) {
      throw new TransactionException(e.getCause());
    }
  }

  @Override
  public void rollback() throws TransactionException {
    try {
      tx.rollback();
    } catch (DatastoreIOException e) {
      throw new TransactionException(e.getCause());
    }
  }

  @Override
  public boolean isActive() {
    return tx.isActive();
  }

  private <T> Optional<T> read(Key key, Class<T> cls) throws IOException {
    final Optional<Entity> entity = tx.get(key);
    if (entity.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(parseJson(entity.get(), cls));
  }
}
