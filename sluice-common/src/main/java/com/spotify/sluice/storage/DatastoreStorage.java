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

import static com.spotify.sluice.serialization.Json.OBJECT_MAPPER;
import static java.util.stream.Collectors.toList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.cloud.Timestamp;
import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreException;
import com.google.cloud.datastore.Entity;
import com.google.cloud.datastore.EntityQuery;
import com.google.cloud.datastore.Key;
import com.google.cloud.datastore.KeyFactory;
import com.google.cloud.datastore.PathElement;
import com.google.cloud.datastore.Query;
import com.google.cloud.datastore.StringValue;
import com.google.cloud.datastore.StructuredQuery.PropertyFilter;
import com.google.common.annotations.VisibleForTesting;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.WarehouseConfig;
import com.spotify.sluice.model.WarehouseSyncState;
import com.spotify.sluice.util.FnWithException;
import com.spotify.sluice.util.RetryUtil;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Storage} backed by Google Cloud Datastore.
 *
 * <p>Every entity carries its full JSON representation in an unindexed {@code json} property,
 * plus the indexed properties the periodic components query on. Backfill segments are stored as
 * children of their run so that a run and its segments can be read and written in one
 * transaction.
 */
public class DatastoreStorage implements Storage {

  private static final Logger LOG = LoggerFactory.getLogger(DatastoreStorage.class);

  public static final String KIND_CREDENTIAL = "Credential";
  public static final String KIND_WAREHOUSE_CONFIG = "WarehouseConfig";
  public static final String KIND_SCHEDULED_JOB = "ScheduledJob";
  public static final String KIND_EXECUTION = "Execution";
  public static final String KIND_BACKFILL_RUN = "BackfillRun";
  public static final String KIND_BACKFILL_SEGMENT = "BackfillSegment";
  public static final String KIND_WAREHOUSE_SYNC_STATE = "WarehouseSyncState";

  public static final String PROPERTY_JSON = "json";
  public static final String PROPERTY_EXPIRES_AT = "expiresAt";
  public static final String PROPERTY_ACTIVE = "active";
  public static final String PROPERTY_NEXT_FIRE = "nextFire";
  public static final String PROPERTY_STATUS = "status";
  public static final String PROPERTY_SCHEDULED_JOB_ID = "scheduledJobId";
  public static final String PROPERTY_CREATED = "created";
  public static final String PROPERTY_SEQUENCE = "sequence";

  public static final int MAX_RETRIES = 10;
  public static final int MAX_TRANSACTION_RETRIES = 5;

  private static final RetryUtil TRANSACTION_RETRY = new RetryUtil(Duration.ofMillis(100), 4);

  private final CheckedDatastore datastore;
  private final Duration retryBaseDelay;
  private final Function<CheckedDatastore.CheckedTransaction, StorageTransaction> storageTransactionFactory;

  public DatastoreStorage(Datastore datastore, Duration retryBaseDelay) {
    this(new CheckedDatastore(datastore), retryBaseDelay, DatastoreStorageTransaction::new);
  }

  @VisibleForTesting
  DatastoreStorage(CheckedDatastore datastore, Duration retryBaseDelay,
                   Function<CheckedDatastore.CheckedTransaction, StorageTransaction> storageTransactionFactory) {
    this.datastore = Objects.requireNonNull(datastore);
    this.retryBaseDelay = Objects.requireNonNull(retryBaseDelay);
    this.storageTransactionFactory = Objects.requireNonNull(storageTransactionFactory);
  }

  @Override
  public void close() {
  }

  @Override
  public Optional<Credential> credential(String principalId) throws IOException {
    return readOpt(credentialKey(datastore::newKeyFactory, principalId), Credential.class);
  }

  @Override
  public List<Credential> credentialsExpiringBefore(Instant instant) throws IOException {
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_CREDENTIAL)
        .setFilter(PropertyFilter.lt(PROPERTY_EXPIRES_AT, instantToTimestamp(instant)))
        .build();
    return queryJson(query, Credential.class);
  }

  @Override
  public void store(Credential credential) throws IOException {
    storeWithRetries(() -> datastore.put(credentialToEntity(datastore::newKeyFactory, credential)));
  }

  @Override
  public Optional<WarehouseConfig> warehouseConfig(String principalId) throws IOException {
    final Key key = datastore.newKeyFactory().setKind(KIND_WAREHOUSE_CONFIG).newKey(principalId);
    return readOpt(key, WarehouseConfig.class);
  }

  @Override
  public void store(WarehouseConfig warehouseConfig) throws IOException {
    final Key key = datastore.newKeyFactory().setKind(KIND_WAREHOUSE_CONFIG)
        .newKey(warehouseConfig.principalId());
    final Entity entity = Entity.newBuilder(key)
        .set(PROPERTY_JSON, jsonValue(warehouseConfig))
        .set(PROPERTY_ACTIVE, warehouseConfig.active())
        .build();
    storeWithRetries(() -> datastore.put(entity));
  }

  @Override
  public Optional<ScheduledJob> scheduledJob(String id) throws IOException {
    return readOpt(scheduledJobKey(datastore::newKeyFactory, id), ScheduledJob.class);
  }

  @Override
  public List<ScheduledJob> scheduledJobs() throws IOException {
    return queryJson(Query.newEntityQueryBuilder().setKind(KIND_SCHEDULED_JOB).build(),
        ScheduledJob.class);
  }

  @Override
  public List<ScheduledJob> dueScheduledJobs(Instant now) throws IOException {
    // single inequality filter; the active flag is checked in memory to avoid a composite index
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_SCHEDULED_JOB)
        .setFilter(PropertyFilter.le(PROPERTY_NEXT_FIRE, instantToTimestamp(now)))
        .build();
    return queryJson(query, ScheduledJob.class).stream()
        .filter(ScheduledJob::active)
        .collect(toList());
  }

  @Override
  public void store(ScheduledJob scheduledJob) throws IOException {
    storeWithRetries(() -> datastore.put(scheduledJobToEntity(datastore::newKeyFactory, scheduledJob)));
  }

  @Override
  public Optional<Execution> execution(String id) throws IOException {
    return readOpt(executionKey(datastore::newKeyFactory, id), Execution.class);
  }

  @Override
  public List<Execution> activeExecutions() throws IOException {
    final List<Execution> executions = new ArrayList<>();
    for (ExecutionStatus status : ExecutionStatus.values()) {
      if (status.isTerminal()) {
        continue;
      }
      final EntityQuery query = Query.newEntityQueryBuilder()
          .setKind(KIND_EXECUTION)
          .setFilter(PropertyFilter.eq(PROPERTY_STATUS, status.name()))
          .build();
      executions.addAll(queryJson(query, Execution.class));
    }
    return executions;
  }

  @Override
  public List<Execution> executionsForScheduledJob(String scheduledJobId, Instant createdSince)
      throws IOException {
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_EXECUTION)
        .setFilter(PropertyFilter.eq(PROPERTY_SCHEDULED_JOB_ID, scheduledJobId))
        .build();
    return queryJson(query, Execution.class).stream()
        .filter(execution -> !execution.created().isBefore(createdSince))
        .collect(toList());
  }

  @Override
  public void store(Execution execution) throws IOException {
    storeWithRetries(() -> datastore.put(executionToEntity(datastore::newKeyFactory, execution)));
  }

  @Override
  public Optional<BackfillRun> backfillRun(String id) throws IOException {
    return readOpt(backfillRunKey(datastore::newKeyFactory, id), BackfillRun.class);
  }

  @Override
  public List<BackfillRun> backfillRuns(BackfillStatus status) throws IOException {
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_BACKFILL_RUN)
        .setFilter(PropertyFilter.eq(PROPERTY_STATUS, status.name()))
        .build();
    return queryJson(query, BackfillRun.class);
  }

  @Override
  public List<BackfillSegment> segments(String runId) throws IOException {
    return querySegments(datastore::query, datastore::newKeyFactory, runId);
  }

  @Override
  public Optional<WarehouseSyncState> syncState(String executionId) throws IOException {
    return readOpt(syncStateKey(datastore::newKeyFactory, executionId), WarehouseSyncState.class);
  }

  @Override
  public List<WarehouseSyncState> syncStates(SyncStatus status) throws IOException {
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_WAREHOUSE_SYNC_STATE)
        .setFilter(PropertyFilter.eq(PROPERTY_STATUS, status.name()))
        .build();
    return queryJson(query, WarehouseSyncState.class);
  }

  @Override
  public <T, E extends Exception> T runInTransactionWithRetries(TransactionFunction<T, E> f)
      throws IOException, E {
    int tries = 0;
    while (true) {
      try {
        return runInTransaction(f);
      } catch (TransactionException e) {
        tries++;
        if (!e.isConflict() || tries >= MAX_TRANSACTION_RETRIES) {
          throw e;
        }
        LOG.debug("Transaction conflict (attempt #{}), retrying", tries);
        sleep(TRANSACTION_RETRY.calculateDelay(tries));
      }
    }
  }

  <T, E extends Exception> T runInTransaction(TransactionFunction<T, E> f) throws IOException, E {
    final StorageTransaction tx = newTransaction();
    try {
      final T value = f.apply(tx);
      tx.commit();
      return value;
    } catch (DatastoreIOException e) {
      throw new TransactionException(e.getCause());
    } catch (DatastoreException e) {
      throw new TransactionException(e);
    } finally {
      if (tx.isActive()) {
        tx.rollback();
      }
    }
  }

  private StorageTransaction newTransaction() throws TransactionException {
    final CheckedDatastore.CheckedTransaction transaction;
    try {
      transaction = datastore.newTransaction();
    } catch (DatastoreIOException e) {
      throw new TransactionException(e.getCause());
    }
    return storageTransactionFactory.apply(transaction);
  }

  private <T> T storeWithRetries(FnWithException<T, IOException> storingOperation) throws IOException {
    int storeRetries = 0;

    while (true) {
      try {
        return storingOperation.apply();
      } catch (DatastoreException | IOException e) {
        storeRetries++;
        if (storeRetries == MAX_RETRIES) {
          throw e;
        }
        LOG.warn(String.format("Failed to write to Datastore (attempt #%d)", storeRetries), e);
        sleep(retryBaseDelay);
      }
    }
  }

  private static void sleep(Duration duration) throws IOException {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting to retry", e);
    }
  }

  private <T> Optional<T> readOpt(Key key, Class<T> cls) throws IOException {
    final Optional<Entity> entity = datastore.get(key);
    if (entity.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(parseJson(entity.get(), cls));
  }

  private <T> List<T> queryJson(EntityQuery query, Class<T> cls) throws IOException {
    final List<T> values = new ArrayList<>();
    for (Entity entity : datastore.query(query)) {
      values.add(parseJson(entity, cls));
    }
    return values;
  }

  interface EntityQueryRunner {

    List<Entity> query(EntityQuery query) throws IOException;
  }

  static List<BackfillSegment> querySegments(EntityQueryRunner runner,
                                             Supplier<KeyFactory> keyFactory,
                                             String runId) throws IOException {
    final EntityQuery query = Query.newEntityQueryBuilder()
        .setKind(KIND_BACKFILL_SEGMENT)
        .setFilter(PropertyFilter.hasAncestor(backfillRunKey(keyFactory, runId)))
        .build();
    final List<BackfillSegment> segments = new ArrayList<>();
    for (Entity entity : runner.query(query)) {
      segments.add(parseJson(entity, BackfillSegment.class));
    }
    segments.sort(BackfillSegment.SEQUENCE_ORDER);
    return segments;
  }

  static <T> T parseJson(Entity entity, Class<T> cls) throws IOException {
    return OBJECT_MAPPER.readValue(entity.getString(PROPERTY_JSON), cls);
  }

  static StringValue jsonValue(Object o) throws JsonProcessingException {
    return StringValue
        .newBuilder(OBJECT_MAPPER.writeValueAsString(o))
        .setExcludeFromIndexes(true)
        .build();
  }

  static Timestamp instantToTimestamp(Instant instant) {
    return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
  }

  static Key credentialKey(Supplier<KeyFactory> keyFactory, String principalId) {
    return keyFactory.get().setKind(KIND_CREDENTIAL).newKey(principalId);
  }

  static Key scheduledJobKey(Supplier<KeyFactory> keyFactory, String id) {
    return keyFactory.get().setKind(KIND_SCHEDULED_JOB).newKey(id);
  }

  static Key executionKey(Supplier<KeyFactory> keyFactory, String id) {
    return keyFactory.get().setKind(KIND_EXECUTION).newKey(id);
  }

  static Key backfillRunKey(Supplier<KeyFactory> keyFactory, String id) {
    return keyFactory.get().setKind(KIND_BACKFILL_RUN).newKey(id);
  }

  static Key segmentKey(Supplier<KeyFactory> keyFactory, String runId, String segmentId) {
    return keyFactory.get()
        .addAncestor(PathElement.of(KIND_BACKFILL_RUN, runId))
        .setKind(KIND_BACKFILL_SEGMENT)
        .newKey(segmentId);
  }

  static Key syncStateKey(Supplier<KeyFactory> keyFactory, String executionId) {
    return keyFactory.get().setKind(KIND_WAREHOUSE_SYNC_STATE).newKey(executionId);
  }

  static Entity credentialToEntity(Supplier<KeyFactory> keyFactory, Credential credential)
      throws JsonProcessingException {
    return Entity.newBuilder(credentialKey(keyFactory, credential.principalId()))
        .set(PROPERTY_JSON, jsonValue(credential))
        .set(PROPERTY_EXPIRES_AT, instantToTimestamp(credential.expiresAt()))
        .build();
  }

  static Entity scheduledJobToEntity(Supplier<KeyFactory> keyFactory, ScheduledJob job)
      throws JsonProcessingException {
    return Entity.newBuilder(scheduledJobKey(keyFactory, job.id()))
        .set(PROPERTY_JSON, jsonValue(job))
        .set(PROPERTY_ACTIVE, job.active())
        .set(PROPERTY_NEXT_FIRE, instantToTimestamp(job.nextFire()))
        .build();
  }

  static Entity executionToEntity(Supplier<KeyFactory> keyFactory, Execution execution)
      throws JsonProcessingException {
    final Entity.Builder builder = Entity.newBuilder(executionKey(keyFactory, execution.id()))
        .set(PROPERTY_JSON, jsonValue(execution))
        .set(PROPERTY_STATUS, execution.status().name())
        .set(PROPERTY_CREATED, instantToTimestamp(execution.created()));
    if (execution.origin().kind() == ExecutionOrigin.Kind.SCHEDULED) {
      execution.origin().referenceId()
          .ifPresent(jobId -> builder.set(PROPERTY_SCHEDULED_JOB_ID, jobId));
    }
    return builder.build();
  }

  static Entity backfillRunToEntity(Supplier<KeyFactory> keyFactory, BackfillRun run)
      throws JsonProcessingException {
    return Entity.newBuilder(backfillRunKey(keyFactory, run.id()))
        .set(PROPERTY_JSON, jsonValue(run))
        .set(PROPERTY_STATUS, run.status().name())
        .set(PROPERTY_CREATED, instantToTimestamp(run.created()))
        .build();
  }

  static Entity segmentToEntity(Supplier<KeyFactory> keyFactory, BackfillSegment segment)
      throws JsonProcessingException {
    return Entity.newBuilder(segmentKey(keyFactory, segment.runId(), segment.id()))
        .set(PROPERTY_JSON, jsonValue(segment))
        .set(PROPERTY_STATUS, segment.status().name())
        .set(PROPERTY_SEQUENCE, segment.sequence())
        .build();
  }

  static Entity syncStateToEntity(Supplier<KeyFactory> keyFactory, WarehouseSyncState state)
      throws JsonProcessingException {
    return Entity.newBuilder(syncStateKey(keyFactory, state.executionId()))
        .set(PROPERTY_JSON, jsonValue(state))
        .set(PROPERTY_STATUS, state.status().name())
        .build();
  }
}
