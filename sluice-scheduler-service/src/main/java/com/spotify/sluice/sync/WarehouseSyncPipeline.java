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

package com.spotify.sluice.sync;

import static com.google.common.base.CaseFormat.LOWER_UNDERSCORE;
import static com.google.common.base.CaseFormat.UPPER_CAMEL;
import static com.spotify.sluice.util.GuardedRunnable.guard;
import static java.util.stream.Collectors.toList;

import com.google.common.collect.ImmutableList;
import com.spotify.futures.CompletableFutures;
import com.spotify.sluice.credentials.TokenRefreshService;
import com.spotify.sluice.crypto.SecretCipher;
import com.spotify.sluice.gateway.ExecutionResults;
import com.spotify.sluice.gateway.QueryGateway;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ResultTable;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.UpsertKeyPolicy;
import com.spotify.sluice.model.WarehouseConfig;
import com.spotify.sluice.model.WarehouseSyncState;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.ConfigurationException;
import com.spotify.sluice.util.ResourceNotFoundException;
import com.spotify.sluice.util.RetryUtil;
import com.spotify.sluice.util.Time;
import com.spotify.sluice.warehouse.Identifiers;
import com.spotify.sluice.warehouse.UpsertRequest;
import com.spotify.sluice.warehouse.WarehouseClient;
import com.spotify.sluice.warehouse.WarehouseClientFactory;
import com.spotify.sluice.warehouse.WarehouseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the results of successful executions into their principal's warehouse.
 *
 * <p>Each sync fetches the results from the query gateway, derives the upsert key and writes the
 * rows in a single warehouse transaction. Failed syncs are retried with exponential backoff up to
 * {@code maxAttempts} attempts. Syncing never changes the execution itself.
 *
 * <p>A sync that stays {@link SyncStatus#UPLOADING} for longer than the upload lease was abandoned
 * by its uploader and counts as a failed attempt.
 */
public class WarehouseSyncPipeline {

  private static final Logger LOG = LoggerFactory.getLogger(WarehouseSyncPipeline.class);

  private static final String TICK_TYPE = UPPER_CAMEL.to(LOWER_UNDERSCORE,
      WarehouseSyncPipeline.class.getSimpleName());

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMinutes(1);
  public static final Duration DEFAULT_UPLOAD_LEASE = Duration.ofMinutes(10);

  private final Storage storage;
  private final QueryGateway gateway;
  private final TokenRefreshService tokens;
  private final SecretCipher cipher;
  private final WarehouseClientFactory clientFactory;
  private final Stats stats;
  private final Time time;
  private final Executor executor;
  private final int maxAttempts;
  private final RetryUtil backoff;
  private final Duration uploadLease;

  public WarehouseSyncPipeline(Storage storage, QueryGateway gateway, TokenRefreshService tokens,
                               SecretCipher cipher, WarehouseClientFactory clientFactory,
                               Stats stats, Time time, Executor executor, int maxAttempts,
                               Duration retryDelay, Duration uploadLease) {
    this.storage = Objects.requireNonNull(storage);
    this.gateway = Objects.requireNonNull(gateway);
    this.tokens = Objects.requireNonNull(tokens);
    this.cipher = Objects.requireNonNull(cipher);
    this.clientFactory = Objects.requireNonNull(clientFactory);
    this.stats = Objects.requireNonNull(stats);
    this.time = Objects.requireNonNull(time);
    this.executor = Objects.requireNonNull(executor);
    this.maxAttempts = maxAttempts;
    this.backoff = new RetryUtil(retryDelay, maxAttempts);
    this.uploadLease = Objects.requireNonNull(uploadLease);
  }

  public void tick() {
    final Instant t0 = time.get();

    final List<WarehouseSyncState> due;
    try {
      due = dueSyncs(t0);
    } catch (IOException e) {
      LOG.warn("Failed to read pending syncs, skipping this tick", e);
      return;
    }

    final List<CompletableFuture<Void>> syncs = due.stream()
        .map(state -> CompletableFuture.runAsync(guard(() -> syncUnchecked(state.executionId())),
            executor))
        .collect(toList());
    CompletableFutures.allAsList(syncs).join();

    stats.recordTickDuration(TICK_TYPE, t0.until(time.get(), ChronoUnit.MILLIS));
  }

  private List<WarehouseSyncState> dueSyncs(Instant now) throws IOException {
    final List<WarehouseSyncState> due = new ArrayList<>(storage.syncStates(SyncStatus.PENDING));
    storage.syncStates(SyncStatus.FAILED).stream()
        .filter(state -> state.attempts() < maxAttempts)
        .filter(state -> state.nextAttemptAt().map(at -> !at.isAfter(now)).orElse(true))
        .forEach(due::add);
    storage.syncStates(SyncStatus.UPLOADING).stream()
        .filter(state -> isUploadAbandoned(state, now))
        .forEach(due::add);
    return due;
  }

  /**
   * Whether the uploader of {@code state} has held it for longer than the upload lease.
   */
  public boolean isUploadAbandoned(WarehouseSyncState state, Instant now) {
    return state.status() == SyncStatus.UPLOADING
        && !state.updated().plus(uploadLease).isAfter(now);
  }

  private void syncUnchecked(String executionId) {
    try {
      sync(executionId);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Sync the results of one execution now.
   *
   * @return the sync state afterwards
   */
  public WarehouseSyncState sync(String executionId) throws IOException {
    final WarehouseSyncState state = storage.syncState(executionId).orElseThrow(() ->
        new ResourceNotFoundException("No warehouse sync for execution " + executionId));
    final Execution execution = storage.execution(executionId).orElseThrow(() ->
        new ResourceNotFoundException("Execution " + executionId + " does not exist"));
    if (isUploadAbandoned(state, time.get())) {
      return fail(state, "Upload abandoned after " + uploadLease + " in " + SyncStatus.UPLOADING);
    }
    if (!isSyncable(state)) {
      LOG.debug("Warehouse sync of {} is {}, nothing to do", executionId, state.status());
      return state;
    }

    final Instant started = time.get();
    final WarehouseConfig config;
    try {
      config = warehouseConfig(state.principalId());
    } catch (ConfigurationException e) {
      LOG.info("Skipping warehouse sync of {}: {}", executionId, e.getMessage());
      return finish(state, state.toBuilder()
          .status(SyncStatus.SKIPPED)
          .lastError(e.getMessage())
          .nextAttemptAt(Optional.empty())
          .updated(started)
          .build());
    }

    final Optional<WarehouseSyncState> claimed = claim(state, started);
    if (claimed.isEmpty()) {
      LOG.debug("Warehouse sync of {} was picked up elsewhere", executionId);
      return storage.syncState(executionId).orElse(state);
    }

    final WarehouseSyncState uploading = claimed.get();
    try {
      final String accessToken = tokens.accessToken(execution.principalId());
      final ExecutionResults results = gateway.fetchResults(accessToken,
          execution.query().instanceId(), execution.externalId().orElseThrow());
      final ResultTable table =
          CompositeKeyDeriver.withExecutionWindow(results.table(), execution.parameters());
      final ImmutableList<String> keyColumns = uploading.upsertKeyPolicy() == UpsertKeyPolicy.APPEND
          ? ImmutableList.of()
          : CompositeKeyDeriver.derive(table);

      final WarehouseClient client = clientFactory.create(config,
          cipher.decrypt(config.encryptedPassword()));
      final String tableName = Identifiers.tableName(uploading.targetTable());
      final long rows = client.upsert(UpsertRequest.create(tableName, table, keyColumns,
          executionId, execution.principalId(), started));

      LOG.info("Uploaded {} rows of execution {} to {} keyed on {}",
          rows, executionId, tableName, keyColumns);
      return finish(uploading, uploading.toBuilder()
          .status(SyncStatus.UPLOADED)
          .attempts(uploading.attempts() + 1)
          .rowsUploaded(rows)
          .keyColumns(keyColumns)
          .uploadedAt(started)
          .lastError(Optional.empty())
          .nextAttemptAt(Optional.empty())
          .updated(time.get())
          .build());
    } catch (WarehouseException | RuntimeException e) {
      return fail(uploading, String.valueOf(e.getMessage()));
    }
  }

  private WarehouseSyncState fail(WarehouseSyncState uploading, String error)
      throws IOException {
    final Instant now = time.get();
    final int attempts = uploading.attempts() + 1;
    final Optional<Instant> nextAttemptAt = attempts < maxAttempts
        ? Optional.of(now.plus(backoff.calculateDelay(attempts)))
        : Optional.empty();

    LOG.warn("Warehouse sync of {} failed (attempt {} of {}){}: {}", uploading.executionId(),
        attempts, maxAttempts, nextAttemptAt.map(at -> ", retrying at " + at).orElse(""),
        error);
    return finish(uploading, uploading.toBuilder()
        .status(SyncStatus.FAILED)
        .attempts(attempts)
        .lastError(error)
        .nextAttemptAt(nextAttemptAt)
        .updated(now)
        .build());
  }

  private Optional<WarehouseSyncState> claim(WarehouseSyncState state, Instant now)
      throws IOException {
    return storage.runInTransactionWithRetries(tx -> {
      final Optional<WarehouseSyncState> current = tx.syncState(state.executionId());
      if (current.isEmpty() || !current.get().equals(state) || !isSyncable(state)) {
        return Optional.<WarehouseSyncState>empty();
      }
      final WarehouseSyncState uploading = state.toBuilder()
          .status(SyncStatus.UPLOADING)
          .updated(now)
          .build();
      tx.store(uploading);
      return Optional.of(uploading);
    });
  }

  private boolean isSyncable(WarehouseSyncState state) {
    return state.status() == SyncStatus.PENDING
        || (state.status() == SyncStatus.FAILED && state.attempts() < maxAttempts);
  }

  /**
   * Store the outcome unless another actor changed the state since {@code expected} was read.
   */
  private WarehouseSyncState finish(WarehouseSyncState expected, WarehouseSyncState outcome)
      throws IOException {
    final WarehouseSyncState stored = storage.runInTransactionWithRetries(tx -> {
      final Optional<WarehouseSyncState> current = tx.syncState(expected.executionId());
      if (current.isPresent() && !current.get().equals(expected)) {
        return current.get();
      }
      tx.store(outcome);
      return outcome;
    });
    if (stored == outcome) {
      stats.recordSync(outcome.status());
    }
    return stored;
  }

  private WarehouseConfig warehouseConfig(String principalId) throws IOException {
    return storage.warehouseConfig(principalId)
        .filter(WarehouseConfig::active)
        .orElseThrow(() -> new ConfigurationException(
            "No active warehouse configuration for principal " + principalId));
  }
}
