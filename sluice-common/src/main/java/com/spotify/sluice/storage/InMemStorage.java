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

import static java.util.stream.Collectors.toList;

import com.google.common.collect.Maps;
import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.BackfillStatus;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.WarehouseConfig;
import com.spotify.sluice.model.WarehouseSyncState;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link Storage} that keeps everything in memory. Transactions are serialized by a single
 * lock and buffer their writes until commit, so a failed transaction leaves no trace.
 */
public class InMemStorage implements Storage {

  private final ConcurrentMap<String, Credential> credentials = Maps.newConcurrentMap();
  private final ConcurrentMap<String, WarehouseConfig> warehouseConfigs = Maps.newConcurrentMap();
  private final ConcurrentMap<String, ScheduledJob> scheduledJobs = Maps.newConcurrentMap();
  private final ConcurrentMap<String, Execution> executions = Maps.newConcurrentMap();
  private final ConcurrentMap<String, BackfillRun> backfillRuns = Maps.newConcurrentMap();
  private final ConcurrentMap<String, BackfillSegment> segments = Maps.newConcurrentMap();
  private final ConcurrentMap<String, WarehouseSyncState> syncStates = Maps.newConcurrentMap();

  private final ReentrantLock transactionLock = new ReentrantLock();

  @Override
  public void close() {
  }

  @Override
  public Optional<Credential> credential(String principalId) {
    return Optional.ofNullable(credentials.get(principalId));
  }

  @Override
  public List<Credential> credentialsExpiringBefore(Instant instant) {
    return credentials.values().stream()
        .filter(credential -> credential.expiresAt().isBefore(instant))
        .collect(toList());
  }

  @Override
  public void store(Credential credential) {
    credentials.put(credential.principalId(), credential);
  }

  @Override
  public Optional<WarehouseConfig> warehouseConfig(String principalId) {
    return Optional.ofNullable(warehouseConfigs.get(principalId));
  }

  @Override
  public void store(WarehouseConfig warehouseConfig) {
    warehouseConfigs.put(warehouseConfig.principalId(), warehouseConfig);
  }

  @Override
  public Optional<ScheduledJob> scheduledJob(String id) {
    return Optional.ofNullable(scheduledJobs.get(id));
  }

  @Override
  public List<ScheduledJob> scheduledJobs() {
    return new ArrayList<>(scheduledJobs.values());
  }

  @Override
  public List<ScheduledJob> dueScheduledJobs(Instant now) {
    return scheduledJobs.values().stream()
        .filter(ScheduledJob::active)
        .filter(job -> !job.nextFire().isAfter(now))
        .collect(toList());
  }

  @Override
  public void store(ScheduledJob scheduledJob) {
    scheduledJobs.put(scheduledJob.id(), scheduledJob);
  }

  @Override
  public Optional<Execution> execution(String id) {
    return Optional.ofNullable(executions.get(id));
  }

  @Override
  public List<Execution> activeExecutions() {
    return executions.values().stream()
        .filter(execution -> !execution.status().isTerminal())
        .collect(toList());
  }

  @Override
  public List<Execution> executionsForScheduledJob(String scheduledJobId, Instant createdSince) {
    return executions.values().stream()
        .filter(execution -> execution.origin().kind() == ExecutionOrigin.Kind.SCHEDULED)
        .filter(execution -> execution.origin().isScheduled(scheduledJobId))
        .filter(execution -> !execution.created().isBefore(createdSince))
        .collect(toList());
  }

  @Override
  public void store(Execution execution) {
    executions.put(execution.id(), execution);
  }

  @Override
  public Optional<BackfillRun> backfillRun(String id) {
    return Optional.ofNullable(backfillRuns.get(id));
  }

  @Override
  public List<BackfillRun> backfillRuns(BackfillStatus status) {
    return backfillRuns.values().stream()
        .filter(run -> run.status() == status)
        .collect(toList());
  }

  @Override
  public List<BackfillSegment> segments(String runId) {
    return segments.values().stream()
        .filter(segment -> segment.runId().equals(runId))
        .sorted(BackfillSegment.SEQUENCE_ORDER)
        .collect(toList());
  }

  @Override
  public Optional<WarehouseSyncState> syncState(String executionId) {
    return Optional.ofNullable(syncStates.get(executionId));
  }

  @Override
  public List<WarehouseSyncState> syncStates(SyncStatus status) {
    return syncStates.values().stream()
        .filter(state -> state.status() == status)
        .collect(toList());
  }

  @Override
  public <T, E extends Exception> T runInTransactionWithRetries(TransactionFunction<T, E> f)
      throws IOException, E {
    transactionLock.lock();
    try {
      final InMemTransaction tx = new InMemTransaction();
      try {
        final T value = f.apply(tx);
        tx.commit();
        return value;
      } finally {
        if (tx.isActive()) {
          tx.rollback();
        }
      }
    } finally {
      transactionLock.unlock();
    }
  }

  private class InMemTransaction implements StorageTransaction {

    private final Map<String, Credential> credentialWrites = new HashMap<>();
    private final Map<String, ScheduledJob> scheduledJobWrites = new HashMap<>();
    private final Map<String, Execution> executionWrites = new HashMap<>();
    private final Map<String, BackfillRun> backfillRunWrites = new HashMap<>();
    private final Map<String, BackfillSegment> segmentWrites = new HashMap<>();
    private final Map<String, WarehouseSyncState> syncStateWrites = new HashMap<>();

    private boolean active = true;

    @Override
    public Optional<Credential> credential(String principalId) {
      return read(credentialWrites, credentials, principalId);
    }

    @Override
    public void store(Credential credential) {
      credentialWrites.put(credential.principalId(), credential);
    }

    @Override
    public Optional<ScheduledJob> scheduledJob(String id) {
      return read(scheduledJobWrites, scheduledJobs, id);
    }

    @Override
    public void store(ScheduledJob scheduledJob) {
      scheduledJobWrites.put(scheduledJob.id(), scheduledJob);
    }

    @Override
    public Optional<Execution> execution(String id) {
      return read(executionWrites, executions, id);
    }

    @Override
    public void store(Execution execution) {
      executionWrites.put(execution.id(), execution);
    }

    @Override
    public Optional<BackfillRun> backfillRun(String id) {
      return read(backfillRunWrites, backfillRuns, id);
    }

    @Override
    public void store(BackfillRun backfillRun) {
      backfillRunWrites.put(backfillRun.id(), backfillRun);
    }

    @Override
    public Optional<BackfillSegment> segment(String runId, String segmentId) {
      return read(segmentWrites, segments, segmentId)
          .filter(segment -> segment.runId().equals(runId));
    }

    @Override
    public List<BackfillSegment> segments(String runId) {
      final Map<String, BackfillSegment> merged = new HashMap<>(segments);
      merged.putAll(segmentWrites);
      return merged.values().stream()
          .filter(segment -> segment.runId().equals(runId))
          .sorted(BackfillSegment.SEQUENCE_ORDER)
          .collect(toList());
    }

    @Override
    public void store(BackfillSegment segment) {
      segmentWrites.put(segment.id(), segment);
    }

    @Override
    public Optional<WarehouseSyncState> syncState(String executionId) {
      return read(syncStateWrites, syncStates, executionId);
    }

    @Override
    public void store(WarehouseSyncState syncState) {
      syncStateWrites.put(syncState.executionId(), syncState);
    }

    @Override
    public void commit() throws TransactionException {
      if (!active) {
        throw new TransactionException("Transaction is not active", false);
      }
      credentials.putAll(credentialWrites);
      scheduledJobs.putAll(scheduledJobWrites);
      executions.putAll(executionWrites);
      backfillRuns.putAll(backfillRunWrites);
      segments.putAll(segmentWrites);
      syncStates.putAll(syncStateWrites);
      active = false;
    }

    @Override
    public void rollback() {
      active = false;
    }

    @Override
    public boolean isActive() {
      return active;
    }

    private <T> Optional<T> read(Map<String, T> writes, Map<String, T> committed, String key) {
      final T written = writes.get(key);
      return written != null ? Optional.of(written) : Optional.ofNullable(committed.get(key));
    }
  }
}
