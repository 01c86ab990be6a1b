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

import com.spotify.sluice.model.BackfillRun;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ScheduledJob;
import com.spotify.sluice.model.WarehouseSyncState;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * The interface to the persistence layer where the same transaction is used across storage
 * operations. All writes are scoped to single entities; reads inside the transaction make the
 * following writes conditional on what was read.
 *
 * <p>Use the {@link Storage#runInTransactionWithRetries(TransactionFunction)} method for automatic
 * commit/rollback handling.
 */
public interface StorageTransaction {

  Optional<Credential> credential(String principalId) throws IOException;

  void store(Credential credential) throws IOException;

  Optional<ScheduledJob> scheduledJob(String id) throws IOException;

  void store(ScheduledJob scheduledJob) throws IOException;

  Optional<Execution> execution(String id) throws IOException;

  void store(Execution execution) throws IOException;

  Optional<BackfillRun> backfillRun(String id) throws IOException;

  void store(BackfillRun backfillRun) throws IOException;

  Optional<BackfillSegment> segment(String runId, String segmentId) throws IOException;

  /**
   * All segments of a backfill run, in sequence order.
   */
  List<BackfillSegment> segments(String runId) throws IOException;

  void store(BackfillSegment segment) throws IOException;

  Optional<WarehouseSyncState> syncState(String executionId) throws IOException;

  void store(WarehouseSyncState syncState) throws IOException;

  /**
   * Commit the transaction.
   *
   * @throws TransactionException if the transaction conflicted with another one
   */
  void commit() throws TransactionException;

  void rollback() throws TransactionException;

  boolean isActive();
}
