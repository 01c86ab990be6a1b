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

import static com.spotify.sluice.storage.DatastoreStorage.PROPERTY_JSON;
import static com.spotify.sluice.storage.DatastoreStorage.PROPERTY_SCHEDULED_JOB_ID;
import static com.spotify.sluice.storage.DatastoreStorage.PROPERTY_STATUS;
import static java.time.Instant.parse;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreException;
import com.google.cloud.datastore.Entity;
import com.google.cloud.datastore.Key;
import com.google.cloud.datastore.KeyFactory;
import com.google.cloud.datastore.PathElement;
import com.google.cloud.datastore.Query;
import com.google.cloud.datastore.QueryResults;
import com.google.cloud.datastore.Transaction;
import com.spotify.sluice.model.BackfillSegment;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.ScheduledJob;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Supplier;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class DatastoreStorageTest {

  private static final Instant NOW = parse("2024-01-16T14:00:00Z");
  private static final Supplier<KeyFactory> KEY_FACTORY = () -> new KeyFactory("test-project");
  private static final QueryDefinition QUERY = QueryDefinition.newBuilder()
      .queryId("query-1")
      .instanceId("instance-1")
      .sql("SELECT * FROM t WHERE d >= {{start_date}}")
      .build();

  @Mock private Datastore datastore;
  @Mock private Transaction transaction;
  @Mock private QueryResults<Entity> queryResults;

  private DatastoreStorage storage;

  @Before
  public void setUp() {
    storage = new DatastoreStorage(datastore, Duration.ZERO);
  }

  @Test
  public void shouldStoreExecutionWithIndexedProperties() throws IOException {
    final Execution execution = execution("exec-1", ExecutionOrigin.scheduled("job-1"));

    final Entity entity = DatastoreStorage.executionToEntity(KEY_FACTORY, execution);

    assertThat(entity.getKey().getName(), is("exec-1"));
    assertThat(entity.getString(PROPERTY_STATUS), is("PENDING"));
    assertThat(entity.getString(PROPERTY_SCHEDULED_JOB_ID), is("job-1"));
    assertThat(entity.getValue(PROPERTY_JSON).excludeFromIndexes(), is(true));
    assertThat(DatastoreStorage.parseJson(entity, Execution.class), is(execution));
  }

  @Test
  public void shouldNotIndexScheduledJobIdForAdHocExecution() throws IOException {
    final Entity entity = DatastoreStorage.executionToEntity(KEY_FACTORY,
        execution("exec-1", ExecutionOrigin.adHoc()));

    assertThat(entity.contains(PROPERTY_SCHEDULED_JOB_ID), is(false));
  }

  @Test
  public void shouldStoreSegmentUnderItsRun() throws IOException {
    final BackfillSegment segment = BackfillSegment.newBuilder()
        .id("run-1-0")
        .runId("run-1")
        .sequence(0)
        .startDate(LocalDate.parse("2024-01-01"))
        .endDate(LocalDate.parse("2024-01-07"))
        .updated(NOW)
        .build();

    final Key key = DatastoreStorage.segmentToEntity(KEY_FACTORY, segment).getKey();

    assertThat(key.getKind(), is(DatastoreStorage.KIND_BACKFILL_SEGMENT));
    assertThat(key.getAncestors().size(), is(1));
    assertThat(key.getAncestors().get(0),
        is(PathElement.of(DatastoreStorage.KIND_BACKFILL_RUN, "run-1")));
  }

  @Test
  public void shouldRetryTransactionOnConflict() throws IOException {
    when(datastore.newTransaction()).thenReturn(transaction);
    when(transaction.commit())
        .thenThrow(new DatastoreException(10, "conflict", "ABORTED"))
        .thenReturn(null);

    final String value = storage.runInTransactionWithRetries(tx -> "done");

    assertThat(value, is("done"));
    verify(transaction, times(2)).commit();
  }

  @Test
  public void shouldGiveUpAfterMaxTransactionRetries() {
    when(datastore.newTransaction()).thenReturn(transaction);
    when(transaction.commit()).thenThrow(new DatastoreException(10, "conflict", "ABORTED"));

    final TransactionException e = assertThrows(TransactionException.class,
        () -> storage.runInTransactionWithRetries(tx -> "done"));

    assertThat(e.isConflict(), is(true));
    verify(transaction, times(DatastoreStorage.MAX_TRANSACTION_RETRIES)).commit();
  }

  @Test
  public void shouldNotRetryNonConflictFailure() {
    when(datastore.newTransaction()).thenReturn(transaction);
    when(transaction.commit()).thenThrow(new DatastoreException(13, "internal", "INTERNAL"));

    final TransactionException e = assertThrows(TransactionException.class,
        () -> storage.runInTransactionWithRetries(tx -> "done"));

    assertThat(e.isConflict(), is(false));
    verify(transaction).commit();
  }

  @Test
  public void shouldRollbackWhenFunctionFails() {
    when(datastore.newTransaction()).thenReturn(transaction);
    when(transaction.isActive()).thenReturn(true);

    assertThrows(IllegalStateException.class, () -> storage.runInTransactionWithRetries(tx -> {
      throw new IllegalStateException("boom");
    }));

    verify(transaction).rollback();
  }

  @Test
  @SuppressWarnings("unchecked")
  public void shouldFilterPausedJobsFromDueJobs() throws IOException {
    final Entity active = DatastoreStorage.scheduledJobToEntity(KEY_FACTORY, job("active", true));
    final Entity paused = DatastoreStorage.scheduledJobToEntity(KEY_FACTORY, job("paused", false));
    when(queryResults.hasNext()).thenReturn(true, true, false);
    when(queryResults.next()).thenReturn(active, paused);
    when(datastore.run(any(Query.class))).thenReturn(queryResults);

    final List<ScheduledJob> due = storage.dueScheduledJobs(NOW);

    assertThat(due.size(), is(1));
    assertThat(due.get(0).id(), is("active"));
  }

  private static Execution execution(String id, ExecutionOrigin origin) {
    return Execution.newBuilder()
        .id(id)
        .origin(origin)
        .principalId("principal-1")
        .query(QUERY)
        .status(ExecutionStatus.PENDING)
        .created(NOW)
        .build();
  }

  private static ScheduledJob job(String id, boolean active) {
    return ScheduledJob.newBuilder()
        .id(id)
        .principalId("principal-1")
        .query(QUERY)
        .cronExpression("0 9 * * *")
        .timezone("America/New_York")
        .active(active)
        .nextFire(NOW.minusSeconds(60))
        .created(NOW)
        .build();
  }
}
