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

package com.spotify.sluice;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import com.google.common.util.concurrent.MoreExecutors;
import com.spotify.sluice.credentials.TokenRefreshService;
import com.spotify.sluice.gateway.ExecutionResults;
import com.spotify.sluice.gateway.GatewayState;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionOrigin;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ResultMetadata;
import com.spotify.sluice.model.ResultTable;
import com.spotify.sluice.model.SyncStatus;
import com.spotify.sluice.model.WarehouseSyncDirective;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.InMemStorage;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class ExecutionPollerTest {

  private static final Instant STARTED = Instant.parse("2024-03-01T10:00:00Z");

  private static final ResultTable TABLE = ResultTable.create(
      List.of("week_start", "region", "revenue"),
      List.of(List.of("2024-02-19", "EU", "100"), List.of("2024-02-19", "US", "250")));

  private final InMemStorage storage = new InMemStorage();
  private final FakeQueryGateway gateway = new FakeQueryGateway();

  private Instant now = STARTED.plus(Duration.ofMinutes(5));
  private ExecutionPoller poller;
  private String externalId;

  @Before
  public void setUp() throws IOException {
    storage.store(TestData.validCredential(STARTED.plus(Duration.ofDays(1))));
    var tokens = new TokenRefreshService(storage, refreshToken -> {
      throw new AssertionError("no renewal expected");
    }, TestData.CIPHER, () -> now, Duration.ofMinutes(10), Stats.NOOP);
    poller = new ExecutionPoller(storage, gateway, tokens,
        new ExecutionOutcomeHandler(Stats.NOOP), Stats.NOOP, () -> now,
        MoreExecutors.directExecutor(), 10, Duration.ofHours(1),
        Duration.ofMinutes(10));
    externalId = gateway.submitQuery("access-token", TestData.QUERY, Map.of());
    storage.store(running(externalId));
  }

  @Test
  public void shouldRecordResultMetadataOfSuccess() throws IOException {
    gateway.succeed(externalId, ExecutionResults.create(TABLE, 1234, Optional.of("s3://x")));

    poller.tick();

    var execution = storage.execution("exec-1").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.SUCCESS));
    assertThat(execution.completed(), is(Optional.of(now)));
    assertThat(execution.resultMetadata(), is(Optional.of(ResultMetadata.create(2, 1234,
        Optional.of("s3://x"), List.of("week_start", "region", "revenue")))));
  }

  @Test
  public void shouldQueueSyncWhenSyncIsEnabled() throws IOException {
    storage.store(running(externalId).toBuilder()
        .syncDirective(WarehouseSyncDirective.enabledFor("weekly_sales"))
        .build());
    gateway.succeed(externalId, ExecutionResults.create(TABLE, 1234, Optional.empty()));

    poller.tick();

    assertThat(storage.syncState("exec-1").orElseThrow().status(), is(SyncStatus.PENDING));
  }

  @Test
  public void shouldFailExecutionWithGatewayError() throws IOException {
    gateway.fail(externalId, "Syntax error at line 1");

    poller.tick();

    var execution = storage.execution("exec-1").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.FAILED));
    assertThat(execution.error(), is(Optional.of("Syntax error at line 1")));
  }

  @Test
  public void shouldFailExecutionWithMalformedResults() throws IOException {
    gateway.succeed(externalId, ExecutionResults.empty());
    gateway.setMalformedResults(true);

    poller.tick();

    var execution = storage.execution("exec-1").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.FAILED));
    assertThat(execution.error().orElseThrow(), containsString("Malformed results"));
  }

  @Test
  public void shouldCancelExecutionCancelledOnGateway() throws IOException {
    gateway.setStatus(externalId, GatewayState.CANCELLED);

    poller.tick();

    assertThat(storage.execution("exec-1").orElseThrow().status(),
        is(ExecutionStatus.CANCELLED));
  }

  @Test
  @Parameters({"PENDING", "RUNNING"})
  public void shouldNotWriteWhileStillRunning(GatewayState state) throws IOException {
    gateway.setStatus(externalId, state);

    poller.tick();

    assertThat(storage.execution("exec-1"), is(Optional.of(running(externalId))));
  }

  @Test
  public void shouldKeepPollingWhileGatewayIsUnavailable() throws IOException {
    gateway.setUnavailable(true);

    poller.tick();

    assertThat(storage.execution("exec-1").orElseThrow().status(), is(ExecutionStatus.RUNNING));
  }

  @Test
  public void shouldHonorCancellationRequest() throws IOException {
    storage.store(running(externalId).toBuilder().cancellationRequested(true).build());

    poller.tick();

    assertThat(gateway.cancelled(), contains(externalId));
    assertThat(storage.execution("exec-1").orElseThrow().status(),
        is(ExecutionStatus.CANCELLED));
  }

  @Test
  public void shouldTimeOutExecutionInFlightTooLong() throws IOException {
    now = STARTED.plus(Duration.ofMinutes(61));

    poller.tick();

    var execution = storage.execution("exec-1").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.TIMED_OUT));
    assertThat(execution.completed(), is(Optional.of(now)));
  }

  @Test
  public void shouldRecordCredentialErrorAndKeepRunning() throws IOException {
    storage.store(TestData.validCredential(STARTED).toBuilder()
        .reauthenticationRequired(true)
        .build());

    poller.tick();

    var execution = storage.execution("exec-1").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.RUNNING));
    assertThat(execution.error().orElseThrow(), containsString("must authenticate again"));
  }

  @Test
  public void shouldNotChangeTerminalExecution() throws IOException {
    var running = running(externalId);
    gateway.fail(externalId, "boom");
    poller.tick();
    var failed = storage.execution("exec-1").orElseThrow();

    gateway.succeed(externalId, ExecutionResults.create(TABLE, 1, Optional.empty()));
    var result = poller.poll(running);

    assertThat(result, is(failed));
    assertThat(storage.execution("exec-1"), is(Optional.of(failed)));
  }

  @Test
  public void shouldFailExecutionThatWasNeverSubmitted() throws IOException {
    storage.store(Execution.newBuilder()
        .id("exec-2")
        .origin(ExecutionOrigin.adHoc())
        .principalId(TestData.PRINCIPAL)
        .query(TestData.QUERY)
        .created(STARTED)
        .build());

    poller.tick();
    assertThat(storage.execution("exec-2").orElseThrow().status(), is(ExecutionStatus.PENDING));

    now = STARTED.plus(Duration.ofMinutes(10));
    poller.tick();

    var execution = storage.execution("exec-2").orElseThrow();
    assertThat(execution.status(), is(ExecutionStatus.FAILED));
    assertThat(execution.error().orElseThrow(), containsString("Not submitted within"));
    assertThat(execution.completed(), is(Optional.of(now)));
  }

  private static Execution running(String externalId) {
    return Execution.newBuilder()
        .id("exec-1")
        .origin(ExecutionOrigin.adHoc())
        .principalId(TestData.PRINCIPAL)
        .query(TestData.QUERY)
        .status(ExecutionStatus.RUNNING)
        .externalId(externalId)
        .created(STARTED)
        .submitted(STARTED)
        .started(STARTED)
        .build();
  }
}
