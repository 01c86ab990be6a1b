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

import static com.google.common.base.CaseFormat.LOWER_UNDERSCORE;
import static com.google.common.base.CaseFormat.UPPER_CAMEL;
import static com.spotify.sluice.util.GuardedRunnable.guard;
import static java.util.stream.Collectors.toList;

import com.google.common.annotations.VisibleForTesting;
import com.spotify.futures.CompletableFutures;
import com.spotify.sluice.credentials.PermanentCredentialException;
import com.spotify.sluice.credentials.TokenRefreshService;
import com.spotify.sluice.credentials.TransientExternalException;
import com.spotify.sluice.gateway.DataException;
import com.spotify.sluice.gateway.ExecutionResults;
import com.spotify.sluice.gateway.GatewayException;
import com.spotify.sluice.gateway.GatewayStatus;
import com.spotify.sluice.gateway.QueryGateway;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ResultMetadata;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.state.ExecutionTransitions;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.Time;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observes running executions on the query gateway and moves them to their terminal status.
 *
 * <p>A status change is only written if the execution still has the status it was polled with,
 * so an execution reaches a terminal status exactly once even with concurrent pollers.
 *
 * <p>A pending execution that is still not submitted after the submit timeout was lost between
 * its creation and its submission, and fails as a failed submission.
 */
public class ExecutionPoller {

  private static final Logger LOG = LoggerFactory.getLogger(ExecutionPoller.class);

  private static final String TICK_TYPE = UPPER_CAMEL.to(LOWER_UNDERSCORE,
      ExecutionPoller.class.getSimpleName());

  static final int DEFAULT_CONCURRENCY = 10;
  static final Duration DEFAULT_MAX_DURATION = Duration.ofHours(1);
  static final Duration DEFAULT_SUBMIT_TIMEOUT = Duration.ofMinutes(10);

  private final Storage storage;
  private final QueryGateway gateway;
  private final TokenRefreshService tokens;
  private final ExecutionOutcomeHandler outcomes;
  private final Stats stats;
  private final Time time;
  private final Executor executor;
  private final Semaphore permits;
  private final Duration maxDuration;
  private final Duration submitTimeout;

  public ExecutionPoller(Storage storage, QueryGateway gateway, TokenRefreshService tokens,
                         ExecutionOutcomeHandler outcomes, Stats stats, Time time,
                         Executor executor, int concurrency, Duration maxDuration,
                         Duration submitTimeout) {
    this.storage = Objects.requireNonNull(storage);
    this.gateway = Objects.requireNonNull(gateway);
    this.tokens = Objects.requireNonNull(tokens);
    this.outcomes = Objects.requireNonNull(outcomes);
    this.stats = Objects.requireNonNull(stats);
    this.time = Objects.requireNonNull(time);
    this.executor = Objects.requireNonNull(executor);
    this.permits = new Semaphore(concurrency);
    this.maxDuration = Objects.requireNonNull(maxDuration);
    this.submitTimeout = Objects.requireNonNull(submitTimeout);
  }

  public void tick() {
    final Instant t0 = time.get();

    final List<Execution> active;
    try {
      active = storage.activeExecutions();
    } catch (IOException e) {
      LOG.warn("Failed to read active executions, skipping this tick", e);
      return;
    }

    active.stream()
        .filter(execution -> isSubmissionLost(execution, t0))
        .forEach(execution -> guard(() -> failLostSubmission(execution)).run());

    final List<CompletableFuture<Void>> polls = active.stream()
        .filter(execution -> execution.status() == ExecutionStatus.RUNNING)
        .filter(execution -> execution.externalId().isPresent())
        .map(execution -> CompletableFuture.runAsync(guard(() -> pollWithPermit(execution)),
            executor))
        .collect(toList());
    CompletableFutures.allAsList(polls).join();

    stats.recordTickDuration(TICK_TYPE, t0.until(time.get(), ChronoUnit.MILLIS));
  }

  private boolean isSubmissionLost(Execution execution, Instant now) {
    return execution.status() == ExecutionStatus.PENDING
        && execution.externalId().isEmpty()
        && !execution.created().plus(submitTimeout).isAfter(now);
  }

  private void failLostSubmission(Execution execution) {
    final Instant now = time.get();
    final String error = "Not submitted within " + submitTimeout + " of its creation";
    LOG.warn("Execution {} was created at {} and never submitted, failing it",
        execution.id(), execution.created());
    try {
      final Execution failed = transition(execution,
          e -> ExecutionTransitions.submitFailed(e, error, now), now);
      if (failed.status() == ExecutionStatus.FAILED) {
        stats.recordSubmissionFailure(execution.origin().kind());
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void pollWithPermit(Execution execution) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return;
    }
    try {
      poll(execution);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      permits.release();
    }
  }

  /**
   * Observe one running execution and store what changed.
   *
   * @return the execution after the observation
   */
  @VisibleForTesting
  Execution poll(Execution execution) throws IOException {
    final Instant now = time.get();
    final String externalId = execution.externalId().orElseThrow();
    final String instanceId = execution.query().instanceId();

    if (execution.cancellationRequested()) {
      cancelQuietly(execution);
      return transition(execution, e -> ExecutionTransitions.cancelled(e, now), now);
    }

    final Instant started = execution.started().orElse(execution.created());
    if (started.plus(maxDuration).isBefore(now)) {
      LOG.warn("Execution {} has been in flight since {}, timing out", execution.id(), started);
      return transition(execution, e -> ExecutionTransitions.timedOut(e, now), now);
    }

    final String accessToken;
    try {
      accessToken = tokens.accessToken(execution.principalId());
    } catch (PermanentCredentialException e) {
      LOG.warn("Cannot poll execution {}: {}", execution.id(), e.getMessage());
      return recordError(execution, e.getMessage());
    } catch (TransientExternalException e) {
      LOG.warn("Cannot poll execution {} now, will retry: {}", execution.id(), e.getMessage());
      return execution;
    }

    final GatewayStatus status;
    try {
      status = gateway.pollStatus(accessToken, instanceId, externalId);
    } catch (GatewayException e) {
      LOG.warn("Failed to poll execution {}, will retry: {}", execution.id(), e.getMessage());
      return execution;
    }

    switch (status.state()) {
      case PENDING:
      case RUNNING:
        return execution;

      case SUCCESS:
        return succeed(execution, accessToken, status, now);

      case FAILED:
        final String error = status.error().orElse("Execution failed on the query gateway");
        return transition(execution, e -> ExecutionTransitions.failed(e, error, now), now);

      case CANCELLED:
        return transition(execution, e -> ExecutionTransitions.cancelled(e, now), now);

      default:
        throw new AssertionError("Unknown gateway state: " + status.state());
    }
  }

  private Execution succeed(Execution execution, String accessToken, GatewayStatus status,
                            Instant now) throws IOException {
    final ExecutionResults results;
    try {
      results = gateway.fetchResults(accessToken, execution.query().instanceId(),
          execution.externalId().orElseThrow());
    } catch (DataException e) {
      final String error = "Malformed results: " + e.getMessage();
      return transition(execution, ex -> ExecutionTransitions.failed(ex, error, now), now);
    } catch (GatewayException e) {
      LOG.warn("Failed to fetch results of execution {}, will retry: {}",
          execution.id(), e.getMessage());
      return execution;
    }

    final ResultMetadata metadata = ResultMetadata.create(
        results.table().rowCount(),
        results.byteSize(),
        results.location().or(status::resultLocation),
        results.table().columns());
    return transition(execution, e -> ExecutionTransitions.succeeded(e, metadata, now), now);
  }

  private Execution transition(Execution observed, UnaryOperator<Execution> transition,
                               Instant now) throws IOException {
    final Optional<Execution> next = storage.runInTransactionWithRetries(tx -> {
      final Optional<Execution> current = tx.execution(observed.id());
      if (current.isEmpty() || current.get().status() != observed.status()) {
        return Optional.<Execution>empty();
      }
      final Execution updated = transition.apply(current.get());
      tx.store(updated);
      outcomes.apply(tx, updated, now);
      return Optional.of(updated);
    });

    if (next.isEmpty()) {
      LOG.debug("Execution {} changed while being polled", observed.id());
      return storage.execution(observed.id()).orElse(observed);
    }
    LOG.info("Execution {} is {}", observed.id(), next.get().status());
    return next.get();
  }

  private Execution recordError(Execution observed, String error) throws IOException {
    return storage.runInTransactionWithRetries(tx -> {
      final Optional<Execution> current = tx.execution(observed.id());
      if (current.isEmpty() || current.get().status() != observed.status()
          || current.get().error().equals(Optional.of(error))) {
        return current.orElse(observed);
      }
      final Execution updated = current.get().toBuilder().error(error).build();
      tx.store(updated);
      return updated;
    });
  }

  private void cancelQuietly(Execution execution) {
    try {
      gateway.cancel(tokens.accessToken(execution.principalId()),
          execution.query().instanceId(), execution.externalId().orElseThrow());
    } catch (IOException | RuntimeException e) {
      LOG.warn("Failed to cancel execution {} on the query gateway: {}",
          execution.id(), e.getMessage());
    }
  }
}
