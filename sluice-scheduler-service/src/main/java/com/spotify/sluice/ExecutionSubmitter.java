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

import com.google.common.base.Preconditions;
import com.spotify.sluice.credentials.PermanentCredentialException;
import com.spotify.sluice.credentials.TokenRefreshService;
import com.spotify.sluice.credentials.TransientExternalException;
import com.spotify.sluice.crypto.SecretCipher.SecretCipherException;
import com.spotify.sluice.gateway.GatewayException;
import com.spotify.sluice.gateway.QueryGateway;
import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.state.ExecutionTransitions;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.ConfigurationException;
import com.spotify.sluice.util.ResourceNotFoundException;
import com.spotify.sluice.util.Time;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits pending executions to the query gateway on behalf of their principal.
 *
 * <p>A submission that fails for any reason, including a credential that cannot be refreshed,
 * fails the execution; callers decide whether to create a new one.
 */
public class ExecutionSubmitter {

  private static final Logger LOG = LoggerFactory.getLogger(ExecutionSubmitter.class);

  private final Storage storage;
  private final QueryGateway gateway;
  private final TokenRefreshService tokens;
  private final ExecutionOutcomeHandler outcomes;
  private final Stats stats;
  private final Time time;

  public ExecutionSubmitter(Storage storage, QueryGateway gateway, TokenRefreshService tokens,
                            ExecutionOutcomeHandler outcomes, Stats stats, Time time) {
    this.storage = Objects.requireNonNull(storage);
    this.gateway = Objects.requireNonNull(gateway);
    this.tokens = Objects.requireNonNull(tokens);
    this.outcomes = Objects.requireNonNull(outcomes);
    this.stats = Objects.requireNonNull(stats);
    this.time = Objects.requireNonNull(time);
  }

  /**
   * Submit a stored pending execution and store the outcome.
   *
   * @return the execution as stored afterwards: running, failed, or whatever another actor made
   *     of it in the meantime
   */
  public Execution submit(Execution execution) throws IOException {
    Preconditions.checkArgument(execution.status() == ExecutionStatus.PENDING,
        "execution %s is not pending", execution.id());

    Optional<String> externalId = Optional.empty();
    String error = null;
    try {
      final String accessToken = tokens.accessToken(execution.principalId());
      externalId = Optional.of(
          gateway.submitQuery(accessToken, execution.query(), execution.parameters()));
    } catch (PermanentCredentialException | TransientExternalException | ConfigurationException
        | GatewayException | SecretCipherException e) {
      error = e.getMessage();
      LOG.warn("Failed to submit execution {} of {}: {}",
          execution.id(), execution.principalId(), error);
    }

    final Optional<String> submittedId = externalId;
    final String failure = error;
    final Execution stored = storage.runInTransactionWithRetries(tx -> {
      final Execution current = tx.execution(execution.id()).orElseThrow(() ->
          new ResourceNotFoundException("Execution " + execution.id() + " does not exist"));
      if (current.status() != ExecutionStatus.PENDING) {
        return current;
      }
      final Execution next = submittedId.isPresent()
          ? ExecutionTransitions.submitted(current, submittedId.get(), time.get())
          : ExecutionTransitions.submitFailed(current, failure, time.get());
      tx.store(next);
      if (next.status().isTerminal()) {
        outcomes.apply(tx, next, time.get());
      }
      return next;
    });

    if (submittedId.isPresent()) {
      if (stored.externalId().equals(submittedId)) {
        stats.recordSubmission(execution.origin().kind());
        LOG.info("Submitted execution {} as {}", execution.id(), submittedId.get());
      } else {
        LOG.info("Execution {} became {} while being submitted, cancelling {}",
            execution.id(), stored.status(), submittedId.get());
        cancelQuietly(execution, submittedId.get());
      }
    } else {
      stats.recordSubmissionFailure(execution.origin().kind());
    }
    return stored;
  }

  private void cancelQuietly(Execution execution, String externalId) {
    try {
      gateway.cancel(tokens.accessToken(execution.principalId()),
          execution.query().instanceId(), externalId);
    } catch (IOException | RuntimeException e) {
      LOG.warn("Failed to cancel {} on the gateway", externalId, e);
    }
  }
}
