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

package com.spotify.sluice.state;

import com.spotify.sluice.model.Execution;
import com.spotify.sluice.model.ExecutionStatus;
import com.spotify.sluice.model.ResultMetadata;
import com.spotify.sluice.util.ConflictException;
import java.time.Instant;
import java.util.Objects;

/**
 * The execution state machine.
 *
 * <pre>
 *   PENDING --submitted--> RUNNING --succeeded--> SUCCESS
 *      |                      |----failed-------> FAILED
 *      |--submitFailed--> FAILED   |--cancelled----> CANCELLED
 *      |--cancelled-----> CANCELLED |--timedOut----> TIMED_OUT
 * </pre>
 *
 * <p>Every transition returns a new {@link Execution}. A transition that is not legal in the
 * current status, including any transition out of a terminal status, throws
 * {@link ConflictException}.
 */
public final class ExecutionTransitions {

  private ExecutionTransitions() {
    throw new UnsupportedOperationException();
  }

  public static Execution submitted(Execution execution, String externalId, Instant now) {
    Objects.requireNonNull(externalId, "externalId");
    switch (execution.status()) {
      case PENDING:
        if (execution.externalId().isPresent()) {
          throw new ConflictException(execution.id() + " already has external id "
                                      + execution.externalId().get());
        }
        return execution.toBuilder()
            .status(ExecutionStatus.RUNNING)
            .externalId(externalId)
            .submitted(now)
            .started(now)
            .build();

      default:
        throw illegalTransition(execution, "submitted");
    }
  }

  public static Execution submitFailed(Execution execution, String error, Instant now) {
    switch (execution.status()) {
      case PENDING:
        return execution.toBuilder()
            .status(ExecutionStatus.FAILED)
            .error(error)
            .completed(now)
            .build();

      default:
        throw illegalTransition(execution, "submitFailed");
    }
  }

  public static Execution succeeded(Execution execution, ResultMetadata resultMetadata,
      Instant now) {
    switch (execution.status()) {
      case RUNNING:
        return execution.toBuilder()
            .status(ExecutionStatus.SUCCESS)
            .resultMetadata(resultMetadata)
            .completed(now)
            .lastPolled(now)
            .build();

      default:
        throw illegalTransition(execution, "succeeded");
    }
  }

  public static Execution failed(Execution execution, String error, Instant now) {
    switch (execution.status()) {
      case RUNNING:
        return execution.toBuilder()
            .status(ExecutionStatus.FAILED)
            .error(error)
            .completed(now)
            .lastPolled(now)
            .build();

      default:
        throw illegalTransition(execution, "failed");
    }
  }

  public static Execution cancelled(Execution execution, Instant now) {
    switch (execution.status()) {
      case PENDING:
      case RUNNING:
        return execution.toBuilder()
            .status(ExecutionStatus.CANCELLED)
            .cancellationRequested(true)
            .completed(now)
            .build();

      default:
        throw illegalTransition(execution, "cancelled");
    }
  }

  public static Execution timedOut(Execution execution, Instant now) {
    switch (execution.status()) {
      case RUNNING:
        return execution.toBuilder()
            .status(ExecutionStatus.TIMED_OUT)
            .error("Execution exceeded the maximum in-flight duration")
            .completed(now)
            .build();

      default:
        throw illegalTransition(execution, "timedOut");
    }
  }

  /**
   * Marks a running execution for cancellation. The poller honors the request on its next
   * observation.
   */
  public static Execution cancellationRequested(Execution execution) {
    switch (execution.status()) {
      case RUNNING:
        return execution.toBuilder()
            .cancellationRequested(true)
            .build();

      default:
        throw illegalTransition(execution, "cancellationRequested");
    }
  }

  private static ConflictException illegalTransition(Execution execution, String event) {
    return new ConflictException(
        "Execution " + execution.id() + " received " + event + " while in " + execution.status());
  }
}
