/*-
 * -\-\-
 * Spotify Sluice Gateway Client
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

package com.spotify.sluice.gateway;

import static com.github.rholder.retry.StopStrategies.stopAfterAttempt;
import static com.github.rholder.retry.WaitStrategies.exponentialWait;
import static com.spotify.sluice.gateway.FutureOkHttpClient.forUri;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.serialization.Json;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QueryGateway} over the gateway's HTTP/JSON API. Submissions are retried on rate limiting
 * and server errors; the other calls fail fast and are retried by the caller's next tick.
 */
public class HttpQueryGateway implements QueryGateway, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(HttpQueryGateway.class);

  private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(60);

  private static final int SUBMIT_ATTEMPTS = 3;

  private final HttpUrl baseUrl;
  private final String clientId;
  private final FutureOkHttpClient client;
  private final Retryer<String> submitRetryer;

  @VisibleForTesting
  HttpQueryGateway(HttpUrl baseUrl, String clientId, FutureOkHttpClient client,
                   Retryer<String> submitRetryer) {
    this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.client = Objects.requireNonNull(client, "client");
    this.submitRetryer = Objects.requireNonNull(submitRetryer, "submitRetryer");
  }

  public static HttpQueryGateway create(String baseUrl, String clientId) {
    return create(baseUrl, clientId, defaultOkHttpClient());
  }

  public static HttpQueryGateway create(String baseUrl, String clientId, OkHttpClient client) {
    return new HttpQueryGateway(HttpUrl.get(baseUrl), clientId, FutureOkHttpClient.create(client),
        defaultSubmitRetryer());
  }

  static OkHttpClient defaultOkHttpClient() {
    return new OkHttpClient.Builder()
        .connectTimeout(DEFAULT_CONNECT_TIMEOUT.getSeconds(), TimeUnit.SECONDS)
        .readTimeout(DEFAULT_READ_TIMEOUT.getSeconds(), TimeUnit.SECONDS)
        .writeTimeout(DEFAULT_WRITE_TIMEOUT.getSeconds(), TimeUnit.SECONDS)
        .build();
  }

  static Retryer<String> defaultSubmitRetryer() {
    return RetryerBuilder.<String>newBuilder()
        .retryIfException(HttpQueryGateway::isSubmitRetryable)
        .withRetryListener(HttpQueryGateway::onSubmitAttempt)
        .withWaitStrategy(exponentialWait(1000, 30, SECONDS))
        .withStopStrategy(stopAfterAttempt(SUBMIT_ATTEMPTS))
        .build();
  }

  /**
   * Submission is not idempotent. Without a response the gateway may already have accepted the
   * query, so only a request that never reached it is sent again.
   */
  @VisibleForTesting
  static boolean isSubmitRetryable(Throwable t) {
    if (!(t instanceof GatewayException)) {
      return false;
    }
    final GatewayException e = (GatewayException) t;
    if (e.getCode() != GatewayException.NO_RESPONSE) {
      return e.isRetryable();
    }
    return Throwables.getCausalChain(e).stream()
        .anyMatch(cause -> cause instanceof ConnectException
                           || cause instanceof UnknownHostException);
  }

  private static <V> void onSubmitAttempt(Attempt<V> attempt) {
    if (attempt.hasException()) {
      LOG.warn("Failed to submit query (attempt #{}): {}", attempt.getAttemptNumber(),
          attempt.getExceptionCause().getMessage());
    }
  }

  @Override
  public String submitQuery(String accessToken, QueryDefinition query,
                            Map<String, String> parameters) {
    final SubmitExecutionRequest payload =
        SubmitExecutionRequest.create(query.queryId(), query.sql(), parameters);
    final Request request = forUri(url("instances", query.instanceId(), "executions"), "POST", payload);
    try {
      return submitRetryer.call(() -> {
        final ExecutionPayload execution = await(execute(request, accessToken, ExecutionPayload.class));
        if (execution.executionId() == null || execution.executionId().isEmpty()) {
          throw new GatewayException("Gateway returned no execution id", 200, null);
        }
        return execution.executionId();
      });
    } catch (RetryException e) {
      final Throwable cause = e.getLastFailedAttempt().getExceptionCause();
      Throwables.throwIfInstanceOf(cause, GatewayException.class);
      throw new GatewayException("Query submission failed: " + e.getMessage(),
          GatewayException.NO_RESPONSE, null, e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new GatewayException("Query submission failed: " + e.getCause().getMessage(),
          GatewayException.NO_RESPONSE, null, e.getCause());
    }
  }

  @Override
  public GatewayStatus pollStatus(String accessToken, String instanceId, String externalId) {
    final ExecutionPayload execution = await(execute(
        forUri(url("instances", instanceId, "executions", externalId)), accessToken,
        ExecutionPayload.class));
    return GatewayStatus.create(
        GatewayState.parse(execution.status().orElse(null)),
        execution.resultLocation(),
        execution.error());
  }

  @Override
  public void cancel(String accessToken, String instanceId, String externalId) {
    try (Response ignored = await(execute(
        forUri(url("instances", instanceId, "executions", externalId), "DELETE"), accessToken))) {
      LOG.info("Requested cancellation of gateway execution {}", externalId);
    }
  }

  @Override
  public ExecutionResults fetchResults(String accessToken, String instanceId, String externalId) {
    final DownloadUrlsPayload urls = await(execute(
        forUri(url("instances", instanceId, "executions", externalId, "download-urls")),
        accessToken, DownloadUrlsPayload.class));
    if (urls.downloadUrls().isEmpty()) {
      LOG.info("Gateway execution {} has no result files", externalId);
      return ExecutionResults.empty();
    }
    final String location = urls.downloadUrls().get(0);
    final HttpUrl downloadUrl = HttpUrl.parse(location);
    if (downloadUrl == null) {
      throw new DataException("Invalid result download url for execution " + externalId);
    }

    // download urls are pre-signed, so no gateway headers are sent along
    final byte[] bytes = await(client.send(forUri(downloadUrl)).handle((response, e) -> {
      if (e != null) {
        throw new GatewayException("Result download failed: " + e.getMessage(),
            GatewayException.NO_RESPONSE, null, e);
      }
      try (ResponseBody body = response.body()) {
        if (!response.isSuccessful()) {
          throw new GatewayException("Result download failed: " + response.code() + " "
                                     + response.message(), response.code(), null);
        }
        return body == null ? new byte[0] : body.bytes();
      } catch (IOException ioe) {
        throw new GatewayException("Result download failed: " + ioe.getMessage(),
            GatewayException.NO_RESPONSE, null, ioe);
      }
    }));

    return ExecutionResults.create(
        ResultCsvParser.parse(new String(bytes, StandardCharsets.UTF_8)),
        bytes.length,
        Optional.of(location));
  }

  private <T> CompletionStage<T> execute(Request request, String accessToken, Class<T> tClass) {
    return execute(request, accessToken).thenApply(response -> {
      try (ResponseBody responseBody = response.body()) {
        if (responseBody == null) {
          throw new GatewayException("Empty response body", response.code(), null);
        }
        return Json.OBJECT_MAPPER.readValue(responseBody.bytes(), tClass);
      } catch (IOException e) {
        throw new GatewayException("Error while reading the received payload: " + e.getMessage(),
            response.code(), response.header("X-Request-Id"), e);
      }
    });
  }

  private CompletionStage<Response> execute(Request request, String accessToken) {
    final String requestId = UUID.randomUUID().toString().replace("-", "");
    return client.send(decorateRequest(request, requestId, accessToken)).handle((response, e) -> {
      if (e != null) {
        throw new GatewayException("Request failed: " + request.method() + " " + request.url().redact(),
            GatewayException.NO_RESPONSE, requestId, e);
      }
      final String responseRequestId = response.header("X-Request-Id");
      final String effectiveRequestId;
      if (responseRequestId != null && !responseRequestId.equals(requestId)) {
        effectiveRequestId = responseRequestId;
        LOG.warn("Request ID mismatch: '{}' != '{}'", requestId, responseRequestId);
      } else {
        effectiveRequestId = requestId;
      }
      if (!response.isSuccessful()) {
        response.close();
        throw new GatewayException(response.code() + " " + response.message(), response.code(),
            effectiveRequestId);
      }
      return response;
    });
  }

  private Request decorateRequest(Request request, String requestId, String accessToken) {
    return request.newBuilder()
        .addHeader("Authorization", "Bearer " + accessToken)
        .addHeader("X-Client-Id", clientId)
        .addHeader("X-Request-Id", requestId)
        .build();
  }

  private HttpUrl url(String... pathSegments) {
    final HttpUrl.Builder builder = baseUrl.newBuilder();
    Arrays.stream(pathSegments).forEach(builder::addPathSegment);
    return builder.build();
  }

  /**
   * Wait for a response, unwrapping the failure of the stage.
   */
  private static <T> T await(CompletionStage<T> stage) {
    try {
      return stage.toCompletableFuture().join();
    } catch (CompletionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new GatewayException(e.getCause().getMessage(), GatewayException.NO_RESPONSE, null,
          e.getCause());
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
