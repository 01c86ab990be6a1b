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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.spotify.sluice.serialization.Json;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wrap OkHttpClient and return a CompletionStage instead of having to pass callbacks.
 */
public class FutureOkHttpClient implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(FutureOkHttpClient.class);

  private static final MediaType APPLICATION_JSON =
      Objects.requireNonNull(MediaType.parse("application/json"));

  private final OkHttpClient client;

  public static FutureOkHttpClient create(OkHttpClient client) {
    return new FutureOkHttpClient(client);
  }

  private FutureOkHttpClient(OkHttpClient client) {
    this.client = Objects.requireNonNull(client);
  }

  public CompletionStage<Response> send(Request request) {
    log.debug("{} {}", request.method(), request.url().redact());
    final long start = System.nanoTime();

    final CompletableFuture<Response> future = new CompletableFuture<>();

    client.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        log.debug("{} {}: failed (latency: {}ms)", request.method(), request.url().redact(),
            latency(start), e);
        future.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response response) {
        log.debug("{} {}: {} {} (latency: {}ms)", request.method(), request.url().redact(),
            response.code(), response.message(), latency(start));
        future.complete(response);
      }
    });

    return future;
  }

  private static long latency(long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }

  public static Request forUri(HttpUrl uri, String method, Object payload) {
    try {
      return new Request.Builder().url(uri)
          .method(method, RequestBody.create(Json.serialize(payload), APPLICATION_JSON))
          .build();
    } catch (JsonProcessingException e) {
      throw new RuntimeException(e);
    }
  }

  public static Request forUri(HttpUrl uri, String method) {
    return new Request.Builder().url(uri).method(method, null).build();
  }

  public static Request forUri(HttpUrl uri) {
    return new Request.Builder().url(uri).build();
  }

  /**
   * A POST of an {@code application/x-www-form-urlencoded} body.
   */
  public static Request forForm(HttpUrl uri, Map<String, String> fields) {
    final FormBody.Builder form = new FormBody.Builder();
    fields.forEach(form::add);
    return new Request.Builder().url(uri).post(form.build()).build();
  }

  @Override
  public void close() {
    client.connectionPool().evictAll();
    client.dispatcher().executorService().shutdown();
  }
}
