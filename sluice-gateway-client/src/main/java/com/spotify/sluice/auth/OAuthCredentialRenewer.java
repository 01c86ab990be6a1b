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

package com.spotify.sluice.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.spotify.sluice.auth.CredentialRenewalException.Kind;
import com.spotify.sluice.gateway.FutureOkHttpClient;
import com.spotify.sluice.serialization.Json;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renews access tokens with an OAuth 2.0 {@code refresh_token} grant. This class only classifies
 * failures; retrying is up to the caller.
 */
public class OAuthCredentialRenewer implements CredentialRenewer, AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(OAuthCredentialRenewer.class);

  private final HttpUrl tokenUrl;
  private final String clientId;
  private final String clientSecret;
  private final FutureOkHttpClient client;

  OAuthCredentialRenewer(HttpUrl tokenUrl, String clientId, String clientSecret,
                         FutureOkHttpClient client) {
    this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
    this.client = Objects.requireNonNull(client, "client");
  }

  public static OAuthCredentialRenewer create(String tokenUrl, String clientId,
                                              String clientSecret) {
    final OkHttpClient okHttpClient = new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(30, TimeUnit.SECONDS)
        .build();
    return new OAuthCredentialRenewer(HttpUrl.get(tokenUrl), clientId, clientSecret,
        FutureOkHttpClient.create(okHttpClient));
  }

  @Override
  public RenewedCredential renew(String refreshToken) throws CredentialRenewalException {
    if (refreshToken == null || refreshToken.isEmpty()) {
      throw new CredentialRenewalException("No refresh token", Kind.PERMANENT, 0);
    }

    final Request request = FutureOkHttpClient.forForm(tokenUrl, ImmutableMap.of(
        "grant_type", "refresh_token",
        "refresh_token", refreshToken,
        "client_id", clientId,
        "client_secret", clientSecret));

    final Response response;
    try {
      response = client.send(request).toCompletableFuture().join();
    } catch (CompletionException e) {
      throw new CredentialRenewalException("Token request failed: " + e.getCause().getMessage(),
          Kind.NETWORK, 0, e.getCause());
    }

    try (ResponseBody body = response.body()) {
      final String content = body == null ? "" : body.string();
      if (response.isSuccessful()) {
        return parse(content, response.code());
      }
      throw classify(response.code(), content);
    } catch (IOException e) {
      throw new CredentialRenewalException("Failed to read token response: " + e.getMessage(),
          Kind.NETWORK, response.code(), e);
    }
  }

  private static RenewedCredential parse(String content, int code)
      throws CredentialRenewalException {
    final RenewedCredential renewed;
    try {
      renewed = Json.OBJECT_MAPPER.readValue(content, RenewedCredential.class);
    } catch (IOException e) {
      throw new CredentialRenewalException("Malformed token response", Kind.SERVER, code, e);
    }
    if (renewed.accessToken() == null || renewed.accessToken().isEmpty()) {
      throw new CredentialRenewalException("Token response has no access token", Kind.SERVER, code);
    }
    return renewed;
  }

  static CredentialRenewalException classify(int code, String content) {
    final String error = errorCode(content);
    final String message = "Token endpoint returned " + code + (error.isEmpty() ? "" : " " + error);
    if (code == 429) {
      return new CredentialRenewalException(message, Kind.RATE_LIMIT, code);
    }
    if (code >= 500) {
      return new CredentialRenewalException(message, Kind.SERVER, code);
    }
    LOG.debug("Token endpoint rejected refresh token: {}", message);
    return new CredentialRenewalException(message, Kind.PERMANENT, code);
  }

  /**
   * The OAuth {@code error} field of an error response, e.g. {@code invalid_grant}.
   */
  private static String errorCode(String content) {
    try {
      final JsonNode node = Json.OBJECT_MAPPER.readTree(content);
      return node != null && node.hasNonNull("error") ? node.get("error").asText() : "";
    } catch (IOException e) {
      return "";
    }
  }

  @Override
  public void close() {
    client.close();
  }
}
