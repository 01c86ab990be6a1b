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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.spotify.sluice.auth.CredentialRenewalException.Kind;
import com.spotify.sluice.gateway.FutureOkHttpClient;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(JUnitParamsRunner.class)
public class OAuthCredentialRenewerTest {

  @Rule public final MockWebServer tokenServer = new MockWebServer();

  private OAuthCredentialRenewer renewer;

  @Before
  public void setUp() {
    renewer = new OAuthCredentialRenewer(tokenServer.url("/auth/o2/token"), "client-1", "secret-1",
        FutureOkHttpClient.create(new OkHttpClient.Builder()
            .readTimeout(1, TimeUnit.SECONDS)
            .build()));
  }

  @After
  public void tearDown() {
    renewer.close();
  }

  @Test
  public void shouldRenewWithRefreshTokenGrant() throws Exception {
    tokenServer.enqueue(new MockResponse()
        .setHeader("Content-Type", "application/json")
        .setBody("{\"access_token\":\"access-2\",\"token_type\":\"bearer\",\"expires_in\":3600}"));

    final RenewedCredential renewed = renewer.renew("refresh-1");

    assertThat(renewed.accessToken(), is("access-2"));
    assertThat(renewed.refreshToken(), is(Optional.empty()));
    assertThat(renewed.expiresIn(), is(3600L));

    final RecordedRequest request = tokenServer.takeRequest();
    assertThat(request.getMethod(), is("POST"));
    assertThat(request.getHeader("Content-Type"), containsString("application/x-www-form-urlencoded"));
    final String form = request.getBody().readUtf8();
    assertThat(form, containsString("grant_type=refresh_token"));
    assertThat(form, containsString("refresh_token=refresh-1"));
    assertThat(form, containsString("client_id=client-1"));
    assertThat(form, containsString("client_secret=secret-1"));
  }

  @Test
  public void shouldReturnRotatedRefreshToken() throws Exception {
    tokenServer.enqueue(new MockResponse().setBody(
        "{\"access_token\":\"access-2\",\"refresh_token\":\"refresh-2\",\"expires_in\":3600}"));

    assertThat(renewer.renew("refresh-1").refreshToken(), is(Optional.of("refresh-2")));
  }

  @Test
  @Parameters({
      "400, PERMANENT",
      "401, PERMANENT",
      "403, PERMANENT",
      "429, RATE_LIMIT",
      "500, SERVER",
      "503, SERVER",
  })
  public void shouldClassifyErrorResponses(int code, Kind kind) {
    tokenServer.enqueue(new MockResponse().setResponseCode(code));

    final CredentialRenewalException e =
        assertThrows(CredentialRenewalException.class, () -> renewer.renew("refresh-1"));

    assertThat(e.kind(), is(kind));
    assertThat(e.code(), is(code));
  }

  @Test
  public void shouldIncludeOAuthErrorCode() {
    tokenServer.enqueue(new MockResponse().setResponseCode(400)
        .setBody("{\"error\":\"invalid_grant\",\"error_description\":\"expired\"}"));

    final CredentialRenewalException e =
        assertThrows(CredentialRenewalException.class, () -> renewer.renew("refresh-1"));

    assertThat(e.isPermanent(), is(true));
    assertThat(e.getMessage(), containsString("invalid_grant"));
  }

  @Test
  public void shouldTreatMissingRefreshTokenAsPermanent() {
    final CredentialRenewalException e =
        assertThrows(CredentialRenewalException.class, () -> renewer.renew(""));

    assertThat(e.kind(), is(Kind.PERMANENT));
    assertThat(tokenServer.getRequestCount(), is(0));
  }

  @Test
  public void shouldClassifyConnectionFailureAsNetwork() throws IOException {
    tokenServer.shutdown();

    final CredentialRenewalException e =
        assertThrows(CredentialRenewalException.class, () -> renewer.renew("refresh-1"));

    assertThat(e.kind(), is(Kind.NETWORK));
  }

  @Test
  public void shouldNotRenderTokensInToString() {
    final RenewedCredential renewed =
        RenewedCredential.create("access-2", Optional.of("refresh-2"), 3600);

    assertThat(renewed.toString().contains("access-2"), is(false));
    assertThat(renewed.toString().contains("refresh-2"), is(false));
  }
}
