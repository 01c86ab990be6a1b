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

package com.spotify.sluice.credentials;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.spotify.sluice.TestData;
import com.spotify.sluice.auth.CredentialRenewalException;
import com.spotify.sluice.auth.CredentialRenewalException.Kind;
import com.spotify.sluice.auth.CredentialRenewer;
import com.spotify.sluice.auth.RenewedCredential;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.InMemStorage;
import com.spotify.sluice.util.ConfigurationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

@RunWith(MockitoJUnitRunner.class)
public class TokenRefreshServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
  private static final String PRINCIPAL = TestData.PRINCIPAL;

  private final InMemStorage storage = new InMemStorage();
  private final List<Duration> sleeps = new ArrayList<>();

  @Mock private CredentialRenewer renewer;
  @Mock private Stats stats;

  private TokenRefreshService service;

  @Before
  public void setUp() {
    service = new TokenRefreshService(storage, renewer, TestData.CIPHER, () -> NOW, sleeps::add,
        Duration.ofMinutes(10), stats);
  }

  @Test
  public void shouldReturnValidCredentialWithoutRenewal() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(30)));

    assertThat(service.accessToken(PRINCIPAL), is("access-token"));

    verify(renewer, never()).renew(anyString());
  }

  @Test
  public void shouldRenewCredentialExpiringWithinWindow() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew("refresh-token")).thenReturn(
        RenewedCredential.create("new-access-token", Optional.of("new-refresh-token"), 3600));

    assertThat(service.accessToken(PRINCIPAL), is("new-access-token"));

    var stored = storage.credential(PRINCIPAL).orElseThrow();
    assertThat(stored.expiresAt(), is(NOW.plusSeconds(3600)));
    assertThat(stored.lastRefreshed(), is(Optional.of(NOW)));
    assertThat(TestData.CIPHER.decrypt(stored.encryptedRefreshToken().orElseThrow()),
        is("new-refresh-token"));
    verify(stats).recordCredentialRefresh("success");
  }

  @Test
  public void shouldKeepRefreshTokenWhenNoneIsReturned() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew("refresh-token")).thenReturn(
        RenewedCredential.create("new-access-token", Optional.empty(), 3600));

    service.ensureValid(PRINCIPAL);

    var stored = storage.credential(PRINCIPAL).orElseThrow();
    assertThat(TestData.CIPHER.decrypt(stored.encryptedRefreshToken().orElseThrow()),
        is("refresh-token"));
  }

  @Test
  public void shouldRequireReauthenticationAfterRejectedRefreshToken() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew(anyString())).thenThrow(
        new CredentialRenewalException("invalid_grant", Kind.PERMANENT, 401));

    assertThrows(PermanentCredentialException.class, () -> service.ensureValid(PRINCIPAL));

    verify(renewer, times(1)).renew(anyString());
    assertThat(sleeps, is(empty()));
    assertThat(storage.credential(PRINCIPAL).orElseThrow().reauthenticationRequired(), is(true));
  }

  @Test
  public void shouldNotRenewCredentialRequiringReauthentication() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)).toBuilder()
        .reauthenticationRequired(true)
        .build());

    assertThrows(PermanentCredentialException.class, () -> service.ensureValid(PRINCIPAL));

    verify(renewer, never()).renew(anyString());
  }

  @Test
  public void shouldGiveUpAfterThreeRetriesOfServerErrors() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew(anyString())).thenThrow(
        new CredentialRenewalException("Service Unavailable", Kind.SERVER, 503));

    assertThrows(CredentialUnavailableException.class, () -> service.ensureValid(PRINCIPAL));

    verify(renewer, times(4)).renew(anyString());
    assertThat(sleeps, contains(Duration.ofSeconds(5), Duration.ofSeconds(10),
        Duration.ofSeconds(20)));
    assertThat(storage.credential(PRINCIPAL).orElseThrow().reauthenticationRequired(),
        is(false));
    verify(stats).recordCredentialRefresh("unavailable");
  }

  @Test
  public void shouldBackOffLongerWhenRateLimited() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew(anyString()))
        .thenThrow(new CredentialRenewalException("Too Many Requests", Kind.RATE_LIMIT, 429))
        .thenThrow(new CredentialRenewalException("Too Many Requests", Kind.RATE_LIMIT, 429))
        .thenThrow(new CredentialRenewalException("Too Many Requests", Kind.RATE_LIMIT, 429))
        .thenReturn(RenewedCredential.create("new-access-token", Optional.empty(), 3600));

    assertThat(service.accessToken(PRINCIPAL), is("new-access-token"));

    assertThat(sleeps, contains(Duration.ofSeconds(10), Duration.ofSeconds(20),
        Duration.ofSeconds(40)));
  }

  @Test
  public void shouldRecoverFromNetworkError() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    when(renewer.renew(anyString()))
        .thenThrow(new CredentialRenewalException("timeout", Kind.NETWORK, 0))
        .thenReturn(RenewedCredential.create("new-access-token", Optional.empty(), 3600));

    assertThat(service.accessToken(PRINCIPAL), is("new-access-token"));

    assertThat(sleeps, contains(Duration.ofSeconds(5)));
  }

  @Test
  public void shouldRequireReauthenticationWithoutRefreshToken() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)).toBuilder()
        .encryptedRefreshToken(Optional.empty())
        .build());

    assertThrows(PermanentCredentialException.class, () -> service.ensureValid(PRINCIPAL));

    assertThat(storage.credential(PRINCIPAL).orElseThrow().reauthenticationRequired(), is(true));
  }

  @Test
  public void shouldRejectPrincipalWithoutCredential() {
    assertThrows(ConfigurationException.class, () -> service.ensureValid("unknown"));
  }

  @Test
  public void shouldSweepExpiringCredentialsInIsolation() throws Exception {
    storage.store(expiringIn(Duration.ofMinutes(5)));
    storage.store(expiringIn(Duration.ofMinutes(5)).toBuilder()
        .principalId("principal-2")
        .encryptedRefreshToken(TestData.CIPHER.encrypt("other-refresh-token"))
        .build());
    storage.store(expiringIn(Duration.ofMinutes(5)).toBuilder()
        .principalId("principal-3")
        .reauthenticationRequired(true)
        .build());
    when(renewer.renew("refresh-token")).thenThrow(
        new CredentialRenewalException("invalid_grant", Kind.PERMANENT, 400));
    when(renewer.renew("other-refresh-token")).thenReturn(
        RenewedCredential.create("new-access-token", Optional.empty(), 3600));

    service.sweep();

    assertThat(storage.credential(PRINCIPAL).orElseThrow().reauthenticationRequired(), is(true));
    assertThat(storage.credential("principal-2").orElseThrow().expiresAt(),
        is(NOW.plusSeconds(3600)));
    verify(renewer, times(2)).renew(anyString());
  }

  private static Credential expiringIn(Duration duration) {
    return TestData.validCredential(NOW).toBuilder()
        .expiresAt(NOW.plus(duration))
        .build();
  }
}
