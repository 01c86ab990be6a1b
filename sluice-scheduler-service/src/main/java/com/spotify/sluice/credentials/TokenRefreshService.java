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

import static com.google.common.base.CaseFormat.LOWER_UNDERSCORE;
import static com.google.common.base.CaseFormat.UPPER_CAMEL;
import static com.spotify.sluice.util.GuardedRunnable.guard;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.spotify.sluice.auth.CredentialRenewalException;
import com.spotify.sluice.auth.CredentialRenewer;
import com.spotify.sluice.auth.RenewedCredential;
import com.spotify.sluice.crypto.SecretCipher;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.monitoring.Stats;
import com.spotify.sluice.storage.Storage;
import com.spotify.sluice.util.ConfigurationException;
import com.spotify.sluice.util.RetryUtil;
import com.spotify.sluice.util.Sleeper;
import com.spotify.sluice.util.Time;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the OAuth credentials of principals valid. This is the only component that decrypts
 * credential secrets.
 *
 * <p>Renewal failures are classified: a rejected refresh token marks the credential as requiring
 * reauthentication and is never retried. Server and network failures are retried up to three times
 * after 5s, 10s and 20s, rate limiting after 10s, 20s and 40s. A renewal that still fails after
 * {@value #MAX_ATTEMPTS} calls surfaces as {@link CredentialUnavailableException}.
 */
public class TokenRefreshService {

  private static final Logger LOG = LoggerFactory.getLogger(TokenRefreshService.class);

  private static final String TICK_TYPE = UPPER_CAMEL.to(LOWER_UNDERSCORE,
      TokenRefreshService.class.getSimpleName());

  public static final Duration DEFAULT_VALIDITY_WINDOW = Duration.ofMinutes(10);
  // the first call and three retries
  static final int MAX_ATTEMPTS = 4;

  private static final RetryUtil SERVER_BACKOFF = new RetryUtil(Duration.ofSeconds(5), 2);
  private static final RetryUtil RATE_LIMIT_BACKOFF = new RetryUtil(Duration.ofSeconds(10), 2);

  private final Storage storage;
  private final CredentialRenewer renewer;
  private final SecretCipher cipher;
  private final Time time;
  private final Sleeper sleeper;
  private final Duration validityWindow;
  private final Stats stats;

  private final Striped<Lock> principalLocks = Striped.lazyWeakLock(64);

  public TokenRefreshService(Storage storage, CredentialRenewer renewer, SecretCipher cipher,
                             Time time, Duration validityWindow, Stats stats) {
    this(storage, renewer, cipher, time, Sleeper.DEFAULT, validityWindow, stats);
  }

  @VisibleForTesting
  TokenRefreshService(Storage storage, CredentialRenewer renewer, SecretCipher cipher, Time time,
                      Sleeper sleeper, Duration validityWindow, Stats stats) {
    this.storage = Objects.requireNonNull(storage);
    this.renewer = Objects.requireNonNull(renewer);
    this.cipher = Objects.requireNonNull(cipher);
    this.time = Objects.requireNonNull(time);
    this.sleeper = Objects.requireNonNull(sleeper);
    this.validityWindow = Objects.requireNonNull(validityWindow);
    this.stats = Objects.requireNonNull(stats);
  }

  /**
   * Get a credential that stays valid for at least the validity window, refreshing it first if
   * needed.
   *
   * @throws ConfigurationException        if the principal has no credential
   * @throws PermanentCredentialException  if the principal must authenticate again
   * @throws CredentialUnavailableException if the token endpoint is unavailable
   */
  public Credential ensureValid(String principalId) throws IOException {
    final Credential credential = readCredential(principalId);
    if (!credential.reauthenticationRequired()
        && credential.isValidFor(validityWindow, time.get())) {
      return credential;
    }

    final Lock lock = principalLocks.get(principalId);
    lock.lock();
    try {
      // another thread may have refreshed while we waited
      final Credential current = readCredential(principalId);
      if (current.reauthenticationRequired()) {
        throw new PermanentCredentialException(principalId,
            "Principal " + principalId + " must authenticate again");
      }
      if (current.isValidFor(validityWindow, time.get())) {
        return current;
      }
      return refresh(current);
    } finally {
      lock.unlock();
    }
  }

  /**
   * The plaintext access token of a principal, valid for at least the validity window.
   */
  public String accessToken(String principalId) throws IOException {
    return cipher.decrypt(ensureValid(principalId).encryptedAccessToken());
  }

  /**
   * Refresh every credential that expires within the validity window. Credentials that require
   * reauthentication are skipped; each refresh fails in isolation.
   */
  public void sweep() {
    final Instant t0 = time.get();

    final List<Credential> expiring;
    try {
      expiring = storage.credentialsExpiringBefore(t0.plus(validityWindow));
    } catch (IOException e) {
      LOG.warn("Failed to list expiring credentials, skipping this sweep", e);
      return;
    }

    expiring.stream()
        .filter(credential -> !credential.reauthenticationRequired())
        .forEach(credential -> guard(() -> sweep(credential.principalId())).run());

    stats.recordTickDuration(TICK_TYPE, t0.until(time.get(), ChronoUnit.MILLIS));
  }

  private void sweep(String principalId) {
    try {
      ensureValid(principalId);
    } catch (PermanentCredentialException e) {
      LOG.warn("Credential of {} requires reauthentication: {}", principalId, e.getMessage());
    } catch (CredentialUnavailableException e) {
      LOG.warn("Could not refresh credential of {}, will retry: {}", principalId, e.getMessage());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private Credential refresh(Credential credential) throws IOException {
    final String principalId = credential.principalId();
    final Optional<String> refreshToken = credential.encryptedRefreshToken().map(cipher::decrypt);
    if (refreshToken.isEmpty()) {
      markReauthenticationRequired(principalId);
      throw new PermanentCredentialException(principalId,
          "Principal " + principalId + " has no refresh token");
    }

    final RenewedCredential renewed = renew(principalId, refreshToken.get());
    final Instant now = time.get();
    final Credential refreshed = credential.toBuilder()
        .encryptedAccessToken(cipher.encrypt(renewed.accessToken()))
        .encryptedRefreshToken(renewed.refreshToken().map(cipher::encrypt)
            .or(credential::encryptedRefreshToken))
        .expiresAt(now.plusSeconds(renewed.expiresIn()))
        .lastRefreshed(now)
        .build();

    final Credential stored = storage.runInTransactionWithRetries(tx -> {
      final Optional<Credential> current = tx.credential(principalId);
      if (current.isPresent() && !current.get().equals(credential)
          && current.get().isValidFor(validityWindow, now)) {
        LOG.debug("Credential of {} was refreshed concurrently", principalId);
        return current.get();
      }
      tx.store(refreshed);
      return refreshed;
    });

    LOG.info("Refreshed credential of {}, expires at {}", principalId, stored.expiresAt());
    stats.recordCredentialRefresh("success");
    return stored;
  }

  private RenewedCredential renew(String principalId, String refreshToken) throws IOException {
    for (int attempt = 1; ; attempt++) {
      try {
        return renewer.renew(refreshToken);
      } catch (CredentialRenewalException e) {
        if (e.isPermanent()) {
          stats.recordCredentialRefresh("permanent");
          markReauthenticationRequired(principalId);
          throw new PermanentCredentialException(principalId,
              "Refresh token of " + principalId + " was rejected: " + e.getMessage(), e);
        }
        if (attempt >= MAX_ATTEMPTS) {
          stats.recordCredentialRefresh("unavailable");
          throw new CredentialUnavailableException(
              "Failed to refresh credential of " + principalId + " after " + attempt
              + " attempts: " + e.getMessage(), e);
        }
        final Duration delay = backoff(e.kind()).calculateDelay(attempt);
        LOG.warn("Credential refresh attempt {} of {} failed ({}), retrying in {}",
            attempt, principalId, e.kind(), delay);
        sleep(principalId, delay, e);
      }
    }
  }

  private void sleep(String principalId, Duration delay, CredentialRenewalException cause) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CredentialUnavailableException(
          "Interrupted while refreshing credential of " + principalId, cause);
    }
  }

  private static RetryUtil backoff(CredentialRenewalException.Kind kind) {
    return kind == CredentialRenewalException.Kind.RATE_LIMIT ? RATE_LIMIT_BACKOFF : SERVER_BACKOFF;
  }

  private void markReauthenticationRequired(String principalId) throws IOException {
    storage.runInTransactionWithRetries(tx -> {
      final Optional<Credential> credential = tx.credential(principalId);
      if (credential.isPresent()) {
        tx.store(credential.get().toBuilder().reauthenticationRequired(true).build());
      }
      return null;
    });
    LOG.info("Marked credential of {} as requiring reauthentication", principalId);
  }

  private Credential readCredential(String principalId) throws IOException {
    return storage.credential(principalId).orElseThrow(() ->
        new ConfigurationException("No credential stored for principal " + principalId));
  }
}
