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

package com.spotify.sluice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * OAuth credentials of a principal. Both secrets are stored encrypted; only the token refresh
 * service decrypts them.
 */
@AutoValue
public abstract class Credential {

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract String encryptedAccessToken();

  @JsonProperty
  public abstract Optional<String> encryptedRefreshToken();

  @JsonProperty
  public abstract Instant expiresAt();

  @JsonProperty
  public abstract Optional<Instant> lastRefreshed();

  /**
   * Set when the refresh token was rejected. Cleared only by onboarding the principal again.
   */
  @JsonProperty
  public abstract boolean reauthenticationRequired();

  public boolean isValidFor(Duration window, Instant now) {
    return expiresAt().isAfter(now.plus(window));
  }

  public static Builder newBuilder() {
    return new AutoValue_Credential.Builder()
        .reauthenticationRequired(false);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static Credential create(
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("encrypted_access_token") String encryptedAccessToken,
      @JsonProperty("encrypted_refresh_token") Optional<String> encryptedRefreshToken,
      @JsonProperty("expires_at") Instant expiresAt,
      @JsonProperty("last_refreshed") Optional<Instant> lastRefreshed,
      @JsonProperty("reauthentication_required") boolean reauthenticationRequired) {
    return newBuilder()
        .principalId(principalId)
        .encryptedAccessToken(encryptedAccessToken)
        .encryptedRefreshToken(encryptedRefreshToken)
        .expiresAt(expiresAt)
        .lastRefreshed(lastRefreshed)
        .reauthenticationRequired(reauthenticationRequired)
        .build();
  }

  @Override
  public String toString() {
    return "Credential{principalId=" + principalId()
           + ", expiresAt=" + expiresAt()
           + ", reauthenticationRequired=" + reauthenticationRequired() + "}";
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder principalId(String principalId);

    public abstract Builder encryptedAccessToken(String encryptedAccessToken);

    public abstract Builder encryptedRefreshToken(String encryptedRefreshToken);

    public abstract Builder encryptedRefreshToken(Optional<String> encryptedRefreshToken);

    public abstract Builder expiresAt(Instant expiresAt);

    public abstract Builder lastRefreshed(Instant lastRefreshed);

    public abstract Builder lastRefreshed(Optional<Instant> lastRefreshed);

    public abstract Builder reauthenticationRequired(boolean reauthenticationRequired);

    public abstract Credential build();
  }
}
