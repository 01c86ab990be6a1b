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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * A token endpoint response. The refresh token is only present when the endpoint rotated it.
 */
@AutoValue
public abstract class RenewedCredential {

  @JsonProperty
  public abstract String accessToken();

  @JsonProperty
  public abstract Optional<String> refreshToken();

  @JsonProperty
  public abstract long expiresIn();

  @JsonCreator
  public static RenewedCredential create(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("refresh_token") Optional<String> refreshToken,
      @JsonProperty("expires_in") long expiresIn) {
    return new AutoValue_RenewedCredential(accessToken, refreshToken, expiresIn);
  }

  @Override
  public String toString() {
    return "RenewedCredential{expiresIn=" + expiresIn() + "}";
  }
}
