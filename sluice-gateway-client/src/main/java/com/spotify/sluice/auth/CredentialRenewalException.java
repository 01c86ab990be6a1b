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

import java.util.Objects;

/**
 * A failed credential renewal, classified by how the caller should react to it.
 */
public class CredentialRenewalException extends Exception {

  public enum Kind {
    /** The refresh material was rejected. Retrying cannot help. */
    PERMANENT,
    /** The token endpoint failed with a server error. */
    SERVER,
    /** The token endpoint is rate limiting us. */
    RATE_LIMIT,
    /** No response was received. */
    NETWORK
  }

  private final Kind kind;
  private final int code;

  public CredentialRenewalException(String message, Kind kind, int code) {
    super(message);
    this.kind = Objects.requireNonNull(kind);
    this.code = code;
  }

  public CredentialRenewalException(String message, Kind kind, int code, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind);
    this.code = code;
  }

  public Kind kind() {
    return kind;
  }

  /**
   * The HTTP status code, or {@code 0} if no response was received.
   */
  public int code() {
    return code;
  }

  public boolean isPermanent() {
    return kind == Kind.PERMANENT;
  }
}
