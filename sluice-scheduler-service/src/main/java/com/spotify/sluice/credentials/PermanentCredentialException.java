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

/**
 * The principal must authenticate again. Never retried.
 */
public class PermanentCredentialException extends RuntimeException {

  private final String principalId;

  public PermanentCredentialException(String principalId, String message) {
    super(message);
    this.principalId = principalId;
  }

  public PermanentCredentialException(String principalId, String message, Throwable cause) {
    super(message, cause);
    this.principalId = principalId;
  }

  public String principalId() {
    return principalId;
  }
}
