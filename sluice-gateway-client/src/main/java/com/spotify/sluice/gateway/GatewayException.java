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

/**
 * A failed call to the query gateway. A code of {@code 0} means no HTTP response was received.
 */
public class GatewayException extends RuntimeException {

  public static final int NO_RESPONSE = 0;

  private final int code;
  private final String requestId;

  public GatewayException(String message, int code, String requestId) {
    super(message);
    this.code = code;
    this.requestId = requestId;
  }

  public GatewayException(String message, int code, String requestId, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.requestId = requestId;
  }

  public int getCode() {
    return code;
  }

  public String getRequestId() {
    return requestId;
  }

  /**
   * Rate limiting, server errors and network failures are worth retrying; any other response is
   * not.
   */
  public boolean isRetryable() {
    return code == NO_RESPONSE || code == 429 || code / 100 == 5;
  }

  @Override
  public String getMessage() {
    final String message = super.getMessage();
    return requestId == null || message.contains(requestId)
        ? message
        : message + " (Request ID: " + requestId + ")";
  }
}
