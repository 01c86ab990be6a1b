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

import java.util.Locale;

/**
 * Execution state as reported by the query gateway.
 */
public enum GatewayState {
  PENDING,
  RUNNING,
  SUCCESS,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCESS || this == FAILED || this == CANCELLED;
  }

  /**
   * Map a gateway status string. Unknown values are treated as still running so that the
   * execution keeps being polled.
   */
  public static GatewayState parse(String status) {
    if (status == null) {
      return RUNNING;
    }
    switch (status.trim().toUpperCase(Locale.ROOT)) {
      case "PENDING":
      case "QUEUED":
        return PENDING;
      case "RUNNING":
        return RUNNING;
      case "SUCCEEDED":
      case "COMPLETED":
        return SUCCESS;
      case "FAILED":
        return FAILED;
      case "CANCELLED":
        return CANCELLED;
      default:
        return RUNNING;
    }
  }
}
