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

import com.spotify.sluice.model.QueryDefinition;
import java.util.Map;

/**
 * The external, asynchronous query execution platform. All calls are authenticated with a
 * principal's access token and throw {@link GatewayException} on failure.
 */
public interface QueryGateway {

  /**
   * Submit a query for execution.
   *
   * @return the gateway's id of the new execution
   */
  String submitQuery(String accessToken, QueryDefinition query, Map<String, String> parameters);

  GatewayStatus pollStatus(String accessToken, String instanceId, String externalId);

  /**
   * Best-effort cancellation of a running execution.
   */
  void cancel(String accessToken, String instanceId, String externalId);

  /**
   * Download the results of a successful execution.
   *
   * @throws DataException if the result data is malformed
   */
  ExecutionResults fetchResults(String accessToken, String instanceId, String externalId);
}
