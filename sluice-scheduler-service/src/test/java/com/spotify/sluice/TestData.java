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

package com.spotify.sluice;

import com.spotify.sluice.crypto.SecretCipher;
import com.spotify.sluice.model.Credential;
import com.spotify.sluice.model.QueryDefinition;
import com.spotify.sluice.model.WarehouseConfig;
import java.time.Duration;
import java.time.Instant;

public final class TestData {

  public static final String PRINCIPAL = "principal-1";

  public static final SecretCipher CIPHER =
      SecretCipher.fromBase64Key("AAECAwQFBgcICQoLDA0ODxAREhMUFRYXGBkaGxwdHh8=");

  public static final QueryDefinition QUERY = QueryDefinition.newBuilder()
      .queryId("weekly-sales")
      .instanceId("instance-1")
      .sql("SELECT * FROM sales WHERE day BETWEEN '{{start_date}}' AND '{{end_date}}'")
      .build();

  private TestData() {
    throw new UnsupportedOperationException();
  }

  public static Credential validCredential(Instant now) {
    return Credential.newBuilder()
        .principalId(PRINCIPAL)
        .encryptedAccessToken(CIPHER.encrypt("access-token"))
        .encryptedRefreshToken(CIPHER.encrypt("refresh-token"))
        .expiresAt(now.plus(Duration.ofHours(1)))
        .build();
  }

  public static WarehouseConfig warehouseConfig(boolean active) {
    return WarehouseConfig.newBuilder()
        .principalId(PRINCIPAL)
        .account("acme-eu")
        .user("loader")
        .encryptedPassword(CIPHER.encrypt("hunter2"))
        .warehouse("COMPUTE_WH")
        .database("ANALYTICS")
        .schema("REPORTS")
        .active(active)
        .build();
  }
}
