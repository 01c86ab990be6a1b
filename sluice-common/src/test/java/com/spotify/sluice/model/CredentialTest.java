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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.time.Duration;
import java.time.Instant;
import org.junit.Test;

public class CredentialTest {

  private static final Instant NOW = Instant.parse("2024-01-16T14:00:00Z");

  private static final Credential CREDENTIAL = Credential.newBuilder()
      .principalId("principal-1")
      .encryptedAccessToken("ENC-ACCESS")
      .encryptedRefreshToken("ENC-REFRESH")
      .expiresAt(NOW.plus(Duration.ofMinutes(15)))
      .build();

  @Test
  public void shouldBeValidOutsideWindow() {
    assertThat(CREDENTIAL.isValidFor(Duration.ofMinutes(10), NOW), is(true));
  }

  @Test
  public void shouldNotBeValidInsideWindow() {
    assertThat(CREDENTIAL.isValidFor(Duration.ofMinutes(10), NOW.plus(Duration.ofMinutes(6))),
        is(false));
  }

  @Test
  public void shouldNotRenderSecrets() {
    assertThat(CREDENTIAL.toString(), not(containsString("ENC-ACCESS")));
    assertThat(CREDENTIAL.toString(), not(containsString("ENC-REFRESH")));
    assertThat(CREDENTIAL.toString(), containsString("principal-1"));
  }
}
