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

package com.spotify.sluice.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.time.Duration;
import org.junit.Test;

public class RetryUtilTest {

  @Test
  public void shouldDoubleDelayPerTry() {
    final RetryUtil retryUtil = new RetryUtil(Duration.ofMinutes(1), 10);

    assertThat(retryUtil.calculateDelay(1), is(Duration.ofMinutes(1)));
    assertThat(retryUtil.calculateDelay(2), is(Duration.ofMinutes(2)));
    assertThat(retryUtil.calculateDelay(3), is(Duration.ofMinutes(4)));
  }

  @Test
  public void shouldCapExponent() {
    final RetryUtil retryUtil = new RetryUtil(Duration.ofSeconds(5), 2);

    assertThat(retryUtil.calculateDelay(3), is(Duration.ofSeconds(20)));
    assertThat(retryUtil.calculateDelay(10), is(Duration.ofSeconds(20)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void shouldRejectZeroTries() {
    new RetryUtil(Duration.ofSeconds(1), 1).calculateDelay(0);
  }
}
