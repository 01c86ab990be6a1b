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

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Objects;

/**
 * Utility for calculating exponential backoff. The delay after the n:th failed try is
 * {@code baseDelay * 2^(n-1)}, with the exponent capped at {@code maxExponent}.
 */
public class RetryUtil {

  private final Duration baseDelay;
  private final int maxExponent;

  public RetryUtil(Duration baseDelay, int maxExponent) {
    Preconditions.checkArgument(maxExponent >= 0, "maxExponent must be non-negative");
    this.baseDelay = Objects.requireNonNull(baseDelay);
    this.maxExponent = maxExponent;
  }

  public Duration calculateDelay(int tries) {
    Preconditions.checkArgument(tries > 0, "tries must be positive");
    final int exponent = Math.min(tries - 1, maxExponent);
    return baseDelay.multipliedBy(1L << exponent);
  }

  public Duration baseDelay() {
    return baseDelay;
  }
}
