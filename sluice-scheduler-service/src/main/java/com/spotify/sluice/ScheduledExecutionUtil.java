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

import static com.spotify.sluice.util.GuardedRunnable.runGuarded;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic scheduling of the scheduler's tick loops.
 */
public final class ScheduledExecutionUtil {

  private static final Logger LOG = LoggerFactory.getLogger(ScheduledExecutionUtil.class);

  static final double JITTER = 0.5;

  private ScheduledExecutionUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Run {@code tick} repeatedly with randomized pauses averaging {@code interval}. The next run is
   * scheduled only after the previous one finished, so a slow tick never overlaps itself. A
   * failing tick does not stop the loop; shutting down the executor does.
   */
  public static void scheduleWithJitter(Runnable tick, ScheduledExecutorService exec,
                                        Duration interval) {
    try {
      exec.schedule(() -> {
        runGuarded(tick);
        scheduleWithJitter(tick, exec, interval);
      }, jitteredDelay(interval).toMillis(), MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOG.debug("Executor is shut down, no longer scheduling {}", tick);
    }
  }

  /**
   * A delay drawn uniformly from {@code interval * [1 - JITTER, 1 + JITTER)}.
   */
  @VisibleForTesting
  static Duration jitteredDelay(Duration interval) {
    final double factor = ThreadLocalRandom.current().nextDouble(1.0 - JITTER, 1.0 + JITTER);
    return Duration.ofMillis((long) (factor * interval.toMillis()));
  }
}
