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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link Runnable} wrapper that logs and swallows any {@link Throwable} thrown by the delegate.
 * Used for periodic ticks and per-entity work so that one failure never cancels a scheduled task
 * or aborts sibling entities.
 */
public final class GuardedRunnable implements Runnable {

  private static final Logger LOG = LoggerFactory.getLogger(GuardedRunnable.class);

  private final Runnable delegate;

  private GuardedRunnable(Runnable delegate) {
    this.delegate = delegate;
  }

  public static Runnable guard(Runnable delegate) {
    return new GuardedRunnable(delegate);
  }

  public static void runGuarded(Runnable delegate) {
    guard(delegate).run();
  }

  @Override
  public void run() {
    try {
      delegate.run();
    } catch (Throwable t) {
      LOG.warn("Guarded runnable threw", t);
    }
  }
}
