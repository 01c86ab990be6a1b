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

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Helpers for reading optional values from a {@link Config}.
 */
public final class ConfigUtil {

  private ConfigUtil() {
    throw new UnsupportedOperationException();
  }

  /**
   * Get a string with a default.
   */
  public static String getString(Config config, String path, String defaultValue) {
    return get(config, config::getString, path, defaultValue);
  }

  /**
   * Optionally get a string.
   */
  public static Optional<String> getString(Config config, String path) {
    return get(config, config::getString, path);
  }

  /**
   * Get a duration with a default.
   */
  public static Duration getDuration(Config config, String path, Duration defaultValue) {
    return get(config, config::getDuration, path, defaultValue);
  }

  /**
   * Get an int with a default.
   */
  public static int getInt(Config config, String path, int defaultValue) {
    return get(config, config::getInt, path, defaultValue);
  }

  /**
   * Get a value with a default.
   */
  public static <T> T get(Config config, Function<String, T> getter, String path, T defaultValue) {
    return get(config, getter, path).orElse(defaultValue);
  }

  /**
   * Optionally get a configuration value.
   */
  public static <T> Optional<T> get(Config config, Function<String, T> getter, String path) {
    if (!config.hasPath(path)) {
      return Optional.empty();
    }
    return Optional.of(getter.apply(path));
  }
}
