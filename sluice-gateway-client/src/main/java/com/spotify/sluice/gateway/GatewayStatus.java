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

import com.google.auto.value.AutoValue;
import java.util.Optional;

@AutoValue
public abstract class GatewayStatus {

  public abstract GatewayState state();

  public abstract Optional<String> resultLocation();

  public abstract Optional<String> error();

  public static GatewayStatus create(GatewayState state, Optional<String> resultLocation,
      Optional<String> error) {
    return new AutoValue_GatewayStatus(state, resultLocation, error);
  }

  public static GatewayStatus of(GatewayState state) {
    return create(state, Optional.empty(), Optional.empty());
  }
}
