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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import java.util.Optional;

/**
 * Connection settings of the warehouse a principal replicates results into.
 */
@AutoValue
public abstract class WarehouseConfig {

  @JsonProperty
  public abstract String principalId();

  @JsonProperty
  public abstract String account();

  @JsonProperty
  public abstract String user();

  @JsonProperty
  public abstract String encryptedPassword();

  @JsonProperty
  public abstract String warehouse();

  @JsonProperty
  public abstract String database();

  @JsonProperty
  public abstract String schema();

  @JsonProperty
  public abstract Optional<String> role();

  @JsonProperty
  public abstract boolean active();

  public static Builder newBuilder() {
    return new AutoValue_WarehouseConfig.Builder()
        .active(true);
  }

  public abstract Builder toBuilder();

  @JsonCreator
  public static WarehouseConfig create(
      @JsonProperty("principal_id") String principalId,
      @JsonProperty("account") String account,
      @JsonProperty("user") String user,
      @JsonProperty("encrypted_password") String encryptedPassword,
      @JsonProperty("warehouse") String warehouse,
      @JsonProperty("database") String database,
      @JsonProperty("schema") String schema,
      @JsonProperty("role") Optional<String> role,
      @JsonProperty("active") boolean active) {
    return newBuilder()
        .principalId(principalId)
        .account(account)
        .user(user)
        .encryptedPassword(encryptedPassword)
        .warehouse(warehouse)
        .database(database)
        .schema(schema)
        .role(role)
        .active(active)
        .build();
  }

  @Override
  public String toString() {
    return "WarehouseConfig{principalId=" + principalId()
           + ", account=" + account()
           + ", database=" + database()
           + ", schema=" + schema()
           + ", active=" + active() + "}";
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder principalId(String principalId);

    public abstract Builder account(String account);

    public abstract Builder user(String user);

    public abstract Builder encryptedPassword(String encryptedPassword);

    public abstract Builder warehouse(String warehouse);

    public abstract Builder database(String database);

    public abstract Builder schema(String schema);

    public abstract Builder role(String role);

    public abstract Builder role(Optional<String> role);

    public abstract Builder active(boolean active);

    public abstract WarehouseConfig build();
  }
}
