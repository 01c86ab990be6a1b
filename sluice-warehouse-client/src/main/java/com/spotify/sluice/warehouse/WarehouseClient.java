/*-
 * -\-\-
 * Spotify Sluice Warehouse Client
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

package com.spotify.sluice.warehouse;

import java.util.List;

/**
 * A principal's analytical data warehouse.
 */
public interface WarehouseClient {

  /**
   * Run a trivial query.
   *
   * @return the warehouse version
   */
  String testConnection() throws WarehouseException;

  /**
   * Create the table if it does not exist. An existing table is left untouched.
   */
  void ensureTable(String table, List<WarehouseColumn> columns, List<String> primaryKey)
      throws WarehouseException;

  /**
   * Atomically write the rows of one execution, creating the table if needed. Writing the same
   * rows again leaves the table unchanged.
   *
   * @return the number of rows written
   */
  long upsert(UpsertRequest request) throws WarehouseException;
}
