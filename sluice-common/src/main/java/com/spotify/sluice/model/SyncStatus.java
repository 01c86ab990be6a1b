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

/**
 * Status of a {@link WarehouseSyncState}. {@link #UPLOADED} and {@link #SKIPPED} are final;
 * {@link #FAILED} is retried automatically until the attempt budget is spent.
 */
public enum SyncStatus {
  PENDING,
  UPLOADING,
  UPLOADED,
  FAILED,
  SKIPPED
}
