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

package com.spotify.sluice.storage;

import com.google.cloud.datastore.DatastoreException;
import java.io.IOException;

public class TransactionException extends IOException {

  // ABORTED
  private static final int CONFLICT_CODE = 10;

  private final boolean conflict;

  public TransactionException(DatastoreException cause) {
    super(cause.getMessage()
          + ", code=" + cause.getCode()
          + ", reason=" + cause.getReason()
          + ", isRetryable=" + cause.isRetryable(),
        cause);
    this.conflict = cause.getCode() == CONFLICT_CODE || "ABORTED".equals(cause.getReason());
  }

  public TransactionException(String message, boolean conflict) {
    super(message);
    this.conflict = conflict;
  }

  public boolean isConflict() {
    return conflict;
  }
}
