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

import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreException;
import com.google.cloud.datastore.DatastoreReaderWriter;
import com.google.cloud.datastore.Entity;
import com.google.cloud.datastore.FullEntity;
import com.google.cloud.datastore.Key;
import com.google.cloud.datastore.KeyFactory;
import com.google.cloud.datastore.Query;
import com.google.cloud.datastore.Transaction;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Wrappers for {@link Datastore} and {@link Transaction} that translate unchecked
 * {@link DatastoreException}s to checked {@link DatastoreIOException}s.
 */
class CheckedDatastore {

  private final Datastore datastore;
  private final ReaderWriter readerWriter;

  CheckedDatastore(Datastore datastore) {
    this.datastore = Objects.requireNonNull(datastore);
    this.readerWriter = new ReaderWriter(datastore);
  }

  KeyFactory newKeyFactory() {
    return datastore.newKeyFactory();
  }

  Optional<Entity> get(Key key) throws IOException {
    return readerWriter.get(key);
  }

  Entity put(FullEntity<?> entity) throws IOException {
    return readerWriter.put(entity);
  }

  <T> List<T> query(Query<T> query) throws IOException {
    return readerWriter.query(query);
  }

  CheckedTransaction newTransaction() throws DatastoreIOException {
    try {
      return new CheckedTransaction(this, datastore.newTransaction());
    } catch (DatastoreException e) {
      throw new DatastoreIOException(e);
    }
  }

  static class ReaderWriter {

    private final DatastoreReaderWriter rw;

    ReaderWriter(DatastoreReaderWriter rw) {
      this.rw = Objects.requireNonNull(rw);
    }

    Optional<Entity> get(Key key) throws IOException {
      return Optional.ofNullable(call(() -> rw.get(key)));
    }

    Entity put(FullEntity<?> entity) throws IOException {
      return call(() -> rw.put(entity));
    }

    /**
     * Only use this method if the results are small enough that gathering them in list is
     * acceptable.
     */
    <T> List<T> query(Query<T> query) throws IOException {
      return call(() -> ImmutableList.copyOf(rw.run(query)));
    }
  }

  static class CheckedTransaction extends ReaderWriter {

    private final CheckedDatastore datastore;
    private final Transaction tx;

    CheckedTransaction(CheckedDatastore datastore, Transaction tx) {
      super(tx);
      this.datastore = Objects.requireNonNull(datastore);
      this.tx = Objects.requireNonNull(tx);
    }

    void commit() throws DatastoreIOException {
      try {
        tx.commit();
      } catch (DatastoreException e) {
        throw new DatastoreIOException(e);
      }
    }

    void rollback() throws DatastoreIOException {
      try {
        tx.rollback();
      } catch (DatastoreException e) {
        throw new DatastoreIOException(e);
      }
    }

    boolean isActive() {
      return tx.isActive();
    }

    KeyFactory newKeyFactory() {
      return datastore.newKeyFactory();
    }
  }

  /**
   * Invokes a {@link Supplier} and translates {@link DatastoreException} to a checked exception.
   */
  static <T> T call(Supplier<T> f) throws IOException {
    try {
      return f.get();
    } catch (DatastoreException e) {
      throw new DatastoreIOException(e);
    }
  }
}
