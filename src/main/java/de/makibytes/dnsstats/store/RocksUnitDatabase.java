/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.dnsstats.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import org.rocksdb.Options;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UnitDatabase} backed by an embedded RocksDB {@link TransactionDB}. Keys are
 * produced by {@link UnitKeys}; RocksDB's default bytewise comparator keeps them in
 * chronological order.
 */
public class RocksUnitDatabase implements UnitDatabase {
    private static final Logger logger = LoggerFactory.getLogger(RocksUnitDatabase.class);

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;
    private final Options options;
    private final TransactionDBOptions transactionDbOptions;
    private final TransactionDB db;
    private final WriteOptions writeOptions;
    private final UnitRecordCodec codec = new UnitRecordCodec();

    private RocksUnitDatabase(Path path, Options options, TransactionDBOptions transactionDbOptions, TransactionDB db) {
        this.path = path;
        this.options = options;
        this.transactionDbOptions = transactionDbOptions;
        this.db = db;
        this.writeOptions = new WriteOptions();
    }

    public static RocksUnitDatabase open(Path path) throws IOException {
        logger.debug("Opening statistics database {}", path);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Options options = new Options().setCreateIfMissing(true);
        TransactionDBOptions transactionDbOptions = new TransactionDBOptions();
        try {
            TransactionDB db = TransactionDB.open(options, transactionDbOptions, path.toString());
            logger.debug("Statistics database opened");
            return new RocksUnitDatabase(path, options, transactionDbOptions, db);
        } catch (RocksDBException ex) {
            transactionDbOptions.close();
            options.close();
            if (ex.getMessage() != null && ex.getMessage().contains("Invalid argument")) {
                logger.error("The statistics database cannot be opened at {}, the file system may not support it: {}",
                        path, ex.getMessage());
            }
            throw new IOException("opening statistics database " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public UnitTransaction begin() {
        return new RocksUnitTransaction(db.beginTransaction(writeOptions));
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        writeOptions.close();
        db.close();
        transactionDbOptions.close();
        options.close();
        logger.debug("Statistics database closed");
    }

    private class RocksUnitTransaction implements UnitTransaction {

        private final Transaction transaction;
        private final ReadOptions readOptions = new ReadOptions();
        private boolean finished;

        RocksUnitTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public UnitRecord load(long id) throws IOException {
            byte[] value;
            try {
                value = transaction.get(readOptions, UnitKeys.idToKey(id));
            } catch (RocksDBException ex) {
                throw new IOException("loading unit " + id + ": " + ex.getMessage(), ex);
            }
            if (value == null) {
                return null;
            }
            try {
                return codec.decode(value);
            } catch (IOException ex) {
                logger.error("Failed to decode unit {}: {}", id, ex.getMessage());
                return null;
            }
        }

        @Override
        public void store(long id, UnitRecord record) throws IOException {
            try {
                transaction.put(UnitKeys.idToKey(id), codec.encode(record));
            } catch (RocksDBException ex) {
                throw new IOException("storing unit " + id + ": " + ex.getMessage(), ex);
            }
        }

        @Override
        public int evictBefore(long firstKeptId) throws IOException {
            List<byte[]> expired = new ArrayList<>();
            try (RocksIterator it = transaction.getIterator(readOptions)) {
                for (it.seekToFirst(); it.isValid(); it.next()) {
                    byte[] key = it.key();
                    OptionalLong id = UnitKeys.keyToId(key);
                    if (id.isPresent() && id.getAsLong() >= firstKeptId) {
                        break;
                    }
                    expired.add(key);
                }
                it.status();
                for (byte[] key : expired) {
                    transaction.delete(key);
                    OptionalLong id = UnitKeys.keyToId(key);
                    if (id.isPresent()) {
                        logger.debug("Deleted unit {}", id.getAsLong());
                    } else {
                        logger.debug("Deleted foreign entry with a {}-byte key", key.length);
                    }
                }
            } catch (RocksDBException ex) {
                throw new IOException("evicting units before " + firstKeptId + ": " + ex.getMessage(), ex);
            }
            return expired.size();
        }

        @Override
        public void commit() throws IOException {
            try {
                transaction.commit();
                finished = true;
            } catch (RocksDBException ex) {
                throw new IOException("committing transaction: " + ex.getMessage(), ex);
            }
        }

        @Override
        public void rollback() throws IOException {
            try {
                transaction.rollback();
                finished = true;
            } catch (RocksDBException ex) {
                throw new IOException("rolling back transaction: " + ex.getMessage(), ex);
            }
        }

        @Override
        public void close() {
            try {
                if (!finished) {
                    rollback();
                }
            } catch (IOException ex) {
                logger.warn("Failed to roll back transaction: {}", ex.getMessage());
            } finally {
                readOptions.close();
                transaction.close();
            }
        }
    }
}
