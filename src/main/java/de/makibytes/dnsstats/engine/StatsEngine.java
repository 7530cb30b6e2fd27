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
package de.makibytes.dnsstats.engine;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.dnsstats.model.Entry;
import de.makibytes.dnsstats.model.NameCount;
import de.makibytes.dnsstats.model.StatsReport;
import de.makibytes.dnsstats.store.Retention;
import de.makibytes.dnsstats.store.Unit;
import de.makibytes.dnsstats.store.UnitDatabase;
import de.makibytes.dnsstats.store.UnitIdGenerator;
import de.makibytes.dnsstats.store.UnitRecord;
import de.makibytes.dnsstats.store.UnitTransaction;

/**
 * Collects per-query statistics into hourly units, persists completed units and
 * answers aggregate queries over the retention window.
 * <p>
 * Lock order is {@code databaseLock} before {@code currentLock}. The current unit
 * lock is only ever held for in-memory work. The database lock is held shared for
 * the duration of a transaction and exclusively only to swap or close the handle.
 */
public class StatsEngine implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(StatsEngine.class);

    private static final Duration IDLE_SLEEP = Duration.ofSeconds(1);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    enum State {
        NEW,
        RUNNING,
        STOPPED
    }

    record FlushStep(boolean proceed, Duration sleep) {
        static final FlushStep CATCH_UP = new FlushStep(true, Duration.ZERO);
        static final FlushStep IDLE = new FlushStep(true, IDLE_SLEEP);
        static final FlushStep STOP = new FlushStep(false, Duration.ZERO);
    }

    private final Path databasePath;
    private final UnitIdGenerator unitIdGenerator;
    private final UnitDatabase.Opener databaseOpener;
    private final UnitDatabase.Remover databaseRemover;
    private final Predicate<List<String>> shouldCountClient;
    private final Runnable configModified;
    private final boolean anonymizeClientIp;

    private final ReentrantReadWriteLock currentLock = new ReentrantReadWriteLock();
    private Unit current;
    private final List<Unit> unflushed = new ArrayList<>();

    private final ReentrantReadWriteLock databaseLock = new ReentrantReadWriteLock();
    private UnitDatabase database;
    // bumped by clear() under both locks; units taken before a clear are discarded
    private volatile long generation;

    private volatile int retentionDays;
    private volatile IgnoredDomains ignoredDomains = IgnoredDomains.none();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile ExecutorService flushExecutor;

    public StatsEngine(StatsEngineConfig config) throws IOException {
        this.databasePath = config.getDatabasePath();
        this.unitIdGenerator = config.getUnitIdGenerator();
        this.databaseOpener = config.getDatabaseOpener();
        this.databaseRemover = config.getDatabaseRemover();
        this.shouldCountClient = config.getShouldCountClient();
        this.configModified = config.getConfigModified();
        this.anonymizeClientIp = config.isAnonymizeClientIp();

        int days = config.getRetentionDays();
        if (!Retention.checkInterval(days)) {
            logger.warn("Unsupported statistics interval of {} days, using {} day instead", days, Retention.DEFAULT_DAYS);
            days = Retention.DEFAULT_DAYS;
        }
        this.retentionDays = days;

        try {
            this.ignoredDomains = IgnoredDomains.of(config.getIgnoredDomains());
            initialize();
        } catch (RuntimeException ex) {
            closeDatabaseAfterFailure(ex);
            throw new IOException("initializing statistics: " + ex.getMessage(), ex);
        } catch (IOException ex) {
            closeDatabaseAfterFailure(ex);
            throw ex;
        }
        logger.debug("Statistics initialized, current unit {}", current.getId());
    }

    private void initialize() throws IOException {
        UnitDatabase db = databaseOpener.open(databasePath);
        database = db;

        long id = unitIdGenerator.currentId();
        UnitRecord stored;
        try (UnitTransaction tx = db.begin()) {
            int deleted = tx.evictBefore(firstKeptId(id, getRetentionHours()));
            stored = tx.load(id);
            if (deleted > 0) {
                logger.debug("Deleted {} expired units", deleted);
                tx.commit();
            } else {
                tx.rollback();
            }
        }
        current = stored == null ? new Unit(id) : Unit.deserialize(id, stored);
    }

    private void closeDatabaseAfterFailure(Exception cause) {
        UnitDatabase db = database;
        database = null;
        if (db == null) {
            return;
        }
        try {
            db.close();
        } catch (IOException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }

    /**
     * Starts the background flush loop.
     */
    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("statistics engine is " + state.get());
        }
        flushExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "stats-flush");
            thread.setDaemon(true);
            return thread;
        });
        flushExecutor.submit(this::periodicFlush);
        logger.info("Statistics collection started, retention {} days", retentionDays);
    }

    /**
     * Counts one processed query. Invalid entries are dropped; this method never
     * fails and never touches the database.
     */
    public void update(Entry entry) {
        if (retentionDays == 0) {
            return;
        }
        if (entry == null || !entry.isValid()) {
            logger.debug("Dropping invalid statistics entry: {}", entry);
            return;
        }
        String client = ClientAddresses.normalize(entry.getClient(), anonymizeClientIp);

        currentLock.writeLock().lock();
        try {
            if (current == null) {
                logger.debug("No current unit, dropping statistics entry");
                return;
            }
            current.add(entry.getResult(), entry.getDomain(), client, entry.getProcessingTimeMs());
        } finally {
            currentLock.writeLock().unlock();
        }
    }

    /**
     * Returns true if a query for {@code host} from a client known by {@code clientIds}
     * should be counted at all.
     */
    public boolean shouldCount(String host, List<String> clientIds) {
        if (!shouldCountClient.test(clientIds)) {
            return false;
        }
        return !ignoredDomains.isIgnored(host);
    }

    private void periodicFlush() {
        while (state.get() == State.RUNNING) {
            FlushStep step;
            try {
                step = flush();
            } catch (RuntimeException ex) {
                logger.error("Statistics flush failed: {}", ex.getMessage(), ex);
                step = FlushStep.IDLE;
            }
            if (!step.proceed()) {
                break;
            }
            if (!step.sleep().isZero()) {
                try {
                    Thread.sleep(step.sleep().toMillis());
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        logger.debug("Periodic flushing finished");
    }

    /**
     * One iteration of the flush loop: when the unit id for "now" differs from the
     * current unit, the current unit is swapped for a fresh one, persisted, and the
     * units that fell out of the retention window are deleted.
     */
    FlushStep flush() {
        long id = unitIdGenerator.currentId();
        int hours = getRetentionHours();
        List<Unit> toPersist;
        long takenGeneration;

        currentLock.writeLock().lock();
        try {
            if (current == null) {
                return FlushStep.STOP;
            }
            if (hours == 0) {
                return FlushStep.IDLE;
            }
            boolean rolledOver = current.getId() != id;
            if (rolledOver) {
                logger.debug("Unit {} is complete, starting unit {}", current.getId(), id);
                unflushed.add(current);
                current = new Unit(id);
            }
            dropExpiredUnflushed(firstKeptId(id, hours));
            // a rollover always needs an eviction pass, even with nothing left to write
            if (unflushed.isEmpty() && !rolledOver) {
                return FlushStep.IDLE;
            }
            toPersist = List.copyOf(unflushed);
            takenGeneration = generation;
        } finally {
            currentLock.writeLock().unlock();
        }

        if (!ensureDatabase() || !persist(toPersist, id, hours, takenGeneration)) {
            return FlushStep.IDLE;
        }

        currentLock.writeLock().lock();
        try {
            unflushed.removeAll(toPersist);
        } finally {
            currentLock.writeLock().unlock();
        }
        return FlushStep.CATCH_UP;
    }

    private boolean persist(List<Unit> units, long currentId, int hours, long takenGeneration) {
        long firstKeptId = firstKeptId(currentId, hours);
        databaseLock.readLock().lock();
        try {
            if (takenGeneration != generation) {
                logger.debug("Statistics were cleared, discarding {} units", units.size());
                return true;
            }
            UnitDatabase db = database;
            if (db == null) {
                return false;
            }
            try (UnitTransaction tx = db.begin()) {
                for (Unit unit : units) {
                    if (unit.getId() < firstKeptId) {
                        logger.debug("Unit {} expired before it was flushed", unit.getId());
                        continue;
                    }
                    tx.store(unit.getId(), unit.serialize());
                    logger.debug("Flushed unit {}", unit.getId());
                }
                int deleted = tx.evictBefore(firstKeptId);
                if (deleted == 0) {
                    logger.debug("No unit to delete before {}", firstKeptId);
                }
                tx.commit();
                return true;
            } catch (IOException ex) {
                logger.error("Failed to flush statistics units: {}", ex.getMessage(), ex);
                return false;
            }
        } finally {
            databaseLock.readLock().unlock();
        }
    }

    // caller holds the currentLock write lock
    private void dropExpiredUnflushed(long firstKeptId) {
        Iterator<Unit> it = unflushed.iterator();
        while (it.hasNext()) {
            Unit unit = it.next();
            if (unit.getId() < firstKeptId) {
                logger.debug("Unit {} expired before it was flushed", unit.getId());
                it.remove();
            }
        }
    }

    /**
     * Reopens the database if an earlier clear left no handle behind.
     *
     * @return false if there is still no usable database
     */
    private boolean ensureDatabase() {
        databaseLock.readLock().lock();
        try {
            if (database != null) {
                return true;
            }
        } finally {
            databaseLock.readLock().unlock();
        }
        databaseLock.writeLock().lock();
        try {
            if (database != null) {
                return true;
            }
            if (state.get() == State.STOPPED) {
                return false;
            }
            database = databaseOpener.open(databasePath);
            logger.info("Statistics database reopened");
            return true;
        } catch (IOException ex) {
            logger.error("Failed to reopen statistics database {}: {}", databasePath, ex.getMessage());
            return false;
        } finally {
            databaseLock.writeLock().unlock();
        }
    }

    private static long firstKeptId(long currentId, int hours) {
        return currentId - hours + 1;
    }

    /**
     * Stops the flush loop, persists the current unit and closes the database.
     */
    @Override
    public void close() throws IOException {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        stopFlushLoop();

        databaseLock.writeLock().lock();
        try {
            List<Unit> toPersist = new ArrayList<>();
            currentLock.writeLock().lock();
            try {
                toPersist.addAll(unflushed);
                if (current != null) {
                    toPersist.add(current);
                }
                unflushed.clear();
                current = null;
            } finally {
                currentLock.writeLock().unlock();
            }

            UnitDatabase db = database;
            database = null;
            if (db == null) {
                return;
            }
            try {
                int hours = getRetentionHours();
                if (hours != 0) {
                    long firstKeptId = firstKeptId(unitIdGenerator.currentId(), hours);
                    try (UnitTransaction tx = db.begin()) {
                        for (Unit unit : toPersist) {
                            if (unit.getId() >= firstKeptId) {
                                tx.store(unit.getId(), unit.serialize());
                            }
                        }
                        tx.evictBefore(firstKeptId);
                        tx.commit();
                    }
                }
            } finally {
                db.close();
            }
        } finally {
            databaseLock.writeLock().unlock();
        }
        logger.info("Statistics collection stopped");
    }

    private void stopFlushLoop() {
        if (flushExecutor == null) {
            return;
        }
        flushExecutor.shutdownNow();
        try {
            if (!flushExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Statistics flush loop did not stop within {} seconds", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Drops all collected statistics: the database is closed, its files deleted and
     * an empty one opened, and the current unit restarts empty.
     *
     * @throws IOException if the old database could not be removed or a new one
     *         could not be opened; a database that was reopened stays usable
     */
    public void clear() throws IOException {
        if (state.get() == State.STOPPED) {
            throw new IllegalStateException("statistics engine is stopped");
        }
        databaseLock.writeLock().lock();
        try {
            UnitDatabase db = database;
            database = null;
            resetUnits();
            if (db != null) {
                db.close();
            }
            IOException removeFailure = null;
            try {
                databaseRemover.remove(databasePath);
            } catch (IOException ex) {
                logger.error("Failed to remove statistics database {}: {}", databasePath, ex.getMessage());
                removeFailure = ex;
            }
            database = databaseOpener.open(databasePath);
            if (removeFailure != null) {
                throw new IOException("removing statistics database " + databasePath + ": "
                        + removeFailure.getMessage(), removeFailure);
            }
        } finally {
            databaseLock.writeLock().unlock();
        }
        logger.info("Statistics cleared");
    }

    private void resetUnits() {
        currentLock.writeLock().lock();
        try {
            current = new Unit(unitIdGenerator.currentId());
            unflushed.clear();
            generation++;
        } finally {
            currentLock.writeLock().unlock();
        }
    }

    /**
     * Sets the retention in days. Zero disables collection and clears all data.
     *
     * @throws IllegalArgumentException if {@code days} is not an allowed retention
     * @throws IOException if disabling failed to clear the database; the new
     *         retention is in effect regardless
     */
    public void setRetention(int days) throws IOException {
        if (!Retention.checkInterval(days)) {
            throw new IllegalArgumentException("unsupported statistics interval: " + days + " days");
        }
        retentionDays = days;
        try {
            if (days == 0) {
                logger.info("Statistics disabled");
                clear();
            } else {
                logger.info("Statistics retention set to {} days", days);
            }
        } finally {
            configModified.run();
        }
    }

    public void setIgnoredDomains(List<String> patterns) {
        ignoredDomains = IgnoredDomains.of(patterns);
        configModified.run();
    }

    /**
     * Validates the whole configuration before applying any of it.
     */
    public void applyConfig(StatsConfigView config) throws IOException {
        if (!Retention.checkInterval(config.intervalDays())) {
            throw new IllegalArgumentException("unsupported statistics interval: " + config.intervalDays() + " days");
        }
        IgnoredDomains ignored = IgnoredDomains.of(config.ignored());
        ignoredDomains = ignored;
        setRetention(config.intervalDays());
    }

    public StatsConfigView getConfig() {
        return new StatsConfigView(retentionDays, ignoredDomains.getPatterns());
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public int getRetentionHours() {
        return Retention.toHours(retentionDays);
    }

    /**
     * Loads the records of the last {@code hours} units, oldest first, with the
     * current unit last. Missing units are substituted with empty records.
     *
     * @return empty if the database cannot be read
     */
    Optional<UnitWindow> loadWindow(int hours) {
        if (state.get() != State.STOPPED && !ensureDatabase()) {
            return Optional.empty();
        }
        long curId;
        UnitRecord currentRecord;
        Map<Long, UnitRecord> pending = new HashMap<>();
        currentLock.readLock().lock();
        try {
            curId = current != null ? current.getId() : unitIdGenerator.currentId();
            currentRecord = current != null ? current.serialize() : UnitRecord.empty();
            long windowStart = curId - hours + 1;
            for (Unit unit : unflushed) {
                if (unit.getId() >= windowStart && unit.getId() < curId) {
                    pending.put(unit.getId(), unit.serialize());
                }
            }
        } finally {
            currentLock.readLock().unlock();
        }

        long firstId = curId - hours + 1;
        List<UnitRecord> records = new ArrayList<>(hours);
        databaseLock.readLock().lock();
        try {
            UnitDatabase db = database;
            if (db == null) {
                return Optional.empty();
            }
            try (UnitTransaction tx = db.begin()) {
                for (long id = firstId; id < curId; id++) {
                    UnitRecord record = pending.get(id);
                    if (record == null && id >= 0) {
                        record = tx.load(id);
                    }
                    records.add(record == null ? UnitRecord.empty() : record);
                }
                tx.rollback();
            } catch (IOException ex) {
                logger.error("Failed to load statistics units: {}", ex.getMessage(), ex);
                return Optional.empty();
            }
        } finally {
            databaseLock.readLock().unlock();
        }
        records.add(currentRecord);

        if (records.size() != hours) {
            throw new IllegalStateException("loaded " + records.size() + " units when the desired number is " + hours);
        }
        return Optional.of(new UnitWindow(records, firstId));
    }

    public Optional<StatsReport> getReport() {
        return getReport(getRetentionHours());
    }

    /**
     * Builds the report over the last {@code hours} units.
     *
     * @return empty only if the database cannot be read
     */
    public Optional<StatsReport> getReport(int hours) {
        if (retentionDays == 0 || hours <= 0) {
            return Optional.of(StatsReport.empty());
        }
        IgnoredDomains ignored = ignoredDomains;
        return loadWindow(hours).map(window -> StatsAggregator.buildReport(window, hours, ignored::isIgnored));
    }

    /**
     * Returns up to {@code limit} client addresses with the most queries in the
     * retention window. Clients that are not IP addresses are skipped.
     */
    public List<InetAddress> topClients(int limit) {
        int hours = getRetentionHours();
        if (hours == 0 || limit <= 0) {
            return List.of();
        }
        Optional<UnitWindow> window = loadWindow(hours);
        if (window.isEmpty()) {
            return List.of();
        }
        List<NameCount> top = StatsAggregator.collectTopN(window.get().records(), limit, UnitRecord::clients, null);
        List<InetAddress> addresses = new ArrayList<>(top.size());
        for (NameCount pair : top) {
            ClientAddresses.parse(pair.name()).ifPresent(addresses::add);
        }
        return addresses;
    }

    int getUnflushedCount() {
        currentLock.readLock().lock();
        try {
            return unflushed.size();
        } finally {
            currentLock.readLock().unlock();
        }
    }

    State getState() {
        return state.get();
    }
}
