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

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.net.InetAddresses;

import de.makibytes.dnsstats.model.Entry;
import de.makibytes.dnsstats.model.Result;
import de.makibytes.dnsstats.model.StatsReport;
import de.makibytes.dnsstats.model.StatsTimeUnit;
import de.makibytes.dnsstats.store.InMemoryUnitDatabase;
import de.makibytes.dnsstats.store.UnitRecord;

@DisplayName("StatsEngine Tests")
class StatsEngineTest {

    private static final long START_ID = 490_000;

    @TempDir
    Path tempDir;

    private final AtomicLong clock = new AtomicLong(START_ID);
    private final AtomicReference<InMemoryUnitDatabase> database = new AtomicReference<>();
    private final AtomicInteger opened = new AtomicInteger();
    private StatsEngine engine;

    @BeforeEach
    void setUp() {
        clock.set(START_ID);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (engine != null) {
            engine.close();
        }
    }

    private StatsEngineConfig.Builder inMemory() {
        return StatsEngineConfig.builder(tempDir.resolve("stats.db"))
                .unitIdGenerator(clock::get)
                .databaseOpener(path -> {
                    InMemoryUnitDatabase db = new InMemoryUnitDatabase(path);
                    database.set(db);
                    opened.incrementAndGet();
                    return db;
                });
    }

    private static Entry entry(String client, String domain, Result result, long millis) {
        return new Entry(client, domain, result, Duration.ofMillis(millis));
    }

    private StatsReport report() {
        return engine.getReport().orElseThrow();
    }

    private void advanceAndFlush(long hours) {
        clock.addAndGet(hours);
        engine.flush();
    }

    @Test
    @DisplayName("one blocked and one allowed query are reported per domain and client")
    void reportsSingleUnit() throws IOException {
        engine = new StatsEngine(inMemory().build());

        engine.update(entry("127.0.0.1", "domain", Result.FILTERED, 0));
        engine.update(entry("127.0.0.1", "domain", Result.NOT_FILTERED, 0));
        StatsReport report = report();

        assertEquals(StatsTimeUnit.HOURS, report.timeUnits());
        assertEquals(2, report.numDnsQueries());
        assertEquals(1, report.numBlockedFiltering());
        assertEquals(List.of(Map.of("domain", 1L)), report.topQueried());
        assertEquals(List.of(Map.of("domain", 1L)), report.topBlocked());
        assertEquals(List.of(Map.of("127.0.0.1", 2L)), report.topClients());
        assertEquals(24, report.dnsQueries().size());
        assertEquals(2L, report.dnsQueries().get(23));
    }

    @Test
    @DisplayName("twelve hours of 1000 clients sum to 12000 queries")
    void reportsManyUnits() throws IOException {
        engine = new StatsEngine(inMemory().build());

        for (int hour = 0; hour < 12; hour++) {
            for (int i = 0; i < 1000; i++) {
                String client = "192.168." + (i / 256) + "." + (i % 256);
                engine.update(entry(client, "d" + (i % 10) + ".example", Result.NOT_FILTERED, 5));
            }
            advanceAndFlush(1);
        }
        StatsReport report = report();

        assertEquals(12_000, report.numDnsQueries());
        assertEquals(100, report.topClients().size());
        assertEquals(Map.of("192.168.0.0", 12L), report.topClients().get(0));
        assertEquals(List.of(Map.of("d0.example", 1200L)), report.topQueried().subList(0, 1));
        assertEquals(0.005, report.avgProcessingTime(), 1e-9);
        assertEquals(12, database.get().size());
    }

    @Test
    @DisplayName("disabled statistics report zeros in days")
    void disabledReportsZeros() throws IOException {
        engine = new StatsEngine(inMemory().build());
        engine.setRetention(0);

        engine.update(entry("127.0.0.1", "domain", Result.FILTERED, 3));
        engine.update(entry("127.0.0.1", "domain", Result.NOT_FILTERED, 3));
        StatsReport report = report();

        assertEquals(StatsReport.empty(), report);
        assertEquals(StatsTimeUnit.DAYS, report.timeUnits());
        assertEquals(StatsEngine.FlushStep.IDLE, engine.flush());
    }

    @Test
    @DisplayName("flush: persists a completed unit once, then idles")
    void flushSteps() throws IOException {
        engine = new StatsEngine(inMemory().build());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));

        assertEquals(StatsEngine.FlushStep.IDLE, engine.flush());
        assertEquals(0, database.get().size());

        clock.incrementAndGet();
        assertEquals(StatsEngine.FlushStep.CATCH_UP, engine.flush());
        assertEquals(StatsEngine.FlushStep.IDLE, engine.flush());
        UnitRecord stored = database.get().get(START_ID);
        assertNotNull(stored);
        assertEquals(1, stored.total());
    }

    @Test
    @DisplayName("flush: units older than the retention window are deleted")
    void evictsExpiredUnits() throws IOException {
        engine = new StatsEngine(inMemory().build());

        for (int hour = 0; hour < 40; hour++) {
            engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
            advanceAndFlush(1);
            long firstKept = clock.get() - 23;
            for (long id : database.get().ids()) {
                assertTrue(id >= firstKept, "unit " + id + " is older than " + firstKept);
            }
        }
        assertEquals(23, database.get().size());
        assertEquals(23, report().numDnsQueries());
    }

    @Test
    @DisplayName("flush: a jump of several days leaves no expired unit behind")
    void evictsAfterLongPause() throws IOException {
        engine = new StatsEngine(inMemory().build());
        for (int hour = 0; hour < 10; hour++) {
            engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
            advanceAndFlush(1);
        }
        assertEquals(10, database.get().size());

        advanceAndFlush(100);

        assertEquals(0, database.get().size());
        assertEquals(0, report().numDnsQueries());
    }

    @Test
    @DisplayName("startup deletes units that expired while stopped")
    void startupEviction() throws IOException {
        InMemoryUnitDatabase db = new InMemoryUnitDatabase(tempDir.resolve("stats.db"));
        db.put(START_ID - 30, UnitRecord.empty());
        db.put(START_ID - 24, UnitRecord.empty());
        db.put(START_ID - 23, UnitRecord.empty());
        db.put(START_ID - 1, UnitRecord.empty());

        engine = new StatsEngine(StatsEngineConfig.builder(db.getPath())
                .unitIdGenerator(clock::get)
                .databaseOpener(path -> db)
                .build());

        assertEquals(Set.of(START_ID - 23, START_ID - 1), db.ids());
    }

    @Test
    @DisplayName("failed commits keep units for the next flush, reports still include them")
    void failedFlushIsRetried() throws IOException {
        engine = new StatsEngine(inMemory().build());
        InMemoryUnitDatabase db = database.get();
        engine.update(entry("10.0.0.1", "a.example", Result.FILTERED, 1));
        db.setFailCommits(true);

        clock.incrementAndGet();
        assertEquals(StatsEngine.FlushStep.IDLE, engine.flush());
        assertEquals(0, db.size());
        assertEquals(1, report().numDnsQueries());
        assertEquals(1, report().numBlockedFiltering());

        db.setFailCommits(false);
        assertEquals(StatsEngine.FlushStep.CATCH_UP, engine.flush());
        assertEquals(1, db.get(START_ID).total());
        assertEquals(1, report().numDnsQueries());
    }

    @Test
    @DisplayName("units that expire while their flush keeps failing are dropped")
    void expiredUnflushedUnitsAreDropped() throws IOException {
        engine = new StatsEngine(inMemory().build());
        InMemoryUnitDatabase db = database.get();
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        db.setFailCommits(true);
        advanceAndFlush(1);
        engine.update(entry("10.0.0.1", "b.example", Result.NOT_FILTERED, 1));
        advanceAndFlush(30);

        db.setFailCommits(false);
        engine.flush();

        assertTrue(db.ids().isEmpty(), "stored " + db.ids());
    }

    @Test
    @DisplayName("restart reloads the current unit and completed units from disk")
    void restartReloads() throws IOException {
        Path path = tempDir.resolve("rocks").resolve("stats.db");
        StatsEngineConfig config = StatsEngineConfig.builder(path).unitIdGenerator(clock::get).build();

        engine = new StatsEngine(config);
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 4));
        advanceAndFlush(1);
        engine.update(entry("10.0.0.2", "b.example", Result.SAFE_BROWSING, 4));
        engine.close();

        engine = new StatsEngine(config);
        engine.update(entry("10.0.0.2", "c.example", Result.NOT_FILTERED, 4));
        StatsReport report = report();

        assertEquals(3, report.numDnsQueries());
        assertEquals(1, report.numReplacedSafebrowsing());
        assertEquals(2L, report.dnsQueries().get(23));
        assertEquals(1L, report.dnsQueries().get(22));
        assertEquals(0.004, report.avgProcessingTime(), 1e-9);
    }

    @Test
    @DisplayName("clear: drops all statistics and reopens an empty database")
    void clearDropsEverything() throws IOException {
        engine = new StatsEngine(inMemory().build());
        InMemoryUnitDatabase first = database.get();
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        advanceAndFlush(1);
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));

        engine.clear();

        assertTrue(first.isClosed());
        assertNotSame(first, database.get());
        assertEquals(2, opened.get());
        assertEquals(0, report().numDnsQueries());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        assertEquals(1, report().numDnsQueries());
    }

    @Test
    @DisplayName("clear: units waiting for a flush retry are dropped")
    void clearDiscardsPendingUnits() throws IOException {
        engine = new StatsEngine(inMemory().build());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        database.get().setFailCommits(true);
        advanceAndFlush(1);

        engine.clear();
        engine.flush();

        assertEquals(0, database.get().size());
        assertEquals(0, report().numDnsQueries());
    }

    @Test
    @DisplayName("setRetention: rejects unsupported intervals and notifies on change")
    void setRetention() throws IOException {
        AtomicInteger modified = new AtomicInteger();
        engine = new StatsEngine(inMemory().configModified(modified::incrementAndGet).build());

        assertThrows(IllegalArgumentException.class, () -> engine.setRetention(2));
        assertEquals(1, engine.getRetentionDays());
        assertEquals(0, modified.get());

        engine.setRetention(30);
        assertEquals(720, engine.getRetentionHours());
        assertEquals(1, modified.get());
        StatsReport report = report();
        assertEquals(StatsTimeUnit.DAYS, report.timeUnits());
        assertEquals(30, report.dnsQueries().size());

        engine.setRetention(7);
        assertEquals(StatsTimeUnit.HOURS, report().timeUnits());
        assertEquals(168, report().dnsQueries().size());
    }

    @Test
    @DisplayName("setRetention(0) clears the collected data")
    void disablingClears() throws IOException {
        engine = new StatsEngine(inMemory().build());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        advanceAndFlush(1);

        engine.setRetention(0);
        engine.setRetention(1);

        assertEquals(0, database.get().size());
        assertEquals(0, report().numDnsQueries());
    }

    @Test
    @DisplayName("an unsupported configured interval falls back to one day")
    void invalidConfiguredInterval() throws IOException {
        engine = new StatsEngine(inMemory().retentionDays(5).build());
        assertEquals(1, engine.getRetentionDays());
    }

    @Test
    @DisplayName("ignored domains are left out of the top tables and of shouldCount")
    void ignoredDomains() throws IOException {
        engine = new StatsEngine(inMemory()
                .ignoredDomains(List.of("*.tracker.example"))
                .shouldCountClient(ids -> !ids.contains("guest"))
                .build());

        engine.update(entry("10.0.0.1", "a.tracker.example", Result.NOT_FILTERED, 1));
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        StatsReport report = report();

        assertEquals(2, report.numDnsQueries());
        assertEquals(List.of(Map.of("a.example", 1L)), report.topQueried());
        assertFalse(engine.shouldCount("x.tracker.example", List.of("10.0.0.1")));
        assertTrue(engine.shouldCount("tracker.example", List.of("10.0.0.1")));
        assertFalse(engine.shouldCount("a.example", List.of("guest", "10.0.0.9")));

        engine.setIgnoredDomains(List.of("a.example"));
        assertEquals(List.of(Map.of("a.tracker.example", 1L)), report().topQueried());
    }

    @Test
    @DisplayName("applyConfig: validates everything before applying anything")
    void applyConfig() throws IOException {
        engine = new StatsEngine(inMemory().build());

        assertThrows(IllegalArgumentException.class,
                () -> engine.applyConfig(new StatsConfigView(7, List.of("a.example", "a.example"))));
        assertThrows(IllegalArgumentException.class,
                () -> engine.applyConfig(new StatsConfigView(3, List.of("a.example"))));
        assertEquals(new StatsConfigView(1, List.of()), engine.getConfig());

        engine.applyConfig(new StatsConfigView(90, List.of("*.lan")));
        assertEquals(new StatsConfigView(90, List.of("*.lan")), engine.getConfig());
    }

    @Test
    @DisplayName("client addresses are normalized and optionally anonymized")
    void clientNormalization() throws IOException {
        engine = new StatsEngine(inMemory().anonymizeClientIp(true).build());

        engine.update(entry("192.168.12.34", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("192.168.99.1", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("2001:0db8::1234:5678", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("laptop", "a.example", Result.NOT_FILTERED, 1));
        List<Map<String, Long>> clients = report().topClients();

        assertEquals(List.of(Map.of("192.168.0.0", 2L), Map.of("2001:db8::1234:0", 1L), Map.of("laptop", 1L)),
                clients);
    }

    @Test
    @DisplayName("topClients: returns the busiest IP clients only")
    void topClients() throws IOException {
        engine = new StatsEngine(inMemory().build());
        for (int i = 0; i < 3; i++) {
            engine.update(entry("10.0.0.3", "a.example", Result.NOT_FILTERED, 1));
            engine.update(entry("laptop", "a.example", Result.NOT_FILTERED, 1));
        }
        engine.update(entry("::1", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("10.0.0.9", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("10.0.0.9", "a.example", Result.NOT_FILTERED, 1));

        List<InetAddress> top = engine.topClients(3);

        assertEquals(List.of(InetAddresses.forString("10.0.0.3"), InetAddresses.forString("10.0.0.9")), top);
        assertTrue(engine.topClients(0).isEmpty());
    }

    @Test
    @DisplayName("invalid entries are dropped")
    void invalidEntries() throws IOException {
        engine = new StatsEngine(inMemory().build());

        engine.update(null);
        engine.update(entry("", "a.example", Result.NOT_FILTERED, 1));
        engine.update(entry("10.0.0.1", "", Result.NOT_FILTERED, 1));
        engine.update(new Entry("10.0.0.1", "a.example", null, Duration.ZERO));

        assertEquals(0, report().numDnsQueries());
    }

    @Test
    @DisplayName("close: persists the current unit, closes the database and is idempotent")
    void closePersists() throws IOException {
        engine = new StatsEngine(inMemory().build());
        engine.start();
        assertEquals(StatsEngine.State.RUNNING, engine.getState());
        assertThrows(IllegalStateException.class, engine::start);
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));

        engine.close();
        engine.close();

        InMemoryUnitDatabase db = database.get();
        assertEquals(StatsEngine.State.STOPPED, engine.getState());
        assertTrue(db.isClosed());
        assertEquals(1, db.get(START_ID).total());
        assertThrows(IllegalStateException.class, engine::clear);
        assertTrue(engine.getReport().isEmpty());
    }

    @Test
    @DisplayName("close: nothing is written while statistics are disabled")
    void closeWhileDisabled() throws IOException {
        engine = new StatsEngine(inMemory().retentionDays(0).build());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));

        engine.close();

        assertNull(database.get().get(START_ID));
        assertEquals(0, database.get().getCommitCount());
    }

    @Test
    @DisplayName("constructor: database and configuration failures surface as IOException")
    void constructorFailures() {
        IOException openFailure = assertThrows(IOException.class, () -> new StatsEngine(
                StatsEngineConfig.builder(tempDir.resolve("stats.db"))
                        .databaseOpener(path -> {
                            throw new IOException("no space left");
                        })
                        .build()));
        assertEquals("no space left", openFailure.getMessage());

        IOException configFailure = assertThrows(IOException.class,
                () -> new StatsEngine(inMemory().ignoredDomains(List.of("*.")).build()));
        assertInstanceOf(IllegalArgumentException.class, configFailure.getCause());
        assertNull(database.get());
    }

    @Test
    @DisplayName("units that keep failing to flush never outgrow the retention window")
    void failingFlushBacklogIsBounded() throws IOException {
        engine = new StatsEngine(inMemory().build());
        InMemoryUnitDatabase db = database.get();
        db.setFailCommits(true);

        for (int hour = 0; hour < 200; hour++) {
            engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
            advanceAndFlush(1);
            assertTrue(engine.getUnflushedCount() < engine.getRetentionHours(),
                    "pending " + engine.getUnflushedCount() + " units after " + (hour + 1) + " hours");
        }
        assertEquals(23, engine.getUnflushedCount());
        assertEquals(23, report().numDnsQueries());

        db.setFailCommits(false);
        assertEquals(StatsEngine.FlushStep.CATCH_UP, engine.flush());
        assertEquals(0, engine.getUnflushedCount());
        assertEquals(23, db.size());
    }

    @Test
    @DisplayName("disabling reports a failed reopen and the engine recovers on the next use")
    void disableWithFailingReopen() throws IOException {
        AtomicInteger opens = new AtomicInteger();
        engine = new StatsEngine(inMemory()
                .databaseOpener(path -> {
                    if (opens.incrementAndGet() == 2) {
                        throw new IOException("cannot open " + path);
                    }
                    InMemoryUnitDatabase db = new InMemoryUnitDatabase(path);
                    database.set(db);
                    return db;
                })
                .build());

        assertThrows(IOException.class, () -> engine.setRetention(0));
        assertEquals(0, engine.getRetentionDays());
        engine.setRetention(1);

        assertTrue(engine.getReport().isPresent());
        assertEquals(3, opens.get());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        clock.incrementAndGet();
        assertEquals(StatsEngine.FlushStep.CATCH_UP, engine.flush());
        assertEquals(1, database.get().get(START_ID).total());
    }

    @Test
    @DisplayName("flush reopens the database when a clear left none behind")
    void flushReopensDatabase() throws IOException {
        AtomicInteger opens = new AtomicInteger();
        engine = new StatsEngine(inMemory()
                .databaseOpener(path -> {
                    if (opens.incrementAndGet() == 2) {
                        throw new IOException("cannot open " + path);
                    }
                    InMemoryUnitDatabase db = new InMemoryUnitDatabase(path);
                    database.set(db);
                    return db;
                })
                .build());
        assertThrows(IOException.class, engine::clear);

        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        clock.incrementAndGet();

        assertEquals(StatsEngine.FlushStep.CATCH_UP, engine.flush());
        assertEquals(3, opens.get());
        assertEquals(1, database.get().get(START_ID).total());
    }

    @Test
    @DisplayName("clear: a database that cannot be removed is reported to the caller")
    void clearReportsRemoveFailure() throws IOException {
        engine = new StatsEngine(inMemory()
                .databaseRemover(path -> {
                    throw new IOException("permission denied: " + path);
                })
                .build());
        InMemoryUnitDatabase first = database.get();
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));

        IOException failure = assertThrows(IOException.class, engine::clear);

        assertTrue(failure.getMessage().contains("permission denied"), failure.getMessage());
        assertTrue(first.isClosed());
        assertFalse(database.get().isClosed());
        assertTrue(engine.getReport().isPresent());
    }

    @Test
    @DisplayName("close: expired units are neither written nor kept")
    void closeDropsExpiredUnits() throws IOException {
        engine = new StatsEngine(inMemory().build());
        InMemoryUnitDatabase db = database.get();
        db.put(START_ID - 100, UnitRecord.empty());
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        db.setFailCommits(true);
        advanceAndFlush(1);
        engine.update(entry("10.0.0.1", "a.example", Result.NOT_FILTERED, 1));
        clock.addAndGet(30);
        db.setFailCommits(false);

        engine.close();

        assertTrue(db.ids().isEmpty(), "stored " + db.ids());
    }

    @Test
    @DisplayName("concurrent updates, flushes and reports lose no query")
    void concurrentUpdates() throws Exception {
        int threads = 8;
        int updatesPerThread = 2500;
        int hours = 20;
        engine = new StatsEngine(inMemory().build());
        engine.start();
        InMemoryUnitDatabase db = database.get();

        ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger maxStored = new AtomicInteger();
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                String client = "10.0.0." + t;
                tasks.add(executor.submit(() -> {
                    go.await();
                    for (int i = 0; i < updatesPerThread; i++) {
                        engine.update(entry(client, "d" + (i % 50) + ".example", Result.NOT_FILTERED, 1));
                    }
                    return null;
                }));
            }
            tasks.add(executor.submit(() -> {
                go.await();
                for (int h = 0; h < hours; h++) {
                    clock.incrementAndGet();
                    engine.flush();
                    assertTrue(engine.getReport().isPresent());
                    maxStored.accumulateAndGet(db.size(), Math::max);
                    Thread.yield();
                }
                return null;
            }));

            go.countDown();
            for (Future<?> task : tasks) {
                task.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        engine.flush();

        assertEquals((long) threads * updatesPerThread, report().numDnsQueries());
        assertTrue(maxStored.get() <= engine.getRetentionHours(), "stored " + maxStored.get() + " units");
        assertEquals(List.of(Map.of("10.0.0.0", (long) updatesPerThread)), report().topClients().subList(0, 1));
    }
}
