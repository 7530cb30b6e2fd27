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

import java.nio.file.Path;
import java.util.List;
import java.util.function.Predicate;

import org.springframework.util.FileSystemUtils;

import de.makibytes.dnsstats.config.DnsStatsProperties;
import de.makibytes.dnsstats.store.Retention;
import de.makibytes.dnsstats.store.RocksUnitDatabase;
import de.makibytes.dnsstats.store.UnitDatabase;
import de.makibytes.dnsstats.store.UnitIdGenerator;

/**
 * Construction-time settings of a {@link StatsEngine}.
 */
public class StatsEngineConfig {

    private final Path databasePath;
    private final int retentionDays;
    private final UnitIdGenerator unitIdGenerator;
    private final List<String> ignoredDomains;
    private final boolean anonymizeClientIp;
    private final Predicate<List<String>> shouldCountClient;
    private final Runnable configModified;
    private final UnitDatabase.Opener databaseOpener;
    private final UnitDatabase.Remover databaseRemover;

    private StatsEngineConfig(Builder builder) {
        this.databasePath = builder.databasePath;
        this.retentionDays = builder.retentionDays;
        this.unitIdGenerator = builder.unitIdGenerator;
        this.ignoredDomains = List.copyOf(builder.ignoredDomains);
        this.anonymizeClientIp = builder.anonymizeClientIp;
        this.shouldCountClient = builder.shouldCountClient;
        this.configModified = builder.configModified;
        this.databaseOpener = builder.databaseOpener;
        this.databaseRemover = builder.databaseRemover;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public UnitIdGenerator getUnitIdGenerator() {
        return unitIdGenerator;
    }

    public List<String> getIgnoredDomains() {
        return ignoredDomains;
    }

    public boolean isAnonymizeClientIp() {
        return anonymizeClientIp;
    }

    public Predicate<List<String>> getShouldCountClient() {
        return shouldCountClient;
    }

    public Runnable getConfigModified() {
        return configModified;
    }

    public UnitDatabase.Opener getDatabaseOpener() {
        return databaseOpener;
    }

    public UnitDatabase.Remover getDatabaseRemover() {
        return databaseRemover;
    }

    public static Builder builder(Path databasePath) {
        return new Builder(databasePath);
    }

    public static Builder fromProperties(DnsStatsProperties properties) {
        return builder(Path.of(properties.getFile()))
                .retentionDays(properties.getIntervalDays())
                .ignoredDomains(properties.getIgnored())
                .anonymizeClientIp(properties.isAnonymizeClientIp());
    }

    public static class Builder {
        private final Path databasePath;
        private int retentionDays = Retention.DEFAULT_DAYS;
        private UnitIdGenerator unitIdGenerator = UnitIdGenerator.systemHourly();
        private List<String> ignoredDomains = List.of();
        private boolean anonymizeClientIp;
        private Predicate<List<String>> shouldCountClient = ids -> true;
        private Runnable configModified = () -> { };
        private UnitDatabase.Opener databaseOpener = RocksUnitDatabase::open;
        private UnitDatabase.Remover databaseRemover = FileSystemUtils::deleteRecursively;

        private Builder(Path databasePath) {
            if (databasePath == null) {
                throw new IllegalArgumentException("database path is required");
            }
            this.databasePath = databasePath;
        }

        public Builder retentionDays(int retentionDays) { this.retentionDays = retentionDays; return this; }
        public Builder unitIdGenerator(UnitIdGenerator unitIdGenerator) { this.unitIdGenerator = unitIdGenerator; return this; }
        public Builder ignoredDomains(List<String> ignoredDomains) { this.ignoredDomains = ignoredDomains == null ? List.of() : ignoredDomains; return this; }
        public Builder anonymizeClientIp(boolean anonymizeClientIp) { this.anonymizeClientIp = anonymizeClientIp; return this; }
        public Builder shouldCountClient(Predicate<List<String>> shouldCountClient) { this.shouldCountClient = shouldCountClient; return this; }
        public Builder configModified(Runnable configModified) { this.configModified = configModified; return this; }
        public Builder databaseOpener(UnitDatabase.Opener databaseOpener) { this.databaseOpener = databaseOpener; return this; }
        public Builder databaseRemover(UnitDatabase.Remover databaseRemover) { this.databaseRemover = databaseRemover; return this; }

        public StatsEngineConfig build() {
            if (unitIdGenerator == null || shouldCountClient == null || configModified == null
                    || databaseOpener == null || databaseRemover == null) {
                throw new IllegalArgumentException("engine collaborators must not be null");
            }
            return new StatsEngineConfig(this);
        }
    }
}
