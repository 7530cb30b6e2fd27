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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.makibytes.dnsstats.model.NameCount;
import de.makibytes.dnsstats.model.Result;

/**
 * Live aggregate of one time bucket. Not thread-safe; the owner guards it.
 * <p>
 * The name maps hold every domain and client seen in the bucket. They are cut
 * down to the {@value #MAX_TOP_ENTRIES} most frequent names only when the unit
 * is serialized.
 */
public class Unit {

    public static final int MAX_TOP_ENTRIES = 100;

    private final long id;
    private final long[] resultHistogram = new long[Result.HISTOGRAM_SIZE];
    private final Map<String, Long> domains = new HashMap<>();
    private final Map<String, Long> blockedDomains = new HashMap<>();
    private final Map<String, Long> clients = new HashMap<>();
    private long total;
    private long durationSumMs;

    public Unit(long id) {
        this.id = id;
    }

    public void add(Result result, String domain, String client, long durationMs) {
        resultHistogram[result.getCode()]++;
        if (result == Result.NOT_FILTERED) {
            domains.merge(domain, 1L, Long::sum);
        } else {
            blockedDomains.merge(domain, 1L, Long::sum);
        }
        clients.merge(client, 1L, Long::sum);
        durationSumMs += durationMs;
        total++;
    }

    public UnitRecord serialize() {
        long averageDurationMs = total == 0 ? 0 : durationSumMs / total;
        return new UnitRecord(
                resultHistogram,
                NameCount.top(domains, MAX_TOP_ENTRIES),
                NameCount.top(blockedDomains, MAX_TOP_ENTRIES),
                NameCount.top(clients, MAX_TOP_ENTRIES),
                total,
                averageDurationMs);
    }

    /**
     * Rebuilds a unit from its snapshot. The duration sum is reconstructed from the
     * stored average, so sub-average precision is lost.
     */
    public static Unit deserialize(long id, UnitRecord record) {
        Unit unit = new Unit(id);
        if (record == null) {
            return unit;
        }
        unit.total = record.total();
        long[] stored = record.resultHistogram();
        int n = Math.min(stored.length, unit.resultHistogram.length);
        // slot 0 is the unknown result and stays empty
        for (int i = 1; i < n; i++) {
            unit.resultHistogram[i] = stored[i];
        }
        putAll(unit.domains, record.domains());
        putAll(unit.blockedDomains, record.blockedDomains());
        putAll(unit.clients, record.clients());
        unit.durationSumMs = record.averageDurationMs() * record.total();
        return unit;
    }

    private static void putAll(Map<String, Long> target, List<NameCount> pairs) {
        for (NameCount pair : pairs) {
            target.put(pair.name(), pair.count());
        }
    }

    public long getId() {
        return id;
    }

    public long getTotal() {
        return total;
    }

    public long getDurationSumMs() {
        return durationSumMs;
    }

    public long getCount(Result result) {
        return resultHistogram[result.getCode()];
    }

    public Map<String, Long> getDomains() {
        return Collections.unmodifiableMap(domains);
    }

    public Map<String, Long> getBlockedDomains() {
        return Collections.unmodifiableMap(blockedDomains);
    }

    public Map<String, Long> getClients() {
        return Collections.unmodifiableMap(clients);
    }
}
