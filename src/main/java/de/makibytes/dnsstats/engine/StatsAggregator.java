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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToLongFunction;

import de.makibytes.dnsstats.model.NameCount;
import de.makibytes.dnsstats.model.Result;
import de.makibytes.dnsstats.model.StatsReport;
import de.makibytes.dnsstats.model.StatsTimeUnit;
import de.makibytes.dnsstats.store.Retention;
import de.makibytes.dnsstats.store.Unit;
import de.makibytes.dnsstats.store.UnitRecord;

/**
 * Query-time rollups over a window of hourly unit snapshots.
 */
public final class StatsAggregator {

    private static final int HOURS_PER_DAY = Retention.HOURS_PER_DAY;

    private StatsAggregator() {
    }

    /**
     * Maps every record through {@code metric}. Hourly series keep one point per
     * record. Daily series sum records into days: the first point covers the
     * partial stretch up to the first day boundary at or after {@code firstId}
     * together with the full day after it, every following 24 records make one
     * point, and a shorter tail makes the last one. A window of {@code 24 * n}
     * records always yields {@code n} points.
     */
    public static List<Long> collectSeries(List<UnitRecord> records, long firstId, StatsTimeUnit timeUnit,
                                           ToLongFunction<UnitRecord> metric) {
        List<Long> series = new ArrayList<>();
        if (timeUnit == StatsTimeUnit.HOURS) {
            for (UnitRecord record : records) {
                series.add(metric.applyAsLong(record));
            }
            return series;
        }

        long firstDayId = (firstId + HOURS_PER_DAY - 1) / HOURS_PER_DAY * HOURS_PER_DAY;
        int bucketSize = (int) (firstDayId - firstId) + HOURS_PER_DAY;
        long sum = 0;
        int inBucket = 0;
        for (UnitRecord record : records) {
            sum += metric.applyAsLong(record);
            inBucket++;
            if (inBucket == bucketSize) {
                series.add(sum);
                sum = 0;
                inBucket = 0;
                bucketSize = HOURS_PER_DAY;
            }
        }
        if (inBucket > 0) {
            series.add(sum);
        }
        return series;
    }

    /**
     * Sums the name counts of all records, skipping excluded names, and returns the
     * {@code max} highest.
     */
    public static List<NameCount> collectTopN(List<UnitRecord> records, int max,
                                              Function<UnitRecord, List<NameCount>> metric,
                                              Predicate<String> excluded) {
        Map<String, Long> merged = new HashMap<>();
        for (UnitRecord record : records) {
            for (NameCount pair : metric.apply(record)) {
                if (excluded != null && excluded.test(pair.name())) {
                    continue;
                }
                merged.merge(pair.name(), pair.count(), Long::sum);
            }
        }
        return NameCount.top(merged, max);
    }

    /**
     * Average of the per-unit average durations, in seconds. Units without any
     * duration are left out. This is not weighted by the number of queries per
     * unit; reports built on it expect exactly this value.
     */
    public static double averageProcessingTime(List<UnitRecord> records) {
        long sumMs = 0;
        long withDuration = 0;
        for (UnitRecord record : records) {
            sumMs += record.averageDurationMs();
            if (record.averageDurationMs() != 0) {
                withDuration++;
            }
        }
        if (withDuration == 0) {
            return 0;
        }
        return (double) (sumMs / withDuration) / 1000;
    }

    public static long sum(List<UnitRecord> records, ToLongFunction<UnitRecord> metric) {
        long total = 0;
        for (UnitRecord record : records) {
            total += metric.applyAsLong(record);
        }
        return total;
    }

    public static StatsReport buildReport(UnitWindow window, int retentionHours, Predicate<String> ignoredDomain) {
        List<UnitRecord> records = window.records();
        long firstId = window.firstId();
        StatsTimeUnit timeUnit = StatsTimeUnit.forRetentionHours(retentionHours);

        List<Long> dnsQueries = collectSeries(records, firstId, timeUnit, UnitRecord::total);
        if (timeUnit == StatsTimeUnit.DAYS && retentionHours % HOURS_PER_DAY == 0
                && dnsQueries.size() != retentionHours / HOURS_PER_DAY) {
            throw new IllegalStateException("collected " + dnsQueries.size() + " days when the desired number is "
                    + retentionHours / HOURS_PER_DAY);
        }

        return new StatsReport(
                timeUnit,
                sum(records, UnitRecord::total),
                sum(records, r -> r.count(Result.FILTERED)),
                sum(records, r -> r.count(Result.SAFE_BROWSING)),
                sum(records, r -> r.count(Result.SAFE_SEARCH)),
                sum(records, r -> r.count(Result.PARENTAL)),
                averageProcessingTime(records),
                dnsQueries,
                collectSeries(records, firstId, timeUnit, r -> r.count(Result.FILTERED)),
                collectSeries(records, firstId, timeUnit, r -> r.count(Result.SAFE_BROWSING)),
                collectSeries(records, firstId, timeUnit, r -> r.count(Result.PARENTAL)),
                toMaps(collectTopN(records, Unit.MAX_TOP_ENTRIES, UnitRecord::domains, ignoredDomain)),
                toMaps(collectTopN(records, Unit.MAX_TOP_ENTRIES, UnitRecord::blockedDomains, ignoredDomain)),
                toMaps(collectTopN(records, Unit.MAX_TOP_ENTRIES, UnitRecord::clients, null)));
    }

    private static List<Map<String, Long>> toMaps(List<NameCount> pairs) {
        List<Map<String, Long>> maps = new ArrayList<>(pairs.size());
        for (NameCount pair : pairs) {
            maps.add(pair.asSingletonMap());
        }
        return maps;
    }
}
