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
package de.makibytes.dnsstats.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregated statistics over one retention window, shaped for the JSON API.
 * Top tables are lists of single-entry {@code {name: count}} maps, highest first.
 */
public record StatsReport(
    @JsonProperty("time_units") StatsTimeUnit timeUnits,
    @JsonProperty("num_dns_queries") long numDnsQueries,
    @JsonProperty("num_blocked_filtering") long numBlockedFiltering,
    @JsonProperty("num_replaced_safebrowsing") long numReplacedSafebrowsing,
    @JsonProperty("num_replaced_safesearch") long numReplacedSafesearch,
    @JsonProperty("num_replaced_parental") long numReplacedParental,
    @JsonProperty("avg_processing_time") double avgProcessingTime,
    @JsonProperty("dns_queries") List<Long> dnsQueries,
    @JsonProperty("blocked_filtering") List<Long> blockedFiltering,
    @JsonProperty("replaced_safebrowsing") List<Long> replacedSafebrowsing,
    @JsonProperty("replaced_parental") List<Long> replacedParental,
    @JsonProperty("top_queried_domains") List<Map<String, Long>> topQueried,
    @JsonProperty("top_blocked_domains") List<Map<String, Long>> topBlocked,
    @JsonProperty("top_clients") List<Map<String, Long>> topClients
) {

    /**
     * Report of a disabled engine: no series, no tops, all totals zero.
     */
    public static StatsReport empty() {
        return new StatsReport(StatsTimeUnit.DAYS, 0, 0, 0, 0, 0, 0,
                List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of());
    }
}
