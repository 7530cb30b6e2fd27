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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public record NameCount(String name, long count) {

    static final Comparator<NameCount> BY_COUNT_DESC = Comparator
            .comparingLong(NameCount::count).reversed()
            .thenComparing(NameCount::name);

    /**
     * Returns at most {@code max} pairs of {@code counts}, highest count first.
     * Equal counts are ordered by name so that the cut is deterministic.
     */
    public static List<NameCount> top(Map<String, Long> counts, int max) {
        List<NameCount> pairs = new ArrayList<>(counts.size());
        counts.forEach((name, count) -> pairs.add(new NameCount(name, count)));
        pairs.sort(BY_COUNT_DESC);
        if (pairs.size() > max) {
            return new ArrayList<>(pairs.subList(0, Math.max(0, max)));
        }
        return pairs;
    }

    public Map<String, Long> asSingletonMap() {
        return Map.of(name, count);
    }
}
