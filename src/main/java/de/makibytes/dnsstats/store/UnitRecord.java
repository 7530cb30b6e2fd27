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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import de.makibytes.dnsstats.model.NameCount;
import de.makibytes.dnsstats.model.Result;

/**
 * Immutable snapshot of a unit as it is persisted. The property names and their
 * order are part of the on-disk format.
 */
@JsonPropertyOrder({"resultHistogram", "domains", "blockedDomains", "clients", "total", "averageDurationMs"})
public record UnitRecord(long[] resultHistogram,
                         List<NameCount> domains,
                         List<NameCount> blockedDomains,
                         List<NameCount> clients,
                         long total,
                         long averageDurationMs) {

    public UnitRecord {
        resultHistogram = resultHistogram == null ? new long[Result.HISTOGRAM_SIZE] : resultHistogram.clone();
        domains = domains == null ? List.of() : List.copyOf(domains);
        blockedDomains = blockedDomains == null ? List.of() : List.copyOf(blockedDomains);
        clients = clients == null ? List.of() : List.copyOf(clients);
    }

    public static UnitRecord empty() {
        return new UnitRecord(new long[Result.HISTOGRAM_SIZE], List.of(), List.of(), List.of(), 0, 0);
    }

    @Override
    public long[] resultHistogram() {
        return resultHistogram.clone();
    }

    public long count(Result result) {
        int code = result.getCode();
        return code < resultHistogram.length ? resultHistogram[code] : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnitRecord other)) {
            return false;
        }
        return total == other.total
                && averageDurationMs == other.averageDurationMs
                && Arrays.equals(resultHistogram, other.resultHistogram)
                && domains.equals(other.domains)
                && blockedDomains.equals(other.blockedDomains)
                && clients.equals(other.clients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(resultHistogram), domains, blockedDomains, clients,
                total, averageDurationMs);
    }

    @Override
    public String toString() {
        return "UnitRecord{resultHistogram=" + Arrays.toString(resultHistogram)
                + ", domains=" + domains.size()
                + ", blockedDomains=" + blockedDomains.size()
                + ", clients=" + clients.size()
                + ", total=" + total
                + ", averageDurationMs=" + averageDurationMs + "}";
    }
}
