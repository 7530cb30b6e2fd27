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

import java.time.Duration;

/**
 * One statistics event, produced once per processed DNS query.
 */
public class Entry {

    private final String client;
    private final String domain;
    private final Result result;
    private final Duration processingTime;

    public Entry(String client, String domain, Result result, Duration processingTime) {
        this.client = client;
        this.domain = domain;
        this.result = result;
        this.processingTime = processingTime;
    }

    public String getClient() {
        return client;
    }

    public String getDomain() {
        return domain;
    }

    public Result getResult() {
        return result;
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    public long getProcessingTimeMs() {
        if (processingTime == null || processingTime.isNegative()) {
            return 0;
        }
        return processingTime.toMillis();
    }

    public boolean isValid() {
        return result != null
                && domain != null && !domain.isEmpty()
                && client != null && !client.isEmpty();
    }

    @Override
    public String toString() {
        return "Entry{client=" + client + ", domain=" + domain + ", result=" + result
                + ", processingTime=" + processingTime + "}";
    }
}
