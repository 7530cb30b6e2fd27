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

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StatsConfigView(
    @JsonProperty("interval_days") int intervalDays,
    @JsonProperty("ignored") List<String> ignored
) {
    public StatsConfigView {
        ignored = ignored == null ? List.of() : List.copyOf(ignored);
    }
}
