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

import java.time.Clock;

/**
 * Produces the identifier of the unit that "now" belongs to. Identifiers never
 * decrease while the clock moves forward.
 */
@FunctionalInterface
public interface UnitIdGenerator {

    long currentId();

    /**
     * Absolute hour number since the Unix epoch, so that every engine reading the
     * same clock agrees on the current unit.
     */
    static UnitIdGenerator hourly(Clock clock) {
        return () -> clock.millis() / 3_600_000L;
    }

    static UnitIdGenerator systemHourly() {
        return hourly(Clock.systemUTC());
    }
}
