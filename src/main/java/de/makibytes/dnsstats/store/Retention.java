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

import java.util.List;

/**
 * Retention tiers of the statistics store, in days. Zero disables collection.
 */
public final class Retention {

    public static final List<Integer> ALLOWED_DAYS = List.of(0, 1, 7, 30, 90);
    public static final int DEFAULT_DAYS = 1;
    public static final int HOURS_PER_DAY = 24;

    private Retention() {
    }

    public static boolean checkInterval(int days) {
        return ALLOWED_DAYS.contains(days);
    }

    public static int toHours(int days) {
        return days * HOURS_PER_DAY;
    }
}
