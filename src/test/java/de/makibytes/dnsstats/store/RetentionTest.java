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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Retention Tests")
class RetentionTest {

    @Test
    @DisplayName("checkInterval: accepts exactly 0, 1, 7, 30 and 90 days")
    void checkInterval() {
        for (int days : new int[] {0, 1, 7, 30, 90}) {
            assertTrue(Retention.checkInterval(days), days + " days");
        }
        for (int days : new int[] {-1, 2, 14, 31, 365}) {
            assertFalse(Retention.checkInterval(days), days + " days");
        }
    }

    @Test
    @DisplayName("toHours: converts days to hours")
    void toHours() {
        assertEquals(0, Retention.toHours(0));
        assertEquals(720, Retention.toHours(30));
    }
}
