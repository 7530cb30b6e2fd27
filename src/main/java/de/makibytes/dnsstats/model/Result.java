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

/**
 * Outcome of a single DNS query as reported by the filtering pipeline.
 * <p>
 * The numeric codes index the result histogram of a unit; code 0 is reserved
 * for "unknown" and never counted.
 */
public enum Result {
    NOT_FILTERED(1),
    FILTERED(2),
    SAFE_BROWSING(3),
    SAFE_SEARCH(4),
    PARENTAL(5);

    public static final int HISTOGRAM_SIZE = 6;

    private final int code;

    Result(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
