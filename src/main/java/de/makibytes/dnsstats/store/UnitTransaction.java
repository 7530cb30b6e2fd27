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

import java.io.IOException;

/**
 * A unit of work against a {@link UnitDatabase}. Closing a transaction that was
 * not committed rolls it back.
 */
public interface UnitTransaction extends AutoCloseable {

    /**
     * Returns the persisted unit, or null if there is none or it cannot be decoded.
     */
    UnitRecord load(long id) throws IOException;

    void store(long id, UnitRecord record) throws IOException;

    /**
     * Walks the units in key order and deletes every one with an id lower than
     * {@code firstKeptId}. Entries with foreign keys met on the way are deleted too.
     *
     * @return the number of deleted entries
     */
    int evictBefore(long firstKeptId) throws IOException;

    void commit() throws IOException;

    void rollback() throws IOException;

    @Override
    void close();
}
