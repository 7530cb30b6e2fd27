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

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Transactional, ordered storage of persisted units, one entry per unit id.
 * Implementations must be safe for concurrent transactions.
 */
public interface UnitDatabase extends Closeable {

    UnitTransaction begin() throws IOException;

    Path getPath();

    @FunctionalInterface
    interface Opener {
        UnitDatabase open(Path path) throws IOException;
    }

    /**
     * Deletes the files of a closed database. A missing path is not an error.
     */
    @FunctionalInterface
    interface Remover {
        void remove(Path path) throws IOException;
    }
}
