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

import java.nio.ByteBuffer;
import java.util.OptionalLong;

/**
 * Store keys of persisted units: the unit id as an unsigned 32-bit big-endian
 * number. Bytewise key order is therefore chronological order, which the eviction
 * walk depends on. Hour numbers stay below 2^32 for roughly 490,000 years.
 */
public final class UnitKeys {

    static final int KEY_LENGTH = Integer.BYTES;
    static final long MAX_ID = 0xFFFF_FFFFL;

    private UnitKeys() {
    }

    public static byte[] idToKey(long id) {
        if (id < 0 || id > MAX_ID) {
            throw new IllegalArgumentException("unit id out of range: " + id);
        }
        return ByteBuffer.allocate(KEY_LENGTH).putInt((int) id).array();
    }

    public static OptionalLong keyToId(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Integer.toUnsignedLong(ByteBuffer.wrap(key).getInt()));
    }
}
