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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Versioned on-disk encoding of {@link UnitRecord}s. Every value is wrapped in an
 * envelope carrying the schema version, so that format changes are explicit.
 */
public class UnitRecordCodec {

    public static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;

    public UnitRecordCodec() {
        this.objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(UnitRecord record) throws IOException {
        return objectMapper.writeValueAsBytes(new Envelope(SCHEMA_VERSION, record));
    }

    public UnitRecord decode(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new IOException("empty unit value");
        }
        Envelope envelope = objectMapper.readValue(data, Envelope.class);
        if (envelope.version() != SCHEMA_VERSION) {
            throw new IOException("unsupported unit schema version " + envelope.version());
        }
        if (envelope.unit() == null) {
            throw new IOException("unit value has no unit");
        }
        return envelope.unit();
    }

    record Envelope(int version, UnitRecord unit) {
    }
}
