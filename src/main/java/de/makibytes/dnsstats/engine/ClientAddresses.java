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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Optional;

import com.google.common.net.InetAddresses;

/**
 * Client identifier helpers. Only IP literals are treated as addresses; host names
 * and opaque client ids are never resolved.
 */
final class ClientAddresses {

    static final int IPV4_ANONYMIZED_PREFIX = 16;
    static final int IPV6_ANONYMIZED_PREFIX = 112;

    private ClientAddresses() {
    }

    static Optional<InetAddress> parse(String client) {
        if (client == null || !InetAddresses.isInetAddress(client)) {
            return Optional.empty();
        }
        return Optional.of(InetAddresses.forString(client));
    }

    /**
     * Canonical form of an IP literal client, masked when {@code anonymize} is set.
     * Other identifiers are returned unchanged.
     */
    static String normalize(String client, boolean anonymize) {
        Optional<InetAddress> address = parse(client);
        if (address.isEmpty()) {
            return client;
        }
        InetAddress ip = address.get();
        if (anonymize) {
            int prefix = ip.getAddress().length == 4 ? IPV4_ANONYMIZED_PREFIX : IPV6_ANONYMIZED_PREFIX;
            ip = mask(ip, prefix);
        }
        return InetAddresses.toAddrString(ip);
    }

    private static InetAddress mask(InetAddress ip, int prefix) {
        byte[] bytes = ip.getAddress();
        for (int i = 0; i < bytes.length; i++) {
            int bitsKept = Math.max(0, Math.min(8, prefix - i * 8));
            bytes[i] &= (byte) (0xFF << (8 - bitsKept));
        }
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException ex) {
            throw new IllegalStateException("masked address has an illegal length: " + bytes.length, ex);
        }
    }
}
