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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Host names excluded from statistics. A pattern is either an exact host name or
 * {@code *.suffix}, which matches any subdomain of the suffix but not the suffix
 * itself. Matching ignores case and a trailing dot.
 */
public final class IgnoredDomains {

    private static final IgnoredDomains NONE = new IgnoredDomains(List.of(), Set.of(), List.of());

    private final List<String> patterns;
    private final Set<String> exact;
    private final List<String> suffixes;

    private IgnoredDomains(List<String> patterns, Set<String> exact, List<String> suffixes) {
        this.patterns = patterns;
        this.exact = exact;
        this.suffixes = suffixes;
    }

    public static IgnoredDomains none() {
        return NONE;
    }

    public static IgnoredDomains of(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return NONE;
        }
        List<String> accepted = new ArrayList<>();
        Set<String> exact = new HashSet<>();
        List<String> suffixes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("ignored domain pattern must not be blank");
            }
            String normalized = normalize(pattern);
            if (!seen.add(normalized)) {
                throw new IllegalArgumentException("duplicate ignored domain pattern: " + pattern);
            }
            if (normalized.startsWith("*.")) {
                if (normalized.length() == 2) {
                    throw new IllegalArgumentException("invalid ignored domain pattern: " + pattern);
                }
                suffixes.add(normalized.substring(1));
            } else {
                exact.add(normalized);
            }
            accepted.add(pattern.trim());
        }
        return new IgnoredDomains(List.copyOf(accepted), Set.copyOf(exact), List.copyOf(suffixes));
    }

    public boolean isIgnored(String host) {
        if (host == null || host.isEmpty() || patterns.isEmpty()) {
            return false;
        }
        String normalized = normalize(host);
        if (exact.contains(normalized)) {
            return true;
        }
        for (String suffix : suffixes) {
            if (normalized.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    private static String normalize(String host) {
        String normalized = host.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
