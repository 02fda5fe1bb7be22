package me.golemcore.veritas.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.veritas.infrastructure.config.CachePolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps raw query text to the stable fragment used in cache keys.
 *
 * <p>
 * Queries that differ only in case, punctuation or whitespace map to the same
 * key: {@code "Hello, World!"} and {@code " hello   world"} both become
 * {@code hello-world}. The result contains only {@code [a-z0-9_-]}, never
 * starts or ends with a hyphen and is at most {@link CachePolicy#getMaxKeyLength()}
 * characters long. Normalizing a normalized value returns it unchanged.
 */
@Component
@RequiredArgsConstructor
public class QueryNormalizer {

    // \s alone is ASCII-only; NBSP and U+3000 must count as whitespace too
    private static final String WHITESPACE = "\\s\\p{Z}\\uFEFF";

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w" + WHITESPACE + "-]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[" + WHITESPACE + "]+");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-+");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private final CachePolicy policy;

    /**
     * Normalize raw query text. Never fails: {@code null} yields an empty string.
     */
    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.strip().toLowerCase(Locale.ROOT);
        value = DISALLOWED.matcher(value).replaceAll("");
        value = WHITESPACE_RUN.matcher(value).replaceAll("-");
        value = HYPHEN_RUN.matcher(value).replaceAll("-");
        value = EDGE_HYPHENS.matcher(value).replaceAll("");
        if (value.length() > policy.getMaxKeyLength()) {
            // truncation can expose a trailing hyphen
            value = EDGE_HYPHENS.matcher(value.substring(0, policy.getMaxKeyLength())).replaceAll("");
        }
        return value;
    }
}
