package me.golemcore.pulse.domain.service;

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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Stable fingerprints for alerts whose identity is "the same findings", not a
 * single upstream event.
 */
public final class ContentSignature {

    public static final String CLEAN = "clean";

    private ContentSignature() {
    }

    /**
     * SHA-256 hex of the trimmed, lower-cased, sorted and de-duplicated finding
     * descriptions joined by {@code |}. Order and repetition do not matter.
     *
     * @return {@link #CLEAN} for an empty set
     */
    public static String of(Collection<String> findings) {
        String joined = findings.stream()
                .filter(Objects::nonNull)
                .map(finding -> finding.trim().toLowerCase(Locale.ROOT))
                .filter(finding -> !finding.isEmpty())
                .distinct()
                .sorted()
                .reduce((left, right) -> left + "|" + right)
                .orElse(null);
        if (joined == null) {
            return CLEAN;
        }
        return sha256(joined);
    }

    /**
     * Scopes a signature to the UTC calendar day of {@code instant}, so an
     * unchanged finding set alerts at most once per day.
     */
    public static String dayBucket(String signature, Instant instant) {
        LocalDate day = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        return signature + ":" + day;
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
