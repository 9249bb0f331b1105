/*
 * This file is part of VulnPlan.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) The VulnPlan Authors. All Rights Reserved.
 */
package org.vulnplan.vulnmatching;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Canonicalizes vulnerability identifiers, such that reports of the same
 * vulnerability from different sources share one identifier.
 */
public final class VulnIdCanonicalizer {

    private static final String PREFIX_CVE = "CVE";
    private static final String PREFIX_GHSA = "GHSA";

    /**
     * @param vulnId  Primary identifier, and the vulnerability's canonical identifier.
     * @param aliases All other identifiers, sorted.
     */
    public record Identifiers(String vulnId, List<String> aliases) {
    }

    /**
     * Canonicalizes a single identifier.
     * <p>
     * The prefix is upper-cased, e.g. {@code cve-2021-44228} becomes {@code CVE-2021-44228}.
     * Bodies of GitHub advisory IDs are lower-cased, as GitHub renders them.
     *
     * @return The canonical identifier, or {@link Optional#empty()} when {@code id} is blank.
     */
    public Optional<String> canonicalize(final @Nullable String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }

        final String trimmed = id.trim();
        final int separatorIndex = trimmed.indexOf('-');
        if (separatorIndex <= 0) {
            return Optional.of(trimmed.toUpperCase(Locale.ROOT));
        }

        final String prefix = trimmed.substring(0, separatorIndex).toUpperCase(Locale.ROOT);
        String body = trimmed.substring(separatorIndex);
        if (PREFIX_GHSA.equals(prefix)) {
            body = body.toLowerCase(Locale.ROOT);
        } else if (PREFIX_CVE.equals(prefix)) {
            body = body.toUpperCase(Locale.ROOT);
        }

        return Optional.of(prefix + body);
    }

    /**
     * Determines the canonical identifier among a record's own identifier and its aliases.
     * <p>
     * CVE identifiers take precedence, such that GitHub and OSV advisories merge with NVD
     * records of the same CVE. When multiple CVEs are present, the lowest one is used.
     *
     * @return The resolved {@link Identifiers}, or {@link Optional#empty()} when no identifier is present at all.
     */
    public Optional<Identifiers> resolve(final @Nullable String vulnId, final Collection<String> aliases) {
        final Optional<String> ownId = canonicalize(vulnId);

        final var allIds = new TreeSet<String>();
        ownId.ifPresent(allIds::add);
        aliases.forEach(alias -> canonicalize(alias).ifPresent(allIds::add));
        if (allIds.isEmpty()) {
            return Optional.empty();
        }

        final String primaryId = allIds.stream()
                .filter(id -> id.startsWith(PREFIX_CVE + "-"))
                .findFirst()
                .or(() -> ownId)
                .orElseGet(allIds::first);
        allIds.remove(primaryId);

        return Optional.of(new Identifiers(primaryId, List.copyOf(allIds)));
    }

}
