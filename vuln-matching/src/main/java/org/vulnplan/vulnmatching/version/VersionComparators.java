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
package org.vulnplan.vulnmatching.version;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Registry of {@link VersionComparator}s, keyed by normalized ecosystem.
 * <p>
 * Ecosystems without a dedicated comparator use the generic one.
 * This includes ecosystems such as {@code gem} and {@code nuget}, whose schemes versatile does not evaluate.
 */
public final class VersionComparators {

    private static final Map<String, String> VERSATILE_SCHEME_BY_ECOSYSTEM = Map.ofEntries(
            Map.entry("cargo", "npm"),
            Map.entry("deb", "deb"),
            Map.entry("golang", "golang"),
            Map.entry("maven", "maven"),
            Map.entry("npm", "npm"),
            Map.entry("rpm", "rpm"));

    private final Map<String, VersionComparator> comparatorByEcosystem;
    private final VersionComparator fallbackComparator;

    private VersionComparators(
            final Map<String, VersionComparator> comparatorByEcosystem,
            final VersionComparator fallbackComparator) {
        this.comparatorByEcosystem = Map.copyOf(comparatorByEcosystem);
        this.fallbackComparator = fallbackComparator;
    }

    /**
     * @return A registry with comparators for all well-known ecosystems.
     */
    public static VersionComparators defaults() {
        final var builder = builder();
        VERSATILE_SCHEME_BY_ECOSYSTEM.forEach(
                (ecosystem, scheme) -> builder.register(ecosystem, new VersatileVersionComparator(scheme)));
        builder.register("pypi", new Pep440VersionComparator());
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param ecosystem A normalized ecosystem name, e.g. {@code pypi}.
     * @return The {@link VersionComparator} to use for {@code ecosystem}.
     */
    public VersionComparator forEcosystem(final String ecosystem) {
        return comparatorByEcosystem.getOrDefault(ecosystem.toLowerCase(Locale.ROOT), fallbackComparator);
    }

    public static final class Builder {

        private final Map<String, VersionComparator> comparatorByEcosystem = new HashMap<>();
        private VersionComparator fallbackComparator;

        private Builder() {
        }

        public Builder register(final String ecosystem, final VersionComparator comparator) {
            requireNonNull(ecosystem, "ecosystem must not be null");
            requireNonNull(comparator, "comparator must not be null");
            comparatorByEcosystem.put(ecosystem.toLowerCase(Locale.ROOT), comparator);
            return this;
        }

        public Builder fallback(final VersionComparator comparator) {
            this.fallbackComparator = requireNonNull(comparator, "comparator must not be null");
            return this;
        }

        public VersionComparators build() {
            return new VersionComparators(
                    comparatorByEcosystem,
                    fallbackComparator != null
                            ? fallbackComparator
                            : new VersatileVersionComparator(VersatileVersionComparator.SCHEME_GENERIC));
        }

    }

}
