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

import org.vulnplan.model.Asset;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Normalized {@code (ecosystem, name)} coordinates of a package.
 * <p>
 * Ecosystems are lower-cased and de-aliased ({@code pip} is {@code pypi}).
 * Names are normalized according to the ecosystem's own rules.
 *
 * @param ecosystem Normalized ecosystem.
 * @param name      Normalized name.
 */
public record PackageCoordinates(String ecosystem, String name) {

    private static final Map<String, String> ECOSYSTEM_ALIASES = Map.of(
            "pip", "pypi",
            "go", "golang",
            "crates", "cargo",
            "crates.io", "cargo");

    private static final Set<String> CASE_INSENSITIVE_ECOSYSTEMS = Set.of("npm", "cargo", "nuget");

    public PackageCoordinates {
        requireNonNull(ecosystem, "ecosystem must not be null");
        requireNonNull(name, "name must not be null");
    }

    public static PackageCoordinates of(final String ecosystem, final String name) {
        final String normalizedEcosystem = normalizeEcosystem(ecosystem);
        return new PackageCoordinates(normalizedEcosystem, normalizeName(normalizedEcosystem, name));
    }

    public static PackageCoordinates of(final Asset asset) {
        return of(asset.ecosystem(), asset.name());
    }

    public static String normalizeEcosystem(final String ecosystem) {
        final String lowerCased = ecosystem.trim().toLowerCase(Locale.ROOT);
        return ECOSYSTEM_ALIASES.getOrDefault(lowerCased, lowerCased);
    }

    static String normalizeName(final String normalizedEcosystem, final String name) {
        final String trimmed = name.trim();
        if ("pypi".equals(normalizedEcosystem)) {
            // https://peps.python.org/pep-0503/#normalized-names
            return trimmed.replaceAll("[-_.]+", "-").toLowerCase(Locale.ROOT);
        } else if (CASE_INSENSITIVE_ECOSYSTEMS.contains(normalizedEcosystem)) {
            return trimmed.toLowerCase(Locale.ROOT);
        }

        return trimmed;
    }

    /**
     * @return Identity of {@code version} of this package, e.g. {@code pypi/django@4.2.0}.
     */
    public String identityOf(final String version) {
        return "%s/%s@%s".formatted(ecosystem, name, version.trim());
    }

}
