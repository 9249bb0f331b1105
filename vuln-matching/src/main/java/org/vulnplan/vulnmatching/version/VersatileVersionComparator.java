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

import io.github.nscuro.versatile.Vers;
import org.vulnplan.vulnmatching.range.VersionInterval;

import java.util.ArrayList;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A {@link VersionComparator} backed by the <a href="https://github.com/nscuro/versatile">versatile</a>
 * implementation of <a href="https://github.com/package-url/vers-spec">vers</a>.
 * <p>
 * Intervals are translated to vers constraints, and evaluated with {@link Vers#contains(String)}.
 */
public final class VersatileVersionComparator implements VersionComparator {

    static final String SCHEME_GENERIC = "generic";

    /**
     * Versioning schemes this comparator is used for.
     */
    static final Set<String> SUPPORTED_SCHEMES = Set.of("deb", SCHEME_GENERIC, "golang", "maven", "npm", "rpm");

    private final String versioningScheme;

    public VersatileVersionComparator(final String versioningScheme) {
        requireNonNull(versioningScheme, "versioningScheme must not be null");
        if (!SUPPORTED_SCHEMES.contains(versioningScheme)) {
            throw new IllegalArgumentException(
                    "Versioning scheme %s is not supported; Expected one of %s".formatted(
                            versioningScheme, SUPPORTED_SCHEMES.stream().sorted().toList()));
        }

        this.versioningScheme = versioningScheme;
    }

    @Override
    public String versioningScheme() {
        return versioningScheme;
    }

    @Override
    public int compare(final String left, final String right) {
        if (left.equals(right)) {
            return 0;
        }

        if (evaluate("<" + right, left)) {
            return -1;
        }

        return evaluate(right, left) ? 0 : 1;
    }

    @Override
    public boolean isWithin(final VersionInterval interval, final String version) {
        if (interval.isUnbounded()) {
            return true;
        }
        if (interval.isExact()) {
            return compare(version, interval.lower()) == 0;
        }

        final var constraints = new ArrayList<String>(2);
        if (interval.lower() != null) {
            constraints.add((interval.lowerInclusive() ? ">=" : ">") + interval.lower());
        }
        if (interval.upper() != null) {
            constraints.add((interval.upperInclusive() ? "<=" : "<") + interval.upper());
        }

        return evaluate(String.join("|", constraints), version);
    }

    private boolean evaluate(final String constraints, final String version) {
        try {
            return Vers.parse("vers:%s/%s".formatted(versioningScheme, constraints)).contains(version);
        } catch (RuntimeException e) {
            throw new VersionComparisonException(
                    "Version %s or range %s is invalid for scheme %s".formatted(version, constraints, versioningScheme), e);
        }
    }

    @Override
    public String toString() {
        return "VersatileVersionComparator{versioningScheme=%s}".formatted(versioningScheme);
    }

}
