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

import org.vulnplan.vulnmatching.range.AffectedRange;
import org.vulnplan.vulnmatching.range.VersionInterval;

import java.util.Optional;

/**
 * Orders versions according to the rules of a single versioning scheme.
 * <p>
 * Implementations must be thread safe.
 */
public interface VersionComparator {

    /**
     * @return Name of the versioning scheme, e.g. {@code npm} or {@code maven}.
     */
    String versioningScheme();

    /**
     * @return A negative integer, zero, or a positive integer as {@code left}
     * is lower than, equal to, or higher than {@code right}.
     * @throws VersionComparisonException When either version is invalid in this scheme.
     */
    int compare(String left, String right);

    /**
     * @return Whether {@code version} lies within {@code interval}.
     * @throws VersionComparisonException When {@code version} or a bound of {@code interval} is invalid in this scheme.
     */
    boolean isWithin(VersionInterval interval, String version);

    /**
     * @return Whether {@code version} is affected according to {@code range}.
     */
    default boolean contains(final AffectedRange range, final String version) {
        for (final String excludedVersion : range.excludedVersions()) {
            if (compare(version, excludedVersion) == 0) {
                return false;
            }
        }

        for (final VersionInterval interval : range.intervals()) {
            if (isWithin(interval, version)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Determines the version that fixes {@code range} for {@code version}.
     * <p>
     * This is the lowest exclusive upper bound of all intervals that contain {@code version}.
     * Intervals with inclusive upper bounds (e.g. OSV's {@code last_affected}) do not
     * indicate a fix.
     *
     * @return The fixed version, or {@link Optional#empty()} when unknown.
     */
    default Optional<String> fixedVersion(final AffectedRange range, final String version) {
        String lowestFix = null;
        for (final VersionInterval interval : range.intervals()) {
            if (interval.upper() == null || interval.upperInclusive() || !isWithin(interval, version)) {
                continue;
            }

            if (lowestFix == null || compare(interval.upper(), lowestFix) < 0) {
                lowestFix = interval.upper();
            }
        }

        return Optional.ofNullable(lowestFix);
    }

}
