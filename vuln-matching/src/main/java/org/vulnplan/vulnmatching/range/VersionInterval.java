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
package org.vulnplan.vulnmatching.range;

import org.jspecify.annotations.Nullable;

/**
 * A contiguous interval of versions.
 * <p>
 * A {@code null} bound means the interval is unbounded in that direction.
 * Bounds are kept as raw version strings; ordering them is the job of a
 * {@link org.vulnplan.vulnmatching.version.VersionComparator}.
 *
 * @param lower          Lower bound, if any.
 * @param lowerInclusive Whether {@code lower} is part of the interval.
 * @param upper          Upper bound, if any.
 * @param upperInclusive Whether {@code upper} is part of the interval.
 */
public record VersionInterval(
        @Nullable String lower,
        boolean lowerInclusive,
        @Nullable String upper,
        boolean upperInclusive) {

    private static final VersionInterval UNBOUNDED = new VersionInterval(null, false, null, false);

    public VersionInterval {
        lower = normalizeBound(lower);
        upper = normalizeBound(upper);
        if (lower == null) {
            lowerInclusive = false;
        }
        if (upper == null) {
            upperInclusive = false;
        }
    }

    public static VersionInterval unbounded() {
        return UNBOUNDED;
    }

    public static VersionInterval exactly(final String version) {
        return new VersionInterval(version, true, version, true);
    }

    public boolean isUnbounded() {
        return lower == null && upper == null;
    }

    public boolean isExact() {
        return lower != null && lower.equals(upper) && lowerInclusive && upperInclusive;
    }

    @Override
    public String toString() {
        if (isUnbounded()) {
            return "*";
        }
        if (isExact()) {
            return "=" + lower;
        }

        final var sb = new StringBuilder();
        if (lower != null) {
            sb.append(lowerInclusive ? ">=" : ">").append(lower);
        }
        if (upper != null) {
            if (lower != null) {
                sb.append(", ");
            }
            sb.append(upperInclusive ? "<=" : "<").append(upper);
        }

        return sb.toString();
    }

    private static @Nullable String normalizeBound(final @Nullable String bound) {
        if (bound == null) {
            return null;
        }

        final String trimmed = bound.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

}
