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

import java.util.List;
import java.util.stream.Collectors;

/**
 * A normalized affected version range.
 * <p>
 * A version is affected when it lies within any of the {@link #intervals()},
 * and is not one of the {@link #excludedVersions()}.
 *
 * @param intervals        Affected intervals, in the order they were declared. Never empty.
 * @param excludedVersions Versions explicitly declared as not affected.
 */
public record AffectedRange(List<VersionInterval> intervals, List<String> excludedVersions) {

    public AffectedRange {
        intervals = intervals != null ? List.copyOf(intervals) : List.of();
        excludedVersions = excludedVersions != null ? List.copyOf(excludedVersions) : List.of();
        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("intervals must not be empty");
        }
    }

    public static AffectedRange of(final VersionInterval... intervals) {
        return new AffectedRange(List.of(intervals), List.of());
    }

    public static AffectedRange allVersions() {
        return of(VersionInterval.unbounded());
    }

    /**
     * @return A syntax-independent rendering of this range,
     * e.g. {@code >=1.0.0, <1.2.3 || =2.0.0}.
     */
    public String expression() {
        final String intervalsExpression = intervals.stream()
                .map(VersionInterval::toString)
                .collect(Collectors.joining(" || "));
        if (excludedVersions.isEmpty()) {
            return intervalsExpression;
        }

        return excludedVersions.stream()
                .map(version -> "!=" + version)
                .collect(Collectors.joining(", ", intervalsExpression + " && ", ""));
    }

    @Override
    public String toString() {
        return expression();
    }

}
