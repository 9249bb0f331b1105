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

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a sequence of comparison constraints into {@link VersionInterval}s.
 * <p>
 * A lower bound ({@code >}, {@code >=}) stays open until the next upper bound
 * ({@code <}, {@code <=}) closes it. An upper bound without an open lower bound
 * starts at the lowest possible version, and a lower bound that is never closed
 * extends to the highest possible version. Equality constraints yield single-version
 * intervals, and inequality constraints are collected as exclusions.
 */
final class IntervalCollector {

    private final String expression;
    private final List<VersionInterval> intervals = new ArrayList<>();
    private final List<String> excludedVersions = new ArrayList<>();
    private String openLower;
    private boolean openLowerInclusive;

    IntervalCollector(final String expression) {
        this.expression = expression;
    }

    IntervalCollector accept(final ComparisonOperator operator, final String version) throws InvalidRangeException {
        if (version.isEmpty()) {
            throw new InvalidRangeException("Missing version after %s in range \"%s\"".formatted(operator.symbol(), expression));
        }

        switch (operator) {
            case GREATER_THAN, GREATER_THAN_OR_EQUAL -> {
                if (openLower != null) {
                    throw new InvalidRangeException("Range \"%s\" declares consecutive lower bounds %s and %s"
                            .formatted(expression, openLower, version));
                }
                openLower = version;
                openLowerInclusive = operator == ComparisonOperator.GREATER_THAN_OR_EQUAL;
            }
            case LESS_THAN, LESS_THAN_OR_EQUAL -> {
                intervals.add(new VersionInterval(
                        openLower, openLowerInclusive, version, operator == ComparisonOperator.LESS_THAN_OR_EQUAL));
                openLower = null;
            }
            case EQUAL, EQUAL_DOUBLE -> intervals.add(VersionInterval.exactly(version));
            case NOT_EQUAL -> excludedVersions.add(version);
        }

        return this;
    }

    /**
     * Closes a dangling lower bound, and starts a new group of constraints.
     */
    IntervalCollector endGroup() {
        if (openLower != null) {
            intervals.add(new VersionInterval(openLower, openLowerInclusive, null, false));
            openLower = null;
        }

        return this;
    }

    AffectedRange toRange() throws InvalidRangeException {
        endGroup();

        if (intervals.isEmpty()) {
            if (excludedVersions.isEmpty()) {
                throw new InvalidRangeException("Range \"%s\" does not contain any constraints".formatted(expression));
            }

            // Only exclusions: everything else is affected.
            intervals.add(VersionInterval.unbounded());
        }

        return new AffectedRange(intervals, excludedVersions);
    }

}
