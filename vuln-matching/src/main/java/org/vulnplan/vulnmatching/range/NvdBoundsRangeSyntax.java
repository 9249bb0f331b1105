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
 * Parses version bounds of NVD CPE match criteria,
 * e.g. {@code versionStartIncluding:1.0.0; versionEndExcluding:1.2.3}.
 * <p>
 * Multiple criteria are separated by {@code ||}.
 */
public final class NvdBoundsRangeSyntax implements RangeSyntax {

    private static final String START_INCLUDING = "versionStartIncluding";
    private static final String START_EXCLUDING = "versionStartExcluding";
    private static final String END_INCLUDING = "versionEndIncluding";
    private static final String END_EXCLUDING = "versionEndExcluding";

    @Override
    public boolean supports(final String expression) {
        return expression.startsWith("versionStart") || expression.startsWith("versionEnd");
    }

    @Override
    public AffectedRange parse(final String expression) throws InvalidRangeException {
        final var intervals = new ArrayList<VersionInterval>();
        for (final String criteria : expression.split("\\|\\|")) {
            intervals.add(parseCriteria(expression, criteria));
        }

        return new AffectedRange(intervals, List.of());
    }

    private static VersionInterval parseCriteria(final String expression, final String criteria) throws InvalidRangeException {
        String lower = null;
        boolean lowerInclusive = false;
        String upper = null;
        boolean upperInclusive = false;

        for (final String rawBound : criteria.split("[;,]")) {
            final String bound = rawBound.trim();
            if (bound.isEmpty()) {
                continue;
            }

            final int separatorIndex = bound.indexOf(':');
            if (separatorIndex < 0) {
                throw new InvalidRangeException("Bound \"%s\" in range \"%s\" is not a key:value pair".formatted(bound, expression));
            }

            final String key = bound.substring(0, separatorIndex).trim();
            final String version = bound.substring(separatorIndex + 1).trim();
            if (version.isEmpty()) {
                throw new InvalidRangeException("Bound %s in range \"%s\" has no version".formatted(key, expression));
            }

            switch (key) {
                case START_INCLUDING, START_EXCLUDING -> {
                    if (lower != null) {
                        throw new InvalidRangeException("Range \"%s\" declares multiple lower bounds".formatted(expression));
                    }
                    lower = version;
                    lowerInclusive = START_INCLUDING.equals(key);
                }
                case END_INCLUDING, END_EXCLUDING -> {
                    if (upper != null) {
                        throw new InvalidRangeException("Range \"%s\" declares multiple upper bounds".formatted(expression));
                    }
                    upper = version;
                    upperInclusive = END_INCLUDING.equals(key);
                }
                default -> throw new InvalidRangeException(
                        "Range \"%s\" contains unknown bound %s".formatted(expression, key));
            }
        }

        if (lower == null && upper == null) {
            throw new InvalidRangeException("Range \"%s\" contains criteria without bounds".formatted(expression));
        }

        return new VersionInterval(lower, lowerInclusive, upper, upperInclusive);
    }

}
