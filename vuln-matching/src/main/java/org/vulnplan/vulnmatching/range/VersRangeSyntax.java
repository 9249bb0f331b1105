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

import java.util.Locale;

/**
 * Parses <a href="https://github.com/package-url/vers-spec">vers</a> ranges,
 * e.g. {@code vers:npm/>=1.0.0|<1.2.3|2.0.0}.
 * <p>
 * The versioning scheme of the range is not used for matching. Versions are always
 * compared according to the ecosystem of the asset.
 */
public final class VersRangeSyntax implements RangeSyntax {

    private static final String PREFIX = "vers:";

    @Override
    public boolean supports(final String expression) {
        return expression.toLowerCase(Locale.ROOT).startsWith(PREFIX);
    }

    @Override
    public AffectedRange parse(final String expression) throws InvalidRangeException {
        final int schemeSeparatorIndex = expression.indexOf('/');
        if (schemeSeparatorIndex < 0) {
            throw new InvalidRangeException(
                    "vers range \"%s\" does not contain a versioning scheme separator".formatted(expression));
        }
        if (schemeSeparatorIndex == PREFIX.length()) {
            throw new InvalidRangeException("vers range \"%s\" does not declare a versioning scheme".formatted(expression));
        }

        final String constraintsStr = expression.substring(schemeSeparatorIndex + 1).trim();
        if ("*".equals(constraintsStr)) {
            return AffectedRange.allVersions();
        }

        final var collector = new IntervalCollector(expression);
        for (final String rawConstraint : constraintsStr.split("\\|")) {
            final String constraint = rawConstraint.trim();
            if (constraint.isEmpty()) {
                throw new InvalidRangeException("vers range \"%s\" contains an empty constraint".formatted(expression));
            }
            if ("*".equals(constraint)) {
                throw new InvalidRangeException(
                        "vers range \"%s\" combines a wildcard with other constraints".formatted(expression));
            }

            final ComparisonOperator operator = ComparisonOperator.ofConstraint(constraint);
            collector.accept(operator, operator.versionOf(constraint));
        }

        return collector.toRange();
    }

}
