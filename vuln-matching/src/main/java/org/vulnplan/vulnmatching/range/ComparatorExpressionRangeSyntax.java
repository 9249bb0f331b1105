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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses comparator expressions as used by GitHub advisories and npm,
 * e.g. {@code >= 1.0.0, < 1.2.3 || = 2.0.0}.
 * <p>
 * Groups are separated by {@code ||}. Within a group, constraints are separated
 * by commas or whitespace.
 */
public final class ComparatorExpressionRangeSyntax implements RangeSyntax {

    private static final Pattern CONSTRAINT_PATTERN = Pattern.compile("(>=|<=|!=|==|>|<|=)?\\s*([^\\s,<>=!|]+)");
    private static final Pattern SEPARATOR_PATTERN = Pattern.compile("[\\s,]*");

    @Override
    public boolean supports(final String expression) {
        final char firstChar = expression.charAt(0);
        return firstChar == '<' || firstChar == '>' || firstChar == '=' || firstChar == '!'
                || expression.contains("||")
                || expression.contains(",");
    }

    @Override
    public AffectedRange parse(final String expression) throws InvalidRangeException {
        final var collector = new IntervalCollector(expression);

        for (final String group : expression.split("\\|\\|")) {
            if (group.isBlank()) {
                throw new InvalidRangeException("Range \"%s\" contains an empty group".formatted(expression));
            }

            final Matcher matcher = CONSTRAINT_PATTERN.matcher(group);
            int position = 0;
            while (matcher.find()) {
                requireSeparator(expression, group.substring(position, matcher.start()));

                final String version = matcher.group(2);
                if (version.startsWith("^") || version.startsWith("~")) {
                    throw new InvalidRangeException(
                            "Range \"%s\" uses unsupported shorthand %s".formatted(expression, version));
                }

                final ComparisonOperator operator = matcher.group(1) != null
                        ? ComparisonOperator.ofConstraint(matcher.group(1))
                        : ComparisonOperator.EQUAL;
                collector.accept(operator, version);
                position = matcher.end();
            }
            requireSeparator(expression, group.substring(position));

            collector.endGroup();
        }

        return collector.toRange();
    }

    private static void requireSeparator(final String expression, final String gap) throws InvalidRangeException {
        if (!SEPARATOR_PATTERN.matcher(gap).matches()) {
            throw new InvalidRangeException(
                    "Range \"%s\" contains unexpected characters \"%s\"".formatted(expression, gap.trim()));
        }
    }

}
