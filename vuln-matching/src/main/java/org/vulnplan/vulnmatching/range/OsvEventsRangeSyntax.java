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
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses flattened <a href="https://ossf.github.io/osv-schema/#affectedrangesevents-fields">OSV range events</a>,
 * e.g. {@code introduced:0, fixed:1.2.3, introduced:2.0.0, last_affected:2.0.4}.
 * <p>
 * Events are evaluated in the order they are declared. An {@code introduced} of {@code 0}
 * denotes the lowest possible version.
 */
public final class OsvEventsRangeSyntax implements RangeSyntax {

    private static final Pattern EVENT_PATTERN = Pattern.compile(
            "(introduced|fixed|last_affected|limit)\\s*:\\s*([^\\s,;]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEPARATOR_PATTERN = Pattern.compile("[\\s,;]*");

    @Override
    public boolean supports(final String expression) {
        final Matcher matcher = EVENT_PATTERN.matcher(expression);
        return matcher.find() && matcher.start() == 0;
    }

    @Override
    public AffectedRange parse(final String expression) throws InvalidRangeException {
        final var intervals = new ArrayList<VersionInterval>();
        final Matcher matcher = EVENT_PATTERN.matcher(expression);

        String introduced = null;
        boolean open = false;
        int position = 0;
        while (matcher.find()) {
            requireSeparator(expression, expression.substring(position, matcher.start()));
            position = matcher.end();

            final String event = matcher.group(1).toLowerCase(Locale.ROOT);
            final String version = matcher.group(2);
            switch (event) {
                case "introduced" -> {
                    // Consecutive introduced events extend the already open interval.
                    if (!open) {
                        introduced = "0".equals(version) ? null : version;
                        open = true;
                    }
                }
                case "fixed", "limit" -> {
                    intervals.add(new VersionInterval(introduced, true, version, false));
                    introduced = null;
                    open = false;
                }
                case "last_affected" -> {
                    intervals.add(new VersionInterval(introduced, true, version, true));
                    introduced = null;
                    open = false;
                }
                default -> throw new IllegalStateException("Unexpected event: " + event);
            }
        }
        requireSeparator(expression, expression.substring(position));

        if (open) {
            intervals.add(new VersionInterval(introduced, true, null, false));
        }
        if (intervals.isEmpty()) {
            throw new InvalidRangeException("OSV range \"%s\" does not contain any events".formatted(expression));
        }

        return new AffectedRange(intervals, List.of());
    }

    private static void requireSeparator(final String expression, final String gap) throws InvalidRangeException {
        if (!SEPARATOR_PATTERN.matcher(gap).matches()) {
            throw new InvalidRangeException(
                    "OSV range \"%s\" contains unexpected characters \"%s\"".formatted(expression, gap.trim()));
        }
    }

}
