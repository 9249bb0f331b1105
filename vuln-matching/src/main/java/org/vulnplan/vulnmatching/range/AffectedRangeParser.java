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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Parses affected version range expressions of any supported {@link RangeSyntax}.
 * <p>
 * Syntaxes are consulted in order, and the first one that supports an
 * expression parses it.
 */
public final class AffectedRangeParser {

    private static final AffectedRangeParser DEFAULT = new AffectedRangeParser(List.of(
            new VersRangeSyntax(),
            new OsvEventsRangeSyntax(),
            new NvdBoundsRangeSyntax(),
            new ExactVersionRangeSyntax(),
            new ComparatorExpressionRangeSyntax()));

    private final List<RangeSyntax> syntaxes;

    public AffectedRangeParser(final List<RangeSyntax> syntaxes) {
        this.syntaxes = List.copyOf(requireNonNull(syntaxes, "syntaxes must not be null"));
    }

    public static AffectedRangeParser defaults() {
        return DEFAULT;
    }

    public AffectedRange parse(final @Nullable String expression) throws InvalidRangeException {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRangeException("Affected range must not be blank");
        }

        final String trimmed = expression.trim();
        for (final RangeSyntax syntax : syntaxes) {
            if (syntax.supports(trimmed)) {
                return syntax.parse(trimmed);
            }
        }

        throw new InvalidRangeException("Unrecognized affected range syntax: \"%s\"".formatted(trimmed));
    }

}
