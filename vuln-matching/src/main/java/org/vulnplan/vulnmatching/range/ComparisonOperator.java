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

/**
 * Comparison operators shared by vers and comparator expression syntaxes.
 */
enum ComparisonOperator {

    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<="),
    NOT_EQUAL("!="),
    EQUAL_DOUBLE("=="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    EQUAL("=");

    // Longer symbols first, such that ">=" is not mistaken for ">".
    private static final List<ComparisonOperator> BY_SYMBOL_LENGTH = List.of(values());

    private final String symbol;

    ComparisonOperator(final String symbol) {
        this.symbol = symbol;
    }

    String symbol() {
        return symbol;
    }

    /**
     * @return The operator {@code constraint} starts with, or {@link #EQUAL} when it has none.
     */
    static ComparisonOperator ofConstraint(final String constraint) {
        for (final ComparisonOperator operator : BY_SYMBOL_LENGTH) {
            if (constraint.startsWith(operator.symbol)) {
                return operator;
            }
        }

        return EQUAL;
    }

    /**
     * @return The version part of {@code constraint}, without the operator.
     */
    String versionOf(final String constraint) {
        return constraint.startsWith(symbol) ? constraint.substring(symbol.length()).trim() : constraint.trim();
    }

}
