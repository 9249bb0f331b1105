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

/**
 * A syntax in which vulnerability sources express affected version ranges.
 *
 * @see AffectedRangeParser
 */
public interface RangeSyntax {

    /**
     * @param expression A trimmed, non-empty range expression.
     * @return Whether this syntax is responsible for {@code expression}.
     */
    boolean supports(String expression);

    /**
     * @param expression A trimmed, non-empty range expression, for which {@link #supports(String)} returned {@code true}.
     * @return The parsed {@link AffectedRange}.
     * @throws InvalidRangeException When {@code expression} is malformed.
     */
    AffectedRange parse(String expression) throws InvalidRangeException;

}
