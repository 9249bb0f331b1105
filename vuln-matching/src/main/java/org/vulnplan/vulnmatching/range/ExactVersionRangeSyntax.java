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
import java.util.regex.Pattern;

/**
 * Handles the wildcard {@code *}, which affects all versions, and bare
 * versions, which affect exactly that version.
 */
public final class ExactVersionRangeSyntax implements RangeSyntax {

    private static final Pattern BARE_VERSION_PATTERN = Pattern.compile("[^\\s,|<>=!*^~]+");

    @Override
    public boolean supports(final String expression) {
        return "*".equals(expression) || BARE_VERSION_PATTERN.matcher(expression).matches();
    }

    @Override
    public AffectedRange parse(final String expression) {
        if ("*".equals(expression)) {
            return AffectedRange.allVersions();
        }

        return new AffectedRange(List.of(VersionInterval.exactly(expression)), List.of());
    }

}
