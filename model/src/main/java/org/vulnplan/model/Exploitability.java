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
package org.vulnplan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How likely a vulnerability is to be exploited.
 * <p>
 * This is a closed set of tiers rather than a continuous scale.
 */
public enum Exploitability {

    /**
     * Listed in a catalog of known exploited vulnerabilities, e.g. CISA KEV.
     */
    ACTIVELY_EXPLOITED(10),

    /**
     * A public exploit or proof of concept exists.
     */
    EXPLOIT_AVAILABLE(7),

    /**
     * No exploitation signal from any source.
     */
    THEORETICAL(3);

    private final int score;

    Exploitability(final int score) {
        this.score = score;
    }

    @JsonValue
    public int score() {
        return score;
    }

    @JsonCreator
    public static Exploitability fromScore(final int score) {
        return Arrays.stream(values())
                .filter(value -> value.score == score)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid exploitability score: " + score));
    }

}
