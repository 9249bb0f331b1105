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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class ScoresTest {

    @ParameterizedTest
    @CsvSource({
            "9.94, 9.9",
            "9.95, 10.0",
            "9.940000000000001, 9.9",
            "0.05, 0.1",
            "6.449999, 6.4",
            "0.0, 0.0"
    })
    void shouldRoundHalfUpToOneDecimal(final double input, final double expected) {
        assertThat(Scores.roundToOneDecimal(input)).isEqualTo(expected);
    }

    @Test
    void tierEnumsShouldResolveFromScores() {
        assertThat(Exploitability.fromScore(7)).isEqualTo(Exploitability.EXPLOIT_AVAILABLE);
        assertThat(Criticality.fromScore(5)).isEqualTo(Criticality.MEDIUM);
        assertThat(Exposure.fromScore(10)).isEqualTo(Exposure.INTERNET_FACING);
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> Exploitability.fromScore(5))
                .withMessage("Invalid exploitability score: 5");
    }

}
