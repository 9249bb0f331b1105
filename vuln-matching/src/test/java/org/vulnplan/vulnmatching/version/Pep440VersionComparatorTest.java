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
package org.vulnplan.vulnmatching.version;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.vulnplan.vulnmatching.range.AffectedRange;
import org.vulnplan.vulnmatching.range.VersionInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class Pep440VersionComparatorTest {

    private final VersionComparator comparator = new Pep440VersionComparator();

    @ParameterizedTest
    @CsvSource({
            "3.2, 3.2.0, 0",
            "3.2.0, 3.2, 0",
            "1.0, 1.0.0.0, 0",
            "v1.0, 1.0, 0",
            "1.0.post0, 1.0-0, 0",
            "1.0RC1, 1.0rc1, 0",
            "1.0c1, 1.0rc1, 0",
            "1.0alpha2, 1.0a2, 0",
            "3.2.5, 3.2, 1",
            "3.10, 3.9.9, 1",
            "1!0.1, 2.0, 1",
            "1.0a1, 1.0, -1",
            "1.0.dev1, 1.0a1, -1",
            "1.0rc1, 1.0, -1",
            "1.0, 1.0.post1, -1",
            "1.0.post1.dev1, 1.0.post1, -1",
            "1.0, 1.0+local, -1",
            "1.0+abc, 1.0+5, -1"
    })
    void shouldCompareVersions(final String left, final String right, final int expectedSign) {
        assertThat(Integer.signum(comparator.compare(left, right))).isEqualTo(expectedSign);
    }

    @Test
    void shouldOrderVersions() {
        final List<String> expected = List.of(
                "1.0.dev456", "1.0a1", "1.0a2.dev456", "1.0a12", "1.0b1.dev456", "1.0b2",
                "1.0b2.post345", "1.0rc1", "1.0", "1.0+abc.5", "1.0+5", "1.0.post456.dev34", "1.0.post456", "1.1.dev1");

        final var shuffled = new ArrayList<>(expected);
        Collections.reverse(shuffled);
        shuffled.sort(comparator::compare);

        assertThat(shuffled).containsExactlyElementsOf(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "3.1.9, false",
            "3.2, true",
            "3.2.0, true",
            "3.2.4, true",
            "3.2.5, false",
            "3.2.5.0, false"
    })
    void shouldMatchShortBoundsAgainstLongVersions(final String version, final boolean expectedWithin) {
        final var interval = new VersionInterval("3.2", true, "3.2.5", false);

        assertThat(comparator.isWithin(interval, version)).isEqualTo(expectedWithin);
    }

    @Test
    void shouldMatchExactVersionRegardlessOfPadding() {
        final var range = AffectedRange.of(new VersionInterval("3.2", true, "3.2", true));

        assertThat(comparator.contains(range, "3.2.0")).isTrue();
        assertThat(comparator.contains(range, "3.2.1")).isFalse();
    }

    @Test
    void shouldDetermineFixedVersion() {
        final var range = AffectedRange.of(new VersionInterval("3.2", true, "3.2.5", false));

        assertThat(comparator.fixedVersion(range, "3.2.0")).hasValue("3.2.5");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "latest", "1.0-beta-final", "1..0"})
    void shouldThrowForInvalidVersions(final String version) {
        assertThatExceptionOfType(VersionComparisonException.class)
                .isThrownBy(() -> comparator.compare(version, "1.0"))
                .withMessage("Version %s is not a valid PEP 440 version", version);
    }

}
