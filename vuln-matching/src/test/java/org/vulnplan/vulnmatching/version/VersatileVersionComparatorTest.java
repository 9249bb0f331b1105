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
import org.vulnplan.vulnmatching.range.AffectedRange;
import org.vulnplan.vulnmatching.range.VersionInterval;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class VersatileVersionComparatorTest {

    private final VersionComparator npmComparator = new VersatileVersionComparator("npm");

    @ParameterizedTest
    @CsvSource({
            "1.0.0, 1.0.0, 0",
            "1.0.0, 1.0.1, -1",
            "1.10.0, 1.9.0, 1",
            "4.17.20, 4.17.21, -1",
            "2.0.0, 1.99.99, 1"
    })
    void shouldCompareVersions(final String left, final String right, final int expectedSign) {
        assertThat(Integer.signum(npmComparator.compare(left, right))).isEqualTo(expectedSign);
    }

    @ParameterizedTest
    @CsvSource({
            "0.9.0, false",
            "1.0.0, true",
            "1.2.2, true",
            "1.2.3, false",
            "2.0.0, false"
    })
    void shouldCheckWhetherVersionIsWithinInterval(final String version, final boolean expectedWithin) {
        final var interval = new VersionInterval("1.0.0", true, "1.2.3", false);

        assertThat(npmComparator.isWithin(interval, version)).isEqualTo(expectedWithin);
    }

    @Test
    void shouldTreatUnboundedIntervalAsContainingEverything() {
        assertThat(npmComparator.isWithin(VersionInterval.unbounded(), "0.0.1")).isTrue();
    }

    @Test
    void shouldHonorExcludedVersions() {
        final var range = new AffectedRange(
                List.of(new VersionInterval(null, false, "2.0.0", false)),
                List.of("1.5.0"));

        assertThat(npmComparator.contains(range, "1.4.0")).isTrue();
        assertThat(npmComparator.contains(range, "1.5.0")).isFalse();
        assertThat(npmComparator.contains(range, "2.0.0")).isFalse();
    }

    @Test
    void shouldDetermineLowestFixedVersionOfContainingIntervals() {
        final var range = AffectedRange.of(
                new VersionInterval(null, false, "1.2.5", false),
                new VersionInterval("1.0.0", true, "1.2.3", false),
                new VersionInterval("2.0.0", true, "2.0.4", false));

        assertThat(npmComparator.fixedVersion(range, "1.1.0")).hasValue("1.2.3");
        assertThat(npmComparator.fixedVersion(range, "1.2.4")).hasValue("1.2.5");
        assertThat(npmComparator.fixedVersion(range, "2.0.1")).hasValue("2.0.4");
        assertThat(npmComparator.fixedVersion(range, "3.0.0")).isEmpty();
    }

    @Test
    void shouldNotReportFixedVersionForInclusiveUpperBound() {
        final var range = AffectedRange.of(new VersionInterval("1.0.0", true, "1.4.0", true));

        assertThat(npmComparator.fixedVersion(range, "1.2.0")).isEmpty();
    }

    @Test
    void shouldRejectUnsupportedScheme() {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> new VersatileVersionComparator("gem"))
                .withMessage("Versioning scheme gem is not supported; Expected one of [deb, generic, golang, maven, npm, rpm]");
    }

}
