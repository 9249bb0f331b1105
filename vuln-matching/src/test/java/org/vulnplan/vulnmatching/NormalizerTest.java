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
package org.vulnplan.vulnmatching;

import org.junit.jupiter.api.Test;
import org.vulnplan.model.Exploitability;
import org.vulnplan.model.RawFindingRecord;
import org.vulnplan.model.RawSeverity;
import org.vulnplan.vulndatasource.api.SourcePriorities;
import org.vulnplan.vulnmatching.range.InvalidRangeException;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer(SourcePriorities.defaults());

    @Test
    void shouldNormalizeRecord() throws Exception {
        final RawFindingRecord record = RawFindingRecord.builder("github")
                .sourcePriority(99)
                .vulnId("ghsa-jfh8-c2jp-5v3q")
                .alias("cve-2021-44228")
                .affects("Maven", "org.apache.logging.log4j:log4j-core", "vers:maven/>=2.0.0|<2.15.0")
                .severity(RawSeverity.ofLabel("CRITICAL").withExploitAvailable(true))
                .title(" Remote code injection in Log4j ")
                .reference("https://github.com/advisories/GHSA-jfh8-c2jp-5v3q")
                .reference("https://github.com/advisories/GHSA-jfh8-c2jp-5v3q")
                .fetchedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .build();

        final FindingFragment fragment = normalizer.normalize(record);

        assertThat(fragment.sourceId()).isEqualTo("github");
        assertThat(fragment.priority()).isEqualTo(3);
        assertThat(fragment.vulnId()).isEqualTo("CVE-2021-44228");
        assertThat(fragment.aliases()).containsExactly("GHSA-jfh8-c2jp-5v3q");
        assertThat(fragment.coordinates()).isEqualTo(new PackageCoordinates("maven", "org.apache.logging.log4j:log4j-core"));
        assertThat(fragment.affectedRange().expression()).isEqualTo(">=2.0.0, <2.15.0");
        assertThat(fragment.cvss()).isEqualTo(9.0);
        assertThat(fragment.exploitability()).isEqualTo(Exploitability.EXPLOIT_AVAILABLE);
        assertThat(fragment.title()).isEqualTo("Remote code injection in Log4j");
        assertThat(fragment.references()).containsExactly("https://github.com/advisories/GHSA-jfh8-c2jp-5v3q");
    }

    @Test
    void shouldUseRecordPriorityForUnknownSource() throws Exception {
        final RawFindingRecord record = RawFindingRecord.builder("snyk")
                .sourcePriority(7)
                .vulnId("SNYK-JS-LODASH-1018905")
                .affects("npm", "lodash", "< 4.17.21")
                .build();

        assertThat(normalizer.normalize(record).priority()).isEqualTo(7);
    }

    @Test
    void shouldRejectRecordWithoutIdentifier() {
        final RawFindingRecord record = RawFindingRecord.builder("osv")
                .affects("npm", "lodash", "< 4.17.21")
                .build();

        assertThatExceptionOfType(UnparsableRecordException.class)
                .isThrownBy(() -> normalizer.normalize(record))
                .satisfies(e -> {
                    assertThat(e.getSourceId()).isEqualTo("osv");
                    assertThat(e.getSubject()).isEqualTo("<unidentified> (npm/lodash)");
                })
                .withMessage("Unparsable record <unidentified> (npm/lodash) from source osv: No vulnerability identifier");
    }

    @Test
    void shouldRejectRecordWithoutPackage() {
        final RawFindingRecord record = RawFindingRecord.builder("nvd")
                .vulnId("CVE-2021-44228")
                .build();

        assertThatExceptionOfType(UnparsableRecordException.class)
                .isThrownBy(() -> normalizer.normalize(record))
                .withMessage("Unparsable record CVE-2021-44228 from source nvd: No affected package");
    }

    @Test
    void shouldRejectRecordWithMalformedRange() {
        final RawFindingRecord record = RawFindingRecord.builder("nvd")
                .vulnId("CVE-2021-44228")
                .affects("maven", "log4j-core", "between 2.0 and 2.15")
                .build();

        assertThatExceptionOfType(UnparsableRecordException.class)
                .isThrownBy(() -> normalizer.normalize(record))
                .withMessageContaining("Unrecognized affected range syntax")
                .withCauseInstanceOf(InvalidRangeException.class);
    }

}
