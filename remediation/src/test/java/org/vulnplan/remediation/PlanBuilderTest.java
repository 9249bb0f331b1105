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
package org.vulnplan.remediation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.Asset;
import org.vulnplan.model.Exploitability;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixActionType;
import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RemediationPhase;
import org.vulnplan.model.RemediationPlan;
import org.vulnplan.model.RemediationTier;
import org.vulnplan.model.WarningCode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.tuple;
import static org.vulnplan.remediation.TestFindings.dependencyFinding;
import static org.vulnplan.remediation.TestFindings.finding;

class PlanBuilderTest {

    private static final Instant GENERATED_AT = Instant.parse("2024-05-01T12:00:00Z");

    private final PlanBuilder planBuilder = new PlanBuilder(ScoringConfig.defaults());

    @Test
    void shouldRejectUnscoredFindings() {
        final Finding unscored = dependencyFinding("CVE-2024-0001", 7.5, "4.17.21");

        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> planBuilder.build(List.of(unscored), GENERATED_AT, List.of()))
                .withMessage("Finding CVE-2024-0001:npm/lodash@4.17.20 has not been scored");
    }

    @Test
    void shouldAlwaysContainAllPhases() {
        final RemediationPlan plan = planBuilder.build(List.of(), GENERATED_AT, List.of());

        assertThat(plan.phases())
                .extracting(RemediationPhase::tier, phase -> phase.findings().size(), RemediationPhase::estimatedEffortHours)
                .containsExactly(
                        tuple(RemediationTier.CRITICAL, 0, 0.0),
                        tuple(RemediationTier.HIGH, 0, 0.0),
                        tuple(RemediationTier.MEDIUM, 0, 0.0),
                        tuple(RemediationTier.LOW, 0, 0.0));
        assertThat(plan.totalEffortHours()).isZero();
        assertThat(plan.generatedAt()).isEqualTo(GENERATED_AT);
    }

    @Test
    void shouldBucketFindingsByRiskScore() {
        final RemediationPlan plan = planBuilder.build(List.of(
                dependencyFinding("CVE-2024-0001", 9.8, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0002", 7.0, "1.0.0").withRiskScore(7.0),
                dependencyFinding("CVE-2024-0003", 5.0, "1.0.0").withRiskScore(4.0),
                dependencyFinding("CVE-2024-0004", 1.0, "1.0.0").withRiskScore(1.2)), GENERATED_AT, List.of());

        assertThat(plan.phases())
                .extracting(RemediationPhase::tier, phase -> phase.findings().stream().map(Finding::vulnId).toList())
                .containsExactly(
                        tuple(RemediationTier.CRITICAL, List.of("CVE-2024-0001")),
                        tuple(RemediationTier.HIGH, List.of("CVE-2024-0002")),
                        tuple(RemediationTier.MEDIUM, List.of("CVE-2024-0003")),
                        tuple(RemediationTier.LOW, List.of("CVE-2024-0004")));
        assertThat(plan.allFindings()).extracting(Finding::tier).containsExactly(
                RemediationTier.CRITICAL, RemediationTier.HIGH, RemediationTier.MEDIUM, RemediationTier.LOW);
    }

    @Test
    void shouldOrderByRiskScoreThenCvssThenCanonicalId() {
        final RemediationPlan plan = planBuilder.build(List.of(
                dependencyFinding("CVE-2024-0001", null, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0002", 7.0, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0003", 9.1, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0004", 7.0, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0005", 2.0, "1.0.0").withRiskScore(9.5)), GENERATED_AT, List.of());

        assertThat(plan.phase(RemediationTier.CRITICAL)).hasValueSatisfying(phase ->
                assertThat(phase.findings()).extracting(Finding::vulnId).containsExactly(
                        "CVE-2024-0005",
                        "CVE-2024-0003",
                        "CVE-2024-0002",
                        "CVE-2024-0004",
                        "CVE-2024-0001"));
    }

    @Test
    void shouldSumEffortPerPhase() {
        final RemediationPlan plan = planBuilder.build(List.of(
                dependencyFinding("CVE-2024-0001", 9.8, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0002", 9.8, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0003", 9.8, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0004", 5.0, "1.0.0").withRiskScore(5.0),
                dependencyFinding("CVE-2024-0005", 1.0, "1.0.0").withRiskScore(1.0)), GENERATED_AT, List.of());

        assertThat(plan.phases())
                .extracting(RemediationPhase::tier, RemediationPhase::estimatedEffortHours)
                .containsExactly(
                        tuple(RemediationTier.CRITICAL, 3.0),
                        tuple(RemediationTier.HIGH, 0.0),
                        tuple(RemediationTier.MEDIUM, 0.25),
                        tuple(RemediationTier.LOW, 0.1));
        assertThat(plan.totalEffortHours()).isEqualTo(3.35);
    }

    @Test
    void shouldAttachFixActionAndTests() {
        final RemediationPlan plan = planBuilder.build(
                List.of(dependencyFinding("CVE-2021-23337", 7.2, "4.17.21").withRiskScore(7.0)), GENERATED_AT, List.of());

        assertThat(plan.allFindings()).satisfiesExactly(finding -> {
            assertThat(finding.fixAction()).isNotNull();
            assertThat(finding.fixAction().type()).isEqualTo(FixActionType.VERSION_BUMP);
            assertThat(finding.fixAction().commands()).containsExactly("npm install lodash@4.17.21");
            assertThat(finding.tests()).isNotNull();
            assertThat(finding.needsManualReview()).isFalse();
        });
        assertThat(plan.warnings()).isEmpty();
    }

    @Test
    void shouldFlagDependencyWithoutFixedVersionForManualReview() {
        final RemediationPlan plan = planBuilder.build(
                List.of(dependencyFinding("CVE-2024-0001", 7.2, null).withRiskScore(7.0)), GENERATED_AT, List.of());

        assertThat(plan.allFindings()).satisfiesExactly(finding -> {
            assertThat(finding.fixAction()).isNotNull();
            assertThat(finding.fixAction().commands()).isEmpty();
            assertThat(finding.needsManualReview()).isTrue();
        });
    }

    @Test
    void shouldWarnAboutUnsupportedAssetKind() {
        final var lambda = new Asset("aws", "image-resizer", "12", "serverless.yml", "serverless-function", null);
        final Finding finding = finding("CVE-2024-0001", lambda, 8.0, Exploitability.EXPLOIT_AVAILABLE, null).withRiskScore(6.9);
        final var upstreamWarning = new PlanWarning(WarningCode.SOURCE_TIMEOUT, "osv", "osv", "Source did not complete within PT30S");

        final RemediationPlan plan = planBuilder.build(List.of(finding), GENERATED_AT, List.of(upstreamWarning));

        assertThat(plan.allFindings()).satisfiesExactly(planned -> {
            assertThat(planned.tier()).isEqualTo(RemediationTier.HIGH);
            assertThat(planned.fixAction()).isNull();
            assertThat(planned.needsManualReview()).isTrue();
            assertThat(planned.tests()).isNotNull();
            assertThat(planned.tests().remediation().assertion())
                    .isEqualTo("manual remediation of CVE-2024-0001 is applied to aws/image-resizer@12");
        });
        assertThat(plan.warnings()).containsExactly(
                upstreamWarning,
                new PlanWarning(
                        WarningCode.UNSUPPORTED_ASSET_KIND,
                        "nvd",
                        "CVE-2024-0001:aws/image-resizer@12",
                        "No fix action is known for asset kind \"serverless-function\" of CVE-2024-0001:aws/image-resizer@12"));
    }

    @Test
    void shouldLogUnsupportedAssetKindWithoutStackTrace() {
        final var lambda = new Asset("aws", "image-resizer", "12", "serverless.yml", "serverless-function", null);
        final Finding finding = finding("CVE-2024-0001", lambda, 8.0, Exploitability.EXPLOIT_AVAILABLE, null).withRiskScore(6.9);

        final var logger = (Logger) LoggerFactory.getLogger(PlanBuilder.class);
        final var appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        try {
            planBuilder.build(List.of(finding), GENERATED_AT, List.of());
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(appender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .satisfiesExactly(event -> {
                    assertThat(event.getFormattedMessage()).isEqualTo(
                            "No fix action for CVE-2024-0001:aws/image-resizer@12; Flagging it for manual review: "
                                    + "No fix action is known for asset kind \"serverless-function\" of CVE-2024-0001:aws/image-resizer@12");
                    assertThat(event.getThrowableProxy()).isNull();
                });
    }

    @Test
    void shouldUseConfiguredThresholdsAndEffort() {
        final var scoringConfig = new ScoringConfig(
                ScoringWeights.defaults(),
                new PhaseThresholds(9.5, 9.0, 8.0),
                new EffortEstimates(Map.of(
                        RemediationTier.CRITICAL, new BigDecimal("4"),
                        RemediationTier.HIGH, new BigDecimal("2"),
                        RemediationTier.MEDIUM, new BigDecimal("1"),
                        RemediationTier.LOW, new BigDecimal("0.333"))));

        final RemediationPlan plan = new PlanBuilder(scoringConfig).build(List.of(
                dependencyFinding("CVE-2024-0001", 9.8, "1.0.0").withRiskScore(9.0),
                dependencyFinding("CVE-2024-0002", 9.8, "1.0.0").withRiskScore(7.0),
                dependencyFinding("CVE-2024-0003", 9.8, "1.0.0").withRiskScore(7.0)), GENERATED_AT, List.of());

        assertThat(plan.phase(RemediationTier.HIGH)).map(RemediationPhase::estimatedEffortHours).hasValue(2.0);
        assertThat(plan.phase(RemediationTier.LOW)).map(RemediationPhase::estimatedEffortHours).hasValue(0.67);
        assertThat(plan.totalEffortHours()).isEqualTo(2.67);
    }

}
