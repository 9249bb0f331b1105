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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.AssetKind;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;
import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RemediationPhase;
import org.vulnplan.model.RemediationPlan;
import org.vulnplan.model.RemediationTier;
import org.vulnplan.model.Scores;
import org.vulnplan.model.WarningCode;
import org.vulnplan.remediation.fix.FixActionDispatcher;
import org.vulnplan.remediation.fix.UnsupportedAssetKindException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Buckets scored findings into remediation phases, and attaches a fix action
 * and verification tests to each of them.
 */
public final class PlanBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanBuilder.class);

    /**
     * Order of findings within a phase: highest risk first, then highest CVSS
     * (unknown CVSS last), then canonical ID.
     */
    static final Comparator<Finding> REMEDIATION_ORDER = Comparator
            .comparing(Finding::riskScore, Comparator.<Double>reverseOrder())
            .thenComparing(Finding::cvss, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(Finding::canonicalId);

    private final ScoringConfig scoringConfig;
    private final FixActionDispatcher fixActionDispatcher;
    private final VerificationTestGenerator testGenerator;

    public PlanBuilder(
            final ScoringConfig scoringConfig,
            final FixActionDispatcher fixActionDispatcher,
            final VerificationTestGenerator testGenerator) {
        this.scoringConfig = requireNonNull(scoringConfig, "scoringConfig must not be null");
        this.fixActionDispatcher = requireNonNull(fixActionDispatcher, "fixActionDispatcher must not be null");
        this.testGenerator = requireNonNull(testGenerator, "testGenerator must not be null");
    }

    public PlanBuilder(final ScoringConfig scoringConfig) {
        this(scoringConfig, FixActionDispatcher.defaults(), new VerificationTestGenerator());
    }

    /**
     * @param findings         Scored findings.
     * @param generatedAt      Point in time of the vulnerability data the findings are based on.
     * @param upstreamWarnings Warnings of earlier stages, to be carried over into the plan.
     * @return The {@link RemediationPlan}, containing a phase for every {@link RemediationTier}.
     * @throws IllegalArgumentException When any of the {@code findings} has not been scored.
     */
    public RemediationPlan build(
            final List<Finding> findings,
            final Instant generatedAt,
            final List<PlanWarning> upstreamWarnings) {
        for (final Finding finding : findings) {
            if (!finding.scored()) {
                throw new IllegalArgumentException("Finding %s has not been scored".formatted(finding.canonicalId()));
            }
        }

        final var warnings = new ArrayList<>(upstreamWarnings);
        final var findingsByTier = new EnumMap<RemediationTier, List<Finding>>(RemediationTier.class);
        for (final RemediationTier tier : RemediationTier.values()) {
            findingsByTier.put(tier, new ArrayList<>());
        }

        final List<Finding> orderedFindings = findings.stream()
                .sorted(Comparator.comparing(Finding::canonicalId))
                .toList();
        for (final Finding finding : orderedFindings) {
            final Finding plannedFinding = plan(finding, warnings);
            findingsByTier.get(plannedFinding.tier()).add(plannedFinding);
        }

        final var phases = new ArrayList<RemediationPhase>(findingsByTier.size());
        BigDecimal totalEffortHours = BigDecimal.ZERO;
        for (final Map.Entry<RemediationTier, List<Finding>> entry : findingsByTier.entrySet()) {
            final RemediationTier tier = entry.getKey();
            final List<Finding> phaseFindings = entry.getValue().stream()
                    .sorted(REMEDIATION_ORDER)
                    .toList();

            final BigDecimal phaseEffortHours = scoringConfig.effortEstimates().hoursFor(tier)
                    .multiply(BigDecimal.valueOf(phaseFindings.size()));
            totalEffortHours = totalEffortHours.add(phaseEffortHours);

            phases.add(new RemediationPhase(tier, phaseFindings, Scores.roundHours(phaseEffortHours)));
        }

        LOGGER.info("Planned remediation of {} findings ({} critical, {} high, {} medium, {} low; {} warnings)",
                findings.size(),
                findingsByTier.get(RemediationTier.CRITICAL).size(),
                findingsByTier.get(RemediationTier.HIGH).size(),
                findingsByTier.get(RemediationTier.MEDIUM).size(),
                findingsByTier.get(RemediationTier.LOW).size(),
                warnings.size());

        return new RemediationPlan(generatedAt, phases, Scores.roundHours(totalEffortHours), warnings);
    }

    private Finding plan(final Finding finding, final List<PlanWarning> warnings) {
        final RemediationTier tier = scoringConfig.thresholds().tierOf(finding.riskScore());

        FixAction fixAction;
        boolean needsManualReview;
        try {
            fixAction = fixActionDispatcher.dispatch(finding);
            needsManualReview = finding.fixedVersion() == null
                    && finding.matchedAsset().assetKind().orElse(null) == AssetKind.DEPENDENCY;
        } catch (UnsupportedAssetKindException e) {
            LOGGER.warn("No fix action for {}; Flagging it for manual review: {}", finding.canonicalId(), e.getMessage());
            warnings.add(new PlanWarning(
                    WarningCode.UNSUPPORTED_ASSET_KIND,
                    finding.sources().isEmpty() ? null : finding.sources().get(0),
                    finding.canonicalId(),
                    e.getMessage()));
            fixAction = null;
            needsManualReview = true;
        }

        return finding.withRemediation(tier, fixAction, testGenerator.generate(finding, fixAction), needsManualReview);
    }

}
