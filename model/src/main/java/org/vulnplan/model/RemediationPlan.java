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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A phased remediation plan.
 * <p>
 * Plans are fully computed: consumers must neither re-score nor re-order their findings.
 *
 * @param generatedAt      Point in time of the vulnerability data the plan is based on.
 * @param phases           Phases ordered from {@link RemediationTier#CRITICAL} to {@link RemediationTier#LOW}.
 * @param totalEffortHours Sum of the estimated effort of all phases.
 * @param warnings         Non-fatal problems encountered while building the plan.
 */
public record RemediationPlan(
        Instant generatedAt,
        List<RemediationPhase> phases,
        double totalEffortHours,
        List<PlanWarning> warnings) {

    public RemediationPlan {
        requireNonNull(generatedAt, "generatedAt must not be null");
        phases = phases != null ? List.copyOf(phases) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Optional<RemediationPhase> phase(final RemediationTier tier) {
        return phases.stream()
                .filter(phase -> phase.tier() == tier)
                .findFirst();
    }

    /**
     * @return All findings of the plan, in plan order.
     */
    public List<Finding> allFindings() {
        return phases.stream()
                .flatMap(phase -> phase.findings().stream())
                .toList();
    }

    /**
     * @return A copy of this plan with all scores rounded to one decimal place.
     */
    public RemediationPlan rounded() {
        final List<RemediationPhase> roundedPhases = phases.stream()
                .map(phase -> new RemediationPhase(
                        phase.tier(),
                        phase.findings().stream().map(Finding::rounded).toList(),
                        phase.estimatedEffortHours()))
                .toList();
        return new RemediationPlan(generatedAt, roundedPhases, totalEffortHours, warnings);
    }

}
