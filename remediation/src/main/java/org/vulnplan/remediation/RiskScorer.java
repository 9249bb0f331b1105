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

import org.vulnplan.model.Finding;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Computes the risk score of findings as the weighted sum of CVSS, exploitability,
 * asset criticality and asset exposure.
 * <p>
 * An unknown CVSS counts as {@code 0}. The unrounded score is retained.
 */
public final class RiskScorer {

    private final ScoringWeights weights;

    public RiskScorer(final ScoringWeights weights) {
        this.weights = requireNonNull(weights, "weights must not be null");
    }

    public Finding score(final Finding finding) {
        final double cvss = finding.cvss() != null ? finding.cvss() : 0.0;
        final double riskScore = cvss * weights.cvss()
                + finding.exploitability().score() * weights.exploitability()
                + finding.criticality().score() * weights.criticality()
                + finding.exposure().score() * weights.exposure();

        return finding.withRiskScore(riskScore);
    }

    public List<Finding> scoreAll(final List<Finding> findings) {
        return findings.stream()
                .map(this::score)
                .toList();
    }

}
