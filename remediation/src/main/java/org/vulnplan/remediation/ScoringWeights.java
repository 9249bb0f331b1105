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

/**
 * Weights of the risk score factors.
 *
 * @param cvss           Weight of the CVSS base score.
 * @param exploitability Weight of the exploitability tier.
 * @param criticality    Weight of the asset criticality tier.
 * @param exposure       Weight of the asset exposure tier.
 */
public record ScoringWeights(double cvss, double exploitability, double criticality, double exposure) {

    static final double SUM_TOLERANCE = 1e-9;

    private static final ScoringWeights DEFAULTS = new ScoringWeights(0.3, 0.3, 0.2, 0.2);

    public ScoringWeights {
        requireInUnitInterval("cvss", cvss);
        requireInUnitInterval("exploitability", exploitability);
        requireInUnitInterval("criticality", criticality);
        requireInUnitInterval("exposure", exposure);

        final double sum = cvss + exploitability + criticality + exposure;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException(
                    "Weights must sum to 1.0, but sum to %s (cvss=%s, exploitability=%s, criticality=%s, exposure=%s)"
                            .formatted(sum, cvss, exploitability, criticality, exposure));
        }
    }

    public static ScoringWeights defaults() {
        return DEFAULTS;
    }

    private static void requireInUnitInterval(final String name, final double weight) {
        if (!(weight >= 0.0 && weight <= 1.0)) {
            throw new InvalidWeightsException(
                    "Weight %s must be within [0, 1], but is %s".formatted(name, weight));
        }
    }

}
