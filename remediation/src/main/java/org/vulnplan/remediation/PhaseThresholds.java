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

import org.vulnplan.model.RemediationTier;

/**
 * Lower risk score bounds of the remediation tiers. Scores below {@code medium} are {@link RemediationTier#LOW}.
 *
 * @param critical Lowest score of {@link RemediationTier#CRITICAL}.
 * @param high     Lowest score of {@link RemediationTier#HIGH}.
 * @param medium   Lowest score of {@link RemediationTier#MEDIUM}.
 */
public record PhaseThresholds(double critical, double high, double medium) {

    private static final PhaseThresholds DEFAULTS = new PhaseThresholds(8.5, 6.5, 4.0);

    public PhaseThresholds {
        if (!(critical <= 10.0 && critical > high && high > medium && medium >= 0.0)) {
            throw new InvalidScoringConfigException(
                    "Thresholds must be strictly descending within [0, 10], but are critical=%s, high=%s, medium=%s"
                            .formatted(critical, high, medium));
        }
    }

    public static PhaseThresholds defaults() {
        return DEFAULTS;
    }

    public RemediationTier tierOf(final double riskScore) {
        if (riskScore >= critical) {
            return RemediationTier.CRITICAL;
        } else if (riskScore >= high) {
            return RemediationTier.HIGH;
        } else if (riskScore >= medium) {
            return RemediationTier.MEDIUM;
        }

        return RemediationTier.LOW;
    }

}
