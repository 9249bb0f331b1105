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

import org.eclipse.microprofile.config.Config;
import org.vulnplan.common.config.NamespacedConfig;
import org.vulnplan.model.RemediationTier;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of risk scoring and remediation planning.
 * <p>
 * All invariants are validated on construction, such that an invalid configuration
 * is rejected before any finding is scored.
 *
 * @param weights         Weights of the risk score factors.
 * @param thresholds      Risk score thresholds of the remediation tiers.
 * @param effortEstimates Effort to remediate a single finding, per tier.
 */
public record ScoringConfig(
        ScoringWeights weights,
        PhaseThresholds thresholds,
        EffortEstimates effortEstimates) {

    public static final String CONFIG_NAMESPACE = "vulnplan.scoring";
    static final String CONFIG_CVSS_WEIGHT = "cvss-weight";
    static final String CONFIG_EXPLOITABILITY_WEIGHT = "exploitability-weight";
    static final String CONFIG_CRITICALITY_WEIGHT = "criticality-weight";
    static final String CONFIG_EXPOSURE_WEIGHT = "exposure-weight";
    static final String CONFIG_THRESHOLDS = "thresholds";
    static final String CONFIG_EFFORT_HOURS = "effort-hours";

    private static final ScoringConfig DEFAULTS = new ScoringConfig(
            ScoringWeights.defaults(),
            PhaseThresholds.defaults(),
            EffortEstimates.defaults());

    public ScoringConfig {
        requireNonNull(weights, "weights must not be null");
        requireNonNull(thresholds, "thresholds must not be null");
        requireNonNull(effortEstimates, "effortEstimates must not be null");
    }

    public static ScoringConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the configuration from the {@value #CONFIG_NAMESPACE} namespace of {@code config}.
     * Properties that are not set fall back to their defaults.
     *
     * @throws InvalidScoringConfigException When a property can not be converted, or the resulting configuration is invalid.
     */
    public static ScoringConfig fromConfig(final Config config) {
        final var scoringConfig = new NamespacedConfig(config, CONFIG_NAMESPACE);
        final ScoringWeights defaultWeights = ScoringWeights.defaults();
        final PhaseThresholds defaultThresholds = PhaseThresholds.defaults();

        final var weights = new ScoringWeights(
                getDouble(scoringConfig, CONFIG_CVSS_WEIGHT, defaultWeights.cvss()),
                getDouble(scoringConfig, CONFIG_EXPLOITABILITY_WEIGHT, defaultWeights.exploitability()),
                getDouble(scoringConfig, CONFIG_CRITICALITY_WEIGHT, defaultWeights.criticality()),
                getDouble(scoringConfig, CONFIG_EXPOSURE_WEIGHT, defaultWeights.exposure()));

        final NamespacedConfig thresholdsConfig = scoringConfig.child(CONFIG_THRESHOLDS);
        final var thresholds = new PhaseThresholds(
                getDouble(thresholdsConfig, RemediationTier.CRITICAL.label(), defaultThresholds.critical()),
                getDouble(thresholdsConfig, RemediationTier.HIGH.label(), defaultThresholds.high()),
                getDouble(thresholdsConfig, RemediationTier.MEDIUM.label(), defaultThresholds.medium()));

        final NamespacedConfig effortConfig = scoringConfig.child(CONFIG_EFFORT_HOURS);
        final var hoursByTier = new EnumMap<RemediationTier, BigDecimal>(RemediationTier.class);
        for (final RemediationTier tier : RemediationTier.values()) {
            hoursByTier.put(tier, getDecimal(effortConfig, tier.label(), EffortEstimates.defaults().hoursFor(tier)));
        }

        return new ScoringConfig(weights, thresholds, new EffortEstimates(hoursByTier));
    }

    private static double getDouble(final NamespacedConfig config, final String propertyName, final double defaultValue) {
        try {
            return config.getOptionalValue(propertyName, Double.class).orElse(defaultValue);
        } catch (IllegalArgumentException | NoSuchElementException e) {
            throw new InvalidScoringConfigException("Invalid value for %s".formatted(propertyName), e);
        }
    }

    private static BigDecimal getDecimal(final NamespacedConfig config, final String propertyName, final BigDecimal defaultValue) {
        final String value = config.getOptionalValue(propertyName, String.class).orElse(null);
        if (value == null) {
            return defaultValue;
        }

        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidScoringConfigException(
                    "Invalid value for %s: %s is not a decimal number".formatted(propertyName, value), e);
        }
    }

}
