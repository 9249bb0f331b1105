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

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Estimated hours it takes to remediate a single finding, per {@link RemediationTier}.
 */
public final class EffortEstimates {

    private static final EffortEstimates DEFAULTS = new EffortEstimates(Map.of(
            RemediationTier.CRITICAL, new BigDecimal("1.0"),
            RemediationTier.HIGH, new BigDecimal("0.5"),
            RemediationTier.MEDIUM, new BigDecimal("0.25"),
            RemediationTier.LOW, new BigDecimal("0.1")));

    private final Map<RemediationTier, BigDecimal> hoursByTier;

    public EffortEstimates(final Map<RemediationTier, BigDecimal> hoursByTier) {
        requireNonNull(hoursByTier, "hoursByTier must not be null");

        final var validatedHours = new EnumMap<RemediationTier, BigDecimal>(RemediationTier.class);
        for (final RemediationTier tier : RemediationTier.values()) {
            final BigDecimal hours = hoursByTier.get(tier);
            if (hours == null) {
                throw new InvalidScoringConfigException("No effort estimate for tier " + tier.label());
            }
            if (hours.signum() < 0) {
                throw new InvalidScoringConfigException(
                        "Effort estimate for tier %s must not be negative, but is %s".formatted(tier.label(), hours));
            }

            validatedHours.put(tier, hours);
        }

        this.hoursByTier = Collections.unmodifiableMap(validatedHours);
    }

    public static EffortEstimates defaults() {
        return DEFAULTS;
    }

    public BigDecimal hoursFor(final RemediationTier tier) {
        return hoursByTier.get(tier);
    }

    public Map<RemediationTier, BigDecimal> asMap() {
        return hoursByTier;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof final EffortEstimates that)) {
            return false;
        }

        for (final RemediationTier tier : RemediationTier.values()) {
            if (hoursFor(tier).compareTo(that.hoursFor(tier)) != 0) {
                return false;
            }
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (final RemediationTier tier : RemediationTier.values()) {
            result = 31 * result + hoursFor(tier).stripTrailingZeros().hashCode();
        }

        return result;
    }

    @Override
    public String toString() {
        return "EffortEstimates" + hoursByTier;
    }

}
