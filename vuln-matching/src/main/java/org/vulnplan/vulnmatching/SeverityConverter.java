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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.Exploitability;
import org.vulnplan.model.RawSeverity;
import org.vulnplan.vulndatasource.api.KnownSources;
import us.springett.cvss.Cvss;
import us.springett.cvss.MalformedVectorException;

import java.util.Locale;

/**
 * Converts source-specific severity information to CVSS base scores and exploitability tiers.
 */
public final class SeverityConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SeverityConverter.class);

    /**
     * @param score  CVSS base score in the range {@code [0, 10]}, if it could be determined.
     * @param vector CVSS vector the score is based on, if any.
     */
    public record CvssRating(@Nullable Double score, @Nullable String vector) {

        private static final CvssRating UNKNOWN = new CvssRating(null, null);

        public static CvssRating unknown() {
            return UNKNOWN;
        }

    }

    /**
     * Determines the CVSS base score of {@code severity}.
     * <p>
     * In order of preference: an explicit score within {@code [0, 10]}, the score
     * calculated from a CVSS v2 or v3.x vector, or the score a qualitative label
     * stands for.
     */
    public CvssRating convert(final RawSeverity severity) {
        final String vector = severity.vector() != null && !severity.vector().isBlank()
                ? severity.vector().trim()
                : null;

        if (severity.score() != null) {
            final double score = severity.score();
            if (score >= 0.0 && score <= 10.0) {
                return new CvssRating(score, vector);
            }

            LOGGER.debug("Ignoring CVSS score {} as it is outside of the valid range", score);
        }

        if (vector != null) {
            final Double calculatedScore = calculateScore(vector);
            if (calculatedScore != null) {
                return new CvssRating(calculatedScore, vector);
            }
        }

        final Double labelScore = scoreOfLabel(severity.label());
        if (labelScore != null) {
            return new CvssRating(labelScore, null);
        }

        return CvssRating.unknown();
    }

    /**
     * @return The {@link Exploitability} a source reports, or {@code null} when it does not report any.
     */
    public @Nullable Exploitability exploitabilityOf(final String sourceId, final RawSeverity severity) {
        if (KnownSources.CISA_KEV.equals(sourceId)) {
            return Exploitability.ACTIVELY_EXPLOITED;
        } else if (severity.exploitAvailable()) {
            return Exploitability.EXPLOIT_AVAILABLE;
        }

        return null;
    }

    private static @Nullable Double calculateScore(final String vector) {
        final Cvss cvss;
        try {
            cvss = Cvss.fromVector(vector);
        } catch (MalformedVectorException | IllegalArgumentException e) {
            LOGGER.debug("CVSS vector {} is malformed; Ignoring it", vector, e);
            return null;
        }

        if (cvss == null) {
            LOGGER.debug("Unrecognized CVSS vector {}", vector);
            return null;
        }

        return cvss.calculateScore().getBaseScore();
    }

    static @Nullable Double scoreOfLabel(final @Nullable String label) {
        if (label == null) {
            return null;
        }

        return switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "CRITICAL" -> 9.0;
            case "HIGH" -> 7.0;
            case "MEDIUM", "MODERATE" -> 5.0;
            case "LOW" -> 2.0;
            default -> null;
        };
    }

}
