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

import org.jspecify.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The canonical, deduplicated record of one vulnerability affecting one {@link Asset}.
 * <p>
 * Findings are created by aggregation, and enriched by scoring and planning.
 * Each enrichment step produces a new instance.
 *
 * @param canonicalId       Identity of the finding, unique within a plan.
 * @param vulnId            Canonical vulnerability identifier.
 * @param aliases           Other identifiers of the vulnerability, sorted.
 * @param matchedAsset      The affected asset.
 * @param affectedRange     Normalized affected version range, as reported by the highest-priority source.
 * @param fixedVersion      Lowest version that fixes the vulnerability for {@code matchedAsset}, if known.
 * @param title             Short title.
 * @param description       Long description.
 * @param references        Reference URLs, deduplicated.
 * @param cvss              CVSS base score in the range {@code [0, 10]}, if known.
 * @param cvssVector        CVSS vector, if known.
 * @param exploitability    Exploitability tier.
 * @param criticality       Criticality tier of the matched asset.
 * @param exposure          Exposure tier of the matched asset.
 * @param sources           IDs of all sources that reported the finding, in priority order.
 * @param riskScore         Computed risk score in the range {@code [0, 10]}. {@code null} until scored.
 * @param tier              Remediation tier. {@code null} until planned.
 * @param fixAction         Remediation action. {@code null} when none could be determined.
 * @param tests             Verification tests. {@code null} until planned.
 * @param needsManualReview Whether the remediation must be reviewed by a human.
 */
public record Finding(
        String canonicalId,
        String vulnId,
        List<String> aliases,
        Asset matchedAsset,
        String affectedRange,
        @Nullable String fixedVersion,
        @Nullable String title,
        @Nullable String description,
        List<String> references,
        @Nullable Double cvss,
        @Nullable String cvssVector,
        Exploitability exploitability,
        Criticality criticality,
        Exposure exposure,
        List<String> sources,
        @Nullable Double riskScore,
        @Nullable RemediationTier tier,
        @Nullable FixAction fixAction,
        @Nullable VerificationTests tests,
        boolean needsManualReview) {

    public Finding {
        requireNonNull(canonicalId, "canonicalId must not be null");
        requireNonNull(vulnId, "vulnId must not be null");
        requireNonNull(matchedAsset, "matchedAsset must not be null");
        requireNonNull(affectedRange, "affectedRange must not be null");
        requireNonNull(exploitability, "exploitability must not be null");
        requireNonNull(criticality, "criticality must not be null");
        requireNonNull(exposure, "exposure must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    public Finding withRiskScore(final double riskScore) {
        return new Finding(canonicalId, vulnId, aliases, matchedAsset, affectedRange, fixedVersion,
                title, description, references, cvss, cvssVector, exploitability, criticality, exposure,
                sources, riskScore, tier, fixAction, tests, needsManualReview);
    }

    public Finding withRemediation(
            final RemediationTier tier,
            final @Nullable FixAction fixAction,
            final VerificationTests tests,
            final boolean needsManualReview) {
        return new Finding(canonicalId, vulnId, aliases, matchedAsset, affectedRange, fixedVersion,
                title, description, references, cvss, cvssVector, exploitability, criticality, exposure,
                sources, riskScore, tier, fixAction, tests, needsManualReview);
    }

    /**
     * @return A copy of this finding with risk score and CVSS rounded to one decimal place.
     */
    public Finding rounded() {
        return new Finding(canonicalId, vulnId, aliases, matchedAsset, affectedRange, fixedVersion,
                title, description, references,
                cvss != null ? Scores.roundToOneDecimal(cvss) : null,
                cvssVector, exploitability, criticality, exposure, sources,
                riskScore != null ? Scores.roundToOneDecimal(riskScore) : null,
                tier, fixAction, tests, needsManualReview);
    }

    public boolean scored() {
        return riskScore != null;
    }

    public @Nullable Double roundedRiskScore() {
        return riskScore != null ? Scores.roundToOneDecimal(riskScore) : null;
    }

}
