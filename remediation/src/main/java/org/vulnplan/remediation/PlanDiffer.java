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

import org.jspecify.annotations.Nullable;
import org.vulnplan.model.Finding;
import org.vulnplan.model.PlanDiff;
import org.vulnplan.model.RemediationPlan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Compares two consecutive {@link RemediationPlan}s of the same project by canonical finding ID.
 * <p>
 * Risk scores are compared after rounding, such that differences below display
 * precision do not count as changes.
 */
public final class PlanDiffer {

    /**
     * @param previous The previous plan, or {@code null} when there is none.
     * @param current  The current plan.
     * @return The {@link PlanDiff}. All ID lists are sorted.
     */
    public PlanDiff diff(final @Nullable RemediationPlan previous, final RemediationPlan current) {
        final Map<String, Double> previousScores = previous != null ? roundedScoresOf(previous) : Map.of();
        final Map<String, Double> currentScores = roundedScoresOf(current);

        final var newFindings = new ArrayList<String>();
        final var unchanged = new ArrayList<String>();
        final var changed = new ArrayList<String>();
        for (final String canonicalId : new TreeSet<>(currentScores.keySet())) {
            if (!previousScores.containsKey(canonicalId)) {
                newFindings.add(canonicalId);
            } else if (Objects.equals(previousScores.get(canonicalId), currentScores.get(canonicalId))) {
                unchanged.add(canonicalId);
            } else {
                changed.add(canonicalId);
            }
        }

        final List<String> resolved = new TreeSet<>(previousScores.keySet()).stream()
                .filter(canonicalId -> !currentScores.containsKey(canonicalId))
                .toList();

        return new PlanDiff(newFindings, unchanged, changed, resolved);
    }

    private static Map<String, Double> roundedScoresOf(final RemediationPlan plan) {
        final var scoresById = new HashMap<String, Double>();
        for (final Finding finding : plan.allFindings()) {
            scoresById.put(finding.canonicalId(), finding.roundedRiskScore());
        }

        return scoresById;
    }

}
