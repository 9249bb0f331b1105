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

import java.util.List;

/**
 * Partition of finding IDs between two consecutive {@link RemediationPlan}s.
 *
 * @param newFindings IDs of findings only present in the current plan.
 * @param unchanged   IDs of findings present in both plans, with the same risk score.
 * @param changed     IDs of findings present in both plans, with a different risk score.
 * @param resolved    IDs of findings only present in the previous plan.
 */
public record PlanDiff(
        List<String> newFindings,
        List<String> unchanged,
        List<String> changed,
        List<String> resolved) {

    public PlanDiff {
        newFindings = newFindings != null ? List.copyOf(newFindings) : List.of();
        unchanged = unchanged != null ? List.copyOf(unchanged) : List.of();
        changed = changed != null ? List.copyOf(changed) : List.of();
        resolved = resolved != null ? List.copyOf(resolved) : List.of();
    }

    public boolean hasChanges() {
        return !newFindings.isEmpty() || !changed.isEmpty() || !resolved.isEmpty();
    }

}
