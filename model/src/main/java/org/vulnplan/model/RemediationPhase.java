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

import static java.util.Objects.requireNonNull;

/**
 * @param tier                 The risk tier of this phase.
 * @param findings             Findings to remediate in this phase, in remediation order.
 * @param estimatedEffortHours Estimated effort to remediate all findings of this phase.
 */
public record RemediationPhase(
        RemediationTier tier,
        List<Finding> findings,
        double estimatedEffortHours) {

    public RemediationPhase {
        requireNonNull(tier, "tier must not be null");
        findings = findings != null ? List.copyOf(findings) : List.of();
    }

}
