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

import org.vulnplan.model.Finding;
import org.vulnplan.model.PlanWarning;

import java.util.List;

/**
 * @param findings Deduplicated findings, sorted by canonical ID.
 * @param warnings Records that were skipped, and why.
 */
public record AggregationResult(List<Finding> findings, List<PlanWarning> warnings) {

    public AggregationResult {
        findings = findings != null ? List.copyOf(findings) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

}
