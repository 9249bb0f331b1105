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
package org.vulnplan.pipeline;

import org.vulnplan.model.PlanDiff;
import org.vulnplan.model.RemediationPlan;

import static java.util.Objects.requireNonNull;

/**
 * @param plan The plan of the current run.
 * @param diff Changes of {@code plan} relative to the plan of the previous run.
 */
public record PipelineResult(RemediationPlan plan, PlanDiff diff) {

    public PipelineResult {
        requireNonNull(plan, "plan must not be null");
        requireNonNull(diff, "diff must not be null");
    }

}
