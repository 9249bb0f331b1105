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

import static java.util.Objects.requireNonNull;

/**
 * A non-fatal problem encountered while building a {@link RemediationPlan}.
 *
 * @param code     Category of the problem.
 * @param sourceId Vulnerability source involved, if any.
 * @param subject  What the problem is about, e.g. a vulnerability ID or asset.
 * @param message  Human-readable description.
 */
public record PlanWarning(
        WarningCode code,
        @Nullable String sourceId,
        String subject,
        String message) {

    public PlanWarning {
        requireNonNull(code, "code must not be null");
        requireNonNull(subject, "subject must not be null");
        requireNonNull(message, "message must not be null");
    }

}
