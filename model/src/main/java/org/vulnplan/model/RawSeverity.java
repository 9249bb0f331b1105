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

/**
 * Severity information as reported by a single source, in that source's vocabulary.
 *
 * @param score            A CVSS base score, if the source reports one.
 * @param vector           A CVSS vector, if the source reports one.
 * @param label            A qualitative severity label, e.g. {@code MODERATE}.
 * @param exploitAvailable Whether the source indicates a public exploit exists.
 */
public record RawSeverity(
        @Nullable Double score,
        @Nullable String vector,
        @Nullable String label,
        boolean exploitAvailable) {

    private static final RawSeverity NONE = new RawSeverity(null, null, null, false);

    public static RawSeverity none() {
        return NONE;
    }

    public static RawSeverity ofScore(final double score) {
        return new RawSeverity(score, null, null, false);
    }

    public static RawSeverity ofVector(final String vector) {
        return new RawSeverity(null, vector, null, false);
    }

    public static RawSeverity ofLabel(final String label) {
        return new RawSeverity(null, null, label, false);
    }

    public RawSeverity withExploitAvailable(final boolean exploitAvailable) {
        return new RawSeverity(score, vector, label, exploitAvailable);
    }

}
