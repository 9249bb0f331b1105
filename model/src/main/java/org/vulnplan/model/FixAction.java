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
 * A concrete remediation step for a single {@link Finding}.
 *
 * @param type         Type of the action.
 * @param summary      One-line summary of the action.
 * @param commands     Shell commands that perform the action, in order.
 * @param instructions Manual steps that accompany the commands, e.g. lockfile updates.
 * @param targetFile   File the action modifies, if any.
 */
public record FixAction(
        FixActionType type,
        String summary,
        List<String> commands,
        List<String> instructions,
        @Nullable String targetFile) {

    public FixAction {
        requireNonNull(type, "type must not be null");
        requireNonNull(summary, "summary must not be null");
        commands = commands != null ? List.copyOf(commands) : List.of();
        instructions = instructions != null ? List.copyOf(instructions) : List.of();
    }

}
