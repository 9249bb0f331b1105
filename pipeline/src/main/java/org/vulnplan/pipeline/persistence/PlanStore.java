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
package org.vulnplan.pipeline.persistence;

import org.vulnplan.model.RemediationPlan;

import java.io.IOException;
import java.util.Optional;

/**
 * Stores the latest {@link RemediationPlan} of each project.
 */
public interface PlanStore {

    /**
     * @param projectPath Path of the project, as passed to asset discovery.
     * @return The latest plan of the project, or {@link Optional#empty()} when none has been saved yet.
     * @throws IOException When the stored plan could not be read.
     */
    Optional<RemediationPlan> load(String projectPath) throws IOException;

    /**
     * Replaces the latest plan of the project.
     *
     * @throws IOException When the plan could not be written.
     */
    void save(String projectPath, RemediationPlan plan) throws IOException;

}
