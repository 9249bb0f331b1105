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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vulnplan.model.RemediationPlan;
import org.vulnplan.remediation.PlanBuilder;
import org.vulnplan.remediation.ScoringConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemPlanStoreTest {

    @TempDir
    private Path tempDirPath;

    @Test
    void shouldReturnEmptyWhenNoPlanWasSaved() throws Exception {
        final var planStore = new FileSystemPlanStore(tempDirPath);

        assertThat(planStore.load("/srv/projects/web")).isEmpty();
    }

    @Test
    void shouldSaveAndLoadPlan() throws Exception {
        final var planStore = new FileSystemPlanStore(tempDirPath);
        final RemediationPlan plan = plan(Instant.parse("2024-05-01T12:00:00Z"));

        planStore.save("/srv/projects/web", plan);

        assertThat(planStore.load("/srv/projects/web")).contains(plan);
        assertThat(planStore.load("/srv/projects/api")).isEmpty();
    }

    @Test
    void shouldNameFileAfterDigestOfProjectPath() throws Exception {
        final var planStore = new FileSystemPlanStore(tempDirPath);

        planStore.save("foo", plan(Instant.EPOCH));

        assertThat(tempDirPath.resolve("2c26b46b68ffc68ff99b453c1d30413413422d706483bfa0f98a5e886266e7ae.json")).exists();
        try (final var files = Files.list(tempDirPath)) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void shouldReplacePreviousPlan() throws Exception {
        final var planStore = new FileSystemPlanStore(tempDirPath);
        planStore.save("/srv/projects/web", plan(Instant.EPOCH));

        final RemediationPlan newPlan = plan(Instant.parse("2024-05-01T12:00:00Z"));
        planStore.save("/srv/projects/web", newPlan);

        assertThat(planStore.load("/srv/projects/web")).contains(newPlan);
        assertThat(Files.readString(planStore.resolvePlanFilePath("/srv/projects/web"), StandardCharsets.UTF_8))
                .contains("\"2024-05-01T12:00:00Z\"");
    }

    private static RemediationPlan plan(final Instant generatedAt) {
        return new PlanBuilder(ScoringConfig.defaults()).build(List.of(), generatedAt, List.of());
    }

}
