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

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.RemediationPlan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A {@link PlanStore} that keeps one JSON file per project in a base directory.
 * <p>
 * Files are named after the SHA-256 digest of the project path, such that
 * arbitrary paths map to valid file names.
 */
public final class FileSystemPlanStore implements PlanStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemPlanStore.class);

    private final Path baseDirPath;
    private final PlanCodec planCodec;

    public FileSystemPlanStore(final Path baseDirPath, final PlanCodec planCodec) {
        this.baseDirPath = requireNonNull(baseDirPath, "baseDirPath must not be null").toAbsolutePath().normalize();
        this.planCodec = requireNonNull(planCodec, "planCodec must not be null");
    }

    public FileSystemPlanStore(final Path baseDirPath) {
        this(baseDirPath, new PlanCodec());
    }

    @Override
    public Optional<RemediationPlan> load(final String projectPath) throws IOException {
        final Path planFilePath = resolvePlanFilePath(projectPath);

        final byte[] planJson;
        try {
            planJson = Files.readAllBytes(planFilePath);
        } catch (NoSuchFileException e) {
            LOGGER.debug("No previous plan found for {} at {}", projectPath, planFilePath);
            return Optional.empty();
        }

        return Optional.of(planCodec.decode(planJson));
    }

    @Override
    public void save(final String projectPath, final RemediationPlan plan) throws IOException {
        requireNonNull(plan, "plan must not be null");

        final Path planFilePath = resolvePlanFilePath(projectPath);
        Files.createDirectories(baseDirPath);

        // Write to a sibling file first, so readers never observe a partially written plan.
        final Path tempFilePath = Files.createTempFile(baseDirPath, planFilePath.getFileName().toString(), ".tmp");
        try {
            Files.write(tempFilePath, planCodec.encode(plan));
            Files.move(tempFilePath, planFilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tempFilePath);
        }

        LOGGER.debug("Saved plan for {} to {}", projectPath, planFilePath);
    }

    Path resolvePlanFilePath(final String projectPath) {
        requireNonNull(projectPath, "projectPath must not be null");
        return baseDirPath.resolve(DigestUtils.sha256Hex(projectPath) + ".json");
    }

}
