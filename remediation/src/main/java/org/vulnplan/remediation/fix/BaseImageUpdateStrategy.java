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
package org.vulnplan.remediation.fix;

import org.vulnplan.model.Asset;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;
import org.vulnplan.model.FixActionType;

import java.util.List;
import java.util.Objects;

/**
 * Patches the {@code FROM} instruction of the Dockerfile that references a vulnerable image.
 */
final class BaseImageUpdateStrategy implements FixActionStrategy {

    private static final String DEFAULT_DOCKERFILE = "Dockerfile";

    @Override
    public FixAction fixFor(final Finding finding) {
        final Asset image = finding.matchedAsset();
        final String dockerfile = Objects.requireNonNullElse(image.filePath(), DEFAULT_DOCKERFILE);
        final String currentReference = image.name() + ":" + image.version();

        if (finding.fixedVersion() == null) {
            return new FixAction(
                    FixActionType.BASE_IMAGE_UPDATE,
                    "Replace base image %s with a patched tag".formatted(currentReference),
                    List.of(),
                    List.of(
                            "No patched tag of %s is known for %s; Pick the latest tag of the same release line"
                                    .formatted(image.name(), finding.vulnId()),
                            "Update the FROM instruction in %s, then rebuild and redeploy the image".formatted(dockerfile)),
                    dockerfile);
        }

        final String patchedReference = image.name() + ":" + finding.fixedVersion();
        return new FixAction(
                FixActionType.BASE_IMAGE_UPDATE,
                "Update base image %s to %s".formatted(currentReference, patchedReference),
                List.of(
                        "sed -i 's|FROM %s|FROM %s|' %s".formatted(currentReference, patchedReference, dockerfile),
                        "docker build --pull -f %s .".formatted(dockerfile)),
                List.of("Change the FROM instruction in %s from %s to %s, then rebuild and redeploy the image"
                        .formatted(dockerfile, currentReference, patchedReference)),
                dockerfile);
    }

}
