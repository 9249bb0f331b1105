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

import java.util.ArrayList;
import java.util.List;

/**
 * Rotates an exposed secret, and keeps the file it was found in out of version control.
 */
final class SecretRotationStrategy implements FixActionStrategy {

    @Override
    public FixAction fixFor(final Finding finding) {
        final Asset secret = finding.matchedAsset();
        final String exposedFile = secret.filePath();

        final var commands = new ArrayList<String>();
        if (exposedFile != null) {
            commands.add("git rm --cached " + exposedFile);
            commands.add("echo '%s' >> .gitignore".formatted(exposedFile));
        }

        final var instructions = new ArrayList<String>();
        instructions.add("Rotate the credential %s at its issuer, and revoke the exposed value".formatted(secret.name()));
        if (exposedFile != null) {
            instructions.add("Add %s to .gitignore".formatted(exposedFile));
            instructions.add("Purge %s from the repository history".formatted(exposedFile));
        }

        return new FixAction(
                FixActionType.SECRET_ROTATION,
                "Rotate exposed secret " + secret.name(),
                commands,
                List.copyOf(instructions),
                exposedFile != null ? ".gitignore" : null);
    }

}
