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

import org.jspecify.annotations.Nullable;
import org.vulnplan.model.Asset;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;
import org.vulnplan.model.FixActionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Patches the Terraform or Kubernetes manifest that declares a vulnerable infrastructure resource.
 */
final class ManifestPatchStrategy implements FixActionStrategy {

    @Override
    public FixAction fixFor(final Finding finding) {
        final Asset resource = finding.matchedAsset();
        final String manifest = resource.filePath();

        final var instructions = new ArrayList<String>();
        if (finding.fixedVersion() != null) {
            instructions.add("Set the version of %s to %s in %s".formatted(
                    resource.name(), finding.fixedVersion(), manifest != null ? manifest : "its manifest"));
        } else {
            instructions.add("Change the configuration of %s in %s to remediate %s".formatted(
                    resource.name(), manifest != null ? manifest : "its manifest", finding.vulnId()));
        }
        if (finding.title() != null) {
            instructions.add("Issue: " + finding.title());
        }

        return new FixAction(
                FixActionType.MANIFEST_PATCH,
                "Patch %s %s".formatted(flavorOf(manifest).displayName, resource.name()),
                commandsFor(manifest),
                instructions,
                manifest);
    }

    private enum Flavor {

        TERRAFORM("Terraform resource"),
        KUBERNETES("Kubernetes resource"),
        UNKNOWN("infrastructure resource");

        private final String displayName;

        Flavor(final String displayName) {
            this.displayName = displayName;
        }

    }

    private static Flavor flavorOf(final @Nullable String manifest) {
        if (manifest == null) {
            return Flavor.UNKNOWN;
        }

        final String lowerCaseManifest = manifest.toLowerCase(Locale.ROOT);
        if (lowerCaseManifest.endsWith(".tf") || lowerCaseManifest.endsWith(".tf.json")) {
            return Flavor.TERRAFORM;
        } else if (lowerCaseManifest.endsWith(".yaml") || lowerCaseManifest.endsWith(".yml")) {
            return Flavor.KUBERNETES;
        }

        return Flavor.UNKNOWN;
    }

    private static List<String> commandsFor(final @Nullable String manifest) {
        return switch (flavorOf(manifest)) {
            case TERRAFORM -> List.of("terraform plan", "terraform apply");
            case KUBERNETES -> List.of("kubectl diff -f " + manifest, "kubectl apply -f " + manifest);
            case UNKNOWN -> List.of();
        };
    }

}
