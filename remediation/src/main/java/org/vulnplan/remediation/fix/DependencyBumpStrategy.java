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
import org.vulnplan.vulnmatching.PackageCoordinates;

import java.util.List;
import java.util.Objects;

/**
 * Bumps a vulnerable dependency to its fixed version, using the package manager of its ecosystem.
 */
final class DependencyBumpStrategy implements FixActionStrategy {

    private record PackageManager(@Nullable String lockfile, List<String> commandTemplates) {
    }

    @Override
    public FixAction fixFor(final Finding finding) {
        final Asset asset = finding.matchedAsset();
        final String ecosystem = PackageCoordinates.normalizeEcosystem(asset.ecosystem());
        final String fixedVersion = finding.fixedVersion();
        final String manifest = Objects.requireNonNullElse(asset.filePath(), "the dependency manifest");

        if (fixedVersion == null) {
            return new FixAction(
                    FixActionType.VERSION_BUMP,
                    "Upgrade %s to a version that fixes %s".formatted(asset.name(), finding.vulnId()),
                    List.of(),
                    List.of(
                            "No fixed version of %s is known; Consult %s for a patched release or a workaround"
                                    .formatted(asset.name(), finding.vulnId()),
                            "Update %s and its lockfile once a patched release is available".formatted(manifest)),
                    asset.filePath());
        }

        final PackageManager packageManager = packageManagerOf(ecosystem);
        if (packageManager == null) {
            return new FixAction(
                    FixActionType.VERSION_BUMP,
                    "Upgrade %s from %s to %s".formatted(asset.name(), asset.version(), fixedVersion),
                    List.of(),
                    List.of("Update %s to %s in %s using the %s tooling".formatted(
                            asset.name(), fixedVersion, manifest, ecosystem)),
                    asset.filePath());
        }

        // Go module versions carry a "v" prefix.
        final String commandVersion = "golang".equals(ecosystem) && !fixedVersion.startsWith("v")
                ? "v" + fixedVersion
                : fixedVersion;
        final List<String> commands = packageManager.commandTemplates().stream()
                .map(template -> template
                        .replace("{name}", asset.name())
                        .replace("{version}", commandVersion))
                .toList();

        return new FixAction(
                FixActionType.VERSION_BUMP,
                "Upgrade %s from %s to %s".formatted(asset.name(), asset.version(), fixedVersion),
                commands,
                List.of(packageManager.lockfile() != null
                        ? "Commit the updated %s together with %s".formatted(packageManager.lockfile(), manifest)
                        : "Commit the updated %s".formatted(manifest)),
                asset.filePath());
    }

    private static @Nullable PackageManager packageManagerOf(final String ecosystem) {
        return switch (ecosystem) {
            case "npm" -> new PackageManager("package-lock.json",
                    List.of("npm install {name}@{version}"));
            case "pypi" -> new PackageManager("requirements lock file",
                    List.of("pip install --upgrade \"{name}=={version}\""));
            case "maven" -> new PackageManager(null,
                    List.of("mvn versions:use-dep-version -Dincludes={name} -DdepVersion={version} -DforceVersion=true"));
            case "golang" -> new PackageManager("go.sum",
                    List.of("go get {name}@{version}", "go mod tidy"));
            case "cargo" -> new PackageManager("Cargo.lock",
                    List.of("cargo update -p {name} --precise {version}"));
            case "nuget" -> new PackageManager("packages.lock.json",
                    List.of("dotnet add package {name} --version {version}"));
            case "gem" -> new PackageManager("Gemfile.lock",
                    List.of("bundle update {name} --conservative"));
            default -> null;
        };
    }

}
