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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.vulnplan.model.Asset;
import org.vulnplan.model.AssetKind;
import org.vulnplan.model.Exploitability;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;
import org.vulnplan.model.FixActionType;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.vulnplan.remediation.TestFindings.finding;

class FixActionDispatcherTest {

    private final FixActionDispatcher dispatcher = FixActionDispatcher.defaults();

    @ParameterizedTest
    @CsvSource(delimiterString = "->", value = {
            "npm    -> lodash                  -> 4.17.21 -> npm install lodash@4.17.21",
            "pypi   -> django                  -> 3.2.19  -> pip install --upgrade \"django==3.2.19\"",
            "maven  -> org.yaml:snakeyaml      -> 2.0     -> mvn versions:use-dep-version -Dincludes=org.yaml:snakeyaml -DdepVersion=2.0 -DforceVersion=true",
            "go     -> golang.org/x/net        -> 0.17.0  -> go get golang.org/x/net@v0.17.0",
            "cargo  -> hyper                   -> 0.14.26 -> cargo update -p hyper --precise 0.14.26",
            "nuget  -> Newtonsoft.Json         -> 13.0.1  -> dotnet add package Newtonsoft.Json --version 13.0.1",
            "gem    -> nokogiri                -> 1.15.4  -> bundle update nokogiri --conservative"
    })
    void shouldBumpDependencyWithEcosystemTooling(
            final String ecosystem, final String name, final String fixedVersion, final String expectedCommand) throws Exception {
        final Asset asset = Asset.dependency(ecosystem, name, "0.0.1", "manifest");

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2024-0001", asset, 7.0, Exploitability.THEORETICAL, fixedVersion));

        assertThat(fixAction.type()).isEqualTo(FixActionType.VERSION_BUMP);
        assertThat(fixAction.summary()).isEqualTo("Upgrade %s from 0.0.1 to %s".formatted(name, fixedVersion));
        assertThat(fixAction.commands()).first().isEqualTo(expectedCommand);
        assertThat(fixAction.targetFile()).isEqualTo("manifest");
    }

    @Test
    void shouldInstructLockfileUpdate() throws Exception {
        final Asset asset = Asset.dependency("golang", "golang.org/x/net", "0.10.0", "go.mod");

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2023-44487", asset, 7.5, Exploitability.ACTIVELY_EXPLOITED, "v0.17.0"));

        assertThat(fixAction.commands()).containsExactly("go get golang.org/x/net@v0.17.0", "go mod tidy");
        assertThat(fixAction.instructions()).containsExactly("Commit the updated go.sum together with go.mod");
    }

    @Test
    void shouldFallBackToGenericInstructionsForUnknownEcosystem() throws Exception {
        final Asset asset = Asset.dependency("hex", "plug", "1.14.0", "mix.exs");

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2024-0001", asset, 5.0, Exploitability.THEORETICAL, "1.15.0"));

        assertThat(fixAction.commands()).isEmpty();
        assertThat(fixAction.instructions()).containsExactly("Update plug to 1.15.0 in mix.exs using the hex tooling");
    }

    @Test
    void shouldNotGuessCommandsWithoutFixedVersion() throws Exception {
        final Asset asset = Asset.dependency("npm", "lodash", "4.17.20", "package.json");

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2024-0001", asset, 5.0, Exploitability.THEORETICAL, null));

        assertThat(fixAction.summary()).isEqualTo("Upgrade lodash to a version that fixes CVE-2024-0001");
        assertThat(fixAction.commands()).isEmpty();
    }

    @Test
    void shouldUpdateBaseImage() throws Exception {
        final Asset image = Asset.of("docker", "nginx", "1.21.0", "deploy/Dockerfile", AssetKind.CONTAINER_IMAGE, Map.of());

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2024-0001", image, 8.1, Exploitability.THEORETICAL, "1.25.3"));

        assertThat(fixAction.type()).isEqualTo(FixActionType.BASE_IMAGE_UPDATE);
        assertThat(fixAction.summary()).isEqualTo("Update base image nginx:1.21.0 to nginx:1.25.3");
        assertThat(fixAction.commands()).containsExactly(
                "sed -i 's|FROM nginx:1.21.0|FROM nginx:1.25.3|' deploy/Dockerfile",
                "docker build --pull -f deploy/Dockerfile .");
        assertThat(fixAction.targetFile()).isEqualTo("deploy/Dockerfile");
    }

    @Test
    void shouldDefaultToDockerfileWithoutFilePath() throws Exception {
        final Asset image = Asset.of("docker", "alpine", "3.14", null, AssetKind.CONTAINER_IMAGE, Map.of());

        final FixAction fixAction = dispatcher.dispatch(finding("CVE-2024-0001", image, 8.1, Exploitability.THEORETICAL, null));

        assertThat(fixAction.commands()).isEmpty();
        assertThat(fixAction.targetFile()).isEqualTo("Dockerfile");
    }

    @ParameterizedTest
    @CsvSource({
            "infra/main.tf, Patch Terraform resource aws_s3_bucket, terraform plan",
            "k8s/deployment.yaml, Patch Kubernetes resource aws_s3_bucket, kubectl diff -f k8s/deployment.yaml",
    })
    void shouldPatchManifest(final String manifest, final String expectedSummary, final String expectedCommand) throws Exception {
        final Asset resource = Asset.of("iac", "aws_s3_bucket", "1", manifest, AssetKind.IAC_RESOURCE, Map.of());

        final FixAction fixAction = dispatcher.dispatch(finding("CKV-2024-0001", resource, 6.0, Exploitability.THEORETICAL, null));

        assertThat(fixAction.type()).isEqualTo(FixActionType.MANIFEST_PATCH);
        assertThat(fixAction.summary()).isEqualTo(expectedSummary);
        assertThat(fixAction.commands()).first().isEqualTo(expectedCommand);
        assertThat(fixAction.instructions()).contains("Issue: Title of CKV-2024-0001");
    }

    @Test
    void shouldRotateSecret() throws Exception {
        final Asset secret = Asset.of("secret", "aws-access-key", "1", "config/.env", AssetKind.SECRET_EXPOSURE, Map.of());

        final FixAction fixAction = dispatcher.dispatch(finding("SECRET-0001", secret, null, Exploitability.EXPLOIT_AVAILABLE, null));

        assertThat(fixAction.type()).isEqualTo(FixActionType.SECRET_ROTATION);
        assertThat(fixAction.commands()).containsExactly("git rm --cached config/.env", "echo 'config/.env' >> .gitignore");
        assertThat(fixAction.instructions()).first().asString().startsWith("Rotate the credential aws-access-key");
        assertThat(fixAction.targetFile()).isEqualTo(".gitignore");
    }

    @Test
    void shouldThrowForUnknownAssetKind() {
        final var asset = new Asset("aws", "image-resizer", "12", null, "serverless-function", null);
        final Finding finding = finding("CVE-2024-0001", asset, 5.0, Exploitability.THEORETICAL, null);

        assertThatThrownBy(() -> dispatcher.dispatch(finding))
                .isInstanceOf(UnsupportedAssetKindException.class)
                .hasMessage("No fix action is known for asset kind \"serverless-function\" of CVE-2024-0001:aws/image-resizer@12")
                .extracting("assetKind")
                .isEqualTo("serverless-function");
    }

    @Test
    void shouldThrowForUnregisteredAssetKind() {
        final var dispatcherWithoutSecrets = new FixActionDispatcher(Map.of(AssetKind.DEPENDENCY, new DependencyBumpStrategy()));
        final Asset secret = Asset.of("secret", "token", "1", ".env", AssetKind.SECRET_EXPOSURE, Map.of());

        assertThatExceptionOfType(UnsupportedAssetKindException.class)
                .isThrownBy(() -> dispatcherWithoutSecrets.dispatch(finding("SECRET-0001", secret, null, Exploitability.THEORETICAL, null)));
    }

}
