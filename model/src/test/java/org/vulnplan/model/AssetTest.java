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

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class AssetTest {

    @Test
    void shouldDefaultToLowestTiersWithoutTags() {
        final Asset asset = Asset.dependency("npm", "lodash", "4.17.20", "package-lock.json");

        assertThat(asset.criticality()).isEqualTo(Criticality.LOW);
        assertThat(asset.exposure()).isEqualTo(Exposure.ISOLATED);
        assertThat(asset.criticality().score()).isEqualTo(2);
        assertThat(asset.exposure().score()).isEqualTo(2);
    }

    @Test
    void shouldResolveTiersFromTags() {
        final Asset asset = Asset.dependency("npm", "lodash", "4.17.20", "package-lock.json")
                .withTag(Asset.CRITICALITY_TAG, "HIGH")
                .withTag(Asset.EXPOSURE_TAG, " internal ");

        assertThat(asset.criticality()).isEqualTo(Criticality.HIGH);
        assertThat(asset.exposure()).isEqualTo(Exposure.INTERNAL);
    }

    @Test
    void shouldFallBackToLowestTiersForUnknownTagValues() {
        final Asset asset = Asset.of("docker", "nginx", "1.25.3", "Dockerfile", AssetKind.CONTAINER_IMAGE,
                Map.of(Asset.CRITICALITY_TAG, "mission-critical", Asset.EXPOSURE_TAG, "dmz"));

        assertThat(asset.criticality()).isEqualTo(Criticality.LOW);
        assertThat(asset.exposure()).isEqualTo(Exposure.ISOLATED);
    }

    @Test
    void shouldResolveKnownKinds() {
        assertThat(Asset.dependency("pypi", "requests", "2.25.1", "requirements.txt").assetKind())
                .contains(AssetKind.DEPENDENCY);
        assertThat(new Asset("terraform", "aws_s3_bucket.logs", "5.0.0", "main.tf", "IaC-Resource", null).assetKind())
                .contains(AssetKind.IAC_RESOURCE);
        assertThat(new Asset("generic", "firmware", "1.0", null, "firmware-blob", null).assetKind())
                .isEmpty();
    }

    @Test
    void shouldSortAndFreezeTags() {
        final var tags = new TreeMap<String, String>();
        tags.put("exposure", "internet-facing");
        tags.put("criticality", "high");
        tags.put("owner", "payments");

        final var asset = new Asset("npm", "express", "4.17.1", "package.json", "dependency", tags);
        tags.put("extra", "value");

        assertThat(asset.tags()).containsOnlyKeys("criticality", "exposure", "owner");
        assertThat(asset.tags().keySet()).containsExactly("criticality", "exposure", "owner");
        assertThatExceptionOfType(UnsupportedOperationException.class)
                .isThrownBy(() -> asset.tags().put("foo", "bar"));
    }

    @Test
    void shouldRequireCoordinates() {
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> new Asset("npm", null, "1.0.0", null, "dependency", null))
                .withMessage("name must not be null");
    }

}
