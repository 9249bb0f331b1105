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
package org.vulnplan.vulnmatching;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PackageCoordinatesTest {

    @ParameterizedTest
    @CsvSource({
            "pip, Django_REST.framework, pypi, django-rest-framework",
            "PyPI, zope.interface, pypi, zope-interface",
            "npm, Lodash, npm, lodash",
            "go, github.com/Sirupsen/logrus, golang, github.com/Sirupsen/logrus",
            "crates, Serde, cargo, serde",
            "NuGet, Newtonsoft.Json, nuget, newtonsoft.json",
            "maven, org.apache.logging.log4j:log4j-core, maven, org.apache.logging.log4j:log4j-core"
    })
    void shouldNormalizeCoordinates(
            final String ecosystem,
            final String name,
            final String expectedEcosystem,
            final String expectedName) {
        final PackageCoordinates coordinates = PackageCoordinates.of(ecosystem, name);

        assertThat(coordinates.ecosystem()).isEqualTo(expectedEcosystem);
        assertThat(coordinates.name()).isEqualTo(expectedName);
    }

    @ParameterizedTest
    @CsvSource({
            "npm, lodash, ' 4.17.20 ', npm/lodash@4.17.20",
            "pip, Flask, 2.0.0, pypi/flask@2.0.0"
    })
    void shouldBuildIdentity(final String ecosystem, final String name, final String version, final String expectedIdentity) {
        assertThat(PackageCoordinates.of(ecosystem, name).identityOf(version)).isEqualTo(expectedIdentity);
    }

}
