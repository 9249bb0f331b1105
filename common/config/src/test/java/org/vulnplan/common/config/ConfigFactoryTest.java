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
package org.vulnplan.common.config;

import io.smallrye.config.SmallRyeConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigFactoryTest {

    @Test
    void withDefaultsShouldResolveExpressions() {
        final SmallRyeConfig config = ConfigFactory.withDefaults(Map.ofEntries(
                Map.entry("base", "0.2"),
                Map.entry("vulnplan.scoring.exposure-weight", "${base}")));

        assertThat(config.getOptionalValue("vulnplan.scoring.exposure-weight", Double.class)).contains(0.2);
    }

}
