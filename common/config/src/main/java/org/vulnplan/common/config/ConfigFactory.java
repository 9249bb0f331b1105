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

import io.smallrye.config.ExpressionConfigSourceInterceptor;
import io.smallrye.config.ProfileConfigSourceInterceptor;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.SmallRyeConfigFactory;
import io.smallrye.config.SmallRyeConfigProviderResolver;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.List;
import java.util.Map;

/**
 * Builds the {@link SmallRyeConfig} that backs all {@code vulnplan.*} settings.
 * <p>
 * Registered via {@code META-INF/services/io.smallrye.config.SmallRyeConfigFactory},
 * such that {@link ConfigProvider#getConfig()} picks it up.
 */
public final class ConfigFactory extends SmallRyeConfigFactory {

    static final List<String> PROFILES = List.of("prod", "dev", "test");

    @Override
    public SmallRyeConfig getConfigFor(
            final SmallRyeConfigProviderResolver configProviderResolver,
            final ClassLoader classLoader) {
        return newBuilder()
                .forClassLoader(classLoader)
                // | Source                                               | Priority |
                // | :--------------------------------------------------- | :------- |
                // | System properties                                    | 400      |
                // | Environment variables                                | 300      |
                // | ${pwd}/.env file                                     | 295      |
                // | ${pwd}/config/application.properties                 | 260      |
                // | ${classpath}/application.properties                  | 250      |
                // | ${classpath}/META-INF/microprofile-config.properties | 100      |
                .addDefaultSources()
                .addDiscoveredSources()
                .addDiscoveredCustomizers()
                .build();
    }

    /**
     * Builds a config from a fixed set of values, on top of the default sources.
     * <p>
     * Mostly useful for embedding the pipeline, and for tests.
     *
     * @param defaultValues Values to use when no other source provides them.
     * @return The {@link SmallRyeConfig}.
     */
    public static SmallRyeConfig withDefaults(final Map<String, String> defaultValues) {
        return newBuilder()
                .withDefaultValues(defaultValues)
                .build();
    }

    private static SmallRyeConfigBuilder newBuilder() {
        return new SmallRyeConfigBuilder()
                // https://smallrye.io/smallrye-config/Main/config/expressions/
                .withInterceptors(new ExpressionConfigSourceInterceptor())
                // https://smallrye.io/smallrye-config/Main/config/profiles/
                .withInterceptors(new ProfileConfigSourceInterceptor(PROFILES));
    }

}
