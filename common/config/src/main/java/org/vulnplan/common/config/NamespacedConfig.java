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

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigValue;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.eclipse.microprofile.config.spi.Converter;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Config} view that scopes all property lookups to a namespace,
 * e.g. {@code vulnplan.scoring}.
 */
public final class NamespacedConfig implements Config {

    private final Config delegate;
    private final String prefix;

    public NamespacedConfig(Config delegate, String namespace) {
        this.delegate = requireNonNull(delegate, "delegate must not be null");
        this.prefix = requireNonNull(namespace, "namespace must not be null").endsWith(".") ? namespace : namespace + ".";
    }

    /**
     * @param namespace The nested namespace, relative to this one.
     * @return A {@link NamespacedConfig} for {@code <this namespace>.<namespace>}.
     */
    public NamespacedConfig child(String namespace) {
        return new NamespacedConfig(delegate, prefix + requireNonNull(namespace, "namespace must not be null"));
    }

    @Override
    public <T> T getValue(String propertyName, Class<T> propertyType) {
        return delegate.getValue(prefix + propertyName, propertyType);
    }

    @Override
    public ConfigValue getConfigValue(String propertyName) {
        return delegate.getConfigValue(prefix + propertyName);
    }

    @Override
    public <T> Optional<T> getOptionalValue(String propertyName, Class<T> propertyType) {
        return delegate.getOptionalValue(prefix + propertyName, propertyType);
    }

    /**
     * @return Property names below this namespace, without the namespace prefix, in natural order.
     */
    @Override
    public Iterable<String> getPropertyNames() {
        return StreamSupport.stream(delegate.getPropertyNames().spliterator(), false)
                .filter(name -> name.startsWith(prefix))
                .map(name -> name.substring(prefix.length()))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @return The distinct first segments of all property names below this namespace.
     * For {@code vulnplan.source-priority.nvd} in namespace {@code vulnplan.source-priority},
     * this yields {@code nvd}.
     */
    public Set<String> getChildNames() {
        return StreamSupport.stream(getPropertyNames().spliterator(), false)
                .map(name -> name.contains(".") ? name.substring(0, name.indexOf('.')) : name)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public Iterable<ConfigSource> getConfigSources() {
        return delegate.getConfigSources();
    }

    @Override
    public <T> Optional<Converter<T>> getConverter(Class<T> forType) {
        return delegate.getConverter(forType);
    }

    @Override
    public <T> T unwrap(Class<T> type) {
        throw new UnsupportedOperationException();
    }

}
