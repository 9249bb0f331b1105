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

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * A single scanned unit of a project, as reported by asset discovery.
 *
 * @param ecosystem Ecosystem the asset belongs to, e.g. {@code npm}, {@code pypi}, {@code docker}.
 * @param name      Name of the asset within its ecosystem.
 * @param version   Version of the asset.
 * @param filePath  Path of the file the asset was discovered in, relative to the project root.
 * @param kind      Raw asset kind as reported by discovery. See {@link AssetKind}.
 * @param tags      Free-form tags. {@value #CRITICALITY_TAG} and {@value #EXPOSURE_TAG} are recognized.
 */
public record Asset(
        String ecosystem,
        String name,
        String version,
        @Nullable String filePath,
        String kind,
        SortedMap<String, String> tags) {

    public static final String CRITICALITY_TAG = "criticality";
    public static final String EXPOSURE_TAG = "exposure";

    public Asset {
        requireNonNull(ecosystem, "ecosystem must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(version, "version must not be null");
        requireNonNull(kind, "kind must not be null");
        tags = tags != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(tags))
                : Collections.emptySortedMap();
    }

    public static Asset of(
            final String ecosystem,
            final String name,
            final String version,
            final @Nullable String filePath,
            final AssetKind kind,
            final Map<String, String> tags) {
        return new Asset(ecosystem, name, version, filePath, kind.kindName(), new TreeMap<>(tags));
    }

    public static Asset dependency(final String ecosystem, final String name, final String version, final String filePath) {
        return of(ecosystem, name, version, filePath, AssetKind.DEPENDENCY, Map.of());
    }

    public Asset withTag(final String name, final String value) {
        final var newTags = new TreeMap<>(tags);
        newTags.put(name, value);
        return new Asset(ecosystem, this.name, version, filePath, kind, newTags);
    }

    public Optional<AssetKind> assetKind() {
        return AssetKind.fromName(kind);
    }

    public Criticality criticality() {
        return Criticality.fromTag(tags.get(CRITICALITY_TAG));
    }

    public Exposure exposure() {
        return Exposure.fromTag(tags.get(EXPOSURE_TAG));
    }

    /**
     * @return A short, human-readable reference to this asset, e.g. {@code npm/lodash@4.17.20}.
     */
    public String displayName() {
        return "%s/%s@%s".formatted(ecosystem, name, version);
    }

}
