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

import org.vulnplan.model.AssetKind;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Selects the {@link FixActionStrategy} for a finding based on the {@link AssetKind} of its asset.
 */
public final class FixActionDispatcher {

    private final Map<AssetKind, FixActionStrategy> strategyByKind;

    public FixActionDispatcher(final Map<AssetKind, FixActionStrategy> strategyByKind) {
        requireNonNull(strategyByKind, "strategyByKind must not be null");
        this.strategyByKind = strategyByKind.isEmpty()
                ? new EnumMap<>(AssetKind.class)
                : new EnumMap<>(strategyByKind);
    }

    public static FixActionDispatcher defaults() {
        final var strategyByKind = new EnumMap<AssetKind, FixActionStrategy>(AssetKind.class);
        strategyByKind.put(AssetKind.DEPENDENCY, new DependencyBumpStrategy());
        strategyByKind.put(AssetKind.CONTAINER_IMAGE, new BaseImageUpdateStrategy());
        strategyByKind.put(AssetKind.IAC_RESOURCE, new ManifestPatchStrategy());
        strategyByKind.put(AssetKind.SECRET_EXPOSURE, new SecretRotationStrategy());
        return new FixActionDispatcher(strategyByKind);
    }

    /**
     * @throws UnsupportedAssetKindException When the asset's kind is unknown, or has no registered strategy.
     */
    public FixAction dispatch(final Finding finding) throws UnsupportedAssetKindException {
        final AssetKind assetKind = finding.matchedAsset().assetKind().orElse(null);
        final FixActionStrategy strategy = assetKind != null ? strategyByKind.get(assetKind) : null;
        if (strategy == null) {
            throw new UnsupportedAssetKindException(finding.matchedAsset().kind(), finding.canonicalId());
        }

        return strategy.fixFor(finding);
    }

}
