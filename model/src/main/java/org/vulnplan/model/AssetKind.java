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

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of {@link Asset}s the remediation planner knows how to fix.
 */
public enum AssetKind {

    DEPENDENCY("dependency"),
    CONTAINER_IMAGE("container-image"),
    IAC_RESOURCE("iac-resource"),
    SECRET_EXPOSURE("secret-exposure");

    private final String kindName;

    AssetKind(final String kindName) {
        this.kindName = kindName;
    }

    public String kindName() {
        return kindName;
    }

    public static Optional<AssetKind> fromName(final @Nullable String kindName) {
        if (kindName == null) {
            return Optional.empty();
        }

        return Arrays.stream(values())
                .filter(kind -> kind.kindName.equalsIgnoreCase(kindName.trim()))
                .findFirst();
    }

}
