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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Arrays;
import java.util.Locale;

/**
 * Network exposure of an {@link Asset}, derived from its {@value Asset#EXPOSURE_TAG} tag.
 */
public enum Exposure {

    INTERNET_FACING(10, "internet-facing"),
    INTERNAL(5, "internal"),
    ISOLATED(2, "isolated");

    private final int score;
    private final String tagValue;

    Exposure(final int score, final String tagValue) {
        this.score = score;
        this.tagValue = tagValue;
    }

    @JsonValue
    public int score() {
        return score;
    }

    public String tagValue() {
        return tagValue;
    }

    /**
     * @param tagValue Value of the asset tag, may be {@code null}.
     * @return The matching {@link Exposure}, or {@link #ISOLATED} when the tag is absent or unknown.
     */
    public static Exposure fromTag(final @Nullable String tagValue) {
        if (tagValue == null) {
            return ISOLATED;
        }

        final String normalized = tagValue.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(value -> value.tagValue.equals(normalized))
                .findFirst()
                .orElse(ISOLATED);
    }

    @JsonCreator
    public static Exposure fromScore(final int score) {
        return Arrays.stream(values())
                .filter(value -> value.score == score)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Invalid exposure score: " + score));
    }

}
