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
package org.vulnplan.vulndatasource.api;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

import static java.util.Objects.requireNonNull;

/**
 * Precedence of vulnerability sources when merging their records.
 * <p>
 * A lower number signals a higher priority. Substituting or adding a source
 * is a change to this table, not to the merging logic.
 */
public final class SourcePriorities {

    private static final SourcePriorities DEFAULTS = builder()
            .withPriority(KnownSources.CISA_KEV, 1)
            .withPriority(KnownSources.NVD, 2)
            .withPriority(KnownSources.GITHUB, 3)
            .withPriority(KnownSources.OSV, 4)
            .build();

    private final Map<String, Integer> priorityBySourceId;

    private SourcePriorities(final Map<String, Integer> priorityBySourceId) {
        this.priorityBySourceId = Collections.unmodifiableMap(new TreeMap<>(priorityBySourceId));
    }

    /**
     * @return The default table: {@code cisa-kev=1, nvd=2, github=3, osv=4}.
     */
    public static SourcePriorities defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(priorityBySourceId);
    }

    public OptionalInt priorityOf(final String sourceId) {
        final Integer priority = priorityBySourceId.get(sourceId);
        return priority != null ? OptionalInt.of(priority) : OptionalInt.empty();
    }

    /**
     * @param sourceId         ID of the source.
     * @param fallbackPriority Priority to use when the table has no entry for {@code sourceId}.
     * @return The priority of the source.
     */
    public int priorityOf(final String sourceId, final int fallbackPriority) {
        return priorityBySourceId.getOrDefault(sourceId, fallbackPriority);
    }

    /**
     * @return A {@link Comparator} ordering source IDs by priority, then by ID.
     * Unknown sources are ordered after all known ones.
     */
    public Comparator<String> sourceIdComparator() {
        return Comparator
                .<String>comparingInt(sourceId -> priorityOf(sourceId, Integer.MAX_VALUE))
                .thenComparing(Comparator.naturalOrder());
    }

    public Map<String, Integer> asMap() {
        return priorityBySourceId;
    }

    @Override
    public String toString() {
        return "SourcePriorities" + priorityBySourceId;
    }

    public static final class Builder {

        private final Map<String, Integer> priorityBySourceId;

        private Builder(final Map<String, Integer> priorityBySourceId) {
            this.priorityBySourceId = new LinkedHashMap<>(priorityBySourceId);
        }

        public Builder withPriority(final String sourceId, final int priority) {
            requireNonNull(sourceId, "sourceId must not be null");
            if (priority < 1) {
                throw new IllegalArgumentException(
                        "Priority of source %s must be positive, but is %d".formatted(sourceId, priority));
            }

            priorityBySourceId.put(sourceId, priority);
            return this;
        }

        public SourcePriorities build() {
            return new SourcePriorities(priorityBySourceId);
        }

    }

}
