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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A single vulnerability report, as returned by a single source.
 * <p>
 * Identifiers, ranges and severities are in the source's own format.
 * Records are not validated beyond their source, as rejecting malformed
 * records is the job of normalization.
 *
 * @param sourceId       Identifier of the source, e.g. {@code nvd}.
 * @param sourcePriority Priority the source claims for itself. Only used when the
 *                       priority table in use has no entry for {@code sourceId}.
 * @param vulnId         Vulnerability identifier, e.g. {@code CVE-2021-44228} or {@code GHSA-jfh8-c2jp-5v3q}.
 * @param aliases        Other identifiers of the same vulnerability.
 * @param ecosystem      Ecosystem of the affected package.
 * @param packageName    Name of the affected package.
 * @param affectedRange  Affected version range, in the source's syntax.
 * @param severity       Severity information.
 * @param title          Short title.
 * @param description    Long description.
 * @param references     Reference URLs.
 * @param fetchedAt      When the record was retrieved from the source.
 */
public record RawFindingRecord(
        String sourceId,
        int sourcePriority,
        @Nullable String vulnId,
        List<String> aliases,
        @Nullable String ecosystem,
        @Nullable String packageName,
        @Nullable String affectedRange,
        RawSeverity severity,
        @Nullable String title,
        @Nullable String description,
        List<String> references,
        @Nullable Instant fetchedAt) {

    public RawFindingRecord {
        requireNonNull(sourceId, "sourceId must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        severity = severity != null ? severity : RawSeverity.none();
        references = references != null ? List.copyOf(references) : List.of();
    }

    public static Builder builder(final String sourceId) {
        return new Builder(sourceId);
    }

    public static final class Builder {

        private final String sourceId;
        private int sourcePriority = Integer.MAX_VALUE;
        private @Nullable String vulnId;
        private final List<String> aliases = new ArrayList<>();
        private @Nullable String ecosystem;
        private @Nullable String packageName;
        private @Nullable String affectedRange;
        private RawSeverity severity = RawSeverity.none();
        private @Nullable String title;
        private @Nullable String description;
        private final List<String> references = new ArrayList<>();
        private @Nullable Instant fetchedAt;

        private Builder(final String sourceId) {
            this.sourceId = requireNonNull(sourceId, "sourceId must not be null");
        }

        public Builder sourcePriority(final int sourcePriority) {
            this.sourcePriority = sourcePriority;
            return this;
        }

        public Builder vulnId(final String vulnId) {
            this.vulnId = vulnId;
            return this;
        }

        public Builder alias(final String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder affects(final String ecosystem, final String packageName, final String affectedRange) {
            this.ecosystem = ecosystem;
            this.packageName = packageName;
            this.affectedRange = affectedRange;
            return this;
        }

        public Builder severity(final RawSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(final String title) {
            this.title = title;
            return this;
        }

        public Builder description(final String description) {
            this.description = description;
            return this;
        }

        public Builder reference(final String reference) {
            this.references.add(reference);
            return this;
        }

        public Builder fetchedAt(final Instant fetchedAt) {
            this.fetchedAt = fetchedAt;
            return this;
        }

        public RawFindingRecord build() {
            return new RawFindingRecord(
                    sourceId,
                    sourcePriority,
                    vulnId,
                    aliases,
                    ecosystem,
                    packageName,
                    affectedRange,
                    severity,
                    title,
                    description,
                    references,
                    fetchedAt);
        }

    }

}
