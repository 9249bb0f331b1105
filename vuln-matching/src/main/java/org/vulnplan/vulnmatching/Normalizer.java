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

import org.vulnplan.model.RawFindingRecord;
import org.vulnplan.vulndatasource.api.SourcePriorities;
import org.vulnplan.vulnmatching.range.AffectedRange;
import org.vulnplan.vulnmatching.range.AffectedRangeParser;
import org.vulnplan.vulnmatching.range.InvalidRangeException;

import java.util.LinkedHashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.StringUtils.trimToNull;

/**
 * Converts {@link RawFindingRecord}s of any source into {@link FindingFragment}s.
 * <p>
 * Normalization is pure, and safe to be invoked concurrently.
 */
public final class Normalizer {

    private final SourcePriorities sourcePriorities;
    private final AffectedRangeParser rangeParser;
    private final SeverityConverter severityConverter;
    private final VulnIdCanonicalizer vulnIdCanonicalizer;

    public Normalizer(
            final SourcePriorities sourcePriorities,
            final AffectedRangeParser rangeParser,
            final SeverityConverter severityConverter,
            final VulnIdCanonicalizer vulnIdCanonicalizer) {
        this.sourcePriorities = requireNonNull(sourcePriorities, "sourcePriorities must not be null");
        this.rangeParser = requireNonNull(rangeParser, "rangeParser must not be null");
        this.severityConverter = requireNonNull(severityConverter, "severityConverter must not be null");
        this.vulnIdCanonicalizer = requireNonNull(vulnIdCanonicalizer, "vulnIdCanonicalizer must not be null");
    }

    public Normalizer(final SourcePriorities sourcePriorities) {
        this(sourcePriorities, AffectedRangeParser.defaults(), new SeverityConverter(), new VulnIdCanonicalizer());
    }

    public FindingFragment normalize(final RawFindingRecord record) throws UnparsableRecordException {
        final String subject = describe(record);

        final VulnIdCanonicalizer.Identifiers identifiers = vulnIdCanonicalizer
                .resolve(record.vulnId(), record.aliases())
                .orElseThrow(() -> new UnparsableRecordException(
                        record.sourceId(), subject, "No vulnerability identifier"));

        final String ecosystem = trimToNull(record.ecosystem());
        final String packageName = trimToNull(record.packageName());
        if (ecosystem == null || packageName == null) {
            throw new UnparsableRecordException(record.sourceId(), subject, "No affected package");
        }

        final AffectedRange affectedRange;
        try {
            affectedRange = rangeParser.parse(record.affectedRange());
        } catch (InvalidRangeException e) {
            throw new UnparsableRecordException(record.sourceId(), subject, e.getMessage(), e);
        }

        final SeverityConverter.CvssRating cvssRating = severityConverter.convert(record.severity());

        return new FindingFragment(
                record.sourceId(),
                sourcePriorities.priorityOf(record.sourceId(), record.sourcePriority()),
                identifiers.vulnId(),
                identifiers.aliases(),
                PackageCoordinates.of(ecosystem, packageName),
                affectedRange,
                cvssRating.score(),
                cvssRating.vector(),
                severityConverter.exploitabilityOf(record.sourceId(), record.severity()),
                trimToNull(record.title()),
                trimToNull(record.description()),
                distinctReferences(record.references()),
                record.fetchedAt());
    }

    static String describe(final RawFindingRecord record) {
        final String vulnId = trimToNull(record.vulnId());
        final String packageName = trimToNull(record.packageName());
        if (packageName == null) {
            return vulnId != null ? vulnId : "<unidentified>";
        }

        return "%s (%s/%s)".formatted(vulnId != null ? vulnId : "<unidentified>", record.ecosystem(), packageName);
    }

    private static List<String> distinctReferences(final List<String> references) {
        final var distinct = new LinkedHashSet<String>();
        for (final String reference : references) {
            final String trimmed = trimToNull(reference);
            if (trimmed != null) {
                distinct.add(trimmed);
            }
        }

        return List.copyOf(distinct);
    }

}
