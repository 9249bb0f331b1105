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

import org.jspecify.annotations.Nullable;
import org.vulnplan.model.Exploitability;
import org.vulnplan.vulnmatching.range.AffectedRange;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A normalized {@link org.vulnplan.model.RawFindingRecord}, not yet matched against assets.
 *
 * @param sourceId       ID of the reporting source.
 * @param priority       Resolved priority of the source. Lower is more important.
 * @param vulnId         Canonical vulnerability identifier.
 * @param aliases        Other identifiers of the vulnerability.
 * @param coordinates    Normalized coordinates of the affected package.
 * @param affectedRange  Parsed affected version range.
 * @param cvss           CVSS base score, if known.
 * @param cvssVector     CVSS vector, if known.
 * @param exploitability Exploitability as reported by the source, if reported at all.
 * @param title          Short title.
 * @param description    Long description.
 * @param references     Reference URLs.
 * @param fetchedAt      When the record was retrieved.
 */
public record FindingFragment(
        String sourceId,
        int priority,
        String vulnId,
        List<String> aliases,
        PackageCoordinates coordinates,
        AffectedRange affectedRange,
        @Nullable Double cvss,
        @Nullable String cvssVector,
        @Nullable Exploitability exploitability,
        @Nullable String title,
        @Nullable String description,
        List<String> references,
        @Nullable Instant fetchedAt) {

    /**
     * Total order in which fragments of the same finding are merged.
     * <p>
     * Fragments of higher-priority sources come first. The remaining criteria only make
     * the order independent of the order in which records were received: fragments that
     * compare equal do not differ in any field that is merged.
     */
    public static final Comparator<FindingFragment> MERGE_ORDER = Comparator
            .comparingInt(FindingFragment::priority)
            .thenComparing(FindingFragment::sourceId)
            .thenComparing(fragment -> fragment.affectedRange().expression())
            .thenComparing(FindingFragment::cvss, Comparator.nullsLast(Comparator.<Double>reverseOrder()))
            .thenComparing(FindingFragment::title, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(FindingFragment::description, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(FindingFragment::cvssVector, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(FindingFragment::fetchedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(FindingFragment::exploitability, Comparator.nullsLast(Comparator.<Exploitability>naturalOrder()))
            .thenComparing(FindingFragment::aliases, FindingFragment::compareLexicographically)
            .thenComparing(FindingFragment::references, FindingFragment::compareLexicographically);

    public FindingFragment {
        requireNonNull(sourceId, "sourceId must not be null");
        requireNonNull(vulnId, "vulnId must not be null");
        requireNonNull(coordinates, "coordinates must not be null");
        requireNonNull(affectedRange, "affectedRange must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
    }

    private static int compareLexicographically(final List<String> left, final List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            final int result = left.get(i).compareTo(right.get(i));
            if (result != 0) {
                return result;
            }
        }

        return Integer.compare(left.size(), right.size());
    }

}
