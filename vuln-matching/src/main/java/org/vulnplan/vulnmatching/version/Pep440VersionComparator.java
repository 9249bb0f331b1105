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
package org.vulnplan.vulnmatching.version;

import org.jspecify.annotations.Nullable;
import org.vulnplan.vulnmatching.range.VersionInterval;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A {@link VersionComparator} for Python packages, ordering versions as defined in
 * <a href="https://peps.python.org/pep-0440/">PEP 440</a>.
 * <p>
 * Release segments of different length compare as if padded with zeros,
 * such that {@code 3.2} and {@code 3.2.0} are equal.
 */
public final class Pep440VersionComparator implements VersionComparator {

    static final String SCHEME_PYPI = "pypi";

    // https://peps.python.org/pep-0440/#appendix-b-parsing-version-strings-with-regular-expressions
    private static final Pattern VERSION_PATTERN = Pattern.compile("""
            v?\
            (?:(?<epoch>[0-9]+)!)?\
            (?<release>[0-9]+(?:\\.[0-9]+)*)\
            (?<pre>[-_.]?(?<preLabel>alpha|a|beta|b|preview|pre|c|rc)[-_.]?(?<preNumber>[0-9]+)?)?\
            (?<post>-(?<postImplicitNumber>[0-9]+)|[-_.]?(?:post|rev|r)[-_.]?(?<postNumber>[0-9]+)?)?\
            (?<dev>[-_.]?dev[-_.]?(?<devNumber>[0-9]+)?)?\
            (?:\\+(?<local>[a-z0-9]+(?:[-_.][a-z0-9]+)*))?""", Pattern.CASE_INSENSITIVE);

    @Override
    public String versioningScheme() {
        return SCHEME_PYPI;
    }

    @Override
    public int compare(final String left, final String right) {
        return Pep440Version.parse(left).compareTo(Pep440Version.parse(right));
    }

    @Override
    public boolean isWithin(final VersionInterval interval, final String version) {
        if (interval.isUnbounded()) {
            return true;
        }

        final Pep440Version parsedVersion = Pep440Version.parse(version);
        if (interval.isExact()) {
            return parsedVersion.compareTo(Pep440Version.parse(interval.lower())) == 0;
        }

        if (interval.lower() != null) {
            final int result = parsedVersion.compareTo(Pep440Version.parse(interval.lower()));
            if (result < 0 || (result == 0 && !interval.lowerInclusive())) {
                return false;
            }
        }
        if (interval.upper() != null) {
            final int result = parsedVersion.compareTo(Pep440Version.parse(interval.upper()));
            return result < 0 || (result == 0 && interval.upperInclusive());
        }

        return true;
    }

    @Override
    public String toString() {
        return "Pep440VersionComparator{versioningScheme=%s}".formatted(SCHEME_PYPI);
    }

    private enum PreReleasePhase {

        DEV_ONLY,
        ALPHA,
        BETA,
        RELEASE_CANDIDATE,
        NONE;

        private static PreReleasePhase ofLabel(final String label) {
            return switch (label.toLowerCase(Locale.ROOT)) {
                case "a", "alpha" -> ALPHA;
                case "b", "beta" -> BETA;
                default -> RELEASE_CANDIDATE;
            };
        }

    }

    private record Pep440Version(
            long epoch,
            List<Long> release,
            PreReleasePhase preReleasePhase,
            long preReleaseNumber,
            @Nullable Long postReleaseNumber,
            @Nullable Long devReleaseNumber,
            List<String> localSegments) implements Comparable<Pep440Version> {

        private static Pep440Version parse(final String version) {
            final Matcher matcher = VERSION_PATTERN.matcher(version.trim());
            if (!matcher.matches()) {
                throw new VersionComparisonException(
                        "Version %s is not a valid PEP 440 version".formatted(version));
            }

            try {
                final var release = new ArrayList<Long>();
                for (final String segment : matcher.group("release").split("\\.")) {
                    release.add(Long.parseLong(segment));
                }

                final Long postReleaseNumber;
                if (matcher.group("post") == null) {
                    postReleaseNumber = null;
                } else if (matcher.group("postImplicitNumber") != null) {
                    postReleaseNumber = Long.parseLong(matcher.group("postImplicitNumber"));
                } else {
                    postReleaseNumber = parseNumberOrZero(matcher.group("postNumber"));
                }

                final Long devReleaseNumber = matcher.group("dev") != null
                        ? parseNumberOrZero(matcher.group("devNumber"))
                        : null;

                final PreReleasePhase preReleasePhase;
                if (matcher.group("pre") != null) {
                    preReleasePhase = PreReleasePhase.ofLabel(matcher.group("preLabel"));
                } else if (postReleaseNumber == null && devReleaseNumber != null) {
                    // 1.0.dev0 sorts before 1.0a0.
                    preReleasePhase = PreReleasePhase.DEV_ONLY;
                } else {
                    preReleasePhase = PreReleasePhase.NONE;
                }

                final List<String> localSegments = matcher.group("local") != null
                        ? List.of(matcher.group("local").toLowerCase(Locale.ROOT).split("[-_.]"))
                        : List.of();

                return new Pep440Version(
                        matcher.group("epoch") != null ? Long.parseLong(matcher.group("epoch")) : 0,
                        List.copyOf(release),
                        preReleasePhase,
                        parseNumberOrZero(matcher.group("preNumber")),
                        postReleaseNumber,
                        devReleaseNumber,
                        localSegments);
            } catch (NumberFormatException e) {
                throw new VersionComparisonException(
                        "Version %s has a numeric segment that is out of range".formatted(version), e);
            }
        }

        private static long parseNumberOrZero(final @Nullable String number) {
            return number != null ? Long.parseLong(number) : 0;
        }

        @Override
        public int compareTo(final Pep440Version other) {
            int result = Long.compare(epoch, other.epoch);
            if (result != 0) {
                return result;
            }

            for (int i = 0; i < Math.max(release.size(), other.release.size()); i++) {
                result = Long.compare(
                        i < release.size() ? release.get(i) : 0,
                        i < other.release.size() ? other.release.get(i) : 0);
                if (result != 0) {
                    return result;
                }
            }

            result = preReleasePhase.compareTo(other.preReleasePhase);
            if (result != 0) {
                return result;
            }
            result = Long.compare(preReleaseNumber, other.preReleaseNumber);
            if (result != 0) {
                return result;
            }

            // No post-release sorts before any post-release.
            result = compareNullable(postReleaseNumber, other.postReleaseNumber, -1);
            if (result != 0) {
                return result;
            }

            // No dev-release sorts after any dev-release.
            result = compareNullable(devReleaseNumber, other.devReleaseNumber, 1);
            if (result != 0) {
                return result;
            }

            return compareLocalSegments(localSegments, other.localSegments);
        }

        private static int compareNullable(final @Nullable Long left, final @Nullable Long right, final int nullOrder) {
            if (left == null || right == null) {
                if (left == right) {
                    return 0;
                }

                return left == null ? nullOrder : -nullOrder;
            }

            return Long.compare(left, right);
        }

        private static int compareLocalSegments(final List<String> left, final List<String> right) {
            for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
                final String leftSegment = left.get(i);
                final String rightSegment = right.get(i);
                final boolean leftNumeric = isNumeric(leftSegment);
                final boolean rightNumeric = isNumeric(rightSegment);

                final int result;
                if (leftNumeric && rightNumeric) {
                    result = new BigInteger(leftSegment).compareTo(new BigInteger(rightSegment));
                } else if (leftNumeric != rightNumeric) {
                    // Numeric segments sort after alphanumeric ones.
                    result = leftNumeric ? 1 : -1;
                } else {
                    result = leftSegment.compareTo(rightSegment);
                }

                if (result != 0) {
                    return result;
                }
            }

            return Integer.compare(left.size(), right.size());
        }

        private static boolean isNumeric(final String segment) {
            return segment.chars().allMatch(Character::isDigit);
        }

    }

}
