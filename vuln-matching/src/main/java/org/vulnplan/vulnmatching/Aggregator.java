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

import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.Asset;
import org.vulnplan.model.Exploitability;
import org.vulnplan.model.Finding;
import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RawFindingRecord;
import org.vulnplan.model.WarningCode;
import org.vulnplan.vulnmatching.version.VersionComparator;
import org.vulnplan.vulnmatching.version.VersionComparators;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Matches normalized records against an asset inventory, and merges all reports
 * of the same vulnerability affecting the same asset into a single {@link Finding}.
 * <p>
 * Records are processed concurrently on a bounded pool of workers. The result does not
 * depend on the order of records, nor on the order in which workers complete.
 */
public final class Aggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

    private final Normalizer normalizer;
    private final VersionComparators versionComparators;
    private final int concurrency;

    public Aggregator(
            final Normalizer normalizer,
            final VersionComparators versionComparators,
            final int concurrency) {
        this.normalizer = requireNonNull(normalizer, "normalizer must not be null");
        this.versionComparators = requireNonNull(versionComparators, "versionComparators must not be null");
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, but is " + concurrency);
        }
        this.concurrency = concurrency;
    }

    /**
     * @param assets  The asset inventory. Must not be empty.
     * @param records Raw records of all sources.
     * @return The aggregated findings, sorted by canonical ID.
     * @throws EmptyInventoryException When {@code assets} is empty.
     * @throws CancellationException   When the calling thread is interrupted.
     */
    public AggregationResult aggregate(final Collection<Asset> assets, final List<RawFindingRecord> records) {
        if (assets.isEmpty()) {
            throw new EmptyInventoryException();
        }

        final Map<PackageCoordinates, List<Asset>> assetsByCoordinates = indexAssets(assets);
        final List<RecordOutcome> outcomes = processAll(assetsByCoordinates, records);

        final var matchesByCanonicalId = new TreeMap<String, List<Match>>();
        final var warnings = new ArrayList<PlanWarning>();
        int unmatchedRecords = 0;
        for (final RecordOutcome outcome : outcomes) {
            warnings.addAll(outcome.warnings());
            if (outcome.matches().isEmpty() && outcome.warnings().isEmpty()) {
                unmatchedRecords++;
            }

            for (final Match match : outcome.matches()) {
                matchesByCanonicalId.computeIfAbsent(match.canonicalId(), ignored -> new ArrayList<>()).add(match);
            }
        }

        final List<Finding> findings = matchesByCanonicalId.entrySet().stream()
                .map(entry -> merge(entry.getKey(), entry.getValue()))
                .toList();

        LOGGER.info("Aggregated {} records into {} findings for {} assets ({} unmatched, {} skipped)",
                records.size(), findings.size(), assets.size(), unmatchedRecords, warnings.size());
        return new AggregationResult(findings, sortWarnings(warnings));
    }

    private List<RecordOutcome> processAll(
            final Map<PackageCoordinates, List<Asset>> assetsByCoordinates,
            final List<RawFindingRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }

        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(concurrency, records.size()),
                new BasicThreadFactory.Builder()
                        .namingPattern("Aggregator-%d")
                        .daemon(true)
                        .build());

        final var futures = new ArrayList<Future<RecordOutcome>>(records.size());
        try {
            for (final RawFindingRecord record : records) {
                futures.add(executor.submit(() -> process(assetsByCoordinates, record)));
            }

            final var outcomes = new ArrayList<RecordOutcome>(records.size());
            for (final Future<RecordOutcome> future : futures) {
                outcomes.add(future.get());
            }

            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            final var cancellationException = new CancellationException("Interrupted while aggregating findings");
            cancellationException.initCause(e);
            throw cancellationException;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Unexpected failure while aggregating findings", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private RecordOutcome process(
            final Map<PackageCoordinates, List<Asset>> assetsByCoordinates,
            final RawFindingRecord record) {
        final FindingFragment fragment;
        try {
            fragment = normalizer.normalize(record);
        } catch (UnparsableRecordException e) {
            LOGGER.warn("Skipping unparsable record {} from source {}: {}",
                    e.getSubject(), e.getSourceId(), e.getMessage());
            return RecordOutcome.skipped(new PlanWarning(
                    WarningCode.UNPARSABLE_RECORD, e.getSourceId(), e.getSubject(), e.getMessage()));
        } catch (RuntimeException e) {
            final String subject = Normalizer.describe(record);
            LOGGER.warn("Failed to normalize record {} from source {}", subject, record.sourceId(), e);
            return RecordOutcome.skipped(new PlanWarning(
                    WarningCode.RECORD_FAILED,
                    record.sourceId(),
                    subject,
                    "Failed to normalize record: %s".formatted(e.getMessage())));
        }

        final List<Asset> candidates = assetsByCoordinates.getOrDefault(fragment.coordinates(), List.of());
        if (candidates.isEmpty()) {
            LOGGER.debug("{} from source {} does not affect any asset", fragment.vulnId(), fragment.sourceId());
            return RecordOutcome.unmatched();
        }

        final VersionComparator versionComparator = versionComparators.forEcosystem(fragment.coordinates().ecosystem());
        final var matches = new ArrayList<Match>();
        final var warnings = new ArrayList<PlanWarning>();
        for (final Asset asset : candidates) {
            try {
                if (!versionComparator.contains(fragment.affectedRange(), asset.version())) {
                    continue;
                }

                final Optional<String> fixedVersion = versionComparator.fixedVersion(fragment.affectedRange(), asset.version());
                final String canonicalId = fragment.vulnId() + ":" + fragment.coordinates().identityOf(asset.version());
                matches.add(new Match(canonicalId, asset, fragment, fixedVersion.orElse(null)));
            } catch (RuntimeException e) {
                final String subject = "%s (%s)".formatted(fragment.vulnId(), asset.displayName());
                LOGGER.warn("Failed to match {} from source {}", subject, fragment.sourceId(), e);
                warnings.add(new PlanWarning(
                        WarningCode.RECORD_FAILED,
                        fragment.sourceId(),
                        subject,
                        "Failed to match affected range %s against version %s: %s".formatted(
                                fragment.affectedRange(), asset.version(), e.getMessage())));
            }
        }

        if (matches.isEmpty() && warnings.isEmpty()) {
            LOGGER.debug("{} from source {} does not affect any version of {}",
                    fragment.vulnId(), fragment.sourceId(), fragment.coordinates());
        }

        return new RecordOutcome(matches, warnings);
    }

    private static Finding merge(final String canonicalId, final List<Match> matches) {
        final List<Match> ordered = matches.stream()
                .sorted(Comparator.comparing(Match::fragment, FindingFragment.MERGE_ORDER))
                .toList();
        final Match primary = ordered.get(0);
        final Asset asset = primary.asset();

        final FindingFragment cvssFragment = ordered.stream()
                .map(Match::fragment)
                .filter(fragment -> fragment.cvss() != null)
                .findFirst()
                .orElse(null);

        final var aliases = new TreeSet<String>();
        final var references = new LinkedHashSet<String>();
        final var sources = new LinkedHashSet<String>();
        for (final Match match : ordered) {
            aliases.addAll(match.fragment().aliases());
            references.addAll(match.fragment().references());
            sources.add(match.fragment().sourceId());
        }
        aliases.remove(primary.fragment().vulnId());

        return new Finding(
                canonicalId,
                primary.fragment().vulnId(),
                List.copyOf(aliases),
                asset,
                primary.fragment().affectedRange().expression(),
                firstNonNull(ordered, Match::fixedVersion),
                firstNonNull(ordered, match -> match.fragment().title()),
                firstNonNull(ordered, match -> match.fragment().description()),
                List.copyOf(references),
                cvssFragment != null ? cvssFragment.cvss() : null,
                cvssFragment != null ? cvssFragment.cvssVector() : null,
                Optional.ofNullable(firstNonNull(ordered, match -> match.fragment().exploitability()))
                        .orElse(Exploitability.THEORETICAL),
                asset.criticality(),
                asset.exposure(),
                List.copyOf(sources),
                null,
                null,
                null,
                null,
                false);
    }

    private static <T> @Nullable T firstNonNull(
            final List<Match> matches,
            final Function<Match, @Nullable T> fieldAccessor) {
        for (final Match match : matches) {
            final T value = fieldAccessor.apply(match);
            if (value != null) {
                return value;
            }
        }

        return null;
    }

    /**
     * Indexes assets by normalized coordinates.
     * <p>
     * Assets with the same coordinates and version are the same asset for the purpose
     * of matching. Of those, the one discovered in the lexicographically lowest file wins.
     */
    private static Map<PackageCoordinates, List<Asset>> indexAssets(final Collection<Asset> assets) {
        final List<Asset> orderedAssets = assets.stream()
                .sorted(Comparator
                        .comparing(Asset::displayName)
                        .thenComparing(Asset::filePath, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                        .thenComparing(Asset::kind))
                .toList();

        final var assetByIdentity = new LinkedHashMap<String, Asset>();
        for (final Asset asset : orderedAssets) {
            final PackageCoordinates coordinates = PackageCoordinates.of(asset);
            final Asset previous = assetByIdentity.putIfAbsent(coordinates.identityOf(asset.version()), asset);
            if (previous != null) {
                LOGGER.debug("Ignoring duplicate asset {} from {}; Already discovered in {}",
                        asset.displayName(), asset.filePath(), previous.filePath());
            }
        }

        final var assetsByCoordinates = new LinkedHashMap<PackageCoordinates, List<Asset>>();
        for (final Asset asset : assetByIdentity.values()) {
            assetsByCoordinates.computeIfAbsent(PackageCoordinates.of(asset), ignored -> new ArrayList<>()).add(asset);
        }

        return assetsByCoordinates;
    }

    private static List<PlanWarning> sortWarnings(final List<PlanWarning> warnings) {
        return warnings.stream()
                .sorted(Comparator
                        .comparing(PlanWarning::code)
                        .thenComparing(PlanWarning::sourceId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                        .thenComparing(PlanWarning::subject)
                        .thenComparing(PlanWarning::message))
                .toList();
    }

    private record Match(String canonicalId, Asset asset, FindingFragment fragment, @Nullable String fixedVersion) {
    }

    private record RecordOutcome(List<Match> matches, List<PlanWarning> warnings) {

        private static RecordOutcome unmatched() {
            return new RecordOutcome(List.of(), List.of());
        }

        private static RecordOutcome skipped(final PlanWarning warning) {
            return new RecordOutcome(List.of(), List.of(warning));
        }

    }

}
