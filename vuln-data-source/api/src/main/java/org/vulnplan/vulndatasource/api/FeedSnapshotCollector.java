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

import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RawFindingRecord;
import org.vulnplan.model.WarningCode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.util.Objects.requireNonNull;

/**
 * Drains multiple {@link VulnDataSource}s concurrently, each with its own deadline.
 * <p>
 * A source that fails or does not finish in time is reported as a warning
 * and contributes no records. Collection as a whole never fails because of
 * a single source, since downstream aggregation tolerates partial input.
 */
public final class FeedSnapshotCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(FeedSnapshotCollector.class);

    private final SourcePriorities sourcePriorities;
    private final Duration sourceTimeout;

    public FeedSnapshotCollector(final SourcePriorities sourcePriorities, final Duration sourceTimeout) {
        this.sourcePriorities = requireNonNull(sourcePriorities, "sourcePriorities must not be null");
        this.sourceTimeout = requireNonNull(sourceTimeout, "sourceTimeout must not be null");
        if (sourceTimeout.isNegative() || sourceTimeout.isZero()) {
            throw new IllegalArgumentException("sourceTimeout must be positive, but is " + sourceTimeout);
        }
    }

    public FeedSnapshot collect(final Collection<? extends VulnDataSource> sources) {
        if (sources.isEmpty()) {
            return new FeedSnapshot(List.of(), List.of());
        }

        final var orderedSources = new ArrayList<VulnDataSource>(sources);
        orderedSources.sort(Comparator.comparing(VulnDataSource::sourceId, sourcePriorities.sourceIdComparator()));

        final ExecutorService executor = Executors.newFixedThreadPool(
                orderedSources.size(),
                new BasicThreadFactory.Builder()
                        .namingPattern("FeedSnapshotCollector-%d")
                        .daemon(true)
                        .build());

        try {
            final var futures = new LinkedHashMap<VulnDataSource, Future<List<RawFindingRecord>>>();
            for (final VulnDataSource source : orderedSources) {
                futures.put(source, executor.submit(() -> drain(source)));
            }

            return awaitAll(futures, System.nanoTime() + sourceTimeout.toNanos());
        } finally {
            executor.shutdownNow();
        }
    }

    private FeedSnapshot awaitAll(
            final Map<VulnDataSource, Future<List<RawFindingRecord>>> futures,
            final long deadlineNanos) {
        final var records = new ArrayList<RawFindingRecord>();
        final var warnings = new ArrayList<PlanWarning>();

        for (final Map.Entry<VulnDataSource, Future<List<RawFindingRecord>>> entry : futures.entrySet()) {
            final String sourceId = entry.getKey().sourceId();
            final Future<List<RawFindingRecord>> future = entry.getValue();

            try {
                final long remainingNanos = Math.max(0, deadlineNanos - System.nanoTime());
                final List<RawFindingRecord> sourceRecords = future.get(remainingNanos, TimeUnit.NANOSECONDS);
                LOGGER.debug("Collected {} records from source {}", sourceRecords.size(), sourceId);
                records.addAll(sourceRecords);
            } catch (TimeoutException e) {
                future.cancel(true);
                LOGGER.warn("Source {} did not complete within {}; Ignoring its records", sourceId, sourceTimeout);
                warnings.add(new PlanWarning(
                        WarningCode.SOURCE_TIMEOUT,
                        sourceId,
                        sourceId,
                        "Source did not complete within %s".formatted(sourceTimeout)));
            } catch (ExecutionException e) {
                LOGGER.warn("Source {} failed; Ignoring its records", sourceId, e.getCause());
                warnings.add(new PlanWarning(
                        WarningCode.SOURCE_FAILED,
                        sourceId,
                        sourceId,
                        "Source failed: %s".formatted(e.getCause() != null ? e.getCause().getMessage() : e.getMessage())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(pending -> pending.cancel(true));
                final var cancellationException = new CancellationException("Interrupted while collecting from source " + sourceId);
                cancellationException.initCause(e);
                throw cancellationException;
            }
        }

        LOGGER.info("Collected {} records from {} sources ({} failed)", records.size(), futures.size(), warnings.size());
        return new FeedSnapshot(records, warnings);
    }

    private static List<RawFindingRecord> drain(final VulnDataSource source) {
        final var records = new ArrayList<RawFindingRecord>();
        try (source) {
            while (source.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Collection from source %s was cancelled".formatted(source.sourceId()));
                }

                records.add(source.next());
            }
        }

        return records;
    }

}
