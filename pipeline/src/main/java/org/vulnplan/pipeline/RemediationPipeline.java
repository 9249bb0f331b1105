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
package org.vulnplan.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnplan.model.Asset;
import org.vulnplan.model.Finding;
import org.vulnplan.model.PlanDiff;
import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RawFindingRecord;
import org.vulnplan.model.RemediationPlan;
import org.vulnplan.pipeline.persistence.PlanStore;
import org.vulnplan.remediation.PlanBuilder;
import org.vulnplan.remediation.PlanDiffer;
import org.vulnplan.remediation.RiskScorer;
import org.vulnplan.vulndatasource.api.FeedSnapshot;
import org.vulnplan.vulndatasource.api.FeedSnapshotCollector;
import org.vulnplan.vulndatasource.api.VulnDataSource;
import org.vulnplan.vulnmatching.AggregationResult;
import org.vulnplan.vulnmatching.Aggregator;
import org.vulnplan.vulnmatching.EmptyInventoryException;
import org.vulnplan.vulnmatching.Normalizer;
import org.vulnplan.vulnmatching.version.VersionComparators;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Turns an asset inventory and vulnerability feed records into a {@link RemediationPlan}.
 * <p>
 * Records are aggregated into findings, findings are scored, and scored findings are
 * bucketed into remediation phases. When a {@link PlanStore} is involved, the plan is
 * compared with the plan of the previous run of the same project, and then replaces it.
 */
public final class RemediationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(RemediationPipeline.class);

    private final FeedSnapshotCollector feedSnapshotCollector;
    private final Aggregator aggregator;
    private final RiskScorer riskScorer;
    private final PlanBuilder planBuilder;
    private final PlanDiffer planDiffer;
    private final PlanStore planStore;

    RemediationPipeline(
            final FeedSnapshotCollector feedSnapshotCollector,
            final Aggregator aggregator,
            final RiskScorer riskScorer,
            final PlanBuilder planBuilder,
            final PlanDiffer planDiffer,
            final PlanStore planStore) {
        this.feedSnapshotCollector = requireNonNull(feedSnapshotCollector, "feedSnapshotCollector must not be null");
        this.aggregator = requireNonNull(aggregator, "aggregator must not be null");
        this.riskScorer = requireNonNull(riskScorer, "riskScorer must not be null");
        this.planBuilder = requireNonNull(planBuilder, "planBuilder must not be null");
        this.planDiffer = requireNonNull(planDiffer, "planDiffer must not be null");
        this.planStore = requireNonNull(planStore, "planStore must not be null");
    }

    public RemediationPipeline(final PipelineConfig config, final PlanStore planStore) {
        this(
                new FeedSnapshotCollector(config.sourcePriorities(), config.feedTimeout()),
                new Aggregator(
                        new Normalizer(config.sourcePriorities()),
                        VersionComparators.defaults(),
                        config.concurrency()),
                new RiskScorer(config.scoringConfig().weights()),
                new PlanBuilder(config.scoringConfig()),
                new PlanDiffer(),
                planStore);
    }

    /**
     * Builds a plan from records that have already been collected.
     *
     * @param assets  The asset inventory. Must not be empty.
     * @param records Raw records of all sources.
     * @return The plan. Its {@code generatedAt} is the latest {@code fetchedAt} of all records,
     * or {@link Instant#EPOCH} when no record carries one.
     * @throws EmptyInventoryException When {@code assets} is empty.
     */
    public RemediationPlan plan(final Collection<Asset> assets, final List<RawFindingRecord> records) {
        return plan(assets, new FeedSnapshot(records, List.of()));
    }

    /**
     * Builds a plan from a {@link FeedSnapshot}. Warnings of the snapshot are carried over into the plan.
     *
     * @throws EmptyInventoryException When {@code assets} is empty.
     */
    public RemediationPlan plan(final Collection<Asset> assets, final FeedSnapshot snapshot) {
        final AggregationResult aggregationResult = aggregator.aggregate(assets, snapshot.records());
        final List<Finding> scoredFindings = riskScorer.scoreAll(aggregationResult.findings());

        final var upstreamWarnings = new ArrayList<PlanWarning>(
                snapshot.warnings().size() + aggregationResult.warnings().size());
        upstreamWarnings.addAll(snapshot.warnings());
        upstreamWarnings.addAll(aggregationResult.warnings());

        return planBuilder.build(scoredFindings, generatedAtOf(snapshot.records()), upstreamWarnings);
    }

    /**
     * Collects records from {@code sources}, builds a plan from them, and reconciles it
     * with the previous plan of {@code projectPath}.
     *
     * @param projectPath Path of the project the assets were discovered in.
     * @param assets      The asset inventory. Must not be empty.
     * @param sources     Vulnerability sources to collect records from.
     * @throws EmptyInventoryException When {@code assets} is empty.
     * @throws IOException             When the previous plan could not be loaded, or the new plan could not be saved.
     */
    public PipelineResult run(
            final String projectPath,
            final Collection<Asset> assets,
            final Collection<? extends VulnDataSource> sources) throws IOException {
        if (assets.isEmpty()) {
            throw new EmptyInventoryException();
        }

        final FeedSnapshot snapshot = feedSnapshotCollector.collect(sources);
        return reconcile(projectPath, plan(assets, snapshot));
    }

    /**
     * Builds a plan from records that have already been collected, and reconciles it
     * with the previous plan of {@code projectPath}.
     *
     * @throws EmptyInventoryException When {@code assets} is empty.
     * @throws IOException             When the previous plan could not be loaded, or the new plan could not be saved.
     */
    public PipelineResult run(
            final String projectPath,
            final Collection<Asset> assets,
            final List<RawFindingRecord> records) throws IOException {
        return reconcile(projectPath, plan(assets, records));
    }

    /**
     * Compares {@code plan} with the previous plan of {@code projectPath}, and saves it as the latest plan.
     *
     * @throws IOException When the previous plan could not be loaded, or the new plan could not be saved.
     */
    public PipelineResult reconcile(final String projectPath, final RemediationPlan plan) throws IOException {
        final RemediationPlan previousPlan = planStore.load(projectPath).orElse(null);
        final PlanDiff diff = planDiffer.diff(previousPlan, plan);
        planStore.save(projectPath, plan);

        if (previousPlan == null) {
            LOGGER.info("Saved first plan for {} with {} findings", projectPath, diff.newFindings().size());
        } else {
            LOGGER.info("Saved plan for {} ({} new, {} changed, {} unchanged, {} resolved findings)",
                    projectPath, diff.newFindings().size(), diff.changed().size(),
                    diff.unchanged().size(), diff.resolved().size());
        }

        return new PipelineResult(plan, diff);
    }

    private static Instant generatedAtOf(final List<RawFindingRecord> records) {
        return records.stream()
                .map(RawFindingRecord::fetchedAt)
                .filter(Objects::nonNull)
                .max(Instant::compareTo)
                .orElse(Instant.EPOCH);
    }

}
