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

import org.eclipse.microprofile.config.Config;
import org.vulnplan.common.config.NamespacedConfig;
import org.vulnplan.remediation.ScoringConfig;
import org.vulnplan.vulndatasource.api.SourcePriorities;

import java.time.Duration;
import java.time.format.DateTimeParseException;

import static java.util.Objects.requireNonNull;

/**
 * Configuration of a {@link RemediationPipeline}.
 *
 * @param concurrency      Number of threads to aggregate records with.
 * @param sourcePriorities Priorities of vulnerability sources, used to resolve conflicts between them.
 * @param feedTimeout      Time every source is given to deliver its records.
 * @param scoringConfig    Configuration of risk scoring and remediation planning.
 */
public record PipelineConfig(
        int concurrency,
        SourcePriorities sourcePriorities,
        Duration feedTimeout,
        ScoringConfig scoringConfig) {

    static final String CONFIG_CONCURRENCY = "vulnplan.aggregation.concurrency";
    static final String CONFIG_SOURCE_PRIORITY_NAMESPACE = "vulnplan.source-priority";
    static final String CONFIG_FEEDS_TIMEOUT = "vulnplan.feeds.timeout";
    static final Duration DEFAULT_FEED_TIMEOUT = Duration.ofSeconds(30);

    public PipelineConfig {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, but is " + concurrency);
        }
        requireNonNull(sourcePriorities, "sourcePriorities must not be null");
        requireNonNull(feedTimeout, "feedTimeout must not be null");
        if (feedTimeout.isNegative() || feedTimeout.isZero()) {
            throw new IllegalArgumentException("feedTimeout must be positive, but is " + feedTimeout);
        }
        requireNonNull(scoringConfig, "scoringConfig must not be null");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(
                Runtime.getRuntime().availableProcessors(),
                SourcePriorities.defaults(),
                DEFAULT_FEED_TIMEOUT,
                ScoringConfig.defaults());
    }

    /**
     * Reads the configuration from {@code config}. Properties that are not set fall back to their defaults.
     * <p>
     * Every {@code vulnplan.source-priority.<sourceId>} property overrides the default
     * priority of {@code sourceId}, or registers it when it is not a known source.
     *
     * @throws IllegalArgumentException When a property has an invalid value.
     */
    public static PipelineConfig fromConfig(final Config config) {
        final int concurrency = config.getOptionalValue(CONFIG_CONCURRENCY, Integer.class)
                .orElseGet(() -> Runtime.getRuntime().availableProcessors());

        final var priorityConfig = new NamespacedConfig(config, CONFIG_SOURCE_PRIORITY_NAMESPACE);
        final SourcePriorities.Builder prioritiesBuilder = SourcePriorities.defaults().toBuilder();
        for (final String sourceId : priorityConfig.getChildNames()) {
            prioritiesBuilder.withPriority(sourceId, priorityConfig.getValue(sourceId, Integer.class));
        }

        final Duration feedTimeout = config.getOptionalValue(CONFIG_FEEDS_TIMEOUT, String.class)
                .map(PipelineConfig::parseDuration)
                .orElse(DEFAULT_FEED_TIMEOUT);

        return new PipelineConfig(
                concurrency,
                prioritiesBuilder.build(),
                feedTimeout,
                ScoringConfig.fromConfig(config));
    }

    private static Duration parseDuration(final String value) {
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Invalid value for %s: %s is not an ISO-8601 duration".formatted(CONFIG_FEEDS_TIMEOUT, value), e);
        }
    }

}
