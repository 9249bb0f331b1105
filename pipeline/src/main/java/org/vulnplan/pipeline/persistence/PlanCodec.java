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
package org.vulnplan.pipeline.persistence;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.vulnplan.model.RemediationPlan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Encodes {@link RemediationPlan}s as JSON.
 * <p>
 * The encoding is canonical: properties and map entries are sorted, instants are
 * written in ISO-8601, and scores are rounded to one decimal place. Encoding the
 * same plan twice yields the same bytes.
 */
public final class PlanCodec {

    private static final String LINE_FEED = "\n";

    private final ObjectMapper objectMapper;
    private final ObjectWriter objectWriter;

    public PlanCodec() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();

        final var indenter = new DefaultIndenter("  ", LINE_FEED);
        this.objectWriter = objectMapper.writer(new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter));
    }

    public byte[] encode(final RemediationPlan plan) {
        try {
            final String planJson = objectWriter.writeValueAsString(plan.rounded());
            return (planJson + LINE_FEED).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode remediation plan", e);
        }
    }

    /**
     * @throws IOException When {@code planJson} is not a valid encoded plan.
     */
    public RemediationPlan decode(final byte[] planJson) throws IOException {
        return objectMapper.readValue(planJson, RemediationPlan.class);
    }

}
