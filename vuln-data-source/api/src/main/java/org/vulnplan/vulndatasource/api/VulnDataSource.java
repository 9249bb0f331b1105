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

import org.vulnplan.model.RawFindingRecord;

import java.util.Iterator;

/**
 * A source of vulnerability intelligence data, e.g. a client of the NVD API.
 * <p>
 * Records are exchanged as {@link RawFindingRecord}s, in the source's own
 * identifier, range and severity formats. Each record describes <em>one</em>
 * vulnerability affecting <em>one</em> package. Sources reporting multiple
 * affected packages per advisory emit one record per package.
 *
 * <h3>Expected {@link Iterator} behavior</h3>
 * It is expected that sources make an effort to keep as little data as possible
 * in memory, and lazily retrieve new data as {@link Iterator#hasNext()} is invoked.
 * All I/O happens in {@link Iterator#hasNext()} and {@link Iterator#next()};
 * the records handed out are fully materialized.
 *
 * <h3>Priority</h3>
 * The precedence of a source when merging records is not decided by the source itself,
 * but by the {@link SourcePriorities} table in use. {@link RawFindingRecord#sourcePriority()}
 * only acts as a fallback for sources the table does not know.
 */
public interface VulnDataSource extends Iterator<RawFindingRecord>, AutoCloseable {

    /**
     * @return Identifier of this source, e.g. {@value KnownSources#NVD}.
     */
    String sourceId();

    @Override
    default void close() {
    }

}
