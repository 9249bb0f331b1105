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

import org.vulnplan.model.PlanWarning;
import org.vulnplan.model.RawFindingRecord;

import java.util.List;

/**
 * Records collected from a set of {@link VulnDataSource}s.
 *
 * @param records  All records, grouped by source in priority order.
 * @param warnings Problems with individual sources. A source listed here contributed no records.
 */
public record FeedSnapshot(List<RawFindingRecord> records, List<PlanWarning> warnings) {

    public FeedSnapshot {
        records = records != null ? List.copyOf(records) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

}
