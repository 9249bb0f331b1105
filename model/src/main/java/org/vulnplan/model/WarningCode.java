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
package org.vulnplan.model;

public enum WarningCode {

    /**
     * A record lacked a resolvable identifier, package, or affected range.
     */
    UNPARSABLE_RECORD,

    /**
     * Processing of a single record failed unexpectedly, e.g. during version comparison.
     */
    RECORD_FAILED,

    /**
     * No fix action is known for the kind of the matched asset.
     */
    UNSUPPORTED_ASSET_KIND,

    /**
     * A vulnerability data source failed while its records were collected.
     */
    SOURCE_FAILED,

    /**
     * A vulnerability data source did not deliver its records in time.
     */
    SOURCE_TIMEOUT

}
