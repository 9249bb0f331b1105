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

/**
 * Identifiers of the vulnerability sources known out of the box.
 */
public final class KnownSources {

    /**
     * CISA Known Exploited Vulnerabilities catalog.
     */
    public static final String CISA_KEV = "cisa-kev";

    /**
     * NIST National Vulnerability Database.
     */
    public static final String NVD = "nvd";

    /**
     * GitHub Security Advisories.
     */
    public static final String GITHUB = "github";

    /**
     * Open Source Vulnerabilities database.
     */
    public static final String OSV = "osv";

    private KnownSources() {
    }

}
