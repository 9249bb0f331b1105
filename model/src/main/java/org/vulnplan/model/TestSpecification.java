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

import static java.util.Objects.requireNonNull;

/**
 * Specification of a verification test, to be materialized by a report renderer.
 *
 * @param phase             The stage of the verification contract.
 * @param name              Name of the test.
 * @param assertionTarget   What the test inspects, e.g. a package coordinate or a file.
 * @param assertion         The assertion being made about the target.
 * @param expectedBeforeFix Expected outcome before the fix is applied.
 * @param expectedAfterFix  Expected outcome after the fix is applied.
 */
public record TestSpecification(
        TestPhase phase,
        String name,
        String assertionTarget,
        String assertion,
        TestOutcome expectedBeforeFix,
        TestOutcome expectedAfterFix) {

    public TestSpecification {
        requireNonNull(phase, "phase must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(assertionTarget, "assertionTarget must not be null");
        requireNonNull(assertion, "assertion must not be null");
        requireNonNull(expectedBeforeFix, "expectedBeforeFix must not be null");
        requireNonNull(expectedAfterFix, "expectedAfterFix must not be null");
    }

}
