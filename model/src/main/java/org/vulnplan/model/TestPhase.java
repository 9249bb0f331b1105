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

/**
 * Stages of the verification contract that accompanies every fix.
 */
public enum TestPhase {

    /**
     * Runs before the fix, and must fail the "not vulnerable" assertion.
     */
    PRE_FIX,

    /**
     * Exercises the fix logic in isolation.
     */
    REMEDIATION,

    /**
     * Runs after the fix, and must pass the "not vulnerable" assertion.
     */
    POST_FIX

}
