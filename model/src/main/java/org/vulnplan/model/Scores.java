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

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Scores {

    private Scores() {
    }

    /**
     * Rounds a score half-up to one decimal place, e.g. {@code 9.94 -> 9.9}, {@code 9.95 -> 10.0}.
     * <p>
     * Rounding goes through the shortest decimal representation of {@code value},
     * such that {@code 2.94 + 3.0 + 2.0 + 2.0} rounds the same as {@code 9.94}.
     */
    public static double roundToOneDecimal(final double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Rounds effort hours half-up to two decimal places.
     */
    public static double roundHours(final BigDecimal hours) {
        return hours.setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

}
