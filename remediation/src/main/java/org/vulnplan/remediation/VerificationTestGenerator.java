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
package org.vulnplan.remediation;

import org.jspecify.annotations.Nullable;
import org.vulnplan.model.Asset;
import org.vulnplan.model.Finding;
import org.vulnplan.model.FixAction;
import org.vulnplan.model.TestOutcome;
import org.vulnplan.model.TestPhase;
import org.vulnplan.model.TestSpecification;
import org.vulnplan.model.VerificationTests;

/**
 * Generates the verification contract of a finding.
 * <p>
 * The pre-fix test reproduces the vulnerability and must fail before the fix.
 * The remediation test exercises the fix in isolation. The post-fix test confirms
 * that the vulnerability is gone once the fix is applied.
 */
public final class VerificationTestGenerator {

    public VerificationTests generate(final Finding finding, final @Nullable FixAction fixAction) {
        final Asset asset = finding.matchedAsset();
        final String notVulnerable = "%s is not affected by %s (affected: %s)"
                .formatted(asset.displayName(), finding.vulnId(), finding.affectedRange());

        final var preFix = new TestSpecification(
                TestPhase.PRE_FIX,
                "reproduce %s in %s".formatted(finding.vulnId(), asset.displayName()),
                asset.displayName(),
                notVulnerable,
                TestOutcome.FAIL,
                TestOutcome.PASS);

        final var remediation = new TestSpecification(
                TestPhase.REMEDIATION,
                "apply fix for %s".formatted(finding.canonicalId()),
                remediationTargetOf(asset, fixAction),
                remediationAssertionOf(finding, fixAction),
                TestOutcome.FAIL,
                TestOutcome.PASS);

        final var postFix = new TestSpecification(
                TestPhase.POST_FIX,
                "verify %s is resolved in %s".formatted(finding.vulnId(), asset.displayName()),
                asset.filePath() != null ? asset.filePath() : asset.displayName(),
                notVulnerable,
                TestOutcome.FAIL,
                TestOutcome.PASS);

        return new VerificationTests(preFix, remediation, postFix);
    }

    private static String remediationTargetOf(final Asset asset, final @Nullable FixAction fixAction) {
        if (fixAction != null && fixAction.targetFile() != null) {
            return fixAction.targetFile();
        }

        return asset.displayName();
    }

    private static String remediationAssertionOf(final Finding finding, final @Nullable FixAction fixAction) {
        final Asset asset = finding.matchedAsset();
        if (fixAction == null) {
            return "manual remediation of %s is applied to %s".formatted(finding.vulnId(), asset.displayName());
        }

        return switch (fixAction.type()) {
            case VERSION_BUMP -> finding.fixedVersion() != null
                    ? "%s resolves to version %s or later".formatted(asset.name(), finding.fixedVersion())
                    : "%s resolves to a version outside of %s".formatted(asset.name(), finding.affectedRange());
            case BASE_IMAGE_UPDATE -> finding.fixedVersion() != null
                    ? "FROM references %s:%s".formatted(asset.name(), finding.fixedVersion())
                    : "FROM references a tag of %s other than %s".formatted(asset.name(), asset.version());
            case MANIFEST_PATCH -> "%s no longer matches %s".formatted(asset.name(), finding.affectedRange());
            case SECRET_ROTATION -> asset.filePath() != null
                    ? "%s is ignored by git, and credential %s is revoked".formatted(asset.filePath(), asset.name())
                    : "credential %s is revoked".formatted(asset.name());
        };
    }

}
