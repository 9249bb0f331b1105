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
package org.vulnplan.vulnmatching;

/**
 * Thrown when a {@link org.vulnplan.model.RawFindingRecord} lacks a resolvable
 * vulnerability identifier, package coordinate, or affected version range.
 */
public class UnparsableRecordException extends Exception {

    private final String sourceId;
    private final String subject;

    public UnparsableRecordException(final String sourceId, final String subject, final String message) {
        this(sourceId, subject, message, null);
    }

    public UnparsableRecordException(final String sourceId, final String subject, final String message, final Throwable cause) {
        super("Unparsable record %s from source %s: %s".formatted(subject, sourceId, message), cause);
        this.sourceId = sourceId;
        this.subject = subject;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSubject() {
        return subject;
    }

}
