package me.golemcore.arena.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

/**
 * Per-record entry of a batch run. Failed outcomes keep their reason so that
 * unresolved records can be audited.
 */
@Data
@Builder
public class ResolutionOutcome {

    private String recordId;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isResolved()
    private boolean resolved;
    private ResolutionResult result;
    private ResolutionFailureKind failureKind;
    private String failureReason;

    public static ResolutionOutcome resolved(ResolutionResult result) {
        return ResolutionOutcome.builder()
                .recordId(result.recordId())
                .resolved(true)
                .result(result)
                .build();
    }

    public static ResolutionOutcome failed(String recordId, ResolutionFailureKind kind, String reason) {
        return ResolutionOutcome.builder()
                .recordId(recordId)
                .resolved(false)
                .failureKind(kind)
                .failureReason(reason)
                .build();
    }
}
