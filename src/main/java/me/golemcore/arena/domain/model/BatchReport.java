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

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one batch run over many metadata records.
 */
@Data
@Builder
public class BatchReport {

    private Instant startedAt;
    private Instant finishedAt;
    private int total;
    private int resolved;
    private int unresolved;
    private int skipped;
    @Builder.Default
    private Map<ResolutionFailureKind, Integer> failuresByKind = new EnumMap<>(ResolutionFailureKind.class);
    @Builder.Default
    private List<ResolutionOutcome> outcomes = new ArrayList<>();

    /**
     * Fraction of attempted records that resolved, 0 when nothing was attempted.
     */
    public double getResolvedRatio() {
        int attempted = resolved + unresolved;
        return attempted == 0 ? 0.0 : (double) resolved / attempted;
    }
}
