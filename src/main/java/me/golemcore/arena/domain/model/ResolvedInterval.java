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

import java.time.LocalDateTime;

/**
 * Interval chosen for a metadata record.
 *
 * @param disambiguated
 *            whether the cross-source stage had to decide between competitive
 *            candidates
 */
@Builder
public record ResolvedInterval(LocalDateTime start, LocalDateTime end, EndSource endSource, Integer locationId,
        String declaredCategory, double compositeScore, double crossSourceScore, boolean disambiguated,
        int candidateCount) {

    public TimeWindow window() {
        return new TimeWindow(start, end);
    }
}
