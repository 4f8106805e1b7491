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

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Candidate interval for a metadata record, built fresh for each resolution
 * request and discarded afterwards.
 *
 * <p>
 * When {@link #endTimestamp} is set it is strictly after the start timestamp.
 */
@Data
@Builder
public class Candidate {

    private SessionMarker start;
    private SessionMarker endMarker;
    private LocalDateTime endTimestamp;
    @Builder.Default
    private EndSource endSource = EndSource.NONE;
    private Duration duration;

    private double attributeScore;
    private double zoneIdScore;
    private double proximityScore;
    private double durationScore;
    private double crossSourceScore;
    private double compositeScore;
    private double disambiguationScore;

    /**
     * Raw proximity in [0,1] before weighting, kept for fallback ranking.
     */
    private double proximity;
    private boolean excluded;

    public LocalDateTime getStartTimestamp() {
        return start.timestamp();
    }

    public boolean hasEnd() {
        return endTimestamp != null;
    }

    /**
     * Closes the interval with a synthetic end and recomputes the duration.
     */
    public void closeSynthetic(LocalDateTime syntheticEnd) {
        this.endMarker = null;
        this.endTimestamp = syntheticEnd;
        this.endSource = EndSource.SYNTHETIC;
        this.duration = Duration.between(start.timestamp(), syntheticEnd);
    }
}
