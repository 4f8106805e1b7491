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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * External description of one recorded match. Read-only input to resolution.
 *
 * <p>
 * {@code declaredZoneId} is the authoritative numeric location id from the
 * recorder side-channel; when present it outranks fuzzy location-name matching.
 * {@code recordingName} is the recorder file name and is only used to fill in
 * missing category, location or primary actor.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetadataRecord {

    private String id;
    private String recordingName;
    private LocalDateTime declaredStart;
    private Duration declaredDuration;
    private String declaredCategory;
    private String declaredLocation;
    private Integer declaredZoneId;
    private String primaryActorId;
    @Builder.Default
    private MatchReliability reliability = MatchReliability.MEDIUM;
    @Builder.Default
    private List<GroundTruthEvent> groundTruthEvents = new ArrayList<>();

    public boolean hasGroundTruth() {
        return groundTruthEvents != null && !groundTruthEvents.isEmpty();
    }

    public boolean hasDeclaredDuration() {
        return declaredDuration != null && !declaredDuration.isZero() && !declaredDuration.isNegative();
    }
}
