package me.golemcore.arena.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.arena.domain.model.Candidate;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.SessionType;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Derives end boundaries for sessions that span several rounds without a
 * reliable end marker. A session is continuous when the record declares a
 * continuous category or when its start marker does. The end is
 * {@code start + declared duration}; round boundaries inside the session are
 * not detected.
 */
@Component
@RequiredArgsConstructor
public class OpenSessionResolver {

    private final AttributeMatcher attributeMatcher;

    public boolean appliesTo(MetadataRecord record) {
        return attributeMatcher.sessionTypeOf(record.getDeclaredCategory()) == SessionType.CONTINUOUS_MULTI_ROUND;
    }

    /**
     * Closes synthetically every candidate that belongs to a continuous
     * session, replacing any round-end marker it was paired with.
     */
    public void closeContinuous(List<Candidate> candidates, MetadataRecord record, Duration declaredDuration) {
        boolean declaredContinuous = appliesTo(record);
        for (Candidate candidate : candidates) {
            if (declaredContinuous || isContinuous(candidate)) {
                candidate.closeSynthetic(synthesizeEnd(candidate.getStartTimestamp(), declaredDuration));
            }
        }
    }

    /**
     * Closes only the candidates that have no end yet.
     */
    public void closeOpenEnded(List<Candidate> candidates, Duration declaredDuration) {
        for (Candidate candidate : candidates) {
            if (!candidate.hasEnd()) {
                candidate.closeSynthetic(synthesizeEnd(candidate.getStartTimestamp(), declaredDuration));
            }
        }
    }

    private static boolean isContinuous(Candidate candidate) {
        return candidate.getStart().sessionType() == SessionType.CONTINUOUS_MULTI_ROUND;
    }

    public LocalDateTime synthesizeEnd(LocalDateTime start, Duration declaredDuration) {
        if (declaredDuration == null || declaredDuration.isNegative() || declaredDuration.isZero()) {
            throw new IllegalArgumentException("declared duration must be positive: " + declaredDuration);
        }
        return start.plus(declaredDuration);
    }
}
