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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.model.Candidate;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.SessionMarker;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Computes the composite match score of candidates against a metadata record.
 *
 * <p>
 * Terms, each configurable under {@code arena.scoring}:
 * <ul>
 * <li>category agreement (0.4)</li>
 * <li>location: exact zone id agreement (0.5) when the record carries an
 * authoritative zone id, otherwise location-name agreement (0.3)</li>
 * <li>temporal proximity to the declared start, decaying linearly to zero at
 * the maximum offset (up to 0.3); candidates beyond it are excluded</li>
 * <li>plausible duration bonus (0.1)</li>
 * </ul>
 * The composite is capped at 1.0.
 */
@Component
@Slf4j
public class CandidateScorer {

    private static final double EPSILON = 1e-9;

    private final ArenaProperties.ScoringProperties scoring;
    private final AttributeMatcher attributeMatcher;

    public CandidateScorer(ArenaProperties properties, AttributeMatcher attributeMatcher) {
        this.scoring = properties.getScoring();
        this.attributeMatcher = attributeMatcher;
    }

    public Candidate score(Candidate candidate, MetadataRecord record) {
        SessionMarker start = candidate.getStart();

        double attribute = 0.0;
        if (attributeMatcher.categoryMatches(record.getDeclaredCategory(), start.declaredCategory())) {
            attribute += scoring.getCategoryWeight();
        }
        double zoneId = 0.0;
        if (record.getDeclaredZoneId() != null) {
            if (record.getDeclaredZoneId().equals(start.locationId())) {
                zoneId = scoring.getZoneIdWeight();
            }
        } else if (attributeMatcher.locationMatches(record.getDeclaredLocation(), start)) {
            attribute += scoring.getLocationNameWeight();
        }

        Duration offset = Duration.between(start.timestamp(), record.getDeclaredStart()).abs();
        long maxOffsetMillis = scoring.getMaxProximityOffset().toMillis();
        boolean excluded = offset.toMillis() > maxOffsetMillis;
        double proximity = excluded || maxOffsetMillis == 0
                ? 0.0
                : 1.0 - (double) offset.toMillis() / maxOffsetMillis;

        double durationBonus = isPlausible(candidate.getDuration()) ? scoring.getDurationBonus() : 0.0;

        candidate.setAttributeScore(attribute);
        candidate.setZoneIdScore(zoneId);
        candidate.setProximity(proximity);
        candidate.setProximityScore(scoring.getProximityWeight() * proximity);
        candidate.setDurationScore(durationBonus);
        candidate.setExcluded(excluded);
        candidate.setCompositeScore(
                Math.min(1.0, attribute + zoneId + candidate.getProximityScore() + durationBonus));
        return candidate;
    }

    /**
     * Scores every candidate and returns the ones within the proximity limit,
     * best first. Ties fall back to proximity and then scan order.
     */
    public List<Candidate> scoreAll(List<Candidate> candidates, MetadataRecord record) {
        List<Candidate> ranked = new ArrayList<>();
        for (Candidate candidate : candidates) {
            score(candidate, record);
            if (candidate.isExcluded()) {
                log.debug("[Score] excluded candidate at {}: outside max proximity offset",
                        candidate.getStartTimestamp());
                continue;
            }
            ranked.add(candidate);
        }
        ranked.sort(ranking());
        return ranked;
    }

    /**
     * Candidates still in contention after scoring. A single entry means the
     * scorer decided on its own; an empty list means nothing is viable.
     */
    public List<Candidate> competitive(List<Candidate> ranked) {
        List<Candidate> viable = ranked.stream()
                .filter(candidate -> candidate.getCompositeScore() + EPSILON >= scoring.getMinimumViableScore())
                .toList();
        if (viable.isEmpty()) {
            return List.of();
        }
        Candidate best = viable.get(0);
        if (best.getCompositeScore() + EPSILON < scoring.getHighConfidenceThreshold()) {
            return viable;
        }
        return viable.stream()
                .filter(candidate -> best.getCompositeScore() - candidate.getCompositeScore()
                        <= scoring.getCompetitiveMargin() + EPSILON)
                .toList();
    }

    static Comparator<Candidate> ranking() {
        return Comparator.comparingDouble(Candidate::getCompositeScore).reversed()
                .thenComparing(Comparator.comparingDouble(Candidate::getProximity).reversed())
                .thenComparingInt(candidate -> candidate.getStart().scanOrder());
    }

    private boolean isPlausible(Duration duration) {
        if (duration == null) {
            return false;
        }
        return duration.compareTo(scoring.getMinPlausibleDuration()) >= 0
                && duration.compareTo(scoring.getMaxPlausibleDuration()) <= 0;
    }
}
