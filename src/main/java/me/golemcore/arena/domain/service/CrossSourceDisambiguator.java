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
import me.golemcore.arena.domain.model.CombatEvent;
import me.golemcore.arena.domain.model.EndSource;
import me.golemcore.arena.domain.model.EventKind;
import me.golemcore.arena.domain.model.GroundTruthEvent;
import me.golemcore.arena.domain.model.LineParseResult;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.CombatLogSource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Re-ranks competitive candidates with evidence the scorer cannot see.
 *
 * <p>
 * For every contender the log is re-scanned inside the contender's interval and
 * its eliminations are matched against the record's ground-truth eliminations
 * by identity and by time (offset from the contender's start, within the
 * configured tolerance). The cross-source score is the fraction of ground-truth
 * events that found a match. The final rank is
 * {@code durationWeight * durationScore + crossSourceWeight * crossSourceScore},
 * with the neutral score standing in for a signal that is unavailable. When
 * every contender ranks the same, proximity decides.
 */
@Component
@Slf4j
public class CrossSourceDisambiguator {

    private static final double EPSILON = 1e-9;

    private final CombatLogTokenizer tokenizer;
    private final ArenaProperties.DisambiguationProperties settings;

    public CrossSourceDisambiguator(CombatLogTokenizer tokenizer, ArenaProperties properties) {
        this.tokenizer = tokenizer;
        this.settings = properties.getDisambiguation();
    }

    /**
     * Picks the winner among contenders that all have an end boundary.
     */
    public Candidate disambiguate(List<Candidate> contenders, MetadataRecord record, CombatLogSource source)
            throws IOException {
        if (contenders.isEmpty()) {
            throw new IllegalArgumentException("no contenders to disambiguate");
        }
        for (Candidate candidate : contenders) {
            double durationComponent = normalizedDurationScore(candidate, record).orElse(settings.getNeutralScore());
            double crossComponent = settings.getNeutralScore();
            if (record.hasGroundTruth()) {
                List<CombatEvent> eliminations = collectEliminations(source, window(candidate));
                double crossSource = matchFraction(record.getGroundTruthEvents(), eliminations,
                        candidate.getStartTimestamp());
                candidate.setCrossSourceScore(crossSource);
                crossComponent = crossSource;
            }
            candidate.setDisambiguationScore(settings.getDurationWeight() * durationComponent
                    + settings.getCrossSourceWeight() * crossComponent);
            log.debug("[Disambiguate] candidate {}: duration={}, crossSource={}, rank={}",
                    candidate.getStartTimestamp(), durationComponent, candidate.getCrossSourceScore(),
                    candidate.getDisambiguationScore());
        }

        if (allTied(contenders)) {
            return contenders.stream().min(byProximity()).orElseThrow();
        }
        return contenders.stream()
                .min(Comparator.comparingDouble(Candidate::getDisambiguationScore).reversed()
                        .thenComparing(byProximity()))
                .orElseThrow();
    }

    /**
     * Duration agreement in [0,1], present only for intervals closed by a real
     * end marker.
     */
    Optional<Double> normalizedDurationScore(Candidate candidate, MetadataRecord record) {
        if (candidate.getEndSource() != EndSource.MARKER || candidate.getDuration() == null
                || !record.hasDeclaredDuration()) {
            return Optional.empty();
        }
        double difference = Math.abs(candidate.getDuration().toMillis() - record.getDeclaredDuration().toMillis());
        double normalization = Math.max(1, settings.getDurationNormalization().toMillis());
        return Optional.of(Math.max(0.0, 1.0 - difference / normalization));
    }

    /**
     * Fraction of ground-truth events matched by a distinct elimination of the
     * same actor within the timing tolerance.
     */
    double matchFraction(List<GroundTruthEvent> groundTruth, List<CombatEvent> eliminations,
            LocalDateTime intervalStart) {
        if (groundTruth == null || groundTruth.isEmpty()) {
            return 0.0;
        }
        long toleranceMillis = settings.getEliminationTolerance().toMillis();
        boolean[] used = new boolean[eliminations.size()];
        int matched = 0;
        for (GroundTruthEvent expected : groundTruth) {
            LocalDateTime expectedAt = intervalStart.plus(Duration.ofMillis(Math.round(expected.getOffsetSeconds() * 1000)));
            for (int i = 0; i < eliminations.size(); i++) {
                CombatEvent elimination = eliminations.get(i);
                if (used[i] || !ActorNameSupport.sameActor(expected.getActorId(), elimination.targetId())) {
                    continue;
                }
                long difference = Math.abs(Duration.between(expectedAt, elimination.timestamp()).toMillis());
                if (difference <= toleranceMillis) {
                    used[i] = true;
                    matched++;
                    break;
                }
            }
        }
        return (double) matched / groundTruth.size();
    }

    List<CombatEvent> collectEliminations(CombatLogSource source, TimeWindow window) throws IOException {
        List<CombatEvent> eliminations = new ArrayList<>();
        try (BufferedReader reader = source.openReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<CombatLogTokenizer.LinePrefix> prefix = tokenizer.readPrefix(line);
                if (prefix.isEmpty() || !window.contains(prefix.get().timestamp())) {
                    continue;
                }
                if (tokenizer.peekKind(line, prefix.get()) != EventKind.ACTOR_ELIMINATED) {
                    continue;
                }
                LineParseResult parsed = tokenizer.tokenize(line, prefix.get());
                if (parsed.isSuccess()) {
                    eliminations.add(parsed.getEvent());
                }
            }
        }
        return eliminations;
    }

    private static TimeWindow window(Candidate candidate) {
        if (!candidate.hasEnd()) {
            throw new IllegalStateException("candidate at " + candidate.getStartTimestamp() + " has no end");
        }
        return new TimeWindow(candidate.getStartTimestamp(), candidate.getEndTimestamp());
    }

    private static boolean allTied(List<Candidate> contenders) {
        double first = contenders.get(0).getDisambiguationScore();
        return contenders.stream().allMatch(candidate -> Math.abs(candidate.getDisambiguationScore() - first) < EPSILON);
    }

    private static Comparator<Candidate> byProximity() {
        return Comparator.comparingDouble(Candidate::getProximity).reversed()
                .thenComparingInt(candidate -> candidate.getStart().scanOrder());
    }
}
