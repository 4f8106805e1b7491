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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.model.Candidate;
import me.golemcore.arena.domain.model.FeatureExtraction;
import me.golemcore.arena.domain.model.MarkerScan;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.ResolutionEventType;
import me.golemcore.arena.domain.model.ResolutionFailureKind;
import me.golemcore.arena.domain.model.ResolutionResult;
import me.golemcore.arena.domain.model.ResolvedInterval;
import me.golemcore.arena.domain.model.ScanStatistics;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.CombatLogSource;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves one metadata record against one combat log.
 *
 * <p>
 * Pipeline: boundary scan inside the padded search window, candidate build,
 * synthetic ends for continuous sessions, scoring, optional cross-source
 * disambiguation among competitive candidates, then attributed feature
 * extraction inside the chosen interval. Every request builds its own
 * candidates; nothing is cached between records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionResolverService {

    private final ArenaProperties properties;
    private final RecordingNameParser recordingNameParser;
    private final BoundaryScanner boundaryScanner;
    private final CandidateBuilder candidateBuilder;
    private final OpenSessionResolver openSessionResolver;
    private final CandidateScorer candidateScorer;
    private final CrossSourceDisambiguator disambiguator;
    private final FeatureExtractor featureExtractor;
    private final ResolutionEventService eventService;

    /**
     * Chosen interval together with the statistics of the boundary pass.
     */
    public record IntervalResolution(ResolvedInterval interval, ScanStatistics boundaryScan) {
    }

    public ResolutionResult resolve(MetadataRecord record, CombatLogSource source, OwnershipIndex ownershipIndex)
            throws SessionResolutionException {
        MetadataRecord effective = recordingNameParser.complete(record);
        String recordId = recordIdOf(effective);
        if (effective.getPrimaryActorId() == null || effective.getPrimaryActorId().isBlank()) {
            throw fail(recordId, ResolutionFailureKind.NO_CONFIDENT_MATCH,
                    "record declares no primary actor", null);
        }

        try {
            IntervalResolution resolution = resolveInterval(effective, source);
            ResolvedInterval interval = resolution.interval();
            FeatureExtraction extraction = featureExtractor.extract(source, interval.window(),
                    effective.getPrimaryActorId(), ownershipIndex != null ? ownershipIndex : OwnershipIndex.empty());

            Map<String, Object> payload = new LinkedHashMap<>(extraction.counters().asNamedCounts());
            payload.put("linesRead", extraction.statistics().linesRead());
            payload.put("linesSkipped", extraction.statistics().linesSkipped());
            eventService.emit(ResolutionEventType.FEATURES_EXTRACTED, recordId, payload);

            return ResolutionResult.builder()
                    .recordId(recordId)
                    .interval(interval)
                    .counters(extraction.counters())
                    .boundaryScan(resolution.boundaryScan())
                    .extractionScan(extraction.statistics())
                    .build();
        } catch (IOException | UncheckedIOException e) {
            throw fail(recordId, ResolutionFailureKind.LOG_UNREADABLE,
                    "combat log " + source.getName() + " is unreadable: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the boundary stages only and returns the chosen interval.
     */
    public IntervalResolution resolveInterval(MetadataRecord record, CombatLogSource source)
            throws SessionResolutionException, IOException {
        String recordId = recordIdOf(record);
        if (record.getDeclaredStart() == null) {
            throw fail(recordId, ResolutionFailureKind.NO_CONFIDENT_MATCH, "record declares no start time", null);
        }
        Duration duration = effectiveDuration(record);
        TimeWindow window = searchWindow(record, duration);

        MarkerScan scan = boundaryScanner.scan(source, window);
        eventService.emit(ResolutionEventType.MARKERS_SCANNED, recordId, Map.of(
                "source", source.getName(),
                "markers", scan.markers().size(),
                "linesRead", scan.statistics().linesRead(),
                "linesSkipped", scan.statistics().linesSkipped()));
        if (scan.isEmpty()) {
            throw fail(recordId, ResolutionFailureKind.NO_BOUNDARY_MARKERS_FOUND,
                    "no session markers in " + source.getName() + " between " + window.start() + " and "
                            + window.end(),
                    null);
        }

        List<Candidate> candidates = candidateBuilder.build(scan.markers());
        openSessionResolver.closeContinuous(candidates, record, duration);

        List<Candidate> ranked = candidateScorer.scoreAll(candidates, record);
        for (Candidate candidate : ranked) {
            eventService.emit(ResolutionEventType.CANDIDATE_SCORED, recordId, candidatePayload(candidate));
        }

        List<Candidate> contenders = candidateScorer.competitive(ranked);
        if (contenders.isEmpty()) {
            throw fail(recordId, ResolutionFailureKind.NO_CONFIDENT_MATCH,
                    candidates.size() + " candidates found, none reached the viability bar", null);
        }
        openSessionResolver.closeOpenEnded(contenders, duration);

        boolean disambiguated = contenders.size() > 1;
        Candidate winner;
        if (disambiguated) {
            eventService.emit(ResolutionEventType.DISAMBIGUATION_STARTED, recordId,
                    Map.of("contenders", contenders.size(), "groundTruth", record.hasGroundTruth()));
            winner = disambiguator.disambiguate(contenders, record, source);
        } else {
            winner = contenders.get(0);
        }

        ResolvedInterval interval = ResolvedInterval.builder()
                .start(winner.getStartTimestamp())
                .end(winner.getEndTimestamp())
                .endSource(winner.getEndSource())
                .locationId(winner.getStart().locationId())
                .declaredCategory(winner.getStart().declaredCategory())
                .compositeScore(winner.getCompositeScore())
                .crossSourceScore(winner.getCrossSourceScore())
                .disambiguated(disambiguated)
                .candidateCount(candidates.size())
                .build();
        eventService.emit(ResolutionEventType.CANDIDATE_SELECTED, recordId, candidatePayload(winner));
        log.debug("[Resolve] {}: selected [{} .. {}] ({}) score={} from {} candidates",
                recordId, interval.start(), interval.end(), interval.endSource(), interval.compositeScore(),
                candidates.size());
        return new IntervalResolution(interval, scan.statistics());
    }

    Duration effectiveDuration(MetadataRecord record) {
        return record.hasDeclaredDuration() ? record.getDeclaredDuration()
                : properties.getSearch().getDefaultDuration();
    }

    TimeWindow searchWindow(MetadataRecord record, Duration duration) {
        ArenaProperties.SearchProperties search = properties.getSearch();
        Duration padding = search.paddingFor(record.getReliability());
        LocalDateTime start = record.getDeclaredStart();
        return new TimeWindow(start.minus(padding), start.plus(duration).plus(padding))
                .widen(search.getExtension());
    }

    static String recordIdOf(MetadataRecord record) {
        if (record.getId() != null) {
            return record.getId();
        }
        return record.getRecordingName();
    }

    private SessionResolutionException fail(String recordId, ResolutionFailureKind kind, String reason,
            Throwable cause) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind", kind.name());
        payload.put("reason", reason);
        eventService.emit(ResolutionEventType.RESOLUTION_FAILED, recordId, payload);
        return cause != null ? new SessionResolutionException(kind, reason, cause)
                : new SessionResolutionException(kind, reason);
    }

    private static Map<String, Object> candidatePayload(Candidate candidate) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("start", candidate.getStartTimestamp());
        payload.put("end", candidate.getEndTimestamp());
        payload.put("endSource", candidate.getEndSource());
        payload.put("locationId", candidate.getStart().locationId());
        payload.put("category", candidate.getStart().declaredCategory());
        payload.put("composite", candidate.getCompositeScore());
        payload.put("proximity", candidate.getProximityScore());
        payload.put("crossSource", candidate.getCrossSourceScore());
        payload.put("rank", candidate.getDisambiguationScore());
        return payload;
    }
}
