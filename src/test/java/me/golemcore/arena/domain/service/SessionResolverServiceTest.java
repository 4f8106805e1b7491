package me.golemcore.arena.domain.service;

import me.golemcore.arena.adapter.outbound.ownership.MapOwnershipIndex;
import me.golemcore.arena.domain.model.EndSource;
import me.golemcore.arena.domain.model.FeatureCounter;
import me.golemcore.arena.domain.model.GroundTruthEvent;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.ResolutionEvent;
import me.golemcore.arena.domain.model.ResolutionEventType;
import me.golemcore.arena.domain.model.ResolutionFailureKind;
import me.golemcore.arena.domain.model.ResolutionResult;
import me.golemcore.arena.domain.model.ResolvedInterval;
import me.golemcore.arena.port.outbound.CombatLogSource;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import me.golemcore.arena.testsupport.CombatLogLines;
import me.golemcore.arena.testsupport.InMemoryCombatLogSource;
import me.golemcore.arena.testsupport.ResolverComponents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionResolverServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 2, 18, 0);
    private static final String PLAYER = "Shiizz-Kazzak-EU";
    private static final String PET = "Zhaarak";
    private static final String ENEMY = "Enemy-Realm-EU";

    private ResolverComponents components;
    private SessionResolverService resolver;
    private final OwnershipIndex ownership = MapOwnershipIndex.fromOwners(Map.of(PLAYER, List.of(PET)));

    @BeforeEach
    void setUp() {
        components = new ResolverComponents();
        resolver = components.resolver;
    }

    @Test
    void shouldResolveSingleMatchingPairWithHighConfidence() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .cast(T0.plusSeconds(5), PLAYER, "Pre-match Buff")
                .matchStart(T0.plusSeconds(20), 1505, "3v3")
                .cast(T0.plusSeconds(20), PLAYER, "Fear")
                .cast(T0.plusSeconds(120), PLAYER, "Chaos Bolt")
                .cast(T0.plusSeconds(320), PLAYER, "Shadowfury")
                .matchEnd(T0.plusSeconds(320))
                .cast(T0.plusSeconds(321), PLAYER, "Post-match")
                .toSource("single");

        ResolutionResult result = resolver.resolve(record("match-1", T0, 300), source, ownership);

        ResolvedInterval interval = result.interval();
        assertEquals(T0.plusSeconds(20), interval.start());
        assertEquals(T0.plusSeconds(320), interval.end());
        assertEquals(EndSource.MARKER, interval.endSource());
        assertEquals(1505, interval.locationId());
        assertTrue(interval.compositeScore() >= 0.8);
        assertFalse(interval.disambiguated());
        assertEquals(3, result.counters().count(FeatureCounter.CASTS));
        assertEquals(List.of("Fear", "Chaos Bolt", "Shadowfury"), result.counters().castNames());
        assertEquals(7, result.boundaryScan().linesRead());
        assertEquals("match-1", result.recordId());
    }

    @Test
    void shouldSelectDifferentBackToBackSessionsForDifferentRecords() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .cast(T0.plusMinutes(1), PLAYER, "Fear")
                .matchEnd(T0.plusMinutes(4))
                .matchStart(T0.plusMinutes(5), 1505, "3v3")
                .cast(T0.plusMinutes(6), PLAYER, "Chaos Bolt")
                .cast(T0.plusMinutes(7), PLAYER, "Chaos Bolt")
                .matchEnd(T0.plusMinutes(9))
                .toSource("back-to-back");

        ResolutionResult first = resolver.resolve(record("match-1", T0.plusSeconds(10), 240), source, ownership);
        ResolutionResult second = resolver.resolve(record("match-2", T0.plusMinutes(5).plusSeconds(10), 240),
                source, ownership);

        assertEquals(T0, first.interval().start());
        assertEquals(T0.plusMinutes(5), second.interval().start());
        assertNotEquals(first.counters(), second.counters());
        assertEquals(1, first.counters().count(FeatureCounter.CASTS));
        assertEquals(2, second.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldProduceIdenticalCountersOnRepeatedResolution() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .cast(T0.plusMinutes(1), PLAYER, "Fear")
                .dispel(T0.plusMinutes(2), PET + "-1", ENEMY, "Devour Magic", "Ice Barrier")
                .interrupt(T0.plusMinutes(3), ENEMY, PLAYER, "Chaos Bolt")
                .matchEnd(T0.plusMinutes(4))
                .toSource("repeat");
        MetadataRecord record = record("match-1", T0, 240);

        ResolutionResult first = resolver.resolve(record, source, ownership);
        ResolutionResult second = resolver.resolve(record, source, ownership);

        assertEquals(first.counters(), second.counters());
        assertEquals(first.interval(), second.interval());
    }

    @Test
    void shouldLetGroundTruthEliminationsPickTheSecondInterval() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .died(T0.plusSeconds(45), "Bystander-Realm-EU")
                .matchEnd(T0.plusMinutes(4))
                .matchStart(T0.plusMinutes(5), 1505, "3v3")
                .died(T0.plusMinutes(5).plusSeconds(30), "Enemy-A-EU")
                .died(T0.plusMinutes(5).plusSeconds(62), "Enemy-B-EU")
                .died(T0.plusMinutes(5).plusSeconds(95), "Enemy-C-EU")
                .matchEnd(T0.plusMinutes(9))
                .toSource("ground-truth");
        MetadataRecord record = record("match-1", T0.plusMinutes(2), 240).toBuilder()
                .groundTruthEvents(List.of(
                        new GroundTruthEvent("Enemy-A-EU", 30),
                        new GroundTruthEvent("Enemy-B-EU", 60),
                        new GroundTruthEvent("Enemy-C-EU", 90)))
                .build();

        ResolutionResult result = resolver.resolve(record, source, ownership);

        assertEquals(T0.plusMinutes(5), result.interval().start());
        assertTrue(result.interval().disambiguated());
        assertEquals(1.0, result.interval().crossSourceScore(), 1e-9);
        assertEquals(2, result.interval().candidateCount());
        assertTrue(components.events.stream()
                .anyMatch(event -> event.type() == ResolutionEventType.DISAMBIGUATION_STARTED));
    }

    @Test
    void shouldSynthesizeEndForContinuousSessionWithoutEndMarker() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 2759, "Rated Solo Shuffle")
                .cast(T0.plusMinutes(10), PLAYER, "Fear")
                .cast(T0.plusSeconds(1800), PLAYER, "Last Cast")
                .cast(T0.plusSeconds(1801), PLAYER, "Too Late")
                .toSource("shuffle");
        MetadataRecord record = MetadataRecord.builder()
                .id("shuffle-1")
                .declaredStart(T0)
                .declaredDuration(Duration.ofSeconds(1800))
                .declaredCategory("Solo Shuffle")
                .declaredLocation("Cage of Carnage")
                .primaryActorId(PLAYER)
                .build();

        ResolutionResult result = resolver.resolve(record, source, ownership);

        assertEquals(T0, result.interval().start());
        assertEquals(T0.plusSeconds(1800), result.interval().end());
        assertEquals(EndSource.SYNTHETIC, result.interval().endSource());
        assertEquals(2, result.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldIgnoreRoundEndMarkersInsideContinuousSession() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 2759, "Rated Solo Shuffle")
                .matchEnd(T0.plusMinutes(3))
                .cast(T0.plusMinutes(20), PLAYER, "Fear")
                .toSource("shuffle-rounds");
        MetadataRecord record = MetadataRecord.builder()
                .id("shuffle-1")
                .declaredStart(T0)
                .declaredDuration(Duration.ofMinutes(25))
                .declaredCategory("Solo Shuffle")
                .primaryActorId(PLAYER)
                .build();

        ResolutionResult result = resolver.resolve(record, source, ownership);

        assertEquals(T0.plusMinutes(25), result.interval().end());
        assertEquals(1, result.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldTreatSessionAsContinuousWhenStartMarkerDeclaresIt() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 2759, "Rated Solo Shuffle")
                .matchEnd(T0.plusMinutes(3))
                .cast(T0.plusMinutes(20), PLAYER, "Fear")
                .toSource("shuffle-generic-category");
        MetadataRecord record = MetadataRecord.builder()
                .id("shuffle-2")
                .declaredStart(T0)
                .declaredDuration(Duration.ofMinutes(25))
                .declaredCategory("Arena")
                .declaredZoneId(2759)
                .primaryActorId(PLAYER)
                .build();

        ResolutionResult result = resolver.resolve(record, source, ownership);

        assertEquals(T0.plusMinutes(25), result.interval().end());
        assertEquals(EndSource.SYNTHETIC, result.interval().endSource());
        assertEquals(1, result.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldSynthesizeEndForStandardWinnerWithoutEndMarker() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .cast(T0.plusMinutes(2), PLAYER, "Fear")
                .toSource("truncated");

        ResolutionResult result = resolver.resolve(record("match-1", T0, 240), source, ownership);

        assertEquals(T0.plusSeconds(240), result.interval().end());
        assertEquals(EndSource.SYNTHETIC, result.interval().endSource());
    }

    @Test
    void shouldFailWhenNoMarkersInSearchWindow() {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .cast(T0, PLAYER, "Fear")
                .matchStart(T0.plusHours(3), 1505, "3v3")
                .toSource("no-markers");

        SessionResolutionException error = assertThrows(SessionResolutionException.class,
                () -> resolver.resolve(record("match-1", T0, 240), source, ownership));

        assertEquals(ResolutionFailureKind.NO_BOUNDARY_MARKERS_FOUND, error.getKind());
        ResolutionEvent failure = components.events.get(components.events.size() - 1);
        assertEquals(ResolutionEventType.RESOLUTION_FAILED, failure.type());
        assertEquals("NO_BOUNDARY_MARKERS_FOUND", failure.payload().get("kind"));
    }

    @Test
    void shouldFailWhenNoCandidateIsViable() {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0.plusSeconds(500), 1505, "3v3")
                .matchEnd(T0.plusSeconds(800))
                .toSource("mismatch");
        MetadataRecord record = record("match-1", T0, 240).toBuilder()
                .declaredCategory("2v2")
                .declaredLocation("Mugambala")
                .build();

        SessionResolutionException error = assertThrows(SessionResolutionException.class,
                () -> resolver.resolve(record, source, ownership));

        assertEquals(ResolutionFailureKind.NO_CONFIDENT_MATCH, error.getKind());
    }

    @Test
    void shouldReportUnreadableLog() throws IOException {
        CombatLogSource source = mock(CombatLogSource.class);
        when(source.getName()).thenReturn("missing.txt");
        when(source.openReader()).thenThrow(new IOException("permission denied"));

        SessionResolutionException error = assertThrows(SessionResolutionException.class,
                () -> resolver.resolve(record("match-1", T0, 240), source, ownership));

        assertEquals(ResolutionFailureKind.LOG_UNREADABLE, error.getKind());
        assertTrue(error.getMessage().contains("missing.txt"));
    }

    @Test
    void shouldRejectRecordsWithoutStartOrPrimaryActor() {
        InMemoryCombatLogSource source = CombatLogLines.log().matchStart(T0, 1505, "3v3").toSource("any");

        SessionResolutionException noStart = assertThrows(SessionResolutionException.class,
                () -> resolver.resolve(record("match-1", null, 240), source, ownership));
        SessionResolutionException noActor = assertThrows(SessionResolutionException.class,
                () -> resolver.resolve(record("match-2", T0, 240).toBuilder().primaryActorId(null).build(), source,
                        ownership));

        assertEquals(ResolutionFailureKind.NO_CONFIDENT_MATCH, noStart.getKind());
        assertEquals(ResolutionFailureKind.NO_CONFIDENT_MATCH, noActor.getKind());
    }

    @Test
    void shouldDeriveMissingAttributesFromRecordingName() throws Exception {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .cast(T0.plusMinutes(1), PLAYER, "Fear")
                .matchEnd(T0.plusMinutes(4))
                .toSource("named");
        MetadataRecord record = MetadataRecord.builder()
                .recordingName("2025-01-02_18-00-00_-_Shiizz_-_3v3_Nagrand_(Win).mp4")
                .declaredStart(T0)
                .declaredDuration(Duration.ofMinutes(4))
                .build();

        ResolutionResult result = resolver.resolve(record, source, ownership);

        assertEquals(record.getRecordingName(), result.recordId());
        assertEquals(1, result.counters().count(FeatureCounter.CASTS));
    }

    @Test
    void shouldUseDefaultDurationAndReliabilityPadding() {
        MetadataRecord record = record("match-1", T0, 240).toBuilder().declaredDuration(null).build();

        assertEquals(Duration.ofMinutes(5), resolver.effectiveDuration(record));
        assertEquals(T0.minusSeconds(120).minusMinutes(10), resolver.searchWindow(record, Duration.ofMinutes(5))
                .start());
        assertEquals(T0.plusMinutes(5).plusSeconds(120).plusMinutes(10),
                resolver.searchWindow(record, Duration.ofMinutes(5)).end());
    }

    private static MetadataRecord record(String id, LocalDateTime start, long durationSeconds) {
        return MetadataRecord.builder()
                .id(id)
                .declaredStart(start)
                .declaredDuration(Duration.ofSeconds(durationSeconds))
                .declaredCategory("3v3")
                .declaredLocation("Nagrand")
                .primaryActorId(PLAYER)
                .build();
    }
}
