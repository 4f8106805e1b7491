package me.golemcore.arena.domain.service;

import me.golemcore.arena.domain.model.MarkerScan;
import me.golemcore.arena.domain.model.MarkerType;
import me.golemcore.arena.domain.model.SessionMarker;
import me.golemcore.arena.domain.model.SessionType;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.testsupport.CombatLogLines;
import me.golemcore.arena.testsupport.InMemoryCombatLogSource;
import me.golemcore.arena.testsupport.ResolverComponents;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundaryScannerTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 1, 2, 18, 0);
    private static final String PLAYER = "Shiizz-Kazzak-EU";

    private final BoundaryScanner scanner = new ResolverComponents().boundaryScanner;

    @Test
    void shouldCollectMarkersInsideWindowInFileOrder() throws IOException {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .raw("garbage that is not a log line")
                .matchStart(T0.minusMinutes(5), 572, "2v2")
                .matchStart(T0.plusMinutes(1), 1505, "3v3")
                .cast(T0.plusMinutes(2), PLAYER, "Fear")
                .matchEnd(T0.plusMinutes(5))
                .raw(CombatLogLines.timestamp(T0.plusMinutes(6)) + "  ARENA_MATCH_END")
                .matchStart(T0.plusMinutes(11), 980, "3v3")
                .toSource("WoWCombatLog-010225_175500.txt");

        MarkerScan scan = scanner.scan(source, new TimeWindow(T0, T0.plusMinutes(10)));

        assertEquals(2, scan.markers().size());
        SessionMarker start = scan.markers().get(0);
        assertEquals(MarkerType.START, start.type());
        assertEquals(T0.plusMinutes(1), start.timestamp());
        assertEquals(1505, start.locationId());
        assertEquals("Nagrand", start.locationName());
        assertEquals("3v3", start.declaredCategory());
        assertEquals(SessionType.STANDARD, start.sessionType());
        assertEquals(0, start.scanOrder());

        SessionMarker end = scan.markers().get(1);
        assertEquals(MarkerType.END, end.type());
        assertNull(end.locationId());
        assertEquals(1, end.scanOrder());

        assertEquals(7, scan.statistics().linesRead());
        assertEquals(2, scan.statistics().linesSkipped());
    }

    @Test
    void shouldIncludeMarkersExactlyOnWindowEdges() throws IOException {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 1505, "3v3")
                .matchEnd(T0.plusMinutes(10))
                .toSource("edges");

        MarkerScan scan = scanner.scan(source, new TimeWindow(T0, T0.plusMinutes(10)));

        assertEquals(2, scan.markers().size());
    }

    @Test
    void shouldFlagContinuousSessionsAndUnknownZones() throws IOException {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .matchStart(T0, 2759, "Rated Solo Shuffle")
                .matchStart(T0.plusMinutes(1), 4242, "3v3")
                .toSource("shuffle");

        MarkerScan scan = scanner.scan(source, new TimeWindow(T0, T0.plusMinutes(10)));

        assertEquals(SessionType.CONTINUOUS_MULTI_ROUND, scan.markers().get(0).sessionType());
        assertEquals("Cage of Carnage", scan.markers().get(0).locationName());
        assertEquals("Zone_4242", scan.markers().get(1).locationName());
    }

    @Test
    void shouldReturnEmptyScanWhenNoMarkersInWindow() throws IOException {
        InMemoryCombatLogSource source = CombatLogLines.log()
                .cast(T0, PLAYER, "Fear")
                .matchStart(T0.plusHours(2), 1505, "3v3")
                .toSource("empty");

        MarkerScan scan = scanner.scan(source, new TimeWindow(T0, T0.plusMinutes(10)));

        assertTrue(scan.isEmpty());
        assertEquals(2, scan.statistics().linesRead());
        assertEquals(0, scan.statistics().linesSkipped());
    }
}
