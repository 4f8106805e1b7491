package me.golemcore.arena.adapter.outbound.combatlog;

import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.CombatLogSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryCombatLogLocatorTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 1, 2, 18, 0);

    @TempDir
    Path tempDir;

    private ArenaProperties properties;
    private DirectoryCombatLogLocator locator;

    @BeforeEach
    void setUp() {
        properties = new ArenaProperties();
        properties.getBatch().setLogsDirectory(tempDir.toString());
        locator = new DirectoryCombatLogLocator(properties);
    }

    @Test
    void shouldPickNearestLogStartedBeforeOrShortlyAfterMatch() throws IOException {
        touch("WoWCombatLog-010225_170000.txt");
        touch("WoWCombatLog-010225_180500.txt");
        touch("WoWCombatLog-010225_120000.txt");
        touch("notes.txt");

        Optional<CombatLogSource> source = locator.locate(record(START));

        assertEquals("WoWCombatLog-010225_180500.txt", source.orElseThrow().getName());
    }

    @Test
    void shouldSkipLogsStartingTooLongAfterMatch() throws IOException {
        touch("WoWCombatLog-010225_181500.txt");
        touch("WoWCombatLog-010225_100000.txt");

        Optional<CombatLogSource> source = locator.locate(record(START));

        assertEquals("WoWCombatLog-010225_100000.txt", source.orElseThrow().getName());
    }

    @Test
    void shouldReturnEmptyWhenNoLogIsCloseEnough() throws IOException {
        touch("WoWCombatLog-122924_180000.txt");

        assertTrue(locator.locate(record(START)).isEmpty());
        assertTrue(locator.locate(record(null)).isEmpty());
    }

    @Test
    void shouldReturnEmptyForMissingDirectory() {
        properties.getBatch().setLogsDirectory(tempDir.resolve("absent").toString());

        assertTrue(locator.locate(record(START)).isEmpty());
    }

    @Test
    void shouldParseStartFromFileName() {
        assertEquals(LocalDateTime.of(2025, 1, 2, 18, 5),
                DirectoryCombatLogLocator.parseStart(Path.of("WoWCombatLog-010225_180500.txt")).orElseThrow()
                        .startedAt());
        assertTrue(DirectoryCombatLogLocator.parseStart(Path.of("WoWCombatLog-133325_180500.txt")).isEmpty());
    }

    private void touch(String name) throws IOException {
        Files.writeString(tempDir.resolve(name), "");
    }

    private static MetadataRecord record(LocalDateTime start) {
        return MetadataRecord.builder().id("match-1").declaredStart(start).build();
    }
}
