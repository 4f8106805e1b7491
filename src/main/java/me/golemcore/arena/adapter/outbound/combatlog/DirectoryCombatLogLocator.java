package me.golemcore.arena.adapter.outbound.combatlog;

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
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.CombatLogLocator;
import me.golemcore.arena.port.outbound.CombatLogSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Picks the combat log file whose creation time, encoded in its name as
 * {@code WoWCombatLog-MMDDYY_HHMMSS.txt}, is nearest to a record's declared
 * start.
 *
 * <p>
 * A file qualifies when it lies within the configured distance of the start
 * and does not begin more than the start tolerance after it. Files with other
 * names are ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DirectoryCombatLogLocator implements CombatLogLocator {

    private static final Pattern LOG_FILE_NAME = Pattern.compile("WoWCombatLog-(\\d{6}_\\d{6})\\.txt");
    private static final DateTimeFormatter LOG_FILE_TIMESTAMP = DateTimeFormatter.ofPattern("MMddyy_HHmmss");

    private final ArenaProperties properties;

    @Override
    public Optional<CombatLogSource> locate(MetadataRecord record) {
        LocalDateTime declaredStart = record.getDeclaredStart();
        if (declaredStart == null) {
            return Optional.empty();
        }
        ArenaProperties.BatchProperties batch = properties.getBatch();
        Duration maxDistance = batch.getMaxLogDistance();
        LocalDateTime latestStart = declaredStart.plus(batch.getLogStartTolerance());

        Optional<LogFile> nearest = listLogFiles(Path.of(batch.getLogsDirectory())).stream()
                .filter(file -> Duration.between(file.startedAt(), declaredStart).abs().compareTo(maxDistance) <= 0)
                .filter(file -> !file.startedAt().isAfter(latestStart))
                .min(Comparator.comparing((LogFile file) -> Duration.between(file.startedAt(), declaredStart).abs())
                        .thenComparing(file -> file.path().getFileName().toString()));
        nearest.ifPresent(file -> log.debug("[Locate] {} -> {}", record.getId(), file.path().getFileName()));
        return nearest.map(file -> new FileCombatLogSource(file.path()));
    }

    List<LogFile> listLogFiles(Path directory) {
        List<LogFile> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            log.warn("[Locate] logs directory {} does not exist", directory);
            return files;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile).forEach(path -> parseStart(path).ifPresent(files::add));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list combat logs in " + directory, e);
        }
        return files;
    }

    static Optional<LogFile> parseStart(Path path) {
        Matcher matcher = LOG_FILE_NAME.matcher(path.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new LogFile(path, LocalDateTime.parse(matcher.group(1), LOG_FILE_TIMESTAMP)));
        } catch (DateTimeParseException e) {
            log.debug("[Locate] ignoring {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    record LogFile(Path path, LocalDateTime startedAt) {
    }
}
