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
import me.golemcore.arena.domain.model.CombatEvent;
import me.golemcore.arena.domain.model.EventKind;
import me.golemcore.arena.domain.model.LineParseResult;
import me.golemcore.arena.domain.model.MarkerScan;
import me.golemcore.arena.domain.model.MarkerType;
import me.golemcore.arena.domain.model.ScanStatistics;
import me.golemcore.arena.domain.model.SessionMarker;
import me.golemcore.arena.domain.model.TimeWindow;
import me.golemcore.arena.port.outbound.CombatLogSource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collects session start and end markers inside a time window with a single
 * pass over the log.
 *
 * <p>
 * Each line is tested against the window on its timestamp alone; the payload
 * is only split for marker lines inside the window. Markers are returned in
 * file order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BoundaryScanner {

    private static final int LOCATION_ID_INDEX = 1;
    private static final int CATEGORY_INDEX = 3;

    private final CombatLogTokenizer tokenizer;
    private final ZoneDirectory zoneDirectory;
    private final AttributeMatcher attributeMatcher;

    public MarkerScan scan(CombatLogSource source, TimeWindow window) throws IOException {
        List<SessionMarker> markers = new ArrayList<>();
        long linesRead = 0;
        long linesSkipped = 0;

        try (BufferedReader reader = source.openReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                linesRead++;
                Optional<CombatLogTokenizer.LinePrefix> prefix = tokenizer.readPrefix(line);
                if (prefix.isEmpty()) {
                    linesSkipped++;
                    continue;
                }
                if (!window.contains(prefix.get().timestamp())) {
                    continue;
                }
                if (!tokenizer.peekKind(line, prefix.get()).isSessionMarker()) {
                    continue;
                }
                LineParseResult parsed = tokenizer.tokenize(line, prefix.get());
                if (!parsed.isSuccess()) {
                    linesSkipped++;
                    continue;
                }
                markers.add(toMarker(parsed.getEvent(), markers.size()));
            }
        }

        log.debug("[Scan] {}: {} markers in [{} .. {}], {} lines read, {} skipped",
                source.getName(), markers.size(), window.start(), window.end(), linesRead, linesSkipped);
        return new MarkerScan(markers, new ScanStatistics(linesRead, linesSkipped));
    }

    private SessionMarker toMarker(CombatEvent event, int scanOrder) {
        if (event.kind() == EventKind.SESSION_END) {
            return new SessionMarker(event, MarkerType.END, null, null, null, null, scanOrder);
        }
        Integer locationId = parseLocationId(event.field(LOCATION_ID_INDEX));
        String category = event.field(CATEGORY_INDEX);
        return new SessionMarker(event, MarkerType.START, locationId, zoneDirectory.nameOf(locationId), category,
                attributeMatcher.sessionTypeOf(category), scanOrder);
    }

    private static Integer parseLocationId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
