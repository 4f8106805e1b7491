package me.golemcore.arena.adapter.outbound.observability;

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
import me.golemcore.arena.domain.model.ResolutionEvent;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.ResolutionEventSink;
import org.springframework.stereotype.Component;

/**
 * Writes resolution events to the application log.
 *
 * <p>
 * {@code SUMMARY} logs batch lifecycle, selections and failures;
 * {@code DETAILED} adds scans, scored candidates and extracted counters;
 * {@code QUIET} logs nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingResolutionEventSink implements ResolutionEventSink {

    private final ArenaProperties properties;

    @Override
    public void accept(ResolutionEvent event) {
        ArenaProperties.Verbosity verbosity = properties.getObservability().getVerbosity();
        if (verbosity == null || verbosity == ArenaProperties.Verbosity.QUIET) {
            return;
        }
        if (isSummary(event) || verbosity == ArenaProperties.Verbosity.DETAILED) {
            log.info("[Event] {} record={} {}", event.type(), event.recordId(), event.payload());
        }
    }

    static boolean isSummary(ResolutionEvent event) {
        return switch (event.type()) {
        case BATCH_STARTED, BATCH_FINISHED, CANDIDATE_SELECTED, RESOLUTION_FAILED -> true;
        case MARKERS_SCANNED, CANDIDATE_SCORED, DISAMBIGUATION_STARTED, FEATURES_EXTRACTED -> false;
        };
    }
}
