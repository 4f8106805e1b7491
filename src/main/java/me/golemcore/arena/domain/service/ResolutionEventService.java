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
import me.golemcore.arena.domain.model.ResolutionEvent;
import me.golemcore.arena.domain.model.ResolutionEventType;
import me.golemcore.arena.port.outbound.ResolutionEventSink;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds resolution events and forwards them to every registered sink.
 */
@Service
@Slf4j
public class ResolutionEventService {

    private final Clock clock;
    private final List<ResolutionEventSink> sinks = new ArrayList<>();

    public ResolutionEventService(Clock clock, List<ResolutionEventSink> sinks) {
        this.clock = clock;
        if (sinks != null) {
            for (ResolutionEventSink sink : sinks) {
                if (sink != null) {
                    this.sinks.add(sink);
                }
            }
        }
    }

    public ResolutionEvent emit(ResolutionEventType type, String recordId, Map<String, Object> payload) {
        Map<String, Object> safePayload = payload != null ? new LinkedHashMap<>(payload) : Map.of();
        ResolutionEvent event = ResolutionEvent.builder()
                .type(type)
                .timestamp(Instant.now(clock))
                .recordId(recordId)
                .payload(safePayload)
                .build();

        for (ResolutionEventSink sink : sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) { // NOSONAR
                log.warn("[Events] sink {} rejected {}: {}", sink.getClass().getSimpleName(), type, e.getMessage());
            }
        }
        return event;
    }
}
