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

import me.golemcore.arena.domain.model.Candidate;
import me.golemcore.arena.domain.model.EndSource;
import me.golemcore.arena.domain.model.SessionMarker;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs start markers with end markers into candidate intervals.
 *
 * <p>
 * Markers are sorted by timestamp with a stable sort, so start markers sharing
 * a timestamp keep their scan order. Each start is paired with the earliest end
 * strictly after it; if another start comes first, the candidate is left
 * open-ended.
 */
@Component
public class CandidateBuilder {

    public List<Candidate> build(List<SessionMarker> markers) {
        List<SessionMarker> ordered = new ArrayList<>(markers);
        ordered.sort(Comparator.comparing(SessionMarker::timestamp));

        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            SessionMarker start = ordered.get(i);
            if (!start.isStart()) {
                continue;
            }
            SessionMarker end = findEnd(ordered, i);
            Candidate.CandidateBuilder candidate = Candidate.builder().start(start);
            if (end != null) {
                candidate.endMarker(end)
                        .endTimestamp(end.timestamp())
                        .endSource(EndSource.MARKER)
                        .duration(Duration.between(start.timestamp(), end.timestamp()));
            }
            candidates.add(candidate.build());
        }
        return candidates;
    }

    private static SessionMarker findEnd(List<SessionMarker> ordered, int startIndex) {
        SessionMarker start = ordered.get(startIndex);
        for (int j = startIndex + 1; j < ordered.size(); j++) {
            SessionMarker next = ordered.get(j);
            if (next.isStart()) {
                return null;
            }
            if (next.timestamp().isAfter(start.timestamp())) {
                return next;
            }
        }
        return null;
    }
}
