package me.golemcore.arena.domain.model;

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

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " precedes start " + start);
        }
    }

    public boolean contains(LocalDateTime timestamp) {
        return timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    public TimeWindow widen(Duration padding) {
        return new TimeWindow(start.minus(padding), end.plus(padding));
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
