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

import java.time.LocalDateTime;

/**
 * Session boundary event with its declared attributes. End markers carry no
 * location or category, so those components are {@code null} for them.
 *
 * @param scanOrder
 *            zero-based position of the marker in file order, used as the
 *            stable tie-break for identical timestamps
 */
public record SessionMarker(CombatEvent event, MarkerType type, Integer locationId, String locationName,
        String declaredCategory, SessionType sessionType, int scanOrder) {

    public LocalDateTime timestamp() {
        return event.timestamp();
    }

    public boolean isStart() {
        return type == MarkerType.START;
    }

    public boolean isEnd() {
        return type == MarkerType.END;
    }
}
