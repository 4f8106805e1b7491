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
import java.util.List;

/**
 * A single parsed combat log line.
 *
 * <p>
 * {@code fields} holds the comma-delimited payload with surrounding quotes
 * removed; index 0 is the raw event token. Actor and target are taken from the
 * standard source-name and destination-name positions and are {@code null} for
 * events that do not carry them.
 */
public record CombatEvent(LocalDateTime timestamp, EventKind kind, String actorId, String targetId,
        List<String> fields) {

    public static final int ACTOR_NAME_INDEX = 2;
    public static final int TARGET_NAME_INDEX = 6;
    public static final int SPELL_NAME_INDEX = 10;
    public static final int EXTRA_SPELL_NAME_INDEX = 12;

    public CombatEvent {
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public String field(int index) {
        if (index < 0 || index >= fields.size()) {
            return null;
        }
        return fields.get(index);
    }

    public String spellName() {
        return field(SPELL_NAME_INDEX);
    }

    public String extraSpellName() {
        return field(EXTRA_SPELL_NAME_INDEX);
    }
}
