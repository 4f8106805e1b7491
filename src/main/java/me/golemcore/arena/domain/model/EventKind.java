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

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Closed set of combat log event kinds understood by the resolver.
 *
 * <p>
 * Every raw event token maps to exactly one constant; tokens the resolver does
 * not care about map to {@link #OTHER}.
 */
public enum EventKind {

    SESSION_START("ARENA_MATCH_START"),

    SESSION_END("ARENA_MATCH_END"),

    CAST_SUCCESS("SPELL_CAST_SUCCESS"),

    INTERRUPT("SPELL_INTERRUPT"),

    DISPEL("SPELL_DISPEL"),

    AURA_APPLIED("SPELL_AURA_APPLIED"),

    ACTOR_ELIMINATED("UNIT_DIED"),

    OTHER(null);

    private static final Map<String, EventKind> BY_TOKEN = Stream.of(values())
            .filter(kind -> kind.token != null)
            .collect(Collectors.toUnmodifiableMap(kind -> kind.token, Function.identity()));

    private final String token;

    EventKind(String token) {
        this.token = token;
    }

    /**
     * Raw log token for this kind, {@code null} for {@link #OTHER}.
     */
    public String getToken() {
        return token;
    }

    public boolean isSessionMarker() {
        return this == SESSION_START || this == SESSION_END;
    }

    public static EventKind fromToken(String token) {
        if (token == null) {
            return OTHER;
        }
        return BY_TOKEN.getOrDefault(token.trim(), OTHER);
    }
}
