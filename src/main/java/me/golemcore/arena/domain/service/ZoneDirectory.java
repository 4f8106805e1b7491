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

import me.golemcore.arena.infrastructure.config.ArenaProperties;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates numeric arena zone ids found on session start markers into map
 * names. Configured entries under {@code arena.zones} override the built-in
 * ones.
 */
@Component
public class ZoneDirectory {

    private static final Map<Integer, String> KNOWN_ZONES = Map.ofEntries(
            Map.entry(980, "Tol'viron"),
            Map.entry(1552, "Ashamane's Fall"),
            Map.entry(2759, "Cage of Carnage"),
            Map.entry(1504, "Black Rook"),
            Map.entry(2167, "Robodrome"),
            Map.entry(2563, "Nokhudon"),
            Map.entry(1911, "Mugambala"),
            Map.entry(2373, "Empyrean Domain"),
            Map.entry(1134, "Tiger's Peak"),
            Map.entry(1505, "Nagrand"),
            Map.entry(1825, "Hook Point"),
            Map.entry(2509, "Maldraxxus"),
            Map.entry(572, "Ruins of Lordaeron"),
            Map.entry(617, "Dalaran Sewers"),
            Map.entry(2547, "Enigma Crucible"));

    private final Map<Integer, String> zones;

    public ZoneDirectory(ArenaProperties properties) {
        Map<Integer, String> merged = new LinkedHashMap<>(KNOWN_ZONES);
        if (properties.getZones() != null) {
            merged.putAll(properties.getZones());
        }
        this.zones = Collections.unmodifiableMap(merged);
    }

    public String nameOf(Integer zoneId) {
        if (zoneId == null) {
            return null;
        }
        return zones.getOrDefault(zoneId, "Zone_" + zoneId);
    }
}
