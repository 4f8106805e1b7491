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

import me.golemcore.arena.domain.model.SessionMarker;
import me.golemcore.arena.domain.model.SessionType;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares declared metadata attributes with the attributes carried by session
 * start markers.
 *
 * <p>
 * Categories are compatible when equal ignoring case or when the configured
 * equivalence list of the declared category names the marker's category (a
 * generic "Skirmish" accepts "2v2" and "3v3", "Solo Shuffle" accepts
 * "Rated Solo Shuffle").
 * Locations compare by numeric zone id when the declared location is numeric,
 * otherwise by case-insensitive substring in either direction.
 */
@Component
public class AttributeMatcher {

    private final ArenaProperties.CategoryProperties categories;

    public AttributeMatcher(ArenaProperties properties) {
        this.categories = properties.getCategories();
    }

    public boolean categoryMatches(String declaredCategory, String markerCategory) {
        if (isBlank(declaredCategory) || isBlank(markerCategory)) {
            return false;
        }
        String declared = declaredCategory.trim();
        String observed = markerCategory.trim();
        if (declared.equalsIgnoreCase(observed)) {
            return true;
        }
        for (Map.Entry<String, List<String>> entry : categories.getEquivalents().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(declared) && containsIgnoreCase(entry.getValue(), observed)) {
                return true;
            }
        }
        return false;
    }

    public boolean locationMatches(String declaredLocation, SessionMarker marker) {
        if (isBlank(declaredLocation) || marker == null) {
            return false;
        }
        Integer declaredId = parseZoneId(declaredLocation);
        if (declaredId != null && marker.locationId() != null) {
            return declaredId.equals(marker.locationId());
        }
        String observed = marker.locationName();
        if (isBlank(observed)) {
            return false;
        }
        String expected = lower(declaredLocation.trim());
        String actual = lower(observed.trim());
        return expected.equals(actual) || actual.contains(expected) || expected.contains(actual);
    }

    public SessionType sessionTypeOf(String category) {
        if (isBlank(category)) {
            return SessionType.STANDARD;
        }
        return containsIgnoreCase(categories.getContinuous(), category.trim())
                ? SessionType.CONTINUOUS_MULTI_ROUND
                : SessionType.STANDARD;
    }

    private static Integer parseZoneId(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (values == null) {
            return false;
        }
        for (String value : values) {
            if (value != null && value.trim().equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
