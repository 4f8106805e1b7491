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

import me.golemcore.arena.domain.model.MetadataRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads match attributes out of recorder file names such as
 * {@code 2025-01-02_18-04-33_-_Shiizz_-_3v3_Nagrand_(Win).mp4} and fills in
 * whatever a metadata record is missing.
 */
@Component
public class RecordingNameParser {

    private static final String SECTION_SEPARATOR = "_-_";
    private static final String RESULT_SEPARATOR = "_(";

    /**
     * Attributes encoded in a recording name; any of them may be {@code null}.
     */
    public record RecordingAttributes(String primaryActor, String category, String location) {
    }

    public Optional<RecordingAttributes> parse(String recordingName) {
        if (recordingName == null || recordingName.isBlank()) {
            return Optional.empty();
        }
        String name = stripDirectory(recordingName.trim());
        String[] sections = name.split(SECTION_SEPARATOR, -1);
        if (sections.length < 2) {
            return Optional.empty();
        }
        String primaryActor = blankToNull(sections[1]);
        if (sections.length < 3) {
            return Optional.of(new RecordingAttributes(primaryActor, null, null));
        }

        String bracketAndMap = sections[2];
        String category;
        String mapPart;
        if (bracketAndMap.startsWith("3v3") || bracketAndMap.startsWith("2v2")) {
            category = bracketAndMap.substring(0, 3);
            mapPart = bracketAndMap.length() > 4 ? bracketAndMap.substring(4) : "";
        } else if (bracketAndMap.contains("Skirmish")) {
            category = "Skirmish";
            mapPart = bracketAndMap.replace("Skirmish_", "");
        } else if (bracketAndMap.contains("Solo_Shuffle")) {
            category = "Solo Shuffle";
            mapPart = bracketAndMap.replace("Solo_Shuffle_", "");
        } else {
            category = null;
            mapPart = bracketAndMap;
        }
        return Optional.of(new RecordingAttributes(primaryActor, category, mapName(mapPart)));
    }

    public MetadataRecord complete(MetadataRecord record) {
        if (record.getPrimaryActorId() != null && record.getDeclaredCategory() != null
                && record.getDeclaredLocation() != null) {
            return record;
        }
        Optional<RecordingAttributes> parsed = parse(record.getRecordingName());
        if (parsed.isEmpty()) {
            return record;
        }
        RecordingAttributes attributes = parsed.get();
        return record.toBuilder()
                .primaryActorId(firstNonNull(record.getPrimaryActorId(), attributes.primaryActor()))
                .declaredCategory(firstNonNull(record.getDeclaredCategory(), attributes.category()))
                .declaredLocation(firstNonNull(record.getDeclaredLocation(), attributes.location()))
                .build();
    }

    private static String mapName(String mapPart) {
        String map = mapPart;
        int result = map.indexOf(RESULT_SEPARATOR);
        if (result >= 0) {
            map = map.substring(0, result);
        } else {
            int extension = map.lastIndexOf('.');
            if (extension > 0) {
                map = map.substring(0, extension);
            }
        }
        map = map.replace('_', ' ').trim().replace("Tol viron", "Tol'viron");
        if (map.isEmpty() || "undefined".equalsIgnoreCase(map) || "unknown".equalsIgnoreCase(map)) {
            return null;
        }
        return map;
    }

    private static String stripDirectory(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null ? preferred : fallback;
    }
}
