package me.golemcore.arena.adapter.outbound.ownership;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the precomputed ownership index:
 *
 * <pre>
 * {"player_pets": {"Owner-Realm-EU": {"pet_names": ["Felhunter", ...]}}}
 * </pre>
 *
 * A {@code pet_lookup} reverse map, when present, is ignored; the index is
 * derived from {@code player_pets} alone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonOwnershipIndexLoader {

    private static final String OWNERS_FIELD = "player_pets";
    private static final String SUB_AGENTS_FIELD = "pet_names";

    private final ObjectMapper objectMapper;

    public MapOwnershipIndex load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "ownership index not found");
        }
        JsonNode root = objectMapper.readTree(file.toFile());
        JsonNode owners = root != null ? root.path(OWNERS_FIELD) : null;
        if (owners == null || !owners.isObject()) {
            throw new IOException("Ownership index " + file + " has no '" + OWNERS_FIELD + "' object");
        }

        Map<String, List<String>> subAgentsByOwner = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = owners.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            List<String> names = new ArrayList<>();
            for (JsonNode name : entry.getValue().path(SUB_AGENTS_FIELD)) {
                if (name.isTextual()) {
                    names.add(name.asText());
                }
            }
            subAgentsByOwner.put(entry.getKey(), names);
        }

        MapOwnershipIndex index = MapOwnershipIndex.fromOwners(subAgentsByOwner);
        log.info("[Ownership] loaded {} sub-agents for {} owners from {}", index.size(), subAgentsByOwner.size(),
                file);
        return index;
    }
}
