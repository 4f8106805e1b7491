package me.golemcore.arena.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.ResolvedRecordStorePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the ids of resolved metadata records in a JSON array. A missing file
 * means nothing was resolved yet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonResolvedRecordStore implements ResolvedRecordStorePort {

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    private final ArenaProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicFileWriter fileWriter;

    @Override
    public Set<String> loadResolvedIds() throws IOException {
        Path file = storeFile();
        if (!Files.exists(file)) {
            log.debug("[Store] no resolved-record store at {}", file);
            return new LinkedHashSet<>();
        }
        List<String> ids = objectMapper.readValue(file.toFile(), ID_LIST);
        return ids != null ? new LinkedHashSet<>(ids) : new LinkedHashSet<>();
    }

    @Override
    public void saveResolvedIds(Set<String> resolvedIds) throws IOException {
        List<String> sorted = new ArrayList<>(resolvedIds);
        Collections.sort(sorted);
        fileWriter.writeText(storeFile(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(sorted));
        log.debug("[Store] saved {} resolved record ids", sorted.size());
    }

    private Path storeFile() {
        return Path.of(properties.getBatch().getResolvedStoreFile());
    }
}
