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
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.MetadataSourcePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads metadata records from a JSON array. Timestamps use ISO-8601 local
 * date-times; durations accept ISO-8601 ({@code PT30M}) or seconds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonMetadataRecordAdapter implements MetadataSourcePort {

    private static final TypeReference<List<MetadataRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ArenaProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public List<MetadataRecord> loadRecords() throws IOException {
        Path file = Path.of(properties.getBatch().getMetadataFile());
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "metadata file not found");
        }
        List<MetadataRecord> records = objectMapper.readValue(file.toFile(), RECORD_LIST);
        if (records == null) {
            return new ArrayList<>();
        }
        log.info("[Metadata] loaded {} records from {}", records.size(), file);
        return records;
    }
}
