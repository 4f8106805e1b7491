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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.model.BatchReport;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.ResolutionReportPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the batch report, including every unresolved record and its reason,
 * as pretty-printed JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonReportAdapter implements ResolutionReportPort {

    private final ArenaProperties properties;
    private final ObjectMapper objectMapper;
    private final AtomicFileWriter fileWriter;

    @Override
    public void saveReport(BatchReport report) throws IOException {
        Path target = Path.of(properties.getBatch().getReportFile());
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        fileWriter.writeText(target, json);
        log.info("[Report] saved batch report to {} ({} outcomes)", target, report.getOutcomes().size());
    }
}
