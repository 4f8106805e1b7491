package me.golemcore.arena.adapter.inbound.batch;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.adapter.outbound.ownership.JsonOwnershipIndexLoader;
import me.golemcore.arena.domain.model.BatchReport;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.ResolutionOutcome;
import me.golemcore.arena.domain.service.BatchResolutionService;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.MetadataSourcePort;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import me.golemcore.arena.port.outbound.ResolutionReportPort;
import me.golemcore.arena.port.outbound.ResolvedRecordStorePort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs one batch over the configured metadata file at startup.
 *
 * <p>
 * The ownership index and metadata are loaded before any record is resolved;
 * failing to load either aborts startup. After the run the report is saved
 * and the ids of newly resolved records are added to the resolved-record
 * store.
 */
@Component
@ConditionalOnProperty(prefix = "arena.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BatchLauncher implements ApplicationRunner {

    private final ArenaProperties properties;
    private final JsonOwnershipIndexLoader ownershipIndexLoader;
    private final MetadataSourcePort metadataSource;
    private final ResolvedRecordStorePort resolvedRecordStore;
    private final ResolutionReportPort reportPort;
    private final BatchResolutionService batchResolutionService;

    @Override
    public void run(ApplicationArguments args) {
        BatchReport report = runBatch();
        log.info("[Batch] {} of {} attempted records resolved", report.getResolved(),
                report.getResolved() + report.getUnresolved());
    }

    public BatchReport runBatch() {
        OwnershipIndex ownershipIndex;
        List<MetadataRecord> records;
        Set<String> resolvedIds;
        try {
            ownershipIndex = ownershipIndexLoader.load(Path.of(properties.getBatch().getOwnershipIndexFile()));
            records = metadataSource.loadRecords();
            resolvedIds = new LinkedHashSet<>(resolvedRecordStore.loadResolvedIds());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load batch inputs", e);
        }

        BatchReport report = batchResolutionService.run(records, resolvedIds, ownershipIndex);

        for (ResolutionOutcome outcome : report.getOutcomes()) {
            if (outcome.isResolved()) {
                resolvedIds.add(outcome.getRecordId());
            }
        }
        try {
            reportPort.saveReport(report);
            resolvedRecordStore.saveResolvedIds(resolvedIds);
        } catch (IOException e) {
            log.error("[Batch] failed to persist batch results: {}", e.getMessage(), e);
        }
        return report;
    }
}
