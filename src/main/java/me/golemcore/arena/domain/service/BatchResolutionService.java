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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.arena.domain.model.BatchReport;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.ResolutionEventType;
import me.golemcore.arena.domain.model.ResolutionFailureKind;
import me.golemcore.arena.domain.model.ResolutionOutcome;
import me.golemcore.arena.port.outbound.CombatLogLocator;
import me.golemcore.arena.port.outbound.CombatLogSource;
import me.golemcore.arena.port.outbound.OwnershipIndex;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Resolves many independent metadata records, one task per record on the
 * shared worker pool.
 *
 * <p>
 * Records whose id is in the caller's already-resolved set are skipped. A
 * failing record never aborts the run: it becomes an unresolved outcome with
 * its failure reason and the remaining records continue.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchResolutionService {

    private final SessionResolverService resolverService;
    private final CombatLogLocator combatLogLocator;
    private final ExecutorService resolverExecutor;
    private final ResolutionEventService eventService;
    private final Clock clock;

    public BatchReport run(List<MetadataRecord> records, Collection<String> alreadyResolved,
            OwnershipIndex ownershipIndex) {
        Instant startedAt = clock.instant();
        Set<String> skipIds = alreadyResolved != null ? new HashSet<>(alreadyResolved) : Set.of();
        OwnershipIndex index = ownershipIndex != null ? ownershipIndex : OwnershipIndex.empty();
        eventService.emit(ResolutionEventType.BATCH_STARTED, null,
                Map.of("records", records.size(), "alreadyResolved", skipIds.size()));
        log.info("[Batch] starting: {} records, {} already resolved", records.size(), skipIds.size());

        List<String> submittedIds = new ArrayList<>();
        List<Future<ResolutionOutcome>> futures = new ArrayList<>();
        int skipped = 0;
        for (int i = 0; i < records.size(); i++) {
            MetadataRecord record = records.get(i);
            String recordId = batchIdOf(record, i);
            if (skipIds.contains(recordId)) {
                skipped++;
                log.debug("[Batch] skipping already resolved record {}", recordId);
                continue;
            }
            submittedIds.add(recordId);
            futures.add(resolverExecutor.submit(() -> resolveOne(record, recordId, index)));
        }

        List<ResolutionOutcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i), submittedIds.get(i), futures));
        }

        BatchReport report = summarize(startedAt, records.size(), skipped, outcomes);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("total", report.getTotal());
        payload.put("resolved", report.getResolved());
        payload.put("unresolved", report.getUnresolved());
        payload.put("skipped", report.getSkipped());
        payload.put("resolvedRatio", report.getResolvedRatio());
        eventService.emit(ResolutionEventType.BATCH_FINISHED, null, payload);
        log.info("[Batch] finished: {} resolved, {} unresolved, {} skipped (ratio {})",
                report.getResolved(), report.getUnresolved(), report.getSkipped(),
                String.format(Locale.ROOT, "%.2f", report.getResolvedRatio()));
        return report;
    }

    ResolutionOutcome resolveOne(MetadataRecord record, String recordId, OwnershipIndex ownershipIndex) {
        MetadataRecord identified = record.getId() != null ? record : record.toBuilder().id(recordId).build();
        Optional<CombatLogSource> source;
        try {
            source = combatLogLocator.locate(identified);
        } catch (UncheckedIOException e) {
            log.warn("[Batch] record {}: log lookup failed: {}", recordId, e.getMessage());
            return ResolutionOutcome.failed(recordId, ResolutionFailureKind.LOG_UNREADABLE,
                    "log lookup failed: " + e.getMessage());
        }
        if (source.isEmpty()) {
            log.warn("[Batch] record {}: no combat log covers {}", recordId, identified.getDeclaredStart());
            return ResolutionOutcome.failed(recordId, ResolutionFailureKind.LOG_UNREADABLE,
                    "no combat log found for declared start " + identified.getDeclaredStart());
        }
        try {
            return ResolutionOutcome.resolved(resolverService.resolve(identified, source.get(), ownershipIndex));
        } catch (SessionResolutionException e) {
            log.warn("[Batch] record {} unresolved: {} ({})", recordId, e.getKind(), e.getMessage());
            return ResolutionOutcome.failed(recordId, e.getKind(), e.getMessage());
        }
    }

    private ResolutionOutcome await(Future<ResolutionOutcome> future, String recordId,
            List<Future<ResolutionOutcome>> all) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Batch] record {} failed unexpectedly", recordId, cause);
            return ResolutionOutcome.failed(recordId, null, "unexpected error: " + cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(pending -> pending.cancel(true));
            throw new IllegalStateException("Batch run interrupted", e);
        }
    }

    private BatchReport summarize(Instant startedAt, int total, int skipped, List<ResolutionOutcome> outcomes) {
        Map<ResolutionFailureKind, Integer> failuresByKind = new EnumMap<>(ResolutionFailureKind.class);
        int resolved = 0;
        for (ResolutionOutcome outcome : outcomes) {
            if (outcome.isResolved()) {
                resolved++;
            } else if (outcome.getFailureKind() != null) {
                failuresByKind.merge(outcome.getFailureKind(), 1, Integer::sum);
            }
        }
        return BatchReport.builder()
                .startedAt(startedAt)
                .finishedAt(clock.instant())
                .total(total)
                .resolved(resolved)
                .unresolved(outcomes.size() - resolved)
                .skipped(skipped)
                .failuresByKind(failuresByKind)
                .outcomes(outcomes)
                .build();
    }

    private static String batchIdOf(MetadataRecord record, int position) {
        String id = SessionResolverService.recordIdOf(record);
        return id != null ? id : "record-" + position;
    }
}
