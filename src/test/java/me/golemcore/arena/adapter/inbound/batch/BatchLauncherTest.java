package me.golemcore.arena.adapter.inbound.batch;

import me.golemcore.arena.adapter.outbound.ownership.JsonOwnershipIndexLoader;
import me.golemcore.arena.adapter.outbound.ownership.MapOwnershipIndex;
import me.golemcore.arena.domain.model.BatchReport;
import me.golemcore.arena.domain.model.MetadataRecord;
import me.golemcore.arena.domain.model.ResolutionFailureKind;
import me.golemcore.arena.domain.model.ResolutionOutcome;
import me.golemcore.arena.domain.model.ResolutionResult;
import me.golemcore.arena.domain.service.BatchResolutionService;
import me.golemcore.arena.infrastructure.config.ArenaProperties;
import me.golemcore.arena.port.outbound.MetadataSourcePort;
import me.golemcore.arena.port.outbound.ResolutionReportPort;
import me.golemcore.arena.port.outbound.ResolvedRecordStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchLauncherTest {

    private JsonOwnershipIndexLoader ownershipIndexLoader;
    private MetadataSourcePort metadataSource;
    private ResolvedRecordStorePort resolvedRecordStore;
    private ResolutionReportPort reportPort;
    private BatchResolutionService batchResolutionService;
    private BatchLauncher launcher;

    private final MapOwnershipIndex ownershipIndex = MapOwnershipIndex.fromOwners(Map.of());
    private final List<MetadataRecord> records = List.of(
            MetadataRecord.builder().id("r1").build(),
            MetadataRecord.builder().id("r2").build());

    @BeforeEach
    void setUp() {
        ownershipIndexLoader = mock(JsonOwnershipIndexLoader.class);
        metadataSource = mock(MetadataSourcePort.class);
        resolvedRecordStore = mock(ResolvedRecordStorePort.class);
        reportPort = mock(ResolutionReportPort.class);
        batchResolutionService = mock(BatchResolutionService.class);
        ArenaProperties properties = new ArenaProperties();
        properties.getBatch().setOwnershipIndexFile("index.json");
        launcher = new BatchLauncher(properties, ownershipIndexLoader, metadataSource, resolvedRecordStore,
                reportPort, batchResolutionService);
    }

    @Test
    void shouldRunBatchAndPersistReportAndNewlyResolvedIds() throws IOException {
        BatchReport report = BatchReport.builder()
                .total(2)
                .resolved(1)
                .unresolved(1)
                .outcomes(List.of(
                        ResolutionOutcome.resolved(ResolutionResult.builder().recordId("r1").build()),
                        ResolutionOutcome.failed("r2", ResolutionFailureKind.NO_CONFIDENT_MATCH, "none")))
                .build();
        when(ownershipIndexLoader.load(Path.of("index.json"))).thenReturn(ownershipIndex);
        when(metadataSource.loadRecords()).thenReturn(records);
        when(resolvedRecordStore.loadResolvedIds()).thenReturn(Set.of("r0"));
        when(batchResolutionService.run(eq(records), anyCollection(), eq(ownershipIndex))).thenReturn(report);

        launcher.run(null);

        verify(reportPort).saveReport(report);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Set<String>> saved = ArgumentCaptor.forClass(Set.class);
        verify(resolvedRecordStore).saveResolvedIds(saved.capture());
        assertEquals(Set.of("r0", "r1"), saved.getValue());
    }

    @Test
    void shouldAbortBeforeResolvingWhenInputsCannotBeLoaded() throws IOException {
        when(ownershipIndexLoader.load(any())).thenThrow(new NoSuchFileException("index.json"));

        assertThrows(UncheckedIOException.class, () -> launcher.runBatch());
        verify(batchResolutionService, never()).run(any(), any(), any());
    }

    @Test
    void shouldKeepReportWhenPersistenceFails() throws IOException {
        BatchReport report = BatchReport.builder().build();
        when(ownershipIndexLoader.load(any())).thenReturn(ownershipIndex);
        when(metadataSource.loadRecords()).thenReturn(records);
        when(resolvedRecordStore.loadResolvedIds()).thenReturn(Set.of());
        when(batchResolutionService.run(any(), any(), any())).thenReturn(report);
        doThrow(new IOException("read-only")).when(reportPort).saveReport(report);

        BatchReport returned = assertDoesNotThrow(() -> launcher.runBatch());

        assertEquals(report, returned);
    }
}
