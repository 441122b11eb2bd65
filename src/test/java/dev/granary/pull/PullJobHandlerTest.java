package dev.granary.pull;

import dev.granary.events.EventPublisher;
import dev.granary.fixture.SourceConfigBuilder;
import dev.granary.ingestion.IngestionJob;
import dev.granary.ingestion.IngestionMetrics;
import dev.granary.ingestion.IngestionQueue;
import dev.granary.source.IterationSettings;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import dev.granary.storage.DuplicateDocumentException;
import dev.granary.storage.RawDocument;
import dev.granary.storage.RawDocumentStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PullJobHandlerTest {

    @Mock
    SourceConfigService sourceConfigService;

    @Mock
    PullDataFetcher fetcher;

    @Mock
    IterationResolver iterationResolver;

    @Mock
    RawDocumentStore rawDocumentStore;

    @Mock
    IngestionQueue queue;

    @Mock
    EventPublisher eventPublisher;

    @Captor
    ArgumentCaptor<IngestionJob> jobCaptor;

    PullRunTracker runTracker;

    SimpleMeterRegistry meterRegistry;

    PullJobHandler handler;

    @BeforeEach
    void setUp() {
        runTracker = new PullRunTracker(Clock.systemUTC());
        meterRegistry = new SimpleMeterRegistry();
        handler = new PullJobHandler(sourceConfigService, fetcher, iterationResolver, rawDocumentStore,
                queue, eventPublisher, runTracker, new IngestionMetrics(meterRegistry));
    }

    private static RawDocument document(SourceConfig config, String hash, Map<String, Object> metadata) {
        return new RawDocument(config.sourceId(), UUID.randomUUID(), "raw-documents", hash,
                "application/json", 10, Instant.now(), metadata);
    }

    // --- Single pull ---

    @Test
    void singlePullStoresAndQueuesPayload() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather").build();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        when(fetcher.fetch(config.ingestion().request(), null)).thenReturn("{}".getBytes());
        when(rawDocumentStore.storeRawDocument(any(), eq(config), any(), anyMap()))
                .thenReturn(document(config, "abc", Map.of()));

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.success()).isTrue();
        assertThat(result.fetched()).isEqualTo(1);
        verify(queue).queueStoredJob(jobCaptor.capture(), any());
        assertThat(jobCaptor.getValue().idempotencyKey()).isEqualTo("content:weather:abc");
        verify(eventPublisher).publishSuccess(eq(config), anyMap());
        assertThat(runTracker.activeRuns()).isEmpty();
    }

    @Test
    void unchangedContentCountsAsDuplicate() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather").build();
        RawDocument existing = document(config, "abc", Map.of());
        UUID existingId = UUID.randomUUID();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        when(fetcher.fetch(any(), isNull())).thenReturn("{}".getBytes());
        when(rawDocumentStore.storeRawDocument(any(), any(), any(), anyMap()))
                .thenThrow(new DuplicateDocumentException("weather", "abc", existingId));
        when(rawDocumentStore.findByDocumentId(existingId)).thenReturn(Optional.of(existing));
        when(queue.isAdmitted("content:weather:abc")).thenReturn(true);

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.success()).isTrue();
        assertThat(result.duplicates()).isEqualTo(1);
        verify(queue, never()).queueStoredJob(any(), any());
        verifyNoInteractions(eventPublisher);
        assertThat(meterRegistry.get("granary.pull.duplicate").tag("source_id", "weather")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void storedContentWithoutJobIsAdmittedOnNextRun() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather").build();
        RawDocument existing = document(config, "abc", Map.of());
        UUID existingId = UUID.randomUUID();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        when(fetcher.fetch(any(), isNull())).thenReturn("{}".getBytes());
        when(rawDocumentStore.storeRawDocument(any(), any(), any(), anyMap()))
                .thenThrow(new DuplicateDocumentException("weather", "abc", existingId));
        when(rawDocumentStore.findByDocumentId(existingId)).thenReturn(Optional.of(existing));
        when(queue.isAdmitted("content:weather:abc")).thenReturn(false);
        when(queue.queueStoredJob(any(IngestionJob.class), any())).thenReturn(true);

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.fetched()).isEqualTo(1);
        assertThat(result.duplicates()).isZero();
        verify(queue).queueStoredJob(jobCaptor.capture(), any());
        assertThat(jobCaptor.getValue().ingestionId()).isEqualTo(existing.getIngestionId());
        assertThat(jobCaptor.getValue().idempotencyKey()).isEqualTo("content:weather:abc");
        verify(eventPublisher).publishSuccess(eq(config), anyMap());
    }

    @Test
    void admissionFailureAfterStoreIsCountedAsFailed() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather").build();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        when(fetcher.fetch(any(), isNull())).thenReturn("{}".getBytes());
        when(rawDocumentStore.storeRawDocument(any(), any(), any(), anyMap()))
                .thenReturn(document(config, "abc", Map.of()));
        when(queue.queueStoredJob(any(IngestionJob.class), any()))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.failed()).isEqualTo(1);
        verify(eventPublisher, never()).publishSuccess(any(), anyMap());
    }

    @Test
    void fetchFailureIsCountedAndAnnounced() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather")
                .onFailure("weather.failed").build();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        when(fetcher.fetch(any(), isNull()))
                .thenThrow(new PullFetchException("gave up", 4, new ResourceAccessException("timeout")));

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.success()).isFalse();
        assertThat(result.failed()).isEqualTo(1);
        verify(eventPublisher).publishFailure(config, "PullFetchException", "gave up", null);
        verify(rawDocumentStore, never()).storeRawDocument(any(), any(), any(), anyMap());
        assertThat(meterRegistry.get("granary.pull.failed")
                .tags("source_id", "weather", "error_type", "PullFetchException").counter().count())
                .isEqualTo(1.0);
    }

    // --- Iteration ---

    @Test
    void iteratesEveryItemAndInjectsLinkage() {
        var iteration = new IterationSettings("farm", "farm-registry", "list_farms", Map.of(),
                "farms", List.of("farm_id"), 2);
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("soil")
                .parameter("farm", "{item.farm_id}").iteration(iteration).build();
        List<Map<String, Object>> items = List.of(
                Map.of("farm_id", "F1"), Map.of("farm_id", "F2"), Map.of("farm_id", "F3"));
        when(sourceConfigService.getConfig("soil")).thenReturn(Optional.of(config));
        when(iterationResolver.resolveItems(iteration)).thenReturn(items);
        when(fetcher.fetch(eq(config.ingestion().request()), anyMap())).thenReturn("{}".getBytes());
        when(rawDocumentStore.storeRawDocument(any(), eq(config), any(), anyMap()))
                .thenAnswer(invocation -> document(config, UUID.randomUUID().toString(), invocation.getArgument(3)));

        PullJobResult result = handler.handleJobTrigger("soil");

        assertThat(result.fetched()).isEqualTo(3);
        verify(queue, times(3)).queueStoredJob(jobCaptor.capture(), any());
        assertThat(jobCaptor.getAllValues())
                .extracting(job -> job.metadata().get("farm_id"))
                .containsExactlyInAnyOrder("F1", "F2", "F3");
    }

    @Test
    void oneFailingItemDoesNotAbortTheOthers() {
        var iteration = new IterationSettings(null, "farm-registry", "list_farms", Map.of(), null, List.of(), 3);
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("soil").iteration(iteration).build();
        Map<String, Object> bad = Map.of("farm_id", "BAD");
        when(sourceConfigService.getConfig("soil")).thenReturn(Optional.of(config));
        when(iterationResolver.resolveItems(iteration)).thenReturn(List.of(Map.of("farm_id", "F1"), bad));
        when(fetcher.fetch(any(), eq(Map.of("farm_id", "F1")))).thenReturn("{}".getBytes());
        when(fetcher.fetch(any(), eq(bad))).thenThrow(new IllegalStateException("boom"));
        when(rawDocumentStore.storeRawDocument(any(), any(), any(), anyMap()))
                .thenReturn(document(config, "h1", Map.of()));

        PullJobResult result = handler.handleJobTrigger("soil");

        assertThat(result.fetched()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.success()).isTrue();
    }

    @Test
    void iterationToolFailureFailsRun() {
        var iteration = new IterationSettings(null, "farm-registry", "list_farms", Map.of(), null, List.of(), 0);
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("soil").iteration(iteration).build();
        when(sourceConfigService.getConfig("soil")).thenReturn(Optional.of(config));
        when(iterationResolver.resolveItems(iteration))
                .thenThrow(new IterationResolutionException("Tool farm-registry/list_farms failed", null));

        PullJobResult result = handler.handleJobTrigger("soil");

        assertThat(result.success()).isFalse();
        assertThat(result.failed()).isEqualTo(1);
        verifyNoInteractions(fetcher);
    }

    @Test
    void emptyItemListIsSuccessfulNoOp() {
        var iteration = new IterationSettings(null, "farm-registry", "list_farms", Map.of(), null, List.of(), 0);
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("soil").iteration(iteration).build();
        when(sourceConfigService.getConfig("soil")).thenReturn(Optional.of(config));
        when(iterationResolver.resolveItems(iteration)).thenReturn(List.of());

        PullJobResult result = handler.handleJobTrigger("soil");

        assertThat(result.success()).isTrue();
        assertThat(result.fetched()).isZero();
    }

    // --- Not run ---

    @Test
    void unknownSourceIsNotRun() {
        when(sourceConfigService.getConfig("ghost")).thenReturn(Optional.empty());

        PullJobResult result = handler.handleJobTrigger("ghost");

        assertThat(result.success()).isFalse();
        assertThat(result.message()).isEqualTo("Source configuration not found");
    }

    @Test
    void blobTriggerSourceIsNotRun() {
        when(sourceConfigService.getConfig("quality")).thenReturn(
                Optional.of(SourceConfigBuilder.blobTrigger().sourceId("quality").build()));

        assertThat(handler.handleJobTrigger("quality").message())
                .isEqualTo("Source is not a scheduled_pull source");
        verifyNoInteractions(fetcher);
    }

    @Test
    void disabledSourceIsNotRun() {
        when(sourceConfigService.getConfig("weather")).thenReturn(
                Optional.of(SourceConfigBuilder.scheduledPull().sourceId("weather").enabled(false).build()));

        assertThat(handler.handleJobTrigger("weather").message()).isEqualTo("Source is disabled");
        verifyNoInteractions(fetcher);
    }

    @Test
    void overlappingTriggerIsNotRun() {
        SourceConfig config = SourceConfigBuilder.scheduledPull().sourceId("weather").build();
        when(sourceConfigService.getConfig("weather")).thenReturn(Optional.of(config));
        runTracker.tryStart("weather");

        PullJobResult result = handler.handleJobTrigger("weather");

        assertThat(result.message()).isEqualTo("Previous run still active");
        verifyNoInteractions(fetcher);
    }
}
