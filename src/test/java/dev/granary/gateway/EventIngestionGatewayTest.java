package dev.granary.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.granary.fixture.SourceConfigBuilder;
import dev.granary.ingestion.IngestionJob;
import dev.granary.ingestion.IngestionMetrics;
import dev.granary.ingestion.IngestionQueue;
import dev.granary.pull.PullJobHandler;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventIngestionGatewayTest {

    @Mock
    SourceConfigService sourceConfigService;

    @Mock
    IngestionQueue queue;

    @Mock
    PullJobHandler pullJobHandler;

    @Captor
    ArgumentCaptor<IngestionJob> jobCaptor;

    SimpleMeterRegistry meterRegistry;

    EventIngestionGateway gateway;

    SourceConfig qualityEvents;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        gateway = new EventIngestionGateway(sourceConfigService, queue, pullJobHandler, new ObjectMapper(),
                new IngestionMetrics(meterRegistry));
        qualityEvents = SourceConfigBuilder.blobTrigger()
                .sourceId("quality-events")
                .landingContainer("quality-events")
                .pathPattern("{farmer_id}/{event_id}.json", "farmer_id", "event_id")
                .build();
        lenient().when(sourceConfigService.isReady()).thenReturn(true);
    }

    private static String blobCreated(String id, String container, String path, String etag) {
        return """
                {"id":"%s","eventType":"Microsoft.Storage.BlobCreated",
                 "subject":"/blobServices/default/containers/%s/blobs/%s",
                 "data":{"eTag":"%s","contentLength":512}}
                """.formatted(id, container, path, etag);
    }

    private void idempotentQueue() {
        Set<String> seen = new HashSet<>();
        when(queue.queueJob(any(IngestionJob.class)))
                .thenAnswer(invocation -> seen.add(invocation.<IngestionJob>getArgument(0).idempotencyKey()));
    }

    // --- Blob-created events ---

    @Test
    void blobCreatedEventBecomesJobWithPathMetadata() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        when(queue.queueJob(any(IngestionJob.class))).thenReturn(true);

        BatchOutcome outcome = gateway.handleBatch(
                "[" + blobCreated("evt-1", "quality-events", "FRM-001/doc.json", "0x8D1") + "]");

        assertThat(outcome.isValidation()).isFalse();
        assertThat(outcome.result()).isEqualTo(new GatewayBatchResult(1, 1, 0, 0, 0, 0, 0));
        verify(queue).queueJob(jobCaptor.capture());
        IngestionJob job = jobCaptor.getValue();
        assertThat(job.sourceId()).isEqualTo("quality-events");
        assertThat(job.blobPath()).isEqualTo("FRM-001/doc.json");
        assertThat(job.contentLength()).isEqualTo(512);
        assertThat(job.traceId()).isEqualTo("evt-1");
        assertThat(job.metadata()).containsEntry("farmer_id", "FRM-001").containsEntry("event_id", "doc");
        assertThat(job.idempotencyKey()).isEqualTo("blob:FRM-001/doc.json#0x8D1");
    }

    @Test
    void redeliveredEventIsCountedAsDuplicate() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        idempotentQueue();
        String event = blobCreated("evt-1", "quality-events", "FRM-001/doc.json", "0x8D1");

        GatewayBatchResult first = gateway.handleBatch("[" + event + "]").result();
        GatewayBatchResult second = gateway.handleBatch("[" + event + "]").result();

        assertThat(first.queued()).isEqualTo(1);
        assertThat(second.queued()).isZero();
        assertThat(second.duplicates()).isEqualTo(1);
    }

    @Test
    void newEtagOnSamePathIsQueuedAgain() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        idempotentQueue();

        GatewayBatchResult result = gateway.handleBatch("["
                + blobCreated("evt-1", "quality-events", "FRM-001/doc.json", "0x1") + ","
                + blobCreated("evt-2", "quality-events", "FRM-001/doc.json", "0x2") + "]").result();

        assertThat(result.queued()).isEqualTo(2);
    }

    @Test
    void mixedBatchCountsEveryOutcome() {
        SourceConfig disabled = SourceConfigBuilder.blobTrigger().sourceId("old").landingContainer("old-drop")
                .enabled(false).build();
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        when(sourceConfigService.getConfigByContainer("nobody")).thenReturn(Optional.empty());
        when(sourceConfigService.getConfigByContainer("old-drop")).thenReturn(Optional.of(disabled));
        when(queue.queueJob(any(IngestionJob.class))).thenReturn(true);
        String batch = "["
                + blobCreated("1", "quality-events", "FRM-1/a.json", "e1") + ","
                + blobCreated("2", "nobody", "x.json", "e2") + ","
                + blobCreated("3", "old-drop", "y.json", "e3") + ","
                + "{\"id\":\"4\",\"eventType\":\"Microsoft.Storage.BlobCreated\",\"subject\":\"/bad\",\"data\":{\"eTag\":\"e4\"}},"
                + "{\"id\":\"5\",\"eventType\":\"Microsoft.Storage.BlobDeleted\",\"subject\":\"s\",\"data\":{}}"
                + "]";

        GatewayBatchResult result = gateway.handleBatch(batch).result();

        assertThat(result).isEqualTo(new GatewayBatchResult(5, 1, 0, 1, 1, 1, 1));
    }

    @Test
    void countersAccumulateAcrossBatches() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        when(sourceConfigService.getConfigByContainer("nobody")).thenReturn(Optional.empty());
        idempotentQueue();
        String event = blobCreated("evt-1", "quality-events", "FRM-001/doc.json", "0x8D1");

        gateway.handleBatch("[" + event + "," + blobCreated("evt-2", "nobody", "x.json", "e2") + "]");
        gateway.handleBatch("[" + event + "]");
        gateway.handleBatch("[{\"id\":\"4\",\"eventType\":\"Microsoft.Storage.BlobCreated\",\"subject\":\"/bad\"}]");

        assertThat(meterRegistry.get("granary.events.received").counter().count()).isEqualTo(4.0);
        assertThat(meterRegistry.get("granary.events.queued").tag("source_id", "quality-events")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("granary.events.duplicate").tag("source_id", "quality-events")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("granary.events.unmatched").tag("container", "nobody")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("granary.events.malformed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void eventWithoutEtagIsQueuedUnderEmptyEtag() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        idempotentQueue();
        String event = """
                [{"id":"1","eventType":"Microsoft.Storage.BlobCreated",
                  "subject":"/blobServices/default/containers/quality-events/blobs/FRM-3/a.json","data":{}}]
                """;

        GatewayBatchResult first = gateway.handleBatch(event).result();
        GatewayBatchResult redelivered = gateway.handleBatch(event).result();

        assertThat(first.queued()).isEqualTo(1);
        assertThat(first.malformed()).isZero();
        assertThat(redelivered.duplicates()).isEqualTo(1);
        verify(queue, times(2)).queueJob(jobCaptor.capture());
        assertThat(jobCaptor.getAllValues().get(0).blobEtag()).isEmpty();
        assertThat(jobCaptor.getAllValues().get(0).idempotencyKey()).isEqualTo("blob:FRM-3/a.json#");
    }

    @Test
    void cloudEventsEnvelopeIsUnwrapped() {
        when(sourceConfigService.getConfigByContainer("quality-events")).thenReturn(Optional.of(qualityEvents));
        when(queue.queueJob(any(IngestionJob.class))).thenReturn(true);
        String wrapped = "[{\"specversion\":\"1.0\",\"type\":\"com.dapr.event.sent\",\"data\":"
                + blobCreated("evt-9", "quality-events", "FRM-2/b.json", "0x9") + "}]";

        assertThat(gateway.handleBatch(wrapped).result().queued()).isEqualTo(1);
    }

    // --- Handshake and errors ---

    @Test
    void validationHandshakeEchoesCode() {
        String body = """
                [{"id":"v","eventType":"Microsoft.EventGrid.SubscriptionValidationEvent",
                  "data":{"validationCode":"abc123"}}]
                """;

        BatchOutcome outcome = gateway.handleBatch(body);

        assertThat(outcome.isValidation()).isTrue();
        assertThat(outcome.validationCode()).isEqualTo("abc123");
        verifyNoInteractions(queue);
    }

    @Test
    void validationIsAnsweredBeforeConfigsAreLoaded() {
        lenient().when(sourceConfigService.isReady()).thenReturn(false);
        String body = "[{\"eventType\":\"Microsoft.EventGrid.SubscriptionValidationEvent\","
                + "\"data\":{\"validationCode\":\"early\"}}]";

        assertThat(gateway.handleBatch(body).validationCode()).isEqualTo("early");
    }

    @Test
    void dataEventsAreRejectedUntilConfigsAreLoaded() {
        when(sourceConfigService.isReady()).thenReturn(false);

        assertThatThrownBy(() -> gateway.handleBatch(
                "[" + blobCreated("1", "quality-events", "a.json", "e") + "]"))
                .isInstanceOf(ServiceNotReadyException.class);
        verifyNoInteractions(queue);
    }

    @Test
    void nonArrayBodyIsMalformed() {
        assertThatThrownBy(() -> gateway.handleBatch("{\"id\":\"1\"}"))
                .isInstanceOf(MalformedEventBatchException.class);
        assertThatThrownBy(() -> gateway.handleBatch("not json"))
                .isInstanceOf(MalformedEventBatchException.class);
    }

    @Test
    void emptyBatchIsAcknowledged() {
        assertThat(gateway.handleBatch("[]").result()).isEqualTo(GatewayBatchResult.empty());
    }

    // --- Scheduler callbacks ---

    @Test
    void scheduledTriggerUsesSourceIdFromPayload() throws Exception {
        var data = new ObjectMapper().readTree("{\"data\":{\"source_id\":\"weather\"}}");

        gateway.handleScheduledTrigger("ingest-weather", data);

        verify(pullJobHandler).handleJobTrigger("weather");
    }

    @Test
    void scheduledTriggerFallsBackToJobName() {
        gateway.handleScheduledTrigger("weather", null);

        verify(pullJobHandler).handleJobTrigger("weather");
    }
}
