package dev.granary.ingestion;

import dev.granary.events.EventPublisher;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import dev.granary.storage.BlobStorageClient;
import dev.granary.storage.DuplicateDocumentException;
import dev.granary.storage.RawDocument;
import dev.granary.storage.RawDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Moves queued blob-trigger jobs into the raw document store.
 *
 * <p>Each poll first re-queues jobs whose claim expired (the instance handling them died), then
 * takes the oldest {@code QUEUED} jobs, claims them one by one (a job claimed by another instance
 * is skipped), reads the landing blob and stores it. The outcome is recorded on
 * the queue record and announced through the source's configured events. A duplicate payload is a
 * successful no-op and publishes nothing. Any other failure marks the job FAILED.
 *
 * <p>While a job is handled the MDC carries {@code ingestion.id}, {@code source.id} and {@code
 * trace.id}.
 */
@Component
@ConditionalOnProperty(prefix = "granary.landing", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class LandingBlobProcessor {

    private static final Logger log = LoggerFactory.getLogger(LandingBlobProcessor.class);

    private final IngestionQueue queue;
    private final SourceConfigService sourceConfigService;
    private final BlobStorageClient blobStorage;
    private final RawDocumentStore rawDocumentStore;
    private final EventPublisher eventPublisher;
    private final LandingProcessorProperties properties;
    private final IngestionMetrics metrics;

    public LandingBlobProcessor(IngestionQueue queue,
                                SourceConfigService sourceConfigService,
                                BlobStorageClient blobStorage,
                                RawDocumentStore rawDocumentStore,
                                EventPublisher eventPublisher,
                                LandingProcessorProperties properties,
                                IngestionMetrics metrics) {
        this.queue = queue;
        this.sourceConfigService = sourceConfigService;
        this.blobStorage = blobStorage;
        this.rawDocumentStore = rawDocumentStore;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Process one batch of pending jobs.
     *
     * @return number of jobs this instance handled
     */
    @Scheduled(fixedDelayString = "${granary.landing.poll-interval-ms:5000}")
    public int processPending() {
        queue.requeueExpiredClaims(properties.claimTimeout());
        List<IngestionJob> pending = queue.findPending(properties.batchSize());
        int handled = 0;
        for (IngestionJob job : pending) {
            if (!queue.claim(job.ingestionId())) {
                log.debug("Job {} already claimed elsewhere", job.ingestionId());
                continue;
            }
            process(job);
            handled++;
        }
        if (handled > 0) {
            log.info("Processed {} landing blobs", handled);
        }
        return handled;
    }

    void process(IngestionJob job) {
        MDC.put("ingestion.id", job.ingestionId().toString());
        MDC.put("source.id", job.sourceId());
        MDC.put("trace.id", job.traceId());
        try {
            Optional<SourceConfig> config = sourceConfigService.getConfig(job.sourceId());
            if (config.isEmpty()) {
                log.warn("Source {} no longer configured, failing job", job.sourceId());
                queue.markFailed(job.ingestionId(), "Source configuration not found");
                return;
            }
            store(job, config.get());
        } finally {
            MDC.remove("ingestion.id");
            MDC.remove("source.id");
            MDC.remove("trace.id");
        }
    }

    private void store(IngestionJob job, SourceConfig config) {
        long started = System.nanoTime();
        try {
            byte[] content = blobStorage.get(job.container(), job.blobPath());
            RawDocument document = rawDocumentStore.storeRawDocument(
                    content, config, job.ingestionId(), job.metadata());
            queue.markStored(job.ingestionId(), document.getDocumentId());
            metrics.processingCompleted(job.sourceId(), since(started));
            eventPublisher.publishSuccess(config, document.toEventDocument());
        } catch (DuplicateDocumentException e) {
            log.info("Landing blob {}/{} duplicates stored content {}",
                    job.container(), job.blobPath(), e.getContentHash());
            queue.markDuplicate(job.ingestionId());
            metrics.processingCompleted(job.sourceId(), since(started));
        } catch (RuntimeException e) {
            log.error("Failed to store landing blob {}/{}", job.container(), job.blobPath(), e);
            queue.markFailed(job.ingestionId(), e.getMessage());
            metrics.processingFailed(job.sourceId(), e.getClass().getSimpleName(), since(started));
            eventPublisher.publishFailure(config, e.getClass().getSimpleName(), e.getMessage(),
                    job.ingestionId().toString());
        }
    }

    private static Duration since(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
