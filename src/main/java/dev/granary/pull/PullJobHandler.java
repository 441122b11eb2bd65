package dev.granary.pull;

import dev.granary.events.EventPublisher;
import dev.granary.ingestion.IngestionJob;
import dev.granary.ingestion.IngestionMetrics;
import dev.granary.ingestion.IngestionQueue;
import dev.granary.source.IterationSettings;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import dev.granary.storage.DuplicateDocumentException;
import dev.granary.storage.RawDocument;
import dev.granary.storage.RawDocumentStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs a scheduled pull when the job scheduler fires.
 *
 * <p>A source without iteration is fetched once. An iterating source first resolves its items and
 * fetches once per item, at most {@code iteration.concurrency} at a time. Every payload goes through
 * the {@link RawDocumentStore}, which drops content already stored, and new payloads are admitted
 * to the {@link IngestionQueue} as stored jobs. Failures of single items are counted and announced
 * through the failure event; they never abort the other items.
 *
 * <p>Content that is already stored but never made it into the queue (the admission after the
 * store failed) is admitted on the next run that fetches it again.
 *
 * <p>Only one run per source is active at a time. A trigger arriving while the previous run is
 * still going is reported as not run.
 */
@Service
public class PullJobHandler {

    private static final Logger log = LoggerFactory.getLogger(PullJobHandler.class);

    private final SourceConfigService sourceConfigService;
    private final PullDataFetcher fetcher;
    private final IterationResolver iterationResolver;
    private final RawDocumentStore rawDocumentStore;
    private final IngestionQueue queue;
    private final EventPublisher eventPublisher;
    private final PullRunTracker runTracker;
    private final IngestionMetrics metrics;

    public PullJobHandler(SourceConfigService sourceConfigService,
                          PullDataFetcher fetcher,
                          IterationResolver iterationResolver,
                          RawDocumentStore rawDocumentStore,
                          IngestionQueue queue,
                          EventPublisher eventPublisher,
                          PullRunTracker runTracker,
                          IngestionMetrics metrics) {
        this.sourceConfigService = sourceConfigService;
        this.fetcher = fetcher;
        this.iterationResolver = iterationResolver;
        this.rawDocumentStore = rawDocumentStore;
        this.queue = queue;
        this.eventPublisher = eventPublisher;
        this.runTracker = runTracker;
        this.metrics = metrics;
    }

    /**
     * Execute the pull of one source.
     *
     * @param sourceId source named in the scheduler job
     * @return counters of the run, or a not-run result with the reason
     */
    public PullJobResult handleJobTrigger(String sourceId) {
        Optional<SourceConfig> found = sourceConfigService.getConfig(sourceId);
        if (found.isEmpty()) {
            log.warn("Scheduler triggered unknown source {}", sourceId);
            return PullJobResult.notRun(sourceId, "Source configuration not found");
        }
        SourceConfig config = found.get();
        if (!config.isScheduledPull()) {
            log.warn("Scheduler triggered {} which is not a scheduled_pull source", sourceId);
            return PullJobResult.notRun(sourceId, "Source is not a scheduled_pull source");
        }
        if (!config.isEnabled()) {
            log.info("Scheduler triggered disabled source {}, skipping", sourceId);
            return PullJobResult.notRun(sourceId, "Source is disabled");
        }
        if (!runTracker.tryStart(sourceId)) {
            log.info("Pull of {} still running, skipping trigger", sourceId);
            return PullJobResult.notRun(sourceId, "Previous run still active");
        }

        Optional<PullRun> run;
        try {
            execute(config, UUID.randomUUID().toString());
        } finally {
            run = runTracker.finish(sourceId);
        }
        PullJobResult result = PullJobResult.of(run.orElseThrow(
                () -> new IllegalStateException("Run of " + sourceId + " vanished")));
        log.info("Pull of {} finished: fetched={}, duplicates={}, failed={}",
                sourceId, result.fetched(), result.duplicates(), result.failed());
        return result;
    }

    private void execute(SourceConfig config, String traceId) {
        IterationSettings iteration = config.ingestion().iteration();
        if (iteration == null) {
            fetchAndStore(config, null, Map.of(), traceId);
            return;
        }
        try {
            runIteration(config, iteration, traceId);
        } catch (IterationResolutionException e) {
            log.error("Cannot resolve iteration items for {}", config.sourceId(), e);
            runTracker.recordFailed(config.sourceId());
            metrics.pullFailed(config.sourceId(), e.getClass().getSimpleName());
            eventPublisher.publishFailure(config, e.getClass().getSimpleName(), e.getMessage(), null);
        }
    }

    private void runIteration(SourceConfig config, IterationSettings iteration, String traceId) {
        List<Map<String, Object>> items = iterationResolver.resolveItems(iteration);
        if (items.isEmpty()) {
            log.info("No iteration items for {}, nothing to pull", config.sourceId());
            return;
        }

        int parallelism = Math.min(iteration.concurrency(), items.size());
        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            CompletableFuture<?>[] fetches = items.stream()
                    .map(item -> CompletableFuture.runAsync(() -> fetchAndStore(config, item,
                            IterationResolver.extractLinkage(item, iteration.injectLinkage()), traceId),
                            executor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(fetches).join();
        } finally {
            executor.shutdown();
        }
    }

    private void fetchAndStore(SourceConfig config, @Nullable Map<String, ?> item,
                               Map<String, Object> linkage, String traceId) {
        String sourceId = config.sourceId();
        UUID ingestionId = UUID.randomUUID();
        try {
            byte[] content = fetcher.fetch(config.ingestion().request(), item);
            Optional<RawDocument> admitted = storeAndQueue(content, config, ingestionId, linkage, traceId);
            if (admitted.isPresent()) {
                runTracker.recordFetched(sourceId);
                metrics.pullFetched(sourceId);
                eventPublisher.publishSuccess(config, admitted.get().toEventDocument());
            } else {
                runTracker.recordDuplicate(sourceId);
                metrics.pullDuplicate(sourceId);
            }
        } catch (RuntimeException e) {
            log.error("Pull of {} failed for item {}", sourceId, linkage, e);
            runTracker.recordFailed(sourceId);
            metrics.pullFailed(sourceId, e.getClass().getSimpleName());
            eventPublisher.publishFailure(config, e.getClass().getSimpleName(), e.getMessage(), null);
        }
    }

    /** The admitted document, or empty when the content was already stored and queued. */
    private Optional<RawDocument> storeAndQueue(byte[] content, SourceConfig config, UUID ingestionId,
                                                Map<String, Object> linkage, String traceId) {
        try {
            RawDocument document = rawDocumentStore.storeRawDocument(content, config, ingestionId, linkage);
            queue.queueStoredJob(toJob(document, traceId), document.getDocumentId());
            return Optional.of(document);
        } catch (DuplicateDocumentException e) {
            Optional<RawDocument> unqueued = admitUnqueued(e, traceId);
            if (unqueued.isEmpty()) {
                log.info("Pulled content for {} unchanged ({})", config.sourceId(), e.getContentHash());
            }
            return unqueued;
        }
    }

    /**
     * Admit the already stored document behind a duplicate when no job was ever queued for it.
     * Empty when the duplicate came from a concurrent writer or the content is already queued.
     */
    private Optional<RawDocument> admitUnqueued(DuplicateDocumentException duplicate, String traceId) {
        if (duplicate.getExistingDocumentId() == null) {
            return Optional.empty();
        }
        Optional<RawDocument> existing = rawDocumentStore.findByDocumentId(duplicate.getExistingDocumentId());
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        IngestionJob job = toJob(existing.get(), traceId);
        if (queue.isAdmitted(job.idempotencyKey())) {
            return Optional.empty();
        }
        if (!queue.queueStoredJob(job, existing.get().getDocumentId())) {
            return Optional.empty();
        }
        log.warn("Admitted stored document {} of {} that had no ingestion job",
                existing.get().getDocumentId(), duplicate.getSourceId());
        return existing;
    }

    private static IngestionJob toJob(RawDocument document, String traceId) {
        return IngestionJob.forPull(document.getIngestionId(), document.getSourceId(),
                document.getBlobContainer(), document.getBlobPath(), document.getContentHash(),
                document.getSizeBytes(), document.getMetadata(), traceId);
    }
}
