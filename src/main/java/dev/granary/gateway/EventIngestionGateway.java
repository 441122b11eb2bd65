package dev.granary.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.granary.ingestion.IngestionJob;
import dev.granary.ingestion.IngestionMetrics;
import dev.granary.ingestion.IngestionQueue;
import dev.granary.pull.PullJobHandler;
import dev.granary.pull.PullJobResult;
import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for ingestion triggers: blob-created webhook batches and scheduler callbacks.
 *
 * <p>A webhook batch is a JSON array. If its first event is a subscription validation the code is
 * echoed back and nothing else happens. Otherwise events are handled one after the other: the
 * subject is parsed, the source is looked up by container, and an accepted event becomes an {@link
 * IngestionJob} submitted to the {@link IngestionQueue}. Unmatched containers, disabled sources,
 * redeliveries and malformed events are counted, never fatal. The batch as a whole is always
 * acknowledged so the notification system does not redeliver it because of one event.
 *
 * <p>Events wrapped in a CloudEvents envelope (a {@code data} member but neither {@code subject} nor
 * {@code eventType}) are unwrapped first. An event without {@code eTag} is still accepted under an
 * empty etag, so its redeliveries are dropped but a later etag-less upload to the same path is too.
 *
 * <p>Per-event outcomes also feed the {@link IngestionMetrics} counters.
 */
@Service
public class EventIngestionGateway {

    static final String BLOB_CREATED = "Microsoft.Storage.BlobCreated";
    static final String SUBSCRIPTION_VALIDATION_SUFFIX = "SubscriptionValidationEvent";

    private static final Logger log = LoggerFactory.getLogger(EventIngestionGateway.class);

    private final SourceConfigService sourceConfigService;
    private final IngestionQueue queue;
    private final PullJobHandler pullJobHandler;
    private final ObjectMapper objectMapper;
    private final IngestionMetrics metrics;

    public EventIngestionGateway(SourceConfigService sourceConfigService,
                                 IngestionQueue queue,
                                 PullJobHandler pullJobHandler,
                                 ObjectMapper objectMapper,
                                 IngestionMetrics metrics) {
        this.sourceConfigService = sourceConfigService;
        this.queue = queue;
        this.pullJobHandler = pullJobHandler;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Handle a raw webhook body.
     *
     * @throws MalformedEventBatchException if the body is not a JSON array
     * @throws ServiceNotReadyException     if source configurations are not loaded yet
     */
    public BatchOutcome handleBatch(String body) {
        JsonNode batch;
        try {
            batch = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new MalformedEventBatchException("Event batch is not valid JSON", e);
        }
        if (batch == null || !batch.isArray()) {
            throw new MalformedEventBatchException("Event batch must be a JSON array");
        }
        if (batch.isEmpty()) {
            return BatchOutcome.processed(GatewayBatchResult.empty());
        }

        JsonNode first = batch.get(0);
        if (eventType(first).endsWith(SUBSCRIPTION_VALIDATION_SUFFIX)) {
            String code = first.path("data").path("validationCode").asText("");
            log.info("Answering event subscription validation handshake");
            return BatchOutcome.validation(code);
        }

        requireReady();
        return BatchOutcome.processed(processEvents(batch));
    }

    /**
     * Handle a scheduler callback.
     *
     * @param jobName name of the firing job, used as source id when the payload has none
     * @param data    job payload, {@code source_id} at the top level or under {@code value}/{@code data}
     */
    public PullJobResult handleScheduledTrigger(String jobName, @Nullable JsonNode data) {
        requireReady();
        String sourceId = sourceIdOf(data).orElse(jobName);
        log.info("Scheduler job {} fired for source {}", jobName, sourceId);
        return pullJobHandler.handleJobTrigger(sourceId);
    }

    private GatewayBatchResult processEvents(JsonNode batch) {
        int queued = 0;
        int duplicates = 0;
        int unmatched = 0;
        int disabled = 0;
        int malformed = 0;
        int ignored = 0;

        for (JsonNode raw : batch) {
            JsonNode event = unwrap(raw);
            if (!BLOB_CREATED.equals(eventType(event))) {
                ignored++;
                continue;
            }
            metrics.eventReceived();

            Optional<BlobSubject> subject = BlobSubject.parse(event.path("subject").asText(null));
            if (subject.isEmpty()) {
                log.warn("Skipping malformed blob event {} (subject={})",
                        event.path("id").asText("?"), event.path("subject").asText(""));
                metrics.eventMalformed();
                malformed++;
                continue;
            }
            String etag = event.path("data").path("eTag").asText("").trim();
            if (etag.isEmpty()) {
                log.warn("Blob event {} for {} has no eTag, accepting with an empty etag",
                        event.path("id").asText("?"), subject.get().blobPath());
            }

            Optional<SourceConfig> config = sourceConfigService.getConfigByContainer(subject.get().container());
            if (config.isEmpty()) {
                log.debug("No source listens on container {}", subject.get().container());
                metrics.eventUnmatched(subject.get().container());
                unmatched++;
                continue;
            }
            if (!config.get().isEnabled()) {
                log.debug("Source {} is disabled, dropping event", config.get().sourceId());
                metrics.eventDisabled(config.get().sourceId());
                disabled++;
                continue;
            }

            IngestionJob job = BlobTriggerStrategy.toJob(config.get(), subject.get(), etag,
                    event.path("data").path("contentLength").asLong(0),
                    event.hasNonNull("id") ? event.get("id").asText() : null);
            if (queue.queueJob(job)) {
                metrics.eventQueued(job.sourceId());
                queued++;
            } else {
                metrics.eventDuplicate(job.sourceId());
                duplicates++;
            }
        }

        GatewayBatchResult result = new GatewayBatchResult(batch.size(), queued, duplicates,
                unmatched, disabled, malformed, ignored);
        log.info("Processed event batch: {}", result);
        return result;
    }

    private void requireReady() {
        if (!sourceConfigService.isReady()) {
            throw new ServiceNotReadyException("Source configurations are not loaded yet");
        }
    }

    private static JsonNode unwrap(JsonNode event) {
        if (event.has("data") && !event.has("subject") && !event.has("eventType")) {
            JsonNode data = event.get("data");
            return data.has("payload") ? data.get("payload") : data;
        }
        return event;
    }

    private static String eventType(JsonNode event) {
        String type = event.path("eventType").asText("");
        return type.isEmpty() ? event.path("type").asText("") : type;
    }

    private static Optional<String> sourceIdOf(@Nullable JsonNode data) {
        if (data == null) {
            return Optional.empty();
        }
        for (JsonNode candidate : new JsonNode[] {data, data.path("value"), data.path("data")}) {
            String sourceId = candidate.path("source_id").asText("");
            if (!sourceId.isBlank()) {
                return Optional.of(sourceId);
            }
        }
        return Optional.empty();
    }
}
