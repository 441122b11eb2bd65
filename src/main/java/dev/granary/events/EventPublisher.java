package dev.granary.events;

import dev.granary.source.EventSettings;
import dev.granary.source.SourceConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort publication of document events configured per source.
 *
 * <p>Topic and payload fields come from {@code events.on_success} / {@code events.on_failure} of
 * the source that produced the document. A missing block or topic makes publishing a no-op that
 * returns {@code false}. Broker failures are logged and reported as {@code false}; they never
 * propagate to the operation that triggered the event. There is no retry or outbox.
 */
@Service
public class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final RabbitTemplate rabbitTemplate;
    private final EventProperties properties;
    private final Clock clock;

    public EventPublisher(RabbitTemplate rabbitTemplate, EventProperties properties, Clock clock) {
        this.rabbitTemplate = rabbitTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Publish the source's success event for a stored document.
     *
     * @param config   configuration of the source owning the document
     * @param document document fields, see {@link EventPayloadExtractor}
     * @return true if the event was handed to the broker
     */
    public boolean publishSuccess(SourceConfig config, Map<String, ?> document) {
        EventSettings settings = config.onSuccess();
        if (settings == null || !settings.hasTopic()) {
            log.debug("No success event configured for source {}", config.sourceId());
            return false;
        }
        Map<String, Object> payload = EventPayloadExtractor.extract(document, settings.payloadFields());
        return publish(settings.topic(), event(DocumentEvent.DOCUMENT_PROCESSED, config, payload));
    }

    /**
     * Publish the source's failure event.
     *
     * @param config       configuration of the source whose ingestion failed
     * @param errorType    short error classifier, usually the exception class name
     * @param errorMessage human readable cause
     * @param documentId   affected document or ingestion, if known
     * @return true if the event was handed to the broker
     */
    public boolean publishFailure(SourceConfig config, String errorType, String errorMessage,
                                  @Nullable String documentId) {
        EventSettings settings = config.onFailure();
        if (settings == null || !settings.hasTopic()) {
            log.debug("No failure event configured for source {}", config.sourceId());
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_type", errorType);
        payload.put("error_message", errorMessage);
        payload.put("source_id", config.sourceId());
        if (documentId != null) {
            payload.put("document_id", documentId);
        }
        return publish(settings.topic(), event(DocumentEvent.DOCUMENT_FAILED, config, payload));
    }

    private DocumentEvent event(String type, SourceConfig config, Map<String, Object> payload) {
        return new DocumentEvent(UUID.randomUUID().toString(), type, config.sourceId(),
                clock.instant().toString(), payload);
    }

    private boolean publish(String topic, DocumentEvent event) {
        try {
            rabbitTemplate.convertAndSend(properties.exchange(), topic, event);
            log.info("Published {} event {} for source {} to {}",
                    event.eventType(), event.eventId(), event.sourceId(), topic);
            return true;
        } catch (Exception e) {
            log.error("Failed to publish {} event for source {} to {}",
                    event.eventType(), event.sourceId(), topic, e);
            return false;
        }
    }
}
