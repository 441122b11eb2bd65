package dev.granary.events;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

/**
 * Envelope of every event published to the broker.
 *
 * @param eventId random id, lets consumers drop redeliveries
 * @param eventType {@code document.processed} or {@code document.failed}
 * @param sourceId source the document belongs to
 * @param timestamp ISO-8601 publication time
 * @param payload fields selected by the source's {@code payload_fields}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentEvent(
    String eventId, String eventType, String sourceId, String timestamp, Map<String, Object> payload) {

  public static final String DOCUMENT_PROCESSED = "document.processed";
  public static final String DOCUMENT_FAILED = "document.failed";
}
