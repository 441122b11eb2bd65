package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One outbound event: the topic and the document fields copied into its payload.
 *
 * @param topic broker routing key, blank disables the event
 * @param payloadFields field names or dotted paths read from the document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventSettings(@Nullable String topic, List<String> payloadFields) {

  public EventSettings {
    payloadFields = payloadFields == null ? List.of() : List.copyOf(payloadFields);
  }

  public boolean hasTopic() {
    return topic != null && !topic.isBlank();
  }
}
