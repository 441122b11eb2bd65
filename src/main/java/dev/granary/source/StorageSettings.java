package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Storage targets of a source.
 *
 * @param rawContainer blob container receiving raw payloads, defaults to {@code raw-documents}
 * @param indexCollection name of the downstream document collection
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StorageSettings(String rawContainer, @Nullable String indexCollection) {

  public static final String DEFAULT_RAW_CONTAINER = "raw-documents";

  public StorageSettings {
    if (rawContainer == null || rawContainer.isBlank()) {
      rawContainer = DEFAULT_RAW_CONTAINER;
    }
  }

  public static StorageSettings defaults() {
    return new StorageSettings(null, null);
  }
}
