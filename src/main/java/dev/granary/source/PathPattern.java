package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Blob path template such as {@code {farmer_id}/{event_id}.json}.
 *
 * @param pattern the template, one {@code {name}} per path segment part
 * @param extractFields the placeholder names to keep in the extracted metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PathPattern(String pattern, List<String> extractFields) {

  public PathPattern {
    extractFields = extractFields == null ? List.of() : List.copyOf(extractFields);
  }
}
