package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Where the credential for a pull lives and how it is sent.
 *
 * @param secretStore name of the secret store
 * @param secretName key of the secret inside the store
 * @param headerName header carrying an API key, defaults to {@code X-API-Key}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthConfig(
    @Nullable String secretStore, @Nullable String secretName, String headerName) {

  public static final String DEFAULT_HEADER_NAME = "X-API-Key";

  public AuthConfig {
    if (headerName == null || headerName.isBlank()) {
      headerName = DEFAULT_HEADER_NAME;
    }
  }

  /** Whether both the store and the secret name are present. */
  public boolean isComplete() {
    return secretStore != null
        && !secretStore.isBlank()
        && secretName != null
        && !secretName.isBlank();
  }
}
