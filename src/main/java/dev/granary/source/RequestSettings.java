package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * HTTP request template for a scheduled pull.
 *
 * <p>Parameter values may contain {@code {item.<dotted.path>}} placeholders resolved against the
 * current iteration item. Parameter order is preserved in the query string.
 *
 * @param baseUrl URL without query string
 * @param authType authentication scheme, {@link AuthType#NONE} when absent
 * @param authConfig secret location, required for any other scheme
 * @param parameters query parameters, insertion ordered
 * @param timeoutSeconds per-attempt timeout, defaults to 30
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RequestSettings(
    String baseUrl,
    AuthType authType,
    @Nullable AuthConfig authConfig,
    Map<String, String> parameters,
    int timeoutSeconds) {

  public static final int DEFAULT_TIMEOUT_SECONDS = 30;

  public RequestSettings {
    if (authType == null) {
      authType = AuthType.NONE;
    }
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    if (timeoutSeconds <= 0) {
      timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    }
  }
}
