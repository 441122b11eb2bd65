package dev.granary.fixture;

import dev.granary.source.AuthConfig;
import dev.granary.source.AuthType;
import dev.granary.source.EventSettings;
import dev.granary.source.EventsSettings;
import dev.granary.source.IngestionSettings;
import dev.granary.source.IterationSettings;
import dev.granary.source.PathPattern;
import dev.granary.source.RequestSettings;
import dev.granary.source.SourceConfig;
import dev.granary.source.StorageSettings;
import dev.granary.source.TriggerMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link SourceConfig}. Defaults to an enabled blob-trigger source; {@link
 * #scheduledPull()} switches to an enabled pull source with a schedule and an unauthenticated
 * request.
 *
 * <pre>{@code
 * SourceConfig config = SourceConfigBuilder.blobTrigger().landingContainer("quality-events").build();
 * }</pre>
 */
public final class SourceConfigBuilder {

  private String sourceId = "test-source";
  private boolean enabled = true;
  private TriggerMode mode = TriggerMode.BLOB_TRIGGER;
  private @Nullable String landingContainer = "landing";
  private @Nullable PathPattern pathPattern;
  private @Nullable String fileFormat = "json";
  private @Nullable String schedule;
  private String baseUrl = "https://api.example.com/data";
  private AuthType authType = AuthType.NONE;
  private @Nullable AuthConfig authConfig;
  private Map<String, String> parameters = new LinkedHashMap<>();
  private int timeoutSeconds = 30;
  private @Nullable IterationSettings iteration;
  private @Nullable String rawContainer;
  private @Nullable EventSettings onSuccess;
  private @Nullable EventSettings onFailure;

  private SourceConfigBuilder() {}

  public static SourceConfigBuilder blobTrigger() {
    return new SourceConfigBuilder();
  }

  public static SourceConfigBuilder scheduledPull() {
    SourceConfigBuilder builder = new SourceConfigBuilder();
    builder.mode = TriggerMode.SCHEDULED_PULL;
    builder.landingContainer = null;
    builder.schedule = "@every 30m";
    return builder;
  }

  public SourceConfigBuilder sourceId(String sourceId) {
    this.sourceId = sourceId;
    return this;
  }

  public SourceConfigBuilder enabled(boolean enabled) {
    this.enabled = enabled;
    return this;
  }

  public SourceConfigBuilder landingContainer(String landingContainer) {
    this.landingContainer = landingContainer;
    return this;
  }

  public SourceConfigBuilder pathPattern(String pattern, String... extractFields) {
    this.pathPattern = new PathPattern(pattern, List.of(extractFields));
    return this;
  }

  public SourceConfigBuilder fileFormat(@Nullable String fileFormat) {
    this.fileFormat = fileFormat;
    return this;
  }

  public SourceConfigBuilder schedule(@Nullable String schedule) {
    this.schedule = schedule;
    return this;
  }

  public SourceConfigBuilder baseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
    return this;
  }

  public SourceConfigBuilder auth(AuthType authType, @Nullable AuthConfig authConfig) {
    this.authType = authType;
    this.authConfig = authConfig;
    return this;
  }

  public SourceConfigBuilder parameter(String name, String value) {
    this.parameters.put(name, value);
    return this;
  }

  public SourceConfigBuilder timeoutSeconds(int timeoutSeconds) {
    this.timeoutSeconds = timeoutSeconds;
    return this;
  }

  public SourceConfigBuilder iteration(IterationSettings iteration) {
    this.iteration = iteration;
    return this;
  }

  public SourceConfigBuilder rawContainer(String rawContainer) {
    this.rawContainer = rawContainer;
    return this;
  }

  public SourceConfigBuilder onSuccess(String topic, String... payloadFields) {
    this.onSuccess = new EventSettings(topic, List.of(payloadFields));
    return this;
  }

  public SourceConfigBuilder onFailure(String topic, String... payloadFields) {
    this.onFailure = new EventSettings(topic, List.of(payloadFields));
    return this;
  }

  public SourceConfig build() {
    boolean pull = mode == TriggerMode.SCHEDULED_PULL;
    RequestSettings request =
        pull ? new RequestSettings(baseUrl, authType, authConfig, parameters, timeoutSeconds) : null;
    IngestionSettings ingestion =
        new IngestionSettings(
            mode,
            pull ? null : landingContainer,
            pull ? null : pathPattern,
            fileFormat,
            pull ? schedule : null,
            request,
            pull ? iteration : null);
    EventsSettings events =
        onSuccess == null && onFailure == null ? null : new EventsSettings(onSuccess, onFailure);
    return new SourceConfig(
        sourceId,
        sourceId,
        enabled,
        ingestion,
        new StorageSettings(rawContainer, null),
        events);
  }
}
