package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Declarative description of one data source.
 *
 * <p>Everything the ingestion core does for a source is driven by this value: which trigger
 * starts it, where the payload comes from, where raw bytes are stored and which events are
 * emitted. There is no source-specific code.
 *
 * <p>The compact constructor enforces that exactly one trigger mode is configured and that the
 * fields of the other mode are absent.
 *
 * @param sourceId stable identifier, also used to derive the scheduler job name
 * @param displayName human readable name
 * @param enabled disabled sources are ignored by the gateway and unscheduled; defaults to true
 * @param ingestion trigger mode and its settings
 * @param storage storage targets, defaulted when absent
 * @param events optional success and failure events
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SourceConfig(
        String sourceId,
        @Nullable String displayName,
        Boolean enabled,
        IngestionSettings ingestion,
        StorageSettings storage,
        @Nullable EventsSettings events) {

    public SourceConfig {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("source_id must not be blank");
        }
        if (ingestion == null || ingestion.mode() == null) {
            throw new IllegalArgumentException("ingestion.mode is required for source " + sourceId);
        }
        enabled = enabled == null || enabled;
        storage = storage == null ? StorageSettings.defaults() : storage;
        validateMode(sourceId, ingestion);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public TriggerMode mode() {
        return ingestion.mode();
    }

    @JsonIgnore
    public boolean isScheduledPull() {
        return ingestion.mode() == TriggerMode.SCHEDULED_PULL;
    }

    @JsonIgnore
    public boolean isBlobTrigger() {
        return ingestion.mode() == TriggerMode.BLOB_TRIGGER;
    }

    /** The configured success event, or null when none is configured. */
    public @Nullable EventSettings onSuccess() {
        return events == null ? null : events.onSuccess();
    }

    /** The configured failure event, or null when none is configured. */
    public @Nullable EventSettings onFailure() {
        return events == null ? null : events.onFailure();
    }

    private static void validateMode(String sourceId, IngestionSettings ingestion) {
        switch (ingestion.mode()) {
            case BLOB_TRIGGER -> {
                if (ingestion.landingContainer() == null || ingestion.landingContainer().isBlank()) {
                    throw new IllegalArgumentException(
                            "blob_trigger source " + sourceId + " requires landing_container");
                }
                if (ingestion.request() != null || ingestion.schedule() != null
                        || ingestion.iteration() != null) {
                    throw new IllegalArgumentException(
                            "blob_trigger source " + sourceId + " must not declare pull settings");
                }
            }
            case SCHEDULED_PULL -> {
                if (ingestion.request() == null || ingestion.request().baseUrl() == null
                        || ingestion.request().baseUrl().isBlank()) {
                    throw new IllegalArgumentException(
                            "scheduled_pull source " + sourceId + " requires request.base_url");
                }
                if (ingestion.landingContainer() != null || ingestion.pathPattern() != null) {
                    throw new IllegalArgumentException(
                            "scheduled_pull source " + sourceId + " must not declare blob trigger settings");
                }
            }
        }
    }
}
