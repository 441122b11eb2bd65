package dev.granary.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * Trigger mode plus the fields that belong to it.
 *
 * <p>Blob-trigger sources carry {@code landingContainer}, {@code pathPattern} and {@code
 * fileFormat}. Scheduled-pull sources carry {@code schedule}, {@code request} and optionally {@code
 * iteration}. {@code fileFormat} is shared since it also decides the stored content type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestionSettings(
    TriggerMode mode,
    @Nullable String landingContainer,
    @Nullable PathPattern pathPattern,
    @Nullable String fileFormat,
    @Nullable String schedule,
    @Nullable RequestSettings request,
    @Nullable IterationSettings iteration) {}
