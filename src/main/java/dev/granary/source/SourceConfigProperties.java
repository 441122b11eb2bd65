package dev.granary.source;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code granary.sources.*}.
 *
 * @param location resource pattern of the YAML files, one source per file
 * @param refreshIntervalMs delay between change checks
 */
@ConfigurationProperties(prefix = "granary.sources")
public record SourceConfigProperties(String location, long refreshIntervalMs) {

    public SourceConfigProperties {
        if (location == null || location.isBlank()) {
            location = "classpath:source-configs/*.yaml";
        }
        if (refreshIntervalMs <= 0) {
            refreshIntervalMs = 60_000;
        }
    }
}
