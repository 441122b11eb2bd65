package dev.granary.events;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code granary.events.*}.
 *
 * @param exchange topic exchange receiving all document events; the configured topic is the
 *     routing key
 */
@ConfigurationProperties(prefix = "granary.events")
public record EventProperties(String exchange) {

    public EventProperties {
        if (exchange == null || exchange.isBlank()) {
            exchange = "granary.events";
        }
    }
}
