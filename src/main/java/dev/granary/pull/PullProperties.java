package dev.granary.pull;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code granary.pull.*}.
 *
 * @param connectTimeoutMs TCP connect timeout of pull requests
 * @param maxTimeoutSeconds ceiling applied to each source's {@code timeout_seconds}
 * @param retry retry policy for connection and timeout failures
 */
@ConfigurationProperties(prefix = "granary.pull")
public record PullProperties(int connectTimeoutMs, int maxTimeoutSeconds, Retry retry) {

    public PullProperties {
        if (connectTimeoutMs <= 0) {
            connectTimeoutMs = 5_000;
        }
        if (maxTimeoutSeconds <= 0) {
            maxTimeoutSeconds = 30;
        }
        if (retry == null) {
            retry = new Retry(3, 1_000, 2.0, 30_000);
        }
    }

    /**
     * @param maxRetries retries after the first attempt
     * @param initialDelayMs delay before the first retry
     * @param multiplier growth factor of the delay
     * @param maxDelayMs delay ceiling
     */
    public record Retry(int maxRetries, long initialDelayMs, double multiplier, long maxDelayMs) {}
}
