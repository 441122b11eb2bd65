package dev.granary.ingestion;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code granary.landing.*}.
 *
 * @param enabled whether the poller runs
 * @param batchSize jobs claimed per poll
 * @param pollIntervalMs delay between polls
 * @param claimTimeoutMs age after which a claimed job that was never finished is re-queued
 */
@ConfigurationProperties(prefix = "granary.landing")
public record LandingProcessorProperties(
        boolean enabled, int batchSize, long pollIntervalMs, long claimTimeoutMs) {

    public LandingProcessorProperties {
        if (batchSize <= 0) {
            batchSize = 20;
        }
        if (pollIntervalMs <= 0) {
            pollIntervalMs = 5_000;
        }
        if (claimTimeoutMs <= 0) {
            claimTimeoutMs = 900_000;
        }
    }

    public Duration claimTimeout() {
        return Duration.ofMillis(claimTimeoutMs);
    }
}
