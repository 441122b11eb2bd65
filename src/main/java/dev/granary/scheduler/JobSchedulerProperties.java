package dev.granary.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code granary.scheduler.*}.
 *
 * @param baseUrl base URL of the job scheduler HTTP API
 * @param jobNamePrefix prefix of job names owned by this service
 * @param pruneOrphans whether a sync deletes owned jobs without a matching enabled source
 */
@ConfigurationProperties(prefix = "granary.scheduler")
public record JobSchedulerProperties(String baseUrl, String jobNamePrefix, boolean pruneOrphans) {

    public JobSchedulerProperties {
        if (jobNamePrefix == null) {
            jobNamePrefix = "ingest-";
        }
    }
}
