package dev.granary.scheduler;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client of the job scheduler HTTP API. One job per scheduled-pull source.
 *
 * <p>Register and delete report failures as {@code false} so a reconciliation pass can carry on
 * with the next source. Deleting a job that does not exist counts as success.
 */
@Service
public class JobSchedulerClient {

    private static final Logger log = LoggerFactory.getLogger(JobSchedulerClient.class);

    private final RestClient restClient;
    private final JobSchedulerProperties properties;

    public JobSchedulerClient(@Qualifier("schedulerRestClient") RestClient restClient,
                              JobSchedulerProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /**
     * Create or replace the job of a source.
     *
     * @param sourceId source to trigger
     * @param schedule cron expression or {@code @every <duration>}
     * @return true if the scheduler accepted the job
     */
    public boolean registerJob(String sourceId, String schedule) {
        String name = jobName(sourceId);
        try {
            restClient.post()
                    .uri("/jobs/{name}", name)
                    .body(Map.of("schedule", schedule, "data", Map.of("source_id", sourceId)))
                    .retrieve()
                    .toBodilessEntity();
            log.info("Registered job {} for source {} with schedule {}", name, sourceId, schedule);
            return true;
        } catch (RestClientException e) {
            log.error("Failed to register job {} for source {}: {}", name, sourceId, e.getMessage());
            return false;
        }
    }

    /**
     * Delete the job of a source.
     *
     * @return true if the job was deleted or did not exist
     */
    public boolean deleteJob(String sourceId) {
        return deleteJobByName(jobName(sourceId));
    }

    boolean deleteJobByName(String name) {
        try {
            restClient.delete()
                    .uri("/jobs/{name}", name)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Deleted job {}", name);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Job {} not found, nothing to delete", name);
            return true;
        } catch (RestClientException e) {
            log.error("Failed to delete job {}: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * All jobs known to the scheduler.
     *
     * @throws JobSchedulerException if the scheduler cannot be queried
     */
    public List<ScheduledJob> listJobs() {
        try {
            JobList response = restClient.get()
                    .uri("/jobs")
                    .retrieve()
                    .body(JobList.class);
            return response == null || response.jobs() == null ? List.of() : response.jobs();
        } catch (RestClientException e) {
            throw new JobSchedulerException("Failed to list scheduler jobs", e);
        }
    }

    /**
     * Job name of a source: the configured prefix followed by the source id lower-cased, with every
     * character outside {@code [a-z0-9-]} replaced by {@code -}.
     */
    public String jobName(String sourceId) {
        return properties.jobNamePrefix()
                + sourceId.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    }

    /** Whether {@code name} belongs to a job this service registers. */
    public boolean isOwnedJob(String name) {
        return name != null && name.startsWith(properties.jobNamePrefix());
    }

    record JobList(List<ScheduledJob> jobs) {}
}
