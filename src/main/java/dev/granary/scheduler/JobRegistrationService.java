package dev.granary.scheduler;

import dev.granary.source.SourceConfig;
import dev.granary.source.SourceConfigService;
import dev.granary.source.SourceConfigsReloadedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps scheduler jobs in line with the configured scheduled-pull sources.
 *
 * <p>{@link #syncAllJobs()} makes one pass over every source: enabled {@code scheduled_pull}
 * sources are (re-)registered, disabled ones are deleted, {@code blob_trigger} sources are skipped.
 * A failure on one source is counted and the pass continues. When pruning is enabled, owned jobs
 * whose source is gone or no longer an enabled pull are deleted afterwards, so repeated passes
 * converge on exactly the enabled pull sources whatever was registered before.
 *
 * <p>A pass runs once the application is ready and after every configuration change.
 */
@Service
public class JobRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(JobRegistrationService.class);

    private final SourceConfigService sourceConfigService;
    private final JobSchedulerClient schedulerClient;
    private final JobSchedulerProperties properties;

    public JobRegistrationService(SourceConfigService sourceConfigService,
                                  JobSchedulerClient schedulerClient,
                                  JobSchedulerProperties properties) {
        this.sourceConfigService = sourceConfigService;
        this.schedulerClient = schedulerClient;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        syncAllJobs();
    }

    @EventListener
    public void onSourceConfigsReloaded(SourceConfigsReloadedEvent event) {
        log.info("Source configurations reloaded ({} sources), re-syncing jobs", event.sourceCount());
        syncAllJobs();
    }

    /**
     * Reconcile scheduler jobs with the current source configurations.
     *
     * @return counters of the pass
     */
    public synchronized JobSyncResult syncAllJobs() {
        int registered = 0;
        int skipped = 0;
        int failed = 0;
        Set<String> wantedJobs = new HashSet<>();

        for (SourceConfig config : sourceConfigService.getAllConfigs()) {
            if (!config.isScheduledPull()) {
                skipped++;
                continue;
            }
            if (!config.isEnabled()) {
                schedulerClient.deleteJob(config.sourceId());
                skipped++;
                continue;
            }
            wantedJobs.add(schedulerClient.jobName(config.sourceId()));
            if (registerJobForSource(config)) {
                registered++;
            } else {
                failed++;
            }
        }

        int removed = properties.pruneOrphans() ? pruneOrphans(wantedJobs) : 0;
        JobSyncResult result = new JobSyncResult(registered, skipped, failed, removed);
        log.info("Job sync complete: registered={}, skipped={}, failed={}, removed={}",
                registered, skipped, failed, removed);
        return result;
    }

    /**
     * Register the job of one source.
     *
     * @return false for non-pull sources, a missing schedule, or a scheduler rejection
     */
    public boolean registerJobForSource(SourceConfig config) {
        if (!config.isScheduledPull()) {
            return false;
        }
        String schedule = config.ingestion().schedule();
        if (schedule == null || schedule.isBlank()) {
            log.warn("Source {} is scheduled_pull without a schedule, not registering", config.sourceId());
            return false;
        }
        return schedulerClient.registerJob(config.sourceId(), schedule);
    }

    public boolean unregisterJobForSource(String sourceId) {
        return schedulerClient.deleteJob(sourceId);
    }

    private int pruneOrphans(Set<String> wantedJobs) {
        List<ScheduledJob> jobs;
        try {
            jobs = schedulerClient.listJobs();
        } catch (JobSchedulerException e) {
            log.warn("Cannot list scheduler jobs, skipping orphan pruning: {}", e.getMessage());
            return 0;
        }
        int removed = 0;
        for (ScheduledJob job : jobs) {
            if (schedulerClient.isOwnedJob(job.name()) && !wantedJobs.contains(job.name())
                    && schedulerClient.deleteJobByName(job.name())) {
                removed++;
            }
        }
        return removed;
    }
}
