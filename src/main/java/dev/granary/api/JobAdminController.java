package dev.granary.api;

import dev.granary.scheduler.JobRegistrationService;
import dev.granary.scheduler.JobSchedulerClient;
import dev.granary.scheduler.JobSyncResult;
import dev.granary.scheduler.ScheduledJob;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Operator view of the scheduler jobs this service owns. */
@RestController
@RequestMapping("/api/jobs")
public class JobAdminController {

  private final JobSchedulerClient schedulerClient;
  private final JobRegistrationService registrationService;

  public JobAdminController(
      JobSchedulerClient schedulerClient, JobRegistrationService registrationService) {
    this.schedulerClient = schedulerClient;
    this.registrationService = registrationService;
  }

  @GetMapping
  public List<ScheduledJob> listJobs() {
    return schedulerClient.listJobs().stream()
        .filter(job -> schedulerClient.isOwnedJob(job.name()))
        .toList();
  }

  @PostMapping("/sync")
  public JobSyncResult sync() {
    return registrationService.syncAllJobs();
  }
}
