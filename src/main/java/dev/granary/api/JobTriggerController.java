package dev.granary.api;

import com.fasterxml.jackson.databind.JsonNode;
import dev.granary.gateway.EventIngestionGateway;
import dev.granary.pull.PullJobResult;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Callback invoked by the job scheduler each time a registered job fires. */
@RestController
public class JobTriggerController {

  private final EventIngestionGateway gateway;

  public JobTriggerController(EventIngestionGateway gateway) {
    this.gateway = gateway;
  }

  @PostMapping("/job/{jobName}")
  public PullJobResult trigger(
      @PathVariable String jobName, @RequestBody(required = false) JsonNode data) {
    return gateway.handleScheduledTrigger(jobName, data);
  }
}
