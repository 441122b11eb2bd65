package dev.granary.api;

import dev.granary.gateway.BatchOutcome;
import dev.granary.gateway.EventIngestionGateway;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook receiving blob-created notification batches.
 *
 * <p>Responds 200 with {@code {"validationResponse": code}} to a subscription handshake and 202
 * with the batch counters otherwise. Malformed bodies and a not-ready service are mapped by {@link
 * dev.granary.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/events")
public class EventGatewayController {

  private final EventIngestionGateway gateway;

  public EventGatewayController(EventIngestionGateway gateway) {
    this.gateway = gateway;
  }

  @PostMapping(value = "/blob-created", consumes = MediaType.ALL_VALUE)
  public ResponseEntity<Object> blobCreated(@RequestBody(required = false) String body) {
    BatchOutcome outcome = gateway.handleBatch(body);
    if (outcome.isValidation()) {
      return ResponseEntity.ok(Map.of("validationResponse", outcome.validationCode()));
    }
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(outcome.result());
  }
}
