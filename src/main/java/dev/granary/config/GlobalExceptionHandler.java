package dev.granary.config;

import dev.granary.gateway.MalformedEventBatchException;
import dev.granary.gateway.ServiceNotReadyException;
import dev.granary.scheduler.JobSchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Malformed event batches become 400. A gateway that is not ready yet answers 503 with {@code Retry-After}
 * so the notification system redelivers. Scheduler outages surface as 502.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String RETRY_AFTER_SECONDS = "30";

  @ExceptionHandler(MalformedEventBatchException.class)
  ProblemDetail handleMalformedBatch(MalformedEventBatchException ex) {
    log.warn("Rejected event batch: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(ServiceNotReadyException.class)
  ResponseEntity<ProblemDetail> handleNotReady(ServiceNotReadyException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
        .body(ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage()));
  }

  @ExceptionHandler(JobSchedulerException.class)
  ProblemDetail handleSchedulerUnavailable(JobSchedulerException ex) {
    log.error("Job scheduler call failed", ex);
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
  }
}
