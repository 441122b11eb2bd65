package dev.granary.ingestion;

import dev.granary.source.TriggerMode;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Ingestion counters, accumulated across batches and pull runs.
 *
 * <p>Gateway outcomes are tagged with the source, or with the container when no source matched.
 * Queue admissions carry the trigger mode as well.
 */
@Component
public class IngestionMetrics {

  static final String EVENTS_RECEIVED = "granary.events.received";
  static final String EVENTS_QUEUED = "granary.events.queued";
  static final String EVENTS_DUPLICATE = "granary.events.duplicate";
  static final String EVENTS_UNMATCHED = "granary.events.unmatched";
  static final String EVENTS_DISABLED = "granary.events.disabled";
  static final String EVENTS_MALFORMED = "granary.events.malformed";
  static final String QUEUE_ADMITTED = "granary.queue.admitted";
  static final String QUEUE_DUPLICATE = "granary.queue.duplicate";
  static final String QUEUE_REQUEUED = "granary.queue.requeued";
  static final String PROCESSING_COMPLETED = "granary.processing.completed";
  static final String PROCESSING_ERRORS = "granary.processing.errors";
  static final String PROCESSING_DURATION = "granary.processing.duration";
  static final String PULL_FETCHED = "granary.pull.fetched";
  static final String PULL_DUPLICATE = "granary.pull.duplicate";
  static final String PULL_FAILED = "granary.pull.failed";

  private final MeterRegistry meterRegistry;

  public IngestionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void eventReceived() {
    meterRegistry.counter(EVENTS_RECEIVED).increment();
  }

  public void eventQueued(String sourceId) {
    meterRegistry.counter(EVENTS_QUEUED, "source_id", sourceId).increment();
  }

  public void eventDuplicate(String sourceId) {
    meterRegistry.counter(EVENTS_DUPLICATE, "source_id", sourceId).increment();
  }

  public void eventUnmatched(String container) {
    meterRegistry.counter(EVENTS_UNMATCHED, "container", container).increment();
  }

  public void eventDisabled(String sourceId) {
    meterRegistry.counter(EVENTS_DISABLED, "source_id", sourceId).increment();
  }

  public void eventMalformed() {
    meterRegistry.counter(EVENTS_MALFORMED).increment();
  }

  void jobAdmitted(String sourceId, TriggerMode triggerMode) {
    meterRegistry
        .counter(QUEUE_ADMITTED, "source_id", sourceId, "trigger_mode", tag(triggerMode))
        .increment();
  }

  void jobDuplicate(String sourceId, TriggerMode triggerMode) {
    meterRegistry
        .counter(QUEUE_DUPLICATE, "source_id", sourceId, "trigger_mode", tag(triggerMode))
        .increment();
  }

  void jobsRequeued(int count) {
    meterRegistry.counter(QUEUE_REQUEUED).increment(count);
  }

  void processingCompleted(String sourceId, Duration duration) {
    meterRegistry.counter(PROCESSING_COMPLETED, "source_id", sourceId).increment();
    meterRegistry.timer(PROCESSING_DURATION, "source_id", sourceId).record(duration);
  }

  void processingFailed(String sourceId, String errorType, Duration duration) {
    meterRegistry
        .counter(PROCESSING_ERRORS, "source_id", sourceId, "error_type", errorType)
        .increment();
    meterRegistry.timer(PROCESSING_DURATION, "source_id", sourceId).record(duration);
  }

  public void pullFetched(String sourceId) {
    meterRegistry.counter(PULL_FETCHED, "source_id", sourceId).increment();
  }

  public void pullDuplicate(String sourceId) {
    meterRegistry.counter(PULL_DUPLICATE, "source_id", sourceId).increment();
  }

  public void pullFailed(String sourceId, String errorType) {
    meterRegistry.counter(PULL_FAILED, "source_id", sourceId, "error_type", errorType).increment();
  }

  private static String tag(TriggerMode triggerMode) {
    return triggerMode.name().toLowerCase(Locale.ROOT);
  }
}
