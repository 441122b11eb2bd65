package dev.granary.gateway;

/**
 * Per-batch counters returned with the acknowledgement.
 *
 * @param received events in the batch
 * @param queued new ingestion jobs
 * @param duplicates triggers the queue had already admitted
 * @param unmatched blob events for a container no source listens on
 * @param disabled blob events for a disabled source
 * @param malformed events whose subject or data could not be read
 * @param ignored events of another type than blob-created
 */
public record GatewayBatchResult(
    int received, int queued, int duplicates, int unmatched, int disabled, int malformed, int ignored) {

  static GatewayBatchResult empty() {
    return new GatewayBatchResult(0, 0, 0, 0, 0, 0, 0);
  }
}
