package dev.granary.ingestion;

/**
 * Processing status of a queued ingestion job.
 *
 * <p>Blob-trigger jobs go QUEUED, PROCESSING, then STORED, DUPLICATE or FAILED. Pulled payloads are
 * stored before they are admitted and enter the queue as STORED. A PROCESSING job whose claim
 * expired goes back to QUEUED. Terminal statuses are never overwritten.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    STORED,
    DUPLICATE,
    FAILED;

    public boolean isTerminal() {
        return this == STORED || this == DUPLICATE || this == FAILED;
    }
}
