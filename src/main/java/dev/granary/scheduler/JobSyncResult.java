package dev.granary.scheduler;

/**
 * Counters of one reconciliation pass.
 *
 * @param registered enabled scheduled-pull sources registered
 * @param skipped blob-trigger and disabled sources
 * @param failed registrations the scheduler rejected, or sources without a schedule
 * @param removed orphan jobs deleted
 */
public record JobSyncResult(int registered, int skipped, int failed, int removed) {}
