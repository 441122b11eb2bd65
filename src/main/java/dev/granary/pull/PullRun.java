package dev.granary.pull;

import java.time.Instant;

/**
 * Immutable snapshot of an active pull run. Each update in {@link PullRunTracker} produces a new
 * record.
 *
 * @param sourceId source being pulled
 * @param fetched payloads fetched and stored
 * @param failed items whose fetch or store failed
 * @param duplicates payloads already stored
 * @param startedAt when the run started
 */
public record PullRun(String sourceId, int fetched, int failed, int duplicates, Instant startedAt) {

    PullRun withFetched() {
        return new PullRun(sourceId, fetched + 1, failed, duplicates, startedAt);
    }

    PullRun withFailed() {
        return new PullRun(sourceId, fetched, failed + 1, duplicates, startedAt);
    }

    PullRun withDuplicate() {
        return new PullRun(sourceId, fetched, failed, duplicates + 1, startedAt);
    }
}
