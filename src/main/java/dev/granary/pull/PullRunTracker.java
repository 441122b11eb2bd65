package dev.granary.pull;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory registry of running pulls, keyed by source id.
 *
 * <p>A run is registered by {@link #tryStart(String)} and removed by {@link #finish(String)};
 * nothing else adds or removes entries. Counters are updated with {@code computeIfPresent}, so
 * concurrent item fetches of one run never lose an increment.
 *
 * <p>State is transient and lost on restart.
 */
@Component
public class PullRunTracker {

    private final ConcurrentHashMap<String, PullRun> activeRuns = new ConcurrentHashMap<>();
    private final Clock clock;

    public PullRunTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Register a run for {@code sourceId}.
     *
     * @return false if a run for this source is already active
     */
    public boolean tryStart(String sourceId) {
        return activeRuns.putIfAbsent(sourceId, new PullRun(sourceId, 0, 0, 0, clock.instant())) == null;
    }

    public void recordFetched(String sourceId) {
        activeRuns.computeIfPresent(sourceId, (id, run) -> run.withFetched());
    }

    public void recordFailed(String sourceId) {
        activeRuns.computeIfPresent(sourceId, (id, run) -> run.withFailed());
    }

    public void recordDuplicate(String sourceId) {
        activeRuns.computeIfPresent(sourceId, (id, run) -> run.withDuplicate());
    }

    public Optional<PullRun> getRun(String sourceId) {
        return Optional.ofNullable(activeRuns.get(sourceId));
    }

    public List<PullRun> activeRuns() {
        return List.copyOf(activeRuns.values());
    }

    /**
     * Stop tracking a run.
     *
     * @return the final snapshot, or empty if the source was not running
     */
    public Optional<PullRun> finish(String sourceId) {
        return Optional.ofNullable(activeRuns.remove(sourceId));
    }
}
