package dev.granary.source;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the source configuration set.
 *
 * <p>Implementations cache the configurations in memory; lookups never hit the backing store.
 */
public interface SourceConfigService {

    Optional<SourceConfig> getConfig(String sourceId);

    /**
     * Find the blob-trigger source whose landing container is {@code container}, enabled or not.
     */
    Optional<SourceConfig> getConfigByContainer(String container);

    List<SourceConfig> getAllConfigs();

    /** False until the first load completed. */
    boolean isReady();

    /**
     * Re-read the backing store.
     *
     * @return true if the configuration set changed
     */
    boolean reload();
}
