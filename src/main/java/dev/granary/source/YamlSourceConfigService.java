package dev.granary.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * {@link SourceConfigService} backed by YAML files, one source per file.
 *
 * <p>Files are read from {@code granary.sources.location} at startup and re-read every {@code
 * granary.sources.refresh-interval-ms}. A file that fails to parse or validate is logged and
 * skipped; it never prevents the other sources from loading. When the loaded set differs from the
 * previous one a {@link SourceConfigsReloadedEvent} is published.
 *
 * <p>The snapshot is an immutable map swapped atomically, so readers never see a partial reload.
 */
@Service
public class YamlSourceConfigService implements SourceConfigService {

    private static final Logger log = LoggerFactory.getLogger(YamlSourceConfigService.class);

    private final SourceConfigProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final ResourcePatternResolver resourceResolver = new PathMatchingResourcePatternResolver();
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private volatile Map<String, SourceConfig> configs = Map.of();
    private volatile boolean ready;

    public YamlSourceConfigService(SourceConfigProperties properties,
                                   ApplicationEventPublisher eventPublisher) {
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    void loadOnStartup() {
        configs = loadAll();
        ready = true;
        log.info("Loaded {} source configurations from {}", configs.size(), properties.location());
    }

    /** Re-reads all files and publishes a {@link SourceConfigsReloadedEvent} if the set differs. */
    @Override
    @Scheduled(fixedDelayString = "${granary.sources.refresh-interval-ms:60000}",
            initialDelayString = "${granary.sources.refresh-interval-ms:60000}")
    public boolean reload() {
        Map<String, SourceConfig> reloaded = loadAll();
        if (reloaded.equals(configs)) {
            log.debug("Source configurations unchanged ({} sources)", reloaded.size());
            return false;
        }
        configs = reloaded;
        ready = true;
        log.info("Source configurations changed, {} sources now loaded", reloaded.size());
        eventPublisher.publishEvent(new SourceConfigsReloadedEvent(reloaded.size()));
        return true;
    }

    @Override
    public Optional<SourceConfig> getConfig(String sourceId) {
        return Optional.ofNullable(configs.get(sourceId));
    }

    @Override
    public Optional<SourceConfig> getConfigByContainer(String container) {
        return configs.values().stream()
                .filter(SourceConfig::isBlobTrigger)
                .filter(config -> container.equals(config.ingestion().landingContainer()))
                .findFirst();
    }

    @Override
    public List<SourceConfig> getAllConfigs() {
        return List.copyOf(configs.values());
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    private Map<String, SourceConfig> loadAll() {
        Resource[] resources;
        try {
            resources = resourceResolver.getResources(properties.location());
        } catch (IOException e) {
            log.error("Cannot list source configurations at {}, keeping previous set",
                    properties.location(), e);
            return configs;
        }

        Map<String, SourceConfig> loaded = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                SourceConfig config = yamlMapper.readValue(in, SourceConfig.class);
                SourceConfig previous = loaded.putIfAbsent(config.sourceId(), config);
                if (previous != null) {
                    log.warn("Duplicate source_id {} in {}, keeping the first definition",
                            config.sourceId(), resource.getDescription());
                }
            } catch (IOException | IllegalArgumentException e) {
                rejected.add(resource.getFilename());
                log.warn("Skipping invalid source configuration {}: {}",
                        resource.getDescription(), e.getMessage());
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("{} source configuration files rejected: {}", rejected.size(), rejected);
        }
        return Map.copyOf(loaded);
    }
}
