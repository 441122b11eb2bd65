package dev.granary.pull;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Hands out {@link RestClient}s for pull requests, one per effective read timeout.
 *
 * <p>Sources declare their own {@code timeout_seconds}; it is capped at {@code
 * granary.pull.max-timeout-seconds} so a hung attempt is always abandoned and retried.
 */
@Component
public class PullRestClientFactory {

    private final RestClient.Builder builder;
    private final PullProperties properties;
    private final Map<Integer, RestClient> clientsByTimeout = new ConcurrentHashMap<>();

    public PullRestClientFactory(RestClient.Builder builder, PullProperties properties) {
        this.builder = builder;
        this.properties = properties;
    }

    /**
     * Client whose read timeout is {@code timeoutSeconds}, capped.
     *
     * @param timeoutSeconds requested per-attempt timeout
     */
    public RestClient forTimeout(int timeoutSeconds) {
        int effective = effectiveTimeoutSeconds(timeoutSeconds);
        return clientsByTimeout.computeIfAbsent(effective, this::create);
    }

    int effectiveTimeoutSeconds(int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            return properties.maxTimeoutSeconds();
        }
        return Math.min(timeoutSeconds, properties.maxTimeoutSeconds());
    }

    private RestClient create(int timeoutSeconds) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
        return builder.clone()
                .requestFactory(requestFactory)
                .build();
    }
}
