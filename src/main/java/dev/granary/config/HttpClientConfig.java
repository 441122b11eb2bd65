package dev.granary.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient}s used to reach the sidecar APIs.
 *
 * <p>The secret store and service invocation share {@code granary.sidecar.base-url}; the job
 * scheduler has its own {@code granary.scheduler.base-url}. Timeouts come from {@code
 * granary.sidecar.*}. Pull requests to third-party APIs do not go through these clients, see
 * {@code PullRestClientFactory}.
 */
@Configuration
public class HttpClientConfig {

    /**
     * Client of the job scheduler API.
     *
     * @param builder Spring-provided builder with common defaults
     * @param baseUrl scheduler API base URL (e.g. {@code http://localhost:3500/v1.0-alpha1})
     */
    @Bean
    public RestClient schedulerRestClient(
            RestClient.Builder builder,
            @Value("${granary.scheduler.base-url}") String baseUrl,
            @Value("${granary.sidecar.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${granary.sidecar.read-timeout-ms}") int readTimeoutMs) {
        return jsonClient(builder, baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    @Bean
    public RestClient secretStoreRestClient(
            RestClient.Builder builder,
            @Value("${granary.sidecar.base-url}") String baseUrl,
            @Value("${granary.sidecar.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${granary.sidecar.read-timeout-ms}") int readTimeoutMs) {
        return jsonClient(builder, baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    @Bean
    public RestClient serviceInvocationRestClient(
            RestClient.Builder builder,
            @Value("${granary.sidecar.base-url}") String baseUrl,
            @Value("${granary.sidecar.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${granary.sidecar.invocation-read-timeout-ms}") int readTimeoutMs) {
        return jsonClient(builder, baseUrl, connectTimeoutMs, readTimeoutMs);
    }

    private static RestClient jsonClient(RestClient.Builder builder, String baseUrl,
                                         int connectTimeoutMs, int readTimeoutMs) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        return builder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
