package dev.granary.pull;

import dev.granary.source.AuthConfig;
import dev.granary.source.AuthType;
import dev.granary.source.RequestSettings;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Performs the HTTP GET of a scheduled pull.
 *
 * <p>The URL is built by {@link RequestUrlBuilder}. Authentication follows the source's {@code
 * auth_type}; when the secret cannot be resolved the request goes out without credentials, so an
 * authentication failure shows up as the remote's HTTP error.
 *
 * <p>Only {@link ResourceAccessException} (connect failure, timeout, I/O) is retried, with
 * exponential backoff capped at {@code granary.pull.retry.max-delay-ms}. An HTTP error status is
 * thrown after the first attempt.
 */
@Service
public class PullDataFetcher {

    private static final Logger log = LoggerFactory.getLogger(PullDataFetcher.class);

    private final PullRestClientFactory clientFactory;
    private final SecretStoreClient secretStore;
    private final PullProperties properties;

    public PullDataFetcher(PullRestClientFactory clientFactory, SecretStoreClient secretStore,
                           PullProperties properties) {
        this.clientFactory = clientFactory;
        this.secretStore = secretStore;
        this.properties = properties;
    }

    /**
     * Fetch the payload described by {@code request}.
     *
     * @param request       request template of the source
     * @param iterationItem current item when the source iterates, otherwise null
     * @return response body, empty when the remote sent none
     * @throws PullFetchException when every attempt failed on a connection or timeout error
     * @throws org.springframework.web.client.RestClientResponseException on an HTTP error status
     */
    public byte[] fetch(RequestSettings request, @Nullable Map<String, ?> iterationItem) {
        String url = RequestUrlBuilder.build(request.baseUrl(), request.parameters(), iterationItem);
        Map<String, String> headers = authHeaders(request);
        RestClient client = clientFactory.forTimeout(request.timeoutSeconds());
        int maxAttempts = properties.retry().maxRetries() + 1;

        try {
            return retryTemplate(maxAttempts).execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying pull {} (attempt {}/{}) after: {}", url,
                            context.getRetryCount() + 1, maxAttempts,
                            context.getLastThrowable().getMessage());
                }
                byte[] body = client.get()
                        .uri(URI.create(url))
                        .headers(h -> headers.forEach(h::set))
                        .retrieve()
                        .body(byte[].class);
                return body == null ? new byte[0] : body;
            });
        } catch (ResourceAccessException e) {
            throw new PullFetchException(
                    "Pull of " + url + " failed after " + maxAttempts + " attempts", maxAttempts, e);
        }
    }

    /**
     * Headers for the source's auth type. Empty for {@code none}, on incomplete auth config, or
     * when the secret lookup fails.
     */
    Map<String, String> authHeaders(RequestSettings request) {
        Map<String, String> headers = new LinkedHashMap<>();
        AuthConfig auth = request.authConfig();
        if (request.authType() == AuthType.NONE) {
            return headers;
        }
        if (auth == null || !auth.isComplete()) {
            log.warn("auth_type {} without secret_store/secret_name, sending unauthenticated request to {}",
                    request.authType(), request.baseUrl());
            return headers;
        }

        Map<String, String> secret;
        try {
            secret = secretStore.getSecret(auth.secretStore(), auth.secretName());
        } catch (SecretResolutionException e) {
            log.warn("Secret {} unavailable, sending unauthenticated request to {}: {}",
                    auth.secretName(), request.baseUrl(), e.getMessage());
            return headers;
        }

        String field = request.authType() == AuthType.BEARER ? "token" : "api_key";
        String value = secret.get(field);
        if (value == null || value.isBlank()) {
            log.warn("Secret {} has no '{}' field, sending unauthenticated request to {}",
                    auth.secretName(), field, request.baseUrl());
            return headers;
        }
        if (request.authType() == AuthType.BEARER) {
            headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + value);
        } else {
            headers.put(auth.headerName(), value);
        }
        return headers;
    }

    private RetryTemplate retryTemplate(int maxAttempts) {
        PullProperties.Retry retry = properties.retry();
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(retry.initialDelayMs(), retry.multiplier(),
                        Math.max(retry.initialDelayMs() + 1, retry.maxDelayMs()))
                .retryOn(ResourceAccessException.class)
                .build();
    }
}
