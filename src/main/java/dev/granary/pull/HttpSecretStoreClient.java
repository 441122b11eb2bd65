package dev.granary.pull;

import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** {@link SecretStoreClient} calling the sidecar secrets API {@code GET /secrets/{store}/{key}}. */
@Service
public class HttpSecretStoreClient implements SecretStoreClient {

    private static final ParameterizedTypeReference<Map<String, String>> SECRET_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HttpSecretStoreClient(@Qualifier("secretStoreRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Map<String, String> getSecret(String store, String key) {
        try {
            Map<String, String> secret = restClient.get()
                    .uri("/secrets/{store}/{key}", store, key)
                    .retrieve()
                    .body(SECRET_TYPE);
            return secret == null ? Map.of() : secret;
        } catch (RestClientException e) {
            throw new SecretResolutionException("Cannot resolve secret " + key + " from " + store, e);
        }
    }
}
