package dev.granary.pull;

import java.util.Map;

/** Resolves named secrets for outbound authentication. */
public interface SecretStoreClient {

    /**
     * Fetch a secret.
     *
     * @param store name of the secret store
     * @param key   name of the secret
     * @return secret fields, e.g. {@code api_key} or {@code token}
     * @throws SecretResolutionException if the store cannot be reached or has no such secret
     */
    Map<String, String> getSecret(String store, String key);
}
