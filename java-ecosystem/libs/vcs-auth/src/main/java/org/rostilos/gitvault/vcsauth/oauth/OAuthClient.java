package org.rostilos.gitvault.vcsauth.oauth;

import org.rostilos.gitvault.core.model.SecretValue;

/**
 * Registered OAuth consumer.
 *
 * @param clientSecret  {@code null} for public clients (device flow)
 * @param useBasicAuth  send the client credentials as HTTP basic auth instead of form fields
 */
public record OAuthClient(String clientId, SecretValue clientSecret, boolean useBasicAuth) {

    public static OAuthClient publicClient(String clientId) {
        return new OAuthClient(clientId, null, false);
    }

    public boolean hasSecret() {
        return clientSecret != null && !clientSecret.isEmpty();
    }

    @Override
    public String toString() {
        return "OAuthClient{clientId='" + clientId + "', basic=" + useBasicAuth + "}";
    }
}
