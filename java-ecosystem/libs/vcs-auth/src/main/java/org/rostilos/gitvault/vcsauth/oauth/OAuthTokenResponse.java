package org.rostilos.gitvault.vcsauth.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import org.rostilos.gitvault.core.model.SecretValue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Successful RFC 6749 token response.
 *
 * @param refreshToken {@code null} when the server did not issue one
 * @param expiresIn    {@code null} when the token does not expire
 * @param scopes       granted scopes, empty when not reported
 */
public record OAuthTokenResponse(
        SecretValue accessToken,
        SecretValue refreshToken,
        Duration expiresIn,
        List<String> scopes
) {

    static OAuthTokenResponse fromJson(JsonNode json) {
        String accessToken = json.path("access_token").asText("");
        String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
        Duration expiresIn = json.hasNonNull("expires_in") ? Duration.ofSeconds(json.get("expires_in").asLong()) : null;
        return new OAuthTokenResponse(
                SecretValue.of(accessToken),
                refreshToken != null && !refreshToken.isEmpty() ? SecretValue.of(refreshToken) : null,
                expiresIn,
                parseScopes(json.has("scope") ? json.path("scope") : json.path("scopes")));
    }

    /**
     * Scopes arrive space separated (RFC 6749), comma separated (GitHub) or as an array.
     * Bitbucket names the field {@code scopes}.
     */
    static List<String> parseScopes(JsonNode scope) {
        List<String> scopes = new ArrayList<>();
        if (scope.isArray()) {
            scope.forEach(node -> scopes.add(node.asText()));
        } else if (scope.isTextual()) {
            for (String part : scope.asText().split("[\\s,]+")) {
                if (!part.isBlank()) {
                    scopes.add(part);
                }
            }
        }
        return scopes;
    }

    @Override
    public String toString() {
        return "OAuthTokenResponse{expiresIn=" + expiresIn + ", scopes=" + scopes + "}";
    }
}
