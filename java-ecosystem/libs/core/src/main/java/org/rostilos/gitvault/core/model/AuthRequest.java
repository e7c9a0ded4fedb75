package org.rostilos.gitvault.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Request for a credential, as issued by the command layer.
 *
 * @param method      requested method, or {@code null} to let configuration and the
 *                    authenticator pick one
 * @param scopes      scopes the caller needs; may be empty
 * @param interactive whether a login flow may be started when nothing is stored
 */
public record AuthRequest(
        EPlatform platform,
        String repositoryKey,
        EAuthMethod method,
        List<String> scopes,
        boolean interactive
) {

    public AuthRequest {
        Objects.requireNonNull(platform, "platform");
        if (repositoryKey == null || repositoryKey.isBlank()) {
            throw new IllegalArgumentException("Repository key cannot be null or empty");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    public static AuthRequest lookup(EPlatform platform, String repositoryKey) {
        return new AuthRequest(platform, repositoryKey, null, List.of(), false);
    }

    public static AuthRequest interactive(EPlatform platform, String repositoryKey, EAuthMethod method) {
        return new AuthRequest(platform, repositoryKey, method, List.of(), true);
    }

    public CredentialKey key() {
        return new CredentialKey(platform, repositoryKey);
    }

    public AuthRequest withMethod(EAuthMethod newMethod) {
        return new AuthRequest(platform, repositoryKey, newMethod, scopes, interactive);
    }
}
