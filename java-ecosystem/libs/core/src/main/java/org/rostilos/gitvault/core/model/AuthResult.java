package org.rostilos.gitvault.core.model;

import java.util.Optional;

/**
 * Outcome of an authenticator run.
 */
public record AuthResult(
        boolean success,
        EAuthMethod method,
        Credential credential,
        String message
) {

    public static AuthResult success(Credential credential, String message) {
        return new AuthResult(true, credential.getMethod(), credential, message);
    }

    public static AuthResult failure(EAuthMethod method, String message) {
        return new AuthResult(false, method, null, message);
    }

    public Optional<Credential> credentialOptional() {
        return Optional.ofNullable(credential);
    }
}
