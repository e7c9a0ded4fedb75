package org.rostilos.gitvault.vcsauth;

import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;
import org.rostilos.gitvault.core.model.TwoFactorResponse;

import java.util.List;
import java.util.Set;

/**
 * Platform-specific login and token lifecycle.
 * <p>
 * Typed failures are raised as {@link org.rostilos.gitvault.core.exception.AuthException}
 * or {@link org.rostilos.gitvault.core.exception.ValidationException}. A failed
 * {@link AuthResult} means the authenticator declined the request (unsupported
 * method, interaction not allowed) and another one may be tried.
 */
public interface PlatformAuthenticator {

    EPlatform platform();

    Set<EAuthMethod> supportedMethods();

    /**
     * Run a login for the request. Blocks on user interaction and network calls;
     * callers bound it with a timeout and interrupt it to cancel.
     */
    AuthResult authenticate(AuthRequest request);

    /**
     * Check token format, then (when the platform has an API) that the token is
     * accepted and holds {@code requiredScopes}.
     */
    void validateToken(SecretValue token, List<String> requiredScopes);

    /**
     * Method-aware variant of {@link #validateToken} for stored credentials.
     */
    void validateCredential(Credential credential, List<String> requiredScopes);

    boolean supportsRefresh();

    /**
     * @throws org.rostilos.gitvault.core.exception.RefreshUnsupportedException when the platform cannot refresh
     */
    Credential refreshToken(CredentialKey key, SecretValue refreshToken);

    TwoFactorResponse handleTwoFactor(TwoFactorChallenge challenge);
}
