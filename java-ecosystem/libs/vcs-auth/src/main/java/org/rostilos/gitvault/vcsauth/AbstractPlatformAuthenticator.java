package org.rostilos.gitvault.vcsauth;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.exception.RefreshUnsupportedException;
import org.rostilos.gitvault.core.exception.ValidationException;
import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.ETwoFactorMethod;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.model.SshKeyInfo;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;
import org.rostilos.gitvault.core.model.TwoFactorResponse;
import org.rostilos.gitvault.security.totp.TotpCodeGenerator;
import org.rostilos.gitvault.vcsauth.http.HttpErrors;
import org.rostilos.gitvault.vcsauth.oauth.DeviceAuthorizationFlow;
import org.rostilos.gitvault.vcsauth.oauth.OAuthClient;
import org.rostilos.gitvault.vcsauth.oauth.OAuthErrorException;
import org.rostilos.gitvault.vcsauth.oauth.OAuthTokenEndpoint;
import org.rostilos.gitvault.vcsauth.oauth.OAuthTokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Shared login flows. Subclasses supply the platform API calls and the OAuth flow.
 */
public abstract class AbstractPlatformAuthenticator implements PlatformAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(AbstractPlatformAuthenticator.class);

    protected final AuthenticatorSettings settings;
    protected final AuthenticatorContext context;

    protected AbstractPlatformAuthenticator(AuthenticatorSettings settings, AuthenticatorContext context) {
        this.settings = settings;
        this.context = context;
    }

    /**
     * Ask the platform about a token. {@code requiredScopes} tells platforms that need
     * an extra call to report scopes whether that call is worth making.
     *
     * @throws IOException          on transport failures
     * @throws PlatformApiException on non-success responses
     */
    protected abstract TokenInspection inspectToken(SecretValue token, List<String> requiredScopes) throws IOException;

    /**
     * Ask the platform about a username/password pair. Defaults to inspecting the
     * password as a token, which is how GitLab treats basic credentials.
     */
    protected TokenInspection inspectBasic(String username, SecretValue password, List<String> requiredScopes)
            throws IOException {
        return inspectToken(password, requiredScopes);
    }

    /**
     * Platform-specific OAuth login.
     */
    protected AuthResult authenticateWithOAuth(AuthRequest request) {
        return AuthResult.failure(EAuthMethod.OAUTH, "OAuth login is not supported for " + platform().getId());
    }

    /**
     * Hint shown when the platform rejects a token.
     */
    protected abstract String tokenHint();

    @Override
    public AuthResult authenticate(AuthRequest request) {
        EAuthMethod method = request.method() != null ? request.method() : settings.getDefaultMethod();
        if (!supportedMethods().contains(method)) {
            return AuthResult.failure(method,
                    "Authentication method " + method.getId() + " is not supported for " + platform().getId());
        }
        if (method != EAuthMethod.SSH && !request.interactive()) {
            return AuthResult.failure(method, method.getId() + " authentication requires interactive mode");
        }
        TokenFormats.requireValidScopes(request.scopes());

        log.info("Starting {} {} login for {}", platform().getId(), method.getId(), request.key());
        return switch (method) {
            case TOKEN -> authenticateWithToken(request);
            case BASIC -> authenticateWithBasic(request);
            case SSH -> authenticateWithSsh(request);
            case OAUTH -> authenticateWithOAuth(request);
        };
    }

    protected AuthResult authenticateWithToken(AuthRequest request) {
        SecretValue token = context.prompter().promptSecret(
                displayName() + " personal access token for " + request.repositoryKey());
        TokenFormats.requireValidTokenFormat(platform(), token);

        List<String> scopes = scopesOf(request);
        TokenInspection inspection = settings.isVerifyTokens()
                ? verify(() -> inspectToken(token, scopes), scopes)
                : TokenInspection.unverified();

        Credential credential = newCredential(request, EAuthMethod.TOKEN, token, null, inspection).build();
        return AuthResult.success(credential, "Authenticated to " + displayName() + " with a personal access token");
    }

    protected AuthResult authenticateWithBasic(AuthRequest request) {
        String username = context.prompter().promptUsername(displayName() + " username for " + request.repositoryKey());
        if (username == null || username.isBlank()) {
            throw new ValidationException("username",
                    platform().name() + "_EMPTY_USERNAME", "Username cannot be empty");
        }
        SecretValue password = context.prompter().promptSecret(displayName() + " password or app password for " + username);
        if (password == null || password.isEmpty()) {
            throw new ValidationException("password",
                    platform().name() + "_EMPTY_PASSWORD", "Password cannot be empty");
        }

        List<String> scopes = scopesOf(request);
        TokenInspection inspection = settings.isVerifyTokens()
                ? verify(() -> inspectBasic(username, password, scopes), scopes)
                : TokenInspection.unverified();

        Credential credential = newCredential(request, EAuthMethod.BASIC, password, null, inspection)
                .username(username)
                .build();
        return AuthResult.success(credential, "Authenticated to " + displayName() + " as " + username);
    }

    protected AuthResult authenticateWithSsh(AuthRequest request) {
        if (context.sshAgent() == null || !context.sshAgent().isAvailable()) {
            throw new AuthException(EAuthErrorKind.AGENT_UNAVAILABLE,
                    "SSH_AGENT_UNAVAILABLE",
                    "No SSH agent is reachable",
                    "Start ssh-agent, export SSH_AUTH_SOCK and add a key with 'ssh-add'");
        }
        List<SshKeyInfo> keys = context.sshAgent().listKeys();
        if (keys.isEmpty()) {
            throw new AuthException(EAuthErrorKind.NOT_FOUND,
                    "SSH_AGENT_NO_KEYS",
                    "The SSH agent holds no identities",
                    "Add a key with 'ssh-add'");
        }
        SshKeyInfo key = keys.get(0);
        Instant now = context.clock().instant();
        Credential credential = Credential.builder()
                .key(request.key())
                .method(EAuthMethod.SSH)
                .secret(SecretValue.empty())
                .metadata(CredentialMetadata.SSH_FINGERPRINT, key.fingerprint())
                .metadata(CredentialMetadata.SOURCE, "ssh-agent")
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("Using SSH identity {} ({}) for {}", key.fingerprint(), key.keyType(), request.key());
        return AuthResult.success(credential, "Using SSH agent identity " + key.fingerprint());
    }

    @Override
    public void validateToken(SecretValue token, List<String> requiredScopes) {
        TokenFormats.requireValidTokenFormat(platform(), token);
        TokenFormats.requireValidScopes(requiredScopes);
        verify(() -> inspectToken(token, requiredScopes), requiredScopes);
    }

    @Override
    public void validateCredential(Credential credential, List<String> requiredScopes) {
        TokenFormats.requireValidScopes(requiredScopes);
        switch (credential.getMethod()) {
            case TOKEN -> validateToken(credential.getSecret(), requiredScopes);
            case OAUTH -> verify(() -> inspectToken(credential.getSecret(), requiredScopes), requiredScopes);
            case BASIC -> verify(() -> inspectBasic(credential.getUsername().orElse(""), credential.getSecret(), requiredScopes),
                    requiredScopes);
            case SSH -> validateSshCredential(credential);
        }
    }

    private void validateSshCredential(Credential credential) {
        String fingerprint = credential.getMetadata().get(CredentialMetadata.SSH_FINGERPRINT);
        if (context.sshAgent() == null) {
            throw new AuthException(EAuthErrorKind.AGENT_UNAVAILABLE, "SSH_AGENT_UNAVAILABLE", "No SSH agent is configured");
        }
        boolean present = context.sshAgent().listKeys().stream()
                .anyMatch(key -> key.fingerprint().equals(fingerprint));
        if (!present) {
            throw new AuthException(EAuthErrorKind.INVALID_CREDENTIALS,
                    "SSH_KEY_NOT_LOADED",
                    "The SSH agent no longer holds key " + fingerprint,
                    "Add the key again with 'ssh-add'");
        }
    }

    @Override
    public boolean supportsRefresh() {
        return false;
    }

    @Override
    public Credential refreshToken(CredentialKey key, SecretValue refreshToken) {
        throw new RefreshUnsupportedException(platform(), tokenHint());
    }

    @Override
    public TwoFactorResponse handleTwoFactor(TwoFactorChallenge challenge) {
        String code;
        if (challenge.method() == ETwoFactorMethod.TOTP && settings.getTotpSeed() != null && !settings.getTotpSeed().isEmpty()) {
            code = generateTotp();
            log.debug("Answered {} TOTP challenge from configured seed", platform().getId());
        } else {
            code = context.prompter().promptTwoFactorCode(challenge);
        }
        String trimmed = code == null ? "" : code.trim();
        if (!TokenFormats.isWellFormedTwoFactorCode(trimmed)) {
            throw new AuthException(EAuthErrorKind.TWO_FACTOR_FAILED,
                    platform().name() + "_2FA_INVALID_CODE",
                    "The two-factor code must be 6 to 8 digits",
                    "Enter the current code from your authenticator");
        }
        return new TwoFactorResponse(trimmed, challenge.method());
    }

    private String generateTotp() {
        char[] seed = settings.getTotpSeed().toCharArray();
        try {
            return new TotpCodeGenerator(context.clock()).currentCode(seed);
        } catch (GeneralSecurityException e) {
            throw new AuthException(EAuthErrorKind.TWO_FACTOR_FAILED,
                    platform().name() + "_2FA_SEED_INVALID",
                    "The configured TOTP seed cannot be used",
                    "Check the base32 seed configured for " + platform().getId(),
                    e);
        } finally {
            Arrays.fill(seed, '\0');
        }
    }

    /**
     * Run a platform call and check the scopes it reports.
     */
    protected TokenInspection verify(InspectionCall call, List<String> requiredScopes) {
        TokenInspection inspection;
        try {
            inspection = call.inspect();
        } catch (PlatformApiException e) {
            throw HttpErrors.fromApiException(platform(), e, tokenHint());
        } catch (IOException e) {
            throw HttpErrors.fromIOException(platform(), "verify " + displayName() + " credentials", e);
        }
        requireScopes(inspection, requiredScopes);
        return inspection;
    }

    protected void requireScopes(TokenInspection inspection, List<String> requiredScopes) {
        if (requiredScopes == null || requiredScopes.isEmpty()) {
            return;
        }
        if (!inspection.reportsScopes()) {
            log.debug("{} did not report token scopes, skipping scope check", platform().getId());
            return;
        }
        List<String> missing = TokenFormats.missingScopes(requiredScopes, inspection.scopes());
        if (!missing.isEmpty()) {
            throw new AuthException(EAuthErrorKind.INVALID_CREDENTIALS,
                    platform().name() + "_INSUFFICIENT_SCOPE",
                    "Token missing required scopes: " + String.join(", ", missing),
                    "Update the token to include the required scopes");
        }
    }

    protected Credential.Builder newCredential(AuthRequest request, EAuthMethod method, SecretValue secret,
                                               SecretValue refreshToken, TokenInspection inspection) {
        Instant now = context.clock().instant();
        return Credential.builder()
                .key(request.key())
                .method(method)
                .secret(secret)
                .refreshToken(refreshToken)
                .username(inspection.login())
                .scopes(inspection.reportsScopes() ? inspection.scopes() : request.scopes())
                .expiresAt(inspection.expiresAt())
                .metadata(CredentialMetadata.USER_ID, inspection.userId())
                .metadata(CredentialMetadata.TWO_FACTOR, inspection.twoFactor() ? "true" : null)
                .metadata(CredentialMetadata.SOURCE, platform().getId())
                .createdAt(now)
                .updatedAt(now);
    }

    /**
     * Credential built from an OAuth token response.
     */
    protected Credential fromTokenResponse(CredentialKey key, OAuthTokenResponse token, TokenInspection inspection) {
        Instant now = context.clock().instant();
        return Credential.builder()
                .key(key)
                .method(EAuthMethod.OAUTH)
                .secret(token.accessToken())
                .refreshToken(token.refreshToken())
                .username(inspection.login())
                .scopes(token.scopes())
                .expiresAt(token.expiresIn() != null ? now.plus(token.expiresIn()) : inspection.expiresAt())
                .metadata(CredentialMetadata.USER_ID, inspection.userId())
                .metadata(CredentialMetadata.SOURCE, platform().getId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Device authorization login shared by GitHub and GitLab.
     */
    protected AuthResult authenticateWithDeviceFlow(AuthRequest request, String deviceCodeUrl, String tokenUrl) {
        String clientId = requireOAuthClientId();
        List<String> scopes = scopesOf(request);
        DeviceAuthorizationFlow flow = new DeviceAuthorizationFlow(platform(), tokenEndpoint(), context.prompter(),
                context.clock(), context.sleeper(), settings.getMinimumPollInterval());

        OAuthTokenResponse token;
        try {
            token = flow.run(deviceCodeUrl, tokenUrl, clientId, scopes);
        } catch (PlatformApiException e) {
            throw HttpErrors.fromApiException(platform(), e, "Check the OAuth application configured for " + displayName());
        } catch (IOException e) {
            throw HttpErrors.fromIOException(platform(), "device authorization", e);
        }

        TokenInspection inspection = settings.isVerifyTokens()
                ? verify(() -> inspectToken(token.accessToken(), scopes), scopes)
                : TokenInspection.unverified();
        Credential credential = fromTokenResponse(request.key(), token, inspection);
        return AuthResult.success(credential, "Authenticated to " + displayName() + " via device authorization");
    }

    /**
     * Run a refresh grant and map its failures. Servers that do not rotate refresh
     * tokens omit them from the response, so the presented one is kept.
     */
    protected Credential refreshWith(CredentialKey key, String tokenUrl, OAuthClient client, SecretValue refreshToken) {
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new AuthException(EAuthErrorKind.EXPIRED_TOKEN,
                    platform().name() + "_NO_REFRESH_TOKEN",
                    "No refresh token is stored for " + key,
                    tokenHint());
        }
        try {
            OAuthTokenResponse token = tokenEndpoint().refresh(tokenUrl, client, refreshToken);
            if (token.refreshToken() == null) {
                token = new OAuthTokenResponse(token.accessToken(), refreshToken.copy(), token.expiresIn(), token.scopes());
            }
            log.info("Refreshed {} token for {}", platform().getId(), key);
            return fromTokenResponse(key, token, TokenInspection.unverified());
        } catch (OAuthErrorException e) {
            if (e.isInvalidGrant()) {
                throw new AuthException(EAuthErrorKind.EXPIRED_TOKEN,
                        platform().name() + "_REFRESH_REJECTED",
                        displayName() + " rejected the refresh token",
                        "Log in again to obtain a new token",
                        e);
            }
            throw HttpErrors.fromApiException(platform(), e, tokenHint());
        } catch (PlatformApiException e) {
            throw HttpErrors.fromApiException(platform(), e, tokenHint());
        } catch (IOException e) {
            throw HttpErrors.fromIOException(platform(), "token refresh", e);
        }
    }

    protected String requireOAuthClientId() {
        if (!settings.hasOauthClient()) {
            throw new ValidationException("oauthClientId",
                    "OAUTH_CLIENT_NOT_CONFIGURED",
                    "No OAuth client id is configured for " + platform().getId());
        }
        return settings.getOauthClientId();
    }

    protected OAuthTokenEndpoint tokenEndpoint() {
        return new OAuthTokenEndpoint(context.httpClientFactory().createClient(), context.objectMapper());
    }

    protected static String firstNonBlank(String configured, String fallback) {
        return configured != null && !configured.isBlank() ? configured : fallback;
    }

    protected List<String> scopesOf(AuthRequest request) {
        return request.scopes().isEmpty() ? settings.getDefaultScopes() : request.scopes();
    }

    protected String displayName() {
        return switch (platform()) {
            case GITHUB -> "GitHub";
            case GITLAB -> "GitLab";
            case BITBUCKET -> "Bitbucket";
            case GENERIC -> "Git";
        };
    }

    @FunctionalInterface
    protected interface InspectionCall {
        TokenInspection inspect() throws IOException;
    }
}
