package org.rostilos.gitvault.vcsauth.bitbucket;

import okhttp3.OkHttpClient;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.exception.ValidationException;
import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.vcsauth.AbstractPlatformAuthenticator;
import org.rostilos.gitvault.vcsauth.AuthenticatorContext;
import org.rostilos.gitvault.vcsauth.AuthenticatorSettings;
import org.rostilos.gitvault.vcsauth.PlatformApiException;
import org.rostilos.gitvault.vcsauth.TokenInspection;
import org.rostilos.gitvault.vcsauth.bitbucket.actions.GetCurrentUserAction;
import org.rostilos.gitvault.vcsauth.http.HttpErrors;
import org.rostilos.gitvault.vcsauth.oauth.OAuthClient;
import org.rostilos.gitvault.vcsauth.oauth.OAuthTokenResponse;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Bitbucket Cloud login: access tokens, app passwords (basic auth), SSH agent
 * identities and the OAuth consumer client-credentials grant with refresh.
 */
public class BitbucketAuthenticator extends AbstractPlatformAuthenticator {

    private static final Set<EAuthMethod> SUPPORTED_METHODS =
            EnumSet.of(EAuthMethod.TOKEN, EAuthMethod.SSH, EAuthMethod.OAUTH, EAuthMethod.BASIC);

    public BitbucketAuthenticator(AuthenticatorSettings settings, AuthenticatorContext context) {
        super(settings, context);
    }

    @Override
    public EPlatform platform() {
        return EPlatform.BITBUCKET;
    }

    @Override
    public Set<EAuthMethod> supportedMethods() {
        return SUPPORTED_METHODS;
    }

    @Override
    protected TokenInspection inspectToken(SecretValue token, List<String> requiredScopes) throws IOException {
        OkHttpClient client = context.httpClientFactory().createClientWithBearerToken(token);
        return new GetCurrentUserAction(client, context.objectMapper(), apiBase()).getCurrentUser();
    }

    @Override
    protected TokenInspection inspectBasic(String username, SecretValue password, List<String> requiredScopes)
            throws IOException {
        OkHttpClient client = context.httpClientFactory().createClientWithBasicAuth(username, password);
        return new GetCurrentUserAction(client, context.objectMapper(), apiBase()).getCurrentUser();
    }

    /**
     * Client credentials grant. The consumer comes from settings, or is prompted for.
     */
    @Override
    protected AuthResult authenticateWithOAuth(AuthRequest request) {
        String clientId = settings.hasOauthClient()
                ? settings.getOauthClientId()
                : context.prompter().promptUsername("Bitbucket OAuth consumer key");
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("oauthClientId", "BITBUCKET_EMPTY_CONSUMER_KEY", "Consumer key cannot be empty");
        }
        SecretValue clientSecret = settings.hasOauthClient() && settings.getOauthClientSecret() != null
                ? settings.getOauthClientSecret()
                : context.prompter().promptSecret("Bitbucket OAuth consumer secret");
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new ValidationException("oauthClientSecret", "BITBUCKET_EMPTY_CONSUMER_SECRET",
                    "Consumer secret cannot be empty");
        }

        List<String> scopes = scopesOf(request);
        OAuthTokenResponse token;
        try {
            token = tokenEndpoint().clientCredentials(tokenUrl(), new OAuthClient(clientId, clientSecret, true), scopes);
        } catch (PlatformApiException e) {
            throw HttpErrors.fromApiException(platform(), e, "Check the OAuth consumer key and secret");
        } catch (IOException e) {
            throw HttpErrors.fromIOException(platform(), "client credentials grant", e);
        }

        TokenInspection inspection = settings.isVerifyTokens()
                ? verify(() -> inspectToken(token.accessToken(), scopes), scopes)
                : TokenInspection.unverified();
        Credential credential = fromTokenResponse(request.key(), token, inspection);
        return AuthResult.success(credential, "Authenticated to Bitbucket with OAuth consumer " + clientId);
    }

    @Override
    public boolean supportsRefresh() {
        return true;
    }

    @Override
    public Credential refreshToken(CredentialKey key, SecretValue refreshToken) {
        if (!settings.hasOauthClient() || settings.getOauthClientSecret() == null) {
            throw new AuthException(EAuthErrorKind.EXPIRED_TOKEN,
                    "BITBUCKET_REFRESH_NOT_CONFIGURED",
                    "Cannot refresh Bitbucket token: no OAuth consumer is configured",
                    "Configure the Bitbucket OAuth consumer key and secret or log in again");
        }
        OAuthClient client = new OAuthClient(settings.getOauthClientId(), settings.getOauthClientSecret(), true);
        return refreshWith(key, tokenUrl(), client, refreshToken);
    }

    @Override
    protected String tokenHint() {
        return "Create a new access token or app password in Bitbucket personal settings";
    }

    private String apiBase() {
        return firstNonBlank(settings.getApiBaseUrl(), BitbucketConfig.API_BASE);
    }

    private String tokenUrl() {
        return firstNonBlank(settings.getWebBaseUrl(), BitbucketConfig.WEB_BASE) + BitbucketConfig.OAUTH_TOKEN_PATH;
    }
}
