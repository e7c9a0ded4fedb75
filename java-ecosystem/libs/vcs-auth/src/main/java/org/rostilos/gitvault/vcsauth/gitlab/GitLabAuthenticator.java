package org.rostilos.gitvault.vcsauth.gitlab;

import okhttp3.OkHttpClient;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
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
import org.rostilos.gitvault.vcsauth.TokenInspection;
import org.rostilos.gitvault.vcsauth.gitlab.actions.GetCurrentUserAction;
import org.rostilos.gitvault.vcsauth.gitlab.actions.GetTokenSelfAction;
import org.rostilos.gitvault.vcsauth.oauth.OAuthClient;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * GitLab login: personal/project/group access tokens, basic auth with a token as
 * password, SSH agent identities and the OAuth device flow with refresh.
 */
public class GitLabAuthenticator extends AbstractPlatformAuthenticator {

    private static final Set<EAuthMethod> SUPPORTED_METHODS =
            EnumSet.of(EAuthMethod.TOKEN, EAuthMethod.SSH, EAuthMethod.OAUTH, EAuthMethod.BASIC);

    public GitLabAuthenticator(AuthenticatorSettings settings, AuthenticatorContext context) {
        super(settings, context);
    }

    @Override
    public EPlatform platform() {
        return EPlatform.GITLAB;
    }

    @Override
    public Set<EAuthMethod> supportedMethods() {
        return SUPPORTED_METHODS;
    }

    @Override
    protected TokenInspection inspectToken(SecretValue token, List<String> requiredScopes) throws IOException {
        OkHttpClient client = context.httpClientFactory().createClientWithBearerToken(token);
        TokenInspection user = new GetCurrentUserAction(client, context.objectMapper(), apiBase()).getCurrentUser();
        if (requiredScopes == null || requiredScopes.isEmpty()) {
            return user;
        }
        return new GetTokenSelfAction(client, context.objectMapper(), apiBase()).getTokenDetails()
                .map(details -> user.withScopes(details.scopes(), details.expiresAt()))
                .orElse(user);
    }

    @Override
    protected AuthResult authenticateWithOAuth(AuthRequest request) {
        String web = webBase();
        return authenticateWithDeviceFlow(request,
                web + GitLabConfig.DEVICE_CODE_PATH,
                web + GitLabConfig.OAUTH_TOKEN_PATH);
    }

    @Override
    public boolean supportsRefresh() {
        return true;
    }

    @Override
    public Credential refreshToken(CredentialKey key, SecretValue refreshToken) {
        if (!settings.hasOauthClient()) {
            throw new AuthException(EAuthErrorKind.EXPIRED_TOKEN,
                    "GITLAB_REFRESH_NOT_CONFIGURED",
                    "Cannot refresh GitLab token: no OAuth client id is configured",
                    "Configure the GitLab OAuth application or log in again");
        }
        OAuthClient client = new OAuthClient(settings.getOauthClientId(), settings.getOauthClientSecret(), false);
        return refreshWith(key, webBase() + GitLabConfig.OAUTH_TOKEN_PATH, client, refreshToken);
    }

    @Override
    protected String tokenHint() {
        return "Create a new token under User Settings > Access Tokens in GitLab";
    }

    private String webBase() {
        return firstNonBlank(settings.getWebBaseUrl(), GitLabConfig.WEB_BASE);
    }

    private String apiBase() {
        if (settings.getApiBaseUrl() != null && !settings.getApiBaseUrl().isBlank()) {
            return settings.getApiBaseUrl();
        }
        return webBase() + GitLabConfig.API_PATH;
    }
}
