package org.rostilos.gitvault.vcsauth.github;

import okhttp3.OkHttpClient;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;
import org.rostilos.gitvault.core.model.TwoFactorResponse;
import org.rostilos.gitvault.vcsauth.AbstractPlatformAuthenticator;
import org.rostilos.gitvault.vcsauth.AuthenticatorContext;
import org.rostilos.gitvault.vcsauth.AuthenticatorSettings;
import org.rostilos.gitvault.vcsauth.TokenInspection;
import org.rostilos.gitvault.vcsauth.github.actions.GetAuthenticatedUserAction;
import org.rostilos.gitvault.vcsauth.github.actions.OtpRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * GitHub login: personal access tokens, username/password with OTP challenges,
 * SSH agent identities and the OAuth device flow. GitHub tokens cannot be refreshed.
 */
public class GitHubAuthenticator extends AbstractPlatformAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(GitHubAuthenticator.class);

    private static final Set<EAuthMethod> SUPPORTED_METHODS =
            EnumSet.of(EAuthMethod.TOKEN, EAuthMethod.SSH, EAuthMethod.OAUTH, EAuthMethod.BASIC);

    public GitHubAuthenticator(AuthenticatorSettings settings, AuthenticatorContext context) {
        super(settings, context);
    }

    @Override
    public EPlatform platform() {
        return EPlatform.GITHUB;
    }

    @Override
    public Set<EAuthMethod> supportedMethods() {
        return SUPPORTED_METHODS;
    }

    @Override
    protected TokenInspection inspectToken(SecretValue token, List<String> requiredScopes) throws IOException {
        OkHttpClient client = context.httpClientFactory().createClientWithBearerToken(token);
        return new GetAuthenticatedUserAction(client, context.objectMapper(), apiBase()).getAuthenticatedUser();
    }

    @Override
    protected TokenInspection inspectBasic(String username, SecretValue password, List<String> requiredScopes)
            throws IOException {
        OkHttpClient client = context.httpClientFactory().createClientWithBasicAuth(username, password);
        GetAuthenticatedUserAction action = new GetAuthenticatedUserAction(client, context.objectMapper(), apiBase());
        try {
            return action.getAuthenticatedUser();
        } catch (OtpRequiredException e) {
            log.info("GitHub requested a {} one-time code for {}", e.getMethod(), username);
            TwoFactorResponse response = handleTwoFactor(TwoFactorChallenge.of(e.getMethod(),
                    "GitHub two-factor code for " + username));
            try {
                return action.getAuthenticatedUser(response.code()).withTwoFactor();
            } catch (OtpRequiredException rejected) {
                throw new AuthException(EAuthErrorKind.TWO_FACTOR_FAILED,
                        "GITHUB_2FA_REJECTED",
                        "GitHub rejected the two-factor code",
                        "Codes are valid for 30 seconds; try again with a fresh one",
                        rejected);
            }
        }
    }

    @Override
    protected AuthResult authenticateWithOAuth(AuthRequest request) {
        String web = webBase();
        return authenticateWithDeviceFlow(request,
                web + GitHubConfig.DEVICE_CODE_PATH,
                web + GitHubConfig.OAUTH_TOKEN_PATH);
    }

    @Override
    protected String tokenHint() {
        return "Create a new token at https://github.com/settings/tokens";
    }

    private String apiBase() {
        return firstNonBlank(settings.getApiBaseUrl(), GitHubConfig.API_BASE);
    }

    private String webBase() {
        return firstNonBlank(settings.getWebBaseUrl(), GitHubConfig.WEB_BASE);
    }
}
