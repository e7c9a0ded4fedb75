package org.rostilos.gitvault.vcsauth;

import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.SecretValue;

import java.time.Duration;
import java.util.List;

/**
 * Per-platform authenticator configuration. Base URLs default to the public SaaS
 * hosts and are overridden for self-hosted instances and tests.
 */
public final class AuthenticatorSettings {

    private final String apiBaseUrl;
    private final String webBaseUrl;
    private final String oauthClientId;
    private final SecretValue oauthClientSecret;
    private final List<String> defaultScopes;
    private final EAuthMethod defaultMethod;
    private final SecretValue totpSeed;
    private final boolean verifyTokens;
    private final Duration minimumPollInterval;

    private AuthenticatorSettings(Builder builder) {
        this.apiBaseUrl = stripTrailingSlash(builder.apiBaseUrl);
        this.webBaseUrl = stripTrailingSlash(builder.webBaseUrl);
        this.oauthClientId = builder.oauthClientId;
        this.oauthClientSecret = builder.oauthClientSecret;
        this.defaultScopes = List.copyOf(builder.defaultScopes);
        this.defaultMethod = builder.defaultMethod;
        this.totpSeed = builder.totpSeed;
        this.verifyTokens = builder.verifyTokens;
        this.minimumPollInterval = builder.minimumPollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getWebBaseUrl() {
        return webBaseUrl;
    }

    public String getOauthClientId() {
        return oauthClientId;
    }

    public SecretValue getOauthClientSecret() {
        return oauthClientSecret;
    }

    public boolean hasOauthClient() {
        return oauthClientId != null && !oauthClientId.isBlank();
    }

    public List<String> getDefaultScopes() {
        return defaultScopes;
    }

    public EAuthMethod getDefaultMethod() {
        return defaultMethod;
    }

    public SecretValue getTotpSeed() {
        return totpSeed;
    }

    public boolean isVerifyTokens() {
        return verifyTokens;
    }

    public Duration getMinimumPollInterval() {
        return minimumPollInterval;
    }

    public Builder toBuilder() {
        return new Builder()
                .apiBaseUrl(apiBaseUrl)
                .webBaseUrl(webBaseUrl)
                .oauthClientId(oauthClientId)
                .oauthClientSecret(oauthClientSecret)
                .defaultScopes(defaultScopes)
                .defaultMethod(defaultMethod)
                .totpSeed(totpSeed)
                .verifyTokens(verifyTokens)
                .minimumPollInterval(minimumPollInterval);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return "AuthenticatorSettings{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", webBaseUrl='" + webBaseUrl + '\'' +
                ", oauthClientId='" + oauthClientId + '\'' +
                ", defaultMethod=" + defaultMethod +
                ", verifyTokens=" + verifyTokens +
                '}';
    }

    public static final class Builder {
        private String apiBaseUrl;
        private String webBaseUrl;
        private String oauthClientId;
        private SecretValue oauthClientSecret;
        private List<String> defaultScopes = List.of();
        private EAuthMethod defaultMethod = EAuthMethod.TOKEN;
        private SecretValue totpSeed;
        private boolean verifyTokens = true;
        private Duration minimumPollInterval = Duration.ofSeconds(5);

        private Builder() {
        }

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder webBaseUrl(String webBaseUrl) {
            this.webBaseUrl = webBaseUrl;
            return this;
        }

        public Builder oauthClientId(String oauthClientId) {
            this.oauthClientId = oauthClientId;
            return this;
        }

        public Builder oauthClientSecret(SecretValue oauthClientSecret) {
            this.oauthClientSecret = oauthClientSecret;
            return this;
        }

        public Builder defaultScopes(List<String> defaultScopes) {
            this.defaultScopes = defaultScopes != null ? defaultScopes : List.of();
            return this;
        }

        public Builder defaultMethod(EAuthMethod defaultMethod) {
            this.defaultMethod = defaultMethod;
            return this;
        }

        /**
         * Base32 authenticator seed used to answer TOTP challenges without prompting.
         */
        public Builder totpSeed(SecretValue totpSeed) {
            this.totpSeed = totpSeed;
            return this;
        }

        /**
         * Whether prompted tokens are checked against the platform API.
         */
        public Builder verifyTokens(boolean verifyTokens) {
            this.verifyTokens = verifyTokens;
            return this;
        }

        /**
         * Lower bound for device flow polling, applied on top of the interval the server asks for.
         */
        public Builder minimumPollInterval(Duration minimumPollInterval) {
            this.minimumPollInterval = minimumPollInterval;
            return this;
        }

        public AuthenticatorSettings build() {
            return new AuthenticatorSettings(this);
        }
    }
}
