package org.rostilos.gitvault.vcsauth.github;

public final class GitHubConfig {

    public static final String API_BASE = "https://api.github.com";
    public static final String WEB_BASE = "https://github.com";

    public static final String DEVICE_CODE_PATH = "/login/device/code";
    public static final String OAUTH_TOKEN_PATH = "/login/oauth/access_token";

    public static final String API_VERSION = "2022-11-28";
    public static final String ACCEPT = "application/vnd.github+json";

    public static final String OAUTH_SCOPES_HEADER = "X-OAuth-Scopes";
    public static final String TOKEN_EXPIRATION_HEADER = "github-authentication-token-expiration";
    public static final String OTP_HEADER = "X-GitHub-OTP";

    private GitHubConfig() {
        // Utility class
    }
}
