package org.rostilos.gitvault.vcsauth.gitlab;

/**
 * Endpoints of gitlab.com; self-managed instances override the base URL.
 */
public final class GitLabConfig {

    public static final String WEB_BASE = "https://gitlab.com";
    public static final String API_PATH = "/api/v4";

    public static final String DEVICE_CODE_PATH = "/oauth/authorize_device";
    public static final String OAUTH_TOKEN_PATH = "/oauth/token";

    private GitLabConfig() {
        // Utility class
    }
}
