package org.rostilos.gitvault.vcsauth.bitbucket;

public final class BitbucketConfig {

    public static final String API_BASE = "https://api.bitbucket.org/2.0";
    public static final String WEB_BASE = "https://bitbucket.org";

    public static final String OAUTH_TOKEN_PATH = "/site/oauth2/access_token";

    public static final String OAUTH_SCOPES_HEADER = "X-OAuth-Scopes";

    private BitbucketConfig() {
        // Utility class
    }
}
