package org.rostilos.gitvault.vcsauth.oauth;

/**
 * Either a token or a sanitized RFC 8628 error code.
 */
public record DevicePollResult(OAuthTokenResponse token, String error) {

    static DevicePollResult completed(OAuthTokenResponse token) {
        return new DevicePollResult(token, null);
    }

    static DevicePollResult failed(String error) {
        return new DevicePollResult(null, error);
    }

    public boolean isComplete() {
        return token != null;
    }
}
