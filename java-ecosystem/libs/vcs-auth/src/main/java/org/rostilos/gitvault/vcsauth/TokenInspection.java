package org.rostilos.gitvault.vcsauth;

import java.time.Instant;
import java.util.List;

/**
 * What a platform told us about a token it accepted.
 *
 * @param login     account name, or {@code null} when unknown
 * @param userId    platform user id, or {@code null}
 * @param scopes    granted scopes; {@code null} when the platform does not report them
 * @param expiresAt token expiry, or {@code null} when it does not expire or is unknown
 * @param twoFactor whether a second factor was presented to get this far
 */
public record TokenInspection(String login, String userId, List<String> scopes, Instant expiresAt, boolean twoFactor) {

    public TokenInspection(String login, String userId, List<String> scopes, Instant expiresAt) {
        this(login, userId, scopes, expiresAt, false);
    }

    /**
     * For tokens accepted on format alone.
     */
    public static TokenInspection unverified() {
        return new TokenInspection(null, null, null, null);
    }

    public boolean reportsScopes() {
        return scopes != null;
    }

    public TokenInspection withScopes(List<String> newScopes, Instant newExpiresAt) {
        return new TokenInspection(login, userId, newScopes, newExpiresAt != null ? newExpiresAt : expiresAt, twoFactor);
    }

    public TokenInspection withTwoFactor() {
        return new TokenInspection(login, userId, scopes, expiresAt, true);
    }
}
