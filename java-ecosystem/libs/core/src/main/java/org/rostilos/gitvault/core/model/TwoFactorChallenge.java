package org.rostilos.gitvault.core.model;

/**
 * Second-factor challenge raised by a platform during login.
 *
 * @param challengeToken opaque token the platform uses to correlate the answer; may be null
 * @param method         delivery channel of the expected code
 * @param message        human readable prompt text
 */
public record TwoFactorChallenge(String challengeToken, ETwoFactorMethod method, String message) {

    public static TwoFactorChallenge of(ETwoFactorMethod method, String message) {
        return new TwoFactorChallenge(null, method, message);
    }
}
