package org.rostilos.gitvault.core.model;

import java.util.Locale;

/**
 * Second-factor delivery channel signalled by a platform.
 */
public enum ETwoFactorMethod {
    TOTP,
    SMS,
    APP;

    /**
     * Parse the method tag a platform sends with a challenge. Unknown tags fall
     * back to TOTP, which is what authenticator apps answer.
     */
    public static ETwoFactorMethod fromTag(String tag) {
        if (tag == null) {
            return TOTP;
        }
        return switch (tag.trim().toLowerCase(Locale.ENGLISH)) {
            case "sms" -> SMS;
            case "app", "push" -> APP;
            default -> TOTP;
        };
    }
}
