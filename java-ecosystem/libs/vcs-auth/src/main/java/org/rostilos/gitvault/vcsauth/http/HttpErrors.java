package org.rostilos.gitvault.vcsauth.http;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.vcsauth.PlatformApiException;

import java.io.IOException;

/**
 * Maps transport and HTTP failures onto the authentication error taxonomy.
 */
public final class HttpErrors {

    private HttpErrors() {
        // Utility class
    }

    public static AuthException fromApiException(EPlatform platform, PlatformApiException e, String hint) {
        String prefix = platform.name();
        if (e.isAuthenticationFailure()) {
            return new AuthException(EAuthErrorKind.INVALID_CREDENTIALS,
                    prefix + "_INVALID_TOKEN",
                    capitalize(platform) + " rejected the credentials (HTTP " + e.getStatusCode() + ")",
                    hint,
                    e);
        }
        if (e.isServerError()) {
            return new AuthException(EAuthErrorKind.NETWORK_ERROR,
                    prefix + "_SERVER_ERROR",
                    capitalize(platform) + " is unavailable: " + e.getMessage(),
                    "Try again later",
                    e);
        }
        return new AuthException(EAuthErrorKind.INVALID_CREDENTIALS,
                prefix + "_API_ERROR",
                capitalize(platform) + " API error: " + e.getMessage(),
                hint,
                e);
    }

    public static AuthException fromIOException(EPlatform platform, String operation, IOException e) {
        return new AuthException(EAuthErrorKind.NETWORK_ERROR,
                platform.name() + "_NETWORK_ERROR",
                "Failed to " + operation + ": " + e.getClass().getSimpleName(),
                "Check your network connection and proxy settings",
                e);
    }

    private static String capitalize(EPlatform platform) {
        String id = platform.getId();
        return switch (platform) {
            case GITHUB -> "GitHub";
            case GITLAB -> "GitLab";
            default -> Character.toUpperCase(id.charAt(0)) + id.substring(1);
        };
    }
}
