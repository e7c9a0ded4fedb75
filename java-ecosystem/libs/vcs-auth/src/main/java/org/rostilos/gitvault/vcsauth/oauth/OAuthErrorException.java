package org.rostilos.gitvault.vcsauth.oauth;

import org.rostilos.gitvault.vcsauth.PlatformApiException;

import java.util.regex.Pattern;

/**
 * Token endpoint answered with an RFC 6749 error code. Only the code is kept;
 * {@code error_description} is free text and never surfaced.
 */
public class OAuthErrorException extends PlatformApiException {

    private static final Pattern ERROR_CODE = Pattern.compile("^[a-z_]{1,64}$");

    private final String error;

    public OAuthErrorException(String operation, int statusCode, String error) {
        super(operation + " (" + sanitize(error) + ")", statusCode);
        this.error = sanitize(error);
    }

    public String getError() {
        return error;
    }

    public boolean isInvalidGrant() {
        return "invalid_grant".equals(error);
    }

    static String sanitize(String error) {
        return error != null && ERROR_CODE.matcher(error).matches() ? error : "unknown_error";
    }
}
