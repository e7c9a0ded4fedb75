package org.rostilos.gitvault.vcsauth;

/**
 * Non-success HTTP status from a platform endpoint. Carries the operation and the
 * status only; response bodies of authentication endpoints may echo secrets.
 */
public class PlatformApiException extends RuntimeException {

    private final String operation;
    private final int statusCode;

    public PlatformApiException(String operation, int statusCode) {
        super(String.format("%s failed with HTTP %d", operation, statusCode));
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isAuthenticationFailure() {
        return statusCode == 401 || statusCode == 403;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
