package org.rostilos.gitvault.core.model;

/**
 * Well-known metadata keys. Metadata is free-form, but these keys carry meaning
 * for resolution and display. Values are never secret.
 */
public final class CredentialMetadata {

    /** Comma separated scope list. */
    public static final String SCOPES = "scopes";
    /** ISO-8601 instant after which the secret is no longer accepted. */
    public static final String EXPIRES_AT = "expires_at";
    /** "true" when a second factor was answered while obtaining the credential. */
    public static final String TWO_FACTOR = "two_factor";
    public static final String PERMISSION = "permission";
    /** Name of the helper or authenticator that produced the credential. */
    public static final String SOURCE = "source";
    public static final String SSH_FINGERPRINT = "ssh_fingerprint";
    public static final String USER_ID = "user_id";

    private CredentialMetadata() {
        // Utility class
    }
}
