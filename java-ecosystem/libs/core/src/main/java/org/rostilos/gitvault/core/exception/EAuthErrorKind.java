package org.rostilos.gitvault.core.exception;

/**
 * Kinds of authentication failure. Callers branch on the kind, never on the message.
 */
public enum EAuthErrorKind {
    /** No source had a credential. */
    NOT_FOUND,
    /** A credential existed but is no longer valid and could not be refreshed. */
    EXPIRED_TOKEN,
    /** Persisted data could not be authenticated or parsed (wrong passphrase, corruption). */
    STORAGE_CORRUPTED,
    /** Persisted data could not be read or written (I/O, no writable store). */
    STORAGE_UNAVAILABLE,
    HELPER_UNAVAILABLE,
    AGENT_UNAVAILABLE,
    NETWORK_ERROR,
    /** The platform rejected the secret. */
    INVALID_CREDENTIALS,
    TWO_FACTOR_REQUIRED,
    TWO_FACTOR_FAILED,
    CANCELED;

    /**
     * Per-source failures the manager absorbs before moving to the next source.
     */
    public boolean isSourceFailure() {
        return this == STORAGE_CORRUPTED
                || this == STORAGE_UNAVAILABLE
                || this == HELPER_UNAVAILABLE
                || this == AGENT_UNAVAILABLE;
    }

    public boolean isRetryable() {
        return this == NETWORK_ERROR;
    }
}
