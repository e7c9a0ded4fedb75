package org.rostilos.gitvault.store;

import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;

import java.util.List;
import java.util.Optional;

/**
 * Persistent backend keyed by {@link CredentialKey}.
 * <p>
 * Implementations must be safe for concurrent use. Failures are reported as
 * {@link org.rostilos.gitvault.core.exception.AuthException} with kind
 * {@code STORAGE_CORRUPTED} (data cannot be authenticated or parsed) or
 * {@code STORAGE_UNAVAILABLE} (I/O failure, backend missing).
 */
public interface CredentialStore {

    /**
     * Stable name used in logs and to address the store in {@code storeCredential}.
     */
    String name();

    /**
     * @return an independent copy of the stored credential; the caller owns its secret buffers
     */
    Optional<Credential> get(CredentialKey key);

    /**
     * Insert or replace the credential for its key.
     */
    void set(Credential credential);

    /**
     * @return whether a credential existed for the key
     */
    boolean delete(CredentialKey key);

    /**
     * Snapshot of stored credentials with secret material stripped.
     */
    List<Credential> list();

    void clear();

    boolean isAvailable();

    default boolean isWritable() {
        return true;
    }
}
