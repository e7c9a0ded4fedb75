package org.rostilos.gitvault.bridge.helper;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;

import java.util.Optional;

/**
 * An external credential source outside our control: git's own helper chain or a
 * platform CLI. Results are handed out as is and never persisted by the manager.
 */
public interface CredentialHelper {

    String name();

    boolean isAvailable();

    /**
     * @return the credential the helper knows for the key, or empty when it has none
     * @throws AuthException with kind {@code HELPER_UNAVAILABLE} when the helper cannot be run
     */
    Optional<Credential> query(CredentialKey key);

    default boolean isWritable() {
        return false;
    }

    default void store(Credential credential) {
        throw readOnly();
    }

    default boolean erase(CredentialKey key) {
        throw readOnly();
    }

    private AuthException readOnly() {
        return new AuthException(EAuthErrorKind.HELPER_UNAVAILABLE,
                "HELPER_READ_ONLY",
                "Credential helper '" + name() + "' is read-only",
                "Manage these credentials with the tool that owns them");
    }
}
