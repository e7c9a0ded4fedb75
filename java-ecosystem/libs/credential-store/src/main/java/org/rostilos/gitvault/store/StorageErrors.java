package org.rostilos.gitvault.store;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;

/**
 * Factory for the storage failures shared by all stores.
 */
public final class StorageErrors {

    private StorageErrors() {
        // Utility class
    }

    public static AuthException corrupted(String storeName, Throwable cause) {
        return new AuthException(
                EAuthErrorKind.STORAGE_CORRUPTED,
                "STORE_CORRUPTED",
                "Credential store '" + storeName + "' could not be decrypted or parsed",
                "Check the store passphrase, or remove the store file to start over",
                cause);
    }

    public static AuthException unavailable(String storeName, String reason, Throwable cause) {
        return new AuthException(
                EAuthErrorKind.STORAGE_UNAVAILABLE,
                "STORE_UNAVAILABLE",
                "Credential store '" + storeName + "' is unavailable: " + reason,
                "Check that the store location exists and is writable",
                cause);
    }
}
