package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * What one resolution ran into on its way: stores that failed and stores that
 * only held expired credentials.
 */
final class ResolutionTrace {

    private final CredentialKey key;
    private final List<String> failedStores = new ArrayList<>();
    private final List<AuthException> storeFailures = new ArrayList<>();
    private final List<String> expiredIn = new ArrayList<>();

    ResolutionTrace(CredentialKey key) {
        this.key = key;
    }

    void storeFailed(String storeName, AuthException failure) {
        failedStores.add(storeName + " (" + failure.getCode() + ")");
        storeFailures.add(failure);
    }

    void expiredIn(String storeName) {
        expiredIn.add(storeName);
    }

    boolean hasExpiredHits() {
        return !expiredIn.isEmpty();
    }

    /**
     * Terminal error when every source came up empty.
     */
    AuthException exhausted() {
        String login = "Run the login for " + key.platform().getId() + " (" + key.repositoryKey()
                + ") or store a token for it";
        if (hasExpiredHits()) {
            return new AuthException(EAuthErrorKind.EXPIRED_TOKEN, "CREDENTIAL_EXPIRED",
                    "Stored credential for " + key + " has expired and could not be refreshed", login);
        }
        return AuthException.notFound("CREDENTIAL_NOT_FOUND", "No credential found for " + key, login);
    }

    void attachTo(AuthException terminal) {
        for (AuthException failure : storeFailures) {
            if (failure != terminal) {
                terminal.addSuppressed(failure);
            }
        }
    }

    void logSkippedStores(Logger log) {
        if (!failedStores.isEmpty()) {
            log.warn("Skipped {} unreadable credential store(s) while resolving {}: {}",
                    failedStores.size(), key, String.join(", ", failedStores));
        }
    }
}
