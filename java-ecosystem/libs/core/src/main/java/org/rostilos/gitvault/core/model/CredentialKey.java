package org.rostilos.gitvault.core.model;

import java.util.Objects;

/**
 * Identity of a credential: one platform plus one repository key. The repository
 * key is opaque to stores; it is usually a host ("github.com") or a host with a
 * path ("github.com/org/repo").
 */
public record CredentialKey(EPlatform platform, String repositoryKey) {

    public CredentialKey {
        Objects.requireNonNull(platform, "platform");
        if (repositoryKey == null || repositoryKey.isBlank()) {
            throw new IllegalArgumentException("Repository key cannot be null or empty");
        }
        repositoryKey = repositoryKey.trim();
    }

    public static CredentialKey of(EPlatform platform, String repositoryKey) {
        return new CredentialKey(platform, repositoryKey);
    }

    /**
     * Storage form used as the map key in persisted credential sets.
     */
    public String asStorageKey() {
        return platform.getId() + "/" + repositoryKey;
    }

    @Override
    public String toString() {
        return asStorageKey();
    }
}
