package org.rostilos.gitvault.store.keychain;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.store.CredentialStore;
import org.rostilos.gitvault.store.StorageErrors;

import java.util.List;
import java.util.Optional;

/**
 * Placeholder for the operating system keychain. There is no native binding, so
 * the store always reports itself unavailable and resolution moves past it.
 */
public class KeychainCredentialStore implements CredentialStore {

    public static final String DEFAULT_NAME = "keychain";
    public static final String DEFAULT_SERVICE = "gitvault";

    private final String service;

    public KeychainCredentialStore() {
        this(DEFAULT_SERVICE);
    }

    public KeychainCredentialStore(String service) {
        this.service = service;
    }

    /**
     * Account name an OS keychain entry would be filed under.
     */
    public String makeKey(CredentialKey key) {
        return service + "." + key.platform().getId() + "." + key.repositoryKey();
    }

    @Override
    public String name() {
        return DEFAULT_NAME;
    }

    @Override
    public Optional<Credential> get(CredentialKey key) {
        throw notSupported();
    }

    @Override
    public void set(Credential credential) {
        throw notSupported();
    }

    @Override
    public boolean delete(CredentialKey key) {
        throw notSupported();
    }

    @Override
    public List<Credential> list() {
        throw notSupported();
    }

    @Override
    public void clear() {
        throw notSupported();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public boolean isWritable() {
        return false;
    }

    private AuthException notSupported() {
        return StorageErrors.unavailable(DEFAULT_NAME, "no keychain backend on this platform", null);
    }
}
