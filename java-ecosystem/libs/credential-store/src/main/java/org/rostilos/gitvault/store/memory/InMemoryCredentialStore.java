package org.rostilos.gitvault.store.memory;

import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.store.CredentialStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Holds defensive copies so callers destroying their
 * credentials do not affect stored ones.
 */
public class InMemoryCredentialStore implements CredentialStore {

    public static final String DEFAULT_NAME = "memory";

    private final String name;
    private final Map<CredentialKey, Credential> credentials = new ConcurrentHashMap<>();

    public InMemoryCredentialStore() {
        this(DEFAULT_NAME);
    }

    public InMemoryCredentialStore(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Credential> get(CredentialKey key) {
        Credential stored = credentials.get(key);
        return stored == null ? Optional.empty() : Optional.of(stored.deepCopy());
    }

    @Override
    public void set(Credential credential) {
        Credential previous = credentials.put(credential.getKey(), credential.deepCopy());
        if (previous != null) {
            previous.destroySecrets();
        }
    }

    @Override
    public boolean delete(CredentialKey key) {
        Credential removed = credentials.remove(key);
        if (removed == null) {
            return false;
        }
        removed.destroySecrets();
        return true;
    }

    @Override
    public List<Credential> list() {
        List<Credential> result = new ArrayList<>();
        for (Credential credential : credentials.values()) {
            result.add(credential.withoutSecret());
        }
        return result;
    }

    @Override
    public void clear() {
        for (CredentialKey key : List.copyOf(credentials.keySet())) {
            delete(key);
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
