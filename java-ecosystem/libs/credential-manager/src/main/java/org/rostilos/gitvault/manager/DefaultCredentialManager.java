package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.bridge.helper.CredentialHelper;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.exception.ValidationException;
import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.RepositoryKeys;
import org.rostilos.gitvault.store.CredentialStore;
import org.rostilos.gitvault.vcsauth.PlatformAuthenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default {@link CredentialManager}: resolves credentials from registered stores,
 * then credential helpers, then interactive platform logins.
 * <p>
 * Safe for concurrent use. Registration is expected to happen during startup but
 * may race with lookups; a lookup sees the sources registered when it started
 * iterating.
 */
public class DefaultCredentialManager implements CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultCredentialManager.class);

    private static final Comparator<Credential> LISTING_ORDER = Comparator
            .comparing(Credential::getPlatform)
            .thenComparing(Credential::getRepositoryKey);

    private final List<CredentialStore> stores = new CopyOnWriteArrayList<>();
    private final List<PlatformAuthenticator> authenticators = new CopyOnWriteArrayList<>();
    private final List<CredentialHelper> helpers = new CopyOnWriteArrayList<>();

    private final CredentialManagerSettings settings;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final InteractiveFlowRunner flowRunner;

    public DefaultCredentialManager() {
        this(CredentialManagerSettings.defaults());
    }

    public DefaultCredentialManager(CredentialManagerSettings settings) {
        this(settings, new InteractiveFlowRunner());
    }

    public DefaultCredentialManager(CredentialManagerSettings settings, InteractiveFlowRunner flowRunner) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.retryPolicy = settings.getRetryPolicy();
        this.clock = settings.getClock();
        this.flowRunner = Objects.requireNonNull(flowRunner, "flowRunner");
    }

    public CredentialManagerSettings getSettings() {
        return settings;
    }

    @Override
    public void registerStore(CredentialStore store) {
        stores.add(Objects.requireNonNull(store, "store"));
        log.debug("Registered credential store {} (position {})", store.name(), stores.size());
    }

    @Override
    public void registerAuthenticator(PlatformAuthenticator authenticator) {
        authenticators.add(Objects.requireNonNull(authenticator, "authenticator"));
        log.debug("Registered {} authenticator {}", authenticator.platform().getId(),
                authenticator.getClass().getSimpleName());
    }

    @Override
    public void registerCredentialHelper(CredentialHelper helper) {
        helpers.add(Objects.requireNonNull(helper, "helper"));
        log.debug("Registered credential helper {}", helper.name());
    }

    public List<CredentialStore> getStores() {
        return Collections.unmodifiableList(stores);
    }

    public List<PlatformAuthenticator> getAuthenticators() {
        return Collections.unmodifiableList(authenticators);
    }

    public List<CredentialHelper> getHelpers() {
        return Collections.unmodifiableList(helpers);
    }

    @Override
    public Credential getCredential(EPlatform platform, String repositoryKey) {
        return getCredential(AuthRequest.lookup(platform, repositoryKey));
    }

    @Override
    public Credential getCredential(String repositoryKey) {
        return getCredential(detectPlatform(repositoryKey), repositoryKey);
    }

    @Override
    public Credential getCredential(AuthRequest request) {
        Objects.requireNonNull(request, "request");
        CredentialKey key = request.key();
        ResolutionTrace trace = new ResolutionTrace(key);
        try {
            Optional<Credential> stored = resolveFromStores(key, trace);
            if (stored.isPresent()) {
                return stored.get();
            }

            Optional<Credential> fromHelper = resolveFromHelpers(key);
            if (fromHelper.isPresent()) {
                return fromHelper.get();
            }

            if (request.interactive()) {
                log.info("No stored credential for {}, starting login", key);
                return login(request).credential();
            }

            throw trace.exhausted();
        } catch (AuthException e) {
            trace.attachTo(e);
            throw e;
        } finally {
            trace.logSkippedStores(log);
        }
    }

    @Override
    public void storeCredential(Credential credential) {
        Objects.requireNonNull(credential, "credential");
        writeWithFallback(credential);
    }

    @Override
    public void storeCredential(Credential credential, String storeName) {
        Objects.requireNonNull(credential, "credential");
        CredentialStore target = stores.stream()
                .filter(store -> store.name().equals(storeName))
                .findFirst()
                .orElseThrow(() -> new ValidationException("storeName", "UNKNOWN_STORE",
                        "No credential store named '" + storeName + "' is registered"));
        if (!target.isAvailable() || !target.isWritable()) {
            throw new AuthException(EAuthErrorKind.STORAGE_UNAVAILABLE, "STORE_NOT_WRITABLE",
                    "Credential store '" + storeName + "' is not available for writing",
                    "Pick another store or leave the store unspecified");
        }
        write(target, credential);
    }

    @Override
    public boolean deleteCredential(EPlatform platform, String repositoryKey) {
        CredentialKey key = new CredentialKey(platform, repositoryKey);
        boolean deleted = false;
        int attempted = 0;
        int failed = 0;
        for (CredentialStore store : stores) {
            if (!store.isAvailable()) {
                continue;
            }
            attempted++;
            try {
                if (store.delete(key)) {
                    deleted = true;
                    log.info("Deleted credential {} from {}", key, store.name());
                }
            } catch (AuthException e) {
                failed++;
                log.warn("Could not delete {} from {}: {} ({})", key, store.name(), e.getMessage(), e.getCode());
            }
        }
        if (attempted > 0 && failed == attempted) {
            throw new AuthException(EAuthErrorKind.STORAGE_UNAVAILABLE, "DELETE_FAILED",
                    "Could not delete " + key + " from any credential store",
                    "Check that the credential file is readable and writable");
        }
        return deleted;
    }

    @Override
    public List<Credential> listCredentials() {
        Map<CredentialKey, Credential> merged = new LinkedHashMap<>();
        for (CredentialStore store : stores) {
            if (!store.isAvailable()) {
                continue;
            }
            List<Credential> listed;
            try {
                listed = store.list();
            } catch (AuthException e) {
                if (!e.getKind().isSourceFailure()) {
                    throw e;
                }
                log.warn("Skipping credential store {} in listing: {} ({})", store.name(), e.getMessage(), e.getCode());
                continue;
            }
            for (Credential credential : listed) {
                Credential stripped = credential.withoutSecret();
                credential.destroySecrets();
                merged.merge(stripped.getKey(), stripped,
                        (current, candidate) -> isNewer(candidate, current) ? candidate : current);
            }
        }
        List<Credential> result = new ArrayList<>(merged.values());
        result.sort(LISTING_ORDER);
        return result;
    }

    @Override
    public AuthResult authenticate(AuthRequest request) {
        Objects.requireNonNull(request, "request");
        CredentialKey key = request.key();
        List<PlatformAuthenticator> candidates = authenticatorsFor(request.platform());
        if (candidates.isEmpty()) {
            throw noAuthenticator(key);
        }
        PlatformAuthenticator validator = candidates.get(0);

        Optional<AuthResult> reused = reuseStored(key, validator, request.scopes());
        if (reused.isPresent()) {
            return reused.get();
        }
        Optional<AuthResult> adopted = adoptFromHelpers(key, validator, request.scopes());
        if (adopted.isPresent()) {
            return adopted.get();
        }

        AuthRequest interactive = request.interactive() ? request
                : new AuthRequest(request.platform(), request.repositoryKey(), request.method(), request.scopes(), true);
        return login(interactive);
    }

    @Override
    public void validateCredentials(EPlatform platform, String repositoryKey) {
        Credential credential = getCredential(platform, repositoryKey);
        try {
            verify(credential, authenticatorsFor(platform).stream().findFirst().orElse(null), credential.getScopes());
            log.info("Credential {} is valid", credential.getKey());
        } finally {
            credential.destroySecrets();
        }
    }

    @Override
    public Credential refreshCredential(EPlatform platform, String repositoryKey) {
        CredentialKey key = new CredentialKey(platform, repositoryKey);
        List<PlatformAuthenticator> candidates = authenticatorsFor(platform);
        if (candidates.isEmpty()) {
            throw noAuthenticator(key);
        }
        PlatformAuthenticator refresher = candidates.stream()
                .filter(PlatformAuthenticator::supportsRefresh)
                .findFirst()
                .orElse(candidates.get(0));

        ResolutionTrace trace = new ResolutionTrace(key);
        try {
            for (CredentialStore store : stores) {
                if (!store.isAvailable()) {
                    continue;
                }
                Optional<Credential> found = readStore(store, key, trace);
                if (found.isPresent()) {
                    Credential current = found.get();
                    try {
                        return refreshInto(store, current, refresher);
                    } finally {
                        current.destroySecrets();
                    }
                }
            }
            throw AuthException.notFound("CREDENTIAL_NOT_FOUND", "No stored credential for " + key + " to refresh",
                    "Run the login for " + platform.getId() + " first");
        } catch (AuthException e) {
            trace.attachTo(e);
            throw e;
        } finally {
            trace.logSkippedStores(log);
        }
    }

    @Override
    public EPlatform detectPlatform(String repositoryKey) {
        EPlatform detected = EPlatform.fromHost(RepositoryKeys.host(repositoryKey));
        return detected == EPlatform.GENERIC ? settings.getDefaultPlatform() : detected;
    }

    @Override
    public void close() {
        flowRunner.close();
    }

    private Optional<Credential> resolveFromStores(CredentialKey key, ResolutionTrace trace) {
        for (CredentialStore store : stores) {
            if (!store.isAvailable()) {
                log.debug("Credential store {} unavailable, skipping", store.name());
                continue;
            }
            Optional<Credential> found = readStore(store, key, trace);
            if (found.isEmpty()) {
                continue;
            }

            Credential credential = found.get();
            if (!credential.expiresWithin(settings.getRefreshSkew(), clock)) {
                log.debug("Resolved {} from store {}", key, store.name());
                return found;
            }

            Optional<Credential> refreshed = refreshStale(store, credential);
            if (refreshed.isPresent()) {
                credential.destroySecrets();
                return refreshed;
            }
            if (!credential.isExpired(clock)) {
                log.debug("Credential {} expires soon but is still valid, using it", key);
                return found;
            }
            log.info("Credential {} in {} has expired, continuing search", key, store.name());
            trace.expiredIn(store.name());
            credential.destroySecrets();
        }
        return Optional.empty();
    }

    private Optional<Credential> readStore(CredentialStore store, CredentialKey key, ResolutionTrace trace) {
        try {
            return store.get(key);
        } catch (AuthException e) {
            if (!e.getKind().isSourceFailure()) {
                throw e;
            }
            trace.storeFailed(store.name(), e);
            return Optional.empty();
        }
    }

    private Optional<Credential> refreshStale(CredentialStore store, Credential credential) {
        Optional<PlatformAuthenticator> refresher = authenticatorsFor(credential.getPlatform()).stream()
                .filter(PlatformAuthenticator::supportsRefresh)
                .findFirst();
        if (refresher.isEmpty()) {
            log.debug("No authenticator can refresh {}", credential.getKey());
            return Optional.empty();
        }
        if (credential.getRefreshToken().map(SecretValue::isEmpty).orElse(true)) {
            log.debug("Credential {} has no refresh token", credential.getKey());
            return Optional.empty();
        }
        try {
            return Optional.of(refreshInto(store, credential, refresher.get()));
        } catch (AuthException e) {
            log.warn("Refreshing {} failed: {} ({})", credential.getKey(), e.getMessage(), e.getCode());
            return Optional.empty();
        }
    }

    private Credential refreshInto(CredentialStore store, Credential current, PlatformAuthenticator refresher) {
        CredentialKey key = current.getKey();
        SecretValue refreshToken = current.getRefreshToken()
                .filter(token -> !token.isEmpty())
                .orElseThrow(() -> new AuthException(EAuthErrorKind.EXPIRED_TOKEN, "NO_REFRESH_TOKEN",
                        "Credential " + key + " has no refresh token",
                        "Run the login for " + key.platform().getId() + " again"));

        Credential fresh = retryPolicy.execute("Refreshing " + key,
                () -> refresher.refreshToken(key, refreshToken));
        Credential merged = mergeRefreshed(current, fresh);
        try {
            store.set(merged);
            log.info("Refreshed credential {} and wrote it back to {}", key, store.name());
        } catch (AuthException e) {
            log.warn("Refreshed credential {} could not be written back to {}: {} ({})",
                    key, store.name(), e.getMessage(), e.getCode());
        }
        return merged;
    }

    private Credential mergeRefreshed(Credential current, Credential fresh) {
        Map<String, String> metadata = new LinkedHashMap<>(current.getMetadata());
        metadata.remove(CredentialMetadata.EXPIRES_AT);
        metadata.putAll(fresh.getMetadata());
        return fresh.toBuilder()
                .key(current.getKey())
                .username(fresh.getUsername().orElse(current.getUsername().orElse(null)))
                .metadata(metadata)
                .createdAt(current.getCreatedAt() != null ? current.getCreatedAt() : clock.instant())
                .updatedAt(clock.instant())
                .build();
    }

    private Optional<Credential> resolveFromHelpers(CredentialKey key) {
        for (CredentialHelper helper : helpers) {
            Optional<Credential> found = queryHelper(helper, key);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Credential> queryHelper(CredentialHelper helper, CredentialKey key) {
        try {
            if (!helper.isAvailable()) {
                log.debug("Credential helper {} unavailable, skipping", helper.name());
                return Optional.empty();
            }
            Optional<Credential> found = helper.query(key);
            if (found.isPresent()) {
                log.info("Resolved {} from credential helper {}", key, helper.name());
            }
            return found;
        } catch (AuthException e) {
            if (!e.getKind().isSourceFailure()) {
                throw e;
            }
            log.debug("Credential helper {} failed for {}: {} ({})", helper.name(), key, e.getMessage(), e.getCode());
            return Optional.empty();
        }
    }

    private Optional<AuthResult> reuseStored(CredentialKey key, PlatformAuthenticator validator, List<String> scopes) {
        ResolutionTrace trace = new ResolutionTrace(key);
        Optional<Credential> stored;
        try {
            stored = resolveFromStores(key, trace);
        } finally {
            trace.logSkippedStores(log);
        }
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        Credential credential = stored.get();
        if (!passesValidation(credential, validator, scopes)) {
            credential.destroySecrets();
            return Optional.empty();
        }
        log.info("Reusing valid stored credential {}", key);
        return Optional.of(AuthResult.success(credential, "Using existing valid credentials"));
    }

    private Optional<AuthResult> adoptFromHelpers(CredentialKey key, PlatformAuthenticator validator, List<String> scopes) {
        for (CredentialHelper helper : helpers) {
            Optional<Credential> found = queryHelper(helper, key);
            if (found.isEmpty()) {
                continue;
            }
            Credential credential = found.get();
            if (!passesValidation(credential, validator, scopes)) {
                credential.destroySecrets();
                continue;
            }
            Credential persisted = persistLogin(credential);
            return Optional.of(AuthResult.success(persisted,
                    "Authenticated using " + helper.name() + " credential helper"));
        }
        return Optional.empty();
    }

    private boolean passesValidation(Credential credential, PlatformAuthenticator validator, List<String> scopes) {
        List<String> required = scopes == null || scopes.isEmpty() ? credential.getScopes() : scopes;
        try {
            verify(credential, validator, required);
            return true;
        } catch (AuthException e) {
            if (e.getKind() == EAuthErrorKind.CANCELED) {
                throw e;
            }
            log.info("Credential {} did not validate, falling back: {} ({})",
                    credential.getKey(), e.getMessage(), e.getCode());
            return false;
        }
    }

    /**
     * Expiry check, then the platform check when an authenticator is given.
     */
    private void verify(Credential credential, PlatformAuthenticator authenticator, List<String> requiredScopes) {
        CredentialKey key = credential.getKey();
        if (credential.isExpired(clock)) {
            throw new AuthException(EAuthErrorKind.EXPIRED_TOKEN, "CREDENTIAL_EXPIRED",
                    "Credential for " + key + " expired at "
                            + credential.getExpiresAt().map(Instant::toString).orElse("unknown"),
                    "Run the login for " + key.platform().getId() + " again");
        }
        if (authenticator == null) {
            log.debug("No {} authenticator registered, {} checked for expiry only", key.platform().getId(), key);
            return;
        }
        retryPolicy.execute("Validating " + key, () -> {
            authenticator.validateCredential(credential, requiredScopes);
            return null;
        });
    }

    private AuthResult login(AuthRequest request) {
        CredentialKey key = request.key();
        List<PlatformAuthenticator> candidates = authenticatorsFor(request.platform());
        if (candidates.isEmpty()) {
            throw noAuthenticator(key);
        }
        AuthRequest effective = request.method() != null ? request
                : request.withMethod(settings.preferredMethod(request.platform()).orElse(null));

        String lastMessage = null;
        for (PlatformAuthenticator authenticator : candidates) {
            String description = "Login to " + key;
            AuthResult result = flowRunner.run(description,
                    () -> retryPolicy.execute(description, () -> authenticator.authenticate(effective)),
                    settings.getInteractiveTimeout());
            if (result.success() && result.credential() != null) {
                persistLogin(result.credential());
                log.info("Logged in to {} with {}", key, result.method());
                return result;
            }
            lastMessage = result.message();
            log.info("{} declined login to {}: {}", authenticator.getClass().getSimpleName(), key, lastMessage);
        }
        throw AuthException.notFound("LOGIN_DECLINED",
                "No authenticator could log in to " + key + (lastMessage != null ? ": " + lastMessage : ""),
                "Pick another authentication method or store a token");
    }

    /**
     * @return the stamped credential, or the given one when no store took it
     */
    private Credential persistLogin(Credential credential) {
        try {
            return writeWithFallback(credential);
        } catch (AuthException e) {
            if (!e.getKind().isSourceFailure()) {
                throw e;
            }
            log.warn("Credential for {} is not persisted: {} ({})", credential.getKey(), e.getMessage(), e.getCode());
            return credential;
        }
    }

    /**
     * Write to the first writable store that accepts the credential, in registration order.
     */
    private Credential writeWithFallback(Credential credential) {
        CredentialKey key = credential.getKey();
        List<AuthException> failures = new ArrayList<>();
        for (CredentialStore store : stores) {
            if (!store.isAvailable() || !store.isWritable()) {
                continue;
            }
            try {
                return write(store, credential);
            } catch (AuthException e) {
                if (!e.getKind().isSourceFailure()) {
                    throw e;
                }
                failures.add(e);
                log.warn("Could not write {} to {}, trying the next store: {} ({})",
                        key, store.name(), e.getMessage(), e.getCode());
            }
        }
        if (failures.isEmpty()) {
            throw noWritableStore(key);
        }
        AuthException failed = new AuthException(EAuthErrorKind.STORAGE_UNAVAILABLE, "STORE_FAILED",
                "Could not write " + key + " to any credential store",
                "Check that the credential file is readable and writable");
        failures.forEach(failed::addSuppressed);
        throw failed;
    }

    private Credential write(CredentialStore store, Credential credential) {
        Instant now = clock.instant();
        Credential stamped = credential.toBuilder()
                .createdAt(credential.getCreatedAt() != null ? credential.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        store.set(stamped);
        log.info("Stored {} credential {} in {}", stamped.getMethod(), stamped.getKey(), store.name());
        return stamped;
    }

    private List<PlatformAuthenticator> authenticatorsFor(EPlatform platform) {
        List<PlatformAuthenticator> matching = new ArrayList<>();
        for (PlatformAuthenticator authenticator : authenticators) {
            if (authenticator.platform() == platform) {
                matching.add(authenticator);
            }
        }
        return matching;
    }

    private static boolean isNewer(Credential candidate, Credential current) {
        Instant candidateTime = candidate.getUpdatedAt() != null ? candidate.getUpdatedAt() : Instant.MIN;
        Instant currentTime = current.getUpdatedAt() != null ? current.getUpdatedAt() : Instant.MIN;
        return candidateTime.isAfter(currentTime);
    }

    private static AuthException noWritableStore(CredentialKey key) {
        return new AuthException(EAuthErrorKind.STORAGE_UNAVAILABLE, "NO_WRITABLE_STORE",
                "No writable credential store is available for " + key,
                "Configure a passphrase for the encrypted credential file");
    }

    private static AuthException noAuthenticator(CredentialKey key) {
        return AuthException.notFound("NO_AUTHENTICATOR",
                "No authenticator is registered for " + key.platform().getId(),
                "Store a token for " + key + " instead");
    }
}
