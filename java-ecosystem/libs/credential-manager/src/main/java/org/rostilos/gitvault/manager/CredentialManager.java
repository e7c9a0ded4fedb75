package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.bridge.helper.CredentialHelper;
import org.rostilos.gitvault.core.model.AuthRequest;
import org.rostilos.gitvault.core.model.AuthResult;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.store.CredentialStore;
import org.rostilos.gitvault.vcsauth.PlatformAuthenticator;

import java.util.List;

/**
 * Entry point of the credential subsystem for the command layer.
 * <p>
 * Sources are consulted in registration order: stores first, then external
 * credential helpers, then (for interactive requests) platform authenticators.
 * Failures are raised as {@link org.rostilos.gitvault.core.exception.AuthException}
 * or {@link org.rostilos.gitvault.core.exception.ValidationException}.
 */
public interface CredentialManager extends AutoCloseable {

    void registerStore(CredentialStore store);

    void registerAuthenticator(PlatformAuthenticator authenticator);

    void registerCredentialHelper(CredentialHelper helper);

    Credential getCredential(EPlatform platform, String repositoryKey);

    /**
     * Resolve a credential for the request, running a login when the request is
     * interactive and no source has one.
     */
    Credential getCredential(AuthRequest request);

    /**
     * Resolve a credential for a repository key, detecting the platform from its host.
     */
    Credential getCredential(String repositoryKey);

    /**
     * Persist into the first available writable store, falling back to the next
     * writable store when a write fails.
     */
    void storeCredential(Credential credential);

    void storeCredential(Credential credential, String storeName);

    /**
     * @return whether any store held the credential
     */
    boolean deleteCredential(EPlatform platform, String repositoryKey);

    /**
     * @return credentials of all available stores without their secrets
     */
    List<Credential> listCredentials();

    /**
     * Authenticate for the request's platform: reuse a stored credential that still
     * validates, otherwise adopt and persist a helper credential that validates,
     * otherwise run the login and persist its result.
     */
    AuthResult authenticate(AuthRequest request);

    /**
     * Resolve the stored credential and check it is unexpired and still accepted
     * by the platform.
     */
    void validateCredentials(EPlatform platform, String repositoryKey);

    /**
     * Refresh a stored credential now and write it back to its store.
     */
    Credential refreshCredential(EPlatform platform, String repositoryKey);

    EPlatform detectPlatform(String repositoryKey);

    @Override
    void close();
}
