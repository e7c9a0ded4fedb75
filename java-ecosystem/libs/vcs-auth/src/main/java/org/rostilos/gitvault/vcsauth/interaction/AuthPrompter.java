package org.rostilos.gitvault.vcsauth.interaction;

import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;

/**
 * User interaction needed by login flows. The command layer supplies the terminal
 * implementation; flows run on a worker thread and may be interrupted while a
 * prompt is pending.
 * <p>
 * Implementations raise {@link org.rostilos.gitvault.core.exception.AuthException}
 * with kind {@code CANCELED} when the user aborts.
 */
public interface AuthPrompter {

    /**
     * Ask for a secret without echoing it.
     */
    SecretValue promptSecret(String prompt);

    String promptUsername(String prompt);

    /**
     * @return the code as typed; validated by the caller
     */
    String promptTwoFactorCode(TwoFactorChallenge challenge);

    /**
     * Show the user code and verification page of an OAuth device authorization.
     */
    void notifyDeviceCode(DeviceCodePrompt prompt);
}
