package org.rostilos.gitvault.vcsauth.interaction;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;

/**
 * Prompter for headless runs: every prompt is canceled.
 */
public class NonInteractiveAuthPrompter implements AuthPrompter {

    @Override
    public SecretValue promptSecret(String prompt) {
        throw canceled();
    }

    @Override
    public String promptUsername(String prompt) {
        throw canceled();
    }

    @Override
    public String promptTwoFactorCode(TwoFactorChallenge challenge) {
        throw canceled();
    }

    @Override
    public void notifyDeviceCode(DeviceCodePrompt prompt) {
        throw canceled();
    }

    private static AuthException canceled() {
        return new AuthException(EAuthErrorKind.CANCELED,
                "NON_INTERACTIVE",
                "Interactive input is not available",
                "Store a credential first, or run the command in a terminal");
    }
}
