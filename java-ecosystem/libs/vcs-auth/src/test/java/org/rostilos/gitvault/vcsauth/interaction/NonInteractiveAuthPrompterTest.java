package org.rostilos.gitvault.vcsauth.interaction;

import org.junit.jupiter.api.Test;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.ETwoFactorMethod;
import org.rostilos.gitvault.core.model.TwoFactorChallenge;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NonInteractiveAuthPrompterTest {

    private final NonInteractiveAuthPrompter prompter = new NonInteractiveAuthPrompter();

    @Test
    void testEveryPrompt_ThrowsCanceled() {
        assertThatThrownBy(() -> prompter.promptSecret("token"))
                .isInstanceOf(AuthException.class)
                .extracting("kind").isEqualTo(EAuthErrorKind.CANCELED);
        assertThatThrownBy(() -> prompter.promptUsername("user"))
                .isInstanceOf(AuthException.class)
                .extracting("code").isEqualTo("NON_INTERACTIVE");
        assertThatThrownBy(() -> prompter.promptTwoFactorCode(TwoFactorChallenge.of(ETwoFactorMethod.TOTP, "code")))
                .isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> prompter.notifyDeviceCode(
                new DeviceCodePrompt("ABCD", "https://example.com/device", Duration.ofMinutes(15))))
                .isInstanceOf(AuthException.class);
    }
}
