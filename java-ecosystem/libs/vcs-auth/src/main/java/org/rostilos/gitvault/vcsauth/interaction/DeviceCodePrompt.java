package org.rostilos.gitvault.vcsauth.interaction;

import java.time.Duration;

/**
 * What the user needs to complete a device authorization in the browser.
 */
public record DeviceCodePrompt(String userCode, String verificationUri, Duration expiresIn) {
}
