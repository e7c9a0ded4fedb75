package org.rostilos.gitvault.vcsauth.oauth;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.util.Sleeper;
import org.rostilos.gitvault.vcsauth.interaction.AuthPrompter;
import org.rostilos.gitvault.vcsauth.interaction.DeviceCodePrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * OAuth 2.0 device authorization grant (RFC 8628): show the user a code, then poll
 * the token endpoint until the user approves, denies, or the code expires.
 */
public class DeviceAuthorizationFlow {

    private static final Logger log = LoggerFactory.getLogger(DeviceAuthorizationFlow.class);

    static final Duration SLOW_DOWN_INCREMENT = Duration.ofSeconds(5);

    private final EPlatform platform;
    private final OAuthTokenEndpoint endpoint;
    private final AuthPrompter prompter;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration minimumInterval;

    public DeviceAuthorizationFlow(EPlatform platform, OAuthTokenEndpoint endpoint, AuthPrompter prompter,
                                   Clock clock, Sleeper sleeper, Duration minimumInterval) {
        this.platform = platform;
        this.endpoint = endpoint;
        this.prompter = prompter;
        this.clock = clock;
        this.sleeper = sleeper;
        this.minimumInterval = minimumInterval != null ? minimumInterval : Duration.ZERO;
    }

    public OAuthTokenResponse run(String deviceCodeUrl, String tokenUrl, String clientId, List<String> scopes)
            throws IOException {
        DeviceCodeResponse deviceCode = endpoint.requestDeviceCode(deviceCodeUrl, clientId, scopes);
        prompter.notifyDeviceCode(new DeviceCodePrompt(
                deviceCode.userCode(), deviceCode.verificationUri(), deviceCode.expiresIn()));

        Instant deadline = clock.instant().plus(deviceCode.expiresIn());
        Duration interval = max(deviceCode.interval(), minimumInterval);
        log.info("Waiting for {} device authorization (polling every {}s)", platform.getId(), interval.toSeconds());

        while (true) {
            if (!clock.instant().isBefore(deadline)) {
                throw expired();
            }
            pause(interval);

            DevicePollResult result = endpoint.pollDeviceToken(tokenUrl, clientId, deviceCode.deviceCode());
            if (result.isComplete()) {
                log.info("{} device authorization approved", platform.getId());
                return result.token();
            }
            switch (result.error()) {
                case "authorization_pending" -> log.debug("Device authorization still pending");
                case "slow_down" -> {
                    interval = interval.plus(SLOW_DOWN_INCREMENT);
                    log.debug("Server asked to slow down, polling every {}s", interval.toSeconds());
                }
                case "expired_token" -> throw expired();
                case "access_denied" -> throw new AuthException(EAuthErrorKind.CANCELED,
                        platform.name() + "_ACCESS_DENIED",
                        "The device authorization was denied",
                        "Approve the request in the browser to continue");
                default -> throw new AuthException(EAuthErrorKind.INVALID_CREDENTIALS,
                        platform.name() + "_DEVICE_FLOW_ERROR",
                        "Device authorization failed: " + result.error(),
                        "Check the OAuth application configuration");
            }
        }
    }

    private void pause(Duration interval) {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(EAuthErrorKind.CANCELED,
                    "LOGIN_INTERRUPTED",
                    "Device authorization was interrupted",
                    null,
                    e);
        }
    }

    private AuthException expired() {
        return new AuthException(EAuthErrorKind.EXPIRED_TOKEN,
                platform.name() + "_DEVICE_CODE_EXPIRED",
                "The device code expired before the authorization was approved",
                "Run the login again and approve it before the code expires");
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
