package org.rostilos.gitvault.vcsauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.gitvault.bridge.sshagent.SshAgentClient;
import org.rostilos.gitvault.core.util.Sleeper;
import org.rostilos.gitvault.vcsauth.http.AuthorizedHttpClientFactory;
import org.rostilos.gitvault.vcsauth.interaction.AuthPrompter;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by all platform authenticators.
 */
public record AuthenticatorContext(
        AuthPrompter prompter,
        SshAgentClient sshAgent,
        AuthorizedHttpClientFactory httpClientFactory,
        ObjectMapper objectMapper,
        Clock clock,
        Sleeper sleeper
) {

    public AuthenticatorContext {
        Objects.requireNonNull(prompter, "prompter");
        Objects.requireNonNull(httpClientFactory, "httpClientFactory");
        Objects.requireNonNull(objectMapper, "objectMapper");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(sleeper, "sleeper");
    }

    public static AuthenticatorContext of(AuthPrompter prompter, SshAgentClient sshAgent) {
        return new AuthenticatorContext(prompter, sshAgent, new AuthorizedHttpClientFactory(),
                new ObjectMapper(), Clock.systemUTC(), Sleeper.threadSleeper());
    }

    public AuthenticatorContext withPrompter(AuthPrompter newPrompter) {
        return new AuthenticatorContext(newPrompter, sshAgent, httpClientFactory, objectMapper, clock, sleeper);
    }
}
