package org.rostilos.gitvault.bridge.helper;

import org.rostilos.gitvault.bridge.process.ProcessResult;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.util.RepositoryKeys;
import org.rostilos.gitvault.core.util.RepositoryLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bridge to git's configured credential helper chain via
 * {@code git credential fill|approve|reject}.
 */
public class GitCredentialHelper extends AbstractProcessCredentialHelper {

    private static final Logger log = LoggerFactory.getLogger(GitCredentialHelper.class);

    public static final String NAME = "git-credential";

    // Never let git fall back to asking on the terminal
    private static final Map<String, String> NON_INTERACTIVE_ENV = Map.of(
            "GIT_TERMINAL_PROMPT", "0",
            "GCM_INTERACTIVE", "never"
    );

    public GitCredentialHelper(ProcessRunner processRunner) {
        this(processRunner, DEFAULT_TIMEOUT);
    }

    public GitCredentialHelper(ProcessRunner processRunner, Duration timeout) {
        super(processRunner, timeout);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String executable() {
        return "git";
    }

    @Override
    public Optional<Credential> query(CredentialKey key) {
        RepositoryLocation location = RepositoryKeys.parse(key.repositoryKey());
        byte[] request = GitCredentialProtocol.encode(location, null, null);

        ProcessResult result = execute(List.of("git", "credential", "fill"), request, NON_INTERACTIVE_ENV);
        try {
            if (!result.isSuccess()) {
                // git exits non-zero when no helper had an answer and prompting is disabled
                log.debug("git credential fill found nothing for {} (exit {})", key, result.getExitCode());
                return Optional.empty();
            }

            GitCredentialProtocol.Response response = GitCredentialProtocol.parse(result.getStdout());
            if (!response.hasPassword()) {
                log.debug("git credential fill returned no password for {}", key);
                return Optional.empty();
            }

            Credential.Builder builder = Credential.builder()
                    .key(key)
                    .method(EAuthMethod.TOKEN)
                    .secret(response.password())
                    .refreshToken(response.refreshToken())
                    .username(response.attribute(GitCredentialProtocol.USERNAME))
                    .metadata(CredentialMetadata.SOURCE, NAME);
            expiry(response).ifPresent(builder::expiresAt);
            return Optional.of(builder.build());
        } finally {
            result.wipe();
        }
    }

    @Override
    public boolean isWritable() {
        return true;
    }

    @Override
    public void store(Credential credential) {
        RepositoryLocation location = RepositoryKeys.parse(credential.getRepositoryKey());
        byte[] request = GitCredentialProtocol.encode(location,
                credential.getUsername().orElse(defaultUsername(credential)),
                credential.getSecret());
        try {
            ProcessResult result = execute(List.of("git", "credential", "approve"), request, NON_INTERACTIVE_ENV);
            if (!result.isSuccess()) {
                throw new AuthException(EAuthErrorKind.HELPER_UNAVAILABLE,
                        "GIT_CREDENTIAL_STORE_ERROR",
                        "Failed to store credentials in git credential helper: " + result.stderrSummary());
            }
        } finally {
            Arrays.fill(request, (byte) 0);
        }
    }

    @Override
    public boolean erase(CredentialKey key) {
        byte[] request = GitCredentialProtocol.encode(RepositoryKeys.parse(key.repositoryKey()), null, null);
        ProcessResult result = execute(List.of("git", "credential", "reject"), request, NON_INTERACTIVE_ENV);
        return result.isSuccess();
    }

    private static Optional<Instant> expiry(GitCredentialProtocol.Response response) {
        String raw = response.attribute(GitCredentialProtocol.PASSWORD_EXPIRY_UTC);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(raw.trim())));
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed password_expiry_utc value");
            return Optional.empty();
        }
    }

    /**
     * Hosting platforms accept any username with a token; git helpers need one to file the entry.
     */
    private static String defaultUsername(Credential credential) {
        return switch (credential.getPlatform()) {
            case GITLAB -> "oauth2";
            case BITBUCKET -> "x-token-auth";
            default -> "x-access-token";
        };
    }
}
