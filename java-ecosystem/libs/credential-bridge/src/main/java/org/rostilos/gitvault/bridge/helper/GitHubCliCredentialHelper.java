package org.rostilos.gitvault.bridge.helper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.gitvault.bridge.process.ProcessResult;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.RepositoryKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the token the GitHub CLI ({@code gh}) holds for a host.
 */
public class GitHubCliCredentialHelper extends AbstractProcessCredentialHelper {

    private static final Logger log = LoggerFactory.getLogger(GitHubCliCredentialHelper.class);

    public static final String NAME = "github-cli";

    private static final Map<String, String> NON_INTERACTIVE_ENV = Map.of("GH_PROMPT_DISABLED", "1");

    private final ObjectMapper objectMapper;

    public GitHubCliCredentialHelper(ProcessRunner processRunner) {
        this(processRunner, DEFAULT_TIMEOUT, new ObjectMapper());
    }

    public GitHubCliCredentialHelper(ProcessRunner processRunner, Duration timeout, ObjectMapper objectMapper) {
        super(processRunner, timeout);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String executable() {
        return "gh";
    }

    @Override
    public Optional<Credential> query(CredentialKey key) {
        if (key.platform() != EPlatform.GITHUB) {
            return Optional.empty();
        }
        String host = RepositoryKeys.host(key.repositoryKey());

        ProcessResult result = execute(List.of("gh", "auth", "token", "--hostname", host), null, NON_INTERACTIVE_ENV);
        SecretValue token;
        try {
            if (!result.isSuccess()) {
                log.debug("gh has no token for {} (exit {})", host, result.getExitCode());
                return Optional.empty();
            }
            token = SecretValue.wrap(trimmed(result.getStdout()));
        } finally {
            result.wipe();
        }
        if (token.isEmpty()) {
            return Optional.empty();
        }

        Credential.Builder builder = Credential.builder()
                .key(key)
                .method(EAuthMethod.TOKEN)
                .secret(token)
                .metadata(CredentialMetadata.SOURCE, NAME);
        lookupUser(host).ifPresent(user -> {
            builder.username(user.path("login").asText(null));
            if (user.hasNonNull("id")) {
                builder.metadata(CredentialMetadata.USER_ID, user.get("id").asText());
            }
        });
        return Optional.of(builder.build());
    }

    /**
     * The username is optional decoration; failures are logged and ignored.
     */
    private Optional<JsonNode> lookupUser(String host) {
        try {
            ProcessResult result = execute(List.of("gh", "api", "user", "--hostname", host), null, NON_INTERACTIVE_ENV);
            if (!result.isSuccess()) {
                log.debug("gh api user failed for {}: {}", host, result.stderrSummary());
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(result.getStdout()));
        } catch (AuthException | IOException e) {
            log.debug("Could not resolve GitHub user for {}: {}", host, e.getMessage());
            return Optional.empty();
        }
    }
}
