package org.rostilos.gitvault.bridge.helper;

import org.rostilos.gitvault.bridge.process.ProcessResult;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.RepositoryKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the token the GitLab CLI ({@code glab}) holds for a host.
 */
public class GitLabCliCredentialHelper extends AbstractProcessCredentialHelper {

    private static final Logger log = LoggerFactory.getLogger(GitLabCliCredentialHelper.class);

    public static final String NAME = "gitlab-cli";

    public GitLabCliCredentialHelper(ProcessRunner processRunner) {
        this(processRunner, DEFAULT_TIMEOUT);
    }

    public GitLabCliCredentialHelper(ProcessRunner processRunner, Duration timeout) {
        super(processRunner, timeout);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String executable() {
        return "glab";
    }

    @Override
    public Optional<Credential> query(CredentialKey key) {
        if (key.platform() != EPlatform.GITLAB) {
            return Optional.empty();
        }
        String host = RepositoryKeys.host(key.repositoryKey());

        ProcessResult result = execute(List.of("glab", "config", "get", "token", "--host", host), null, Map.of("NO_PROMPT", "1"));
        SecretValue token;
        try {
            if (!result.isSuccess()) {
                log.debug("glab has no token for {} (exit {})", host, result.getExitCode());
                return Optional.empty();
            }
            token = SecretValue.wrap(trimmed(result.getStdout()));
        } finally {
            result.wipe();
        }
        if (token.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(Credential.builder()
                .key(key)
                .method(EAuthMethod.TOKEN)
                .secret(token)
                .metadata(CredentialMetadata.SOURCE, NAME)
                .build());
    }
}
