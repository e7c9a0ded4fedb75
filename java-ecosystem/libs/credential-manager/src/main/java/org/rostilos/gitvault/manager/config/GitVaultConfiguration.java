package org.rostilos.gitvault.manager.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.gitvault.bridge.helper.GitCredentialHelper;
import org.rostilos.gitvault.bridge.helper.GitHubCliCredentialHelper;
import org.rostilos.gitvault.bridge.helper.GitLabCliCredentialHelper;
import org.rostilos.gitvault.bridge.process.DefaultProcessRunner;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.bridge.sshagent.SshAgentClient;
import org.rostilos.gitvault.bridge.sshagent.UnixSocketSshAgentClient;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.Sleeper;
import org.rostilos.gitvault.manager.CredentialManager;
import org.rostilos.gitvault.manager.CredentialManagerSettings;
import org.rostilos.gitvault.manager.DefaultCredentialManager;
import org.rostilos.gitvault.manager.RetryPolicy;
import org.rostilos.gitvault.security.crypto.CredentialEncryptionService;
import org.rostilos.gitvault.security.crypto.KdfParameters;
import org.rostilos.gitvault.store.file.EncryptedFileCredentialStore;
import org.rostilos.gitvault.store.keychain.KeychainCredentialStore;
import org.rostilos.gitvault.store.memory.InMemoryCredentialStore;
import org.rostilos.gitvault.vcsauth.AuthenticatorContext;
import org.rostilos.gitvault.vcsauth.AuthenticatorSettings;
import org.rostilos.gitvault.vcsauth.bitbucket.BitbucketAuthenticator;
import org.rostilos.gitvault.vcsauth.generic.GenericAuthenticator;
import org.rostilos.gitvault.vcsauth.github.GitHubAuthenticator;
import org.rostilos.gitvault.vcsauth.gitlab.GitLabAuthenticator;
import org.rostilos.gitvault.vcsauth.http.AuthorizedHttpClientFactory;
import org.rostilos.gitvault.vcsauth.interaction.AuthPrompter;
import org.rostilos.gitvault.vcsauth.interaction.NonInteractiveAuthPrompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Wires a {@link CredentialManager} from {@code gitvault.*} properties.
 * <p>
 * Resolution order: the OS keychain, then the encrypted credential file (or an
 * in-memory store when no passphrase is configured), then git / gh / glab
 * helpers. Per-platform authenticator settings are read from
 * {@code gitvault.<platform>.*}.
 */
@Configuration
public class GitVaultConfiguration implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(GitVaultConfiguration.class);

    @Value("${gitvault.store.file:${user.home}/.gitvault/credentials.enc}")
    private String storeFile;

    @Value("${gitvault.store.passphrase:}")
    private String storePassphrase;

    @Value("${gitvault.store.kdf.iterations:2}")
    private int kdfIterations;

    @Value("${gitvault.store.kdf.memory-kib:19456}")
    private int kdfMemoryKib;

    @Value("${gitvault.store.kdf.parallelism:1}")
    private int kdfParallelism;

    @Value("${gitvault.interactive-timeout-seconds:120}")
    private long interactiveTimeoutSeconds;

    @Value("${gitvault.external-timeout-seconds:5}")
    private long externalTimeoutSeconds;

    @Value("${gitvault.refresh-skew-seconds:300}")
    private long refreshSkewSeconds;

    @Value("${gitvault.retry.max-attempts:3}")
    private int retryMaxAttempts;

    @Value("${gitvault.retry.initial-backoff-millis:500}")
    private long retryInitialBackoffMillis;

    @Value("${gitvault.default-platform:generic}")
    private String defaultPlatform;

    @Value("${gitvault.helpers.enabled:true}")
    private boolean helpersEnabled;

    @Value("${gitvault.verify-tokens:true}")
    private boolean verifyTokens;

    private final Environment environment;
    private CredentialEncryptionService encryptionService;

    public GitVaultConfiguration(Environment environment) {
        this.environment = environment;
    }

    @Bean
    public static PropertySourcesPlaceholderConfigurer gitVaultPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public CredentialManagerSettings credentialManagerSettings() {
        CredentialManagerSettings.Builder builder = CredentialManagerSettings.builder()
                .interactiveTimeout(Duration.ofSeconds(interactiveTimeoutSeconds))
                .externalCallTimeout(Duration.ofSeconds(externalTimeoutSeconds))
                .refreshSkew(Duration.ofSeconds(refreshSkewSeconds))
                .retryPolicy(new RetryPolicy(retryMaxAttempts, Duration.ofMillis(retryInitialBackoffMillis),
                        RetryPolicy.DEFAULT_MULTIPLIER, Sleeper.threadSleeper()))
                .defaultPlatform(EPlatform.fromId(defaultPlatform));
        for (EPlatform platform : EPlatform.values()) {
            String method = platformProperty(platform, "preferred-method");
            if (method != null) {
                builder.preferredMethod(platform, EAuthMethod.fromId(method));
            }
        }
        return builder.build();
    }

    @Bean
    public ProcessRunner gitVaultProcessRunner() {
        return new DefaultProcessRunner();
    }

    @Bean
    public SshAgentClient sshAgentClient(CredentialManagerSettings settings) {
        return new UnixSocketSshAgentClient(System.getenv(), settings.getExternalCallTimeout());
    }

    @Bean
    public AuthorizedHttpClientFactory authorizedHttpClientFactory() {
        return new AuthorizedHttpClientFactory();
    }

    @Bean(destroyMethod = "close")
    public CredentialManager credentialManager(CredentialManagerSettings settings,
                                               ProcessRunner gitVaultProcessRunner,
                                               SshAgentClient sshAgentClient,
                                               AuthorizedHttpClientFactory authorizedHttpClientFactory,
                                               ObjectProvider<AuthPrompter> prompterProvider) {
        DefaultCredentialManager manager = new DefaultCredentialManager(settings);

        manager.registerStore(new KeychainCredentialStore());
        if (storePassphrase == null || storePassphrase.isEmpty()) {
            log.warn("gitvault.store.passphrase is not set, credentials are kept in memory for this process only");
            manager.registerStore(new InMemoryCredentialStore());
        } else {
            char[] passphrase = storePassphrase.toCharArray();
            try {
                encryptionService = new CredentialEncryptionService(passphrase,
                        new KdfParameters(kdfIterations, kdfMemoryKib, kdfParallelism));
            } finally {
                Arrays.fill(passphrase, '\0');
            }
            manager.registerStore(new EncryptedFileCredentialStore(Path.of(storeFile), encryptionService));
        }

        ObjectMapper objectMapper = new ObjectMapper();
        if (helpersEnabled) {
            Duration timeout = settings.getExternalCallTimeout();
            manager.registerCredentialHelper(new GitCredentialHelper(gitVaultProcessRunner, timeout));
            manager.registerCredentialHelper(new GitHubCliCredentialHelper(gitVaultProcessRunner, timeout, objectMapper));
            manager.registerCredentialHelper(new GitLabCliCredentialHelper(gitVaultProcessRunner, timeout));
        }

        AuthPrompter prompter = prompterProvider.getIfAvailable(NonInteractiveAuthPrompter::new);
        AuthenticatorContext context = new AuthenticatorContext(prompter, sshAgentClient, authorizedHttpClientFactory,
                objectMapper, settings.getClock(), Sleeper.threadSleeper());
        manager.registerAuthenticator(new GitHubAuthenticator(authenticatorSettings(EPlatform.GITHUB), context));
        manager.registerAuthenticator(new GitLabAuthenticator(authenticatorSettings(EPlatform.GITLAB), context));
        manager.registerAuthenticator(new BitbucketAuthenticator(authenticatorSettings(EPlatform.BITBUCKET), context));
        manager.registerAuthenticator(new GenericAuthenticator(authenticatorSettings(EPlatform.GENERIC), context));

        log.info("Credential manager ready with {} store(s), {} helper(s), {} authenticator(s)",
                manager.getStores().size(), manager.getHelpers().size(), manager.getAuthenticators().size());
        return manager;
    }

    AuthenticatorSettings authenticatorSettings(EPlatform platform) {
        AuthenticatorSettings.Builder builder = AuthenticatorSettings.builder()
                .apiBaseUrl(platformProperty(platform, "api-url"))
                .webBaseUrl(platformProperty(platform, "web-url"))
                .oauthClientId(platformProperty(platform, "oauth-client-id"))
                .verifyTokens(verifyTokens);

        String clientSecret = platformProperty(platform, "oauth-client-secret");
        if (clientSecret != null) {
            builder.oauthClientSecret(SecretValue.of(clientSecret));
        }
        String totpSeed = platformProperty(platform, "totp-seed");
        if (totpSeed != null) {
            builder.totpSeed(SecretValue.of(totpSeed));
        }
        String scopes = platformProperty(platform, "scopes");
        if (scopes != null) {
            builder.defaultScopes(splitList(scopes));
        }
        String method = platformProperty(platform, "default-method");
        if (method != null) {
            builder.defaultMethod(EAuthMethod.fromId(method));
        }
        return builder.build();
    }

    private String platformProperty(EPlatform platform, String name) {
        String value = environment.getProperty("gitvault." + platform.getId() + "." + name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public void destroy() {
        if (encryptionService != null) {
            encryptionService.destroy();
        }
    }
}
