package org.rostilos.gitvault.bridge.helper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.gitvault.bridge.process.ProcessResult;
import org.rostilos.gitvault.bridge.process.ProcessRunner;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EPlatform;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GitHubCliCredentialHelperTest {

    private static final List<String> AUTH_TOKEN = List.of("gh", "auth", "token", "--hostname", "github.com");
    private static final List<String> API_USER = List.of("gh", "api", "user", "--hostname", "github.com");

    @Mock
    private ProcessRunner processRunner;

    private GitHubCliCredentialHelper helper;

    @BeforeEach
    void setUp() {
        helper = new GitHubCliCredentialHelper(processRunner, Duration.ofSeconds(1), new ObjectMapper());
    }

    @Test
    void testQuery_TokenAndUser_ReturnsCredentialWithLogin() throws IOException {
        when(processRunner.run(eq(AUTH_TOKEN), any(), anyMap(), any(Duration.class)))
                .thenReturn(result(0, "gho_cli_token\n"));
        when(processRunner.run(eq(API_USER), any(), anyMap(), any(Duration.class)))
                .thenReturn(result(0, "{\"login\":\"octocat\",\"id\":583231,\"name\":\"The Octocat\"}"));

        Credential credential = helper.query(CredentialKey.of(EPlatform.GITHUB, "github.com/org/repo")).orElseThrow();

        assertThat(credential.getSecret().reveal()).isEqualTo("gho_cli_token");
        assertThat(credential.getUsername()).contains("octocat");
        assertThat(credential.getMetadata())
                .containsEntry(CredentialMetadata.USER_ID, "583231")
                .containsEntry(CredentialMetadata.SOURCE, GitHubCliCredentialHelper.NAME);
    }

    @Test
    void testQuery_UserLookupFails_StillReturnsToken() throws IOException {
        when(processRunner.run(eq(AUTH_TOKEN), any(), anyMap(), any(Duration.class)))
                .thenReturn(result(0, "gho_cli_token"));
        when(processRunner.run(eq(API_USER), any(), anyMap(), any(Duration.class)))
                .thenReturn(result(1, ""));

        Credential credential = helper.query(CredentialKey.of(EPlatform.GITHUB, "github.com")).orElseThrow();

        assertThat(credential.getUsername()).isEmpty();
    }

    @Test
    void testQuery_NotLoggedIn_ReturnsEmpty() throws IOException {
        when(processRunner.run(eq(AUTH_TOKEN), any(), anyMap(), any(Duration.class)))
                .thenReturn(result(1, ""));

        assertThat(helper.query(CredentialKey.of(EPlatform.GITHUB, "github.com"))).isEmpty();
    }

    @Test
    void testQuery_OtherPlatform_DoesNotRunGh() {
        assertThat(helper.query(CredentialKey.of(EPlatform.GITLAB, "gitlab.com"))).isEmpty();
        verifyNoInteractions(processRunner);
    }

    @Test
    void testStore_ReadOnly() {
        assertThat(helper.isWritable()).isFalse();
        assertThatThrownBy(() -> helper.erase(CredentialKey.of(EPlatform.GITHUB, "github.com")))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("read-only");
    }

    private static ProcessResult result(int exitCode, String stdout) {
        return new ProcessResult(exitCode, stdout.getBytes(StandardCharsets.UTF_8), new byte[0]);
    }
}
