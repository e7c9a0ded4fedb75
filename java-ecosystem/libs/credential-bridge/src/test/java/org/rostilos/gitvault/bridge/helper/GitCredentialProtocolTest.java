package org.rostilos.gitvault.bridge.helper;

import org.junit.jupiter.api.Test;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.RepositoryLocation;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitCredentialProtocolTest {

    @Test
    void testEncode_HostOnly_EndsWithBlankLine() {
        byte[] request = GitCredentialProtocol.encode(new RepositoryLocation("https", "github.com", null), null, null);

        assertThat(new String(request, StandardCharsets.UTF_8)).isEqualTo("protocol=https\nhost=github.com\n\n");
    }

    @Test
    void testEncode_WithPathUserAndPassword() {
        byte[] request = GitCredentialProtocol.encode(
                new RepositoryLocation("https", "gitlab.com", "group/app"), "dev", SecretValue.of("s3cret"));

        assertThat(new String(request, StandardCharsets.UTF_8)).isEqualTo(
                "protocol=https\nhost=gitlab.com\npath=group/app\nusername=dev\npassword=s3cret\n\n");
    }

    @Test
    void testEncode_SshLocation_AsksForHttpsCredentials() {
        byte[] request = GitCredentialProtocol.encode(new RepositoryLocation("ssh", "github.com", "org/repo"), null, null);

        assertThat(new String(request, StandardCharsets.UTF_8)).startsWith("protocol=https\n");
    }

    @Test
    void testEncode_NewlineInValue_Rejected() {
        RepositoryLocation location = new RepositoryLocation("https", "github.com", null);

        assertThatThrownBy(() -> GitCredentialProtocol.encode(location, "evil\nhost=attacker", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("username");
    }

    @Test
    void testParse_ReadsAttributesAndSecrets() {
        byte[] output = ("protocol=https\r\nhost=github.com\nusername=octocat\npassword=ghp_value=with=equals\n"
                + "oauth_refresh_token=refresh\npassword_expiry_utc=1893456000\n").getBytes(StandardCharsets.UTF_8);

        GitCredentialProtocol.Response response = GitCredentialProtocol.parse(output);

        assertThat(response.attribute("protocol")).isEqualTo("https");
        assertThat(response.attribute("username")).isEqualTo("octocat");
        assertThat(response.attribute("password_expiry_utc")).isEqualTo("1893456000");
        assertThat(response.attributes()).doesNotContainKeys("password", "oauth_refresh_token");
        assertThat(response.hasPassword()).isTrue();
        assertThat(response.password().reveal()).isEqualTo("ghp_value=with=equals");
        assertThat(response.refreshToken().reveal()).isEqualTo("refresh");
        assertThat(response.toString()).doesNotContain("ghp_value");
    }

    @Test
    void testParse_NoPassword() {
        GitCredentialProtocol.Response response = GitCredentialProtocol.parse(
                "protocol=https\nhost=github.com\n".getBytes(StandardCharsets.UTF_8));

        assertThat(response.hasPassword()).isFalse();
        assertThat(response.password()).isNull();
    }
}
