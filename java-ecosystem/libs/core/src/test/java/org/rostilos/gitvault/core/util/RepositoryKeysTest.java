package org.rostilos.gitvault.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RepositoryKeys")
class RepositoryKeysTest {

    @Test
    @DisplayName("bare host should parse as https without path")
    void bareHost() {
        assertThat(RepositoryKeys.parse("GitHub.com"))
                .isEqualTo(new RepositoryLocation("https", "github.com", null));
    }

    @Test
    @DisplayName("host with path should keep the path")
    void hostWithPath() {
        assertThat(RepositoryKeys.parse("gitlab.com/group/sub/project"))
                .isEqualTo(new RepositoryLocation("https", "gitlab.com", "group/sub/project"));
    }

    @Test
    @DisplayName("https URL should drop credentials, port and .git suffix")
    void httpsUrl() {
        assertThat(RepositoryKeys.parse("https://user@git.example.org:8443/team/repo.git/"))
                .isEqualTo(new RepositoryLocation("https", "git.example.org", "team/repo"));
    }

    @Test
    @DisplayName("scp-like SSH remote should parse as ssh")
    void scpLikeRemote() {
        assertThat(RepositoryKeys.parse("git@bitbucket.org:team/repo.git"))
                .isEqualTo(new RepositoryLocation("ssh", "bitbucket.org", "team/repo"));
    }

    @Test
    @DisplayName("ssh URL should parse as ssh")
    void sshUrl() {
        assertThat(RepositoryKeys.parse("ssh://git@github.com/org/repo.git"))
                .isEqualTo(new RepositoryLocation("ssh", "github.com", "org/repo"));
    }

    @Test
    @DisplayName("blank key should be rejected")
    void blankKeyRejected() {
        assertThatThrownBy(() -> RepositoryKeys.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
