package org.rostilos.gitvault.store.file;

import org.junit.jupiter.api.Test;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialFileCodecTest {

    private final CredentialFileCodec codec = new CredentialFileCodec();

    @Test
    void testEncode_WritesSecretAsBase64() throws IOException {
        Credential credential = Credential.builder()
                .key(EPlatform.GITLAB, "gitlab.com")
                .method(EAuthMethod.TOKEN)
                .secret(SecretValue.of("glpat-secretsecretsecret"))
                .build();
        Map<CredentialKey, Credential> credentials = new LinkedHashMap<>();
        credentials.put(credential.getKey(), credential);

        String json = new String(codec.encode(credentials), StandardCharsets.UTF_8);

        assertThat(json)
                .contains("\"schema\":1")
                .contains("\"platform\":\"gitlab\"")
                .contains(Base64.getEncoder().encodeToString("glpat-secretsecretsecret".getBytes(StandardCharsets.UTF_8)))
                .doesNotContain("glpat-secretsecretsecret");
    }

    @Test
    void testDecode_UnknownSchema_Fails() {
        byte[] json = "{\"schema\":7,\"credentials\":[]}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(json))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("schema");
    }

    @Test
    void testDecode_UnknownPlatform_Fails() {
        byte[] json = ("{\"schema\":1,\"credentials\":[{\"platform\":\"sourceforge\",\"repository_key\":\"x\","
                + "\"method\":\"token\",\"secret\":\"AAAA\"}]}").getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.decode(json))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("sourceforge");
    }

    @Test
    void testDecode_EmptyDocument_ReturnsEmptyMap() throws IOException {
        byte[] json = "{\"schema\":1}".getBytes(StandardCharsets.UTF_8);

        assertThat(codec.decode(json)).isEmpty();
    }
}
