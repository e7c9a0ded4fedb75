package org.rostilos.gitvault.store.file;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a credential set, the plaintext inside the encrypted store file.
 * Secrets are written as byte arrays (base64 in JSON) so they never pass through
 * a {@code String} on our side.
 */
public class CredentialFileCodec {

    static final int SCHEMA_VERSION = 1;

    private final ObjectMapper objectMapper;

    public CredentialFileCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(Map<CredentialKey, Credential> credentials) throws IOException {
        List<CredentialEntry> entries = new ArrayList<>();
        try {
            for (Credential credential : credentials.values()) {
                entries.add(CredentialEntry.from(credential));
            }
            return objectMapper.writeValueAsBytes(new CredentialDocument(SCHEMA_VERSION, entries));
        } finally {
            entries.forEach(CredentialEntry::wipe);
        }
    }

    public Map<CredentialKey, Credential> decode(byte[] json) throws IOException {
        CredentialDocument document = objectMapper.readValue(json, CredentialDocument.class);
        if (document.schema() != SCHEMA_VERSION) {
            throw new IOException("Unsupported credential document schema: " + document.schema());
        }
        Map<CredentialKey, Credential> credentials = new LinkedHashMap<>();
        if (document.credentials() == null) {
            return credentials;
        }
        for (CredentialEntry entry : document.credentials()) {
            Credential credential = entry.toCredential();
            credentials.put(credential.getKey(), credential);
        }
        return credentials;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CredentialDocument(
            @JsonProperty("schema") int schema,
            @JsonProperty("credentials") List<CredentialEntry> credentials
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CredentialEntry(
            @JsonProperty("platform") String platform,
            @JsonProperty("repository_key") String repositoryKey,
            @JsonProperty("method") String method,
            @JsonProperty("secret") byte[] secret,
            @JsonProperty("refresh_token") byte[] refreshToken,
            @JsonProperty("username") String username,
            @JsonProperty("metadata") Map<String, String> metadata,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("updated_at") String updatedAt
    ) {

        static CredentialEntry from(Credential credential) {
            return new CredentialEntry(
                    credential.getPlatform().getId(),
                    credential.getRepositoryKey(),
                    credential.getMethod().getId(),
                    credential.getSecret().toByteArray(),
                    credential.getRefreshToken().map(SecretValue::toByteArray).orElse(null),
                    credential.getUsername().orElse(null),
                    credential.getMetadata(),
                    credential.getCreatedAt() != null ? credential.getCreatedAt().toString() : null,
                    credential.getUpdatedAt() != null ? credential.getUpdatedAt().toString() : null
            );
        }

        /**
         * Ownership of the secret arrays moves into the returned credential.
         */
        Credential toCredential() throws IOException {
            try {
                return Credential.builder()
                        .key(EPlatform.fromId(platform), repositoryKey)
                        .method(EAuthMethod.fromId(method))
                        .secret(secret != null ? SecretValue.wrap(secret) : SecretValue.empty())
                        .refreshToken(refreshToken != null ? SecretValue.wrap(refreshToken) : null)
                        .username(username)
                        .metadata(metadata)
                        .createdAt(createdAt != null ? Instant.parse(createdAt) : null)
                        .updatedAt(updatedAt != null ? Instant.parse(updatedAt) : null)
                        .build();
            } catch (RuntimeException e) {
                wipe();
                throw new IOException("Malformed credential entry for platform " + platform, e);
            }
        }

        void wipe() {
            if (secret != null) {
                Arrays.fill(secret, (byte) 0);
            }
            if (refreshToken != null) {
                Arrays.fill(refreshToken, (byte) 0);
            }
        }
    }
}
