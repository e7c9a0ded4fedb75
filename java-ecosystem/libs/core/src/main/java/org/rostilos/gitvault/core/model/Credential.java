package org.rostilos.gitvault.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Secret material plus the metadata describing how to authenticate to one
 * platform/repository pair.
 * <p>
 * Instances are immutable. Copies share nothing mutable with the original except
 * through {@link SecretValue}, which callers copy explicitly when they need an
 * independent lifetime.
 */
public final class Credential {

    private final CredentialKey key;
    private final EAuthMethod method;
    private final SecretValue secret;
    private final SecretValue refreshToken;
    private final String username;
    private final Map<String, String> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Credential(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key");
        this.method = Objects.requireNonNull(builder.method, "method");
        this.secret = builder.secret != null ? builder.secret : SecretValue.empty();
        this.refreshToken = builder.refreshToken;
        this.username = builder.username;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .key(key)
                .method(method)
                .secret(secret)
                .refreshToken(refreshToken)
                .username(username)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
        builder.metadata.putAll(metadata);
        return builder;
    }

    public CredentialKey getKey() {
        return key;
    }

    public EPlatform getPlatform() {
        return key.platform();
    }

    public String getRepositoryKey() {
        return key.repositoryKey();
    }

    public EAuthMethod getMethod() {
        return method;
    }

    public SecretValue getSecret() {
        return secret;
    }

    public Optional<SecretValue> getRefreshToken() {
        return Optional.ofNullable(refreshToken);
    }

    public Optional<String> getUsername() {
        return Optional.ofNullable(username);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public List<String> getScopes() {
        String raw = metadata.get(CredentialMetadata.SCOPES);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> scopes = new ArrayList<>();
        for (String scope : raw.split(",")) {
            if (!scope.isBlank()) {
                scopes.add(scope.trim());
            }
        }
        return scopes;
    }

    /**
     * @return the expiry instant, empty when the credential does not expire or the
     *         stored value cannot be parsed
     */
    public Optional<Instant> getExpiresAt() {
        String raw = metadata.get(CredentialMetadata.EXPIRES_AT);
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public boolean isExpired(Clock clock) {
        return getExpiresAt().map(expiresAt -> !expiresAt.isAfter(clock.instant())).orElse(false);
    }

    /**
     * True when the credential expires within {@code skew} from now (or already has).
     */
    public boolean expiresWithin(Duration skew, Clock clock) {
        return getExpiresAt().map(expiresAt -> !expiresAt.isAfter(clock.instant().plus(skew))).orElse(false);
    }

    /**
     * Copy safe to hand out for listings: empty secret, no refresh token.
     */
    public Credential withoutSecret() {
        return toBuilder()
                .secret(SecretValue.empty())
                .refreshToken(null)
                .build();
    }

    /**
     * Copy with independently owned secret buffers.
     */
    public Credential deepCopy() {
        return toBuilder()
                .secret(secret.copy())
                .refreshToken(refreshToken != null ? refreshToken.copy() : null)
                .build();
    }

    /**
     * Zero the secret buffers held by this instance.
     */
    public void destroySecrets() {
        secret.destroy();
        if (refreshToken != null) {
            refreshToken.destroy();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Credential that)) return false;
        return key.equals(that.key)
                && method == that.method
                && secret.equals(that.secret)
                && Objects.equals(refreshToken, that.refreshToken)
                && Objects.equals(username, that.username)
                && metadata.equals(that.metadata)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, method, username, metadata);
    }

    @Override
    public String toString() {
        return "Credential{" +
                "key=" + key +
                ", method=" + method +
                ", username=" + username +
                ", secret=" + secret +
                ", metadata=" + metadata +
                ", updatedAt=" + updatedAt +
                '}';
    }

    public static final class Builder {
        private CredentialKey key;
        private EAuthMethod method;
        private SecretValue secret;
        private SecretValue refreshToken;
        private String username;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder key(CredentialKey key) {
            this.key = key;
            return this;
        }

        public Builder key(EPlatform platform, String repositoryKey) {
            this.key = new CredentialKey(platform, repositoryKey);
            return this;
        }

        public Builder method(EAuthMethod method) {
            this.method = method;
            return this;
        }

        public Builder secret(SecretValue secret) {
            this.secret = secret;
            return this;
        }

        public Builder refreshToken(SecretValue refreshToken) {
            this.refreshToken = refreshToken;
            return this;
        }

        public Builder username(String username) {
            this.username = username == null || username.isBlank() ? null : username;
            return this;
        }

        public Builder metadata(String name, String value) {
            if (value == null) {
                this.metadata.remove(name);
            } else {
                this.metadata.put(name, value);
            }
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder scopes(List<String> scopes) {
            return metadata(CredentialMetadata.SCOPES,
                    scopes == null || scopes.isEmpty() ? null : String.join(",", scopes));
        }

        public Builder scopes(String... scopes) {
            return scopes(Arrays.asList(scopes));
        }

        public Builder expiresAt(Instant expiresAt) {
            return metadata(CredentialMetadata.EXPIRES_AT, expiresAt != null ? expiresAt.toString() : null);
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Credential build() {
            return new Credential(this);
        }
    }
}
