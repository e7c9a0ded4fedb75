package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@link CredentialManager}.
 */
public final class CredentialManagerSettings {

    public static final Duration DEFAULT_INTERACTIVE_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration DEFAULT_EXTERNAL_CALL_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REFRESH_SKEW = Duration.ofMinutes(5);

    private final Duration interactiveTimeout;
    private final Duration externalCallTimeout;
    private final Duration refreshSkew;
    private final RetryPolicy retryPolicy;
    private final Map<EPlatform, EAuthMethod> preferredMethods;
    private final EPlatform defaultPlatform;
    private final Clock clock;

    private CredentialManagerSettings(Builder builder) {
        this.interactiveTimeout = requirePositive(builder.interactiveTimeout, "interactiveTimeout");
        this.externalCallTimeout = requirePositive(builder.externalCallTimeout, "externalCallTimeout");
        this.refreshSkew = Objects.requireNonNull(builder.refreshSkew, "refreshSkew");
        if (refreshSkew.isNegative()) {
            throw new IllegalArgumentException("refreshSkew must not be negative");
        }
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy");
        this.preferredMethods = Collections.unmodifiableMap(new EnumMap<>(builder.preferredMethods));
        this.defaultPlatform = Objects.requireNonNull(builder.defaultPlatform, "defaultPlatform");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
    }

    public static CredentialManagerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getInteractiveTimeout() {
        return interactiveTimeout;
    }

    /**
     * Bound for calls to external helpers and the SSH agent.
     */
    public Duration getExternalCallTimeout() {
        return externalCallTimeout;
    }

    public Duration getRefreshSkew() {
        return refreshSkew;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Map<EPlatform, EAuthMethod> getPreferredMethods() {
        return preferredMethods;
    }

    public Optional<EAuthMethod> preferredMethod(EPlatform platform) {
        return Optional.ofNullable(preferredMethods.get(platform));
    }

    /**
     * Platform assumed for repository keys whose host is not recognized.
     */
    public EPlatform getDefaultPlatform() {
        return defaultPlatform;
    }

    public Clock getClock() {
        return clock;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .interactiveTimeout(interactiveTimeout)
                .externalCallTimeout(externalCallTimeout)
                .refreshSkew(refreshSkew)
                .retryPolicy(retryPolicy)
                .defaultPlatform(defaultPlatform)
                .clock(clock);
        builder.preferredMethods.putAll(preferredMethods);
        return builder;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    @Override
    public String toString() {
        return "CredentialManagerSettings{" +
                "interactiveTimeout=" + interactiveTimeout +
                ", externalCallTimeout=" + externalCallTimeout +
                ", refreshSkew=" + refreshSkew +
                ", retryPolicy=" + retryPolicy +
                ", preferredMethods=" + preferredMethods +
                ", defaultPlatform=" + defaultPlatform +
                '}';
    }

    public static final class Builder {
        private Duration interactiveTimeout = DEFAULT_INTERACTIVE_TIMEOUT;
        private Duration externalCallTimeout = DEFAULT_EXTERNAL_CALL_TIMEOUT;
        private Duration refreshSkew = DEFAULT_REFRESH_SKEW;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private final Map<EPlatform, EAuthMethod> preferredMethods = new EnumMap<>(EPlatform.class);
        private EPlatform defaultPlatform = EPlatform.GENERIC;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder interactiveTimeout(Duration interactiveTimeout) {
            this.interactiveTimeout = interactiveTimeout;
            return this;
        }

        public Builder externalCallTimeout(Duration externalCallTimeout) {
            this.externalCallTimeout = externalCallTimeout;
            return this;
        }

        public Builder refreshSkew(Duration refreshSkew) {
            this.refreshSkew = refreshSkew;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder preferredMethod(EPlatform platform, EAuthMethod method) {
            if (method == null) {
                preferredMethods.remove(platform);
            } else {
                preferredMethods.put(platform, method);
            }
            return this;
        }

        public Builder defaultPlatform(EPlatform defaultPlatform) {
            this.defaultPlatform = defaultPlatform;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CredentialManagerSettings build() {
            return new CredentialManagerSettings(this);
        }
    }
}
