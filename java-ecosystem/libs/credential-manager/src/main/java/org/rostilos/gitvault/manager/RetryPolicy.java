package org.rostilos.gitvault.manager;

import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Retries an operation while it fails with a retryable {@link AuthException}
 * (network errors), backing off exponentially between attempts.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MULTIPLIER,
                Sleeper.threadSleeper());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Sleeper.threadSleeper());
    }

    public RetryPolicy withSleeper(Sleeper newSleeper) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, newSleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Run {@code action}, retrying retryable failures up to the configured number
     * of attempts. Non-retryable failures and the last retryable one propagate.
     *
     * @throws AuthException with kind {@code CANCELED} when interrupted while backing off
     */
    public <T> T execute(String operation, Supplier<T> action) {
        Duration backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (AuthException e) {
                if (!e.getKind().isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed with {} (attempt {}/{}), retrying in {} ms",
                        operation, e.getCode(), attempt, maxAttempts, backoff.toMillis());
                pause(operation, backoff, e);
                backoff = next(backoff);
            }
        }
    }

    Duration next(Duration backoff) {
        return Duration.ofMillis(Math.round(backoff.toMillis() * multiplier));
    }

    private void pause(String operation, Duration backoff, AuthException lastFailure) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            AuthException canceled = new AuthException(EAuthErrorKind.CANCELED, "RETRY_INTERRUPTED",
                    operation + " was interrupted while waiting to retry", null, ie);
            canceled.addSuppressed(lastFailure);
            throw canceled;
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", initialBackoff=" + initialBackoff +
                ", multiplier=" + multiplier +
                '}';
    }
}
