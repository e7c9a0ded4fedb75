package org.rostilos.gitvault.core.model;

import javax.security.auth.Destroyable;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;

/**
 * Holder for secret bytes (token, password, refresh token).
 * <p>
 * The bytes are owned by this instance: constructors copy their input and
 * {@link #destroy()} zeroes the buffer. {@link #toString()} never renders the
 * content, so a secret that ends up in a log statement or exception message by
 * accident prints as a mask.
 */
public final class SecretValue implements Destroyable, AutoCloseable {

    private static final SecretValue EMPTY = new SecretValue(new byte[0]);

    private final byte[] bytes;
    private volatile boolean destroyed;

    private SecretValue(byte[] owned) {
        this.bytes = owned;
    }

    public static SecretValue of(byte[] secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret bytes cannot be null");
        }
        return new SecretValue(secret.clone());
    }

    public static SecretValue of(char[] secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret chars cannot be null");
        }
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(secret));
        byte[] owned = new byte[encoded.remaining()];
        encoded.get(owned);
        if (encoded.hasArray()) {
            Arrays.fill(encoded.array(), (byte) 0);
        }
        return new SecretValue(owned);
    }

    /**
     * Convenience for values that already live in a {@code String} (HTTP responses,
     * test fixtures). Prefer the array factories where the caller controls the buffer.
     */
    public static SecretValue of(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret cannot be null");
        }
        return new SecretValue(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Take ownership of {@code secret} without copying; the caller must not reuse the array.
     */
    public static SecretValue wrap(byte[] secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret bytes cannot be null");
        }
        return new SecretValue(secret);
    }

    public static SecretValue empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * @return a copy of the secret bytes; the caller is responsible for zeroing it
     */
    public byte[] toByteArray() {
        ensureAlive();
        return bytes.clone();
    }

    /**
     * @return the secret decoded as UTF-8 characters; the caller is responsible for zeroing it
     */
    public char[] toCharArray() {
        ensureAlive();
        CharBuffer decoded = StandardCharsets.UTF_8.decode(ByteBuffer.wrap(bytes));
        char[] chars = new char[decoded.remaining()];
        decoded.get(chars);
        if (decoded.hasArray()) {
            Arrays.fill(decoded.array(), '\0');
        }
        return chars;
    }

    /**
     * Materialize the secret as a {@code String}. Only for handing the value to APIs
     * that accept nothing else (HTTP headers, form bodies).
     */
    public String reveal() {
        ensureAlive();
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public SecretValue copy() {
        ensureAlive();
        return bytes.length == 0 ? EMPTY : new SecretValue(bytes.clone());
    }

    @Override
    public void destroy() {
        if (this == EMPTY) {
            return;
        }
        Arrays.fill(bytes, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    private void ensureAlive() {
        if (destroyed) {
            throw new IllegalStateException("Secret has been destroyed");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecretValue other)) return false;
        return MessageDigest.isEqual(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        // Length only: hashing content would leak information through hash-based containers
        return Integer.hashCode(bytes.length);
    }

    @Override
    public String toString() {
        return "SecretValue[****]";
    }
}
