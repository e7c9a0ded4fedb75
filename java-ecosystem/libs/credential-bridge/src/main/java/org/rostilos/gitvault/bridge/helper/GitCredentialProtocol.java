package org.rostilos.gitvault.bridge.helper;

import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.core.util.RepositoryLocation;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The newline-delimited {@code key=value} format spoken by {@code git credential}.
 * Password values stay in byte arrays from the process output to the returned
 * {@link SecretValue}.
 */
public final class GitCredentialProtocol {

    public static final String PROTOCOL = "protocol";
    public static final String HOST = "host";
    public static final String PATH = "path";
    public static final String USERNAME = "username";
    public static final String PASSWORD = "password";
    public static final String PASSWORD_EXPIRY_UTC = "password_expiry_utc";
    public static final String OAUTH_REFRESH_TOKEN = "oauth_refresh_token";

    private GitCredentialProtocol() {
        // Utility class
    }

    /**
     * Encode a request. The result contains the password bytes when one is given;
     * the caller must zero it after use.
     */
    public static byte[] encode(RepositoryLocation location, String username, SecretValue password) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String protocol = "ssh".equals(location.protocol()) ? "https" : location.protocol();
        writeAttribute(out, PROTOCOL, protocol);
        writeAttribute(out, HOST, location.host());
        if (location.path() != null) {
            writeAttribute(out, PATH, location.path());
        }
        if (username != null) {
            writeAttribute(out, USERNAME, username);
        }
        if (password != null && !password.isEmpty()) {
            byte[] secret = password.toByteArray();
            try {
                checkValue(PASSWORD, secret);
                out.writeBytes((PASSWORD + "=").getBytes(StandardCharsets.UTF_8));
                out.writeBytes(secret);
                out.write('\n');
            } finally {
                Arrays.fill(secret, (byte) 0);
            }
        }
        out.write('\n');
        return out.toByteArray();
    }

    public static Response parse(byte[] output) {
        Map<String, String> attributes = new LinkedHashMap<>();
        SecretValue password = null;
        SecretValue refreshToken = null;

        int lineStart = 0;
        for (int i = 0; i <= output.length; i++) {
            if (i < output.length && output[i] != '\n') {
                continue;
            }
            int lineEnd = i;
            if (lineEnd > lineStart && output[lineEnd - 1] == '\r') {
                lineEnd--;
            }
            int separator = indexOf(output, (byte) '=', lineStart, lineEnd);
            if (separator > lineStart) {
                String key = new String(output, lineStart, separator - lineStart, StandardCharsets.UTF_8);
                if (PASSWORD.equals(key)) {
                    password = SecretValue.wrap(Arrays.copyOfRange(output, separator + 1, lineEnd));
                } else if (OAUTH_REFRESH_TOKEN.equals(key)) {
                    refreshToken = SecretValue.wrap(Arrays.copyOfRange(output, separator + 1, lineEnd));
                } else {
                    attributes.put(key, new String(output, separator + 1, lineEnd - separator - 1, StandardCharsets.UTF_8));
                }
            }
            lineStart = i + 1;
        }
        return new Response(Collections.unmodifiableMap(attributes), password, refreshToken);
    }

    private static void writeAttribute(ByteArrayOutputStream out, String key, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        checkValue(key, bytes);
        out.writeBytes((key + "=").getBytes(StandardCharsets.UTF_8));
        out.writeBytes(bytes);
        out.write('\n');
    }

    private static void checkValue(String key, byte[] value) {
        for (byte b : value) {
            if (b == '\n' || b == 0) {
                throw new IllegalArgumentException("Credential attribute '" + key + "' contains a newline or NUL");
            }
        }
    }

    private static int indexOf(byte[] data, byte target, int from, int to) {
        for (int i = from; i < to; i++) {
            if (data[i] == target) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Parsed helper answer. Non-secret attributes are plain strings.
     */
    public record Response(Map<String, String> attributes, SecretValue password, SecretValue refreshToken) {

        public String attribute(String key) {
            return attributes.get(key);
        }

        public boolean hasPassword() {
            return password != null && !password.isEmpty();
        }

        @Override
        public String toString() {
            return "Response{attributes=" + attributes.keySet() + ", password=" + (password != null ? password : "none") + "}";
        }
    }
}
