package org.rostilos.gitvault.bridge.sshagent;

import org.rostilos.gitvault.core.model.SshKeyInfo;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Message framing of the SSH agent protocol (draft-miller-ssh-agent): every message
 * is a uint32 length followed by a one-byte type and the payload.
 */
final class SshAgentProtocol {

    static final byte SSH_AGENT_FAILURE = 5;
    static final byte SSH2_AGENTC_REQUEST_IDENTITIES = 11;
    static final byte SSH2_AGENT_IDENTITIES_ANSWER = 12;

    /** Agents answer with a few KiB; anything this large is not an agent. */
    static final int MAX_MESSAGE_LENGTH = 256 * 1024;

    private SshAgentProtocol() {
        // Utility class
    }

    static ByteBuffer requestIdentities() {
        ByteBuffer request = ByteBuffer.allocate(5);
        request.putInt(1);
        request.put(SSH2_AGENTC_REQUEST_IDENTITIES);
        request.flip();
        return request;
    }

    /**
     * @param message message body after the length prefix, positioned at the type byte
     */
    static List<SshKeyInfo> parseIdentitiesAnswer(ByteBuffer message) throws IOException {
        try {
            byte type = message.get();
            if (type == SSH_AGENT_FAILURE) {
                throw new AgentFailureException();
            }
            if (type != SSH2_AGENT_IDENTITIES_ANSWER) {
                throw new IOException("Unexpected agent response type " + type);
            }
            int count = message.getInt();
            if (count < 0 || count > MAX_MESSAGE_LENGTH / 8) {
                throw new IOException("Implausible identity count " + count);
            }
            List<SshKeyInfo> keys = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                byte[] blob = readString(message);
                String comment = new String(readString(message), StandardCharsets.UTF_8);
                keys.add(new SshKeyInfo(fingerprint(blob), comment, keyType(blob)));
            }
            return keys;
        } catch (BufferUnderflowException e) {
            throw new IOException("Truncated agent response", e);
        }
    }

    /**
     * OpenSSH style {@code SHA256:<unpadded base64>} fingerprint of a public key blob.
     */
    static String fingerprint(byte[] blob) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(blob);
            return "SHA256:" + Base64.getEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * The first string of a public key blob is its algorithm name.
     */
    static String keyType(byte[] blob) {
        ByteBuffer buffer = ByteBuffer.wrap(blob);
        try {
            return new String(readString(buffer), StandardCharsets.US_ASCII);
        } catch (BufferUnderflowException | IOException e) {
            return "unknown";
        }
    }

    private static byte[] readString(ByteBuffer buffer) throws IOException {
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new IOException("Invalid string length " + length + " in agent response");
        }
        byte[] value = new byte[length];
        buffer.get(value);
        return value;
    }

    static final class AgentFailureException extends IOException {
        AgentFailureException() {
            super("Agent answered SSH_AGENT_FAILURE");
        }
    }
}
