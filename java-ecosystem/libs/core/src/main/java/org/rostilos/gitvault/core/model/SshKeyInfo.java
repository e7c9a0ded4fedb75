package org.rostilos.gitvault.core.model;

/**
 * Public identity held by an SSH agent.
 *
 * @param fingerprint OpenSSH style fingerprint, e.g. {@code SHA256:abc...}
 * @param comment     key comment, usually the key file path or user@host
 * @param keyType     algorithm name from the key blob, e.g. {@code ssh-ed25519}
 */
public record SshKeyInfo(String fingerprint, String comment, String keyType) {
}
