package org.rostilos.gitvault.core.util;

/**
 * Repository key broken down into the fields git credential helpers speak.
 *
 * @param path repository path without leading slash, or {@code null} for host-wide keys
 */
public record RepositoryLocation(String protocol, String host, String path) {
}
