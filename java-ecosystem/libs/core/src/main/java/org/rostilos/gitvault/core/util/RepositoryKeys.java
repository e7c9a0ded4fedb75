package org.rostilos.gitvault.core.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses repository keys in the shapes users actually type: a bare host, a host
 * with a path, an HTTPS/SSH URL, or an scp-like {@code git@host:org/repo.git}.
 */
public final class RepositoryKeys {

    private static final Pattern URL_FORM = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]*)://(?:[^@/]+@)?([^/:]+)(?::\\d+)?(?:/(.*))?$");
    private static final Pattern SCP_FORM = Pattern.compile("^(?:[^@/]+@)?([^/:]+):(.+)$");

    private RepositoryKeys() {
        // Utility class
    }

    public static RepositoryLocation parse(String repositoryKey) {
        if (repositoryKey == null || repositoryKey.isBlank()) {
            throw new IllegalArgumentException("Repository key cannot be null or empty");
        }
        String key = repositoryKey.trim();

        Matcher url = URL_FORM.matcher(key);
        if (url.matches()) {
            String protocol = url.group(1).toLowerCase(Locale.ENGLISH);
            if (protocol.equals("ssh") || protocol.equals("git+ssh")) {
                protocol = "ssh";
            }
            return new RepositoryLocation(protocol, url.group(2).toLowerCase(Locale.ENGLISH), normalizePath(url.group(3)));
        }

        Matcher scp = SCP_FORM.matcher(key);
        if (scp.matches() && key.indexOf('/') > key.indexOf(':')) {
            return new RepositoryLocation("ssh", scp.group(1).toLowerCase(Locale.ENGLISH), normalizePath(scp.group(2)));
        }

        int slash = key.indexOf('/');
        if (slash < 0) {
            return new RepositoryLocation("https", key.toLowerCase(Locale.ENGLISH), null);
        }
        return new RepositoryLocation("https",
                key.substring(0, slash).toLowerCase(Locale.ENGLISH),
                normalizePath(key.substring(slash + 1)));
    }

    public static String host(String repositoryKey) {
        return parse(repositoryKey).host();
    }

    private static String normalizePath(String path) {
        if (path == null) {
            return null;
        }
        String p = path;
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.endsWith(".git")) {
            p = p.substring(0, p.length() - 4);
        }
        return p.isEmpty() ? null : p;
    }
}
