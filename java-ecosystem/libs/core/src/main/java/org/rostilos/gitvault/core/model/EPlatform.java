package org.rostilos.gitvault.core.model;

import java.util.Locale;

/**
 * Enumeration of supported git hosting platform families.
 */
public enum EPlatform {
    GITHUB("github"),
    GITLAB("gitlab"),
    BITBUCKET("bitbucket"),
    GENERIC("generic");

    private final String id;

    EPlatform(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static EPlatform fromId(String platformId) {
        if (platformId == null) {
            throw new IllegalArgumentException("Platform ID cannot be null");
        }

        String normalized = platformId.trim().toLowerCase(Locale.ENGLISH).replace('_', '-');
        for (EPlatform platform : values()) {
            if (platform.id.equals(normalized)) {
                return platform;
            }
        }

        // Accept the hosted product names used in configuration files
        return switch (normalized) {
            case "bitbucket-cloud", "bitbucket-server" -> BITBUCKET;
            case "git" -> GENERIC;
            default -> throw new IllegalArgumentException("Unknown platform: " + platformId);
        };
    }

    /**
     * Detect the platform family from a host name. Self-hosted instances are
     * recognized by the conventional "gitlab." / "bitbucket." host prefixes.
     */
    public static EPlatform fromHost(String host) {
        if (host == null || host.isBlank()) {
            return GENERIC;
        }
        String h = host.toLowerCase(Locale.ENGLISH);
        if (h.equals("github.com") || h.endsWith(".github.com") || h.startsWith("github.")) {
            return GITHUB;
        }
        if (h.equals("gitlab.com") || h.endsWith(".gitlab.com") || h.startsWith("gitlab.")) {
            return GITLAB;
        }
        if (h.equals("bitbucket.org") || h.endsWith(".bitbucket.org") || h.startsWith("bitbucket.")) {
            return BITBUCKET;
        }
        return GENERIC;
    }
}
