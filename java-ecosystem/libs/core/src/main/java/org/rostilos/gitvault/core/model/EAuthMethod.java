package org.rostilos.gitvault.core.model;

import java.util.Locale;

public enum EAuthMethod {
    TOKEN("token"),
    SSH("ssh"),
    OAUTH("oauth"),
    BASIC("basic");

    private final String id;

    EAuthMethod(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static EAuthMethod fromId(String methodId) {
        if (methodId == null) {
            throw new IllegalArgumentException("Auth method ID cannot be null");
        }
        String normalized = methodId.trim().toLowerCase(Locale.ENGLISH);
        for (EAuthMethod method : values()) {
            if (method.id.equals(normalized)) {
                return method;
            }
        }
        // "https" is what git remotes call username/password authentication
        if (normalized.equals("https")) {
            return BASIC;
        }
        throw new IllegalArgumentException("Unknown auth method: " + methodId);
    }
}
