package org.rostilos.gitvault.core.exception;

import java.util.Objects;

/**
 * Typed authentication failure.
 * <p>
 * Messages, codes and hints are composed from platform names, repository keys and
 * status codes only; secret material must never be passed into any of them.
 */
public class AuthException extends RuntimeException {

    private final EAuthErrorKind kind;
    private final String code;
    private final String hint;

    public AuthException(EAuthErrorKind kind, String code, String message) {
        this(kind, code, message, null, null);
    }

    public AuthException(EAuthErrorKind kind, String code, String message, String hint) {
        this(kind, code, message, hint, null);
    }

    public AuthException(EAuthErrorKind kind, String code, String message, String hint, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.code = code;
        this.hint = hint;
    }

    public static AuthException notFound(String code, String message, String hint) {
        return new AuthException(EAuthErrorKind.NOT_FOUND, code, message, hint);
    }

    public EAuthErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getHint() {
        return hint;
    }

    public boolean is(EAuthErrorKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + (code != null ? "/" + code : "") + "]: " + getMessage();
    }
}
