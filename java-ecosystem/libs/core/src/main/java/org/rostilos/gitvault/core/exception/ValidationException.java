package org.rostilos.gitvault.core.exception;

/**
 * Malformed caller input (empty or badly formatted token, bad scope string).
 * Never retried against another source.
 */
public class ValidationException extends RuntimeException {

    private final String field;
    private final String code;

    public ValidationException(String field, String code, String message) {
        super(message);
        this.field = field;
        this.code = code;
    }

    public String getField() {
        return field;
    }

    public String getCode() {
        return code;
    }
}
