package org.rostilos.gitvault.core.model;

/**
 * Answer to a {@link TwoFactorChallenge}. The code is short-lived but still
 * treated as sensitive, so it is masked in {@link #toString()}.
 */
public record TwoFactorResponse(String code, ETwoFactorMethod method) {

    @Override
    public String toString() {
        return "TwoFactorResponse[code=******, method=" + method + "]";
    }
}
