package org.rostilos.gitvault.vcsauth.github.actions;

import org.rostilos.gitvault.core.model.ETwoFactorMethod;
import org.rostilos.gitvault.vcsauth.PlatformApiException;

/**
 * GitHub accepted the password but wants a one-time code ({@code X-GitHub-OTP: required; <method>}).
 */
public class OtpRequiredException extends PlatformApiException {

    private final ETwoFactorMethod method;

    public OtpRequiredException(String operation, ETwoFactorMethod method) {
        super(operation, 401);
        this.method = method;
    }

    public ETwoFactorMethod getMethod() {
        return method;
    }
}
