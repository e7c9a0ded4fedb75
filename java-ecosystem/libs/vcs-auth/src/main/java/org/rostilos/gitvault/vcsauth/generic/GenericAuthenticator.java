package org.rostilos.gitvault.vcsauth.generic;

import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.vcsauth.AbstractPlatformAuthenticator;
import org.rostilos.gitvault.vcsauth.AuthenticatorContext;
import org.rostilos.gitvault.vcsauth.AuthenticatorSettings;
import org.rostilos.gitvault.vcsauth.TokenInspection;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Plain git remotes. There is no API to ask, so tokens are checked for format only.
 */
public class GenericAuthenticator extends AbstractPlatformAuthenticator {

    private static final Set<EAuthMethod> SUPPORTED_METHODS =
            EnumSet.of(EAuthMethod.TOKEN, EAuthMethod.SSH, EAuthMethod.BASIC);

    public GenericAuthenticator(AuthenticatorSettings settings, AuthenticatorContext context) {
        super(settings, context);
    }

    @Override
    public EPlatform platform() {
        return EPlatform.GENERIC;
    }

    @Override
    public Set<EAuthMethod> supportedMethods() {
        return SUPPORTED_METHODS;
    }

    @Override
    protected TokenInspection inspectToken(SecretValue token, List<String> requiredScopes) {
        return TokenInspection.unverified();
    }

    @Override
    protected String tokenHint() {
        return "Update the token stored for this remote";
    }
}
