package org.rostilos.gitvault.core.exception;

import org.rostilos.gitvault.core.model.EPlatform;

/**
 * Raised by platforms that have no token refresh mechanism.
 */
public class RefreshUnsupportedException extends AuthException {

    private final EPlatform platform;

    public RefreshUnsupportedException(EPlatform platform, String hint) {
        super(EAuthErrorKind.EXPIRED_TOKEN,
                platform.name() + "_NO_REFRESH",
                "Token refresh is not supported for platform: " + platform.getId(),
                hint);
        this.platform = platform;
    }

    public EPlatform getPlatform() {
        return platform;
    }
}
