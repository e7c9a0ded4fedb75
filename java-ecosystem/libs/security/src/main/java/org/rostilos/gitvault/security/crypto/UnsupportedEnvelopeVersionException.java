package org.rostilos.gitvault.security.crypto;

import java.security.GeneralSecurityException;

public class UnsupportedEnvelopeVersionException extends GeneralSecurityException {

    private final int version;

    public UnsupportedEnvelopeVersionException(int version) {
        super("Unsupported credential envelope version: " + version);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
