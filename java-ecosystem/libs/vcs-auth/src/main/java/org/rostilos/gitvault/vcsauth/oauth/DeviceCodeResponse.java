package org.rostilos.gitvault.vcsauth.oauth;

import java.time.Duration;

/**
 * RFC 8628 device authorization response.
 */
public record DeviceCodeResponse(
        String deviceCode,
        String userCode,
        String verificationUri,
        Duration expiresIn,
        Duration interval
) {

    @Override
    public String toString() {
        return "DeviceCodeResponse{userCode='" + userCode + "', verificationUri='" + verificationUri
                + "', expiresIn=" + expiresIn + ", interval=" + interval + "}";
    }
}
