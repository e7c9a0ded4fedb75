package org.rostilos.gitvault.security.totp;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Locale;

/**
 * RFC 6238 time-based one-time codes (HMAC-SHA1, 30 second period), used to answer
 * TOTP challenges automatically when the user configured their authenticator seed.
 */
public class TotpCodeGenerator {

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final int TOTP_PERIOD = 30; // seconds
    private static final String BASE32_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

    private final int digits;
    private final Clock clock;

    public TotpCodeGenerator(Clock clock) {
        this(6, clock);
    }

    public TotpCodeGenerator(int digits, Clock clock) {
        if (digits < 6 || digits > 8) {
            throw new IllegalArgumentException("TOTP digits must be between 6 and 8");
        }
        this.digits = digits;
        this.clock = clock;
    }

    /**
     * @param base32Seed the authenticator seed as shown at enrollment (spaces allowed)
     */
    public String currentCode(char[] base32Seed) throws GeneralSecurityException {
        long counter = clock.instant().getEpochSecond() / TOTP_PERIOD;
        byte[] key = decodeBase32(base32Seed);
        try {
            return generate(key, counter);
        } finally {
            Arrays.fill(key, (byte) 0);
        }
    }

    String generate(byte[] key, long counter) throws GeneralSecurityException {
        if (key.length == 0) {
            throw new GeneralSecurityException("TOTP seed is empty");
        }
        byte[] data = new byte[8];
        for (int i = 7; i >= 0; i--) {
            data[i] = (byte) (counter & 0xff);
            counter >>= 8;
        }

        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
        byte[] hash = mac.doFinal(data);

        int offset = hash[hash.length - 1] & 0xf;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);

        int otp = binary % (int) Math.pow(10, digits);
        return String.format(Locale.ROOT, "%0" + digits + "d", otp);
    }

    static byte[] decodeBase32(char[] base32) {
        int valid = 0;
        for (char c : base32) {
            if (BASE32_CHARS.indexOf(Character.toUpperCase(c)) >= 0) {
                valid++;
            }
        }
        byte[] result = new byte[valid * 5 / 8];

        int buffer = 0;
        int bitsLeft = 0;
        int index = 0;
        for (char c : base32) {
            int value = BASE32_CHARS.indexOf(Character.toUpperCase(c));
            if (value < 0) continue;

            buffer = (buffer << 5) | value;
            bitsLeft += 5;

            if (bitsLeft >= 8) {
                result[index++] = (byte) (buffer >> (bitsLeft - 8));
                bitsLeft -= 8;
            }
        }
        return result;
    }
}
