package org.rostilos.gitvault.security.crypto;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Derives AES keys from a user passphrase with Argon2id.
 */
public final class PassphraseKeyDerivation {

    public static final int KEY_LENGTH_BYTES = 32;

    private PassphraseKeyDerivation() {
        // Utility class
    }

    /**
     * @return raw key bytes; the caller owns and must zero them
     */
    public static byte[] deriveKey(char[] passphrase, byte[] salt, KdfParameters parameters) {
        Argon2Parameters argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(parameters.iterations())
                .withMemoryAsKB(parameters.memoryKib())
                .withParallelism(parameters.parallelism())
                .withSalt(salt)
                .build();

        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(argon2);
        byte[] key = new byte[KEY_LENGTH_BYTES];
        generator.generateBytes(passphrase, key);
        return key;
    }
}
