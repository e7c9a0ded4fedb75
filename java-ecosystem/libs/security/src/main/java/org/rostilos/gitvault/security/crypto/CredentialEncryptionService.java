package org.rostilos.gitvault.security.crypto;

import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.security.auth.Destroyable;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * AES-GCM envelope encryption keyed by a passphrase.
 * <p>
 * Envelope layout (version 1):
 * <pre>
 * version(1) | kdfIterations(4) | kdfMemoryKiB(4) | kdfParallelism(1) | salt(16) | nonce(12) | ciphertext || tag(16)
 * </pre>
 * The header is bound as associated data, so tampering with the KDF parameters or
 * salt fails authentication just like tampering with the ciphertext.
 * <p>
 * The most recently derived key is cached together with its salt: sealing reuses the
 * salt (with a fresh nonce) instead of paying for a new derivation on every write.
 */
public class CredentialEncryptionService implements Destroyable {

    public static final int FORMAT_VERSION = 1;

    private static final String ENCRYPTION_ALGO = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int SALT_LENGTH = 16;
    static final int HEADER_LENGTH = 1 + 4 + 4 + 1 + SALT_LENGTH + GCM_IV_LENGTH;

    private final char[] passphrase;
    private final KdfParameters kdfParameters;
    private final BytesKeyGenerator saltGenerator = KeyGenerators.secureRandom(SALT_LENGTH);
    private final BytesKeyGenerator nonceGenerator = KeyGenerators.secureRandom(GCM_IV_LENGTH);

    private DerivedKey cachedKey;
    private volatile boolean destroyed;

    public CredentialEncryptionService(char[] passphrase, KdfParameters kdfParameters) {
        if (passphrase == null || passphrase.length == 0) {
            throw new IllegalArgumentException("Passphrase cannot be null or empty");
        }
        this.passphrase = passphrase.clone();
        this.kdfParameters = kdfParameters != null ? kdfParameters : KdfParameters.defaults();
    }

    public KdfParameters getKdfParameters() {
        return kdfParameters;
    }

    public byte[] encrypt(byte[] plaintext) throws GeneralSecurityException {
        DerivedKey key = keyForSealing();
        byte[] nonce = nonceGenerator.generateKey();

        ByteBuffer header = ByteBuffer.allocate(HEADER_LENGTH);
        header.put((byte) FORMAT_VERSION);
        header.putInt(key.parameters().iterations());
        header.putInt(key.parameters().memoryKib());
        header.put((byte) key.parameters().parallelism());
        header.put(key.salt());
        header.put(nonce);
        byte[] headerBytes = header.array();

        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.ENCRYPT_MODE, key.spec(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
        cipher.updateAAD(headerBytes);
        byte[] encrypted = cipher.doFinal(plaintext);

        byte[] envelope = new byte[headerBytes.length + encrypted.length];
        System.arraycopy(headerBytes, 0, envelope, 0, headerBytes.length);
        System.arraycopy(encrypted, 0, envelope, headerBytes.length, encrypted.length);
        return envelope;
    }

    /**
     * @return the plaintext; the caller owns and must zero it
     * @throws GeneralSecurityException on a wrong passphrase, truncated or tampered data,
     *                                  or an unknown format version
     */
    public byte[] decrypt(byte[] envelope) throws GeneralSecurityException {
        if (envelope == null || envelope.length < 1) {
            throw new GeneralSecurityException("Credential envelope is empty");
        }
        int version = envelope[0] & 0xFF;
        if (version != FORMAT_VERSION) {
            throw new UnsupportedEnvelopeVersionException(version);
        }
        if (envelope.length < HEADER_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new GeneralSecurityException("Credential envelope is truncated");
        }

        ByteBuffer header = ByteBuffer.wrap(envelope, 1, HEADER_LENGTH - 1);
        KdfParameters parameters;
        try {
            parameters = new KdfParameters(header.getInt(), header.getInt(), header.get() & 0xFF);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Credential envelope has invalid key derivation parameters", e);
        }
        // Checked before deriving: the header is only authenticated after the key exists
        if (!kdfParameters.admits(parameters)) {
            throw new GeneralSecurityException("Credential envelope requests more key derivation work than configured");
        }
        byte[] salt = new byte[SALT_LENGTH];
        header.get(salt);
        byte[] nonce = new byte[GCM_IV_LENGTH];
        header.get(nonce);

        DerivedKey key = keyForOpening(salt, parameters);
        Cipher cipher = Cipher.getInstance(ENCRYPTION_ALGO);
        cipher.init(Cipher.DECRYPT_MODE, key.spec(), new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
        cipher.updateAAD(envelope, 0, HEADER_LENGTH);
        return cipher.doFinal(envelope, HEADER_LENGTH, envelope.length - HEADER_LENGTH);
    }

    private synchronized DerivedKey keyForSealing() {
        ensureAlive();
        if (cachedKey == null || !cachedKey.parameters().equals(kdfParameters)) {
            cachedKey = derive(saltGenerator.generateKey(), kdfParameters);
        }
        return cachedKey;
    }

    private synchronized DerivedKey keyForOpening(byte[] salt, KdfParameters parameters) {
        ensureAlive();
        if (cachedKey != null && cachedKey.matches(salt, parameters)) {
            return cachedKey;
        }
        DerivedKey derived = derive(salt, parameters);
        // Only keep keys we would also seal with; a file written with older parameters gets rewritten with current ones
        if (parameters.equals(kdfParameters)) {
            cachedKey = derived;
        }
        return derived;
    }

    private DerivedKey derive(byte[] salt, KdfParameters parameters) {
        byte[] keyBytes = PassphraseKeyDerivation.deriveKey(passphrase, salt, parameters);
        try {
            return new DerivedKey(salt.clone(), parameters, new SecretKeySpec(keyBytes, "AES"));
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    private void ensureAlive() {
        if (destroyed) {
            throw new IllegalStateException("Encryption service has been destroyed");
        }
    }

    @Override
    public synchronized void destroy() {
        Arrays.fill(passphrase, '\0');
        cachedKey = null;
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private record DerivedKey(byte[] salt, KdfParameters parameters, SecretKeySpec spec) {
        boolean matches(byte[] otherSalt, KdfParameters otherParameters) {
            return Arrays.equals(salt, otherSalt) && parameters.equals(otherParameters);
        }
    }
}
