package org.rostilos.gitvault.store.file;

import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.security.crypto.CredentialEncryptionService;
import org.rostilos.gitvault.store.CredentialStore;
import org.rostilos.gitvault.store.StorageErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Credential set kept in a single passphrase-encrypted file.
 * <p>
 * Every write is a locked read-modify-write: an in-process lock (one per file path,
 * shared by all instances) plus an exclusive OS lock on {@code <file>.lock} for other
 * processes. The new content goes to a {@code 0600} temp file that is atomically
 * renamed over the store, so readers never see a partial file and need no lock.
 */
public class EncryptedFileCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptedFileCredentialStore.class);

    public static final String DEFAULT_NAME = "encrypted-file";

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final Map<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final String name;
    private final Path file;
    private final Path lockFile;
    private final CredentialEncryptionService encryptionService;
    private final CredentialFileCodec codec;

    public EncryptedFileCredentialStore(Path file, CredentialEncryptionService encryptionService) {
        this(DEFAULT_NAME, file, encryptionService);
    }

    public EncryptedFileCredentialStore(String name, Path file, CredentialEncryptionService encryptionService) {
        this.name = name;
        this.file = file.toAbsolutePath().normalize();
        this.lockFile = this.file.resolveSibling(this.file.getFileName() + ".lock");
        this.encryptionService = encryptionService;
        this.codec = new CredentialFileCodec();
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Credential> get(CredentialKey key) {
        Map<CredentialKey, Credential> credentials = readAll();
        Credential found = credentials.remove(key);
        destroyAll(credentials);
        return Optional.ofNullable(found);
    }

    @Override
    public void set(Credential credential) {
        mutate(credentials -> {
            Credential previous = credentials.put(credential.getKey(), credential.deepCopy());
            if (previous != null) {
                previous.destroySecrets();
            }
            return null;
        });
        log.debug("Stored credential {} in '{}'", credential.getKey(), name);
    }

    @Override
    public boolean delete(CredentialKey key) {
        Boolean deleted = mutate(credentials -> {
            Credential removed = credentials.remove(key);
            if (removed == null) {
                return null;
            }
            removed.destroySecrets();
            return Boolean.TRUE;
        });
        return deleted != null;
    }

    @Override
    public List<Credential> list() {
        Map<CredentialKey, Credential> credentials = readAll();
        List<Credential> result = new ArrayList<>(credentials.size());
        for (Credential credential : credentials.values()) {
            result.add(credential.withoutSecret());
        }
        destroyAll(credentials);
        return result;
    }

    @Override
    public void clear() {
        withWriteLock(() -> {
            Files.deleteIfExists(file);
            return null;
        });
        log.info("Cleared credential store '{}'", name);
    }

    @Override
    public boolean isAvailable() {
        if (encryptionService.isDestroyed()) {
            return false;
        }
        Path directory = file.getParent();
        if (directory == null) {
            return false;
        }
        // Missing directories are created on first write; the nearest existing one must allow that
        Path existing = directory;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.isDirectory(existing) || !Files.isWritable(existing)) {
            log.debug("Store directory {} is not writable and cannot be created", directory);
            return false;
        }
        return !Files.exists(file) || Files.isReadable(file);
    }

    /**
     * Decrypt the whole file. The returned credentials own fresh secret buffers.
     */
    private Map<CredentialKey, Credential> readAll() {
        byte[] envelope;
        try {
            envelope = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return new LinkedHashMap<>();
        } catch (IOException e) {
            throw StorageErrors.unavailable(name, "cannot read " + file, e);
        }

        byte[] plaintext;
        try {
            plaintext = encryptionService.decrypt(envelope);
        } catch (GeneralSecurityException e) {
            throw StorageErrors.corrupted(name, e);
        } catch (IllegalStateException e) {
            throw StorageErrors.unavailable(name, "encryption key has been destroyed", e);
        }

        try {
            return codec.decode(plaintext);
        } catch (IOException e) {
            throw StorageErrors.corrupted(name, e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private <T> T mutate(Function<Map<CredentialKey, Credential>, T> change) {
        return withWriteLock(() -> {
            Map<CredentialKey, Credential> credentials = readAll();
            try {
                T result = change.apply(credentials);
                writeAll(credentials);
                return result;
            } finally {
                destroyAll(credentials);
            }
        });
    }

    private <T> T withWriteLock(LockedAction<T> action) {
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(file, p -> new ReentrantLock());
        processLock.lock();
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                return action.run();
            }
        } catch (IOException e) {
            throw StorageErrors.unavailable(name, "cannot write " + file, e);
        } finally {
            processLock.unlock();
        }
    }

    private void writeAll(Map<CredentialKey, Credential> credentials) throws IOException {
        byte[] plaintext = codec.encode(credentials);
        byte[] envelope;
        try {
            envelope = encryptionService.encrypt(plaintext);
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to encrypt credential store", e);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }

        Path temp = createOwnerOnlyTempFile();
        try {
            Files.write(temp, envelope, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Path createOwnerOnlyTempFile() throws IOException {
        Path directory = file.getParent();
        String prefix = file.getFileName().toString() + ".";
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            FileAttribute<Set<PosixFilePermission>> permissions = PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            return Files.createTempFile(directory, prefix, ".tmp", permissions);
        }
        return Files.createTempFile(directory, prefix, ".tmp");
    }

    private static void destroyAll(Map<CredentialKey, Credential> credentials) {
        credentials.values().forEach(Credential::destroySecrets);
    }

    @FunctionalInterface
    private interface LockedAction<T> {
        T run() throws IOException;
    }
}
