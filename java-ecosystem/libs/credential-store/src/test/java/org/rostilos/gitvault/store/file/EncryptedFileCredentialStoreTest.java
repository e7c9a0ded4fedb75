package org.rostilos.gitvault.store.file;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.rostilos.gitvault.core.exception.AuthException;
import org.rostilos.gitvault.core.exception.EAuthErrorKind;
import org.rostilos.gitvault.core.model.Credential;
import org.rostilos.gitvault.core.model.CredentialKey;
import org.rostilos.gitvault.core.model.CredentialMetadata;
import org.rostilos.gitvault.core.model.EAuthMethod;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.security.crypto.CredentialEncryptionService;
import org.rostilos.gitvault.security.crypto.KdfParameters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EncryptedFileCredentialStore")
class EncryptedFileCredentialStoreTest {

    private static final String PASSPHRASE = "store-passphrase";
    private static final CredentialKey GITHUB_KEY = CredentialKey.of(EPlatform.GITHUB, "github.com");

    @TempDir
    Path tempDir;

    private Path storeFile;
    private EncryptedFileCredentialStore store;

    @BeforeEach
    void setUp() {
        storeFile = tempDir.resolve("gitvault").resolve("credentials.enc");
        store = open(PASSPHRASE);
    }

    @AfterEach
    void tearDown() {
        store.clear();
    }

    @Nested
    @DisplayName("get() / set()")
    class ReadWriteTests {

        @Test
        @DisplayName("should return what was stored")
        void shouldReturnWhatWasStored() {
            Credential credential = githubToken("ghp_" + "a".repeat(36));

            store.set(credential);

            assertThat(store.get(GITHUB_KEY)).contains(credential);
        }

        @Test
        @DisplayName("should keep refresh token, username and metadata")
        void shouldKeepAllFields() {
            Credential credential = Credential.builder()
                    .key(EPlatform.BITBUCKET, "bitbucket.org/team/repo")
                    .method(EAuthMethod.OAUTH)
                    .secret(SecretValue.of("access"))
                    .refreshToken(SecretValue.of("refresh"))
                    .username("dev")
                    .scopes("repository", "pullrequest")
                    .expiresAt(Instant.parse("2030-01-01T00:00:00Z"))
                    .metadata(CredentialMetadata.SOURCE, "bitbucket")
                    .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                    .updatedAt(Instant.parse("2024-02-01T00:00:00Z"))
                    .build();

            store.set(credential);

            Credential loaded = store.get(credential.getKey()).orElseThrow();
            assertThat(loaded).isEqualTo(credential);
            assertThat(loaded.getRefreshToken()).hasValueSatisfying(r -> assertThat(r.reveal()).isEqualTo("refresh"));
            assertThat(loaded.getScopes()).containsExactly("repository", "pullrequest");
        }

        @Test
        @DisplayName("should be readable by a new instance with the same passphrase")
        void shouldBeReadableByNewInstance() {
            store.set(githubToken("ghp_persisted"));

            EncryptedFileCredentialStore reopened = open(PASSPHRASE);

            assertThat(reopened.get(GITHUB_KEY)).hasValueSatisfying(
                    c -> assertThat(c.getSecret().reveal()).isEqualTo("ghp_persisted"));
        }

        @Test
        @DisplayName("should replace credential with same key")
        void shouldReplaceCredentialWithSameKey() {
            store.set(githubToken("ghp_old"));
            store.set(githubToken("ghp_new"));

            assertThat(store.list()).hasSize(1);
            assertThat(store.get(GITHUB_KEY).orElseThrow().getSecret().reveal()).isEqualTo("ghp_new");
        }

        @Test
        @DisplayName("should not destroy the caller's credential")
        void shouldNotDestroyCallerCredential() {
            Credential credential = githubToken("ghp_caller_owned");

            store.set(credential);

            assertThat(credential.getSecret().isDestroyed()).isFalse();
            assertThat(credential.getSecret().reveal()).isEqualTo("ghp_caller_owned");
        }

        @Test
        @DisplayName("should return empty when file does not exist")
        void shouldReturnEmptyWhenFileMissing() {
            assertThat(store.get(GITHUB_KEY)).isEmpty();
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("At rest")
    class AtRestTests {

        @Test
        @DisplayName("should never write the secret in plaintext")
        void shouldNeverWritePlaintext() throws IOException {
            store.set(githubToken("ghp_plaintext_marker"));

            byte[] raw = Files.readAllBytes(storeFile);
            String asText = new String(raw, StandardCharsets.ISO_8859_1);
            assertThat(asText).doesNotContain("ghp_plaintext_marker").doesNotContain("github.com");
        }

        @Test
        @DisabledOnOs(OS.WINDOWS)
        @DisplayName("should create the file readable by owner only")
        void shouldCreateOwnerOnlyFile() throws IOException {
            store.set(githubToken("ghp_mode"));

            assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(storeFile)))
                    .isEqualTo("rw-------");
        }

        @Test
        @DisplayName("should leave no temp files behind")
        void shouldLeaveNoTempFiles() throws IOException {
            store.set(githubToken("ghp_a"));
            store.set(githubToken("ghp_b"));

            try (var files = Files.list(storeFile.getParent())) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .containsExactlyInAnyOrder("credentials.enc", "credentials.enc.lock");
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should report STORAGE_CORRUPTED for a wrong passphrase")
        void shouldReportCorruptedForWrongPassphrase() {
            store.set(githubToken("ghp_locked"));

            EncryptedFileCredentialStore wrong = open("not-the-passphrase");

            assertThatThrownBy(() -> wrong.get(GITHUB_KEY))
                    .isInstanceOfSatisfying(AuthException.class, e -> {
                        assertThat(e.getKind()).isEqualTo(EAuthErrorKind.STORAGE_CORRUPTED);
                        assertThat(e.getMessage()).doesNotContain("ghp_locked").doesNotContain(PASSPHRASE);
                        assertThat(e.getHint()).isNotBlank();
                    });
        }

        @Test
        @DisplayName("should report STORAGE_CORRUPTED for garbage content")
        void shouldReportCorruptedForGarbage() throws IOException {
            Files.createDirectories(storeFile.getParent());
            Files.write(storeFile, "definitely not an envelope".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> store.get(GITHUB_KEY))
                    .isInstanceOfSatisfying(AuthException.class,
                            e -> assertThat(e.getKind()).isEqualTo(EAuthErrorKind.STORAGE_CORRUPTED));
        }

        @Test
        @DisplayName("should report STORAGE_CORRUPTED when the header asks for gigabytes of key derivation memory")
        void shouldReportCorruptedForInflatedKdfHeader() throws IOException {
            store.set(githubToken("ghp_header"));
            byte[] raw = Files.readAllBytes(storeFile);
            ByteBuffer.wrap(raw, 1, 8).putInt(8).putInt(4 * 1024 * 1024);
            Files.write(storeFile, raw);

            assertThatThrownBy(() -> open(PASSPHRASE).get(GITHUB_KEY))
                    .isInstanceOfSatisfying(AuthException.class,
                            e -> assertThat(e.getKind()).isEqualTo(EAuthErrorKind.STORAGE_CORRUPTED));
        }

        @Test
        @DisplayName("should refuse to overwrite a file it cannot decrypt")
        void shouldRefuseToOverwriteCorruptedFile() {
            store.set(githubToken("ghp_original"));
            EncryptedFileCredentialStore wrong = open("not-the-passphrase");

            assertThatThrownBy(() -> wrong.set(githubToken("ghp_intruder")))
                    .isInstanceOf(AuthException.class);
            assertThat(store.get(GITHUB_KEY).orElseThrow().getSecret().reveal()).isEqualTo("ghp_original");
        }

        @Test
        @DisplayName("should be unavailable when the directory cannot be created")
        void shouldBeUnavailableWhenDirectoryBlocked() throws IOException {
            Path blocker = tempDir.resolve("blocker");
            Files.write(blocker, new byte[]{1});
            EncryptedFileCredentialStore blocked = new EncryptedFileCredentialStore(
                    blocker.resolve("credentials.enc"),
                    new CredentialEncryptionService(PASSPHRASE.toCharArray(), KdfParameters.minimal()));

            assertThat(blocked.isAvailable()).isFalse();
            assertThatThrownBy(() -> blocked.set(githubToken("ghp_nowhere")))
                    .isInstanceOfSatisfying(AuthException.class,
                            e -> assertThat(e.getKind()).isEqualTo(EAuthErrorKind.STORAGE_UNAVAILABLE));
        }
    }

    @Nested
    @DisplayName("isAvailable()")
    class AvailabilityTests {

        @Test
        @DisplayName("should report a missing directory as available without creating it")
        void shouldNotCreateDirectoryWhenCheckingAvailability() {
            Path nested = tempDir.resolve("a").resolve("b").resolve("credentials.enc");
            EncryptedFileCredentialStore fresh = new EncryptedFileCredentialStore(nested,
                    new CredentialEncryptionService(PASSPHRASE.toCharArray(), KdfParameters.minimal()));

            assertThat(fresh.isAvailable()).isTrue();
            assertThat(tempDir.resolve("a")).doesNotExist();

            fresh.set(githubToken("ghp_first_write"));

            assertThat(nested).exists();
        }

        @Test
        @DisplayName("should be unavailable once the encryption key is destroyed")
        void shouldBeUnavailableAfterDestroy() {
            CredentialEncryptionService service =
                    new CredentialEncryptionService(PASSPHRASE.toCharArray(), KdfParameters.minimal());
            EncryptedFileCredentialStore destroyed = new EncryptedFileCredentialStore(storeFile, service);

            service.destroy();

            assertThat(destroyed.isAvailable()).isFalse();
        }
    }

    @Nested
    @DisplayName("delete() / clear()")
    class DeleteTests {

        @Test
        @DisplayName("should delete only the given key")
        void shouldDeleteOnlyGivenKey() {
            store.set(githubToken("ghp_keep"));
            CredentialKey other = CredentialKey.of(EPlatform.GITHUB, "github.com/org/repo");
            store.set(githubToken("ghp_drop").toBuilder().key(other).build());

            assertThat(store.delete(other)).isTrue();
            assertThat(store.delete(other)).isFalse();

            assertThat(store.get(other)).isEmpty();
            assertThat(store.get(GITHUB_KEY)).isPresent();
        }

        @Test
        @DisplayName("should remove the file on clear")
        void shouldRemoveFileOnClear() {
            store.set(githubToken("ghp_gone"));

            store.clear();

            assertThat(storeFile).doesNotExist();
            assertThat(store.list()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should keep every concurrent write")
        void shouldKeepEveryConcurrentWrite() throws Exception {
            int writers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < writers; i++) {
                    int index = i;
                    // separate instances share only the file
                    EncryptedFileCredentialStore writer = open(PASSPHRASE);
                    futures.add(executor.submit(() -> {
                        start.await();
                        writer.set(githubToken("ghp_writer_" + index).toBuilder()
                                .key(EPlatform.GITHUB, "github.com/org/repo-" + index)
                                .build());
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            List<Credential> stored = open(PASSPHRASE).list();
            assertThat(stored).hasSize(writers);
            for (int i = 0; i < writers; i++) {
                CredentialKey key = CredentialKey.of(EPlatform.GITHUB, "github.com/org/repo-" + i);
                assertThat(store.get(key)).hasValueSatisfying(
                        c -> assertThat(c.getSecret().reveal()).startsWith("ghp_writer_"));
            }
        }
    }

    private EncryptedFileCredentialStore open(String passphrase) {
        return new EncryptedFileCredentialStore(storeFile,
                new CredentialEncryptionService(passphrase.toCharArray(), KdfParameters.minimal()));
    }

    private static Credential githubToken(String token) {
        return Credential.builder()
                .key(GITHUB_KEY)
                .method(EAuthMethod.TOKEN)
                .secret(SecretValue.of(token))
                .build();
    }
}
