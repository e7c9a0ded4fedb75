package org.rostilos.gitvault.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SecretValue")
class SecretValueTest {

    @Nested
    @DisplayName("Factories")
    class FactoryTests {

        @Test
        @DisplayName("should copy input array")
        void shouldCopyInputArray() {
            byte[] input = "ghp_secret".getBytes(StandardCharsets.UTF_8);
            SecretValue secret = SecretValue.of(input);

            input[0] = 'X';

            assertThat(secret.reveal()).isEqualTo("ghp_secret");
        }

        @Test
        @DisplayName("should encode chars as UTF-8")
        void shouldEncodeCharsAsUtf8() {
            SecretValue secret = SecretValue.of("pässwörd".toCharArray());

            assertThat(secret.toByteArray()).isEqualTo("pässwörd".getBytes(StandardCharsets.UTF_8));
            assertThat(secret.toCharArray()).containsExactly("pässwörd".toCharArray());
        }

        @Test
        @DisplayName("should reject null input")
        void shouldRejectNullInput() {
            assertThatThrownBy(() -> SecretValue.of((byte[]) null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("empty secret should report empty")
        void emptySecretShouldReportEmpty() {
            assertThat(SecretValue.empty().isEmpty()).isTrue();
            assertThat(SecretValue.empty().length()).isZero();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("destroy should zero the buffer and block access")
        void destroyShouldZeroBufferAndBlockAccess() {
            byte[] owned = "token-value".getBytes(StandardCharsets.UTF_8);
            SecretValue secret = SecretValue.wrap(owned);

            secret.destroy();

            assertThat(secret.isDestroyed()).isTrue();
            assertThat(owned).containsOnly((byte) 0);
            assertThatThrownBy(secret::reveal).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("copy should survive destruction of the original")
        void copyShouldSurviveDestructionOfOriginal() {
            SecretValue original = SecretValue.of("abc12345");
            SecretValue copy = original.copy();

            original.destroy();

            assertThat(copy.reveal()).isEqualTo("abc12345");
        }

        @Test
        @DisplayName("destroying the shared empty instance should be a no-op")
        void destroyingEmptyShouldBeNoOp() {
            SecretValue.empty().destroy();

            assertThat(SecretValue.empty().isDestroyed()).isFalse();
        }
    }

    @Test
    @DisplayName("toString should never render the secret")
    void toStringShouldNeverRenderSecret() {
        SecretValue secret = SecretValue.of("ghp_topsecret");

        assertThat(secret.toString()).doesNotContain("topsecret").contains("****");
    }

    @Test
    @DisplayName("equals should compare content")
    void equalsShouldCompareContent() {
        assertThat(SecretValue.of("same")).isEqualTo(SecretValue.of("same"));
        assertThat(SecretValue.of("same")).isNotEqualTo(SecretValue.of("other"));
    }
}
