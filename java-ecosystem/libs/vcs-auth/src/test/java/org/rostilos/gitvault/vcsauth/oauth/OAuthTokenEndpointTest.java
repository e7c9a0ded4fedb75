package org.rostilos.gitvault.vcsauth.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.vcsauth.PlatformApiException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OAuthTokenEndpoint")
class OAuthTokenEndpointTest {

    private MockWebServer server;
    private OAuthTokenEndpoint endpoint;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        endpoint = new OAuthTokenEndpoint(new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String tokenUrl() {
        return server.url("/oauth/token").toString();
    }

    @Test
    @DisplayName("should send client credentials as basic auth when asked to")
    void shouldRefreshWithBasicClientAuth() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"access_token\":\"new-access\",\"refresh_token\":\"new-refresh\",\"expires_in\":7200,\"scopes\":\"repository account\"}"));

        OAuthTokenResponse token = endpoint.refresh(tokenUrl(),
                new OAuthClient("consumer", SecretValue.of("consumer-secret"), true),
                SecretValue.of("old-refresh"));

        assertThat(token.accessToken().reveal()).isEqualTo("new-access");
        assertThat(token.refreshToken().reveal()).isEqualTo("new-refresh");
        assertThat(token.expiresIn()).isEqualTo(Duration.ofHours(2));
        assertThat(token.scopes()).containsExactly("repository", "account");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization"))
                .isEqualTo(Credentials.basic("consumer", "consumer-secret", StandardCharsets.UTF_8));
        String form = request.getBody().readUtf8();
        assertThat(form).contains("grant_type=refresh_token").contains("refresh_token=old-refresh");
        assertThat(form).doesNotContain("client_secret");
    }

    @Test
    @DisplayName("should send client id in the form for public clients")
    void shouldRefreshWithFormClientAuth() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"a\",\"scope\":\"api read_user\"}"));

        OAuthTokenResponse token = endpoint.refresh(tokenUrl(), OAuthClient.publicClient("app-id"), SecretValue.of("r"));

        assertThat(token.refreshToken()).isNull();
        assertThat(token.expiresIn()).isNull();
        assertThat(token.scopes()).containsExactly("api", "read_user");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("Authorization")).isNull();
        assertThat(request.getBody().readUtf8()).contains("client_id=app-id").doesNotContain("client_secret");
    }

    @Test
    @DisplayName("should request client credentials grant with scopes")
    void shouldRequestClientCredentials() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"access_token\":\"cc\"}"));

        endpoint.clientCredentials(tokenUrl(), new OAuthClient("key", SecretValue.of("secret"), true),
                List.of("repository", "account"));

        String form = server.takeRequest().getBody().readUtf8();
        assertThat(form).contains("grant_type=client_credentials").contains("scope=repository%20account");
    }

    @Test
    @DisplayName("should surface the OAuth error code only")
    void shouldRaiseOAuthError() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":\"invalid_grant\",\"error_description\":\"refresh token old-refresh revoked\"}"));

        assertThatThrownBy(() -> endpoint.refresh(tokenUrl(), OAuthClient.publicClient("app"), SecretValue.of("old-refresh")))
                .isInstanceOf(OAuthErrorException.class)
                .hasMessageNotContaining("old-refresh")
                .satisfies(e -> assertThat(((OAuthErrorException) e).isInvalidGrant()).isTrue());
    }

    @Test
    @DisplayName("should raise plain API exception for non-JSON failures")
    void shouldRaiseApiExceptionForHtml() {
        server.enqueue(new MockResponse().setResponseCode(502).setBody("<html>bad gateway</html>"));

        assertThatThrownBy(() -> endpoint.refresh(tokenUrl(), OAuthClient.publicClient("app"), SecretValue.of("r")))
                .isExactlyInstanceOf(PlatformApiException.class)
                .satisfies(e -> assertThat(((PlatformApiException) e).isServerError()).isTrue());
    }

    @Test
    @DisplayName("should read verification_url as sent by Google-style servers")
    void shouldReadVerificationUrl() throws Exception {
        server.enqueue(new MockResponse().setBody(
                "{\"device_code\":\"d\",\"user_code\":\"U\",\"verification_url\":\"https://example.com/activate\"}"));

        DeviceCodeResponse response = endpoint.requestDeviceCode(server.url("/device").toString(), "app", List.of());

        assertThat(response.verificationUri()).isEqualTo("https://example.com/activate");
        assertThat(response.expiresIn()).isEqualTo(Duration.ofSeconds(900));
        assertThat(response.interval()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should sanitize free-form error codes")
    void shouldSanitizeErrorCode() {
        assertThat(OAuthErrorException.sanitize("slow_down")).isEqualTo("slow_down");
        assertThat(OAuthErrorException.sanitize("<script>")).isEqualTo("unknown_error");
        assertThat(OAuthErrorException.sanitize(null)).isEqualTo("unknown_error");
    }
}
