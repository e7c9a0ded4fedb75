package org.rostilos.gitvault.vcsauth.http;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.rostilos.gitvault.core.model.SecretValue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Builds OkHttp clients that authenticate every request. All clients share the
 * connection pool of one base client.
 */
public class AuthorizedHttpClientFactory {

    private final OkHttpClient baseClient;

    public AuthorizedHttpClientFactory() {
        this(Duration.ofSeconds(30), Duration.ofSeconds(60));
    }

    public AuthorizedHttpClientFactory(Duration connectTimeout, Duration readTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .writeTimeout(readTimeout)
                .build());
    }

    public AuthorizedHttpClientFactory(OkHttpClient baseClient) {
        this.baseClient = baseClient;
    }

    public OkHttpClient createClient() {
        return baseClient;
    }

    /**
     * Create an OkHttpClient that sends {@code token} as an OAuth2 bearer token.
     * The header value is materialized per request, not kept in the client.
     */
    public OkHttpClient createClientWithBearerToken(SecretValue token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("Access token cannot be null or empty");
        }
        return baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", "Bearer " + token.reveal())
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }

    /**
     * Create an OkHttpClient that uses HTTP basic authentication.
     */
    public OkHttpClient createClientWithBasicAuth(String username, SecretValue password) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username cannot be null or empty");
        }
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        return baseClient.newBuilder()
                .addInterceptor(chain -> {
                    Request original = chain.request();
                    Request authorized = original.newBuilder()
                            .header("Authorization", Credentials.basic(username, password.reveal(), StandardCharsets.UTF_8))
                            .build();
                    return chain.proceed(authorized);
                })
                .build();
    }
}
