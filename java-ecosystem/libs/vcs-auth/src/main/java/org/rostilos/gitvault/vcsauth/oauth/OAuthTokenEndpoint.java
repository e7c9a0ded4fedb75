package org.rostilos.gitvault.vcsauth.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.rostilos.gitvault.core.model.SecretValue;
import org.rostilos.gitvault.vcsauth.PlatformApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Client for the OAuth 2.0 token and device authorization endpoints of a platform.
 */
public class OAuthTokenEndpoint {

    private static final Logger log = LoggerFactory.getLogger(OAuthTokenEndpoint.class);

    static final String DEVICE_CODE_GRANT = "urn:ietf:params:oauth:grant-type:device_code";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OAuthTokenEndpoint(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Exchange a refresh token for a new access token.
     */
    public OAuthTokenResponse refresh(String tokenUrl, OAuthClient client, SecretValue refreshToken) throws IOException {
        FormBody.Builder form = new FormBody.Builder()
                .add("grant_type", "refresh_token")
                .add("refresh_token", refreshToken.reveal());
        return requestToken("token refresh", tokenUrl, client, form);
    }

    /**
     * Client credentials grant: the consumer itself is the principal.
     */
    public OAuthTokenResponse clientCredentials(String tokenUrl, OAuthClient client, List<String> scopes) throws IOException {
        FormBody.Builder form = new FormBody.Builder()
                .add("grant_type", "client_credentials");
        if (scopes != null && !scopes.isEmpty()) {
            form.add("scope", String.join(" ", scopes));
        }
        return requestToken("client credentials grant", tokenUrl, client, form);
    }

    public DeviceCodeResponse requestDeviceCode(String deviceCodeUrl, String clientId, List<String> scopes) throws IOException {
        FormBody.Builder form = new FormBody.Builder().add("client_id", clientId);
        if (scopes != null && !scopes.isEmpty()) {
            form.add("scope", String.join(" ", scopes));
        }
        Request request = new Request.Builder()
                .url(deviceCodeUrl)
                .header("Accept", "application/json")
                .post(form.build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            JsonNode json = readJson(response);
            if (!response.isSuccessful() || json == null || !json.hasNonNull("device_code")) {
                throw errorFrom("device authorization", response.code(), json);
            }
            String verificationUri = json.hasNonNull("verification_uri")
                    ? json.get("verification_uri").asText()
                    : json.path("verification_url").asText();
            return new DeviceCodeResponse(
                    json.get("device_code").asText(),
                    json.path("user_code").asText(),
                    verificationUri,
                    Duration.ofSeconds(json.path("expires_in").asLong(900)),
                    Duration.ofSeconds(json.path("interval").asLong(5)));
        }
    }

    /**
     * One poll of the token endpoint during a device authorization. Pending states come
     * back as an error code; GitHub sends them with HTTP 200, RFC 8628 servers with 400.
     */
    public DevicePollResult pollDeviceToken(String tokenUrl, String clientId, String deviceCode) throws IOException {
        Request request = new Request.Builder()
                .url(tokenUrl)
                .header("Accept", "application/json")
                .post(new FormBody.Builder()
                        .add("client_id", clientId)
                        .add("device_code", deviceCode)
                        .add("grant_type", DEVICE_CODE_GRANT)
                        .build())
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            JsonNode json = readJson(response);
            if (json != null && json.hasNonNull("access_token")) {
                return DevicePollResult.completed(OAuthTokenResponse.fromJson(json));
            }
            if (json != null && json.hasNonNull("error") && response.code() < 500) {
                return DevicePollResult.failed(OAuthErrorException.sanitize(json.get("error").asText()));
            }
            throw new PlatformApiException("device token poll", response.code());
        }
    }

    private OAuthTokenResponse requestToken(String operation, String tokenUrl, OAuthClient client,
                                            FormBody.Builder form) throws IOException {
        Request.Builder request = new Request.Builder()
                .url(tokenUrl)
                .header("Accept", "application/json");
        if (client.useBasicAuth()) {
            String secret = client.hasSecret() ? client.clientSecret().reveal() : "";
            request.header("Authorization", Credentials.basic(client.clientId(), secret, StandardCharsets.UTF_8));
        } else {
            form.add("client_id", client.clientId());
            if (client.hasSecret()) {
                form.add("client_secret", client.clientSecret().reveal());
            }
        }

        try (Response response = httpClient.newCall(request.post(form.build()).build()).execute()) {
            JsonNode json = readJson(response);
            if (!response.isSuccessful() || json == null || !json.hasNonNull("access_token")) {
                throw errorFrom(operation, response.code(), json);
            }
            OAuthTokenResponse token = OAuthTokenResponse.fromJson(json);
            log.debug("{} succeeded, expires in {}", operation, token.expiresIn());
            return token;
        }
    }

    private JsonNode readJson(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            return null;
        }
        byte[] bytes = body.bytes();
        if (bytes.length == 0) {
            return null;
        }
        try {
            return objectMapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            log.debug("Token endpoint returned a non-JSON body (HTTP {})", response.code());
            return null;
        }
    }

    private static PlatformApiException errorFrom(String operation, int status, JsonNode json) {
        if (json != null && json.hasNonNull("error")) {
            return new OAuthErrorException(operation, status, json.get("error").asText());
        }
        return new PlatformApiException(operation, status);
    }
}
