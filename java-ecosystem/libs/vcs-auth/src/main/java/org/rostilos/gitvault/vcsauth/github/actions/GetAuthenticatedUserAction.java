package org.rostilos.gitvault.vcsauth.github.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.rostilos.gitvault.core.model.ETwoFactorMethod;
import org.rostilos.gitvault.vcsauth.PlatformApiException;
import org.rostilos.gitvault.vcsauth.TokenInspection;
import org.rostilos.gitvault.vcsauth.github.GitHubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code GET /user} with whatever authentication the client carries. Scopes come from
 * the {@code X-OAuth-Scopes} header, which fine-grained tokens do not send.
 */
public class GetAuthenticatedUserAction {

    private static final Logger log = LoggerFactory.getLogger(GetAuthenticatedUserAction.class);

    private static final DateTimeFormatter EXPIRATION_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss VV", Locale.ROOT);

    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public GetAuthenticatedUserAction(OkHttpClient authorizedOkHttpClient, ObjectMapper objectMapper, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
    }

    public TokenInspection getAuthenticatedUser() throws IOException {
        return getAuthenticatedUser(null);
    }

    /**
     * @param otpCode one-time code to send in {@code X-GitHub-OTP}, or {@code null}
     * @throws OtpRequiredException when GitHub asks for (another) one-time code
     */
    public TokenInspection getAuthenticatedUser(String otpCode) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(apiBase + "/user")
                .header("Accept", GitHubConfig.ACCEPT)
                .header("X-GitHub-Api-Version", GitHubConfig.API_VERSION)
                .get();
        if (otpCode != null) {
            builder.header(GitHubConfig.OTP_HEADER, otpCode);
        }

        try (Response resp = authorizedOkHttpClient.newCall(builder.build()).execute()) {
            if (!resp.isSuccessful()) {
                String otp = resp.header(GitHubConfig.OTP_HEADER);
                if (resp.code() == 401 && otp != null && otp.toLowerCase(Locale.ROOT).startsWith("required")) {
                    throw new OtpRequiredException("GitHub user lookup", parseOtpMethod(otp));
                }
                throw new PlatformApiException("GitHub user lookup", resp.code());
            }

            ResponseBody body = resp.body();
            JsonNode user = body != null ? objectMapper.readTree(body.byteStream()) : objectMapper.createObjectNode();
            String login = user.hasNonNull("login") ? user.get("login").asText() : null;
            String id = user.hasNonNull("id") ? user.get("id").asText() : null;
            return new TokenInspection(login, id,
                    parseScopes(resp.header(GitHubConfig.OAUTH_SCOPES_HEADER)),
                    parseExpiration(resp.header(GitHubConfig.TOKEN_EXPIRATION_HEADER)));
        }
    }

    static ETwoFactorMethod parseOtpMethod(String header) {
        int separator = header.indexOf(';');
        return ETwoFactorMethod.fromTag(separator >= 0 ? header.substring(separator + 1) : null);
    }

    static List<String> parseScopes(String header) {
        if (header == null) {
            return null;
        }
        List<String> scopes = new ArrayList<>();
        for (String scope : header.split(",")) {
            if (!scope.isBlank()) {
                scopes.add(scope.trim());
            }
        }
        return scopes;
    }

    static Instant parseExpiration(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(header.trim(), EXPIRATION_FORMAT).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unrecognized token expiration header format: {}", header);
            return null;
        }
    }
}
