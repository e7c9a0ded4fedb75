package org.rostilos.gitvault.vcsauth.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code GET /personal_access_tokens/self}: scopes and expiry of the presented token.
 * OAuth tokens and tokens without {@code read_api} get a 4xx here, reported as empty.
 */
public class GetTokenSelfAction {

    private static final Logger log = LoggerFactory.getLogger(GetTokenSelfAction.class);

    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public GetTokenSelfAction(OkHttpClient authorizedOkHttpClient, ObjectMapper objectMapper, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
    }

    public Optional<TokenDetails> getTokenDetails() throws IOException {
        Request req = new Request.Builder()
                .url(apiBase + "/personal_access_tokens/self")
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                log.debug("GitLab token details unavailable (HTTP {})", resp.code());
                return Optional.empty();
            }
            ResponseBody body = resp.body();
            if (body == null) {
                return Optional.empty();
            }
            JsonNode token = objectMapper.readTree(body.byteStream());
            List<String> scopes = new ArrayList<>();
            token.path("scopes").forEach(scope -> scopes.add(scope.asText()));
            return Optional.of(new TokenDetails(scopes, parseExpiry(token.path("expires_at"))));
        }
    }

    /**
     * GitLab tokens expire at the start of their {@code expires_at} date, UTC.
     */
    private static Instant parseExpiry(JsonNode expiresAt) {
        if (!expiresAt.isTextual() || expiresAt.asText().isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(expiresAt.asText()).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unrecognized GitLab token expiry: {}", expiresAt.asText());
            return null;
        }
    }

    public record TokenDetails(List<String> scopes, Instant expiresAt) {
    }
}
