package org.rostilos.gitvault.vcsauth.bitbucket.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.rostilos.gitvault.vcsauth.PlatformApiException;
import org.rostilos.gitvault.vcsauth.TokenInspection;
import org.rostilos.gitvault.vcsauth.bitbucket.BitbucketConfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code GET /user} on Bitbucket Cloud. OAuth tokens report their scopes in
 * {@code X-OAuth-Scopes}; app passwords and access tokens do not.
 */
public class GetCurrentUserAction {

    private final OkHttpClient authorizedOkHttpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    public GetCurrentUserAction(OkHttpClient authorizedOkHttpClient, ObjectMapper objectMapper, String apiBase) {
        this.authorizedOkHttpClient = authorizedOkHttpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
    }

    public TokenInspection getCurrentUser() throws IOException {
        Request req = new Request.Builder()
                .url(apiBase + "/user")
                .header("Accept", "application/json")
                .get()
                .build();

        try (Response resp = authorizedOkHttpClient.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                throw new PlatformApiException("Bitbucket user lookup", resp.code());
            }
            ResponseBody body = resp.body();
            JsonNode user = body != null ? objectMapper.readTree(body.byteStream()) : objectMapper.createObjectNode();
            String login = user.hasNonNull("username") ? user.get("username").asText() : null;
            String id = user.hasNonNull("account_id") ? user.get("account_id").asText()
                    : user.hasNonNull("uuid") ? user.get("uuid").asText() : null;
            return new TokenInspection(login, id, parseScopes(resp.header(BitbucketConfig.OAUTH_SCOPES_HEADER)), null);
        }
    }

    static List<String> parseScopes(String header) {
        if (header == null) {
            return null;
        }
        List<String> scopes = new ArrayList<>();
        for (String scope : header.split("[\\s,]+")) {
            if (!scope.isBlank()) {
                scopes.add(scope);
            }
        }
        return scopes;
    }
}
