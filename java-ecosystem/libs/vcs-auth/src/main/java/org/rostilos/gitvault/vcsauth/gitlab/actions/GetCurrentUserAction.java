package org.rostilos.gitvault.vcsauth.gitlab.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.rostilos.gitvault.vcsauth.PlatformApiException;
import org.rostilos.gitvault.vcsauth.TokenInspection;

import java.io.IOException;

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
                throw new PlatformApiException("GitLab user lookup", resp.code());
            }
            ResponseBody body = resp.body();
            JsonNode user = body != null ? objectMapper.readTree(body.byteStream()) : objectMapper.createObjectNode();
            return new TokenInspection(
                    user.hasNonNull("username") ? user.get("username").asText() : null,
                    user.hasNonNull("id") ? user.get("id").asText() : null,
                    null,
                    null);
        }
    }
}
