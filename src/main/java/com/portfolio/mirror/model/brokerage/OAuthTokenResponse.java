package com.portfolio.mirror.model.brokerage;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a successful {@code POST /oauth2/token}. Fields are null when upstream left them out;
 * {@link #missingFields()} tells the caller which ones.
 */
public record OAuthTokenResponse(String accessToken,
                                 String refreshToken,
                                 String apiServer,
                                 long expiresInSeconds) {

    public static OAuthTokenResponse from(JsonNode body) {
        if (body == null || !body.isObject()) {
            return new OAuthTokenResponse(null, null, null, 0L);
        }
        return new OAuthTokenResponse(
                text(body, "access_token"),
                text(body, "refresh_token"),
                text(body, "api_server"),
                seconds(body.get("expires_in")));
    }

    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (accessToken == null) missing.add("access_token");
        if (refreshToken == null) missing.add("refresh_token");
        if (apiServer == null) missing.add("api_server");
        if (expiresInSeconds <= 0) missing.add("expires_in");
        return missing;
    }

    public boolean isComplete() {
        return missingFields().isEmpty();
    }

    // Numeric text such as "1800" is accepted; anything unparsable counts as missing.
    private static long seconds(JsonNode node) {
        if (node == null) return 0L;
        if (node.isNumber()) return node.canConvertToLong() ? node.asLong() : 0L;
        if (node.isTextual()) return node.asLong(0L);
        return 0L;
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
