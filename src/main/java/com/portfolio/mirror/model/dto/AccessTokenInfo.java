package com.portfolio.mirror.model.dto;

import java.time.Instant;

/**
 * A usable access token together with the server it is valid for.
 */
public record AccessTokenInfo(String accessToken, String apiServer, String personName, Instant expiresAt) {
}
