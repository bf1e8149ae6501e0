package com.portfolio.mirror.model.dto;

import java.time.Instant;

/**
 * Read-only health projection over a person's credentials.
 */
public record TokenStatus(String personName,
                          RefreshTokenStatus refreshToken,
                          AccessTokenStatus accessToken,
                          boolean isHealthy) {

    public record RefreshTokenStatus(boolean exists, Instant expiresAt, Instant lastUsed,
                                     int errorCount, String lastError) {
    }

    public record AccessTokenStatus(boolean exists, Instant expiresAt, Instant lastUsed, String apiServer) {
    }
}
