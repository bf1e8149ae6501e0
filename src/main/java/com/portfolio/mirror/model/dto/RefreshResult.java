package com.portfolio.mirror.model.dto;

import java.time.Instant;

/**
 * Token metadata returned after a refresh; the token value itself stays server side.
 */
public record RefreshResult(String personName, String apiServer, Instant expiresAt) {

    public static RefreshResult of(AccessTokenInfo info) {
        return new RefreshResult(info.personName(), info.apiServer(), info.expiresAt());
    }
}
