package com.portfolio.mirror.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the brokerage connection, the token lifecycle, the rate limiter and the quote cache.
 * Field initialisers mirror the property defaults.
 */
@Component
@Getter
@Setter
public class BrokerageConfig {

    @Value("${portfolio.brokerage.auth-url:https://login.questrade.com}")
    private String authUrl = "https://login.questrade.com";

    @Value("${portfolio.brokerage.request-timeout-ms:15000}")
    private long requestTimeoutMs = 15000;

    @Value("${portfolio.brokerage.connect-timeout-ms:5000}")
    private long connectTimeoutMs = 5000;

    @Value("${portfolio.token.min-refresh-length:20}")
    private int minRefreshTokenLength = 20;

    @Value("${portfolio.token.refresh-validity-days:7}")
    private int refreshValidityDays = 7;

    @Value("${portfolio.token.refresh-lock-timeout-ms:30000}")
    private long refreshLockTimeoutMs = 30000;

    @Value("${portfolio.rate-limit.max-per-second:20}")
    private int maxPerSecond = 20;

    @Value("${portfolio.rate-limit.max-concurrent:5}")
    private int maxConcurrent = 5;

    @Value("${portfolio.rate-limit.max-wait-ms:30000}")
    private long maxWaitMs = 30000;

    @Value("${portfolio.market.quote-ttl-seconds:60}")
    private long quoteTtlSeconds = 60;

    @Value("${portfolio.market.person:}")
    private String marketDataPerson = "";

    public Duration refreshValidity() {
        return Duration.ofDays(refreshValidityDays);
    }

    public Duration quoteTtl() {
        return Duration.ofSeconds(quoteTtlSeconds);
    }
}
