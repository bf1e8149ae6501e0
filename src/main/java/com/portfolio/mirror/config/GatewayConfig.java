package com.portfolio.mirror.config;

import com.portfolio.mirror.service.gateway.UpstreamRateLimiter;
import com.portfolio.mirror.service.market.QuoteCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Process-scoped state shared by all brokerage callers.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public UpstreamRateLimiter upstreamRateLimiter(BrokerageConfig config) {
        return new UpstreamRateLimiter("brokerage", config.getMaxPerSecond(), config.getMaxConcurrent(),
                Duration.ofMillis(config.getMaxWaitMs()));
    }

    @Bean
    public QuoteCache quoteCache(BrokerageConfig config, Clock clock) {
        return new QuoteCache(clock, config.quoteTtl());
    }
}
