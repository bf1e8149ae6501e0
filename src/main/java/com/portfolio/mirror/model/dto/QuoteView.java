package com.portfolio.mirror.model.dto;

import com.portfolio.mirror.model.brokerage.BrokerQuote;

import java.time.Instant;

/**
 * A quote as served to callers; {@code stale} is set when the live fetch failed and an older cached value was used.
 */
public record QuoteView(BrokerQuote quote, Instant fetchedAt, boolean stale) {
}
