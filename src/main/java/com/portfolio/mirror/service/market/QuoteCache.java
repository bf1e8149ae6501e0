package com.portfolio.mirror.service.market;

import com.portfolio.mirror.model.brokerage.BrokerQuote;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-symbol quote cache. Entries past the TTL are not evicted; they stay readable as a stale fallback
 * until overwritten by a newer fetch or dropped by {@link #clear()}. Memory therefore grows with the set of
 * symbols ever quoted.
 */
public class QuoteCache {

    private final ConcurrentHashMap<String, CachedQuote> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public QuoteCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Entry younger than the TTL, if any.
     */
    public Optional<CachedQuote> getFresh(String symbol) {
        return get(symbol).filter(this::isFresh);
    }

    /**
     * Entry regardless of age.
     */
    public Optional<CachedQuote> get(String symbol) {
        return Optional.ofNullable(store.get(key(symbol)));
    }

    public CachedQuote put(String symbol, BrokerQuote quote) {
        CachedQuote entry = new CachedQuote(key(symbol), quote, clock.instant());
        store.put(entry.symbol(), entry);
        return entry;
    }

    public boolean isFresh(CachedQuote entry) {
        return Duration.between(entry.fetchedAt(), clock.instant()).compareTo(ttl) < 0;
    }

    public int clear() {
        int size = store.size();
        store.clear();
        return size;
    }

    public int size() {
        return store.size();
    }

    private static String key(String symbol) {
        return symbol.trim().toUpperCase();
    }

    public record CachedQuote(String symbol, BrokerQuote payload, Instant fetchedAt) {
    }
}
