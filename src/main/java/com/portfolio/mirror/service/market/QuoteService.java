package com.portfolio.mirror.service.market;

import com.portfolio.mirror.common.exception.SymbolNotFoundException;
import com.portfolio.mirror.common.exception.ValidationException;
import com.portfolio.mirror.model.brokerage.BrokerQuote;
import com.portfolio.mirror.model.documents.SymbolInfo;
import com.portfolio.mirror.model.dto.QuoteView;
import com.portfolio.mirror.service.gateway.BrokerageGatewayClient;
import com.portfolio.mirror.service.person.PersonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Quote read path. Fresh cache entries are served as-is; otherwise the quote is fetched through the gateway.
 * When the live fetch fails, the last cached value is served (flagged stale) regardless of age, and the failure
 * only reaches the caller when nothing was ever cached for the symbol.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuoteService {

    private final QuoteCache cache;
    private final BrokerageGatewayClient gateway;
    private final SymbolService symbolService;
    private final PersonService personService;

    public QuoteView getQuote(String symbol, boolean forceRefresh) {
        String ticker = normalize(symbol);
        if (!forceRefresh) {
            Optional<QuoteCache.CachedQuote> fresh = cache.getFresh(ticker);
            if (fresh.isPresent()) {
                log.debug("Cache hit for {}", ticker);
                return view(fresh.get(), false);
            }
        }
        try {
            return view(cache.put(ticker, fetchOne(ticker)), false);
        } catch (RuntimeException e) {
            return staleOrThrow(ticker, e);
        }
    }

    /**
     * Cache misses are fetched in one upstream call; symbols the batch response left out are fetched one by one.
     * Unknown symbols are left out of the result.
     */
    public List<QuoteView> getMultipleQuotes(Collection<String> symbols, boolean forceRefresh) {
        Set<String> tickers = new LinkedHashSet<>();
        for (String s : symbols) {
            if (s != null && !s.isBlank()) tickers.add(normalize(s));
        }
        if (tickers.isEmpty()) {
            throw new ValidationException("At least one symbol is required");
        }

        Map<String, QuoteView> result = new LinkedHashMap<>();
        List<String> misses = new ArrayList<>();
        for (String ticker : tickers) {
            Optional<QuoteCache.CachedQuote> fresh = forceRefresh ? Optional.empty() : cache.getFresh(ticker);
            if (fresh.isPresent()) {
                result.put(ticker, view(fresh.get(), false));
            } else {
                misses.add(ticker);
            }
        }

        if (!misses.isEmpty()) {
            Set<String> unresolved = new LinkedHashSet<>(misses);
            try {
                for (BrokerQuote quote : fetchBatch(misses)) {
                    String ticker = quote.getSymbol() == null ? null : quote.getSymbol().toUpperCase();
                    if (ticker != null && unresolved.remove(ticker)) {
                        result.put(ticker, view(cache.put(ticker, quote), false));
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Batch quote fetch for {} symbols failed: {}", misses.size(), e.getMessage());
                for (String ticker : unresolved) {
                    result.put(ticker, staleOrThrow(ticker, e));
                }
                unresolved.clear();
            }
            for (String ticker : unresolved) {
                try {
                    result.put(ticker, getQuote(ticker, true));
                } catch (SymbolNotFoundException e) {
                    log.info("Skipping unknown symbol {}", ticker);
                }
            }
        }

        List<QuoteView> ordered = new ArrayList<>(result.size());
        for (String ticker : tickers) {
            QuoteView v = result.get(ticker);
            if (v != null) ordered.add(v);
        }
        return ordered;
    }

    /**
     * Operator-triggered clear; returns the number of entries dropped.
     */
    public int clearCache() {
        int dropped = cache.clear();
        log.info("Quote cache cleared ({} entries)", dropped);
        return dropped;
    }

    private BrokerQuote fetchOne(String ticker) {
        SymbolInfo info = symbolService.resolve(ticker);
        String person = personService.findAvailablePerson();
        return gateway.getQuotes(person, List.of(info.getSymbolId())).stream()
                .findFirst()
                .orElseThrow(() -> new SymbolNotFoundException(ticker));
    }

    private List<BrokerQuote> fetchBatch(List<String> tickers) {
        List<Long> ids = new ArrayList<>();
        for (String ticker : tickers) {
            try {
                ids.add(symbolService.resolve(ticker).getSymbolId());
            } catch (SymbolNotFoundException e) {
                log.debug("No symbol id for {}", ticker);
            }
        }
        if (ids.isEmpty()) return List.of();
        return gateway.getQuotes(personService.findAvailablePerson(), ids);
    }

    private QuoteView staleOrThrow(String ticker, RuntimeException failure) {
        Optional<QuoteCache.CachedQuote> cached = cache.get(ticker);
        if (cached.isPresent()) {
            log.warn("Live quote for {} failed ({}); serving cached value from {}", ticker,
                    failure.getMessage(), cached.get().fetchedAt());
            return view(cached.get(), !cache.isFresh(cached.get()));
        }
        throw failure;
    }

    private static QuoteView view(QuoteCache.CachedQuote entry, boolean stale) {
        return new QuoteView(entry.payload(), entry.fetchedAt(), stale);
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Symbol is required");
        }
        return symbol.trim().toUpperCase();
    }
}
