package com.portfolio.mirror.service.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfolio.mirror.common.exception.SymbolNotFoundException;
import com.portfolio.mirror.common.exception.ValidationException;
import com.portfolio.mirror.model.documents.SymbolInfo;
import com.portfolio.mirror.repo.documents.SymbolInfoRepo;
import com.portfolio.mirror.service.gateway.BrokerageGatewayClient;
import com.portfolio.mirror.service.person.PersonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Maps tickers to brokerage symbol ids. Looks in the local symbol collection first and falls back to
 * the brokerage search endpoint, persisting what it learns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SymbolService {

    private final SymbolInfoRepo symbolRepo;
    private final BrokerageGatewayClient gateway;
    private final PersonService personService;
    private final Clock clock;

    public SymbolInfo resolve(String symbol) {
        String ticker = normalize(symbol);
        return symbolRepo.findBySymbol(ticker).orElseGet(() -> {
            String person = personService.findAvailablePerson();
            List<JsonNode> matches = gateway.searchSymbols(person, ticker);
            JsonNode exact = matches.stream()
                    .filter(s -> ticker.equals(s.path("symbol").asText()))
                    .findFirst()
                    .orElseThrow(() -> new SymbolNotFoundException(ticker));
            SymbolInfo saved = symbolRepo.save(toSymbolInfo(exact));
            log.info("Resolved {} to symbol id {}", ticker, saved.getSymbolId());
            return saved;
        });
    }

    /**
     * Local prefix search; goes upstream only when nothing is known locally.
     */
    public List<SymbolInfo> search(String prefix, int limit) {
        String p = normalize(prefix);
        int size = Math.max(1, limit);
        List<SymbolInfo> local = symbolRepo.findBySymbolStartingWithOrderBySymbolAsc(p, PageRequest.of(0, size));
        if (!local.isEmpty()) {
            return local;
        }
        String person = personService.findAvailablePerson();
        List<SymbolInfo> found = gateway.searchSymbols(person, p).stream()
                .limit(size)
                .map(this::toSymbolInfo)
                .map(s -> symbolRepo.findBySymbol(s.getSymbol()).orElseGet(() -> symbolRepo.save(s)))
                .toList();
        log.debug("Upstream search for '{}' returned {} symbols", p, found.size());
        return found;
    }

    private SymbolInfo toSymbolInfo(JsonNode s) {
        return SymbolInfo.builder()
                .symbol(s.path("symbol").asText())
                .symbolId(s.path("symbolId").asLong())
                .description(s.path("description").asText(null))
                .securityType(s.path("securityType").asText(null))
                .exchange(s.path("listingExchange").asText(s.path("exchange").asText(null)))
                .currency(s.path("currency").asText(null))
                .tradable(s.path("isTradable").asBoolean(true))
                .quotable(s.path("isQuotable").asBoolean(true))
                .hasOptions(s.path("hasOptions").asBoolean(false))
                .updatedAt(clock.instant())
                .build();
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException("Symbol is required");
        }
        return symbol.trim().toUpperCase();
    }
}
