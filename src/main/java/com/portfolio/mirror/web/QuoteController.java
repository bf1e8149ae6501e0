package com.portfolio.mirror.web;

import com.portfolio.mirror.common.Result;
import com.portfolio.mirror.common.exception.Http;
import com.portfolio.mirror.service.market.QuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.Map;

@RestController
@RequestMapping("/api/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final QuoteService quotes;

    @GetMapping("/{symbol}")
    public ResponseEntity<?> quote(@PathVariable("symbol") String symbol,
                                   @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        return Http.from(Result.ok(quotes.getQuote(symbol, refresh)));
    }

    @GetMapping
    public ResponseEntity<?> quotes(@RequestParam("symbols") String symbols,
                                    @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {
        return Http.from(Result.ok(quotes.getMultipleQuotes(Arrays.asList(symbols.split(",")), refresh)));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache() {
        return Http.from(Result.ok(Map.of("cleared", quotes.clearCache())));
    }
}
