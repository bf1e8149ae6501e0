package com.portfolio.mirror.web;

import com.portfolio.mirror.common.Result;
import com.portfolio.mirror.common.exception.Http;
import com.portfolio.mirror.service.market.SymbolService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/symbols")
@RequiredArgsConstructor
public class SymbolController {

    private final SymbolService symbols;

    @GetMapping("/search")
    public ResponseEntity<?> search(@RequestParam("prefix") String prefix,
                                    @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return Http.from(Result.ok(symbols.search(prefix, limit)));
    }

    @GetMapping("/{symbol}")
    public ResponseEntity<?> get(@PathVariable("symbol") String symbol) {
        return Http.from(Result.ok(symbols.resolve(symbol)));
    }
}
