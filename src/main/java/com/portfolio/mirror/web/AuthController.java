package com.portfolio.mirror.web;

import com.portfolio.mirror.common.Result;
import com.portfolio.mirror.common.exception.Http;
import com.portfolio.mirror.model.dto.RefreshResult;
import com.portfolio.mirror.model.dto.SetupPersonRequest;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final TokenLifecycleManager tokens;

    @GetMapping("/access-token/{personName}")
    public ResponseEntity<?> accessToken(@PathVariable("personName") String personName) {
        return Http.from(Result.ok(tokens.getValidAccessToken(personName)));
    }

    @PostMapping("/refresh-token/{personName}")
    public ResponseEntity<?> refresh(@PathVariable("personName") String personName) {
        return Http.from(Result.ok(RefreshResult.of(tokens.refreshAccessToken(personName))));
    }

    @GetMapping("/token-status/{personName}")
    public ResponseEntity<?> status(@PathVariable("personName") String personName) {
        return Http.from(Result.ok(tokens.getTokenStatus(personName)));
    }

    @PostMapping("/test-connection/{personName}")
    public ResponseEntity<?> testConnection(@PathVariable("personName") String personName) {
        return Http.from(Result.ok(tokens.testConnection(personName)));
    }

    @PostMapping("/setup-person")
    public ResponseEntity<?> setupPerson(@Valid @RequestBody SetupPersonRequest req) {
        return Http.from(Result.ok(tokens.setupPersonToken(req.getPersonName(), req.getRefreshToken(),
                req.getDisplayName())), HttpStatus.CREATED);
    }
}
