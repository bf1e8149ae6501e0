package com.portfolio.mirror.service.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.portfolio.mirror.common.constants.BrokerageConstants;
import com.portfolio.mirror.common.exception.AuthenticationFailedException;
import com.portfolio.mirror.common.exception.BaseBrokerException;
import com.portfolio.mirror.common.exception.InvalidRefreshTokenFormatException;
import com.portfolio.mirror.common.exception.NoRefreshTokenException;
import com.portfolio.mirror.common.exception.UpstreamAuthException;
import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
import com.portfolio.mirror.common.exception.ValidationException;
import com.portfolio.mirror.config.BrokerageConfig;
import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.brokerage.OAuthTokenResponse;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.model.dto.AccessTokenInfo;
import com.portfolio.mirror.model.dto.ConnectionTestResult;
import com.portfolio.mirror.model.dto.EnrollmentResult;
import com.portfolio.mirror.model.dto.TokenStatus;
import com.portfolio.mirror.service.credential.CredentialStore;
import com.portfolio.mirror.service.credential.TokenCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owns every write to credentials and person health.
 * <p>
 * Per person the lifecycle is: no credential, refresh token only, valid access token, access expired
 * (back to refresh token only). A failed refresh keeps the person enrolled but marks it unhealthy.
 * <p>
 * Refresh tokens are single-use, so refreshes for one person are serialized on a per-person lock and a
 * caller that waited on the lock re-checks the store before going upstream. Concurrent callers that all saw
 * an expired token therefore share one upstream refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLifecycleManager {

    private final CredentialStore store;
    private final OAuthTokenClient oauthClient;
    private final TokenCipher cipher;
    private final BrokerageConfig config;
    private final RestTemplate template;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    // =====================================================================================
    // Token supply
    // =====================================================================================

    /**
     * Returns the active, unexpired access token, refreshing first when there is none.
     *
     * @throws NoRefreshTokenException when the person has no active refresh token
     */
    public AccessTokenInfo getValidAccessToken(String personName) {
        Optional<AccessTokenInfo> current = currentAccessToken(personName);
        if (current.isPresent()) {
            return current.get();
        }
        return withRefreshLock(personName, () -> currentAccessToken(personName)
                .orElseGet(() -> doRefresh(personName)));
    }

    /**
     * Unconditional refresh: consumes the active refresh token and rotates both tokens.
     */
    public AccessTokenInfo refreshAccessToken(String personName) {
        return withRefreshLock(personName, () -> doRefresh(personName));
    }

    /**
     * Refresh triggered by upstream rejecting {@code rejectedToken}. If another caller already rotated
     * the pair while this one waited, the newer token is returned without a second upstream refresh.
     */
    public AccessTokenInfo refreshAfterRejection(String personName, String rejectedToken) {
        return withRefreshLock(personName, () -> currentAccessToken(personName)
                .filter(info -> !Objects.equals(info.accessToken(), rejectedToken))
                .orElseGet(() -> doRefresh(personName)));
    }

    // =====================================================================================
    // Enrollment
    // =====================================================================================

    public EnrollmentResult setupPersonToken(String personName, String refreshToken) {
        return setupPersonToken(personName, refreshToken, null);
    }

    /**
     * Enrolls (or re-enrolls) a person. The token is tried against upstream before anything is stored;
     * on success the new pair replaces every prior credential of the person.
     */
    public EnrollmentResult setupPersonToken(String personName, String refreshToken, String displayName) {
        if (personName == null || personName.isBlank()) {
            throw new ValidationException("Person name is required");
        }
        String candidate = refreshToken == null ? null : refreshToken.trim();
        validateFormat(candidate);

        log.info("Enrolling {}: trial refresh against brokerage", personName);
        OAuthTokenResponse minted = oauthClient.exchangeRefreshToken(personName, candidate);

        return withRefreshLock(personName, () -> {
            Instant now = clock.instant();
            persistRotation(personName, minted, now);
            store.purgeInactive(personName);
            upsertPerson(personName, now, p -> {
                if (displayName != null && !displayName.isBlank()) {
                    p.setDisplayName(displayName);
                } else if (p.getDisplayName() == null) {
                    p.setDisplayName(personName);
                }
                p.setActive(true);
                p.setHasValidToken(true);
                p.setLastTokenRefresh(now);
                p.setLastTokenError(null);
            });
            log.info("Enrolled {} against {}", personName, minted.apiServer());
            return new EnrollmentResult(personName, minted.apiServer());
        });
    }

    // =====================================================================================
    // Health
    // =====================================================================================

    public TokenStatus getTokenStatus(String personName) {
        Instant now = clock.instant();
        Optional<Credential> refresh = store.findActive(personName, CredentialKind.REFRESH);
        Optional<Credential> access = store.findActive(personName, CredentialKind.ACCESS)
                .filter(c -> !c.isExpiredAt(now));

        TokenStatus.RefreshTokenStatus refreshStatus = refresh
                .map(c -> new TokenStatus.RefreshTokenStatus(true, c.getExpiresAt(), c.getLastUsed(),
                        c.getErrorCount(), c.getLastError()))
                .orElse(new TokenStatus.RefreshTokenStatus(false, null, null, 0, null));
        TokenStatus.AccessTokenStatus accessStatus = access
                .map(c -> new TokenStatus.AccessTokenStatus(true, c.getExpiresAt(), c.getLastUsed(), c.getApiServer()))
                .orElse(new TokenStatus.AccessTokenStatus(false, null, null, null));

        boolean healthy = refresh.isPresent()
                && (access.isPresent() || refresh.get().getLastError() == null);
        return new TokenStatus(personName, refreshStatus, accessStatus, healthy);
    }

    /**
     * Bumps the error counter on the active refresh token and flags the person unhealthy. Never throws.
     */
    public void recordTokenError(String personName, String message) {
        try {
            Instant now = clock.instant();
            store.recordFailure(personName, message, now);
            upsertPerson(personName, now, p -> {
                p.setHasValidToken(false);
                p.setLastTokenError(message);
            });
        } catch (RuntimeException e) {
            log.error("Could not record token error for {}: {}", personName, e.toString());
        }
    }

    /**
     * End-to-end check: obtains a valid token and asks the brokerage for its server time.
     * Success clears the error bookkeeping.
     */
    public ConnectionTestResult testConnection(String personName) {
        AccessTokenInfo token = getValidAccessToken(personName);
        String url = token.apiServer() + BrokerageConstants.API_VERSION_PATH + BrokerageConstants.TIME_ENDPOINT;

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(token.accessToken());

        JsonNode body;
        try {
            body = template.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class).getBody();
        } catch (HttpStatusCodeException e) {
            recordTokenError(personName, "Connection test failed: HTTP " + e.getStatusCode().value());
            if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new AuthenticationFailedException(personName, BrokerageConstants.TIME_ENDPOINT, e);
            }
            throw new UpstreamUnavailableException(
                    "Connection test for " + personName + " failed with HTTP " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            recordTokenError(personName, "Connection test failed: " + e.getMessage());
            throw new UpstreamUnavailableException("Connection test for " + personName + " could not reach "
                    + token.apiServer(), 0, e);
        }

        Instant now = clock.instant();
        store.recordSuccess(personName, now);
        upsertPerson(personName, now, p -> {
            p.setHasValidToken(true);
            p.setLastTokenError(null);
        });
        String serverTime = body == null ? null : body.path("time").asText(null);
        log.info("Connection test for {} succeeded (server time {})", personName, serverTime);
        return new ConnectionTestResult(personName, token.apiServer(), serverTime);
    }

    /**
     * Soft-deactivates all credentials and marks the person inactive.
     */
    public void deletePersonTokens(String personName) {
        Instant now = clock.instant();
        store.deactivateAll(personName, now);
        store.findPerson(personName).ifPresent(p -> {
            p.setActive(false);
            p.setHasValidToken(false);
            p.setUpdatedAt(now);
            store.savePerson(p);
        });
        log.info("Deactivated all credentials of {}", personName);
    }

    // =====================================================================================
    // Internals
    // =====================================================================================

    private Optional<AccessTokenInfo> currentAccessToken(String personName) {
        Instant now = clock.instant();
        return store.findActive(personName, CredentialKind.ACCESS)
                .filter(c -> c.isUsableAccessAt(now))
                .map(c -> {
                    store.markUsed(c.getId(), now);
                    return new AccessTokenInfo(cipher.decrypt(c.getEncryptedToken()), c.getApiServer(),
                            personName, c.getExpiresAt());
                });
    }

    /**
     * Consume the active refresh token, mint a new pair and persist it before declaring success.
     * Caller must hold the person's refresh lock.
     */
    private AccessTokenInfo doRefresh(String personName) {
        Credential refresh = store.findActive(personName, CredentialKind.REFRESH)
                .orElseThrow(() -> new NoRefreshTokenException(personName));

        OAuthTokenResponse minted;
        try {
            String refreshToken = decryptRefresh(personName, refresh);
            validateFormat(refreshToken);
            store.markUsed(refresh.getId(), clock.instant());
            minted = oauthClient.exchangeRefreshToken(personName, refreshToken);
        } catch (UpstreamAuthException e) {
            recordTokenError(personName, e.getMessage());
            if (e.isRefreshTokenInvalid()) {
                store.retire(refresh.getId(), clock.instant());
                log.warn("Refresh token of {} rejected by brokerage (HTTP {}); reconnect required",
                        personName, e.getStatus());
            }
            throw e;
        } catch (BaseBrokerException e) {
            recordTokenError(personName, e.getMessage());
            throw e;
        }

        Instant now = clock.instant();
        AccessTokenInfo info = persistRotation(personName, minted, now);
        upsertPerson(personName, now, p -> {
            p.setHasValidToken(true);
            p.setLastTokenRefresh(now);
            p.setLastTokenError(null);
        });
        log.info("Rotated tokens for {} (access expires {})", personName, info.expiresAt());
        return info;
    }

    private AccessTokenInfo persistRotation(String personName, OAuthTokenResponse minted, Instant now) {
        Instant accessExpiry = now.plusSeconds(minted.expiresInSeconds());
        Credential access = Credential.builder()
                .personName(personName)
                .kind(CredentialKind.ACCESS)
                .encryptedToken(cipher.encrypt(minted.accessToken()))
                .apiServer(minted.apiServer())
                .expiresAt(accessExpiry)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Credential refresh = Credential.builder()
                .personName(personName)
                .kind(CredentialKind.REFRESH)
                .encryptedToken(cipher.encrypt(minted.refreshToken()))
                .expiresAt(now.plus(config.refreshValidity()))
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        store.rotate(personName, access, refresh, now);
        return new AccessTokenInfo(minted.accessToken(), minted.apiServer(), personName, accessExpiry);
    }

    private String decryptRefresh(String personName, Credential refresh) {
        try {
            return cipher.decrypt(refresh.getEncryptedToken());
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new InvalidRefreshTokenFormatException("Stored refresh token for " + personName
                    + " cannot be decrypted");
        }
    }

    private void validateFormat(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new InvalidRefreshTokenFormatException("Refresh token is missing");
        }
        if (refreshToken.length() < config.getMinRefreshTokenLength()) {
            throw new InvalidRefreshTokenFormatException("Refresh token is too short (minimum "
                    + config.getMinRefreshTokenLength() + " characters)");
        }
    }

    private void upsertPerson(String personName, Instant now, Consumer<Person> changes) {
        Person person = store.findPerson(personName).orElseGet(() -> Person.builder()
                .personName(personName)
                .displayName(personName)
                .active(true)
                .createdAt(now)
                .build());
        changes.accept(person);
        person.setUpdatedAt(now);
        store.savePerson(person);
    }

    private <T> T withRefreshLock(String personName, Supplier<T> action) {
        ReentrantLock lock = refreshLocks.computeIfAbsent(personName, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(config.getRefreshLockTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("Interrupted while waiting for token refresh of " + personName,
                    0, e);
        }
        if (!acquired) {
            throw new UpstreamUnavailableException("Timed out waiting for token refresh of " + personName, 0, null);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
