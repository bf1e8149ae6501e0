package com.portfolio.mirror.service.jobs;

import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.service.credential.CredentialStore;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * TokenRefreshJob: keeps access tokens of healthy persons warm.
 * <p>
 * Every run walks active persons with a valid token and, when the access token is missing or expires within
 * the window, refreshes it through {@link TokenLifecycleManager} so the refresh takes the same per-person lock
 * as request traffic. Failures are logged and recorded by the manager; nobody is deactivated.
 * <p>
 * Config (application.yml):
 * <pre>
 * portfolio:
 *   token:
 *     keepalive:
 *       enabled: true
 *       cron: "0 0/10 * * * *"
 *       window-minutes: 5
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenRefreshJob {

    private final CredentialStore store;
    private final TokenLifecycleManager tokenManager;
    private final Clock clock;

    @Value("${portfolio.token.keepalive.enabled:true}")
    private boolean enabled;

    @Value("${portfolio.token.keepalive.window-minutes:5}")
    private long windowMinutes;

    // Kept only for observability
    private volatile Instant lastRunAt = null;
    private volatile int lastRefreshed = 0;
    private volatile int lastFailed = 0;

    @Scheduled(cron = "${portfolio.token.keepalive.cron:0 0/10 * * * *}")
    public void keepAlive() {
        if (!enabled) {
            return;
        }
        runOnce();
    }

    /**
     * One pass over all persons; returns the number of tokens refreshed.
     */
    public int runOnce() {
        Instant now = clock.instant();
        Instant horizon = now.plus(Duration.ofMinutes(windowMinutes));
        int refreshed = 0;
        int failed = 0;

        for (Person person : store.listPersons()) {
            if (!person.isActive() || !person.isHasValidToken()) {
                continue;
            }
            Optional<Credential> access = store.findActive(person.getPersonName(), CredentialKind.ACCESS);
            boolean due = access.map(a -> a.getExpiresAt() == null || a.getExpiresAt().isBefore(horizon))
                    .orElse(true);
            if (!due) {
                continue;
            }
            try {
                if (access.isPresent() && access.get().isUsableAccessAt(now)) {
                    tokenManager.refreshAccessToken(person.getPersonName());
                } else {
                    tokenManager.getValidAccessToken(person.getPersonName());
                }
                refreshed++;
            } catch (Exception e) {
                failed++;
                log.warn("Keepalive refresh for {} failed: {}", person.getPersonName(), e.getMessage());
            }
        }

        lastRunAt = now;
        lastRefreshed = refreshed;
        lastFailed = failed;
        if (refreshed > 0 || failed > 0) {
            log.info("Token keepalive: {} refreshed, {} failed", refreshed, failed);
        }
        return refreshed;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public int getLastRefreshed() {
        return lastRefreshed;
    }

    public int getLastFailed() {
        return lastFailed;
    }
}
