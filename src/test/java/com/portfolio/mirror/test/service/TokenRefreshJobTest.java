package com.portfolio.mirror.test.service;

import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
import com.portfolio.mirror.enums.CredentialKind;
import com.portfolio.mirror.model.documents.Credential;
import com.portfolio.mirror.model.documents.Person;
import com.portfolio.mirror.service.credential.InMemoryCredentialStore;
import com.portfolio.mirror.service.jobs.TokenRefreshJob;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import com.portfolio.mirror.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenRefreshJobTest {

    private static final Instant T0 = Instant.parse("2024-03-01T15:00:00Z");

    private InMemoryCredentialStore store;
    private TokenLifecycleManager tokens;
    private TokenRefreshJob job;

    @BeforeEach
    void setUp() {
        store = new InMemoryCredentialStore();
        tokens = mock(TokenLifecycleManager.class);
        job = new TokenRefreshJob(store, tokens, new MutableClock(T0));
        ReflectionTestUtils.setField(job, "enabled", true);
        ReflectionTestUtils.setField(job, "windowMinutes", 5L);
    }

    @Test
    void refreshesOnlyHealthyPersonsNearExpiry() {
        person("alice", true, true);
        access("alice", T0.plus(Duration.ofMinutes(2)));
        person("bob", true, true);
        access("bob", T0.plus(Duration.ofMinutes(45)));
        person("carol", true, false);
        person("dave", true, true);
        person("erin", false, true);

        int refreshed = job.runOnce();

        assertThat(refreshed).isEqualTo(2);
        verify(tokens).refreshAccessToken("alice");
        verify(tokens, never()).refreshAccessToken("bob");
        verify(tokens, never()).getValidAccessToken("carol");
        verify(tokens).getValidAccessToken("dave");
        verify(tokens, never()).getValidAccessToken("erin");
        assertThat(job.getLastRunAt()).isEqualTo(T0);
    }

    @Test
    void failuresAreCountedAndDoNotStopTheRun() {
        person("alice", true, true);
        person("bob", true, true);
        when(tokens.getValidAccessToken("alice"))
                .thenThrow(new UpstreamUnavailableException("Brokerage OAuth endpoint unreachable", 0, null));

        int refreshed = job.runOnce();

        assertThat(refreshed).isEqualTo(1);
        assertThat(job.getLastFailed()).isEqualTo(1);
        verify(tokens).getValidAccessToken("bob");
        assertThat(store.findPerson("alice").orElseThrow().isActive()).isTrue();
    }

    private void person(String name, boolean active, boolean valid) {
        store.savePerson(Person.builder()
                .personName(name)
                .active(active)
                .hasValidToken(valid)
                .createdAt(T0.minusSeconds(store.listPersons().size() * 60L + 60))
                .build());
    }

    private void access(String name, Instant expiresAt) {
        store.insert(List.of(Credential.builder()
                .personName(name)
                .kind(CredentialKind.ACCESS)
                .encryptedToken("encrypted")
                .apiServer("https://api01.iq.questrade.com")
                .expiresAt(expiresAt)
                .active(true)
                .createdAt(T0.minus(Duration.ofMinutes(25)))
                .build()));
    }
}
