package com.portfolio.mirror.test.service;

import com.portfolio.mirror.common.exception.InvalidRefreshTokenFormatException;
import com.portfolio.mirror.common.exception.NoRefreshTokenException;
import com.portfolio.mirror.common.exception.UpstreamAuthException;
import com.portfolio.mirror.common.exception.UpstreamUnavailableException;
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
import com.portfolio.mirror.service.credential.InMemoryCredentialStore;
import com.portfolio.mirror.service.credential.TokenCipher;
import com.portfolio.mirror.service.token.OAuthTokenClient;
import com.portfolio.mirror.service.token.TokenLifecycleManager;
import com.portfolio.mirror.test.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TokenLifecycleManagerTest {

    private static final String OLD_REFRESH = "old-refresh-token-0123456789";
    private static final String NEW_REFRESH = "new-refresh-token-9876543210";
    private static final String API_SERVER = "https://api01.iq.questrade.com";
    private static final Instant T0 = Instant.parse("2024-03-01T15:00:00Z");

    private MutableClock clock;
    private CrashingStore store;
    private OAuthTokenClient oauth;
    private TokenCipher cipher;
    private BrokerageConfig config;
    private RestTemplate template;
    private TokenLifecycleManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new CrashingStore();
        oauth = mock(OAuthTokenClient.class);
        cipher = new TokenCipher("test-password", "0123456789abcdef");
        config = new BrokerageConfig();
        config.setRefreshLockTimeoutMs(5_000);
        template = new RestTemplate();
        manager = new TokenLifecycleManager(store, oauth, cipher, config, template, clock);
    }

    @Test
    void firstAccessTokenRequestRefreshesOnceAndRotatesThePair() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));

        AccessTokenInfo info = manager.getValidAccessToken("alice");

        assertThat(info.accessToken()).isEqualTo("access-1");
        assertThat(info.apiServer()).isEqualTo(API_SERVER);
        assertThat(info.expiresAt()).isEqualTo(T0.plusSeconds(1800));
        assertSingleActivePair("alice");

        Credential refresh = store.findActive("alice", CredentialKind.REFRESH).orElseThrow();
        assertThat(cipher.decrypt(refresh.getEncryptedToken())).isEqualTo(NEW_REFRESH);
        assertThat(refresh.getEncryptedToken()).doesNotContain(NEW_REFRESH);
        assertThat(refresh.getExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));

        Person alice = store.findPerson("alice").orElseThrow();
        assertThat(alice.isHasValidToken()).isTrue();
        assertThat(alice.getLastTokenRefresh()).isEqualTo(T0);

        // still valid: served from the store
        clock.advance(Duration.ofMinutes(10));
        assertThat(manager.getValidAccessToken("alice").accessToken()).isEqualTo("access-1");
        verify(oauth, times(1)).exchangeRefreshToken(anyString(), anyString());
        assertThat(store.findActive("alice", CredentialKind.ACCESS).orElseThrow().getLastUsed())
                .isEqualTo(T0.plus(Duration.ofMinutes(10)));
    }

    @Test
    void expiredAccessTokenUsesTheRotatedRefreshToken() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));
        when(oauth.exchangeRefreshToken("alice", NEW_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-2", "third-refresh-token-000000", API_SERVER, 1800));

        manager.getValidAccessToken("alice");
        clock.advance(Duration.ofMinutes(31));

        assertThat(manager.getValidAccessToken("alice").accessToken()).isEqualTo("access-2");
        verify(oauth).exchangeRefreshToken("alice", NEW_REFRESH);
        assertSingleActivePair("alice");
    }

    @Test
    void rejectedRefreshTokenIsRetiredAndPersonFlaggedUnhealthy() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenThrow(new UpstreamAuthException("alice", 400, "invalid_grant"));

        assertThatThrownBy(() -> manager.refreshAccessToken("alice"))
                .isInstanceOfSatisfying(UpstreamAuthException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(400);
                    assertThat(e.isRefreshTokenInvalid()).isTrue();
                    assertThat(e.getErrorCode()).isEqualTo(UpstreamAuthException.RECONNECT_ERROR_CODE);
                });

        assertThat(store.findActive("alice", CredentialKind.REFRESH)).isEmpty();
        Person alice = store.findPerson("alice").orElseThrow();
        assertThat(alice.isHasValidToken()).isFalse();
        assertThat(alice.getLastTokenError()).contains("HTTP 400");

        // the consumed token is not retried
        assertThatThrownBy(() -> manager.refreshAccessToken("alice")).isInstanceOf(NoRefreshTokenException.class);
        verify(oauth, times(1)).exchangeRefreshToken(anyString(), anyString());
        assertThat(manager.getTokenStatus("alice").isHealthy()).isFalse();
    }

    @Test
    void transientFailureKeepsRefreshTokenAndRecordsTheError() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenThrow(new UpstreamUnavailableException("Brokerage OAuth endpoint returned HTTP 503", 503, null));

        assertThatThrownBy(() -> manager.getValidAccessToken("alice"))
                .isInstanceOf(UpstreamUnavailableException.class);

        Credential refresh = store.findActive("alice", CredentialKind.REFRESH).orElseThrow();
        assertThat(refresh.getErrorCount()).isEqualTo(1);
        assertThat(refresh.getLastError()).contains("503");

        TokenStatus status = manager.getTokenStatus("alice");
        assertThat(status.refreshToken().exists()).isTrue();
        assertThat(status.refreshToken().errorCount()).isEqualTo(1);
        assertThat(status.accessToken().exists()).isFalse();
        assertThat(status.isHealthy()).isFalse();
    }

    @Test
    void maintenancePageFromTokenEndpointIsRecordedAsTransientFailure() {
        enroll("alice", OLD_REFRESH);
        config.setAuthUrl("https://login.example.com");
        MockRestServiceServer server = MockRestServiceServer.bindTo(template).build();
        server.expect(requestTo("https://login.example.com/oauth2/token"))
                .andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));
        TokenLifecycleManager wired = new TokenLifecycleManager(store, new OAuthTokenClient(template, config),
                cipher, config, template, clock);

        assertThatThrownBy(() -> wired.refreshAccessToken("alice"))
                .isInstanceOf(UpstreamUnavailableException.class);

        server.verify();
        Credential refresh = store.findActive("alice", CredentialKind.REFRESH).orElseThrow();
        assertThat(refresh.getErrorCount()).isEqualTo(1);
        assertThat(store.findPerson("alice").orElseThrow().isHasValidToken()).isFalse();
    }

    @Test
    void missingEnrollmentFailsWithNoRefreshToken() {
        assertThatThrownBy(() -> manager.getValidAccessToken("nobody"))
                .isInstanceOf(NoRefreshTokenException.class)
                .hasMessageContaining("nobody");
        verify(oauth, never()).exchangeRefreshToken(anyString(), anyString());
    }

    @Test
    void implausiblyShortStoredTokenIsRejectedBeforeCallingUpstream() {
        enroll("alice", "short");

        assertThatThrownBy(() -> manager.refreshAccessToken("alice"))
                .isInstanceOf(InvalidRefreshTokenFormatException.class);

        verify(oauth, never()).exchangeRefreshToken(anyString(), anyString());
        assertThat(store.findActive("alice", CredentialKind.REFRESH).orElseThrow().getErrorCount()).isEqualTo(1);
    }

    @Test
    void concurrentCallersShareOneUpstreamRefresh() throws Exception {
        enroll("alice", OLD_REFRESH);
        AtomicInteger upstreamCalls = new AtomicInteger();
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH)).thenAnswer(inv -> {
            upstreamCalls.incrementAndGet();
            Thread.sleep(200);
            return new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800);
        });

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AccessTokenInfo>> results = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return manager.getValidAccessToken("alice");
            }));
        }
        start.countDown();
        for (Future<AccessTokenInfo> f : results) {
            assertThat(f.get(10, TimeUnit.SECONDS).accessToken()).isEqualTo("access-1");
        }
        pool.shutdown();

        assertThat(upstreamCalls.get()).isEqualTo(1);
        assertSingleActivePair("alice");
    }

    @Test
    void rejectionOfAnAlreadyReplacedTokenDoesNotRefreshAgain() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));
        when(oauth.exchangeRefreshToken("alice", NEW_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-2", "third-refresh-token-000000", API_SERVER, 1800));
        manager.getValidAccessToken("alice");

        assertThat(manager.refreshAfterRejection("alice", "access-0").accessToken()).isEqualTo("access-1");
        verify(oauth, times(1)).exchangeRefreshToken(anyString(), anyString());

        assertThat(manager.refreshAfterRejection("alice", "access-1").accessToken()).isEqualTo("access-2");
        verify(oauth, times(2)).exchangeRefreshToken(anyString(), anyString());
        assertSingleActivePair("alice");
    }

    @Test
    void crashBetweenInsertAndRetireLeavesTheNewPairReadable() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));
        when(oauth.exchangeRefreshToken("alice", NEW_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-2", "third-refresh-token-000000", API_SERVER, 1800));
        store.crashOnNextRetire = true;

        assertThatThrownBy(() -> manager.refreshAccessToken("alice")).hasMessageContaining("simulated crash");

        Credential refresh = store.findActive("alice", CredentialKind.REFRESH).orElseThrow();
        assertThat(cipher.decrypt(refresh.getEncryptedToken())).isEqualTo(NEW_REFRESH);
        assertThat(manager.getValidAccessToken("alice").accessToken()).isEqualTo("access-1");

        // next rotation cleans up the leftover old row
        manager.refreshAccessToken("alice");
        assertSingleActivePair("alice");
    }

    @Test
    void tokenStatusIsHealthyAfterSuccessfulRefresh() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));
        manager.getValidAccessToken("alice");

        TokenStatus status = manager.getTokenStatus("alice");

        assertThat(status.isHealthy()).isTrue();
        assertThat(status.refreshToken().exists()).isTrue();
        assertThat(status.accessToken().exists()).isTrue();
        assertThat(status.accessToken().apiServer()).isEqualTo(API_SERVER);
        assertThat(status.accessToken().expiresAt()).isEqualTo(T0.plusSeconds(1800));
    }

    @Test
    void statusWithRefreshTokenOnlyAndNoErrorIsHealthy() {
        enroll("alice", OLD_REFRESH);

        TokenStatus status = manager.getTokenStatus("alice");

        assertThat(status.accessToken().exists()).isFalse();
        assertThat(status.isHealthy()).isTrue();
    }

    @Test
    void setupPersonTriesTheTokenBeforeStoringAnything() {
        when(oauth.exchangeRefreshToken("bob", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));

        EnrollmentResult result = manager.setupPersonToken("bob", "  " + OLD_REFRESH + " ", "Bob B.");

        assertThat(result.personName()).isEqualTo("bob");
        assertThat(result.apiServer()).isEqualTo(API_SERVER);
        assertSingleActivePair("bob");
        Person bob = store.findPerson("bob").orElseThrow();
        assertThat(bob.getDisplayName()).isEqualTo("Bob B.");
        assertThat(bob.isActive()).isTrue();
        assertThat(bob.isHasValidToken()).isTrue();
    }

    @Test
    void reEnrollmentReplacesPriorCredentials() {
        enroll("bob", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("bob", "operator-supplied-token-123"))
                .thenReturn(new OAuthTokenResponse("access-9", NEW_REFRESH, API_SERVER, 1800));

        manager.setupPersonToken("bob", "operator-supplied-token-123");

        assertSingleActivePair("bob");
        Credential refresh = store.findActive("bob", CredentialKind.REFRESH).orElseThrow();
        assertThat(cipher.decrypt(refresh.getEncryptedToken())).isEqualTo(NEW_REFRESH);
    }

    @Test
    void failedTrialRefreshPersistsNothing() {
        when(oauth.exchangeRefreshToken("bob", OLD_REFRESH))
                .thenThrow(new UpstreamAuthException("bob", 401, "unauthorized"));

        assertThatThrownBy(() -> manager.setupPersonToken("bob", OLD_REFRESH))
                .isInstanceOf(UpstreamAuthException.class);

        assertThat(store.findActive("bob")).isEmpty();
        assertThat(store.findPerson("bob")).isEmpty();
    }

    @Test
    void setupRejectsMalformedTokenWithoutCallingUpstream() {
        assertThatThrownBy(() -> manager.setupPersonToken("bob", "abc"))
                .isInstanceOf(InvalidRefreshTokenFormatException.class);
        assertThatThrownBy(() -> manager.setupPersonToken("bob", null))
                .isInstanceOf(InvalidRefreshTokenFormatException.class);
        verify(oauth, never()).exchangeRefreshToken(anyString(), anyString());
    }

    @Test
    void recordTokenErrorNeverThrows() {
        CredentialStore broken = mock(CredentialStore.class);
        doThrow(new IllegalStateException("store down")).when(broken).recordFailure(anyString(), anyString(), any());
        TokenLifecycleManager m = new TokenLifecycleManager(broken, oauth, cipher, config, template, clock);

        m.recordTokenError("alice", "boom");

        verify(broken).recordFailure("alice", "boom", T0);
    }

    @Test
    void testConnectionCallsServerTimeAndClearsErrors() {
        enroll("alice", OLD_REFRESH);
        when(oauth.exchangeRefreshToken("alice", OLD_REFRESH))
                .thenReturn(new OAuthTokenResponse("access-1", NEW_REFRESH, API_SERVER, 1800));
        manager.getValidAccessToken("alice");
        manager.recordTokenError("alice", "earlier failure");

        MockRestServiceServer server = MockRestServiceServer.bindTo(template).build();
        server.expect(requestTo(API_SERVER + "/v1/time"))
                .andExpect(header("Authorization", "Bearer access-1"))
                .andRespond(withSuccess("{\"time\":\"2024-03-01T10:00:00.000000-05:00\"}", MediaType.APPLICATION_JSON));

        ConnectionTestResult result = manager.testConnection("alice");

        server.verify();
        assertThat(result.serverTime()).isEqualTo("2024-03-01T10:00:00.000000-05:00");
        Credential refresh = store.findActive("alice", CredentialKind.REFRESH).orElseThrow();
        assertThat(refresh.getErrorCount()).isZero();
        assertThat(refresh.getLastError()).isNull();
        assertThat(refresh.getLastSuccessfulUse()).isEqualTo(T0);
        assertThat(store.findPerson("alice").orElseThrow().isHasValidToken()).isTrue();
    }

    @Test
    void deletePersonTokensDeactivatesEverything() {
        enroll("alice", OLD_REFRESH);

        manager.deletePersonTokens("alice");

        assertThat(store.findActive("alice")).isEmpty();
        Person alice = store.findPerson("alice").orElseThrow();
        assertThat(alice.isActive()).isFalse();
        assertThat(alice.isHasValidToken()).isFalse();
    }

    // ---------- helpers ----------

    private void enroll(String person, String refreshToken) {
        Instant created = T0.minus(Duration.ofHours(1));
        store.insert(List.of(Credential.builder()
                .personName(person)
                .kind(CredentialKind.REFRESH)
                .encryptedToken(cipher.encrypt(refreshToken))
                .expiresAt(created.plus(Duration.ofDays(7)))
                .active(true)
                .createdAt(created)
                .updatedAt(created)
                .build()));
        store.savePerson(Person.builder()
                .personName(person)
                .displayName(person)
                .active(true)
                .hasValidToken(true)
                .createdAt(created)
                .build());
    }

    private void assertSingleActivePair(String person) {
        List<Credential> active = store.findActive(person);
        assertThat(active).filteredOn(c -> c.getKind() == CredentialKind.ACCESS).hasSize(1);
        assertThat(active).filteredOn(c -> c.getKind() == CredentialKind.REFRESH).hasSize(1);
    }

    /**
     * In-memory store that can fail once between inserting the new pair and retiring the old one.
     */
    static class CrashingStore extends InMemoryCredentialStore {
        volatile boolean crashOnNextRetire;

        @Override
        public synchronized void retireActiveExcept(String personName, Collection<String> keepIds, Instant at) {
            if (crashOnNextRetire) {
                crashOnNextRetire = false;
                throw new IllegalStateException("simulated crash");
            }
            super.retireActiveExcept(personName, keepIds, at);
        }
    }
}
