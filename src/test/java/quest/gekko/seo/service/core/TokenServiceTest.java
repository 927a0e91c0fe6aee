package quest.gekko.seo.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.seo.domain.Credential;
import quest.gekko.seo.exception.NotConnectedException;
import quest.gekko.seo.exception.UpstreamApiException;
import quest.gekko.seo.repository.CredentialRepository;
import quest.gekko.seo.service.integration.connector.OAuthTokenClient;
import quest.gekko.seo.service.integration.dto.TokenResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private CredentialRepository credentialRepository;
    private OAuthTokenClient oAuthTokenClient;
    private TokenService service;

    @BeforeEach
    void setUp() {
        credentialRepository = mock(CredentialRepository.class);
        oAuthTokenClient = mock(OAuthTokenClient.class);
        when(credentialRepository.save(any(Credential.class))).thenAnswer(inv -> inv.getArgument(0));
        service = new TokenService(credentialRepository, oAuthTokenClient, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Credential credential(String access, String refresh, Instant expiry) {
        Credential c = new Credential();
        c.setUserId(1L);
        c.setAccessToken(access);
        c.setRefreshToken(refresh);
        c.setTokenExpiry(expiry);
        when(credentialRepository.findById(1L)).thenReturn(Optional.of(c));
        return c;
    }

    @Test
    void unexpired_token_is_returned_without_refresh() {
        credential("cached", "refresh", NOW.plusSeconds(60));

        assertEquals("cached", service.getValidAccessToken(1L));

        verifyNoInteractions(oAuthTokenClient);
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void token_expiring_exactly_now_is_refreshed() {
        credential("cached", "refresh", NOW);
        when(oAuthTokenClient.refresh("refresh")).thenReturn(new TokenResponse("fresh", null, 3600, "Bearer"));

        assertEquals("fresh", service.getValidAccessToken(1L));

        verify(oAuthTokenClient, times(1)).refresh("refresh");
    }

    @Test
    void refresh_for_one_user_does_not_block_another() throws Exception {
        credential("old", "refresh", NOW.minusSeconds(10));
        Credential other = new Credential();
        other.setUserId(2L);
        other.setRefreshToken("refresh-2");
        when(credentialRepository.findById(2L)).thenReturn(Optional.of(other));
        CountDownLatch refreshing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(oAuthTokenClient.refresh("refresh")).thenAnswer(inv -> {
            refreshing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new TokenResponse("fresh", null, 3600, "Bearer");
        });
        when(oAuthTokenClient.refresh("refresh-2")).thenReturn(new TokenResponse("fresh-2", null, 3600, "Bearer"));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> blocked = pool.submit(() -> service.getValidAccessToken(1L));
            assertTrue(refreshing.await(5, TimeUnit.SECONDS));

            Future<String> second = pool.submit(() -> service.getValidAccessToken(2L));
            assertEquals("fresh-2", second.get(5, TimeUnit.SECONDS));
            assertFalse(blocked.isDone());

            release.countDown();
            assertEquals("fresh", blocked.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void expired_token_is_refreshed_once_and_persisted() {
        Credential c = credential("old", "refresh", NOW.minusSeconds(1));
        when(oAuthTokenClient.refresh("refresh")).thenReturn(new TokenResponse("fresh", null, 3599, "Bearer"));

        String token = service.getValidAccessToken(1L);

        assertEquals("fresh", token);
        assertEquals("fresh", c.getAccessToken());
        assertEquals(NOW.plusSeconds(3599), c.getTokenExpiry());
        assertEquals("refresh", c.getRefreshToken());
        verify(oAuthTokenClient, times(1)).refresh("refresh");
        verify(credentialRepository).save(c);
    }

    @Test
    void missing_expiry_triggers_refresh() {
        credential("old", "refresh", null);
        when(oAuthTokenClient.refresh("refresh")).thenReturn(new TokenResponse("fresh", null, 3600, "Bearer"));

        assertEquals("fresh", service.getValidAccessToken(1L));
        verify(oAuthTokenClient, times(1)).refresh("refresh");
    }

    @Test
    void missing_access_token_triggers_refresh_even_with_future_expiry() {
        credential(null, "refresh", NOW.plusSeconds(600));
        when(oAuthTokenClient.refresh("refresh")).thenReturn(new TokenResponse("fresh", null, 3600, "Bearer"));

        assertEquals("fresh", service.getValidAccessToken(1L));
    }

    @Test
    void user_without_credential_is_not_connected() {
        when(credentialRepository.findById(1L)).thenReturn(Optional.empty());

        NotConnectedException ex = assertThrows(NotConnectedException.class, () -> service.getValidAccessToken(1L));
        assertEquals(1L, ex.userId());
        verifyNoInteractions(oAuthTokenClient);
    }

    @Test
    void blank_refresh_token_is_not_connected() {
        credential("cached", "", NOW.plusSeconds(60));

        assertThrows(NotConnectedException.class, () -> service.getValidAccessToken(1L));
    }

    @Test
    void refresh_failure_propagates_unwrapped_and_nothing_is_saved() {
        credential("old", "refresh", NOW.minusSeconds(10));
        UpstreamApiException failure = new UpstreamApiException("Failed to refresh token", 400, "invalid_grant");
        when(oAuthTokenClient.refresh(anyString())).thenThrow(failure);

        UpstreamApiException thrown = assertThrows(UpstreamApiException.class, () -> service.getValidAccessToken(1L));

        assertSame(failure, thrown);
        verify(oAuthTokenClient, times(1)).refresh("refresh");
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void concurrent_callers_share_a_single_refresh() throws Exception {
        credential("old", "refresh", NOW.minusSeconds(10));
        CountDownLatch refreshing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(oAuthTokenClient.refresh("refresh")).thenAnswer(inv -> {
            refreshing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new TokenResponse("fresh", null, 3600, "Bearer");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<String>> results = new ArrayList<>();
            results.add(pool.submit(() -> service.getValidAccessToken(1L)));
            assertTrue(refreshing.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 3; i++) {
                results.add(pool.submit(() -> service.getValidAccessToken(1L)));
            }
            release.countDown();

            for (Future<String> result : results) {
                assertEquals("fresh", result.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        verify(oAuthTokenClient, times(1)).refresh("refresh");
    }

    @Test
    void save_tokens_creates_credential_on_first_connection() {
        when(credentialRepository.findById(7L)).thenReturn(Optional.empty());

        Credential saved = service.saveTokens(7L, "access", "refresh", 3600);

        assertEquals(7L, saved.getUserId());
        assertEquals("access", saved.getAccessToken());
        assertEquals("refresh", saved.getRefreshToken());
        assertEquals(NOW.plusSeconds(3600), saved.getTokenExpiry());
        assertEquals(NOW, saved.getUpdatedAt());
    }

    @Test
    void save_tokens_overwrites_existing_values() {
        Credential c = credential("old", "old-refresh", NOW.minusSeconds(5));

        service.saveTokens(1L, "new", "new-refresh", 60);

        assertEquals("new", c.getAccessToken());
        assertEquals("new-refresh", c.getRefreshToken());
        assertEquals(NOW.plusSeconds(60), c.getTokenExpiry());
    }

    @Test
    void connect_stores_empty_refresh_token_when_google_omits_it() {
        when(credentialRepository.findById(1L)).thenReturn(Optional.empty());
        when(oAuthTokenClient.exchangeCode("code", "https://app/cb"))
                .thenReturn(new TokenResponse("access", null, 3600, "Bearer"));

        service.connect(1L, "code", "https://app/cb");

        verify(credentialRepository).save(argThat(c -> "".equals(c.getRefreshToken()) && "access".equals(c.getAccessToken())));
    }
}
