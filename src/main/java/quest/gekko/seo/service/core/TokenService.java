package quest.gekko.seo.service.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.seo.domain.Credential;
import quest.gekko.seo.exception.NotConnectedException;
import quest.gekko.seo.repository.CredentialRepository;
import quest.gekko.seo.service.integration.connector.OAuthTokenClient;
import quest.gekko.seo.service.integration.dto.TokenResponse;

import java.time.Clock;
import java.time.Instant;

/**
 * Hands out usable Google access tokens, refreshing them through the OAuth endpoint when the
 * cached one has expired.
 * <p>
 * Refreshes are serialized per user: a caller that had to wait re-reads the credential and
 * reuses the token the first caller obtained instead of refreshing again.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {
    private final CredentialRepository credentialRepository;
    private final OAuthTokenClient oAuthTokenClient;
    private final Clock clock;

    // Weak values: a user's lock lives only while some thread holds it
    private final Cache<Long, Object> refreshLocks = Caffeine.newBuilder().weakValues().build();

    public String getValidAccessToken(Long userId) {
        Credential cached = loadConnected(userId);
        if (cached.isAccessTokenValidAt(clock.instant())) {
            return cached.getAccessToken();
        }

        Object lock = refreshLocks.get(userId, id -> new Object());
        synchronized (lock) {
            Credential credential = loadConnected(userId);
            Instant now = clock.instant();
            if (credential.isAccessTokenValidAt(now)) {
                return credential.getAccessToken();
            }

            log.info("Refreshing Google access token for user {}", userId);
            TokenResponse tokens = oAuthTokenClient.refresh(credential.getRefreshToken());

            credential.setAccessToken(tokens.accessToken());
            credential.setTokenExpiry(now.plusSeconds(tokens.expiresIn()));
            credential.setUpdatedAt(now);
            credentialRepository.save(credential);
            return tokens.accessToken();
        }
    }

    /**
     * Overwrites all three token fields; creates the credential row on first connection.
     */
    public Credential saveTokens(Long userId, String accessToken, String refreshToken, long expiresInSeconds) {
        Instant now = clock.instant();
        Credential credential = credentialRepository.findById(userId).orElseGet(() -> {
            Credential fresh = new Credential();
            fresh.setUserId(userId);
            return fresh;
        });
        credential.setAccessToken(accessToken);
        credential.setRefreshToken(refreshToken);
        credential.setTokenExpiry(now.plusSeconds(expiresInSeconds));
        credential.setUpdatedAt(now);
        return credentialRepository.save(credential);
    }

    /**
     * Completes the OAuth consent flow for a user.
     */
    public void connect(Long userId, String code, String redirectUri) {
        TokenResponse tokens = oAuthTokenClient.exchangeCode(code, redirectUri);
        // Google omits refresh_token when the user had already granted offline access
        String refreshToken = tokens.refreshToken() != null ? tokens.refreshToken() : "";
        saveTokens(userId, tokens.accessToken(), refreshToken, tokens.expiresIn());
        log.info("Stored Google tokens for user {}", userId);
    }

    public String buildAuthorizationUrl(String redirectUri) {
        return oAuthTokenClient.buildAuthorizationUrl(redirectUri);
    }

    private Credential loadConnected(Long userId) {
        return credentialRepository.findById(userId)
                .filter(c -> c.getRefreshToken() != null && !c.getRefreshToken().isBlank())
                .orElseThrow(() -> new NotConnectedException(userId));
    }
}
