package quest.gekko.seo.service.integration.connector;

import quest.gekko.seo.service.integration.dto.TokenResponse;

public interface OAuthTokenClient {

    /** Consent screen URL for offline Search Console access. */
    String buildAuthorizationUrl(String redirectUri);

    TokenResponse exchangeCode(String code, String redirectUri);

    TokenResponse refresh(String refreshToken);
}
