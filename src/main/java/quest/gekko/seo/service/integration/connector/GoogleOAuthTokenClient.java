package quest.gekko.seo.service.integration.connector;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.exception.ConfigurationException;
import quest.gekko.seo.exception.UpstreamApiException;
import quest.gekko.seo.service.integration.dto.TokenResponse;

import java.util.List;

@Service
@RequiredArgsConstructor
public class GoogleOAuthTokenClient implements OAuthTokenClient {
    private final WebClient http;
    private final SeoProperties.Google google;

    private static final List<String> SCOPES = List.of(
            "https://www.googleapis.com/auth/webmasters.readonly",
            "https://www.googleapis.com/auth/userinfo.email",
            "https://www.googleapis.com/auth/userinfo.profile"
    );

    @Override
    public String buildAuthorizationUrl(String redirectUri) {
        if (google.clientId() == null || google.clientId().isBlank()) {
            throw new ConfigurationException("seo.google.client-id is not configured");
        }
        return UriComponentsBuilder.fromUriString(google.authUrl())
                .queryParam("client_id", "{clientId}")
                .queryParam("redirect_uri", "{redirectUri}")
                .queryParam("response_type", "code")
                .queryParam("scope", "{scope}")
                .queryParam("access_type", "offline")
                .queryParam("prompt", "consent")
                .encode()
                .buildAndExpand(google.clientId(), redirectUri, String.join(" ", SCOPES))
                .toUriString();
    }

    @Override
    public TokenResponse exchangeCode(String code, String redirectUri) {
        MultiValueMap<String, String> form = clientForm("authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        return post(form, "Failed to exchange code for tokens");
    }

    @Override
    public TokenResponse refresh(String refreshToken) {
        MultiValueMap<String, String> form = clientForm("refresh_token");
        form.add("refresh_token", refreshToken);
        return post(form, "Failed to refresh token");
    }

    // ---- Helpers ----

    private MultiValueMap<String, String> clientForm(String grantType) {
        if (!google.hasClientCredentials()) {
            throw new ConfigurationException("Google OAuth credentials not configured");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", google.clientId());
        form.add("client_secret", google.clientSecret());
        form.add("grant_type", grantType);
        return form;
    }

    private TokenResponse post(MultiValueMap<String, String> form, String failure) {
        return http.post()
                .uri(google.tokenUrl())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> UpstreamApiException.of(failure, resp.statusCode().value(), body)))
                .bodyToMono(TokenResponse.class)
                .block();
    }
}
