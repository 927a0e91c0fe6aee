package quest.gekko.seo.service.integration.connector;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.exception.UpstreamApiException;
import quest.gekko.seo.service.integration.dto.QueryRow;
import quest.gekko.seo.service.integration.dto.SitePerformance;
import quest.gekko.seo.util.RateLimiter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class GoogleSearchConsoleConnector implements SearchConsoleConnector {
    private final WebClient http;
    private final SeoProperties.Google google;
    private final RateLimiter rateLimiter;

    @Override
    public List<String> listSites(String accessToken) {
        JsonNode resp = rateLimiter.call(() -> http.get()
                .uri(google.webmastersUrl() + "/sites")
                .headers(h -> h.setBearerAuth(accessToken))
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> UpstreamApiException.of("Failed to list sites", r.statusCode().value(), body)))
                .bodyToMono(JsonNode.class)
                .block());

        List<String> sites = new ArrayList<>();
        if (resp == null) return sites;
        for (JsonNode entry : resp.path("siteEntry")) {
            String siteUrl = entry.path("siteUrl").asText("");
            if (!siteUrl.isBlank()) sites.add(siteUrl);
        }
        return sites;
    }

    @Override
    public SitePerformance fetchSitePerformance(String accessToken, String siteUrl, LocalDate startDate, LocalDate endDate) {
        Map<String, Object> body = queryBody(startDate, endDate);
        JsonNode resp = query(accessToken, siteUrl, body, "Failed to fetch site performance");

        JsonNode rows = resp == null ? null : resp.path("rows");
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            return SitePerformance.empty();
        }
        JsonNode first = rows.get(0);
        return new SitePerformance(
                first.path("clicks").asLong(0),
                first.path("impressions").asLong(0),
                first.path("ctr").asDouble(0),
                first.path("position").asDouble(0));
    }

    @Override
    public List<QueryRow> fetchQueryRows(String accessToken, String siteUrl, LocalDate startDate, LocalDate endDate, int rowLimit) {
        Map<String, Object> body = queryBody(startDate, endDate);
        body.put("dimensions", List.of("query"));
        body.put("rowLimit", rowLimit);
        JsonNode resp = query(accessToken, siteUrl, body, "Failed to fetch search analytics");

        List<QueryRow> rows = new ArrayList<>();
        if (resp == null) return rows;
        for (JsonNode row : resp.path("rows")) {
            String keyword = row.path("keys").path(0).asText("");
            if (keyword.isBlank()) continue;
            rows.add(new QueryRow(
                    keyword,
                    row.path("clicks").asLong(0),
                    row.path("impressions").asLong(0),
                    row.path("ctr").asDouble(0),
                    row.path("position").asDouble(0)));
        }
        return rows;
    }

    // ---- Helpers ----

    private static Map<String, Object> queryBody(LocalDate startDate, LocalDate endDate) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("startDate", startDate.toString());
        body.put("endDate", endDate.toString());
        body.put("dataState", "final");
        return body;
    }

    private JsonNode query(String accessToken, String siteUrl, Map<String, Object> body, String failure) {
        // siteUrl is a URI variable so "sc-domain:" and "https://" properties are fully percent-encoded
        return rateLimiter.call(() -> http.post()
                .uri(google.searchConsoleUrl() + "/sites/{site}/searchAnalytics/query", siteUrl)
                .headers(h -> h.setBearerAuth(accessToken))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(text -> UpstreamApiException.of(failure, r.statusCode().value(), text)))
                .bodyToMono(JsonNode.class)
                .block());
    }
}
