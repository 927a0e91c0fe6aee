package quest.gekko.seo.service.integration.connector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.Strategy;
import quest.gekko.seo.exception.UpstreamApiException;
import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;
import quest.gekko.seo.util.RateLimiter;

import java.net.URI;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class GooglePageSpeedConnector implements PageSpeedConnector {
    private final WebClient http;
    private final SeoProperties.PageSpeed props;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    private static final List<String> CATEGORIES = List.of("performance", "accessibility", "best-practices", "seo");
    private static final TypeReference<Map<String, Object>> RAW_TYPE = new TypeReference<>() {};

    @Override
    public PageSpeedMetrics fetch(String url, Strategy strategy) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(props.apiUrl())
                .queryParam("url", "{url}")
                .queryParam("strategy", strategy.wireValue())
                .queryParam("category", CATEGORIES);
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            builder.queryParam("key", props.apiKey());
        }
        URI uri = builder.encode().buildAndExpand(url).toUri();

        JsonNode root = rateLimiter.call(() -> http.get()
                .uri(uri)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> UpstreamApiException.of("PageSpeed API error", r.statusCode().value(), body)))
                .bodyToMono(JsonNode.class)
                .block());

        return toMetrics(url, strategy, root);
    }

    PageSpeedMetrics toMetrics(String url, Strategy strategy, JsonNode root) {
        JsonNode safeRoot = root == null ? objectMapper.createObjectNode() : root;
        JsonNode lighthouse = safeRoot.path("lighthouseResult");
        JsonNode categories = lighthouse.path("categories");
        JsonNode audits = lighthouse.path("audits");

        // field data, only present for origins with enough real-user traffic
        double fid = safeRoot.path("loadingExperience").path("metrics")
                .path("FIRST_INPUT_DELAY_MS").path("percentile").asDouble(0);

        return new PageSpeedMetrics(
                url,
                strategy,
                categoryScore(categories, "performance"),
                categoryScore(categories, "accessibility"),
                categoryScore(categories, "best-practices"),
                categoryScore(categories, "seo"),
                auditValue(audits, "largest-contentful-paint", 1),
                (int) Math.round(fid),
                auditValue(audits, "cumulative-layout-shift", 1000),
                auditValue(audits, "server-response-time", 1),
                auditValue(audits, "first-contentful-paint", 1),
                auditValue(audits, "speed-index", 1),
                auditValue(audits, "total-blocking-time", 1),
                objectMapper.convertValue(safeRoot, RAW_TYPE));
    }

    // ---- Helpers ----

    private static int categoryScore(JsonNode categories, String id) {
        return (int) Math.round(categories.path(id).path("score").asDouble(0) * 100);
    }

    private static int auditValue(JsonNode audits, String id, int scale) {
        return (int) Math.round(audits.path(id).path("numericValue").asDouble(0) * scale);
    }
}
