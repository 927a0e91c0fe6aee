package quest.gekko.seo.service.integration.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import quest.gekko.seo.domain.Strategy;

import java.util.Map;

/**
 * Flattened PageSpeed Insights result. Scores are 0-100, timings in ms, cls is the
 * layout shift value x 1000.
 */
public record PageSpeedMetrics(
        String url,
        Strategy strategy,
        int performanceScore,
        int accessibilityScore,
        int bestPracticesScore,
        int seoScore,
        int lcp,
        int fid,
        int cls,
        int ttfb,
        int fcp,
        int speedIndex,
        int tbt,
        @JsonIgnore Map<String, Object> rawData
) {}
