package quest.gekko.seo.service.core;

import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;
import quest.gekko.seo.web.dto.AiReadabilityScore;

/**
 * Blends the four Lighthouse category scores and bucketed Core Web Vitals into an
 * "AI readability" estimate. Pure computation, no I/O.
 */
public final class AiReadabilityScorer {

    private AiReadabilityScorer() {}

    public static AiReadabilityScore calculate(PageSpeedMetrics metrics) {
        int semanticHtml = clamp(Math.round(
                metrics.accessibilityScore() * 0.6
                        + metrics.seoScore() * 0.4));

        int schemaOrg = clamp(Math.round(
                metrics.seoScore() * 0.7
                        + metrics.bestPracticesScore() * 0.3));

        int contentClarity = clamp(Math.round(
                metrics.accessibilityScore() * 0.5
                        + metrics.performanceScore() * 0.3
                        + metrics.seoScore() * 0.2));

        // bucket upper bounds are inclusive
        int lcpScore = bucket(metrics.lcp(), 2500, 4000);
        int clsScore = bucket(metrics.cls(), 100, 250);
        int fidScore = bucket(metrics.fid(), 100, 300);
        int technicalSeo = clamp(Math.round((lcpScore + clsScore + fidScore) / 3.0));

        int overall = clamp(Math.round(
                semanticHtml * 0.3
                        + schemaOrg * 0.25
                        + contentClarity * 0.25
                        + technicalSeo * 0.2));

        return new AiReadabilityScore(overall, semanticHtml, schemaOrg, contentClarity, technicalSeo);
    }

    static int bucket(int value, int good, int needsImprovement) {
        if (value <= good) return 100;
        if (value <= needsImprovement) return 75;
        return 50;
    }

    private static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }
}
