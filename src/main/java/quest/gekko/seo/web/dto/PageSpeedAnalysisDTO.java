package quest.gekko.seo.web.dto;

import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;

public record PageSpeedAnalysisDTO(
        String url,
        PageSpeedHistoryDTO metrics,
        AiReadabilityScore aiReadability
) {

    public static PageSpeedAnalysisDTO of(PageSpeedMetrics m, Long domainId, AiReadabilityScore score) {
        PageSpeedHistoryDTO flat = new PageSpeedHistoryDTO(domainId, m.url(), m.strategy(), null,
                m.performanceScore(), m.accessibilityScore(), m.bestPracticesScore(), m.seoScore(),
                m.lcp(), m.fid(), m.cls(), m.ttfb(), m.fcp(), m.speedIndex(), m.tbt());
        return new PageSpeedAnalysisDTO(m.url(), flat, score);
    }
}
