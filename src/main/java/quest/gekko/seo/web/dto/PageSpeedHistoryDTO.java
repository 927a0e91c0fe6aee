package quest.gekko.seo.web.dto;

import quest.gekko.seo.domain.PageSpeedHistory;
import quest.gekko.seo.domain.Strategy;

import java.time.Instant;

/**
 * PageSpeed history row without the raw Lighthouse payload.
 */
public record PageSpeedHistoryDTO(
        Long domainId,
        String url,
        Strategy strategy,
        Instant analyzedAt,
        Integer performanceScore,
        Integer accessibilityScore,
        Integer bestPracticesScore,
        Integer seoScore,
        Integer lcp,
        Integer fid,
        Integer cls,
        Integer ttfb,
        Integer fcp,
        Integer speedIndex,
        Integer tbt
) {

    public static PageSpeedHistoryDTO from(PageSpeedHistory h) {
        return new PageSpeedHistoryDTO(h.getDomain().getId(), h.getUrl(), h.getStrategy(), h.getAnalyzedAt(),
                h.getPerformanceScore(), h.getAccessibilityScore(), h.getBestPracticesScore(), h.getSeoScore(),
                h.getLcp(), h.getFid(), h.getCls(), h.getTtfb(), h.getFcp(), h.getSpeedIndex(), h.getTbt());
    }
}
