package quest.gekko.seo.web.dto;

import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;

/**
 * Outcome of refreshing both PageSpeed strategies for one domain. A strategy whose analysis
 * failed is {@code null}.
 */
public record DomainRefreshResult(
        String url,
        PageSpeedMetrics mobile,
        PageSpeedMetrics desktop
) {

    public int analyzed() {
        return (mobile != null ? 1 : 0) + (desktop != null ? 1 : 0);
    }
}
