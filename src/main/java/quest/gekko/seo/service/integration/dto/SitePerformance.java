package quest.gekko.seo.service.integration.dto;

/**
 * Aggregate Search Console numbers for one property over a date window.
 */
public record SitePerformance(long clicks, long impressions, double ctr, double position) {

    public static SitePerformance empty() {
        return new SitePerformance(0, 0, 0, 0);
    }
}
