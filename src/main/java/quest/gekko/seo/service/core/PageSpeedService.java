package quest.gekko.seo.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.Strategy;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.repository.TrackedDomainRepository;
import quest.gekko.seo.service.integration.connector.PageSpeedConnector;
import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;
import quest.gekko.seo.web.dto.AiReadabilityScore;
import quest.gekko.seo.web.dto.DomainRefreshResult;
import quest.gekko.seo.web.dto.PageSpeedAnalysisDTO;
import quest.gekko.seo.web.dto.PageSpeedSyncResult;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class PageSpeedService {
    private final TrackedDomainRepository domainRepository;
    private final PageSpeedConnector pageSpeed;
    private final HistoryService historyService;
    private final SeoProperties.PageSpeed props;
    private final Clock clock;

    public PageSpeedMetrics fetchPageSpeedInsights(String url, Strategy strategy) {
        return pageSpeed.fetch(url, strategy);
    }

    public PageSpeedMetrics analyzeAndSavePageSpeed(Long domainId, String url) {
        return analyzeAndSavePageSpeed(requireDomain(domainId), url, Strategy.MOBILE);
    }

    public PageSpeedMetrics analyzeAndSavePageSpeed(TrackedDomain domain, String url, Strategy strategy) {
        PageSpeedMetrics metrics = pageSpeed.fetch(url, strategy);
        historyService.recordPageSpeed(domain, metrics, clock.instant());
        return metrics;
    }

    /**
     * On-demand analysis; only persisted when a tracked domain is given.
     */
    public PageSpeedAnalysisDTO analyze(String url, Long domainId, Strategy strategy) {
        Strategy effective = strategy != null ? strategy : Strategy.MOBILE;
        PageSpeedMetrics metrics = domainId != null
                ? analyzeAndSavePageSpeed(requireDomain(domainId), url, effective)
                : fetchPageSpeedInsights(url, effective);
        AiReadabilityScore score = AiReadabilityScorer.calculate(metrics);
        return PageSpeedAnalysisDTO.of(metrics, domainId, score);
    }

    public PageSpeedSyncResult syncPageSpeedData(Long userId) {
        List<TrackedDomain> domains;
        try {
            domains = domainRepository.findByUserIdOrderByIdAsc(userId);
        } catch (Exception e) {
            log.error("PageSpeed sync failed for user {}", userId, e);
            return PageSpeedSyncResult.failed(e);
        }

        int urlsAnalyzed = 0;
        for (TrackedDomain domain : domains) {
            try {
                analyzeAndSavePageSpeed(domain, domain.rootUrl(), Strategy.MOBILE);
                urlsAnalyzed++;
            } catch (Exception e) {
                log.error("Error analyzing PageSpeed for {}", domain.getDomain(), e);
            }
            pause(props.interDomainDelay());
        }
        log.info("PageSpeed sync for user {}: {}/{} urls analyzed", userId, urlsAnalyzed, domains.size());
        return PageSpeedSyncResult.ok(urlsAnalyzed);
    }

    /**
     * Analyzes the domain's root URL for both strategies. A failing strategy is logged and
     * left out of the result, so this method only throws when the domain itself is unusable.
     */
    public DomainRefreshResult refreshDomain(TrackedDomain domain) {
        String url = domain.rootUrl();
        PageSpeedMetrics mobile = tryAnalyze(domain, url, Strategy.MOBILE);
        PageSpeedMetrics desktop = tryAnalyze(domain, url, Strategy.DESKTOP);
        return new DomainRefreshResult(url, mobile, desktop);
    }

    public TrackedDomain requireDomain(Long domainId) {
        return domainRepository.findById(domainId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown domain id " + domainId));
    }

    // ---- Helpers ----

    private PageSpeedMetrics tryAnalyze(TrackedDomain domain, String url, Strategy strategy) {
        try {
            return analyzeAndSavePageSpeed(domain, url, strategy);
        } catch (Exception e) {
            log.warn("PageSpeed {} analysis failed for {}: {}", strategy.wireValue(), url, e.getMessage());
            return null;
        }
    }

    private static void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during inter-domain delay");
        }
    }
}
