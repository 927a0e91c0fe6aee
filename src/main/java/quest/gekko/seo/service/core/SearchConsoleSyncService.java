package quest.gekko.seo.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.domain.TrackedKeyword;
import quest.gekko.seo.repository.TrackedDomainRepository;
import quest.gekko.seo.service.integration.connector.SearchConsoleConnector;
import quest.gekko.seo.service.integration.dto.QueryRow;
import quest.gekko.seo.service.integration.dto.SitePerformance;
import quest.gekko.seo.web.dto.SearchConsoleSyncResult;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Pulls Search Console totals and per-query rows for every property-backed domain of a user
 * and records them as daily history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchConsoleSyncService {
    private final TrackedDomainRepository domainRepository;
    private final TokenService tokenService;
    private final SearchConsoleConnector searchConsole;
    private final KeywordService keywordService;
    private final HistoryService historyService;
    private final SeoProperties.SearchConsole props;
    private final Clock clock;

    public SearchConsoleSyncResult syncSearchConsoleData(Long userId) {
        List<TrackedDomain> domains;
        String accessToken;
        try {
            domains = domainRepository.findWithSearchConsoleProperty(userId);
            if (domains.isEmpty()) {
                return SearchConsoleSyncResult.ok(0, 0);
            }
            accessToken = tokenService.getValidAccessToken(userId);
        } catch (Exception e) {
            log.error("Search Console sync failed for user {}", userId, e);
            return SearchConsoleSyncResult.failed(e);
        }

        // Trailing window ending yesterday; today's data is still partial
        LocalDate endDate = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        LocalDate startDate = endDate.minusDays(props.windowDays() - 1L);

        int domainsUpdated = 0;
        int keywordsUpdated = 0;

        for (TrackedDomain domain : domains) {
            try {
                SitePerformance perf = searchConsole.fetchSitePerformance(
                        accessToken, domain.getSearchConsoleProperty(), startDate, endDate);
                historyService.recordDomainSnapshot(domain, perf, endDate);
                domainsUpdated++;

                List<QueryRow> rows = searchConsole.fetchQueryRows(
                        accessToken, domain.getSearchConsoleProperty(), startDate, endDate, props.keywordRowLimit());
                for (QueryRow row : rows) {
                    TrackedKeyword keyword = keywordService.findOrCreate(domain, userId, row.keyword());
                    historyService.recordKeywordSnapshot(keyword, row, endDate);
                    keywordsUpdated++;
                }
            } catch (Exception e) {
                log.error("Error syncing Search Console data for domain {}", domain.getDomain(), e);
            }
        }

        log.info("Search Console sync for user {}: {} domains, {} keyword rows ({} .. {})",
                userId, domainsUpdated, keywordsUpdated, startDate, endDate);
        return SearchConsoleSyncResult.ok(domainsUpdated, keywordsUpdated);
    }

    public List<String> listSites(Long userId) {
        return searchConsole.listSites(tokenService.getValidAccessToken(userId));
    }
}
