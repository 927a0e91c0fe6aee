package quest.gekko.seo.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quest.gekko.seo.config.SeoProperties;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.domain.TrackedKeyword;
import quest.gekko.seo.exception.NotConnectedException;
import quest.gekko.seo.repository.TrackedDomainRepository;
import quest.gekko.seo.service.integration.connector.SearchConsoleConnector;
import quest.gekko.seo.service.integration.dto.QueryRow;
import quest.gekko.seo.service.integration.dto.SitePerformance;
import quest.gekko.seo.web.dto.SearchConsoleSyncResult;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SearchConsoleSyncServiceTest {

    // 00:30 UTC, so "yesterday" must be computed in UTC
    private static final Instant NOW = Instant.parse("2026-03-10T00:30:00Z");
    private static final LocalDate END = LocalDate.of(2026, 3, 9);
    private static final LocalDate START = LocalDate.of(2026, 3, 3);

    private TrackedDomainRepository domainRepository;
    private TokenService tokenService;
    private SearchConsoleConnector searchConsole;
    private KeywordService keywordService;
    private HistoryService historyService;
    private SearchConsoleSyncService service;

    @BeforeEach
    void setUp() {
        domainRepository = mock(TrackedDomainRepository.class);
        tokenService = mock(TokenService.class);
        searchConsole = mock(SearchConsoleConnector.class);
        keywordService = mock(KeywordService.class);
        historyService = mock(HistoryService.class);
        service = new SearchConsoleSyncService(domainRepository, tokenService, searchConsole, keywordService,
                historyService, new SeoProperties.SearchConsole(7, 500), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static TrackedDomain domain(long id, String name, String property) {
        TrackedDomain d = new TrackedDomain();
        d.setId(id);
        d.setUserId(1L);
        d.setDomain(name);
        d.setSearchConsoleProperty(property);
        return d;
    }

    private static TrackedKeyword keyword(long id) {
        TrackedKeyword k = new TrackedKeyword();
        k.setId(id);
        return k;
    }

    @Test
    void user_without_property_domains_succeeds_without_network_calls() {
        when(domainRepository.findWithSearchConsoleProperty(1L)).thenReturn(List.of());

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertEquals(SearchConsoleSyncResult.ok(0, 0), result);
        verifyNoInteractions(tokenService, searchConsole, keywordService, historyService);
    }

    @Test
    void token_failure_becomes_failed_result() {
        when(domainRepository.findWithSearchConsoleProperty(1L))
                .thenReturn(List.of(domain(10, "example.com", "sc-domain:example.com")));
        when(tokenService.getValidAccessToken(1L)).thenThrow(new NotConnectedException(1L));

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertFalse(result.success());
        assertEquals(0, result.domainsUpdated());
        assertEquals(0, result.keywordsUpdated());
        assertTrue(result.error().contains("not connected"));
        verifyNoInteractions(searchConsole);
    }

    @Test
    void repository_failure_becomes_failed_result() {
        when(domainRepository.findWithSearchConsoleProperty(1L)).thenThrow(new IllegalStateException("db down"));

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertFalse(result.success());
        assertTrue(result.error().contains("db down"));
    }

    @Test
    void syncs_trailing_window_and_counts_every_keyword_row() {
        TrackedDomain d = domain(10, "example.com", "sc-domain:example.com");
        when(domainRepository.findWithSearchConsoleProperty(1L)).thenReturn(List.of(d));
        when(tokenService.getValidAccessToken(1L)).thenReturn("token");
        SitePerformance perf = new SitePerformance(120, 4000, 0.03, 8.5);
        when(searchConsole.fetchSitePerformance("token", "sc-domain:example.com", START, END)).thenReturn(perf);
        QueryRow first = new QueryRow("java sync", 10, 100, 0.1, 3.2);
        QueryRow second = new QueryRow("java sync", 5, 50, 0.1, 4.0);
        QueryRow third = new QueryRow("spring retry", 1, 20, 0.05, 9.1);
        when(searchConsole.fetchQueryRows("token", "sc-domain:example.com", START, END, 500))
                .thenReturn(List.of(first, second, third));
        TrackedKeyword javaSync = keyword(100);
        TrackedKeyword springRetry = keyword(101);
        when(keywordService.findOrCreate(d, 1L, "java sync")).thenReturn(javaSync);
        when(keywordService.findOrCreate(d, 1L, "spring retry")).thenReturn(springRetry);

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertEquals(SearchConsoleSyncResult.ok(1, 3), result);
        verify(historyService).recordDomainSnapshot(d, perf, END);
        verify(historyService).recordKeywordSnapshot(javaSync, first, END);
        verify(historyService).recordKeywordSnapshot(javaSync, second, END);
        verify(historyService).recordKeywordSnapshot(springRetry, third, END);
    }

    @Test
    void failing_domain_is_skipped_and_the_rest_continue() {
        TrackedDomain broken = domain(10, "broken.com", "sc-domain:broken.com");
        TrackedDomain healthy = domain(11, "healthy.com", "sc-domain:healthy.com");
        when(domainRepository.findWithSearchConsoleProperty(1L)).thenReturn(List.of(broken, healthy));
        when(tokenService.getValidAccessToken(1L)).thenReturn("token");
        when(searchConsole.fetchSitePerformance(eq("token"), eq("sc-domain:broken.com"), any(), any()))
                .thenThrow(new IllegalStateException("403"));
        when(searchConsole.fetchSitePerformance(eq("token"), eq("sc-domain:healthy.com"), any(), any()))
                .thenReturn(SitePerformance.empty());
        when(searchConsole.fetchQueryRows(eq("token"), eq("sc-domain:healthy.com"), any(), any(), anyInt()))
                .thenReturn(List.of());

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertEquals(SearchConsoleSyncResult.ok(1, 0), result);
        verify(historyService).recordDomainSnapshot(eq(healthy), any(), eq(END));
        verify(historyService, never()).recordDomainSnapshot(eq(broken), any(), any());
    }

    @Test
    void domain_counted_even_when_keyword_fetch_fails() {
        TrackedDomain d = domain(10, "example.com", "sc-domain:example.com");
        when(domainRepository.findWithSearchConsoleProperty(1L)).thenReturn(List.of(d));
        when(tokenService.getValidAccessToken(1L)).thenReturn("token");
        when(searchConsole.fetchSitePerformance(anyString(), anyString(), any(), any())).thenReturn(SitePerformance.empty());
        when(searchConsole.fetchQueryRows(anyString(), anyString(), any(), any(), anyInt()))
                .thenThrow(new IllegalStateException("quota"));

        SearchConsoleSyncResult result = service.syncSearchConsoleData(1L);

        assertTrue(result.success());
        assertEquals(1, result.domainsUpdated());
        assertEquals(0, result.keywordsUpdated());
    }

    @Test
    void list_sites_uses_a_valid_token() {
        when(tokenService.getValidAccessToken(1L)).thenReturn("token");
        when(searchConsole.listSites("token")).thenReturn(List.of("sc-domain:example.com"));

        assertEquals(List.of("sc-domain:example.com"), service.listSites(1L));
    }
}
