package quest.gekko.seo.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import quest.gekko.seo.config.CacheConfig;
import quest.gekko.seo.domain.DomainHistory;
import quest.gekko.seo.domain.KeywordHistory;
import quest.gekko.seo.domain.PageSpeedHistory;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.domain.TrackedKeyword;
import quest.gekko.seo.repository.DomainHistoryRepository;
import quest.gekko.seo.repository.KeywordHistoryRepository;
import quest.gekko.seo.repository.PageSpeedHistoryRepository;
import quest.gekko.seo.service.integration.dto.PageSpeedMetrics;
import quest.gekko.seo.service.integration.dto.QueryRow;
import quest.gekko.seo.service.integration.dto.SitePerformance;
import quest.gekko.seo.web.dto.DomainHistoryDTO;
import quest.gekko.seo.web.dto.KeywordHistoryDTO;
import quest.gekko.seo.web.dto.PageSpeedHistoryDTO;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Supplier;

/**
 * Writes the daily snapshot tables. Every write is an upsert on (entity, snapshot date), so
 * re-running a sync on the same day refreshes the row instead of appending a duplicate.
 * <p>
 * Two writers can both miss the row and both insert; the loser hits the unique key and
 * repeats its write in a new transaction, where it finds the winner's row and updates it.
 */
@Service
@Slf4j
public class HistoryService {
    private final DomainHistoryRepository domainHistoryRepository;
    private final KeywordHistoryRepository keywordHistoryRepository;
    private final PageSpeedHistoryRepository pageSpeedHistoryRepository;
    private final TransactionTemplate tx;

    public HistoryService(DomainHistoryRepository domainHistoryRepository,
                          KeywordHistoryRepository keywordHistoryRepository,
                          PageSpeedHistoryRepository pageSpeedHistoryRepository,
                          PlatformTransactionManager transactionManager) {
        this.domainHistoryRepository = domainHistoryRepository;
        this.keywordHistoryRepository = keywordHistoryRepository;
        this.pageSpeedHistoryRepository = pageSpeedHistoryRepository;
        this.tx = new TransactionTemplate(transactionManager);
    }

    @CacheEvict(value = CacheConfig.DOMAIN_HISTORY, key = "#domain.id")
    public DomainHistory recordDomainSnapshot(TrackedDomain domain, SitePerformance perf, LocalDate date) {
        return upsert("domain " + domain.getId(), () -> writeDomainSnapshot(domain, perf, date));
    }

    @CacheEvict(value = CacheConfig.KEYWORD_HISTORY, key = "#keyword.id")
    public KeywordHistory recordKeywordSnapshot(TrackedKeyword keyword, QueryRow row, LocalDate date) {
        return upsert("keyword " + keyword.getId(), () -> writeKeywordSnapshot(keyword, row, date));
    }

    @CacheEvict(value = CacheConfig.PAGESPEED_HISTORY, allEntries = true)
    public PageSpeedHistory recordPageSpeed(TrackedDomain domain, PageSpeedMetrics metrics, Instant analyzedAt) {
        return upsert("pagespeed " + domain.getId(), () -> writePageSpeed(domain, metrics, analyzedAt));
    }

    private DomainHistory writeDomainSnapshot(TrackedDomain domain, SitePerformance perf, LocalDate date) {
        DomainHistory row = domainHistoryRepository.findByDomainIdAndSnapshotDate(domain.getId(), date)
                .orElseGet(() -> {
                    DomainHistory h = new DomainHistory();
                    h.setDomain(domain);
                    h.setSnapshotDate(date);
                    return h;
                });
        row.setTotalClicks(perf.clicks());
        row.setTotalImpressions(perf.impressions());
        row.setAvgPosition(perf.position());
        row.setAvgCtr(perf.ctr());
        return domainHistoryRepository.save(row);
    }

    private KeywordHistory writeKeywordSnapshot(TrackedKeyword keyword, QueryRow row, LocalDate date) {
        KeywordHistory history = keywordHistoryRepository.findByKeywordIdAndSnapshotDate(keyword.getId(), date)
                .orElseGet(() -> {
                    KeywordHistory h = new KeywordHistory();
                    h.setKeyword(keyword);
                    h.setSnapshotDate(date);
                    return h;
                });
        history.setPosition(row.position());
        history.setClicks(row.clicks());
        history.setImpressions(row.impressions());
        history.setCtr(row.ctr());
        return keywordHistoryRepository.save(history);
    }

    private PageSpeedHistory writePageSpeed(TrackedDomain domain, PageSpeedMetrics metrics, Instant analyzedAt) {
        LocalDate date = LocalDate.ofInstant(analyzedAt, ZoneOffset.UTC);
        PageSpeedHistory row = pageSpeedHistoryRepository
                .findByDomainIdAndUrlAndStrategyAndSnapshotDate(domain.getId(), metrics.url(), metrics.strategy(), date)
                .orElseGet(() -> {
                    PageSpeedHistory h = new PageSpeedHistory();
                    h.setDomain(domain);
                    h.setUrl(metrics.url());
                    h.setStrategy(metrics.strategy());
                    h.setSnapshotDate(date);
                    return h;
                });
        row.setAnalyzedAt(analyzedAt);
        row.setPerformanceScore(metrics.performanceScore());
        row.setAccessibilityScore(metrics.accessibilityScore());
        row.setBestPracticesScore(metrics.bestPracticesScore());
        row.setSeoScore(metrics.seoScore());
        row.setLcp(metrics.lcp());
        row.setFid(metrics.fid());
        row.setCls(metrics.cls());
        row.setTtfb(metrics.ttfb());
        row.setFcp(metrics.fcp());
        row.setSpeedIndex(metrics.speedIndex());
        row.setTbt(metrics.tbt());
        row.setRawData(metrics.rawData());
        return pageSpeedHistoryRepository.save(row);
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.DOMAIN_HISTORY, key = "#domainId")
    public List<DomainHistoryDTO> getDomainHistory(Long domainId) {
        return domainHistoryRepository.findByDomainIdOrderBySnapshotDateAsc(domainId).stream()
                .map(DomainHistoryDTO::from)
                .toList();
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.KEYWORD_HISTORY, key = "#keywordId")
    public List<KeywordHistoryDTO> getKeywordHistory(Long keywordId) {
        return keywordHistoryRepository.findByKeywordIdOrderBySnapshotDateAsc(keywordId).stream()
                .map(KeywordHistoryDTO::from)
                .toList();
    }

    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.PAGESPEED_HISTORY, key = "#domainId + ':' + #limit")
    public List<PageSpeedHistoryDTO> getPageSpeedHistory(Long domainId, int limit) {
        return pageSpeedHistoryRepository.findByDomainIdOrderByAnalyzedAtDesc(domainId, PageRequest.of(0, Math.max(limit, 1)))
                .stream()
                .map(PageSpeedHistoryDTO::from)
                .toList();
    }

    private <T> T upsert(String subject, Supplier<T> write) {
        try {
            return tx.execute(status -> write.get());
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent snapshot write for {}, updating the existing row", subject);
            return tx.execute(status -> write.get());
        }
    }
}
