package quest.gekko.seo.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.PageSpeedHistory;
import quest.gekko.seo.domain.Strategy;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface PageSpeedHistoryRepository extends JpaRepository<PageSpeedHistory, Long> {
    Optional<PageSpeedHistory> findByDomainIdAndUrlAndStrategyAndSnapshotDate(final Long domainId, final String url,
                                                                              final Strategy strategy, final LocalDate snapshotDate);

    List<PageSpeedHistory> findByDomainIdOrderByAnalyzedAtDesc(final Long domainId, final Pageable pageable);
}
