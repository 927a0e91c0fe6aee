package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.DomainHistory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DomainHistoryRepository extends JpaRepository<DomainHistory, Long> {
    Optional<DomainHistory> findByDomainIdAndSnapshotDate(final Long domainId, final LocalDate snapshotDate);
    List<DomainHistory> findByDomainIdOrderBySnapshotDateAsc(final Long domainId);
    long countByDomainId(final Long domainId);
}
