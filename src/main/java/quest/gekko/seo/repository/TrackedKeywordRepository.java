package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.TrackedKeyword;

import java.util.Optional;

public interface TrackedKeywordRepository extends JpaRepository<TrackedKeyword, Long> {
    Optional<TrackedKeyword> findFirstByDomainIdAndKeywordOrderByIdAsc(final Long domainId, final String keyword);
}
