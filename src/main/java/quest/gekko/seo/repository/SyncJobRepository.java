package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.SyncJob;
import quest.gekko.seo.domain.SyncJobType;

import java.util.List;
import java.util.Optional;

public interface SyncJobRepository extends JpaRepository<SyncJob, Long> {
    Optional<SyncJob> findByUserIdAndJobType(final Long userId, final SyncJobType jobType);
    List<SyncJob> findByUserIdOrderByJobTypeAsc(final Long userId);
}
