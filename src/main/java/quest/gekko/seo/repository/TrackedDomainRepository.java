package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.seo.domain.TrackedDomain;

import java.util.List;

public interface TrackedDomainRepository extends JpaRepository<TrackedDomain, Long> {
    List<TrackedDomain> findByUserIdOrderByIdAsc(final Long userId);

    @Query("""
        select d from TrackedDomain d
        where d.userId = :userId
          and d.searchConsoleProperty is not null
          and d.searchConsoleProperty <> ''
        order by d.id
        """)
    List<TrackedDomain> findWithSearchConsoleProperty(@Param("userId") final Long userId);
}
