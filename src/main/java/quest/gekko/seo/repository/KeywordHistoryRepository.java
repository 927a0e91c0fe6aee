package quest.gekko.seo.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.seo.domain.KeywordHistory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface KeywordHistoryRepository extends JpaRepository<KeywordHistory, Long> {
    Optional<KeywordHistory> findByKeywordIdAndSnapshotDate(final Long keywordId, final LocalDate snapshotDate);
    List<KeywordHistory> findByKeywordIdOrderBySnapshotDateAsc(final Long keywordId);
}
