package quest.gekko.seo.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.seo.domain.TrackedDomain;
import quest.gekko.seo.domain.TrackedKeyword;
import quest.gekko.seo.repository.TrackedKeywordRepository;

@Service
@RequiredArgsConstructor
public class KeywordService {
    private final TrackedKeywordRepository keywordRepository;

    /**
     * Returns the tracked keyword for (domain, keyword text), creating it for {@code userId}
     * when the keyword surfaces for the first time.
     */
    @Transactional
    public TrackedKeyword findOrCreate(TrackedDomain domain, Long userId, String keyword) {
        return keywordRepository.findFirstByDomainIdAndKeywordOrderByIdAsc(domain.getId(), keyword)
                .orElseGet(() -> {
                    TrackedKeyword created = new TrackedKeyword();
                    created.setUserId(userId);
                    created.setDomain(domain);
                    created.setKeyword(keyword);
                    return keywordRepository.save(created);
                });
    }
}
