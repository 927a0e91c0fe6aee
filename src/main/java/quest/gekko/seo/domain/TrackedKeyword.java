package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Unique per (domain, keyword) at the application level only, see
 * {@code KeywordService#findOrCreate}.
 */
@Entity
@Table(name = "tracked_keywords")
@Getter @Setter
public class TrackedKeyword {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    Long userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "domain_id")
    TrackedDomain domain;

    @Column(nullable = false, length = 500)
    String keyword;

    @Column(name = "target_url", length = 2000)
    String targetUrl;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
