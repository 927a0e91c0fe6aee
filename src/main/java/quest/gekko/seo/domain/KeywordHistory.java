package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "keyword_history", uniqueConstraints = @UniqueConstraint(columnNames = { "keyword_id", "snapshot_date" }))
@Getter @Setter
public class KeywordHistory {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "keyword_id")
    TrackedKeyword keyword;

    @Column(name = "snapshot_date", nullable = false)
    LocalDate snapshotDate;

    @Column(name = "avg_position")
    Double position;

    Long clicks;
    Long impressions;
    Double ctr;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
