package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

@Entity
@Table(name = "pagespeed_history",
        uniqueConstraints = @UniqueConstraint(columnNames = { "domain_id", "url", "strategy", "snapshot_date" }))
@Getter @Setter
public class PageSpeedHistory {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "domain_id")
    TrackedDomain domain;

    @Column(nullable = false, length = 2000)
    String url;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 16)
    Strategy strategy;

    @Column(name = "snapshot_date", nullable = false)
    LocalDate snapshotDate;

    @Column(nullable = false)
    Instant analyzedAt;

    Integer performanceScore;
    Integer accessibilityScore;
    Integer bestPracticesScore;
    Integer seoScore;

    Integer lcp;        // ms
    Integer fid;        // ms
    Integer cls;        // layout shift x 1000
    Integer ttfb;       // ms
    Integer fcp;        // ms
    Integer speedIndex; // ms
    Integer tbt;        // ms

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_data")
    Map<String, Object> rawData;
}
