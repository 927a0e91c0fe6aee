package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "domain_history", uniqueConstraints = @UniqueConstraint(columnNames = { "domain_id", "snapshot_date" }))
@Getter @Setter
public class DomainHistory {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "domain_id")
    TrackedDomain domain;

    @Column(name = "snapshot_date", nullable = false)
    LocalDate snapshotDate;

    Long totalClicks;
    Long totalImpressions;
    Double avgPosition;
    Double avgCtr;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
