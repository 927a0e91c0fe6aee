package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Last known outcome of a user-triggered sync, one row per (user, job type).
 */
@Entity
@Table(name = "sync_jobs", uniqueConstraints = @UniqueConstraint(columnNames = { "user_id", "job_type" }))
@Getter @Setter
public class SyncJob {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    Long userId;

    @Enumerated(EnumType.STRING) @Column(name = "job_type", nullable = false, length = 32)
    SyncJobType jobType;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 16)
    SyncJobStatus status = SyncJobStatus.PENDING;

    Instant lastRunAt;
    Instant nextRunAt;

    @Column(name = "error_message", length = 4096)
    String errorMessage;

    @Column(nullable = false)
    Instant createdAt;

    @Column(nullable = false)
    Instant updatedAt;
}
