package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "tracked_domains")
@Getter @Setter
public class TrackedDomain {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    Long userId;

    @Column(nullable = false)
    String domain;

    // e.g. "sc-domain:example.com" or "https://example.com/"
    @Column(name = "search_console_property", length = 500)
    String searchConsoleProperty;

    boolean verified;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    /** The URL PageSpeed analyzes for this domain. */
    public String rootUrl() {
        return domain.startsWith("http") ? domain : "https://" + domain;
    }
}
