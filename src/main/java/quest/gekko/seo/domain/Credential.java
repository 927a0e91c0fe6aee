package quest.gekko.seo.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A user's Google OAuth tokens. The access token is treated as usable while
 * {@code tokenExpiry} lies in the future.
 */
@Entity
@Table(name = "credentials")
@Getter @Setter
public class Credential {
    @Id
    @Column(name = "user_id")
    Long userId;

    @Column(name = "access_token", length = 4096)
    String accessToken;

    @Column(name = "refresh_token", length = 4096)
    String refreshToken;

    @Column(name = "token_expiry")
    Instant tokenExpiry;

    @Column(nullable = false)
    Instant updatedAt;

    public boolean isAccessTokenValidAt(Instant now) {
        return accessToken != null && tokenExpiry != null && tokenExpiry.isAfter(now);
    }
}
