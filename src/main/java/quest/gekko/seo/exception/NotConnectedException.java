package quest.gekko.seo.exception;

/**
 * The user has no stored Google refresh token.
 */
public class NotConnectedException extends RuntimeException {

    private final Long userId;

    public NotConnectedException(Long userId) {
        super("User " + userId + " is not connected to Google");
        this.userId = userId;
    }

    public Long userId() {
        return userId;
    }
}
