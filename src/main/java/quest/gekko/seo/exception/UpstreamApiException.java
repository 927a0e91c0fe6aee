package quest.gekko.seo.exception;

/**
 * Non-2xx answer from one of the Google endpoints. Carries the status and the raw body text.
 */
public class UpstreamApiException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public UpstreamApiException(String message, int status, String responseBody) {
        super(message + ": " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    /**
     * 429 and 5xx become {@link TransientUpstreamException}, which the rate limiter retries.
     */
    public static UpstreamApiException of(String message, int status, String responseBody) {
        if (status == 429 || status >= 500) {
            return new TransientUpstreamException(message, status, responseBody);
        }
        return new UpstreamApiException(message, status, responseBody);
    }

    public int status() {
        return status;
    }

    public String responseBody() {
        return responseBody;
    }
}
