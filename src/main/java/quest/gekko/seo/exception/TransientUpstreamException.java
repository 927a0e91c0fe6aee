package quest.gekko.seo.exception;

public class TransientUpstreamException extends UpstreamApiException {

    public TransientUpstreamException(String message, int status, String responseBody) {
        super(message, status, responseBody);
    }
}
