package quest.gekko.seo.exception;

/**
 * Required integration settings (OAuth client id/secret) are missing.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
