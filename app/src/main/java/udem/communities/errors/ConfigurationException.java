package udem.communities.errors;

/**
 * Unknown model name, malformed options or unreadable options file.
 */
public class ConfigurationException extends CommunityDetectionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
