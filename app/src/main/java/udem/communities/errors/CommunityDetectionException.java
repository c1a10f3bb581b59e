package udem.communities.errors;

/**
 * Root of the failures raised by community detection.
 */
public class CommunityDetectionException extends RuntimeException {

    public CommunityDetectionException(String message) {
        super(message);
    }

    public CommunityDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
