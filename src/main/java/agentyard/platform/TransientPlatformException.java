package agentyard.platform;

/**
 * A collaborator could not be reached or timed out. The operation may succeed
 * if retried later.
 */
public class TransientPlatformException extends PlatformException {

    public TransientPlatformException(String message) {
        super(message);
    }

    public TransientPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
