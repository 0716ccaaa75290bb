package agentyard.platform;

/**
 * A collaborator (build backend, registry, container scheduler, gateway)
 * rejected an operation. Retrying the same request will not help.
 */
public class PlatformException extends RuntimeException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
