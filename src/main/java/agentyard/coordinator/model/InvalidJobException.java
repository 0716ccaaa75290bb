package agentyard.coordinator.model;

/**
 * A job that can never succeed as submitted: malformed payload, unknown
 * agent, or a deployment without a usable build. Acknowledged as FAILED
 * immediately and never retried.
 */
public class InvalidJobException extends RuntimeException {

    public InvalidJobException(String message) {
        super(message);
    }

    public InvalidJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
