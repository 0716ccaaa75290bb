package agentyard.coordinator.repository;

/**
 * The state store could not complete an operation.
 * Workers abandon the current claim without acknowledging it so the job is
 * redelivered once the store is back.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
