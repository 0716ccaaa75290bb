package agentyard.coordinator.model;

/**
 * Delivery status of a queued job.
 */
public enum JobStatus {
    /** Waiting in the queue, deliverable once visibleAt has passed */
    PENDING,
    /** Delivered to a consumer and not yet acknowledged */
    CLAIMED,
    /** Acknowledged after successful processing */
    DONE,
    /** Acknowledged as a terminal failure */
    FAILED,
    /** Gave up after exhausting delivery attempts */
    DEAD_LETTERED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == DEAD_LETTERED;
    }
}
