package agentyard.coordinator.model;

/**
 * Result of handing a claimed job back to the queue.
 */
public enum JobRetryResult {
    /** Job is PENDING again and will be redelivered */
    REQUEUED,

    /** Attempts exhausted, job is dead-lettered */
    DEAD_LETTERED,

    /** Job not found */
    NOT_FOUND,

    /** Job is claimed by a different consumer (or was redelivered) */
    NOT_HOLDER
}
