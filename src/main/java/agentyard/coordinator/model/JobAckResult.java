package agentyard.coordinator.model;

/**
 * Result of acknowledging a claimed job.
 */
public enum JobAckResult {
    /** Job moved to its terminal status */
    ACKED,

    /** Job was already terminal - idempotent success */
    ALREADY_TERMINAL,

    /** Job not found */
    NOT_FOUND,

    /** Job is claimed by a different consumer (or was redelivered) */
    NOT_HOLDER
}
