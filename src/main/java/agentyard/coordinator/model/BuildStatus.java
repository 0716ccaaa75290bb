package agentyard.coordinator.model;

/**
 * Lifecycle of one build attempt.
 */
public enum BuildStatus {
    /** Record created, not yet accepted by the build backend */
    QUEUED,
    /** Backend job submitted and running */
    BUILDING,
    /** Backend job finished, image push being verified */
    PUSHING,
    /** Image built and present in the registry */
    SUCCEEDED,
    /** Build failed; errorDetail says why */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
