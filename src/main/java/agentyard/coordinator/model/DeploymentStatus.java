package agentyard.coordinator.model;

/**
 * Lifecycle of one deployment attempt.
 */
public enum DeploymentStatus {
    /** Record created, substrate not yet instructed */
    QUEUED,
    /** Workload submitted, waiting to be scheduled */
    DEPLOYING,
    /** Workload scheduled, waiting for readiness */
    HEALTH_CHECK,
    /** Workload ready and serving */
    RUNNING,
    /** Deployment failed; errorDetail says why */
    FAILED;

    public boolean isTerminal() {
        return this == RUNNING || this == FAILED;
    }
}
